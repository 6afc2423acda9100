package org.zen.logic.kb.exceptions;

/**
 * Thrown when an operation needs a verified, valid proof and the proof is not one.
 */
public class ProofIncompleteException extends LogicException
{
  private static final long serialVersionUID = 1L;

  public ProofIncompleteException(String xiTheoremName)
  {
    super("Proof of '" + xiTheoremName + "' has not been verified as valid", LogicErrorCode.PROOF_INCOMPLETE);
  }
}

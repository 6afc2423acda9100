package org.zen.logic.kb.exceptions;

/**
 * Thrown when a proof is submitted for verification with no steps.
 */
public class EmptyProofException extends InvalidProofException
{
  private static final long serialVersionUID = 1L;

  public EmptyProofException(String xiTheoremName)
  {
    super("Proof of '" + xiTheoremName + "' must have at least one step");
  }
}

package org.zen.logic.kb.exceptions;

/**
 * Thrown when a proof submitted for verification is malformed.  The registry is left unchanged.
 */
public class InvalidProofException extends LogicException
{
  private static final long serialVersionUID = 1L;

  public InvalidProofException(String xiMessage)
  {
    super(xiMessage, LogicErrorCode.INVALID_PROOF);
  }
}

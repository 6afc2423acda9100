package org.zen.logic.kb.exceptions;

/**
 * Thrown when a bounded verification does not finish before its deadline.
 */
public class VerificationTimeoutException extends LogicException
{
  private static final long serialVersionUID = 1L;

  public VerificationTimeoutException(String xiTheoremName, long xiTimeoutMillis)
  {
    super("Verification of '" + xiTheoremName + "' did not finish within " + xiTimeoutMillis + "ms",
          LogicErrorCode.TIMEOUT);
  }
}

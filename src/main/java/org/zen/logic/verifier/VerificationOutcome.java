package org.zen.logic.verifier;

/**
 * Result of a bounded verification.
 */
public enum VerificationOutcome
{
  VALID,
  INVALID,

  /**
   * The deadline passed before the verification finished.  The verification still runs to completion in the
   * background and its result is applied to the registry, but the caller never sees it.
   */
  TIMED_OUT;

  public static VerificationOutcome of(boolean xiValid)
  {
    return xiValid ? VALID : INVALID;
  }
}

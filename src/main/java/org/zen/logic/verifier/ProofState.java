package org.zen.logic.verifier;

/**
 * Lifecycle of a {@link Proof}.
 *
 * <pre>
 *   EMPTY --append--> ACCUMULATING --verify--> VERIFIED_VALID | VERIFIED_INVALID
 *                          ^                              |
 *                          +----------- append -----------+
 * </pre>
 *
 * Verification may also be requested directly from EMPTY with a complete step list.
 */
public enum ProofState
{
  EMPTY,
  ACCUMULATING,
  VERIFIED_VALID,
  VERIFIED_INVALID
}

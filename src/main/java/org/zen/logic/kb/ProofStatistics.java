package org.zen.logic.kb;

import org.zen.logic.verifier.Proof;
import org.zen.logic.verifier.ProofState;

/**
 * Summary of a single proof.
 */
public class ProofStatistics
{
  private final String     mTheoremName;
  private final int        mStepCount;
  private final ProofState mState;
  private final long       mVerificationTime;

  ProofStatistics(Proof xiProof)
  {
    mTheoremName = xiProof.getTheoremName();
    mStepCount = xiProof.getStepCount();
    mState = xiProof.getState();
    mVerificationTime = xiProof.getVerificationTime();
  }

  public String getTheoremName()
  {
    return mTheoremName;
  }

  public int getStepCount()
  {
    return mStepCount;
  }

  public ProofState getState()
  {
    return mState;
  }

  public boolean isValid()
  {
    return mState == ProofState.VERIFIED_VALID;
  }

  public boolean isComplete()
  {
    return mState == ProofState.VERIFIED_VALID;
  }

  /**
   * @return the duration of the last verification, in nanoseconds.
   */
  public long getVerificationTime()
  {
    return mVerificationTime;
  }

  @Override
  public String toString()
  {
    return mTheoremName + ": " + mStepCount + " steps, " + mState + ", " + mVerificationTime + "ns";
  }
}

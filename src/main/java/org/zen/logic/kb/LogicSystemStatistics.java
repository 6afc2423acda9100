package org.zen.logic.kb;

/**
 * Point-in-time summary of a {@link LogicSystem}.  Times are in nanoseconds.
 */
public class LogicSystemStatistics
{
  private final int     mTheoremCount;
  private final int     mAxiomCount;
  private final int     mProofCount;
  private final boolean mConsistent;
  private final long    mTotalVerifications;
  private final long    mTotalVerificationTime;
  private final double  mAverageVerificationTime;

  LogicSystemStatistics(int xiTheoremCount,
                        int xiAxiomCount,
                        int xiProofCount,
                        boolean xiConsistent,
                        long xiTotalVerifications,
                        long xiTotalVerificationTime,
                        double xiAverageVerificationTime)
  {
    mTheoremCount = xiTheoremCount;
    mAxiomCount = xiAxiomCount;
    mProofCount = xiProofCount;
    mConsistent = xiConsistent;
    mTotalVerifications = xiTotalVerifications;
    mTotalVerificationTime = xiTotalVerificationTime;
    mAverageVerificationTime = xiAverageVerificationTime;
  }

  public int getTheoremCount()
  {
    return mTheoremCount;
  }

  public int getAxiomCount()
  {
    return mAxiomCount;
  }

  public int getProofCount()
  {
    return mProofCount;
  }

  /**
   * @return whether the axiom set passed a pairwise consistency scan.
   */
  public boolean isConsistent()
  {
    return mConsistent;
  }

  public long getTotalVerifications()
  {
    return mTotalVerifications;
  }

  public long getTotalVerificationTime()
  {
    return mTotalVerificationTime;
  }

  /**
   * @return the mean verification time, or 0 if nothing has been verified.
   */
  public double getAverageVerificationTime()
  {
    return mAverageVerificationTime;
  }

  @Override
  public String toString()
  {
    return mTheoremCount + " theorems, " + mAxiomCount + " axioms, " + mProofCount + " proofs, " +
           (mConsistent ? "consistent" : "inconsistent") + ", " + mTotalVerifications + " verifications";
  }
}

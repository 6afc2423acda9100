package org.zen.logic.util.stats;

/**
 * Keep track of a statistic based on a number of samples - used for verification latencies, in nanoseconds.
 *
 * Optimised for recording samples more often than reading the summary.  Not thread-safe: callers serialize access.
 */
public class SampledStatistic
{
  private long   mNumSamples   = 0;
  private long   mTotal        = 0;
  private double mSumOfSquares = 0;
  private long   mMin          = Long.MAX_VALUE;
  private long   mMax          = Long.MIN_VALUE;

  /**
   * Record a sample.
   *
   * @param xiValue - the sample value.
   */
  public void sample(long xiValue)
  {
    mTotal += xiValue;
    mSumOfSquares += (double)xiValue * xiValue;
    mMin = Math.min(mMin, xiValue);
    mMax = Math.max(mMax, xiValue);
    mNumSamples++;
  }

  /**
   * Forget all samples.
   */
  public void reset()
  {
    mNumSamples = 0;
    mTotal = 0;
    mSumOfSquares = 0;
    mMin = Long.MAX_VALUE;
    mMax = Long.MIN_VALUE;
  }

  /**
   * @return the number of samples recorded.
   */
  public long getNumSamples()
  {
    return mNumSamples;
  }

  /**
   * @return the total value of the recorded samples.
   */
  public long getTotal()
  {
    return mTotal;
  }

  /**
   * @return the mean value of the recorded samples, or 0 if there are none.
   */
  public double getMean()
  {
    if (mNumSamples == 0)
    {
      return 0;
    }
    return (double)mTotal / mNumSamples;
  }

  /**
   * @return the smallest sample, or 0 if there are none.
   */
  public long getMin()
  {
    return (mNumSamples == 0) ? 0 : mMin;
  }

  /**
   * @return the largest sample, or 0 if there are none.
   */
  public long getMax()
  {
    return (mNumSamples == 0) ? 0 : mMax;
  }

  /**
   * @return the standard deviation of the recorded samples.
   */
  public double getStdDev()
  {
    if (mNumSamples < 2)
    {
      return 0;
    }

    // Rounding can make the numerator very slightly negative when every sample is the same.
    double lSum = mTotal;
    double lNumerator = Math.max(0, (mNumSamples * mSumOfSquares) - (lSum * lSum));
    return Math.sqrt(lNumerator / (mNumSamples * ((double)mNumSamples - 1)));
  }

  @Override
  public String toString()
  {
    if (mNumSamples == 0)
    {
      return "<No samples>";
    }

    return (long)getMean() + " +/- " + (long)getStdDev();
  }
}

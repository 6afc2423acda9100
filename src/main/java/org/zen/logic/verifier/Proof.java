package org.zen.logic.verifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaPool;

/**
 * A proof of a named theorem: an ordered list of steps, each with a justification at the same index.
 *
 * The proof owns its steps and justifications.  Once verified as valid it is also referenced (not copied) by its
 * theorem.  Mutation is only possible through {@link ProofVerifier}, which keeps the state flags consistent.
 */
public class Proof
{
  private final String        mTheoremName;
  private final List<Formula> mSteps          = new ArrayList<>();
  private final List<Formula> mJustifications = new ArrayList<>();
  private ProofState          mState          = ProofState.EMPTY;
  private long                mVerificationTime;

  /**
   * Create an empty proof.
   *
   * @param xiTheoremName - the theorem this proves.
   */
  public Proof(String xiTheoremName)
  {
    mTheoremName = xiTheoremName;
  }

  public String getTheoremName()
  {
    return mTheoremName;
  }

  public List<Formula> getSteps()
  {
    return Collections.unmodifiableList(mSteps);
  }

  public List<Formula> getJustifications()
  {
    return Collections.unmodifiableList(mJustifications);
  }

  public int getStepCount()
  {
    return mSteps.size();
  }

  public ProofState getState()
  {
    return mState;
  }

  /**
   * @return whether the last verification found the proof valid and no step has been added since.
   */
  public boolean isValid()
  {
    return mState == ProofState.VERIFIED_VALID;
  }

  /**
   * @return whether the proof is complete.  A proof is complete exactly when it has been verified as valid.
   */
  public boolean isComplete()
  {
    return mState == ProofState.VERIFIED_VALID;
  }

  /**
   * @return the time taken by the last verification, in nanoseconds (0 if never verified).
   */
  public long getVerificationTime()
  {
    return mVerificationTime;
  }

  /**
   * @return a deep copy of this proof, sharing no formula with it.
   */
  public Proof snapshot()
  {
    Proof lCopy = new Proof(mTheoremName);
    for (int lii = 0; lii < mSteps.size(); lii++)
    {
      lCopy.mSteps.add(FormulaPool.copy(mSteps.get(lii)));
      lCopy.mJustifications.add(FormulaPool.copy(mJustifications.get(lii)));
    }
    lCopy.mState = mState;
    lCopy.mVerificationTime = mVerificationTime;
    return lCopy;
  }

  void replaceSteps(List<Formula> xiSteps, List<Formula> xiJustifications)
  {
    mSteps.clear();
    mJustifications.clear();
    mSteps.addAll(xiSteps);
    mJustifications.addAll(xiJustifications);
    mState = mSteps.isEmpty() ? ProofState.EMPTY : ProofState.ACCUMULATING;
  }

  void appendStep(Formula xiStep, Formula xiJustification)
  {
    mSteps.add(xiStep);
    mJustifications.add(xiJustification);
    mState = ProofState.ACCUMULATING;
  }

  void recordVerification(boolean xiValid, long xiElapsed)
  {
    mState = xiValid ? ProofState.VERIFIED_VALID : ProofState.VERIFIED_INVALID;
    mVerificationTime = xiElapsed;
  }

  @Override
  public String toString()
  {
    return "Proof of " + mTheoremName + " (" + mSteps.size() + " steps, " + mState + ")";
  }
}

package org.zen.logic.kb;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaPool;
import org.zen.logic.verifier.Proof;

/**
 * A named statement to be proven.
 *
 * Theorems handed out by {@link LogicSystem} are snapshots: later registry operations do not change them.
 */
public class Theorem
{
  private final String        mName;
  private final Formula       mStatement;
  private final List<Formula> mHypotheses;
  private final Formula       mConclusion;
  private Proof               mProof;
  private boolean             mProven;

  Theorem(String xiName, Formula xiStatement, List<Formula> xiHypotheses, Formula xiConclusion)
  {
    mName = xiName;
    mStatement = xiStatement;
    mHypotheses = Collections.unmodifiableList(new ArrayList<>(xiHypotheses));
    mConclusion = xiConclusion;
  }

  public String getName()
  {
    return mName;
  }

  public Formula getStatement()
  {
    return mStatement;
  }

  public List<Formula> getHypotheses()
  {
    return mHypotheses;
  }

  /**
   * @return the conclusion, or null if none was given.
   */
  public Formula getConclusion()
  {
    return mConclusion;
  }

  /**
   * @return the proof that established this theorem, or null if it hasn't been proven.
   */
  public Proof getProof()
  {
    return mProof;
  }

  /**
   * @return whether a valid proof has ever been verified for this theorem.
   */
  public boolean isProven()
  {
    return mProven;
  }

  void markProven(Proof xiProof)
  {
    mProof = xiProof;
    mProven = true;
  }

  Theorem snapshot()
  {
    List<Formula> lHypotheses = new ArrayList<>(mHypotheses.size());
    for (Formula lHypothesis : mHypotheses)
    {
      lHypotheses.add(FormulaPool.copy(lHypothesis));
    }

    Theorem lCopy = new Theorem(mName, FormulaPool.copy(mStatement), lHypotheses, FormulaPool.copy(mConclusion));
    lCopy.mProof = (mProof == null) ? null : mProof.snapshot();
    lCopy.mProven = mProven;
    return lCopy;
  }

  @Override
  public String toString()
  {
    return mName + ": " + mStatement + (mProven ? " (proven)" : "");
  }
}

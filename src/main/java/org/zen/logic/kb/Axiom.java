package org.zen.logic.kb;

import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaPool;

/**
 * A named statement accepted without proof.
 */
public class Axiom
{
  private final String  mName;
  private final Formula mStatement;
  private final boolean mFoundational;
  private boolean       mConsistent = true;

  Axiom(String xiName, Formula xiStatement, boolean xiFoundational)
  {
    mName = xiName;
    mStatement = xiStatement;
    mFoundational = xiFoundational;
  }

  public String getName()
  {
    return mName;
  }

  public Formula getStatement()
  {
    return mStatement;
  }

  /**
   * @return the result of the last consistency check (true until one has been run).
   */
  public boolean isConsistent()
  {
    return mConsistent;
  }

  /**
   * @return whether this is one of the axioms every initialized logic system starts with.
   */
  public boolean isFoundational()
  {
    return mFoundational;
  }

  void setConsistent(boolean xiConsistent)
  {
    mConsistent = xiConsistent;
  }

  Axiom snapshot()
  {
    Axiom lCopy = new Axiom(mName, FormulaPool.copy(mStatement), mFoundational);
    lCopy.mConsistent = mConsistent;
    return lCopy;
  }

  @Override
  public String toString()
  {
    return mName + ": " + mStatement;
  }
}

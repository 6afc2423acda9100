package org.zen.logic.godel;

import org.zen.logic.formula.grammar.Formula;

/**
 * A statement flagged as possibly undecidable, and why.
 */
public class Undecidable
{
  /**
   * The pattern a statement matched.
   */
  public static enum Reason
  {
    /**
     * ¬Provable(...): the statement asserts its own unprovability.
     */
    UNPROVABILITY_CLAIM("asserts unprovability"),

    /**
     * ∀x (A → B): the shape of an incompleteness schema such as ∀T (Consistent(T) → ¬Complete(T)).
     */
    INCOMPLETENESS_SCHEMA("universally quantified implication");

    private final String mDescription;

    private Reason(String xiDescription)
    {
      mDescription = xiDescription;
    }

    public String getDescription()
    {
      return mDescription;
    }
  }

  private final Formula mStatement;
  private final Reason  mReason;

  Undecidable(Formula xiStatement, Reason xiReason)
  {
    mStatement = xiStatement;
    mReason = xiReason;
  }

  /**
   * @return a copy of the flagged statement.
   */
  public Formula getStatement()
  {
    return mStatement;
  }

  public Reason getReason()
  {
    return mReason;
  }

  @Override
  public String toString()
  {
    return "Undecidable (" + mReason.getDescription() + "): " + mStatement;
  }
}

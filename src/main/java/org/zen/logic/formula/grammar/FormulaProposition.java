package org.zen.logic.formula.grammar;

/**
 * A <i>proposition</i> is a named atomic statement.  It may carry a fixed truth value, which plays no part in
 * structural comparison.
 *
 * See {@link Formula} for a complete description of the formula hierarchy.
 */
@SuppressWarnings("serial")
public final class FormulaProposition extends Formula
{
  private final String  name;
  private final Boolean truth;

  FormulaProposition(String name, Boolean truth)
  {
    this.name = name;
    this.truth = truth;
  }

  @Override
  public FormulaKind getKind()
  {
    return FormulaKind.PROPOSITION;
  }

  public String getName()
  {
    return name;
  }

  /**
   * @return the fixed truth value, or null if the proposition is unassigned.
   */
  public Boolean getTruth()
  {
    return truth;
  }

  @Override
  public Formula deepCopy()
  {
    return new FormulaProposition(name, truth);
  }

  @Override
  public boolean isGround()
  {
    return true;
  }

  @Override
  public String toString()
  {
    return name;
  }

}

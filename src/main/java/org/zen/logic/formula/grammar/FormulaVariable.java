package org.zen.logic.formula.grammar;

/**
 * A <i>variable</i>, either bound by an enclosing quantifier or free.
 *
 * See {@link Formula} for a complete description of the formula hierarchy.
 */
@SuppressWarnings("serial")
public final class FormulaVariable extends Formula
{

  private final String  name;
  private final boolean bound;

  FormulaVariable(String name, boolean bound)
  {
    this.name = name;
    this.bound = bound;
  }

  @Override
  public FormulaKind getKind()
  {
    return FormulaKind.VARIABLE;
  }

  public String getName()
  {
    return name;
  }

  public boolean isBound()
  {
    return bound;
  }

  @Override
  public Formula deepCopy()
  {
    return new FormulaVariable(name, bound);
  }

  @Override
  public boolean isGround()
  {
    return bound;
  }

  @Override
  public String toString()
  {
    return name;
  }

}

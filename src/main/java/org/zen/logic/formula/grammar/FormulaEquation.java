package org.zen.logic.formula.grammar;

/**
 * An <i>equation</i> states that two terms are equal.
 *
 * See {@link Formula} for a complete description of the formula hierarchy.
 */
@SuppressWarnings("serial")
public final class FormulaEquation extends Formula
{
  private final Formula left;
  private final Formula right;

  FormulaEquation(Formula left, Formula right)
  {
    this.left = left;
    this.right = right;
  }

  @Override
  public FormulaKind getKind()
  {
    return FormulaKind.EQUATION;
  }

  public Formula getLeft()
  {
    return left;
  }

  public Formula getRight()
  {
    return right;
  }

  @Override
  public Formula deepCopy()
  {
    return new FormulaEquation(copyOf(left), copyOf(right));
  }

  @Override
  public boolean isGround()
  {
    return isGround(left) && isGround(right);
  }

  @Override
  public String toString()
  {
    return "(" + left + " = " + right + ")";
  }

}

package org.zen.logic.formula.grammar;

/**
 * An <i>inequality</i> orders two terms.
 *
 * See {@link Formula} for a complete description of the formula hierarchy.
 */
@SuppressWarnings("serial")
public final class FormulaInequality extends Formula
{
  private final InequalityKind kind;
  private final Formula        left;
  private final Formula        right;

  FormulaInequality(InequalityKind kind, Formula left, Formula right)
  {
    this.kind = kind;
    this.left = left;
    this.right = right;
  }

  @Override
  public FormulaKind getKind()
  {
    return FormulaKind.INEQUALITY;
  }

  public InequalityKind getInequalityKind()
  {
    return kind;
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
    return new FormulaInequality(kind, copyOf(left), copyOf(right));
  }

  @Override
  public boolean isGround()
  {
    return isGround(left) && isGround(right);
  }

  @Override
  public String toString()
  {
    return "(" + left + " " + kind.getSymbol() + " " + right + ")";
  }

}

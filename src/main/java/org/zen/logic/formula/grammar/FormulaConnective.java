package org.zen.logic.formula.grammar;

/**
 * A <i>connective</i> combines formulas with a propositional operator.  Negation has no left operand; every other
 * connective has both.
 *
 * See {@link Formula} for a complete description of the formula hierarchy.
 */
@SuppressWarnings("serial")
public final class FormulaConnective extends Formula
{
  private final ConnectiveKind kind;
  private final Formula        left;
  private final Formula        right;
  private transient Boolean    ground;

  FormulaConnective(ConnectiveKind kind, Formula left, Formula right)
  {
    this.kind = kind;
    this.left = left;
    this.right = right;
    ground = null;
  }

  @Override
  public FormulaKind getKind()
  {
    return FormulaKind.CONNECTIVE;
  }

  public ConnectiveKind getConnectiveKind()
  {
    return kind;
  }

  public boolean is(ConnectiveKind xiKind)
  {
    return kind == xiKind;
  }

  /**
   * @return the left operand, which is always null for a negation.
   */
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
    return new FormulaConnective(kind, copyOf(left), copyOf(right));
  }

  @Override
  public boolean isGround()
  {
    if (ground == null)
    {
      ground = isGround(left) && isGround(right);
    }

    return ground;
  }

  @Override
  public String toString()
  {
    if (kind.isUnary())
    {
      return kind.getSymbol() + right;
    }

    return "(" + left + " " + kind.getSymbol() + " " + right + ")";
  }

}

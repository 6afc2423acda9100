package org.zen.logic.formula.grammar;

/**
 * A numeric literal leaf.
 */
@SuppressWarnings("serial")
public final class FormulaNumber extends Formula
{
  private final double value;

  FormulaNumber(double value)
  {
    this.value = value;
  }

  @Override
  public FormulaKind getKind()
  {
    return FormulaKind.NUMBER;
  }

  public double getValue()
  {
    return value;
  }

  @Override
  public Formula deepCopy()
  {
    return new FormulaNumber(value);
  }

  @Override
  public boolean isGround()
  {
    return true;
  }

  @Override
  public String toString()
  {
    if ((value == Math.rint(value)) && !Double.isInfinite(value) && (Math.abs(value) < 1e15))
    {
      return Long.toString((long)value);
    }
    return Double.toString(value);
  }

}

package org.zen.logic.formula.grammar;

/**
 * A string literal leaf.
 */
@SuppressWarnings("serial")
public final class FormulaString extends Formula
{
  private final String value;

  FormulaString(String value)
  {
    this.value = value;
  }

  @Override
  public FormulaKind getKind()
  {
    return FormulaKind.STRING;
  }

  public String getValue()
  {
    return value;
  }

  @Override
  public Formula deepCopy()
  {
    return new FormulaString(value);
  }

  @Override
  public boolean isGround()
  {
    return true;
  }

  @Override
  public String toString()
  {
    return "\"" + value + "\"";
  }

}

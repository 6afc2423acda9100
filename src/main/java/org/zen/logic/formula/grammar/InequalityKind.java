package org.zen.logic.formula.grammar;

public enum InequalityKind
{
  LT("<", "<"),
  LE("≤", "\\leq"),
  GT(">", ">"),
  GE("≥", "\\geq");

  private final String mSymbol;
  private final String mLatex;

  private InequalityKind(String xiSymbol, String xiLatex)
  {
    mSymbol = xiSymbol;
    mLatex = xiLatex;
  }

  public String getSymbol()
  {
    return mSymbol;
  }

  public String getLatex()
  {
    return mLatex;
  }
}

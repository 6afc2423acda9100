package org.zen.logic.formula.grammar;

/**
 * The two first-order quantifiers.
 */
public enum QuantifierKind
{
  UNIVERSAL("∀", "\\forall"),
  EXISTENTIAL("∃", "\\exists");

  private final String mSymbol;
  private final String mLatex;

  private QuantifierKind(String xiSymbol, String xiLatex)
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

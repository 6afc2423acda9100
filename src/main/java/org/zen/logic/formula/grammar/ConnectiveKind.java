package org.zen.logic.formula.grammar;

/**
 * Propositional connectives.  {@link #NOT} is the only unary connective.
 */
public enum ConnectiveKind
{
  AND("∧", "\\land"),
  OR("∨", "\\lor"),
  IMPLIES("→", "\\rightarrow"),
  IFF("↔", "\\leftrightarrow"),
  NOT("¬", "\\lnot");

  private final String mSymbol;
  private final String mLatex;

  private ConnectiveKind(String xiSymbol, String xiLatex)
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

  /**
   * @return whether the connective takes only a right operand.
   */
  public boolean isUnary()
  {
    return this == NOT;
  }
}

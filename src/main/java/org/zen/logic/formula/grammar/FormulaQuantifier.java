package org.zen.logic.formula.grammar;

/**
 * A <i>quantifier</i> binds a variable, optionally restricted to a domain, over a body.
 *
 * See {@link Formula} for a complete description of the formula hierarchy.
 */
@SuppressWarnings("serial")
public final class FormulaQuantifier extends Formula
{
  private final QuantifierKind kind;
  private final String         variable;
  private final Formula        domain;
  private final Formula        body;
  private transient Boolean    ground;

  FormulaQuantifier(QuantifierKind kind, String variable, Formula domain, Formula body)
  {
    this.kind = kind;
    this.variable = variable;
    this.domain = domain;
    this.body = body;
    ground = null;
  }

  @Override
  public FormulaKind getKind()
  {
    return FormulaKind.QUANTIFIER;
  }

  public QuantifierKind getQuantifierKind()
  {
    return kind;
  }

  public boolean isUniversal()
  {
    return kind == QuantifierKind.UNIVERSAL;
  }

  public String getVariable()
  {
    return variable;
  }

  /**
   * @return the domain the variable ranges over, or null if unrestricted.
   */
  public Formula getDomain()
  {
    return domain;
  }

  public Formula getBody()
  {
    return body;
  }

  @Override
  public Formula deepCopy()
  {
    return new FormulaQuantifier(kind, variable, copyOf(domain), copyOf(body));
  }

  @Override
  public boolean isGround()
  {
    if (ground == null)
    {
      ground = isGround(domain) && isGround(body);
    }

    return ground;
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder();

    sb.append(kind.getSymbol()).append(variable);
    if (domain != null)
    {
      sb.append(" ∈ ").append(domain);
    }
    sb.append(" ").append(body);

    return sb.toString();
  }

}

package org.zen.logic.formula.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A <i>proof marker</i> tags a step of a proof.  Premises and conclusions may carry the statement they introduce;
 * inference steps name their rule and carry the premises it is applied to.
 *
 * See {@link Formula} for a complete description of the formula hierarchy.
 */
@SuppressWarnings("serial")
public final class FormulaProofMarker extends Formula
{
  private final MarkerKind        kind;
  private final InferenceRuleKind rule;
  private final List<Formula>     premises;
  private final Formula           statement;

  FormulaProofMarker(MarkerKind kind, InferenceRuleKind rule, List<Formula> premises, Formula statement)
  {
    this.kind = kind;
    this.rule = rule;
    this.premises = premises;
    this.statement = statement;
  }

  @Override
  public FormulaKind getKind()
  {
    return FormulaKind.PROOF_MARKER;
  }

  public MarkerKind getMarkerKind()
  {
    return kind;
  }

  /**
   * @return the licensing rule of an inference step, or null for premises and conclusions.
   */
  public InferenceRuleKind getRule()
  {
    return rule;
  }

  /**
   * @return the premises of an inference step (empty for premises and conclusions).
   */
  public List<Formula> getPremises()
  {
    return premises;
  }

  /**
   * @return the statement introduced or concluded by this step, or null.
   */
  public Formula getStatement()
  {
    return statement;
  }

  @Override
  public Formula deepCopy()
  {
    if (premises.isEmpty())
    {
      return new FormulaProofMarker(kind, rule, Collections.<Formula>emptyList(), copyOf(statement));
    }

    List<Formula> lPremises = new ArrayList<>(premises.size());
    for (Formula lPremise : premises)
    {
      lPremises.add(copyOf(lPremise));
    }
    return new FormulaProofMarker(kind, rule, FormulaPool.freeze(lPremises), copyOf(statement));
  }

  @Override
  public boolean isGround()
  {
    return isGround(statement) && FormulaPool.allGround(premises);
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder();

    switch (kind)
    {
      case PREMISE:
        sb.append("premise");
        break;

      case CONCLUSION:
        sb.append("conclusion");
        break;

      default:
        sb.append("by ").append(rule.getName());
        if (!premises.isEmpty())
        {
          sb.append(" [");
          for (int lii = 0; lii < premises.size(); lii++)
          {
            if (lii > 0)
            {
              sb.append("; ");
            }
            sb.append(premises.get(lii));
          }
          sb.append("]");
        }
        break;
    }

    if (statement != null)
    {
      sb.append(": ").append(statement);
    }

    return sb.toString();
  }

}

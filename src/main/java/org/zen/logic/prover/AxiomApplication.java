package org.zen.logic.prover;

import java.util.List;

import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.InferenceRuleKind;

/**
 * Axiom application: an axiom statement may always be written down as a justified step.
 */
public final class AxiomApplication implements InferenceRule
{
  @Override
  public InferenceRuleKind getKind()
  {
    return InferenceRuleKind.AXIOM;
  }

  @Override
  public int getArity()
  {
    return 1;
  }

  @Override
  public Formula apply(List<Formula> xiPremises)
  {
    if ((xiPremises.size() != 1) || (xiPremises.get(0) == null))
    {
      return null;
    }

    return xiPremises.get(0).deepCopy();
  }
}

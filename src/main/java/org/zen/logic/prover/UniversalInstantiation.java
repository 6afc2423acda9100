package org.zen.logic.prover;

import java.util.List;

import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaKind;
import org.zen.logic.formula.grammar.FormulaQuantifier;
import org.zen.logic.formula.grammar.InferenceRuleKind;

/**
 * Universal instantiation: from <code>∀x B</code> and an instance <code>t</code>, derive the body <code>B</code>.
 *
 * The instance licenses the step but is not substituted for the bound variable: the derived formula is a copy of
 * the body exactly as written.  Verification outcomes depend on this, so it must not be changed silently.
 */
public final class UniversalInstantiation implements InferenceRule
{
  @Override
  public InferenceRuleKind getKind()
  {
    return InferenceRuleKind.UNIVERSAL_INSTANTIATION;
  }

  @Override
  public int getArity()
  {
    return 2;
  }

  @Override
  public Formula apply(List<Formula> xiPremises)
  {
    if (xiPremises.size() != 2)
    {
      return null;
    }

    Formula lUniversal = xiPremises.get(0);
    if ((lUniversal == null) ||
        (lUniversal.getKind() != FormulaKind.QUANTIFIER) ||
        !((FormulaQuantifier)lUniversal).isUniversal())
    {
      return null;
    }

    Formula lBody = ((FormulaQuantifier)lUniversal).getBody();
    return (lBody == null) ? null : lBody.deepCopy();
  }
}

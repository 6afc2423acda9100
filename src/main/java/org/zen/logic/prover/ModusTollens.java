package org.zen.logic.prover;

import java.util.List;

import org.zen.logic.formula.FormulaEquivalence;
import org.zen.logic.formula.grammar.ConnectiveKind;
import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaConnective;
import org.zen.logic.formula.grammar.FormulaKind;
import org.zen.logic.formula.grammar.FormulaPool;
import org.zen.logic.formula.grammar.InferenceRuleKind;

/**
 * Modus tollens: from <code>P → Q</code> and <code>¬Q</code>, derive <code>¬P</code>.
 */
public final class ModusTollens implements InferenceRule
{
  @Override
  public InferenceRuleKind getKind()
  {
    return InferenceRuleKind.MODUS_TOLLENS;
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

    Formula lConditional = xiPremises.get(0);
    Formula lNegatedConsequent = xiPremises.get(1);
    if (!ModusPonens.isImplication(lConditional) ||
        (lNegatedConsequent == null) ||
        (lNegatedConsequent.getKind() != FormulaKind.CONNECTIVE) ||
        !((FormulaConnective)lNegatedConsequent).is(ConnectiveKind.NOT))
    {
      return null;
    }

    FormulaConnective lImplication = (FormulaConnective)lConditional;
    Formula lConsequent = ((FormulaConnective)lNegatedConsequent).getRight();
    if ((lImplication.getLeft() == null) ||
        !FormulaEquivalence.equivalent(lImplication.getRight(), lConsequent))
    {
      return null;
    }

    return FormulaPool.getNot(lImplication.getLeft().deepCopy());
  }
}

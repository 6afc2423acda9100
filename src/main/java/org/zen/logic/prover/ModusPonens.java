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
 * Modus ponens: from <code>P → Q</code> and <code>P</code>, derive <code>Q</code>.
 */
public final class ModusPonens implements InferenceRule
{
  @Override
  public InferenceRuleKind getKind()
  {
    return InferenceRuleKind.MODUS_PONENS;
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
    Formula lAntecedent = xiPremises.get(1);
    if (!isImplication(lConditional) || (lAntecedent == null))
    {
      return null;
    }

    FormulaConnective lImplication = (FormulaConnective)lConditional;
    if (!FormulaEquivalence.equivalent(lImplication.getLeft(), lAntecedent))
    {
      return null;
    }

    return FormulaPool.copy(lImplication.getRight());
  }

  static boolean isImplication(Formula xiFormula)
  {
    return (xiFormula != null) &&
           (xiFormula.getKind() == FormulaKind.CONNECTIVE) &&
           ((FormulaConnective)xiFormula).is(ConnectiveKind.IMPLIES);
  }
}

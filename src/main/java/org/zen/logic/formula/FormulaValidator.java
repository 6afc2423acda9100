package org.zen.logic.formula;

import java.util.List;

import org.apache.commons.lang.StringUtils;
import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaConnective;
import org.zen.logic.formula.grammar.FormulaEquation;
import org.zen.logic.formula.grammar.FormulaInequality;
import org.zen.logic.formula.grammar.FormulaMathFunction;
import org.zen.logic.formula.grammar.FormulaPredicate;
import org.zen.logic.formula.grammar.FormulaQuantifier;

/**
 * Well-formedness of logical statements.
 *
 * A formula must be well-formed before it can be stored as an axiom or theorem, or be fed to the inference engine.
 * Only the root node is checked: children are not required to be well-formed themselves.  Proof markers and literals
 * are never well-formed statements on their own, which keeps non-logical nodes out of proofs.
 */
public final class FormulaValidator
{
  private FormulaValidator()
  {
  }

  /**
   * @return whether the specified node is a well-formed logical statement.
   *
   * @param xiFormula - the node to check (may be null, which is never well-formed).
   */
  public static boolean validate(Formula xiFormula)
  {
    if (xiFormula == null)
    {
      return false;
    }

    switch (xiFormula.getKind())
    {
      case QUANTIFIER:
      {
        FormulaQuantifier lQuantifier = (FormulaQuantifier)xiFormula;
        return StringUtils.isNotEmpty(lQuantifier.getVariable()) && (lQuantifier.getBody() != null);
      }

      case PREDICATE:
        return StringUtils.isNotEmpty(((FormulaPredicate)xiFormula).getName());

      case CONNECTIVE:
      {
        FormulaConnective lConnective = (FormulaConnective)xiFormula;
        if (lConnective.getConnectiveKind().isUnary())
        {
          return lConnective.getRight() != null;
        }
        return (lConnective.getLeft() != null) && (lConnective.getRight() != null);
      }

      case VARIABLE:
      case PROPOSITION:
        return true;

      case EQUATION:
      {
        FormulaEquation lEquation = (FormulaEquation)xiFormula;
        return (lEquation.getLeft() != null) && (lEquation.getRight() != null);
      }

      case INEQUALITY:
      {
        FormulaInequality lInequality = (FormulaInequality)xiFormula;
        return (lInequality.getLeft() != null) && (lInequality.getRight() != null);
      }

      case MATH_FUNCTION:
        return StringUtils.isNotEmpty(((FormulaMathFunction)xiFormula).getName());

      default:
        return false;
    }
  }

  /**
   * @return whether every member of the list is well-formed.  An empty list passes.
   */
  public static boolean validateAll(List<? extends Formula> xiFormulas)
  {
    for (Formula lFormula : xiFormulas)
    {
      if (!validate(lFormula))
      {
        return false;
      }
    }

    return true;
  }
}

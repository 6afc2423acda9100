package org.zen.logic.formula;

import java.util.List;

import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaConnective;
import org.zen.logic.formula.grammar.FormulaEquation;
import org.zen.logic.formula.grammar.FormulaInequality;
import org.zen.logic.formula.grammar.FormulaMathFunction;
import org.zen.logic.formula.grammar.FormulaNumber;
import org.zen.logic.formula.grammar.FormulaPredicate;
import org.zen.logic.formula.grammar.FormulaProofMarker;
import org.zen.logic.formula.grammar.FormulaProposition;
import org.zen.logic.formula.grammar.FormulaQuantifier;
import org.zen.logic.formula.grammar.FormulaString;
import org.zen.logic.formula.grammar.FormulaVariable;

/**
 * Structural equivalence of formula trees.
 *
 * Two trees are equivalent when they have the same shape, the same names and the same operators.  Bound variables
 * are not renamed: <code>∀x P(x)</code> and <code>∀y P(y)</code> are <b>not</b> equivalent.  The truth value fixed on
 * a proposition is ignored.
 *
 * The relation is reflexive and symmetric for every tree.
 */
public final class FormulaEquivalence
{
  private FormulaEquivalence()
  {
  }

  /**
   * @return whether the two trees are structurally equivalent.  Two absent trees are equivalent; an absent and a
   *         present tree are not.
   *
   * @param xiFirst - the first tree (may be null).
   * @param xiSecond - the second tree (may be null).
   */
  public static boolean equivalent(Formula xiFirst, Formula xiSecond)
  {
    if ((xiFirst == null) || (xiSecond == null))
    {
      return xiFirst == xiSecond;
    }

    if (xiFirst.getKind() != xiSecond.getKind())
    {
      return false;
    }

    switch (xiFirst.getKind())
    {
      case PROPOSITION:
        return ((FormulaProposition)xiFirst).getName().equals(((FormulaProposition)xiSecond).getName());

      case VARIABLE:
      {
        FormulaVariable lFirst = (FormulaVariable)xiFirst;
        FormulaVariable lSecond = (FormulaVariable)xiSecond;
        return lFirst.getName().equals(lSecond.getName()) && (lFirst.isBound() == lSecond.isBound());
      }

      case PREDICATE:
      {
        FormulaPredicate lFirst = (FormulaPredicate)xiFirst;
        FormulaPredicate lSecond = (FormulaPredicate)xiSecond;
        return lFirst.getName().equals(lSecond.getName()) && equivalent(lFirst.getArgs(), lSecond.getArgs());
      }

      case MATH_FUNCTION:
      {
        FormulaMathFunction lFirst = (FormulaMathFunction)xiFirst;
        FormulaMathFunction lSecond = (FormulaMathFunction)xiSecond;
        return lFirst.getName().equals(lSecond.getName()) && equivalent(lFirst.getArgs(), lSecond.getArgs());
      }

      case CONNECTIVE:
      {
        FormulaConnective lFirst = (FormulaConnective)xiFirst;
        FormulaConnective lSecond = (FormulaConnective)xiSecond;
        return (lFirst.getConnectiveKind() == lSecond.getConnectiveKind()) &&
               equivalent(lFirst.getLeft(), lSecond.getLeft()) &&
               equivalent(lFirst.getRight(), lSecond.getRight());
      }

      case EQUATION:
      {
        FormulaEquation lFirst = (FormulaEquation)xiFirst;
        FormulaEquation lSecond = (FormulaEquation)xiSecond;
        return equivalent(lFirst.getLeft(), lSecond.getLeft()) && equivalent(lFirst.getRight(), lSecond.getRight());
      }

      case INEQUALITY:
      {
        FormulaInequality lFirst = (FormulaInequality)xiFirst;
        FormulaInequality lSecond = (FormulaInequality)xiSecond;
        return (lFirst.getInequalityKind() == lSecond.getInequalityKind()) &&
               equivalent(lFirst.getLeft(), lSecond.getLeft()) &&
               equivalent(lFirst.getRight(), lSecond.getRight());
      }

      case QUANTIFIER:
      {
        FormulaQuantifier lFirst = (FormulaQuantifier)xiFirst;
        FormulaQuantifier lSecond = (FormulaQuantifier)xiSecond;
        return (lFirst.getQuantifierKind() == lSecond.getQuantifierKind()) &&
               lFirst.getVariable().equals(lSecond.getVariable()) &&
               equivalent(lFirst.getDomain(), lSecond.getDomain()) &&
               equivalent(lFirst.getBody(), lSecond.getBody());
      }

      case PROOF_MARKER:
      {
        FormulaProofMarker lFirst = (FormulaProofMarker)xiFirst;
        FormulaProofMarker lSecond = (FormulaProofMarker)xiSecond;
        return (lFirst.getMarkerKind() == lSecond.getMarkerKind()) &&
               (lFirst.getRule() == lSecond.getRule()) &&
               equivalent(lFirst.getStatement(), lSecond.getStatement()) &&
               equivalent(lFirst.getPremises(), lSecond.getPremises());
      }

      case NUMBER:
        return Double.compare(((FormulaNumber)xiFirst).getValue(), ((FormulaNumber)xiSecond).getValue()) == 0;

      case STRING:
        return ((FormulaString)xiFirst).getValue().equals(((FormulaString)xiSecond).getValue());

      default:
        // A pairing with no comparison is never reported as equivalent.
        return false;
    }
  }

  /**
   * @return whether two argument lists have the same length and are pairwise equivalent in order.
   */
  public static boolean equivalent(List<Formula> xiFirst, List<Formula> xiSecond)
  {
    if (xiFirst.size() != xiSecond.size())
    {
      return false;
    }

    for (int lii = 0; lii < xiFirst.size(); lii++)
    {
      if (!equivalent(xiFirst.get(lii), xiSecond.get(lii)))
      {
        return false;
      }
    }

    return true;
  }

  /**
   * @return whether some member of the collection is equivalent to the specified tree.
   *
   * @param xiCandidates - the trees to search.
   * @param xiTarget - the tree to look for.
   */
  public static boolean containsEquivalent(Iterable<? extends Formula> xiCandidates, Formula xiTarget)
  {
    for (Formula lCandidate : xiCandidates)
    {
      if (equivalent(lCandidate, xiTarget))
      {
        return true;
      }
    }

    return false;
  }
}

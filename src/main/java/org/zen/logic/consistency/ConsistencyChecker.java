package org.zen.logic.consistency;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.zen.logic.formula.FormulaEquivalence;
import org.zen.logic.formula.grammar.ConnectiveKind;
import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaConnective;
import org.zen.logic.formula.grammar.FormulaKind;

/**
 * Shallow consistency and entailment checks over formula trees.
 *
 * Entailment is membership: a conclusion is entailed only if it is equivalent to one of the premises.  No closure
 * under the inference rules is computed.  Likewise, two statements are inconsistent only when one is literally the
 * negation of the other.
 */
public final class ConsistencyChecker
{
  private static final Logger LOGGER = LogManager.getLogger();

  private ConsistencyChecker()
  {
  }

  /**
   * @return whether the conclusion is equivalent to one of the premises.
   *
   * @param xiPremises - the premises.
   * @param xiConclusion - the conclusion.
   */
  public static boolean entails(List<? extends Formula> xiPremises, Formula xiConclusion)
  {
    return (xiPremises != null) && FormulaEquivalence.containsEquivalent(xiPremises, xiConclusion);
  }

  /**
   * @return whether a pair of statements is consistent, i.e. whether neither is the negation of the other.  Only
   * pairs of connectives can be inconsistent.
   */
  public static boolean consistent(Formula xiFirst, Formula xiSecond)
  {
    if ((xiFirst == null) || (xiSecond == null) ||
        (xiFirst.getKind() != FormulaKind.CONNECTIVE) ||
        (xiSecond.getKind() != FormulaKind.CONNECTIVE))
    {
      return true;
    }

    return !negates(xiFirst, xiSecond) && !negates(xiSecond, xiFirst);
  }

  private static boolean negates(Formula xiCandidate, Formula xiOther)
  {
    return ((FormulaConnective)xiCandidate).is(ConnectiveKind.NOT) &&
           FormulaEquivalence.equivalent(((FormulaConnective)xiCandidate).getRight(), xiOther);
  }

  /**
   * @return whether a statement is consistent with every statement in a set.
   *
   * @param xiStatement - the statement to check.
   * @param xiOthers - the statements to check against.  The statement itself may be among them.
   */
  public static boolean isConsistentWith(Formula xiStatement, Iterable<? extends Formula> xiOthers)
  {
    for (Formula lOther : xiOthers)
    {
      if (lOther == xiStatement)
      {
        continue;
      }

      if (!consistent(xiStatement, lOther))
      {
        LOGGER.debug(xiStatement + " contradicts " + lOther);
        return false;
      }
    }
    return true;
  }

  /**
   * @return whether every pair of statements in the set is consistent.
   */
  public static boolean isConsistent(List<? extends Formula> xiStatements)
  {
    for (int lii = 0; lii < xiStatements.size(); lii++)
    {
      for (int ljj = lii + 1; ljj < xiStatements.size(); ljj++)
      {
        if (!consistent(xiStatements.get(lii), xiStatements.get(ljj)))
        {
          return false;
        }
      }
    }
    return true;
  }
}

package org.zen.logic.godel;

import org.apache.commons.lang.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.zen.logic.formula.grammar.ConnectiveKind;
import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaConnective;
import org.zen.logic.formula.grammar.FormulaKind;
import org.zen.logic.formula.grammar.FormulaPool;
import org.zen.logic.formula.grammar.FormulaPredicate;
import org.zen.logic.formula.grammar.FormulaQuantifier;

/**
 * Pattern-based detection of Gödel-style statements.
 *
 * This is a syntactic heuristic over the top of the tree.  It produces false positives (every universally quantified
 * implication matches) and false negatives (self-reference that isn't spelt with a "Provable" predicate).
 */
public final class SelfReferenceDetector
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Predicate-name fragment that marks a provability claim.
   */
  public static final String PROVABILITY_MARKER = "Provable";

  private SelfReferenceDetector()
  {
  }

  /**
   * @return the match, or null if the statement doesn't look self-referential.
   *
   * @param xiStatement - the statement to check.
   */
  public static Undecidable detect(Formula xiStatement)
  {
    Undecidable.Reason lReason = match(xiStatement);
    if (lReason == null)
    {
      return null;
    }

    LOGGER.debug(xiStatement + " matches " + lReason);
    return new Undecidable(FormulaPool.copy(xiStatement), lReason);
  }

  /**
   * @return whether the statement looks self-referential.
   */
  public static boolean isUndecidable(Formula xiStatement)
  {
    return match(xiStatement) != null;
  }

  private static Undecidable.Reason match(Formula xiStatement)
  {
    if (xiStatement == null)
    {
      return null;
    }

    if (xiStatement.getKind() == FormulaKind.CONNECTIVE)
    {
      FormulaConnective lConnective = (FormulaConnective)xiStatement;
      Formula lInner = lConnective.getRight();
      if (lConnective.is(ConnectiveKind.NOT) &&
          (lInner != null) &&
          (lInner.getKind() == FormulaKind.PREDICATE) &&
          StringUtils.contains(((FormulaPredicate)lInner).getName(), PROVABILITY_MARKER))
      {
        return Undecidable.Reason.UNPROVABILITY_CLAIM;
      }
    }
    else if (xiStatement.getKind() == FormulaKind.QUANTIFIER)
    {
      FormulaQuantifier lQuantifier = (FormulaQuantifier)xiStatement;
      Formula lBody = lQuantifier.getBody();
      if (lQuantifier.isUniversal() &&
          (lBody != null) &&
          (lBody.getKind() == FormulaKind.CONNECTIVE) &&
          ((FormulaConnective)lBody).is(ConnectiveKind.IMPLIES))
      {
        return Undecidable.Reason.INCOMPLETENESS_SCHEMA;
      }
    }

    return null;
  }
}

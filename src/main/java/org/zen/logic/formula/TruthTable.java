package org.zen.logic.formula;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaConnective;
import org.zen.logic.formula.grammar.FormulaProposition;
import org.zen.logic.kb.exceptions.FormulaConversionException;
import org.zen.logic.util.config.LogicConfiguration;
import org.zen.logic.util.config.LogicConfiguration.CfgItem;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Truth table of a propositional formula.
 *
 * The variables are the distinct names of the propositions without a fixed truth value, in sorted order.  Rows are
 * listed with the first variable as the most significant bit, starting from all-false.  Propositions with a fixed
 * truth value always evaluate to it.
 */
public class TruthTable
{
  /**
   * One assignment of truth values to the variables, and the formula's value under it.
   */
  public static class Row
  {
    private final Map<String, Boolean> mAssignment;
    private final boolean              mValue;

    Row(Map<String, Boolean> xiAssignment, boolean xiValue)
    {
      mAssignment = xiAssignment;
      mValue = xiValue;
    }

    public Map<String, Boolean> getAssignment()
    {
      return mAssignment;
    }

    public boolean getValue()
    {
      return mValue;
    }

    @Override
    public String toString()
    {
      return mAssignment + " -> " + mValue;
    }
  }

  // Rows are numbered with a long, so no configuration may push the table past this.
  private static final int MAX_VARIABLES = 62;

  private final Formula      mFormula;
  private final List<String> mVariables;
  private final List<Row>    mRows;

  private TruthTable(Formula xiFormula, List<String> xiVariables, List<Row> xiRows)
  {
    mFormula = xiFormula;
    mVariables = xiVariables;
    mRows = xiRows;
  }

  /**
   * Build the truth table of a formula.
   *
   * @param xiFormula - the formula.  Must consist only of propositions and connectives.
   *
   * @return the truth table.
   * @throws FormulaConversionException if the formula is not propositional or has too many variables.
   */
  public static TruthTable of(Formula xiFormula) throws FormulaConversionException
  {
    SortedSet<String> lNames = new TreeSet<>();
    collectVariables(xiFormula, lNames);

    int lMaxVariables = Math.min(LogicConfiguration.getCfgInt(CfgItem.TRUTH_TABLE_MAX_VARIABLES), MAX_VARIABLES);
    if (lNames.size() > lMaxVariables)
    {
      throw new FormulaConversionException("Truth table would range over " + lNames.size() +
                                           " variables (at most " + lMaxVariables + " allowed)");
    }

    List<String> lVariables = ImmutableList.copyOf(lNames);
    int lNumVariables = lVariables.size();
    ImmutableList.Builder<Row> lRows = ImmutableList.builder();
    for (long lRow = 0; lRow < (1L << lNumVariables); lRow++)
    {
      ImmutableMap.Builder<String, Boolean> lAssignment = ImmutableMap.builder();
      for (int lii = 0; lii < lNumVariables; lii++)
      {
        boolean lValue = ((lRow >> (lNumVariables - 1 - lii)) & 1) != 0;
        lAssignment.put(lVariables.get(lii), lValue);
      }
      Map<String, Boolean> lMap = lAssignment.build();
      lRows.add(new Row(lMap, evaluate(xiFormula, lMap)));
    }

    return new TruthTable(xiFormula, lVariables, lRows.build());
  }

  private static void collectVariables(Formula xiFormula, SortedSet<String> xiNames)
    throws FormulaConversionException
  {
    if (xiFormula == null)
    {
      throw new FormulaConversionException("Truth table of a formula with a missing operand");
    }

    switch (xiFormula.getKind())
    {
      case PROPOSITION:
        FormulaProposition lProposition = (FormulaProposition)xiFormula;
        if (lProposition.getTruth() == null)
        {
          xiNames.add(lProposition.getName());
        }
        break;

      case CONNECTIVE:
        FormulaConnective lConnective = (FormulaConnective)xiFormula;
        if (!lConnective.getConnectiveKind().isUnary())
        {
          collectVariables(lConnective.getLeft(), xiNames);
        }
        collectVariables(lConnective.getRight(), xiNames);
        break;

      default:
        throw new FormulaConversionException("Truth tables need a propositional formula, but found " +
                                             xiFormula.getKind() + ": " + xiFormula);
    }
  }

  /**
   * Evaluate a propositional formula under an assignment.  The formula must already have been checked by
   * {@link #collectVariables}.
   */
  static boolean evaluate(Formula xiFormula, Map<String, Boolean> xiAssignment)
  {
    if (xiFormula instanceof FormulaProposition)
    {
      FormulaProposition lProposition = (FormulaProposition)xiFormula;
      if (lProposition.getTruth() != null)
      {
        return lProposition.getTruth();
      }
      return xiAssignment.get(lProposition.getName());
    }

    FormulaConnective lConnective = (FormulaConnective)xiFormula;
    boolean lRight = evaluate(lConnective.getRight(), xiAssignment);
    switch (lConnective.getConnectiveKind())
    {
      case NOT:     return !lRight;
      case AND:     return evaluate(lConnective.getLeft(), xiAssignment) && lRight;
      case OR:      return evaluate(lConnective.getLeft(), xiAssignment) || lRight;
      case IMPLIES: return !evaluate(lConnective.getLeft(), xiAssignment) || lRight;
      case IFF:     return evaluate(lConnective.getLeft(), xiAssignment) == lRight;
      default:      throw new IllegalStateException("Unknown connective: " + lConnective.getConnectiveKind());
    }
  }

  public Formula getFormula()
  {
    return mFormula;
  }

  public List<String> getVariables()
  {
    return mVariables;
  }

  public List<Row> getRows()
  {
    return mRows;
  }

  /**
   * @return whether the formula is true under every assignment.
   */
  public boolean isTautology()
  {
    for (Row lRow : mRows)
    {
      if (!lRow.getValue())
      {
        return false;
      }
    }
    return true;
  }

  /**
   * @return whether the formula is true under some assignment.
   */
  public boolean isSatisfiable()
  {
    for (Row lRow : mRows)
    {
      if (lRow.getValue())
      {
        return true;
      }
    }
    return false;
  }

  public boolean isContradiction()
  {
    return !isSatisfiable();
  }
}

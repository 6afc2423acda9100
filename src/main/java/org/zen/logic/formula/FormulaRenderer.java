package org.zen.logic.formula;

import java.util.List;

import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaConnective;
import org.zen.logic.formula.grammar.FormulaEquation;
import org.zen.logic.formula.grammar.FormulaInequality;
import org.zen.logic.formula.grammar.FormulaMathFunction;
import org.zen.logic.formula.grammar.FormulaPredicate;
import org.zen.logic.formula.grammar.FormulaProofMarker;
import org.zen.logic.formula.grammar.FormulaQuantifier;
import org.zen.logic.formula.grammar.FormulaString;

/**
 * Human-readable forms of formula trees, for display and proof export only.  Nothing in the core ever parses these
 * strings back.
 */
public final class FormulaRenderer
{
  private static final String ABSENT = "?";

  private FormulaRenderer()
  {
  }

  /**
   * @return the formula in Unicode logic notation, e.g. <code>∀P (P ∨ ¬P)</code>.
   */
  public static String render(Formula xiFormula)
  {
    return (xiFormula == null) ? ABSENT : xiFormula.toString();
  }

  /**
   * @return the formula as LaTeX math-mode source.
   */
  public static String renderLatex(Formula xiFormula)
  {
    StringBuilder sb = new StringBuilder();
    appendLatex(sb, xiFormula);
    return sb.toString();
  }

  private static void appendLatex(StringBuilder xiBuilder, Formula xiFormula)
  {
    if (xiFormula == null)
    {
      xiBuilder.append(ABSENT);
      return;
    }

    switch (xiFormula.getKind())
    {
      case QUANTIFIER:
      {
        FormulaQuantifier lQuantifier = (FormulaQuantifier)xiFormula;
        xiBuilder.append(lQuantifier.getQuantifierKind().getLatex()).append(' ').append(lQuantifier.getVariable());
        if (lQuantifier.getDomain() != null)
        {
          xiBuilder.append(" \\in ");
          appendLatex(xiBuilder, lQuantifier.getDomain());
        }
        xiBuilder.append(".\\, ");
        appendLatex(xiBuilder, lQuantifier.getBody());
        break;
      }

      case CONNECTIVE:
      {
        FormulaConnective lConnective = (FormulaConnective)xiFormula;
        if (lConnective.getConnectiveKind().isUnary())
        {
          xiBuilder.append(lConnective.getConnectiveKind().getLatex()).append(' ');
          appendLatex(xiBuilder, lConnective.getRight());
        }
        else
        {
          xiBuilder.append("\\left(");
          appendLatex(xiBuilder, lConnective.getLeft());
          xiBuilder.append(' ').append(lConnective.getConnectiveKind().getLatex()).append(' ');
          appendLatex(xiBuilder, lConnective.getRight());
          xiBuilder.append("\\right)");
        }
        break;
      }

      case PREDICATE:
      {
        FormulaPredicate lPredicate = (FormulaPredicate)xiFormula;
        appendApplication(xiBuilder, "\\mathrm{" + lPredicate.getName() + "}", lPredicate.getArgs());
        break;
      }

      case MATH_FUNCTION:
      {
        FormulaMathFunction lFunction = (FormulaMathFunction)xiFormula;
        appendApplication(xiBuilder, "\\operatorname{" + lFunction.getName() + "}", lFunction.getArgs());
        break;
      }

      case EQUATION:
      {
        FormulaEquation lEquation = (FormulaEquation)xiFormula;
        appendLatex(xiBuilder, lEquation.getLeft());
        xiBuilder.append(" = ");
        appendLatex(xiBuilder, lEquation.getRight());
        break;
      }

      case INEQUALITY:
      {
        FormulaInequality lInequality = (FormulaInequality)xiFormula;
        appendLatex(xiBuilder, lInequality.getLeft());
        xiBuilder.append(' ').append(lInequality.getInequalityKind().getLatex()).append(' ');
        appendLatex(xiBuilder, lInequality.getRight());
        break;
      }

      case PROOF_MARKER:
      {
        FormulaProofMarker lMarker = (FormulaProofMarker)xiFormula;
        switch (lMarker.getMarkerKind())
        {
          case PREMISE:
            xiBuilder.append("\\text{premise}");
            break;

          case CONCLUSION:
            xiBuilder.append("\\therefore");
            break;

          default:
            xiBuilder.append("\\text{").append(lMarker.getRule().getName().replace("_", "\\_")).append("}");
            break;
        }
        if (lMarker.getStatement() != null)
        {
          xiBuilder.append("\\; ");
          appendLatex(xiBuilder, lMarker.getStatement());
        }
        break;
      }

      case STRING:
        xiBuilder.append("\\text{``").append(((FormulaString)xiFormula).getValue()).append("''}");
        break;

      default:
        // Variables, propositions and numbers render the same way in both notations.
        xiBuilder.append(xiFormula.toString());
        break;
    }
  }

  private static void appendApplication(StringBuilder xiBuilder, String xiName, List<Formula> xiArgs)
  {
    xiBuilder.append(xiName).append('(');
    for (int lii = 0; lii < xiArgs.size(); lii++)
    {
      if (lii > 0)
      {
        xiBuilder.append(", ");
      }
      appendLatex(xiBuilder, xiArgs.get(lii));
    }
    xiBuilder.append(')');
  }
}

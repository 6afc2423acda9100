package org.zen.logic.formula.grammar;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The only way to build {@link Formula} nodes.
 *
 * Children passed to a factory method become owned by the new parent.  Factory methods do not check
 * well-formedness (that is the job of the validator, so that malformed statements can be built and then rejected),
 * with one exception: a negation never has a left operand.
 */
public final class FormulaPool
{
  private FormulaPool()
  {
  }

  public static FormulaQuantifier getQuantifier(QuantifierKind xiKind,
                                                String xiVariable,
                                                Formula xiDomain,
                                                Formula xiBody)
  {
    Preconditions.checkNotNull(xiKind, "quantifier kind");
    Preconditions.checkNotNull(xiVariable, "quantified variable");
    return new FormulaQuantifier(xiKind, xiVariable, xiDomain, xiBody);
  }

  public static FormulaQuantifier getUniversal(String xiVariable, Formula xiBody)
  {
    return getQuantifier(QuantifierKind.UNIVERSAL, xiVariable, null, xiBody);
  }

  public static FormulaQuantifier getExistential(String xiVariable, Formula xiBody)
  {
    return getQuantifier(QuantifierKind.EXISTENTIAL, xiVariable, null, xiBody);
  }

  /**
   * Build a connective.
   *
   * @param xiKind - the connective.
   * @param xiLeft - the left operand, which must be null for {@link ConnectiveKind#NOT}.
   * @param xiRight - the right operand.
   *
   * @throws IllegalArgumentException if a negation is given a left operand.
   */
  public static FormulaConnective getConnective(ConnectiveKind xiKind, Formula xiLeft, Formula xiRight)
  {
    Preconditions.checkNotNull(xiKind, "connective kind");
    Preconditions.checkArgument(!(xiKind.isUnary() && (xiLeft != null)), "Negation takes no left operand");
    return new FormulaConnective(xiKind, xiLeft, xiRight);
  }

  public static FormulaConnective getNot(Formula xiOperand)
  {
    return getConnective(ConnectiveKind.NOT, null, xiOperand);
  }

  public static FormulaConnective getAnd(Formula xiLeft, Formula xiRight)
  {
    return getConnective(ConnectiveKind.AND, xiLeft, xiRight);
  }

  public static FormulaConnective getOr(Formula xiLeft, Formula xiRight)
  {
    return getConnective(ConnectiveKind.OR, xiLeft, xiRight);
  }

  public static FormulaConnective getImplies(Formula xiLeft, Formula xiRight)
  {
    return getConnective(ConnectiveKind.IMPLIES, xiLeft, xiRight);
  }

  public static FormulaConnective getIff(Formula xiLeft, Formula xiRight)
  {
    return getConnective(ConnectiveKind.IFF, xiLeft, xiRight);
  }

  public static FormulaPredicate getPredicate(String xiName, List<? extends Formula> xiArgs)
  {
    Preconditions.checkNotNull(xiName, "predicate name");
    return new FormulaPredicate(xiName, freeze(xiArgs));
  }

  public static FormulaPredicate getPredicate(String xiName, Formula... xiArgs)
  {
    return getPredicate(xiName, Arrays.asList(xiArgs));
  }

  public static FormulaVariable getVariable(String xiName, boolean xiBound)
  {
    Preconditions.checkNotNull(xiName, "variable name");
    return new FormulaVariable(xiName, xiBound);
  }

  public static FormulaProposition getProposition(String xiName)
  {
    return getProposition(xiName, null);
  }

  /**
   * @param xiName - the name.
   * @param xiTruth - the fixed truth value, or null.
   */
  public static FormulaProposition getProposition(String xiName, Boolean xiTruth)
  {
    Preconditions.checkNotNull(xiName, "proposition name");
    return new FormulaProposition(xiName, xiTruth);
  }

  public static FormulaEquation getEquation(Formula xiLeft, Formula xiRight)
  {
    return new FormulaEquation(xiLeft, xiRight);
  }

  public static FormulaInequality getInequality(InequalityKind xiKind, Formula xiLeft, Formula xiRight)
  {
    Preconditions.checkNotNull(xiKind, "inequality kind");
    return new FormulaInequality(xiKind, xiLeft, xiRight);
  }

  public static FormulaMathFunction getMathFunction(String xiName, List<? extends Formula> xiArgs)
  {
    Preconditions.checkNotNull(xiName, "function name");
    return new FormulaMathFunction(xiName, freeze(xiArgs));
  }

  public static FormulaMathFunction getMathFunction(String xiName, Formula... xiArgs)
  {
    return getMathFunction(xiName, Arrays.asList(xiArgs));
  }

  public static FormulaProofMarker getPremise()
  {
    return getPremise(null);
  }

  /**
   * @param xiStatement - the statement assumed by this premise, or null.
   */
  public static FormulaProofMarker getPremise(Formula xiStatement)
  {
    return new FormulaProofMarker(MarkerKind.PREMISE, null, Collections.<Formula>emptyList(), xiStatement);
  }

  public static FormulaProofMarker getConclusion()
  {
    return getConclusion(null);
  }

  /**
   * @param xiStatement - the statement concluded, or null.
   */
  public static FormulaProofMarker getConclusion(Formula xiStatement)
  {
    return new FormulaProofMarker(MarkerKind.CONCLUSION, null, Collections.<Formula>emptyList(), xiStatement);
  }

  public static FormulaProofMarker getInferenceStep(InferenceRuleKind xiRule, List<? extends Formula> xiPremises)
  {
    return getInferenceStep(xiRule, xiPremises, null);
  }

  public static FormulaProofMarker getInferenceStep(InferenceRuleKind xiRule, Formula... xiPremises)
  {
    return getInferenceStep(xiRule, Arrays.asList(xiPremises), null);
  }

  /**
   * @param xiRule - the licensing rule.
   * @param xiPremises - the formulas the rule is applied to.
   * @param xiStatement - the statement derived, or null.
   */
  public static FormulaProofMarker getInferenceStep(InferenceRuleKind xiRule,
                                                    List<? extends Formula> xiPremises,
                                                    Formula xiStatement)
  {
    Preconditions.checkNotNull(xiRule, "inference rule");
    return new FormulaProofMarker(MarkerKind.INFERENCE_STEP, xiRule, freeze(xiPremises), xiStatement);
  }

  public static FormulaNumber getNumber(double xiValue)
  {
    return new FormulaNumber(xiValue);
  }

  public static FormulaString getString(String xiValue)
  {
    Preconditions.checkNotNull(xiValue, "string literal");
    return new FormulaString(xiValue);
  }

  /**
   * @return a deep copy of the specified tree, or null if it is null.
   *
   * @param xiFormula - the tree to copy.
   */
  public static Formula copy(Formula xiFormula)
  {
    return Formula.copyOf(xiFormula);
  }

  /**
   * Copy an argument list into an unmodifiable one.
   *
   * @throws NullPointerException if the list contains a null argument.
   */
  static List<Formula> freeze(List<? extends Formula> xiArgs)
  {
    if (xiArgs == null)
    {
      return ImmutableList.of();
    }
    return ImmutableList.copyOf(xiArgs);
  }

  static boolean allGround(List<Formula> xiArgs)
  {
    for (Formula lArg : xiArgs)
    {
      if (!lArg.isGround())
      {
        return false;
      }
    }

    return true;
  }

  static String application(String xiName, List<Formula> xiArgs)
  {
    StringBuilder sb = new StringBuilder();

    sb.append(xiName).append("(");
    for (int lii = 0; lii < xiArgs.size(); lii++)
    {
      if (lii > 0)
      {
        sb.append(", ");
      }
      sb.append(xiArgs.get(lii));
    }
    sb.append(")");

    return sb.toString();
  }
}

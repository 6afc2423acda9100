package org.zen.logic.prover;

import java.util.List;

import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.InferenceRuleKind;

/**
 * A sound inference rule, applied directly to formula trees.
 *
 * Implementations are pure: they never modify their premises and the derived formula never shares a node with them.
 */
public interface InferenceRule
{
  /**
   * @return the tag under which this rule is dispatched.
   */
  public InferenceRuleKind getKind();

  /**
   * @return the number of premises the rule consumes.
   */
  public int getArity();

  /**
   * Apply the rule.
   *
   * @param xiPremises - the premises, in the order the rule defines.
   * @return the derived formula, or null if the premises do not have the shape the rule requires.
   */
  public Formula apply(List<Formula> xiPremises);
}

package org.zen.logic.prover;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.zen.logic.formula.FormulaValidator;
import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaProofMarker;
import org.zen.logic.formula.grammar.InferenceRuleKind;
import org.zen.logic.formula.grammar.MarkerKind;

/**
 * Dispatches inference-rule applications by rule tag.
 *
 * Every premise must be a well-formed statement; if any is not, no rule applies.  Unknown rule tags never match.
 */
public class InferenceEngine
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final Map<InferenceRuleKind, InferenceRule> mRules = new EnumMap<>(InferenceRuleKind.class);

  /**
   * Create an engine with the standard rule set: modus ponens, modus tollens, universal instantiation and axiom
   * application.
   */
  public InferenceEngine()
  {
    this(Arrays.<InferenceRule>asList(new ModusPonens(),
                                      new ModusTollens(),
                                      new UniversalInstantiation(),
                                      new AxiomApplication()));
  }

  /**
   * Create an engine with a specific rule set.
   *
   * @param xiRules - the rules.  A later rule replaces an earlier one with the same tag.
   */
  public InferenceEngine(Collection<? extends InferenceRule> xiRules)
  {
    for (InferenceRule lRule : xiRules)
    {
      if (lRule.getKind() == InferenceRuleKind.UNKNOWN)
      {
        throw new IllegalArgumentException("Cannot register a rule under the UNKNOWN tag");
      }
      mRules.put(lRule.getKind(), lRule);
    }
  }

  /**
   * @return whether the engine implements the specified rule.
   */
  public boolean supports(InferenceRuleKind xiKind)
  {
    return (xiKind != null) && mRules.containsKey(xiKind);
  }

  /**
   * Apply a rule.
   *
   * @param xiKind - the rule tag.
   * @param xiPremises - the premises.
   *
   * @return the derived formula, or null if the rule is unknown or does not apply to the premises.
   */
  public Formula apply(InferenceRuleKind xiKind, List<Formula> xiPremises)
  {
    InferenceRule lRule = (xiKind == null) ? null : mRules.get(xiKind);
    if (lRule == null)
    {
      LOGGER.debug("No rule registered for " + xiKind);
      return null;
    }

    if ((xiPremises == null) || (xiPremises.size() != lRule.getArity()))
    {
      return null;
    }

    for (Formula lPremise : xiPremises)
    {
      if (!FormulaValidator.validate(lPremise))
      {
        LOGGER.debug("Refusing to apply " + xiKind + " to malformed premise " + lPremise);
        return null;
      }
    }

    Formula lDerived = lRule.apply(Collections.unmodifiableList(xiPremises));
    if (LOGGER.isDebugEnabled())
    {
      LOGGER.debug(xiKind + " " + xiPremises + (lDerived == null ? " does not apply" : " ⊢ " + lDerived));
    }
    return lDerived;
  }

  /**
   * Apply an inference-step marker's own rule to its own premises.
   *
   * @param xiStep - the step.
   * @return the derived formula, or null if the marker is not an inference step or its rule does not apply.
   */
  public Formula applyStep(FormulaProofMarker xiStep)
  {
    if ((xiStep == null) || (xiStep.getMarkerKind() != MarkerKind.INFERENCE_STEP))
    {
      return null;
    }
    return apply(xiStep.getRule(), xiStep.getPremises());
  }

  public Formula modusPonens(Formula xiConditional, Formula xiAntecedent)
  {
    return apply(InferenceRuleKind.MODUS_PONENS, Arrays.asList(xiConditional, xiAntecedent));
  }

  public Formula modusTollens(Formula xiConditional, Formula xiNegatedConsequent)
  {
    return apply(InferenceRuleKind.MODUS_TOLLENS, Arrays.asList(xiConditional, xiNegatedConsequent));
  }

  public Formula universalInstantiation(Formula xiUniversal, Formula xiInstance)
  {
    return apply(InferenceRuleKind.UNIVERSAL_INSTANTIATION, Arrays.asList(xiUniversal, xiInstance));
  }

  public Formula applyAxiom(Formula xiAxiomStatement)
  {
    return apply(InferenceRuleKind.AXIOM, Collections.singletonList(xiAxiomStatement));
  }
}

package org.zen.logic.verifier;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.zen.logic.formula.FormulaValidator;
import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaKind;
import org.zen.logic.formula.grammar.FormulaPool;
import org.zen.logic.formula.grammar.FormulaProofMarker;
import org.zen.logic.formula.grammar.InferenceRuleKind;
import org.zen.logic.prover.InferenceEngine;
import org.zen.logic.util.config.LogicConfiguration;
import org.zen.logic.util.config.LogicConfiguration.CfgItem;

/**
 * Drives {@link Proof}s through their {@link ProofState}s.
 *
 * A step list is valid when it contains at least one premise marker, at least one inference step licensed by a rule
 * the engine implements, at least one conclusion marker, and every step that is not a marker is a well-formed
 * formula.  Null steps are ignored.  Inference steps are checked for their rule only; the rule is not re-applied.
 *
 * Verification is timed.  Slow verifications are logged but never fail.
 */
public class ProofVerifier
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Name of the proposition used as the justification of a step that doesn't supply one.
   */
  public static final String DEFAULT_JUSTIFICATION = "assumed";

  private final InferenceEngine mEngine;

  public ProofVerifier()
  {
    this(new InferenceEngine());
  }

  /**
   * @param xiEngine - the engine whose rule set licenses inference steps.
   */
  public ProofVerifier(InferenceEngine xiEngine)
  {
    mEngine = xiEngine;
  }

  public InferenceEngine getEngine()
  {
    return mEngine;
  }

  /**
   * @return a fresh default justification.
   */
  public static Formula defaultJustification()
  {
    return FormulaPool.getProposition(DEFAULT_JUSTIFICATION);
  }

  /**
   * Check a step list, without touching any proof.
   *
   * @param xiSteps - the steps.
   * @return whether the steps form a valid proof.
   */
  public boolean isValidStepSequence(List<? extends Formula> xiSteps)
  {
    if ((xiSteps == null) || xiSteps.isEmpty())
    {
      return false;
    }

    boolean lHasPremise = false;
    boolean lHasInference = false;
    boolean lHasConclusion = false;

    for (Formula lStep : xiSteps)
    {
      if (lStep == null)
      {
        continue;
      }

      if (lStep.getKind() != FormulaKind.PROOF_MARKER)
      {
        if (!FormulaValidator.validate(lStep))
        {
          LOGGER.debug("Malformed proof step: " + lStep);
          return false;
        }
        continue;
      }

      FormulaProofMarker lMarker = (FormulaProofMarker)lStep;
      switch (lMarker.getMarkerKind())
      {
        case PREMISE:
          lHasPremise = true;
          break;

        case CONCLUSION:
          lHasConclusion = true;
          break;

        case INFERENCE_STEP:
          if (isLicensed(lMarker.getRule()))
          {
            lHasInference = true;
          }
          break;

        default:
          throw new IllegalStateException("Unexpected marker kind: " + lMarker.getMarkerKind());
      }
    }

    return lHasPremise && lHasInference && lHasConclusion;
  }

  private boolean isLicensed(InferenceRuleKind xiRule)
  {
    return (xiRule != null) && xiRule.isSound() && mEngine.supports(xiRule);
  }

  /**
   * Replace a proof's steps and verify them.
   *
   * @param xiProof - the proof.
   * @param xiSteps - the new steps.  Must not be empty.
   * @param xiJustifications - per-step justifications, or null.  Missing or null entries get the default
   *                           justification.
   *
   * @return whether the proof is valid.
   */
  public boolean verify(Proof xiProof, List<? extends Formula> xiSteps, List<? extends Formula> xiJustifications)
  {
    if ((xiJustifications != null) && (xiJustifications.size() > xiSteps.size()))
    {
      throw new IllegalArgumentException("More justifications (" + xiJustifications.size() + ") than steps (" +
                                         xiSteps.size() + ")");
    }

    List<Formula> lJustifications = new ArrayList<>(xiSteps.size());
    for (int lii = 0; lii < xiSteps.size(); lii++)
    {
      Formula lJustification = null;
      if ((xiJustifications != null) && (lii < xiJustifications.size()))
      {
        lJustification = xiJustifications.get(lii);
      }
      lJustifications.add(lJustification == null ? defaultJustification() : lJustification);
    }

    xiProof.replaceSteps(new ArrayList<Formula>(xiSteps), lJustifications);
    return reverify(xiProof);
  }

  /**
   * Verify a proof's current steps.
   *
   * @param xiProof - the proof.
   * @return whether the proof is valid.
   */
  public boolean reverify(Proof xiProof)
  {
    long lStart = System.nanoTime();
    boolean lValid = isValidStepSequence(xiProof.getSteps());
    long lElapsed = System.nanoTime() - lStart;

    xiProof.recordVerification(lValid, lElapsed);

    long lTargetMillis = LogicConfiguration.getCfgInt(CfgItem.VERIFICATION_TARGET_MILLIS);
    if (lElapsed > TimeUnit.MILLISECONDS.toNanos(lTargetMillis))
    {
      LOGGER.warn("Verification of " + xiProof.getTheoremName() + " took " +
                  TimeUnit.NANOSECONDS.toMillis(lElapsed) + "ms (target " + lTargetMillis + "ms)");
    }

    LOGGER.debug("Verified " + xiProof + " in " + lElapsed + "ns");
    return lValid;
  }

  /**
   * Append a step to a proof.  The proof drops back to {@link ProofState#ACCUMULATING}.
   *
   * @param xiProof - the proof.
   * @param xiStep - the step.
   * @param xiJustification - its justification, or null for the default.
   *
   * @return whether the step is plausible: the first step always is; later steps are when they are proof markers or
   * well-formed formulas.
   */
  public boolean appendStep(Proof xiProof, Formula xiStep, Formula xiJustification)
  {
    boolean lFirst = (xiProof.getStepCount() == 0);
    xiProof.appendStep(xiStep, xiJustification == null ? defaultJustification() : xiJustification);

    if (lFirst)
    {
      return true;
    }

    return (xiStep != null) &&
           ((xiStep.getKind() == FormulaKind.PROOF_MARKER) || FormulaValidator.validate(xiStep));
  }
}

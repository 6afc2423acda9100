package org.zen.logic.formula.grammar;

/**
 * Role of a {@link FormulaProofMarker} within a proof.
 */
public enum MarkerKind
{
  PREMISE,
  CONCLUSION,
  INFERENCE_STEP
}

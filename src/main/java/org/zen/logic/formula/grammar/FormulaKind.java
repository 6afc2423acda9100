package org.zen.logic.formula.grammar;

/**
 * Variant tag of a {@link Formula} node.
 */
public enum FormulaKind
{
  QUANTIFIER,
  CONNECTIVE,
  PREDICATE,
  VARIABLE,
  PROPOSITION,
  EQUATION,
  INEQUALITY,
  MATH_FUNCTION,
  PROOF_MARKER,
  NUMBER,
  STRING
}

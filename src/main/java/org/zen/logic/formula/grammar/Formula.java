package org.zen.logic.formula.grammar;

import java.io.Serializable;

/**
 * Class at the root of the formula hierarchy.  Every logical statement handled by the theorem-proving core (axioms,
 * theorem statements, hypotheses, proof steps and justifications) is represented by a tree of objects from this
 * hierarchy - never by a string.
 *
 * <h1>The formula hierarchy</h1>
 *
 * <ul>
 *
 * <li><b>Quantifier</b>: binds a named <i>variable</i> over an optional <i>domain</i> and applies it to a
 *     <i>body</i>.  Either universal (for all) or existential (there exists).
 *
 * <li><b>Connective</b>: combines one or two formulas.  <i>and</i>, <i>or</i>, <i>implies</i> and <i>iff</i> take a
 *     left and a right operand; <i>not</i> only takes a right operand.
 *
 * <li><b>Predicate</b>: a named relation applied to an ordered list of argument formulas, e.g. <code>P(x, y)</code>.
 *
 * <li><b>Proposition</b>: a named atomic statement, optionally with a fixed truth value.
 *
 * <li><b>Variable</b>: a named variable, either bound by an enclosing quantifier or free.
 *
 * <li><b>Equation</b>, <b>Inequality</b> and <b>Math function</b>: the basic mathematical relations and terms that
 *     can appear inside a statement.
 *
 * <li><b>Proof marker</b>: tags a proof step as a <i>premise</i>, a <i>conclusion</i> or an <i>inference step</i>.
 *     Inference steps name the rule that licenses them and carry the premises the rule is applied to.
 *
 * <li><b>Number</b> and <b>String</b>: literal leaves used as arguments.
 *
 * </ul>
 *
 * <h1>Ownership</h1>
 *
 * Each node is exclusively owned by its parent: a tree never shares a subtree with another tree and never contains
 * a cycle.  Nodes are built through {@link FormulaPool}, are immutable once built, and a node handed to a factory
 * method belongs to the constructed parent from then on.  Use {@link #deepCopy()} to obtain an independent tree.
 */
@SuppressWarnings("serial")
public abstract class Formula implements Serializable
{
  /**
   * @return the variant tag of this node.
   */
  public abstract FormulaKind getKind();

  /**
   * @return a deep copy of this tree.  No node of the copy is shared with this tree.
   */
  public abstract Formula deepCopy();

  /**
   * @return whether this formula is free of unbound variables.
   */
  public abstract boolean isGround();

  @Override
  public abstract String toString();

  /**
   * Deep-copy a possibly absent child.
   */
  static Formula copyOf(Formula xiFormula)
  {
    return (xiFormula == null) ? null : xiFormula.deepCopy();
  }

  static boolean isGround(Formula xiFormula)
  {
    return (xiFormula == null) || xiFormula.isGround();
  }
}

package org.zen.logic.formula;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;
import org.zen.logic.formula.grammar.ConnectiveKind;
import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaPool;
import org.zen.logic.formula.grammar.InequalityKind;
import org.zen.logic.formula.grammar.InferenceRuleKind;

public class FormulaValidatorTest
{
  @Test
  public void testWellFormed()
  {
    assertTrue(FormulaValidator.validate(FormulaPool.getProposition("P")));
    assertTrue(FormulaValidator.validate(FormulaPool.getVariable("x", false)));
    assertTrue(FormulaValidator.validate(FormulaPool.getPredicate("Even")));
    assertTrue(FormulaValidator.validate(FormulaPool.getNot(FormulaPool.getProposition("P"))));
    assertTrue(FormulaValidator.validate(FormulaPool.getImplies(FormulaPool.getProposition("P"),
                                                                FormulaPool.getProposition("Q"))));
    assertTrue(FormulaValidator.validate(FormulaPool.getUniversal("x", FormulaPool.getProposition("P"))));
    assertTrue(FormulaValidator.validate(FormulaPool.getEquation(FormulaPool.getNumber(1), FormulaPool.getNumber(1))));
    assertTrue(FormulaValidator.validate(FormulaPool.getInequality(InequalityKind.GE,
                                                                   FormulaPool.getNumber(2),
                                                                   FormulaPool.getNumber(1))));
    assertTrue(FormulaValidator.validate(FormulaPool.getMathFunction("sin", FormulaPool.getNumber(0))));
  }

  @Test
  public void testQuantifierWithEmptyVariableIsMalformed()
  {
    assertFalse(FormulaValidator.validate(FormulaPool.getUniversal("", FormulaPool.getProposition("P"))));
  }

  @Test
  public void testMissingOperands()
  {
    assertFalse(FormulaValidator.validate(null));
    assertFalse(FormulaValidator.validate(FormulaPool.getUniversal("x", null)));
    assertFalse(FormulaValidator.validate(FormulaPool.getNot(null)));
    assertFalse(FormulaValidator.validate(FormulaPool.getConnective(ConnectiveKind.AND,
                                                                    FormulaPool.getProposition("P"),
                                                                    null)));
    assertFalse(FormulaValidator.validate(FormulaPool.getConnective(ConnectiveKind.OR,
                                                                    null,
                                                                    FormulaPool.getProposition("P"))));
    assertFalse(FormulaValidator.validate(FormulaPool.getEquation(FormulaPool.getNumber(1), null)));
    assertFalse(FormulaValidator.validate(FormulaPool.getPredicate("")));
    assertFalse(FormulaValidator.validate(FormulaPool.getMathFunction("")));
  }

  @Test
  public void testMarkersAndLiteralsAreNotStatements()
  {
    assertFalse(FormulaValidator.validate(FormulaPool.getPremise(FormulaPool.getProposition("P"))));
    assertFalse(FormulaValidator.validate(FormulaPool.getConclusion()));
    assertFalse(FormulaValidator.validate(FormulaPool.getInferenceStep(InferenceRuleKind.AXIOM,
                                                                       FormulaPool.getProposition("P"))));
    assertFalse(FormulaValidator.validate(FormulaPool.getNumber(1)));
    assertFalse(FormulaValidator.validate(FormulaPool.getString("P")));
  }

  @Test
  public void testValidateAll()
  {
    assertTrue(FormulaValidator.validateAll(Collections.<Formula>emptyList()));
    assertTrue(FormulaValidator.validateAll(Arrays.<Formula>asList(FormulaPool.getProposition("P"))));
    assertFalse(FormulaValidator.validateAll(Arrays.<Formula>asList(FormulaPool.getProposition("P"),
                                                                    FormulaPool.getNumber(1))));
  }
}

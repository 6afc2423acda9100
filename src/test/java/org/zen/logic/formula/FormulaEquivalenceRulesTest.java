package org.zen.logic.formula;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;
import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaPool;

public class FormulaEquivalenceRulesTest
{
  @Test
  public void testTruthValueIgnored()
  {
    assertTrue(FormulaEquivalence.equivalent(FormulaPool.getProposition("P", true),
                                             FormulaPool.getProposition("P", false)));
    assertTrue(FormulaEquivalence.equivalent(FormulaPool.getProposition("P", null),
                                             FormulaPool.getProposition("P", true)));
  }

  @Test
  public void testBoundFlagMatters()
  {
    assertFalse(FormulaEquivalence.equivalent(FormulaPool.getVariable("x", true),
                                              FormulaPool.getVariable("x", false)));
  }

  @Test
  public void testNoAlphaRenaming()
  {
    Formula lForallX = FormulaPool.getUniversal("x", FormulaPool.getPredicate("P", FormulaPool.getVariable("x", true)));
    Formula lForallY = FormulaPool.getUniversal("y", FormulaPool.getPredicate("P", FormulaPool.getVariable("y", true)));
    assertFalse(FormulaEquivalence.equivalent(lForallX, lForallY));
  }

  @Test
  public void testArgumentOrderMatters()
  {
    Formula lAB = FormulaPool.getPredicate("R", FormulaPool.getString("a"), FormulaPool.getString("b"));
    Formula lBA = FormulaPool.getPredicate("R", FormulaPool.getString("b"), FormulaPool.getString("a"));
    Formula lA = FormulaPool.getPredicate("R", FormulaPool.getString("a"));
    assertFalse(FormulaEquivalence.equivalent(lAB, lBA));
    assertFalse(FormulaEquivalence.equivalent(lAB, lA));
  }

  @Test
  public void testConnectivesAreNotCommutative()
  {
    assertFalse(FormulaEquivalence.equivalent(FormulaPool.getAnd(FormulaPool.getProposition("P"),
                                                                 FormulaPool.getProposition("Q")),
                                              FormulaPool.getAnd(FormulaPool.getProposition("Q"),
                                                                 FormulaPool.getProposition("P"))));
  }

  @Test
  public void testContainsEquivalent()
  {
    assertTrue(FormulaEquivalence.containsEquivalent(Arrays.<Formula>asList(FormulaPool.getProposition("A"),
                                                                            FormulaPool.getProposition("B")),
                                                     FormulaPool.getProposition("B")));
    assertFalse(FormulaEquivalence.containsEquivalent(Arrays.<Formula>asList(FormulaPool.getProposition("A")),
                                                      FormulaPool.getProposition("B")));
  }
}

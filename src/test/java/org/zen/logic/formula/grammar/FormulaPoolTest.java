package org.zen.logic.formula.grammar;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;
import org.zen.logic.formula.FormulaEquivalence;

public class FormulaPoolTest
{
  @Test
  public void testRendering()
  {
    Formula lExcludedMiddle = FormulaPool.getUniversal("P",
                                                       FormulaPool.getOr(FormulaPool.getProposition("P"),
                                                                         FormulaPool.getNot(
                                                                           FormulaPool.getProposition("P"))));
    assertEquals("∀P (P ∨ ¬P)", lExcludedMiddle.toString());

    Formula lPredicate = FormulaPool.getPredicate("Loves", FormulaPool.getVariable("x", true),
                                                           FormulaPool.getString("juliet"));
    assertEquals("Loves(x, \"juliet\")", lPredicate.toString());

    assertEquals("3", FormulaPool.getNumber(3).toString());
    assertEquals("2.5", FormulaPool.getNumber(2.5).toString());
    assertEquals("by modus_ponens [(P → Q); P]: Q",
                 FormulaPool.getInferenceStep(InferenceRuleKind.MODUS_PONENS,
                                              listOf(FormulaPool.getImplies(FormulaPool.getProposition("P"),
                                                                            FormulaPool.getProposition("Q")),
                                                     FormulaPool.getProposition("P")),
                                              FormulaPool.getProposition("Q")).toString());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegationRejectsLeftOperand()
  {
    FormulaPool.getConnective(ConnectiveKind.NOT, FormulaPool.getProposition("P"), FormulaPool.getProposition("Q"));
  }

  @Test
  public void testNegationHasNoLeftOperand()
  {
    FormulaConnective lNot = FormulaPool.getNot(FormulaPool.getProposition("P"));
    assertTrue(lNot.is(ConnectiveKind.NOT));
    assertNull(lNot.getLeft());
    assertEquals("P", lNot.getRight().toString());
  }

  @Test
  public void testArgumentListsAreCopied()
  {
    List<Formula> lArgs = new ArrayList<>();
    lArgs.add(FormulaPool.getVariable("x", false));
    FormulaPredicate lPredicate = FormulaPool.getPredicate("Even", lArgs);

    lArgs.add(FormulaPool.getVariable("y", false));
    assertEquals(1, lPredicate.arity());

    try
    {
      lPredicate.getArgs().add(FormulaPool.getVariable("z", false));
      fail("Argument list should be unmodifiable");
    }
    catch (UnsupportedOperationException lEx)
    {
      // Expected.
    }
  }

  @Test
  public void testDeepCopy()
  {
    Formula lOriginal = FormulaPool.getExistential("x",
                                                   FormulaPool.getAnd(FormulaPool.getPredicate("Prime",
                                                                                               FormulaPool.getVariable("x", true)),
                                                                      FormulaPool.getInequality(InequalityKind.GT,
                                                                                                FormulaPool.getVariable("x", true),
                                                                                                FormulaPool.getNumber(2))));
    Formula lCopy = FormulaPool.copy(lOriginal);

    assertNotSame(lOriginal, lCopy);
    assertNotSame(((FormulaQuantifier)lOriginal).getBody(), ((FormulaQuantifier)lCopy).getBody());
    assertTrue(FormulaEquivalence.equivalent(lOriginal, lCopy));
    assertEquals(lOriginal.toString(), lCopy.toString());
    assertNull(FormulaPool.copy(null));
  }

  @Test
  public void testProofMarkers()
  {
    FormulaProofMarker lPremise = FormulaPool.getPremise();
    assertEquals(MarkerKind.PREMISE, lPremise.getMarkerKind());
    assertNull(lPremise.getRule());
    assertTrue(lPremise.getPremises().isEmpty());
    assertNull(lPremise.getStatement());

    FormulaProofMarker lStep = FormulaPool.getInferenceStep(InferenceRuleKind.AXIOM, FormulaPool.getProposition("A"));
    assertEquals(MarkerKind.INFERENCE_STEP, lStep.getMarkerKind());
    assertSame(InferenceRuleKind.AXIOM, lStep.getRule());
    assertEquals(1, lStep.getPremises().size());
  }

  @Test
  public void testGround()
  {
    assertTrue(FormulaPool.getProposition("P").isGround());
    assertTrue(FormulaPool.getVariable("x", true).isGround());
    assertFalse(FormulaPool.getVariable("x", false).isGround());
    assertFalse(FormulaPool.getPredicate("Even", FormulaPool.getVariable("x", false)).isGround());
    assertTrue(FormulaPool.getPredicate("Even", FormulaPool.getNumber(4)).isGround());
  }

  @Test
  public void testRuleNames()
  {
    assertSame(InferenceRuleKind.MODUS_TOLLENS, InferenceRuleKind.fromName("modus_tollens"));
    assertSame(InferenceRuleKind.UNKNOWN, InferenceRuleKind.fromName("resolution"));
    assertFalse(InferenceRuleKind.UNKNOWN.isSound());
  }

  private static List<Formula> listOf(Formula... xiFormulas)
  {
    List<Formula> lList = new ArrayList<>();
    for (Formula lFormula : xiFormulas)
    {
      lList.add(lFormula);
    }
    return lList;
  }
}

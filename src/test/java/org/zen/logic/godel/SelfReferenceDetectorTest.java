package org.zen.logic.godel;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.zen.logic.formula.FormulaEquivalence;
import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaPool;

public class SelfReferenceDetectorTest
{
  private static Formula g()
  {
    return FormulaPool.getPredicate("G");
  }

  @Test
  public void testUnprovabilityClaim()
  {
    Formula lStatement = FormulaPool.getNot(FormulaPool.getPredicate("Provable", g()));
    Undecidable lResult = SelfReferenceDetector.detect(lStatement);

    assertEquals(Undecidable.Reason.UNPROVABILITY_CLAIM, lResult.getReason());
    assertTrue(FormulaEquivalence.equivalent(lStatement, lResult.getStatement()));
    assertNotSame(lStatement, lResult.getStatement());
  }

  @Test
  public void testMarkerMayBePartOfName()
  {
    assertTrue(SelfReferenceDetector.isUndecidable(FormulaPool.getNot(FormulaPool.getPredicate("IsProvableIn", g()))));
    assertFalse(SelfReferenceDetector.isUndecidable(FormulaPool.getNot(FormulaPool.getPredicate("provable", g()))));
  }

  @Test
  public void testIncompletenessSchema()
  {
    Formula lTheory = FormulaPool.getVariable("T", true);
    Formula lStatement =
      FormulaPool.getUniversal("T",
                               FormulaPool.getImplies(FormulaPool.getPredicate("Consistent", lTheory),
                                                      FormulaPool.getNot(FormulaPool.getPredicate("Complete",
                                                                                                  lTheory))));

    assertEquals(Undecidable.Reason.INCOMPLETENESS_SCHEMA, SelfReferenceDetector.detect(lStatement).getReason());
  }

  @Test
  public void testOrdinaryStatements()
  {
    assertNull(SelfReferenceDetector.detect(g()));
    assertNull(SelfReferenceDetector.detect(FormulaPool.getNot(g())));
    assertNull(SelfReferenceDetector.detect(FormulaPool.getExistential("x", FormulaPool.getImplies(g(), g()))));
    assertNull(SelfReferenceDetector.detect(FormulaPool.getUniversal("x", FormulaPool.getAnd(g(), g()))));
    assertNull(SelfReferenceDetector.detect(FormulaPool.getNot(null)));
    assertNull(SelfReferenceDetector.detect(null));
  }

  @Test
  public void testOnlyTheRootIsInspected()
  {
    Formula lNested = FormulaPool.getAnd(g(), FormulaPool.getNot(FormulaPool.getPredicate("Provable", g())));
    assertFalse(SelfReferenceDetector.isUndecidable(lNested));
  }
}

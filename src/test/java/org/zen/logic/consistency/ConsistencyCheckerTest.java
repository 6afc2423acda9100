package org.zen.logic.consistency;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.zen.logic.test.FormulaFixtures.p;
import static org.zen.logic.test.FormulaFixtures.pImpliesQ;
import static org.zen.logic.test.FormulaFixtures.q;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;
import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaPool;

public class ConsistencyCheckerTest
{
  @Test
  public void testEntailmentIsMembership()
  {
    List<Formula> lPremises = Arrays.asList(pImpliesQ(), p());

    assertTrue(ConsistencyChecker.entails(lPremises, p()));
    assertTrue(ConsistencyChecker.entails(lPremises, pImpliesQ()));

    // Q follows by modus ponens, but no closure is computed.
    assertFalse(ConsistencyChecker.entails(lPremises, q()));
    assertFalse(ConsistencyChecker.entails(Collections.<Formula>emptyList(), p()));
    assertFalse(ConsistencyChecker.entails(null, p()));
  }

  @Test
  public void testNegatedConnectivesConflict()
  {
    Formula lConjunction = FormulaPool.getAnd(p(), q());
    Formula lDenial = FormulaPool.getNot(FormulaPool.getAnd(p(), q()));

    assertFalse(ConsistencyChecker.consistent(lConjunction, lDenial));
    assertFalse(ConsistencyChecker.consistent(lDenial, lConjunction));
    assertTrue(ConsistencyChecker.consistent(lConjunction, FormulaPool.getNot(pImpliesQ())));
  }

  @Test
  public void testOnlyConnectivePairsConflict()
  {
    // P is a proposition, so its negation is not caught.
    assertTrue(ConsistencyChecker.consistent(p(), FormulaPool.getNot(p())));
    assertTrue(ConsistencyChecker.consistent(null, p()));
  }

  @Test
  public void testSets()
  {
    Formula lStatement = FormulaPool.getOr(p(), q());
    List<Formula> lOthers = Arrays.asList(lStatement, pImpliesQ(), FormulaPool.getNot(FormulaPool.getOr(p(), q())));

    assertFalse(ConsistencyChecker.isConsistentWith(lStatement, lOthers));
    assertTrue(ConsistencyChecker.isConsistentWith(lStatement, lOthers.subList(0, 2)));

    assertTrue(ConsistencyChecker.isConsistent(lOthers.subList(0, 2)));
    assertFalse(ConsistencyChecker.isConsistent(lOthers));
    assertTrue(ConsistencyChecker.isConsistent(Collections.<Formula>emptyList()));
  }
}

package org.zen.logic.kb;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.zen.logic.test.FormulaFixtures.minimalProof;
import static org.zen.logic.test.FormulaFixtures.modusPonensProof;
import static org.zen.logic.test.FormulaFixtures.p;
import static org.zen.logic.test.FormulaFixtures.pImpliesQ;
import static org.zen.logic.test.FormulaFixtures.q;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.zen.logic.formula.FormulaEquivalence;
import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaPool;
import org.zen.logic.kb.exceptions.DuplicateNameException;
import org.zen.logic.kb.exceptions.EmptyProofException;
import org.zen.logic.kb.exceptions.InvalidProofException;
import org.zen.logic.kb.exceptions.InvalidStatementException;
import org.zen.logic.kb.exceptions.LogicErrorCode;
import org.zen.logic.kb.exceptions.NotConfirmedException;
import org.zen.logic.kb.exceptions.NotFoundException;
import org.zen.logic.kb.exceptions.SystemNotInitializedException;
import org.zen.logic.util.config.LogicConfiguration;
import org.zen.logic.util.config.LogicConfiguration.CfgItem;
import org.zen.logic.verifier.ExportFormat;
import org.zen.logic.verifier.Proof;
import org.zen.logic.verifier.ProofState;

public class LogicSystemTest
{
  private LogicSystem mSystem;

  @Before
  public void setUp()
  {
    mSystem = new LogicSystem();
    mSystem.init();
  }

  @After
  public void tearDown()
  {
    mSystem.cleanup();
    LogicConfiguration.utOverrideCfgVal(CfgItem.SEED_FOUNDATIONAL_AXIOMS, null);
  }

  @Test
  public void testUninitializedSystemRefusesWork() throws Exception
  {
    LogicSystem lSystem = new LogicSystem();
    assertFalse(lSystem.isInitialized());

    try
    {
      lSystem.defineTheorem("t", p());
      fail("Defined a theorem before init");
    }
    catch (SystemNotInitializedException lEx)
    {
      assertEquals(LogicErrorCode.SYSTEM_NOT_INIT, lEx.getErrorCode());
    }

    try
    {
      lSystem.getStatistics();
      fail("Read statistics before init");
    }
    catch (SystemNotInitializedException lEx)
    {
      // Expected
    }
  }

  @Test
  public void testInitSeedsFoundationalAxioms() throws Exception
  {
    List<Axiom> lAxioms = mSystem.listAxioms();
    assertEquals(2, lAxioms.size());
    assertEquals(LogicSystem.EXCLUDED_MIDDLE, lAxioms.get(0).getName());
    assertEquals(LogicSystem.NON_CONTRADICTION, lAxioms.get(1).getName());
    assertTrue(lAxioms.get(0).isFoundational());
    assertTrue(lAxioms.get(0).isConsistent());
    assertEquals("∀P (P ∨ ¬P)", lAxioms.get(0).getStatement().toString());
  }

  @Test
  public void testInitIsIdempotent() throws Exception
  {
    mSystem.addAxiom("extra", p());
    mSystem.init();
    assertEquals(3, mSystem.listAxioms().size());
  }

  @Test
  public void testSeedingCanBeDisabled() throws Exception
  {
    LogicConfiguration.utOverrideCfgVal(CfgItem.SEED_FOUNDATIONAL_AXIOMS, "false");
    LogicSystem lSystem = new LogicSystem();
    lSystem.init();
    assertTrue(lSystem.listAxioms().isEmpty());
  }

  @Test
  public void testDefineTheorem() throws Exception
  {
    Theorem lTheorem = mSystem.defineTheorem("mp", q(), Arrays.asList(pImpliesQ(), p()), q());

    assertEquals("mp", lTheorem.getName());
    assertEquals(2, lTheorem.getHypotheses().size());
    assertTrue(FormulaEquivalence.equivalent(q(), lTheorem.getConclusion()));
    assertFalse(lTheorem.isProven());
    assertNull(lTheorem.getProof());
    assertNotNull(mSystem.getTheorem("mp"));
    assertNull(mSystem.getTheorem("other"));
  }

  @Test
  public void testDuplicateTheorem() throws Exception
  {
    mSystem.defineTheorem("t", p());
    try
    {
      mSystem.defineTheorem("t", q());
      fail("Duplicate theorem accepted");
    }
    catch (DuplicateNameException lEx)
    {
      assertEquals(LogicErrorCode.INVALID_THEOREM, lEx.getErrorCode());
      assertEquals("t", lEx.getName());
    }

    // The original is untouched.
    assertTrue(FormulaEquivalence.equivalent(p(), mSystem.getTheorem("t").getStatement()));
  }

  @Test
  public void testMalformedTheoremsRejected() throws Exception
  {
    try
    {
      mSystem.defineTheorem("t", FormulaPool.getAnd(p(), null));
      fail("Malformed statement accepted");
    }
    catch (InvalidStatementException lEx)
    {
      assertEquals(LogicErrorCode.INVALID_THEOREM, lEx.getErrorCode());
    }

    try
    {
      mSystem.defineTheorem("t", p(), Collections.<Formula>singletonList(FormulaPool.getPremise()), null);
      fail("Malformed hypothesis accepted");
    }
    catch (InvalidStatementException lEx)
    {
      assertEquals(LogicErrorCode.INVALID_THEOREM, lEx.getErrorCode());
    }

    try
    {
      mSystem.defineTheorem(" ", p());
      fail("Blank name accepted");
    }
    catch (InvalidStatementException lEx)
    {
      assertEquals(LogicErrorCode.INVALID_THEOREM, lEx.getErrorCode());
    }

    assertTrue(mSystem.listTheorems().isEmpty());
  }

  @Test
  public void testAxioms() throws Exception
  {
    Axiom lAxiom = mSystem.addAxiom("a", pImpliesQ());
    assertFalse(lAxiom.isFoundational());
    assertTrue(lAxiom.isConsistent());
    assertEquals(3, mSystem.getAxiomStatements().size());

    try
    {
      mSystem.addAxiom("a", p());
      fail("Duplicate axiom accepted");
    }
    catch (DuplicateNameException lEx)
    {
      assertEquals(LogicErrorCode.INVALID_AXIOM, lEx.getErrorCode());
    }

    try
    {
      mSystem.addAxiom("b", FormulaPool.getString("x"));
      fail("Literal accepted as an axiom");
    }
    catch (InvalidStatementException lEx)
    {
      assertEquals(LogicErrorCode.INVALID_AXIOM, lEx.getErrorCode());
    }
  }

  @Test
  public void testValidateAxiom() throws Exception
  {
    Formula lConjunction = FormulaPool.getAnd(p(), q());
    mSystem.addAxiom("both", lConjunction);
    assertTrue(mSystem.validateAxiom("both"));

    mSystem.addAxiom("neither", FormulaPool.getNot(FormulaPool.getAnd(p(), q())));
    assertFalse(mSystem.validateAxiom("neither"));
    assertFalse(mSystem.getAxiom("neither").isConsistent());
    assertFalse(mSystem.getStatistics().isConsistent());

    try
    {
      mSystem.validateAxiom("missing");
      fail("Validated a missing axiom");
    }
    catch (NotFoundException lEx)
    {
      assertEquals(LogicErrorCode.NOT_FOUND, lEx.getErrorCode());
    }
  }

  @Test
  public void testVerifyProof() throws Exception
  {
    mSystem.defineTheorem("t", q());
    assertTrue(mSystem.verifyProof("t", modusPonensProof()));

    Theorem lTheorem = mSystem.getTheorem("t");
    assertTrue(lTheorem.isProven());
    assertEquals(ProofState.VERIFIED_VALID, lTheorem.getProof().getState());
    assertTrue(mSystem.verifyTheorem("t"));
  }

  @Test
  public void testInvalidProofLeavesTheoremUnproven() throws Exception
  {
    mSystem.defineTheorem("t", q());
    assertFalse(mSystem.verifyProof("t", Collections.<Formula>singletonList(FormulaPool.getPremise())));

    assertFalse(mSystem.getTheorem("t").isProven());
    assertEquals(ProofState.VERIFIED_INVALID, mSystem.getProof("t").getState());
    assertFalse(mSystem.verifyTheorem("t"));
  }

  @Test
  public void testReverificationIsIdempotent() throws Exception
  {
    mSystem.defineTheorem("t", p());
    assertTrue(mSystem.verifyProof("t", minimalProof()));
    assertTrue(mSystem.verifyProof("t", minimalProof()));

    assertEquals(3, mSystem.getProof("t").getStepCount());
    assertEquals(1, mSystem.getStatistics().getProofCount());
    assertEquals(2, mSystem.getStatistics().getTotalVerifications());
  }

  @Test
  public void testEmptyProofChangesNothing() throws Exception
  {
    mSystem.defineTheorem("t", p());
    mSystem.verifyProof("t", minimalProof());

    try
    {
      mSystem.verifyProof("t", Collections.<Formula>emptyList());
      fail("Empty proof accepted");
    }
    catch (EmptyProofException lEx)
    {
      assertEquals(LogicErrorCode.INVALID_PROOF, lEx.getErrorCode());
    }

    assertEquals(3, mSystem.getProof("t").getStepCount());
    assertTrue(mSystem.getProof("t").isValid());
    assertEquals(1, mSystem.getStatistics().getTotalVerifications());
  }

  @Test
  public void testSurplusJustificationsChangeNothing() throws Exception
  {
    mSystem.defineTheorem("t", q());
    List<Formula> lSteps = Collections.<Formula>singletonList(FormulaPool.getPremise());
    List<Formula> lJustifications = Arrays.<Formula>asList(FormulaPool.getPremise(), FormulaPool.getPremise());

    try
    {
      mSystem.verifyProof("t", lSteps, lJustifications);
      fail("More justifications than steps accepted");
    }
    catch (InvalidProofException lEx)
    {
      assertEquals(LogicErrorCode.INVALID_PROOF, lEx.getErrorCode());
    }

    assertNull(mSystem.getProof("t"));
    assertEquals(0, mSystem.getStatistics().getProofCount());
    assertEquals(0, mSystem.getStatistics().getTotalVerifications());
  }

  @Test
  public void testExportProof() throws Exception
  {
    mSystem.defineTheorem("t", p());
    assertTrue(mSystem.verifyProof("t", minimalProof()));
    assertTrue(mSystem.exportProof("t", ExportFormat.TEXT).contains("Proof of t"));

    mSystem.reset(true);
    try
    {
      mSystem.exportProof("t", ExportFormat.TEXT);
      fail("Exported the proof of a theorem that was reset away");
    }
    catch (NotFoundException lEx)
    {
      assertEquals("t", lEx.getName());
    }
  }

  @Test(expected = NotFoundException.class)
  public void testProofOfMissingTheorem() throws Exception
  {
    mSystem.verifyProof("missing", minimalProof());
  }

  @Test
  public void testProofStepsAccumulate() throws Exception
  {
    mSystem.defineTheorem("t", p());
    for (Formula lStep : minimalProof())
    {
      assertTrue(mSystem.addProofStep("t", lStep, null));
    }

    Proof lProof = mSystem.getProof("t");
    assertEquals(ProofState.ACCUMULATING, lProof.getState());
    assertFalse(mSystem.getTheorem("t").isProven());

    // Verifying the theorem verifies the pending steps.
    assertTrue(mSystem.verifyTheorem("t"));
    assertTrue(mSystem.getTheorem("t").isProven());
    assertEquals(ProofState.VERIFIED_VALID, mSystem.getProofStatistics("t").getState());
  }

  @Test
  public void testVerifyTheoremWithoutProof() throws Exception
  {
    mSystem.defineTheorem("t", p());
    assertTrue(mSystem.verifyTheorem("t"));
    assertTrue(mSystem.storeTheorem("t"));

    try
    {
      mSystem.getProofStatistics("t");
      fail("Statistics for a missing proof");
    }
    catch (NotFoundException lEx)
    {
      assertEquals(LogicErrorCode.NOT_FOUND, lEx.getErrorCode());
    }
  }

  @Test
  public void testSnapshotsAreIndependent() throws Exception
  {
    mSystem.defineTheorem("t", p());
    mSystem.verifyProof("t", minimalProof());
    Proof lBefore = mSystem.getProof("t");

    mSystem.addProofStep("t", q(), null);

    assertEquals(3, lBefore.getStepCount());
    assertEquals(ProofState.VERIFIED_VALID, lBefore.getState());
    assertEquals(4, mSystem.getProof("t").getStepCount());
  }

  @Test
  public void testStatistics() throws Exception
  {
    mSystem.defineTheorem("a", p());
    mSystem.defineTheorem("b", q());
    mSystem.verifyProof("a", minimalProof());

    LogicSystemStatistics lStats = mSystem.getStatistics();
    assertEquals(2, lStats.getTheoremCount());
    assertEquals(2, lStats.getAxiomCount());
    assertEquals(1, lStats.getProofCount());
    assertTrue(lStats.isConsistent());
    assertEquals(1, lStats.getTotalVerifications());
    assertEquals(mSystem.getProof("a").getVerificationTime(), lStats.getTotalVerificationTime());
    assertEquals(lStats.getTotalVerificationTime(), lStats.getAverageVerificationTime(), 1e-9);
  }

  @Test
  public void testResetKeepsFoundationalAxioms() throws Exception
  {
    mSystem.defineTheorem("t", p());
    mSystem.verifyProof("t", minimalProof());
    mSystem.addAxiom("extra", q());

    try
    {
      mSystem.reset(false);
      fail("Unconfirmed reset");
    }
    catch (NotConfirmedException lEx)
    {
      assertEquals(LogicErrorCode.NONE, lEx.getErrorCode());
    }
    assertEquals(1, mSystem.listTheorems().size());

    mSystem.reset(true);

    LogicSystemStatistics lStats = mSystem.getStatistics();
    assertEquals(0, lStats.getTheoremCount());
    assertEquals(0, lStats.getProofCount());
    assertEquals(2, lStats.getAxiomCount());
    assertEquals(0, lStats.getTotalVerifications());
    assertNotNull(mSystem.getAxiom(LogicSystem.EXCLUDED_MIDDLE));
    assertNull(mSystem.getAxiom("extra"));
  }

  @Test
  public void testCleanup() throws Exception
  {
    mSystem.defineTheorem("t", p());
    mSystem.cleanup();
    assertFalse(mSystem.isInitialized());

    mSystem.init();
    assertTrue(mSystem.listTheorems().isEmpty());
    assertEquals(2, mSystem.listAxioms().size());
  }
}

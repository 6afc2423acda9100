package org.zen.logic.verifier;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.zen.logic.test.FormulaFixtures.minimalProof;
import static org.zen.logic.test.FormulaFixtures.p;

import java.util.Collections;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaPool;
import org.zen.logic.kb.LogicSystem;
import org.zen.logic.kb.exceptions.EmptyProofException;
import org.zen.logic.kb.exceptions.LogicErrorCode;
import org.zen.logic.kb.exceptions.NotFoundException;
import org.zen.logic.kb.exceptions.SystemNotInitializedException;
import org.zen.logic.kb.exceptions.VerificationTimeoutException;

public class BoundedProofVerifierTest
{
  private LogicSystem          mSystem;
  private BoundedProofVerifier mVerifier;

  @Before
  public void setUp() throws Exception
  {
    mSystem = new LogicSystem();
    mSystem.init();
    mSystem.defineTheorem("t", p());
    mVerifier = new BoundedProofVerifier(mSystem);
  }

  @After
  public void tearDown()
  {
    mVerifier.close();
    mSystem.cleanup();
  }

  @Test
  public void testOutcomes() throws Exception
  {
    assertEquals(VerificationOutcome.VALID, mVerifier.verify("t", minimalProof(), null));
    assertEquals(VerificationOutcome.INVALID,
                 mVerifier.verify("t", Collections.<Formula>singletonList(FormulaPool.getPremise()), null));
  }

  @Test
  public void testTimeout() throws Exception
  {
    VerificationOutcome lOutcome;

    // Hold the registry's lock so that the worker cannot finish.
    synchronized (mSystem)
    {
      lOutcome = mVerifier.verify("t", minimalProof(), null, 50);
    }
    assertEquals(VerificationOutcome.TIMED_OUT, lOutcome);

    // The late verification still lands.
    long lDeadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while ((mSystem.getProof("t") == null) && (System.nanoTime() < lDeadline))
    {
      Thread.sleep(10);
    }
    assertEquals(ProofState.VERIFIED_VALID, mSystem.getProof("t").getState());
  }

  @Test
  public void testDeadlineAsException() throws Exception
  {
    assertTrue(mVerifier.verifyWithin("t", minimalProof(), null, 5000));

    synchronized (mSystem)
    {
      try
      {
        mVerifier.verifyWithin("t", minimalProof(), null, 50);
        fail("Verification finished while the registry was locked");
      }
      catch (VerificationTimeoutException lEx)
      {
        assertEquals(LogicErrorCode.TIMEOUT, lEx.getErrorCode());
      }
    }
  }

  @Test(expected = NotFoundException.class)
  public void testMissingTheorem() throws Exception
  {
    mVerifier.verify("missing", minimalProof(), null);
  }

  @Test(expected = EmptyProofException.class)
  public void testEmptyProof() throws Exception
  {
    mVerifier.verify("t", Collections.<Formula>emptyList(), null);
  }

  @Test
  public void testUninitializedSystem() throws Exception
  {
    mSystem.cleanup();
    try
    {
      mVerifier.verify("t", minimalProof(), null);
    }
    catch (SystemNotInitializedException lEx)
    {
      assertFalse(mSystem.isInitialized());
      return;
    }
    throw new AssertionError("Verification ran on an uninitialized system");
  }
}

package org.zen.logic.verifier;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.kb.LogicSystem;
import org.zen.logic.kb.exceptions.InvalidProofException;
import org.zen.logic.kb.exceptions.NotFoundException;
import org.zen.logic.kb.exceptions.SystemNotInitializedException;
import org.zen.logic.kb.exceptions.VerificationTimeoutException;
import org.zen.logic.util.config.LogicConfiguration;
import org.zen.logic.util.config.LogicConfiguration.CfgItem;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Runs proof verifications against a deadline.
 *
 * Verification runs on a single daemon worker thread.  The core has no cancellation points, so a verification that
 * misses its deadline is not interrupted: it finishes in the background and updates the registry as usual.  Only the
 * caller's wait is bounded.
 */
public class BoundedProofVerifier implements AutoCloseable
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final LogicSystem     mSystem;
  private final ExecutorService mWorker;

  /**
   * @param xiSystem - the registry whose proofs to verify.
   */
  public BoundedProofVerifier(LogicSystem xiSystem)
  {
    mSystem = xiSystem;
    mWorker = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder().setNameFormat("proof-verifier-%d")
                                                                          .setDaemon(true)
                                                                          .build());
  }

  /**
   * Verify a proof, waiting no longer than the configured default timeout.
   *
   * @see #verify(String, List, List, long)
   */
  public VerificationOutcome verify(String xiTheoremName,
                                    List<? extends Formula> xiSteps,
                                    List<? extends Formula> xiJustifications)
    throws SystemNotInitializedException, NotFoundException, InvalidProofException
  {
    return verify(xiTheoremName,
                  xiSteps,
                  xiJustifications,
                  LogicConfiguration.getCfgInt(CfgItem.BOUNDED_VERIFY_TIMEOUT_MILLIS));
  }

  /**
   * Verify a proof, waiting no longer than the specified timeout.
   *
   * @param xiTheoremName - the theorem.
   * @param xiSteps - the steps.
   * @param xiJustifications - per-step justifications, or null.
   * @param xiTimeoutMillis - how long to wait for the result.
   *
   * @return whether the proof was valid, or {@link VerificationOutcome#TIMED_OUT}.
   */
  public VerificationOutcome verify(final String xiTheoremName,
                                    List<? extends Formula> xiSteps,
                                    List<? extends Formula> xiJustifications,
                                    long xiTimeoutMillis)
    throws SystemNotInitializedException, NotFoundException, InvalidProofException
  {
    // Take copies of the lists now - the caller may reuse them as soon as we return.
    final List<Formula> lSteps = (xiSteps == null) ? null : new ArrayList<Formula>(xiSteps);
    final List<Formula> lJustifications = (xiJustifications == null) ? null :
                                                                       new ArrayList<Formula>(xiJustifications);

    Future<Boolean> lFuture = mWorker.submit(new Callable<Boolean>()
    {
      @Override
      public Boolean call() throws Exception
      {
        return mSystem.verifyProof(xiTheoremName, lSteps, lJustifications);
      }
    });

    try
    {
      return VerificationOutcome.of(lFuture.get(xiTimeoutMillis, TimeUnit.MILLISECONDS));
    }
    catch (TimeoutException lEx)
    {
      LOGGER.warn("Verification of " + xiTheoremName + " did not finish within " + xiTimeoutMillis + "ms");
      return VerificationOutcome.TIMED_OUT;
    }
    catch (InterruptedException lEx)
    {
      LOGGER.warn("Interrupted waiting for verification of " + xiTheoremName);
      Thread.currentThread().interrupt();
      return VerificationOutcome.TIMED_OUT;
    }
    catch (ExecutionException lEx)
    {
      Throwable lCause = lEx.getCause();
      if (lCause instanceof SystemNotInitializedException)
      {
        throw (SystemNotInitializedException)lCause;
      }
      if (lCause instanceof NotFoundException)
      {
        throw (NotFoundException)lCause;
      }
      if (lCause instanceof InvalidProofException)
      {
        throw (InvalidProofException)lCause;
      }
      if (lCause instanceof RuntimeException)
      {
        throw (RuntimeException)lCause;
      }
      if (lCause instanceof Error)
      {
        throw (Error)lCause;
      }
      throw new IllegalStateException("Unexpected verification failure", lCause);
    }
  }

  /**
   * Verify a proof, failing if it doesn't finish in time.
   *
   * @param xiTheoremName - the theorem.
   * @param xiSteps - the steps.
   * @param xiJustifications - per-step justifications, or null.
   * @param xiTimeoutMillis - how long to wait for the result.
   *
   * @return whether the proof is valid.
   * @throws VerificationTimeoutException if the result wasn't available in time.
   */
  public boolean verifyWithin(String xiTheoremName,
                              List<? extends Formula> xiSteps,
                              List<? extends Formula> xiJustifications,
                              long xiTimeoutMillis)
    throws SystemNotInitializedException, NotFoundException, InvalidProofException, VerificationTimeoutException
  {
    VerificationOutcome lOutcome = verify(xiTheoremName, xiSteps, xiJustifications, xiTimeoutMillis);
    if (lOutcome == VerificationOutcome.TIMED_OUT)
    {
      throw new VerificationTimeoutException(xiTheoremName, xiTimeoutMillis);
    }
    return lOutcome == VerificationOutcome.VALID;
  }

  /**
   * Stop the worker.  A verification in progress is allowed to finish.
   */
  @Override
  public void close()
  {
    mWorker.shutdown();
  }
}

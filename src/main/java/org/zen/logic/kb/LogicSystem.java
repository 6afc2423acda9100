package org.zen.logic.kb;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.zen.logic.consistency.ConsistencyChecker;
import org.zen.logic.formula.FormulaValidator;
import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaPool;
import org.zen.logic.kb.exceptions.DuplicateNameException;
import org.zen.logic.kb.exceptions.EmptyProofException;
import org.zen.logic.kb.exceptions.InvalidProofException;
import org.zen.logic.kb.exceptions.InvalidStatementException;
import org.zen.logic.kb.exceptions.LogicErrorCode;
import org.zen.logic.kb.exceptions.NotConfirmedException;
import org.zen.logic.kb.exceptions.NotFoundException;
import org.zen.logic.kb.exceptions.ProofIncompleteException;
import org.zen.logic.kb.exceptions.SystemNotInitializedException;
import org.zen.logic.util.config.LogicConfiguration;
import org.zen.logic.util.config.LogicConfiguration.CfgItem;
import org.zen.logic.util.stats.SampledStatistic;
import org.zen.logic.verifier.ExportFormat;
import org.zen.logic.verifier.Proof;
import org.zen.logic.verifier.ProofExporter;
import org.zen.logic.verifier.ProofState;
import org.zen.logic.verifier.ProofVerifier;

import com.google.common.collect.ImmutableList;

/**
 * Registry of theorems, axioms and proofs.
 *
 * Every operation other than {@link #init()}, {@link #cleanup()} and {@link #isInitialized()} requires the system to
 * be initialized.  Entries are kept in the order they were added.  Formulas passed in become owned by the registry;
 * everything handed out is a snapshot, so callers can never mutate registry state.
 *
 * All operations validate their input before changing anything, so a failed operation leaves the registry as it
 * was.  Access is serialized on the instance.
 */
public class LogicSystem
{
  private static final Logger LOGGER = LogManager.getLogger();

  public static final String EXCLUDED_MIDDLE   = "law_of_excluded_middle";
  public static final String NON_CONTRADICTION = "law_of_non_contradiction";

  private final Map<String, Theorem> mTheorems = new LinkedHashMap<>();
  private final Map<String, Axiom>   mAxioms   = new LinkedHashMap<>();
  private final Map<String, Proof>   mProofs   = new LinkedHashMap<>();

  private final ProofVerifier    mVerifier;
  private final SampledStatistic mVerificationTimes = new SampledStatistic();
  private boolean                mInitialized;

  /**
   * Create an uninitialized logic system with the standard rule set.
   */
  public LogicSystem()
  {
    this(new ProofVerifier());
  }

  /**
   * Create an uninitialized logic system.
   *
   * @param xiVerifier - the verifier used for all proofs.
   */
  public LogicSystem(ProofVerifier xiVerifier)
  {
    mVerifier = xiVerifier;
  }

  /**
   * @return ∀P (P ∨ ¬P)
   */
  public static Formula excludedMiddle()
  {
    return FormulaPool.getUniversal("P", FormulaPool.getOr(FormulaPool.getProposition("P"),
                                                           FormulaPool.getNot(FormulaPool.getProposition("P"))));
  }

  /**
   * @return ∀P ¬(P ∧ ¬P)
   */
  public static Formula nonContradiction()
  {
    return FormulaPool.getUniversal("P",
                                    FormulaPool.getNot(FormulaPool.getAnd(FormulaPool.getProposition("P"),
                                                                          FormulaPool.getNot(
                                                                            FormulaPool.getProposition("P")))));
  }

  //---------------------------------------------------------------------------
  // Lifecycle
  //---------------------------------------------------------------------------

  /**
   * Initialize the system, seeding the foundational axioms (unless configured not to).  Has no effect if the system is
   * already initialized.
   */
  public synchronized void init()
  {
    if (mInitialized)
    {
      return;
    }

    LogicConfiguration.logConfig();
    seedFoundationalAxioms();
    mInitialized = true;
    LOGGER.info("Logic system initialized with " + mAxioms.size() + " axioms");
  }

  public synchronized boolean isInitialized()
  {
    return mInitialized;
  }

  /**
   * Clear all theorems and proofs, remove all but the foundational axioms and zero the statistics.
   *
   * @param xiConfirmed - must be true.
   *
   * @throws NotConfirmedException if the reset wasn't confirmed.
   */
  public synchronized void reset(boolean xiConfirmed) throws SystemNotInitializedException, NotConfirmedException
  {
    checkInitialized();
    if (!xiConfirmed)
    {
      throw new NotConfirmedException("Reset");
    }

    mTheorems.clear();
    mProofs.clear();

    Iterator<Axiom> lIterator = mAxioms.values().iterator();
    while (lIterator.hasNext())
    {
      if (!lIterator.next().isFoundational())
      {
        lIterator.remove();
      }
    }

    // Re-seeding puts back any foundational axiom that was never there and restores the consistency flags.
    seedFoundationalAxioms();
    mVerificationTimes.reset();
    LOGGER.info("Logic system reset");
  }

  /**
   * Release everything and return to the uninitialized state.
   */
  public synchronized void cleanup()
  {
    mTheorems.clear();
    mAxioms.clear();
    mProofs.clear();
    mVerificationTimes.reset();
    mInitialized = false;
    LOGGER.info("Logic system cleaned up");
  }

  private void seedFoundationalAxioms()
  {
    if (!LogicConfiguration.getCfgBool(CfgItem.SEED_FOUNDATIONAL_AXIOMS))
    {
      return;
    }

    seed(EXCLUDED_MIDDLE, excludedMiddle());
    seed(NON_CONTRADICTION, nonContradiction());
  }

  private void seed(String xiName, Formula xiStatement)
  {
    Axiom lExisting = mAxioms.get(xiName);
    if (lExisting != null)
    {
      lExisting.setConsistent(true);
    }
    else
    {
      mAxioms.put(xiName, new Axiom(xiName, xiStatement, true));
    }
  }

  /**
   * @throws SystemNotInitializedException if the system isn't initialized.
   */
  public synchronized void checkInitialized() throws SystemNotInitializedException
  {
    if (!mInitialized)
    {
      throw new SystemNotInitializedException();
    }
  }

  //---------------------------------------------------------------------------
  // Theorems
  //---------------------------------------------------------------------------

  /**
   * Define a theorem.
   *
   * @param xiName - the theorem's name.
   * @param xiStatement - the statement.
   *
   * @return a snapshot of the new theorem.
   */
  public Theorem defineTheorem(String xiName, Formula xiStatement)
    throws SystemNotInitializedException, DuplicateNameException, InvalidStatementException
  {
    return defineTheorem(xiName, xiStatement, Collections.<Formula>emptyList(), null);
  }

  /**
   * Define a theorem with hypotheses and a conclusion.
   *
   * @param xiName - the theorem's name.
   * @param xiStatement - the statement.
   * @param xiHypotheses - the hypotheses (may be empty).  Each must be well-formed.
   * @param xiConclusion - the conclusion, or null.  If present, must be well-formed.
   *
   * @return a snapshot of the new theorem.
   */
  public synchronized Theorem defineTheorem(String xiName,
                                            Formula xiStatement,
                                            List<? extends Formula> xiHypotheses,
                                            Formula xiConclusion)
    throws SystemNotInitializedException, DuplicateNameException, InvalidStatementException
  {
    checkInitialized();
    checkName("Theorem", xiName, LogicErrorCode.INVALID_THEOREM);

    if (mTheorems.containsKey(xiName))
    {
      throw new DuplicateNameException("Theorem", xiName, LogicErrorCode.INVALID_THEOREM);
    }

    if (!FormulaValidator.validate(xiStatement))
    {
      throw new InvalidStatementException("Statement of theorem '" + xiName + "' is not a well-formed formula: " +
                                          xiStatement,
                                          LogicErrorCode.INVALID_THEOREM);
    }

    List<Formula> lHypotheses = (xiHypotheses == null) ? Collections.<Formula>emptyList() :
                                                         new ArrayList<Formula>(xiHypotheses);
    if (!FormulaValidator.validateAll(lHypotheses))
    {
      throw new InvalidStatementException("Hypotheses of theorem '" + xiName + "' are not well-formed",
                                          LogicErrorCode.INVALID_THEOREM);
    }

    if ((xiConclusion != null) && !FormulaValidator.validate(xiConclusion))
    {
      throw new InvalidStatementException("Conclusion of theorem '" + xiName + "' is not a well-formed formula: " +
                                          xiConclusion,
                                          LogicErrorCode.INVALID_THEOREM);
    }

    Theorem lTheorem = new Theorem(xiName, xiStatement, lHypotheses, xiConclusion);
    mTheorems.put(xiName, lTheorem);
    LOGGER.debug("Defined theorem " + lTheorem);
    return lTheorem.snapshot();
  }

  /**
   * @return a snapshot of the named theorem, or null if there isn't one.
   */
  public synchronized Theorem getTheorem(String xiName) throws SystemNotInitializedException
  {
    checkInitialized();
    Theorem lTheorem = mTheorems.get(xiName);
    return (lTheorem == null) ? null : lTheorem.snapshot();
  }

  /**
   * @return snapshots of all theorems, in definition order.
   */
  public synchronized List<Theorem> listTheorems() throws SystemNotInitializedException
  {
    checkInitialized();
    ImmutableList.Builder<Theorem> lBuilder = ImmutableList.builder();
    for (Theorem lTheorem : mTheorems.values())
    {
      lBuilder.add(lTheorem.snapshot());
    }
    return lBuilder.build();
  }

  /**
   * Confirm that a theorem is held by the registry.  Theorems live for the lifetime of the registry; nothing is
   * written anywhere else.
   *
   * @return true.
   * @throws NotFoundException if there is no such theorem.
   */
  public synchronized boolean storeTheorem(String xiName) throws SystemNotInitializedException, NotFoundException
  {
    checkInitialized();
    lookupTheorem(xiName);
    LOGGER.debug("Theorem " + xiName + " is stored");
    return true;
  }

  /**
   * Re-check a theorem.  Any proof steps added since the proof was last verified are verified first.
   *
   * @return whether the statement is well-formed and the theorem's proof, if it has one, is valid.
   * @throws NotFoundException if there is no such theorem.
   */
  public synchronized boolean verifyTheorem(String xiName) throws SystemNotInitializedException, NotFoundException
  {
    checkInitialized();
    Theorem lTheorem = lookupTheorem(xiName);

    Proof lProof = mProofs.get(xiName);
    if ((lProof != null) && (lProof.getState() == ProofState.ACCUMULATING))
    {
      recordOutcome(lTheorem, lProof, mVerifier.reverify(lProof));
    }

    boolean lWellFormed = FormulaValidator.validate(lTheorem.getStatement());
    return lWellFormed && ((lProof == null) || lProof.isValid());
  }

  private Theorem lookupTheorem(String xiName) throws NotFoundException
  {
    Theorem lTheorem = mTheorems.get(xiName);
    if (lTheorem == null)
    {
      throw new NotFoundException("Theorem", xiName);
    }
    return lTheorem;
  }

  //---------------------------------------------------------------------------
  // Axioms
  //---------------------------------------------------------------------------

  /**
   * Add an axiom.  It is marked consistent until {@link #validateAxiom(String)} says otherwise.
   *
   * @return a snapshot of the new axiom.
   */
  public synchronized Axiom addAxiom(String xiName, Formula xiStatement)
    throws SystemNotInitializedException, DuplicateNameException, InvalidStatementException
  {
    checkInitialized();
    checkName("Axiom", xiName, LogicErrorCode.INVALID_AXIOM);

    if (mAxioms.containsKey(xiName))
    {
      throw new DuplicateNameException("Axiom", xiName, LogicErrorCode.INVALID_AXIOM);
    }

    if (!FormulaValidator.validate(xiStatement))
    {
      throw new InvalidStatementException("Statement of axiom '" + xiName + "' is not a well-formed formula: " +
                                          xiStatement,
                                          LogicErrorCode.INVALID_AXIOM);
    }

    Axiom lAxiom = new Axiom(xiName, xiStatement, false);
    mAxioms.put(xiName, lAxiom);
    LOGGER.debug("Added axiom " + lAxiom);
    return lAxiom.snapshot();
  }

  /**
   * Re-check an axiom against every other axiom and record the result.
   *
   * @return whether the axiom is consistent with the rest of the axiom set.
   * @throws NotFoundException if there is no such axiom.
   */
  public synchronized boolean validateAxiom(String xiName) throws SystemNotInitializedException, NotFoundException
  {
    checkInitialized();
    Axiom lAxiom = mAxioms.get(xiName);
    if (lAxiom == null)
    {
      throw new NotFoundException("Axiom", xiName);
    }

    List<Formula> lOthers = new ArrayList<>(mAxioms.size());
    for (Axiom lOther : mAxioms.values())
    {
      if (lOther != lAxiom)
      {
        lOthers.add(lOther.getStatement());
      }
    }

    boolean lConsistent = ConsistencyChecker.isConsistentWith(lAxiom.getStatement(), lOthers);
    lAxiom.setConsistent(lConsistent);
    LOGGER.debug("Axiom " + xiName + (lConsistent ? " is consistent" : " is inconsistent"));
    return lConsistent;
  }

  /**
   * @return a snapshot of the named axiom, or null if there isn't one.
   */
  public synchronized Axiom getAxiom(String xiName) throws SystemNotInitializedException
  {
    checkInitialized();
    Axiom lAxiom = mAxioms.get(xiName);
    return (lAxiom == null) ? null : lAxiom.snapshot();
  }

  /**
   * @return snapshots of all axioms, in the order they were added.  The foundational axioms come first.
   */
  public synchronized List<Axiom> listAxioms() throws SystemNotInitializedException
  {
    checkInitialized();
    ImmutableList.Builder<Axiom> lBuilder = ImmutableList.builder();
    for (Axiom lAxiom : mAxioms.values())
    {
      lBuilder.add(lAxiom.snapshot());
    }
    return lBuilder.build();
  }

  /**
   * @return the statements of all axioms, as copies.
   */
  public synchronized List<Formula> getAxiomStatements() throws SystemNotInitializedException
  {
    checkInitialized();
    ImmutableList.Builder<Formula> lBuilder = ImmutableList.builder();
    for (Axiom lAxiom : mAxioms.values())
    {
      lBuilder.add(FormulaPool.copy(lAxiom.getStatement()));
    }
    return lBuilder.build();
  }

  //---------------------------------------------------------------------------
  // Proofs
  //---------------------------------------------------------------------------

  /**
   * Verify a proof of a theorem, with default justifications.
   *
   * @see #verifyProof(String, List, List)
   */
  public boolean verifyProof(String xiTheoremName, List<? extends Formula> xiSteps)
    throws SystemNotInitializedException, NotFoundException, InvalidProofException
  {
    return verifyProof(xiTheoremName, xiSteps, null);
  }

  /**
   * Replace a theorem's proof with the specified steps and verify it.  If the proof is valid the theorem becomes
   * proven.
   *
   * @param xiTheoremName - the theorem.
   * @param xiSteps - the steps.
   * @param xiJustifications - the justification of each step, or null for the default.
   *
   * @return whether the proof is valid.
   *
   * @throws NotFoundException if there is no such theorem.
   * @throws EmptyProofException if there are no steps.  Nothing is changed.
   * @throws InvalidProofException if there are more justifications than steps.  Nothing is changed.
   */
  public synchronized boolean verifyProof(String xiTheoremName,
                                          List<? extends Formula> xiSteps,
                                          List<? extends Formula> xiJustifications)
    throws SystemNotInitializedException, NotFoundException, InvalidProofException
  {
    checkInitialized();
    Theorem lTheorem = lookupTheorem(xiTheoremName);
    if ((xiSteps == null) || xiSteps.isEmpty())
    {
      throw new EmptyProofException(xiTheoremName);
    }
    if ((xiJustifications != null) && (xiJustifications.size() > xiSteps.size()))
    {
      throw new InvalidProofException("Proof of '" + xiTheoremName + "' has more justifications (" +
                                      xiJustifications.size() + ") than steps (" + xiSteps.size() + ")");
    }

    Proof lProof = getOrCreateProof(xiTheoremName);
    boolean lValid = mVerifier.verify(lProof, xiSteps, xiJustifications);
    recordOutcome(lTheorem, lProof, lValid);
    return lValid;
  }

  /**
   * Append a step to a theorem's proof, creating the proof if necessary.  The proof must be verified again
   * (explicitly or through {@link #verifyTheorem(String)}) before it counts as valid.
   *
   * @param xiTheoremName - the theorem.
   * @param xiStep - the step.
   * @param xiJustification - its justification, or null for the default.
   *
   * @return whether the step is plausible.
   * @throws NotFoundException if there is no such theorem.
   */
  public synchronized boolean addProofStep(String xiTheoremName, Formula xiStep, Formula xiJustification)
    throws SystemNotInitializedException, NotFoundException
  {
    checkInitialized();
    lookupTheorem(xiTheoremName);

    boolean lPlausible = mVerifier.appendStep(getOrCreateProof(xiTheoremName), xiStep, xiJustification);
    LOGGER.debug("Added step " + xiStep + " to proof of " + xiTheoremName + (lPlausible ? "" : " (implausible)"));
    return lPlausible;
  }

  /**
   * @return a snapshot of the proof of the named theorem, or null if it has none.
   */
  public synchronized Proof getProof(String xiTheoremName) throws SystemNotInitializedException
  {
    checkInitialized();
    Proof lProof = mProofs.get(xiTheoremName);
    return (lProof == null) ? null : lProof.snapshot();
  }

  /**
   * Export the proof of a theorem, together with the statement it proves.
   *
   * @param xiTheoremName - the theorem.
   * @param xiFormat - the output format.
   *
   * @return the exported proof.
   * @throws NotFoundException if there is no such theorem or it has no proof.
   * @throws ProofIncompleteException if the proof has not been verified as valid.
   */
  public synchronized String exportProof(String xiTheoremName, ExportFormat xiFormat)
    throws SystemNotInitializedException, NotFoundException, ProofIncompleteException
  {
    checkInitialized();
    Theorem lTheorem = lookupTheorem(xiTheoremName);
    Proof lProof = mProofs.get(xiTheoremName);
    if (lProof == null)
    {
      throw new NotFoundException("Proof", xiTheoremName);
    }
    return ProofExporter.export(lProof.snapshot(), lTheorem.getStatement(), xiFormat);
  }

  /**
   * @return statistics for the proof of the named theorem.
   * @throws NotFoundException if the theorem has no proof.
   */
  public synchronized ProofStatistics getProofStatistics(String xiTheoremName)
    throws SystemNotInitializedException, NotFoundException
  {
    checkInitialized();
    Proof lProof = mProofs.get(xiTheoremName);
    if (lProof == null)
    {
      throw new NotFoundException("Proof", xiTheoremName);
    }
    return new ProofStatistics(lProof);
  }

  private Proof getOrCreateProof(String xiTheoremName)
  {
    Proof lProof = mProofs.get(xiTheoremName);
    if (lProof == null)
    {
      lProof = new Proof(xiTheoremName);
      mProofs.put(xiTheoremName, lProof);
    }
    return lProof;
  }

  private void recordOutcome(Theorem xiTheorem, Proof xiProof, boolean xiValid)
  {
    mVerificationTimes.sample(xiProof.getVerificationTime());
    if (xiValid)
    {
      xiTheorem.markProven(xiProof);
      LOGGER.debug("Theorem " + xiTheorem.getName() + " proven");
    }
  }

  //---------------------------------------------------------------------------
  // Statistics
  //---------------------------------------------------------------------------

  /**
   * @return a summary of the registry.
   */
  public synchronized LogicSystemStatistics getStatistics() throws SystemNotInitializedException
  {
    checkInitialized();

    List<Formula> lStatements = new ArrayList<>(mAxioms.size());
    for (Axiom lAxiom : mAxioms.values())
    {
      lStatements.add(lAxiom.getStatement());
    }

    return new LogicSystemStatistics(mTheorems.size(),
                                     mAxioms.size(),
                                     mProofs.size(),
                                     ConsistencyChecker.isConsistent(lStatements),
                                     mVerificationTimes.getNumSamples(),
                                     mVerificationTimes.getTotal(),
                                     mVerificationTimes.getMean());
  }

  private static void checkName(String xiEntity, String xiName, LogicErrorCode xiErrorCode)
    throws InvalidStatementException
  {
    if (StringUtils.isBlank(xiName))
    {
      throw new InvalidStatementException(xiEntity + " name must not be blank", xiErrorCode);
    }
  }
}

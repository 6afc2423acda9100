package org.zen.logic.stdlib;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.zen.logic.consistency.ConsistencyChecker;
import org.zen.logic.formula.FormulaEquivalence;
import org.zen.logic.formula.FormulaRenderer;
import org.zen.logic.formula.TruthTable;
import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.godel.SelfReferenceDetector;
import org.zen.logic.kb.Axiom;
import org.zen.logic.kb.LogicSystem;
import org.zen.logic.kb.LogicSystemStatistics;
import org.zen.logic.kb.ProofStatistics;
import org.zen.logic.kb.Theorem;
import org.zen.logic.kb.exceptions.FormulaConversionException;
import org.zen.logic.kb.exceptions.LogicErrorCode;
import org.zen.logic.kb.exceptions.LogicException;
import org.zen.logic.kb.exceptions.NotFoundException;
import org.zen.logic.prover.InferenceEngine;
import org.zen.logic.value.ArrayValue;
import org.zen.logic.value.BooleanValue;
import org.zen.logic.value.FormulaValueConverter;
import org.zen.logic.value.ObjectValue;
import org.zen.logic.value.StringValue;
import org.zen.logic.value.Value;
import org.zen.logic.value.ValueType;
import org.zen.logic.value.Values;
import org.zen.logic.verifier.ExportFormat;

import com.google.common.collect.ImmutableList;

/**
 * Script-callable logic functions.
 *
 * Every function takes boxed arguments and returns a boxed result.  Failures never escape as exceptions: they are
 * returned as {@link org.zen.logic.value.ErrorValue}s carrying the {@link LogicErrorCode} of the failure, or code 0
 * for a bad argument count or type.
 */
public class LogicFunctions
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Names of all the functions {@link #call(String, Value...)} accepts.
   */
  public static final List<String> FUNCTION_NAMES = ImmutableList.of("theorem_define",
                                                                     "theorem_get",
                                                                     "theorem_list",
                                                                     "theorem_store",
                                                                     "theorem_verify",
                                                                     "axiom_add",
                                                                     "axiom_list",
                                                                     "axiom_validate",
                                                                     "proof_step",
                                                                     "proof_verify",
                                                                     "proof_stats",
                                                                     "proof_export",
                                                                     "entails",
                                                                     "modus_ponens",
                                                                     "modus_tollens",
                                                                     "universal_instantiation",
                                                                     "equivalent",
                                                                     "truth_table",
                                                                     "check_undecidable",
                                                                     "system_stats",
                                                                     "system_reset");

  private static final String JUSTIFICATION = "justification";

  /**
   * A call whose arguments are the wrong number or type.
   */
  @SuppressWarnings("serial")
  private static class BadArgumentException extends Exception
  {
    private final LogicErrorCode mErrorCode;

    BadArgumentException(String xiMessage, LogicErrorCode xiErrorCode)
    {
      super(xiMessage);
      mErrorCode = xiErrorCode;
    }
  }

  private final LogicSystem     mSystem;
  private final InferenceEngine mEngine;

  /**
   * Create the functions over a new, initialized, logic system.
   */
  public LogicFunctions()
  {
    this(newInitializedSystem());
  }

  /**
   * Create the functions over an existing logic system.  Calls fail with
   * {@link LogicErrorCode#SYSTEM_NOT_INIT} while it isn't initialized.
   *
   * @param xiSystem - the logic system.
   */
  public LogicFunctions(LogicSystem xiSystem)
  {
    mSystem = xiSystem;
    mEngine = new InferenceEngine();
  }

  private static LogicSystem newInitializedSystem()
  {
    LogicSystem lSystem = new LogicSystem();
    lSystem.init();
    return lSystem;
  }

  public LogicSystem getSystem()
  {
    return mSystem;
  }

  /**
   * @return whether there is a function with the specified name.
   */
  public static boolean isFunction(String xiName)
  {
    return FUNCTION_NAMES.contains(xiName);
  }

  /**
   * Call a logic function.
   *
   * @param xiName - the function name.
   * @param xiArgs - the arguments.
   *
   * @return the result, or an error value.
   */
  public Value call(String xiName, Value... xiArgs)
  {
    try
    {
      return dispatch(xiName, normalize(xiArgs));
    }
    catch (BadArgumentException lEx)
    {
      LOGGER.debug(xiName + ": " + lEx.getMessage());
      return Values.error(lEx.getMessage(), lEx.mErrorCode);
    }
    catch (LogicException lEx)
    {
      LOGGER.debug(xiName + " failed with " + lEx.getErrorCode() + ": " + lEx.getMessage());
      return Values.error(lEx);
    }
  }

  /**
   * @return a copy of the arguments with every Java null replaced by {@link Values#nullValue()}.
   */
  private static Value[] normalize(Value[] xiArgs)
  {
    if (xiArgs == null)
    {
      return new Value[0];
    }

    Value[] lArgs = new Value[xiArgs.length];
    for (int lii = 0; lii < xiArgs.length; lii++)
    {
      lArgs[lii] = (xiArgs[lii] == null) ? Values.nullValue() : xiArgs[lii];
    }
    return lArgs;
  }

  private Value dispatch(String xiName, Value[] xiArgs) throws BadArgumentException, LogicException
  {
    if (!isFunction(xiName))
    {
      throw new BadArgumentException("Unknown logic function '" + xiName + "'", LogicErrorCode.NONE);
    }

    switch (xiName)
    {
      case "theorem_define":          return theoremDefine(xiArgs);
      case "theorem_get":             return theoremGet(xiArgs);
      case "theorem_list":            return theoremList(xiArgs);
      case "theorem_store":           return theoremStore(xiArgs);
      case "theorem_verify":          return theoremVerify(xiArgs);
      case "axiom_add":               return axiomAdd(xiArgs);
      case "axiom_list":              return axiomList(xiArgs);
      case "axiom_validate":          return axiomValidate(xiArgs);
      case "proof_step":              return proofStep(xiArgs);
      case "proof_verify":            return proofVerify(xiArgs);
      case "proof_stats":             return proofStats(xiArgs);
      case "proof_export":            return proofExport(xiArgs);
      case "entails":                 return entails(xiArgs);
      case "modus_ponens":            return modusPonens(xiArgs);
      case "modus_tollens":           return modusTollens(xiArgs);
      case "universal_instantiation": return universalInstantiation(xiArgs);
      case "equivalent":              return equivalent(xiArgs);
      case "truth_table":             return truthTable(xiArgs);
      case "check_undecidable":       return checkUndecidable(xiArgs);
      case "system_stats":            return systemStats(xiArgs);
      case "system_reset":            return systemReset(xiArgs);
      default:
        throw new IllegalStateException("No implementation for " + xiName);
    }
  }

  //---------------------------------------------------------------------------
  // Theorems
  //---------------------------------------------------------------------------

  // theorem_define(name, statement [, hypotheses [, conclusion]])
  private Value theoremDefine(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("theorem_define", xiArgs, 2, 4);
    String lName = stringArg(xiArgs, 0, "Theorem name", LogicErrorCode.INVALID_THEOREM);
    Formula lStatement = FormulaValueConverter.toFormula(objectArg(xiArgs, 1, "Theorem statement",
                                                                   LogicErrorCode.INVALID_THEOREM));

    List<Formula> lHypotheses = new ArrayList<>();
    if ((xiArgs.length > 2) && !xiArgs[2].is(ValueType.NULL))
    {
      lHypotheses = FormulaValueConverter.toFormulas(arrayArg(xiArgs, 2, "Hypotheses",
                                                               LogicErrorCode.INVALID_THEOREM));
    }

    Formula lConclusion = null;
    if ((xiArgs.length > 3) && !xiArgs[3].is(ValueType.NULL))
    {
      lConclusion = FormulaValueConverter.toFormula(objectArg(xiArgs, 3, "Conclusion",
                                                              LogicErrorCode.INVALID_THEOREM));
    }

    return theoremToValue(mSystem.defineTheorem(lName, lStatement, lHypotheses, lConclusion));
  }

  // theorem_get(name)
  private Value theoremGet(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("theorem_get", xiArgs, 1, 1);
    Theorem lTheorem = mSystem.getTheorem(stringArg(xiArgs, 0, "Theorem name", LogicErrorCode.INVALID_THEOREM));
    return (lTheorem == null) ? Values.nullValue() : theoremToValue(lTheorem);
  }

  // theorem_list()
  private Value theoremList(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("theorem_list", xiArgs, 0, 0);
    ArrayValue lArray = Values.newArray();
    for (Theorem lTheorem : mSystem.listTheorems())
    {
      lArray.add(theoremToValue(lTheorem));
    }
    return lArray;
  }

  // theorem_store(name)
  private Value theoremStore(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("theorem_store", xiArgs, 1, 1);
    String lName = stringArg(xiArgs, 0, "Theorem name", LogicErrorCode.INVALID_THEOREM);
    return Values.bool(mSystem.storeTheorem(lName));
  }

  // theorem_verify(name)
  private Value theoremVerify(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("theorem_verify", xiArgs, 1, 1);
    String lName = stringArg(xiArgs, 0, "Theorem name", LogicErrorCode.INVALID_THEOREM);
    return Values.bool(mSystem.verifyTheorem(lName));
  }

  private static ObjectValue theoremToValue(Theorem xiTheorem)
  {
    ObjectValue lObject = Values.newObject();
    lObject.set("name", Values.string(xiTheorem.getName()));
    lObject.set("statement", Values.string(FormulaRenderer.render(xiTheorem.getStatement())));
    lObject.set("formula", FormulaValueConverter.toValue(xiTheorem.getStatement()));
    lObject.set("hypotheses", FormulaValueConverter.toValues(xiTheorem.getHypotheses()));
    lObject.set("conclusion", FormulaValueConverter.toValue(xiTheorem.getConclusion()));
    lObject.set("is_proven", Values.bool(xiTheorem.isProven()));
    lObject.set("has_proof", Values.bool(xiTheorem.getProof() != null));
    return lObject;
  }

  //---------------------------------------------------------------------------
  // Axioms
  //---------------------------------------------------------------------------

  // axiom_add(name, statement)
  private Value axiomAdd(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("axiom_add", xiArgs, 2, 2);
    String lName = stringArg(xiArgs, 0, "Axiom name", LogicErrorCode.INVALID_AXIOM);
    Formula lStatement = FormulaValueConverter.toFormula(objectArg(xiArgs, 1, "Axiom statement",
                                                                   LogicErrorCode.INVALID_AXIOM));
    mSystem.addAxiom(lName, lStatement);
    return Values.bool(true);
  }

  // axiom_list()
  private Value axiomList(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("axiom_list", xiArgs, 0, 0);
    ArrayValue lArray = Values.newArray();
    for (Axiom lAxiom : mSystem.listAxioms())
    {
      lArray.add(axiomToValue(lAxiom));
    }
    return lArray;
  }

  // axiom_validate(name)
  private Value axiomValidate(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("axiom_validate", xiArgs, 1, 1);
    String lName = stringArg(xiArgs, 0, "Axiom name", LogicErrorCode.INVALID_AXIOM);
    return Values.bool(mSystem.validateAxiom(lName));
  }

  private static ObjectValue axiomToValue(Axiom xiAxiom)
  {
    ObjectValue lObject = Values.newObject();
    lObject.set("name", Values.string(xiAxiom.getName()));
    lObject.set("statement", Values.string(FormulaRenderer.render(xiAxiom.getStatement())));
    lObject.set("formula", FormulaValueConverter.toValue(xiAxiom.getStatement()));
    lObject.set("is_consistent", Values.bool(xiAxiom.isConsistent()));
    lObject.set("is_foundational", Values.bool(xiAxiom.isFoundational()));
    return lObject;
  }

  //---------------------------------------------------------------------------
  // Proofs
  //---------------------------------------------------------------------------

  // proof_step(theorem_name, step [, justification])
  private Value proofStep(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("proof_step", xiArgs, 2, 3);
    String lName = stringArg(xiArgs, 0, "Theorem name", LogicErrorCode.INVALID_PROOF);
    Formula lStep = FormulaValueConverter.toFormula(objectArg(xiArgs, 1, "Proof step", LogicErrorCode.INVALID_PROOF));

    Formula lJustification = null;
    if ((xiArgs.length > 2) && !xiArgs[2].is(ValueType.NULL))
    {
      lJustification = FormulaValueConverter.toFormula(objectArg(xiArgs, 2, "Justification",
                                                                 LogicErrorCode.INVALID_PROOF));
    }

    return Values.bool(mSystem.addProofStep(lName, lStep, lJustification));
  }

  // proof_verify(theorem_name, steps)
  private Value proofVerify(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("proof_verify", xiArgs, 2, 2);
    String lName = stringArg(xiArgs, 0, "Theorem name", LogicErrorCode.INVALID_THEOREM);
    ArrayValue lStepValues = arrayArg(xiArgs, 1, "Proof steps", LogicErrorCode.INVALID_PROOF);
    if (mSystem.getTheorem(lName) == null)
    {
      throw new NotFoundException("Theorem", lName);
    }

    // Convert everything before touching the registry, so a bad step changes nothing.
    List<Formula> lSteps = new ArrayList<>(lStepValues.size());
    List<Formula> lJustifications = new ArrayList<>(lStepValues.size());
    for (Value lStepValue : lStepValues)
    {
      lSteps.add(FormulaValueConverter.toFormula(lStepValue));
      lJustifications.add(justificationOf(lStepValue));
    }

    return Values.bool(mSystem.verifyProof(lName, lSteps, lJustifications));
  }

  /**
   * @return the justification attached to a step object, or null (for the default) if there isn't a usable one.
   */
  private static Formula justificationOf(Value xiStep)
  {
    Value lJustification = ((ObjectValue)xiStep).get(JUSTIFICATION);
    if ((lJustification == null) || lJustification.is(ValueType.NULL))
    {
      return null;
    }

    try
    {
      return FormulaValueConverter.toFormula(lJustification);
    }
    catch (FormulaConversionException lEx)
    {
      LOGGER.debug("Using the default justification in place of " + lJustification + ": " + lEx.getMessage());
      return null;
    }
  }

  // proof_stats(theorem_name)
  private Value proofStats(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("proof_stats", xiArgs, 1, 1);
    ProofStatistics lStats = mSystem.getProofStatistics(stringArg(xiArgs, 0, "Theorem name",
                                                                  LogicErrorCode.INVALID_PROOF));

    ObjectValue lObject = Values.newObject();
    lObject.set("theorem_name", Values.string(lStats.getTheoremName()));
    lObject.set("step_count", Values.number(lStats.getStepCount()));
    lObject.set("state", Values.string(lStats.getState().name().toLowerCase()));
    lObject.set("is_valid", Values.bool(lStats.isValid()));
    lObject.set("is_complete", Values.bool(lStats.isComplete()));
    lObject.set("verification_time", Values.number(lStats.getVerificationTime() / 1e9));
    return lObject;
  }

  // proof_export(theorem_name [, format])
  private Value proofExport(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("proof_export", xiArgs, 1, 2);
    String lName = stringArg(xiArgs, 0, "Theorem name", LogicErrorCode.INVALID_PROOF);

    ExportFormat lFormat = ExportFormat.MARKDOWN;
    if (xiArgs.length > 1)
    {
      String lFormatName = stringArg(xiArgs, 1, "Export format", LogicErrorCode.NONE);
      lFormat = ExportFormat.fromName(lFormatName);
      if (lFormat == null)
      {
        throw new BadArgumentException("Unknown export format '" + lFormatName + "'", LogicErrorCode.NONE);
      }
    }

    return Values.string(mSystem.exportProof(lName, lFormat));
  }

  //---------------------------------------------------------------------------
  // Inference
  //---------------------------------------------------------------------------

  // entails(premises, conclusion)
  private Value entails(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("entails", xiArgs, 2, 2);
    mSystem.checkInitialized();
    List<Formula> lPremises = FormulaValueConverter.toFormulas(xiArgs[0]);
    Formula lConclusion = FormulaValueConverter.toFormula(xiArgs[1]);
    return Values.bool(ConsistencyChecker.entails(lPremises, lConclusion));
  }

  // modus_ponens(conditional, antecedent)
  private Value modusPonens(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("modus_ponens", xiArgs, 2, 2);
    mSystem.checkInitialized();
    return derived(mEngine.modusPonens(FormulaValueConverter.toFormula(xiArgs[0]),
                                       FormulaValueConverter.toFormula(xiArgs[1])));
  }

  // modus_tollens(conditional, negated_consequent)
  private Value modusTollens(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("modus_tollens", xiArgs, 2, 2);
    mSystem.checkInitialized();
    return derived(mEngine.modusTollens(FormulaValueConverter.toFormula(xiArgs[0]),
                                        FormulaValueConverter.toFormula(xiArgs[1])));
  }

  // universal_instantiation(universal, instance)
  private Value universalInstantiation(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("universal_instantiation", xiArgs, 2, 2);
    mSystem.checkInitialized();
    return derived(mEngine.universalInstantiation(FormulaValueConverter.toFormula(xiArgs[0]),
                                                  FormulaValueConverter.toFormula(xiArgs[1])));
  }

  private static Value derived(Formula xiDerived)
  {
    return (xiDerived == null) ? Values.nullValue() : FormulaValueConverter.toValue(xiDerived);
  }

  // equivalent(first, second)
  private Value equivalent(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("equivalent", xiArgs, 2, 2);
    mSystem.checkInitialized();
    return Values.bool(FormulaEquivalence.equivalent(FormulaValueConverter.toFormula(xiArgs[0]),
                                                     FormulaValueConverter.toFormula(xiArgs[1])));
  }

  // truth_table(formula)
  private Value truthTable(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("truth_table", xiArgs, 1, 1);
    mSystem.checkInitialized();
    TruthTable lTable = TruthTable.of(FormulaValueConverter.toFormula(xiArgs[0]));

    ArrayValue lVariables = Values.newArray();
    for (String lVariable : lTable.getVariables())
    {
      lVariables.add(Values.string(lVariable));
    }

    ArrayValue lRows = Values.newArray();
    for (TruthTable.Row lRow : lTable.getRows())
    {
      ObjectValue lAssignment = Values.newObject();
      for (Map.Entry<String, Boolean> lEntry : lRow.getAssignment().entrySet())
      {
        lAssignment.set(lEntry.getKey(), Values.bool(lEntry.getValue()));
      }
      lRows.add(Values.newObject().set("assignment", lAssignment).set("value", Values.bool(lRow.getValue())));
    }

    ObjectValue lObject = Values.newObject();
    lObject.set("variables", lVariables);
    lObject.set("rows", lRows);
    lObject.set("is_tautology", Values.bool(lTable.isTautology()));
    lObject.set("is_satisfiable", Values.bool(lTable.isSatisfiable()));
    return lObject;
  }

  // check_undecidable(statement)
  private Value checkUndecidable(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("check_undecidable", xiArgs, 1, 1);
    mSystem.checkInitialized();
    Formula lStatement = FormulaValueConverter.toFormula(xiArgs[0]);
    return SelfReferenceDetector.isUndecidable(lStatement) ? Values.undecidable() : Values.bool(false);
  }

  //---------------------------------------------------------------------------
  // System
  //---------------------------------------------------------------------------

  // system_stats()
  private Value systemStats(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("system_stats", xiArgs, 0, 0);
    LogicSystemStatistics lStats = mSystem.getStatistics();

    ObjectValue lObject = Values.newObject();
    lObject.set("theorem_count", Values.number(lStats.getTheoremCount()));
    lObject.set("axiom_count", Values.number(lStats.getAxiomCount()));
    lObject.set("proof_count", Values.number(lStats.getProofCount()));
    lObject.set("is_consistent", Values.bool(lStats.isConsistent()));
    lObject.set("total_verifications", Values.number(lStats.getTotalVerifications()));
    lObject.set("average_verification_time", Values.number(lStats.getAverageVerificationTime() / 1e9));
    return lObject;
  }

  // system_reset(confirm)
  private Value systemReset(Value[] xiArgs) throws BadArgumentException, LogicException
  {
    checkArgCount("system_reset", xiArgs, 0, 1);
    boolean lConfirmed = (xiArgs.length == 1) &&
                         xiArgs[0].is(ValueType.BOOLEAN) &&
                         ((BooleanValue)xiArgs[0]).getValue();
    mSystem.reset(lConfirmed);
    return Values.bool(true);
  }

  //---------------------------------------------------------------------------
  // Argument checking
  //---------------------------------------------------------------------------

  private static void checkArgCount(String xiFunction, Value[] xiArgs, int xiMin, int xiMax)
    throws BadArgumentException
  {
    if ((xiArgs.length < xiMin) || (xiArgs.length > xiMax))
    {
      String lExpected = (xiMin == xiMax) ? Integer.toString(xiMin) : (xiMin + " to " + xiMax);
      throw new BadArgumentException(xiFunction + "() takes " + lExpected + " argument(s), but got " +
                                     xiArgs.length,
                                     LogicErrorCode.NONE);
    }
  }

  private static String stringArg(Value[] xiArgs, int xiIndex, String xiWhat, LogicErrorCode xiErrorCode)
    throws BadArgumentException
  {
    Value lArg = xiArgs[xiIndex];
    if ((lArg == null) || !lArg.is(ValueType.STRING))
    {
      throw new BadArgumentException(xiWhat + " must be a string", xiErrorCode);
    }
    return ((StringValue)lArg).getValue();
  }

  private static Value objectArg(Value[] xiArgs, int xiIndex, String xiWhat, LogicErrorCode xiErrorCode)
    throws BadArgumentException
  {
    Value lArg = xiArgs[xiIndex];
    if ((lArg == null) || !lArg.is(ValueType.OBJECT))
    {
      throw new BadArgumentException(xiWhat + " must be a formula object", xiErrorCode);
    }
    return lArg;
  }

  private static ArrayValue arrayArg(Value[] xiArgs, int xiIndex, String xiWhat, LogicErrorCode xiErrorCode)
    throws BadArgumentException
  {
    Value lArg = xiArgs[xiIndex];
    if ((lArg == null) || !lArg.is(ValueType.ARRAY))
    {
      throw new BadArgumentException(xiWhat + " must be an array", xiErrorCode);
    }
    return (ArrayValue)lArg;
  }
}

package org.zen.logic.test;

import org.junit.runner.RunWith;
import org.junit.runners.Suite;
import org.zen.logic.consistency.ConsistencyCheckerTest;
import org.zen.logic.formula.FormulaEquivalenceRulesTest;
import org.zen.logic.formula.FormulaEquivalenceTest;
import org.zen.logic.formula.FormulaRendererTest;
import org.zen.logic.formula.FormulaValidatorTest;
import org.zen.logic.formula.TruthTableTest;
import org.zen.logic.formula.grammar.FormulaPoolTest;
import org.zen.logic.godel.SelfReferenceDetectorTest;
import org.zen.logic.kb.exceptions.LogicErrorCodeTest;
import org.zen.logic.kb.LogicSystemTest;
import org.zen.logic.prover.InferenceEngineTest;
import org.zen.logic.stdlib.LogicFunctionsTest;
import org.zen.logic.util.config.LogicConfigurationTest;
import org.zen.logic.util.stats.SampledStatisticTest;
import org.zen.logic.value.FormulaValueConverterTest;
import org.zen.logic.verifier.BoundedProofVerifierTest;
import org.zen.logic.verifier.ProofExporterTest;
import org.zen.logic.verifier.ProofVerifierTest;

@RunWith(Suite.class)
@Suite.SuiteClasses({FormulaPoolTest.class,
                     FormulaEquivalenceTest.class,
                     FormulaEquivalenceRulesTest.class,
                     FormulaValidatorTest.class,
                     FormulaRendererTest.class,
                     TruthTableTest.class,
                     InferenceEngineTest.class,
                     ConsistencyCheckerTest.class,
                     SelfReferenceDetectorTest.class,
                     ProofVerifierTest.class,
                     ProofExporterTest.class,
                     BoundedProofVerifierTest.class,
                     LogicErrorCodeTest.class,
                     LogicSystemTest.class,
                     FormulaValueConverterTest.class,
                     LogicFunctionsTest.class,
                     LogicConfigurationTest.class,
                     SampledStatisticTest.class})
public class AllTests
{

}

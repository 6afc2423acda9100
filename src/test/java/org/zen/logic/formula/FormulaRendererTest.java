package org.zen.logic.formula;

import static org.junit.Assert.assertEquals;

import org.junit.Test;
import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaPool;
import org.zen.logic.formula.grammar.InequalityKind;

public class FormulaRendererTest
{
  @Test
  public void testUnicode()
  {
    Formula lFormula = FormulaPool.getImplies(FormulaPool.getProposition("P"),
                                              FormulaPool.getNot(FormulaPool.getProposition("Q")));
    assertEquals("(P → ¬Q)", FormulaRenderer.render(lFormula));
    assertEquals("?", FormulaRenderer.render(null));
  }

  @Test
  public void testLatex()
  {
    Formula lFormula = FormulaPool.getUniversal("x",
                                                FormulaPool.getInequality(InequalityKind.LE,
                                                                          FormulaPool.getNumber(0),
                                                                          FormulaPool.getMathFunction("abs",
                                                                                                      FormulaPool.getVariable("x", true))));
    assertEquals("\\forall x.\\, 0 \\leq \\operatorname{abs}(x)", FormulaRenderer.renderLatex(lFormula));

    assertEquals("\\left(P \\land \\lnot Q\\right)",
                 FormulaRenderer.renderLatex(FormulaPool.getAnd(FormulaPool.getProposition("P"),
                                                                FormulaPool.getNot(FormulaPool.getProposition("Q")))));
  }
}

package org.zen.logic.formula.grammar;

import java.util.ArrayList;
import java.util.List;

/**
 * A <i>math function</i> is a named term applied to arguments, e.g. <code>sqrt(x)</code>.  Unlike a
 * {@link FormulaPredicate} it denotes a value, not a truth value.
 *
 * See {@link Formula} for a complete description of the formula hierarchy.
 */
@SuppressWarnings("serial")
public final class FormulaMathFunction extends Formula
{
  private final String        name;
  private final List<Formula> args;
  private transient Boolean   ground;

  FormulaMathFunction(String name, List<Formula> args)
  {
    this.name = name;
    this.args = args;
    ground = null;
  }

  @Override
  public FormulaKind getKind()
  {
    return FormulaKind.MATH_FUNCTION;
  }

  public String getName()
  {
    return name;
  }

  public int arity()
  {
    return args.size();
  }

  public List<Formula> getArgs()
  {
    return args;
  }

  @Override
  public Formula deepCopy()
  {
    List<Formula> lArgs = new ArrayList<>(args.size());
    for (Formula lArg : args)
    {
      lArgs.add(copyOf(lArg));
    }
    return new FormulaMathFunction(name, FormulaPool.freeze(lArgs));
  }

  @Override
  public boolean isGround()
  {
    if (ground == null)
    {
      ground = FormulaPool.allGround(args);
    }

    return ground;
  }

  @Override
  public String toString()
  {
    return FormulaPool.application(name, args);
  }

}

package org.zen.logic.formula.grammar;

import java.util.ArrayList;
import java.util.List;

/**
 * A <i>predicate</i> is a named relation applied to an ordered list of arguments.
 *
 * See {@link Formula} for a complete description of the formula hierarchy.
 */
@SuppressWarnings("serial")
public final class FormulaPredicate extends Formula
{
  private final String        name;
  private final List<Formula> args;
  private transient Boolean   ground;

  FormulaPredicate(String name, List<Formula> args)
  {
    this.name = name;
    this.args = args;
    ground = null;
  }

  @Override
  public FormulaKind getKind()
  {
    return FormulaKind.PREDICATE;
  }

  public String getName()
  {
    return name;
  }

  public int arity()
  {
    return args.size();
  }

  public Formula get(int index)
  {
    return args.get(index);
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
    return new FormulaPredicate(name, FormulaPool.freeze(lArgs));
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

package org.zen.logic.value;

import java.util.ArrayList;
import java.util.List;

import org.zen.logic.formula.grammar.ConnectiveKind;
import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.formula.grammar.FormulaConnective;
import org.zen.logic.formula.grammar.FormulaEquation;
import org.zen.logic.formula.grammar.FormulaInequality;
import org.zen.logic.formula.grammar.FormulaMathFunction;
import org.zen.logic.formula.grammar.FormulaNumber;
import org.zen.logic.formula.grammar.FormulaPool;
import org.zen.logic.formula.grammar.FormulaPredicate;
import org.zen.logic.formula.grammar.FormulaProofMarker;
import org.zen.logic.formula.grammar.FormulaProposition;
import org.zen.logic.formula.grammar.FormulaQuantifier;
import org.zen.logic.formula.grammar.FormulaString;
import org.zen.logic.formula.grammar.FormulaVariable;
import org.zen.logic.formula.grammar.InequalityKind;
import org.zen.logic.formula.grammar.InferenceRuleKind;
import org.zen.logic.formula.grammar.QuantifierKind;
import org.zen.logic.kb.exceptions.FormulaConversionException;

/**
 * Translates between boxed values and formula trees.
 *
 * A formula is represented by an object whose <code>"type"</code> field names the node kind:
 *
 * <pre>
 *   quantifier     quantifier_type ("universal" | "existential", default universal), variable, [domain], body
 *   connective     connective_type ("and" | "or" | "not" | "implies" | "iff"), [left], [right]
 *   predicate      name, [args]
 *   proposition    name, [truth]
 *   variable       name, [is_bound]
 *   equation       left, right
 *   inequality     inequality_type ("lt" | "le" | "gt" | "ge"), left, right
 *   math_function  name, [args]
 *   premise        [statement]
 *   conclusion     [statement]
 *   inference      rule, [premises], [statement]
 * </pre>
 *
 * Inside <code>args</code>, and as either side of an equation or inequality, plain numbers and strings stand for
 * literal leaves.  Conversion is all-or-nothing: any problem anywhere in the value raises an exception and no partial
 * tree is returned.
 */
public final class FormulaValueConverter
{
  public static final String TYPE = "type";

  private FormulaValueConverter()
  {
  }

  //---------------------------------------------------------------------------
  // Value -> Formula
  //---------------------------------------------------------------------------

  /**
   * Convert a boxed value to a formula tree.
   *
   * @param xiValue - the value.
   * @return the tree.
   *
   * @throws FormulaConversionException if the value doesn't describe a formula.
   */
  public static Formula toFormula(Value xiValue) throws FormulaConversionException
  {
    ObjectValue lObject = asObject(xiValue, "formula");
    String lType = requireString(lObject, TYPE);

    switch (lType)
    {
      case "quantifier":    return toQuantifier(lObject);
      case "connective":    return toConnective(lObject);
      case "predicate":     return FormulaPool.getPredicate(requireString(lObject, "name"), toArgs(lObject));
      case "proposition":   return toProposition(lObject);
      case "variable":      return FormulaPool.getVariable(requireString(lObject, "name"),
                                                           optionalBoolean(lObject, "is_bound", false));
      case "equation":      return FormulaPool.getEquation(toTerm(require(lObject, "left")),
                                                           toTerm(require(lObject, "right")));
      case "inequality":    return toInequality(lObject);
      case "math_function": return FormulaPool.getMathFunction(requireString(lObject, "name"), toArgs(lObject));
      case "premise":       return FormulaPool.getPremise(optionalFormula(lObject, "statement"));
      case "conclusion":    return FormulaPool.getConclusion(optionalFormula(lObject, "statement"));
      case "inference":     return toInferenceStep(lObject);
      default:              throw new FormulaConversionException("Unknown formula type '" + lType + "'");
    }
  }

  /**
   * Convert each element of an array, or a single formula object, to a formula.
   *
   * @param xiValue - an array of formula objects, or one formula object.
   * @return the trees, in order.
   */
  public static List<Formula> toFormulas(Value xiValue) throws FormulaConversionException
  {
    List<Formula> lFormulas = new ArrayList<>();
    if ((xiValue != null) && xiValue.is(ValueType.ARRAY))
    {
      for (Value lElement : (ArrayValue)xiValue)
      {
        lFormulas.add(toFormula(lElement));
      }
    }
    else
    {
      lFormulas.add(toFormula(xiValue));
    }
    return lFormulas;
  }

  private static Formula toQuantifier(ObjectValue xiObject) throws FormulaConversionException
  {
    QuantifierKind lKind = QuantifierKind.UNIVERSAL;
    if (xiObject.has("quantifier_type"))
    {
      String lName = requireString(xiObject, "quantifier_type");
      if ("universal".equals(lName))
      {
        lKind = QuantifierKind.UNIVERSAL;
      }
      else if ("existential".equals(lName))
      {
        lKind = QuantifierKind.EXISTENTIAL;
      }
      else
      {
        throw new FormulaConversionException("Unknown quantifier type '" + lName + "'");
      }
    }

    String lVariable = requireString(xiObject, "variable");
    Formula lDomain = optionalFormula(xiObject, "domain");
    Formula lBody = toFormula(require(xiObject, "body"));
    return FormulaPool.getQuantifier(lKind, lVariable, lDomain, lBody);
  }

  private static Formula toConnective(ObjectValue xiObject) throws FormulaConversionException
  {
    String lName = requireString(xiObject, "connective_type");
    ConnectiveKind lKind;
    switch (lName)
    {
      case "and":     lKind = ConnectiveKind.AND;     break;
      case "or":      lKind = ConnectiveKind.OR;      break;
      case "not":     lKind = ConnectiveKind.NOT;     break;
      case "implies": lKind = ConnectiveKind.IMPLIES; break;
      case "iff":     lKind = ConnectiveKind.IFF;     break;
      default:        throw new FormulaConversionException("Unknown connective type '" + lName + "'");
    }

    if (lKind.isUnary())
    {
      if (isPresent(xiObject, "left"))
      {
        throw new FormulaConversionException("'not' takes only a right operand");
      }
      return FormulaPool.getNot(optionalFormula(xiObject, "right"));
    }

    return FormulaPool.getConnective(lKind, optionalFormula(xiObject, "left"), optionalFormula(xiObject, "right"));
  }

  private static Formula toProposition(ObjectValue xiObject) throws FormulaConversionException
  {
    String lName = requireString(xiObject, "name");
    if (!isPresent(xiObject, "truth"))
    {
      return FormulaPool.getProposition(lName);
    }
    return FormulaPool.getProposition(lName, optionalBoolean(xiObject, "truth", false));
  }

  private static Formula toInequality(ObjectValue xiObject) throws FormulaConversionException
  {
    String lName = requireString(xiObject, "inequality_type");
    InequalityKind lKind;
    switch (lName)
    {
      case "lt": lKind = InequalityKind.LT; break;
      case "le": lKind = InequalityKind.LE; break;
      case "gt": lKind = InequalityKind.GT; break;
      case "ge": lKind = InequalityKind.GE; break;
      default:   throw new FormulaConversionException("Unknown inequality type '" + lName + "'");
    }

    return FormulaPool.getInequality(lKind,
                                     toTerm(require(xiObject, "left")),
                                     toTerm(require(xiObject, "right")));
  }

  private static Formula toInferenceStep(ObjectValue xiObject) throws FormulaConversionException
  {
    // Unknown rule names are representable.  They just never license anything.
    InferenceRuleKind lRule = InferenceRuleKind.fromName(requireString(xiObject, "rule"));

    List<Formula> lPremises = new ArrayList<>();
    if (isPresent(xiObject, "premises"))
    {
      for (Value lPremise : asArray(xiObject.get("premises"), "premises"))
      {
        lPremises.add(toFormula(lPremise));
      }
    }
    return FormulaPool.getInferenceStep(lRule, lPremises, optionalFormula(xiObject, "statement"));
  }

  private static List<Formula> toArgs(ObjectValue xiObject) throws FormulaConversionException
  {
    List<Formula> lArgs = new ArrayList<>();
    if (!isPresent(xiObject, "args"))
    {
      return lArgs;
    }

    for (Value lArg : asArray(xiObject.get("args"), "args"))
    {
      lArgs.add(toTerm(lArg));
    }
    return lArgs;
  }

  /**
   * Convert a term: a formula object, or a plain number or string standing for a literal.
   */
  private static Formula toTerm(Value xiValue) throws FormulaConversionException
  {
    switch (xiValue.getType())
    {
      case NUMBER: return FormulaPool.getNumber(((NumberValue)xiValue).getValue());
      case STRING: return FormulaPool.getString(((StringValue)xiValue).getValue());
      default:     return toFormula(xiValue);
    }
  }

  private static boolean isPresent(ObjectValue xiObject, String xiKey)
  {
    Value lValue = xiObject.get(xiKey);
    return (lValue != null) && !lValue.is(ValueType.NULL);
  }

  private static Value require(ObjectValue xiObject, String xiKey) throws FormulaConversionException
  {
    if (!isPresent(xiObject, xiKey))
    {
      throw new FormulaConversionException("Missing required field '" + xiKey + "' in " + xiObject);
    }
    return xiObject.get(xiKey);
  }

  private static String requireString(ObjectValue xiObject, String xiKey) throws FormulaConversionException
  {
    Value lValue = require(xiObject, xiKey);
    if (!lValue.is(ValueType.STRING))
    {
      throw new FormulaConversionException("Field '" + xiKey + "' must be a string, but is " + lValue);
    }
    return ((StringValue)lValue).getValue();
  }

  private static boolean optionalBoolean(ObjectValue xiObject, String xiKey, boolean xiDefault)
    throws FormulaConversionException
  {
    if (!isPresent(xiObject, xiKey))
    {
      return xiDefault;
    }

    Value lValue = xiObject.get(xiKey);
    if (!lValue.is(ValueType.BOOLEAN))
    {
      throw new FormulaConversionException("Field '" + xiKey + "' must be a boolean, but is " + lValue);
    }
    return ((BooleanValue)lValue).getValue();
  }

  private static Formula optionalFormula(ObjectValue xiObject, String xiKey) throws FormulaConversionException
  {
    return isPresent(xiObject, xiKey) ? toFormula(xiObject.get(xiKey)) : null;
  }

  private static ObjectValue asObject(Value xiValue, String xiWhat) throws FormulaConversionException
  {
    if ((xiValue == null) || !xiValue.is(ValueType.OBJECT))
    {
      throw new FormulaConversionException("Expected an object for the " + xiWhat + ", but got " + xiValue);
    }
    return (ObjectValue)xiValue;
  }

  private static ArrayValue asArray(Value xiValue, String xiWhat) throws FormulaConversionException
  {
    if ((xiValue == null) || !xiValue.is(ValueType.ARRAY))
    {
      throw new FormulaConversionException("Expected an array for '" + xiWhat + "', but got " + xiValue);
    }
    return (ArrayValue)xiValue;
  }

  //---------------------------------------------------------------------------
  // Formula -> Value
  //---------------------------------------------------------------------------

  /**
   * Convert a formula tree to its boxed representation.
   *
   * @param xiFormula - the tree, or null.
   * @return the value ({@link NullValue} for null).
   */
  public static Value toValue(Formula xiFormula)
  {
    if (xiFormula == null)
    {
      return Values.nullValue();
    }

    switch (xiFormula.getKind())
    {
      case QUANTIFIER:
      {
        FormulaQuantifier lQuantifier = (FormulaQuantifier)xiFormula;
        ObjectValue lObject = typed("quantifier");
        lObject.set("quantifier_type", Values.string(lQuantifier.isUniversal() ? "universal" : "existential"));
        lObject.set("variable", Values.string(lQuantifier.getVariable()));
        if (lQuantifier.getDomain() != null)
        {
          lObject.set("domain", toValue(lQuantifier.getDomain()));
        }
        return lObject.set("body", toValue(lQuantifier.getBody()));
      }

      case CONNECTIVE:
      {
        FormulaConnective lConnective = (FormulaConnective)xiFormula;
        ObjectValue lObject = typed("connective");
        lObject.set("connective_type", Values.string(lConnective.getConnectiveKind().name().toLowerCase()));
        if (lConnective.getLeft() != null)
        {
          lObject.set("left", toValue(lConnective.getLeft()));
        }
        return lObject.set("right", toValue(lConnective.getRight()));
      }

      case PREDICATE:
      {
        FormulaPredicate lPredicate = (FormulaPredicate)xiFormula;
        return typed("predicate").set("name", Values.string(lPredicate.getName()))
                                 .set("args", toValues(lPredicate.getArgs()));
      }

      case VARIABLE:
      {
        FormulaVariable lVariable = (FormulaVariable)xiFormula;
        return typed("variable").set("name", Values.string(lVariable.getName()))
                                .set("is_bound", Values.bool(lVariable.isBound()));
      }

      case PROPOSITION:
      {
        FormulaProposition lProposition = (FormulaProposition)xiFormula;
        ObjectValue lObject = typed("proposition").set("name", Values.string(lProposition.getName()));
        if (lProposition.getTruth() != null)
        {
          lObject.set("truth", Values.bool(lProposition.getTruth()));
        }
        return lObject;
      }

      case EQUATION:
      {
        FormulaEquation lEquation = (FormulaEquation)xiFormula;
        return typed("equation").set("left", toValue(lEquation.getLeft()))
                                .set("right", toValue(lEquation.getRight()));
      }

      case INEQUALITY:
      {
        FormulaInequality lInequality = (FormulaInequality)xiFormula;
        return typed("inequality").set("inequality_type",
                                       Values.string(lInequality.getInequalityKind().name().toLowerCase()))
                                  .set("left", toValue(lInequality.getLeft()))
                                  .set("right", toValue(lInequality.getRight()));
      }

      case MATH_FUNCTION:
      {
        FormulaMathFunction lFunction = (FormulaMathFunction)xiFormula;
        return typed("math_function").set("name", Values.string(lFunction.getName()))
                                     .set("args", toValues(lFunction.getArgs()));
      }

      case PROOF_MARKER:
        return markerToValue((FormulaProofMarker)xiFormula);

      case NUMBER:
        return Values.number(((FormulaNumber)xiFormula).getValue());

      case STRING:
        return Values.string(((FormulaString)xiFormula).getValue());

      default:
        throw new IllegalStateException("Unknown formula kind: " + xiFormula.getKind());
    }
  }

  private static Value markerToValue(FormulaProofMarker xiMarker)
  {
    ObjectValue lObject;
    switch (xiMarker.getMarkerKind())
    {
      case PREMISE:
        lObject = typed("premise");
        break;

      case CONCLUSION:
        lObject = typed("conclusion");
        break;

      default:
        lObject = typed("inference").set("rule", Values.string(xiMarker.getRule().getName()))
                                    .set("premises", toValues(xiMarker.getPremises()));
        break;
    }

    if (xiMarker.getStatement() != null)
    {
      lObject.set("statement", toValue(xiMarker.getStatement()));
    }
    return lObject;
  }

  /**
   * @return an array of the boxed representations of the formulas.
   */
  public static ArrayValue toValues(List<? extends Formula> xiFormulas)
  {
    ArrayValue lArray = Values.newArray();
    for (Formula lFormula : xiFormulas)
    {
      lArray.add(toValue(lFormula));
    }
    return lArray;
  }

  private static ObjectValue typed(String xiType)
  {
    return Values.newObject().set(TYPE, Values.string(xiType));
  }
}

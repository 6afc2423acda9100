package org.zen.logic.value;

import org.zen.logic.kb.exceptions.LogicErrorCode;
import org.zen.logic.kb.exceptions.LogicException;

/**
 * Factory for boxed values.
 */
public final class Values
{
  private Values()
  {
  }

  public static NullValue nullValue()
  {
    return NullValue.INSTANCE;
  }

  public static BooleanValue bool(boolean xiValue)
  {
    return xiValue ? BooleanValue.TRUE : BooleanValue.FALSE;
  }

  public static NumberValue number(double xiValue)
  {
    return new NumberValue(xiValue);
  }

  /**
   * @return a string value.  A null string becomes the empty string.
   */
  public static StringValue string(String xiValue)
  {
    return new StringValue(xiValue == null ? "" : xiValue);
  }

  public static ArrayValue newArray()
  {
    return new ArrayValue();
  }

  public static ArrayValue array(Value... xiElements)
  {
    ArrayValue lArray = new ArrayValue();
    for (Value lElement : xiElements)
    {
      lArray.add(lElement);
    }
    return lArray;
  }

  public static ObjectValue newObject()
  {
    return new ObjectValue();
  }

  public static UndecidableValue undecidable()
  {
    return UndecidableValue.INSTANCE;
  }

  /**
   * @return an error without a logic-specific code.
   */
  public static ErrorValue error(String xiMessage)
  {
    return new ErrorValue(xiMessage, LogicErrorCode.NONE);
  }

  public static ErrorValue error(String xiMessage, LogicErrorCode xiCode)
  {
    return new ErrorValue(xiMessage, xiCode);
  }

  /**
   * @return the error a script sees for a failure inside the logic system.
   */
  public static ErrorValue error(LogicException xiException)
  {
    return new ErrorValue(xiException.getMessage(), xiException.getErrorCode());
  }
}

package org.zen.logic.value;

import org.zen.logic.kb.exceptions.LogicErrorCode;

/**
 * A failed call.  Carries a human-readable message and the numeric code scripts branch on.
 */
public final class ErrorValue extends Value
{
  private final String         message;
  private final LogicErrorCode code;

  ErrorValue(String message, LogicErrorCode code)
  {
    this.message = message;
    this.code = code;
  }

  @Override
  public ValueType getType()
  {
    return ValueType.ERROR;
  }

  public String getMessage()
  {
    return message;
  }

  public LogicErrorCode getErrorCode()
  {
    return code;
  }

  /**
   * @return the numeric code, 0 for errors without a logic-specific code.
   */
  public int getCode()
  {
    return code.getCode();
  }

  @Override
  public String toString()
  {
    return "Error(" + code.getCode() + "): " + message;
  }
}

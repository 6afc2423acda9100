package org.zen.logic.kb.exceptions;

/**
 * Thrown when a boxed value cannot be translated to a formula tree (or a formula cannot be evaluated in the way
 * requested).  No partial tree is ever produced.
 */
public class FormulaConversionException extends LogicException
{
  private static final long serialVersionUID = 1L;

  public FormulaConversionException(String xiMessage)
  {
    super(xiMessage, LogicErrorCode.PARSE_FAILED);
  }
}

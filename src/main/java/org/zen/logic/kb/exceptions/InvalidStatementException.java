package org.zen.logic.kb.exceptions;

/**
 * Thrown when a statement offered as a theorem, hypothesis or axiom is not a well-formed logical formula.
 */
public class InvalidStatementException extends LogicException
{
  private static final long serialVersionUID = 1L;

  public InvalidStatementException(String xiMessage, LogicErrorCode xiErrorCode)
  {
    super(xiMessage, xiErrorCode);
  }
}

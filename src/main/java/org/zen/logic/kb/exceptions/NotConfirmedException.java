package org.zen.logic.kb.exceptions;

/**
 * Thrown when a destructive operation is requested without explicit confirmation.
 */
public class NotConfirmedException extends LogicException
{
  private static final long serialVersionUID = 1L;

  public NotConfirmedException(String xiOperation)
  {
    super(xiOperation + " requires confirmation (pass true to confirm)", LogicErrorCode.NONE);
  }
}

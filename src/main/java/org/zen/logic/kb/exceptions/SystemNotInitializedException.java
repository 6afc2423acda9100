package org.zen.logic.kb.exceptions;

/**
 * Thrown when the logic system is used before {@code init()} or after {@code cleanup()}.
 */
public class SystemNotInitializedException extends LogicException
{
  private static final long serialVersionUID = 1L;

  public SystemNotInitializedException()
  {
    super("Logic system is not initialized", LogicErrorCode.SYSTEM_NOT_INIT);
  }
}

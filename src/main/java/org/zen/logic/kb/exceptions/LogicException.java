package org.zen.logic.kb.exceptions;

/**
 * Abstract class for failures reported by the logic system.  Every failure carries the error code scripts see.
 */
public abstract class LogicException extends Exception
{
  private static final long serialVersionUID = 1L;

  private final LogicErrorCode mErrorCode;

  protected LogicException(String xiMessage, LogicErrorCode xiErrorCode)
  {
    super(xiMessage);
    mErrorCode = xiErrorCode;
  }

  protected LogicException(String xiMessage, LogicErrorCode xiErrorCode, Throwable xiCause)
  {
    super(xiMessage, xiCause);
    mErrorCode = xiErrorCode;
  }

  public LogicErrorCode getErrorCode()
  {
    return mErrorCode;
  }
}

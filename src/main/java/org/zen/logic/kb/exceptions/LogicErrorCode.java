package org.zen.logic.kb.exceptions;

/**
 * Numeric error codes reported to scripts.  The values are part of the scripting interface and must not change.
 */
public enum LogicErrorCode
{
  /**
   * A plain error (bad argument count or type, missing confirmation) with no logic-specific code.
   */
  NONE(0),
  INVALID_THEOREM(-1001),
  INVALID_PROOF(-1002),
  INVALID_AXIOM(-1003),
  PROOF_INCOMPLETE(-1004),
  INCONSISTENT(-1005),
  TIMEOUT(-1006),
  PARSE_FAILED(-1007),
  NOT_FOUND(-1008),
  SYSTEM_NOT_INIT(-1009),
  MEMORY_ALLOC(-1010);

  private final int mCode;

  private LogicErrorCode(int xiCode)
  {
    mCode = xiCode;
  }

  public int getCode()
  {
    return mCode;
  }

  /**
   * @return the error with the specified numeric code, or {@link #NONE} if there isn't one.
   */
  public static LogicErrorCode fromCode(int xiCode)
  {
    for (LogicErrorCode lError : values())
    {
      if (lError.mCode == xiCode)
      {
        return lError;
      }
    }
    return NONE;
  }
}

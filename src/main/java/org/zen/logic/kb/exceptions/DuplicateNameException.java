package org.zen.logic.kb.exceptions;

/**
 * Thrown when a theorem or axiom is defined under a name that is already taken.
 */
public class DuplicateNameException extends LogicException
{
  private static final long serialVersionUID = 1L;

  private final String mName;

  public DuplicateNameException(String xiEntity, String xiName, LogicErrorCode xiErrorCode)
  {
    super(xiEntity + " '" + xiName + "' already exists", xiErrorCode);
    mName = xiName;
  }

  public String getName()
  {
    return mName;
  }
}

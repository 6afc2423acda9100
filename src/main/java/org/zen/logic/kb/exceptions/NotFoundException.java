package org.zen.logic.kb.exceptions;

/**
 * Thrown when a named theorem, axiom or proof does not exist.
 */
public class NotFoundException extends LogicException
{
  private static final long serialVersionUID = 1L;

  private final String mName;

  public NotFoundException(String xiEntity, String xiName)
  {
    super(xiEntity + " '" + xiName + "' not found", LogicErrorCode.NOT_FOUND);
    mName = xiName;
  }

  public String getName()
  {
    return mName;
  }
}

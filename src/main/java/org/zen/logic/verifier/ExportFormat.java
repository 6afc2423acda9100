package org.zen.logic.verifier;

/**
 * Formats a verified proof can be exported in.
 */
public enum ExportFormat
{
  MARKDOWN("markdown"),
  LATEX("latex"),
  TEXT("text");

  private final String mName;

  private ExportFormat(String xiName)
  {
    mName = xiName;
  }

  public String getName()
  {
    return mName;
  }

  /**
   * @return the format with the specified name (case-insensitive), or null if there isn't one.
   */
  public static ExportFormat fromName(String xiName)
  {
    for (ExportFormat lFormat : values())
    {
      if (lFormat.mName.equalsIgnoreCase(xiName))
      {
        return lFormat;
      }
    }
    return null;
  }
}

package org.aspgen.base.util.solver;

/**
 * Severity of a solver message, lowest first.
 */
public enum MessageLevel
{
  DEBUG,
  INFO,
  WARNING,
  ERROR,
  CRITICAL;

  /**
   * @return the level corresponding to the solver's (or a configuration file's) name for it.  Unknown names are
   * treated as {@link #INFO}.
   *
   * @param xiName - the name, in any case.
   */
  public static MessageLevel fromString(String xiName)
  {
    if (xiName == null)
    {
      return INFO;
    }

    switch (xiName.trim().toLowerCase())
    {
      case "debug":
        return DEBUG;
      case "warn":
      case "warning":
        return WARNING;
      case "error":
        return ERROR;
      case "critical":
      case "fatal":
        return CRITICAL;
      default:
        return INFO;
    }
  }

  public boolean isAtLeast(MessageLevel xiOther)
  {
    return compareTo(xiOther) >= 0;
  }
}

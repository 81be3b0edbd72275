package org.aspgen.base.util.solver;

/**
 * A message reported by the solver, with the location in the program text that it refers to (if any).
 */
public final class SolverMessage
{
  private final String       mFileName;
  private final int          mLine;
  private final int          mColumnStart;
  private final int          mColumnEnd;
  private final MessageLevel mLevel;
  private final String       mSeverity;
  private final String       mText;

  /**
   * @param xiFileName - the source the location refers to.
   * @param xiLine - 1-based line number, or 0 if the message has no location.
   * @param xiColumnStart - 1-based first column.
   * @param xiColumnEnd - 1-based column just past the end.
   * @param xiSeverity - the solver's name for the severity.
   * @param xiText - the message.
   */
  public SolverMessage(String xiFileName,
                       int xiLine,
                       int xiColumnStart,
                       int xiColumnEnd,
                       String xiSeverity,
                       String xiText)
  {
    mFileName = xiFileName;
    mLine = xiLine;
    mColumnStart = xiColumnStart;
    mColumnEnd = xiColumnEnd;
    mSeverity = xiSeverity;
    mLevel = MessageLevel.fromString(xiSeverity);
    mText = xiText;
  }

  public String getFileName()
  {
    return mFileName;
  }

  public int getLine()
  {
    return mLine;
  }

  public int getColumnStart()
  {
    return mColumnStart;
  }

  public int getColumnEnd()
  {
    return mColumnEnd;
  }

  public MessageLevel getLevel()
  {
    return mLevel;
  }

  public String getSeverity()
  {
    return mSeverity;
  }

  public String getText()
  {
    return mText;
  }

  public boolean hasLocation()
  {
    return mLine > 0;
  }

  /**
   * @return a copy of this message with further text appended on a new line.
   */
  SolverMessage withContinuation(String xiMore)
  {
    return new SolverMessage(mFileName, mLine, mColumnStart, mColumnEnd, mSeverity, mText + "\n" + xiMore);
  }

  @Override
  public String toString()
  {
    return mSeverity + ": " + mText + (hasLocation() ? " (" + mFileName + ":" + mLine + ":" + mColumnStart + ")" : "");
  }
}

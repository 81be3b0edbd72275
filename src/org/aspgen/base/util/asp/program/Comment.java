package org.aspgen.base.util.asp.program;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A comment.  Single-line comments render as <tt>% text</tt>, anything longer as a <tt>%* ... *%</tt> block.
 */
public final class Comment implements ProgramElement
{
  private final String mText;

  public Comment(String xiText)
  {
    checkNotNull(xiText, "Comment text may not be null");
    checkArgument(!xiText.contains("*%"), "Comment text may not contain the block terminator '*%': %s", xiText);
    mText = xiText;
  }

  public String getText()
  {
    return mText;
  }

  public boolean isMultiLine()
  {
    return mText.contains("\n");
  }

  @Override
  public String render()
  {
    if (isMultiLine())
    {
      return "%*\n" + mText + "\n*%";
    }
    return "% " + mText;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    return (xiOther instanceof Comment) && ((Comment)xiOther).mText.equals(mText);
  }

  @Override
  public int hashCode()
  {
    return mText.hashCode();
  }

  @Override
  public String toString()
  {
    return render();
  }
}

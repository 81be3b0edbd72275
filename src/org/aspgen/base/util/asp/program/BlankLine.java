package org.aspgen.base.util.asp.program;

/**
 * An empty line, for layout.
 */
public final class BlankLine implements ProgramElement
{
  public static final BlankLine INSTANCE = new BlankLine();

  private BlankLine()
  {
  }

  @Override
  public String render()
  {
    return "";
  }

  @Override
  public String toString()
  {
    return "<blank>";
  }
}

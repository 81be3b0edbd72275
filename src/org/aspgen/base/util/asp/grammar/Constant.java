package org.aspgen.base.util.asp.grammar;

/**
 * An integer constant.
 */
@SuppressWarnings("serial")
public final class Constant extends Value
{
  private final int value;

  public Constant(int value)
  {
    this.value = value;
  }

  public static Constant of(int value)
  {
    return new Constant(value);
  }

  public int getValue()
  {
    return value;
  }

  @Override
  public TermKind getKind()
  {
    return TermKind.NUMBER;
  }

  @Override
  public boolean isGround()
  {
    return true;
  }

  @Override
  public String render()
  {
    return Integer.toString(value);
  }

  @Override
  public boolean equals(Object o)
  {
    return (o instanceof Constant) && ((Constant)o).value == value;
  }

  @Override
  public int hashCode()
  {
    return value;
  }
}

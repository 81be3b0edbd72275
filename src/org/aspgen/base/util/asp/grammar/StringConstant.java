package org.aspgen.base.util.asp.grammar;

import static com.google.common.base.Preconditions.checkArgument;

import org.apache.commons.lang.StringUtils;

/**
 * A quoted string constant.  Escapes aren't supported, so the text may not contain quotes, backslashes or line
 * breaks.
 */
@SuppressWarnings("serial")
public final class StringConstant extends Value
{
  private final String value;

  public StringConstant(String value)
  {
    checkArgument(value != null, "String constant may not be null");
    checkArgument(!StringUtils.containsAny(value, "\"\\\r\n"),
                  "String constant may not contain quotes, backslashes or line breaks: %s",
                  value);
    this.value = value;
  }

  public static StringConstant of(String value)
  {
    return new StringConstant(value);
  }

  public String getValue()
  {
    return value;
  }

  @Override
  public TermKind getKind()
  {
    return TermKind.STRING;
  }

  @Override
  public boolean isGround()
  {
    return true;
  }

  @Override
  public String render()
  {
    return "\"" + value + "\"";
  }

  @Override
  public boolean equals(Object o)
  {
    return (o instanceof StringConstant) && ((StringConstant)o).value.equals(value);
  }

  @Override
  public int hashCode()
  {
    return value.hashCode();
  }
}

package org.aspgen.base.util.asp.grammar;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.regex.Pattern;

/**
 * A named constant whose value is supplied by a <tt>#const</tt> directive.  A program only accepts symbolic constants
 * that have been registered with it, so normally these come from
 * {@link org.aspgen.base.util.asp.program.Program#registerConstant(String, int)}.
 */
@SuppressWarnings("serial")
public final class SymbolicConstant extends Value
{
  private static final Pattern NAME_PATTERN = Pattern.compile("[a-z][A-Za-z0-9_]*");

  private final String name;

  public SymbolicConstant(String name)
  {
    checkArgument(name != null && NAME_PATTERN.matcher(name).matches(),
                  "Invalid symbolic constant name '%s': must start with a lower-case letter and contain only " +
                  "letters, digits and underscores",
                  name);
    this.name = name;
  }

  public static SymbolicConstant of(String name)
  {
    return new SymbolicConstant(name);
  }

  public static boolean isValidName(String name)
  {
    return name != null && NAME_PATTERN.matcher(name).matches();
  }

  public String getName()
  {
    return name;
  }

  @Override
  public TermKind getKind()
  {
    return TermKind.SYMBOLIC_CONSTANT;
  }

  @Override
  public boolean isGround()
  {
    return true;
  }

  @Override
  public String render()
  {
    return name;
  }

  @Override
  public boolean equals(Object o)
  {
    return (o instanceof SymbolicConstant) && ((SymbolicConstant)o).name.equals(name);
  }

  @Override
  public int hashCode()
  {
    return name.hashCode();
  }
}

package org.aspgen.base.util.asp.grammar;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.regex.Pattern;

/**
 * A variable.  Names start with an upper-case letter (optionally after leading underscores).  The bare name
 * <tt>_</tt> is the anonymous variable, available as {@link #ANY}.
 */
@SuppressWarnings("serial")
public final class Variable extends Value
{
  private static final Pattern NAME_PATTERN = Pattern.compile("_|_*[A-Z][A-Za-z0-9_']*");

  /**
   * The anonymous variable.
   */
  public static final Variable ANY = new Variable("_");

  private final String name;

  public Variable(String name)
  {
    checkArgument(name != null && NAME_PATTERN.matcher(name).matches(),
                  "Invalid variable name '%s': must start with an upper-case letter, or be _",
                  name);
    this.name = name;
  }

  public static Variable of(String name)
  {
    return "_".equals(name) ? ANY : new Variable(name);
  }

  public String getName()
  {
    return name;
  }

  public boolean isAnonymous()
  {
    return "_".equals(name);
  }

  /**
   * @return the comparison <tt>X = pool</tt>, which binds this variable to each member of the pool in turn.
   *
   * @param pool - the domain.
   */
  public Comparison in(Pool pool)
  {
    return new Comparison(this, ComparisonOperator.EQUAL, pool);
  }

  @Override
  public TermKind getKind()
  {
    return TermKind.VARIABLE;
  }

  @Override
  public boolean isGround()
  {
    return false;
  }

  @Override
  public String render()
  {
    return name;
  }

  @Override
  public boolean equals(Object o)
  {
    return (o instanceof Variable) && ((Variable)o).name.equals(name);
  }

  @Override
  public int hashCode()
  {
    return name.hashCode();
  }
}

package org.aspgen.base.util.asp.grammar;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Serializable;
import java.util.regex.Pattern;

import com.google.common.base.Objects;

/**
 * A named, typed field of a {@link PredicateDefinition}.
 */
@SuppressWarnings("serial")
public final class Field implements Serializable
{
  private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final String name;
  private final FieldKind kind;

  public Field(String name, FieldKind kind)
  {
    checkArgument(name != null && NAME_PATTERN.matcher(name).matches(), "Invalid field name '%s'", name);
    this.name = name;
    this.kind = checkNotNull(kind);
  }

  /**
   * @return a field that accepts any argument.
   */
  public static Field of(String name)
  {
    return new Field(name, FieldKind.ANY);
  }

  public static Field value(String name)
  {
    return new Field(name, FieldKind.VALUE);
  }

  public static Field predicate(String name)
  {
    return new Field(name, FieldKind.PREDICATE);
  }

  public String getName()
  {
    return name;
  }

  public FieldKind getKind()
  {
    return kind;
  }

  @Override
  public boolean equals(Object o)
  {
    if (!(o instanceof Field))
    {
      return false;
    }
    Field other = (Field)o;
    return name.equals(other.name) && kind == other.kind;
  }

  @Override
  public int hashCode()
  {
    return Objects.hashCode(name, kind);
  }

  @Override
  public String toString()
  {
    return (kind == FieldKind.ANY) ? name : name + ":" + kind.name().toLowerCase();
  }
}

package org.aspgen.base.util.asp.grammar;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.aspgen.base.util.asp.exceptions.ArityMismatchException;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * The definition of a predicate: its name, optional namespace, ordered fields and whether it is shown in solver
 * output.  Definitions are immutable; {@link #inNamespace(String)} and {@link #hidden()} return new definitions.
 *
 * Instances are created from a definition, either positionally:
 *
 * <pre>
 *   PredicateDefinition cell = PredicateDefinition.define("cell", "row", "col");
 *   Predicate p = cell.of(1, Variable.of("C"));
 * </pre>
 *
 * or by field name with {@link #ofFields(Map)}.
 */
@SuppressWarnings("serial")
public final class PredicateDefinition implements Serializable
{
  private static final Pattern NAME_PATTERN = Pattern.compile("[a-z][A-Za-z0-9_]*");

  private final String name;
  private final String namespace;
  private final ImmutableList<Field> fields;
  private final boolean show;

  private PredicateDefinition(String name, String namespace, List<Field> fields, boolean show)
  {
    checkArgument(name != null && NAME_PATTERN.matcher(name).matches(),
                  "Invalid predicate name '%s': must start with a lower-case letter",
                  name);
    checkArgument(namespace.isEmpty() || NAME_PATTERN.matcher(namespace).matches(),
                  "Invalid namespace '%s'",
                  namespace);

    Set<String> lSeen = new HashSet<>();
    for (Field lField : fields)
    {
      checkArgument(lSeen.add(lField.getName()), "Duplicate field '%s' in predicate %s", lField.getName(), name);
    }

    this.name = name;
    this.namespace = namespace;
    this.fields = ImmutableList.copyOf(fields);
    this.show = show;
  }

  /**
   * @return a new (shown, un-namespaced) nullary definition.
   *
   * @param name - the predicate name.
   */
  public static PredicateDefinition define(String name)
  {
    return new PredicateDefinition(name, "", ImmutableList.<Field>of(), true);
  }

  /**
   * @return a new (shown, un-namespaced) definition whose fields accept any argument.
   *
   * @param name - the predicate name.
   * @param fieldNames - the field names, in order.
   */
  public static PredicateDefinition define(String name, String... fieldNames)
  {
    List<Field> lFields = new ArrayList<>();
    for (String lFieldName : fieldNames)
    {
      lFields.add(Field.of(lFieldName));
    }
    return new PredicateDefinition(name, "", lFields, true);
  }

  /**
   * @return a new (shown, un-namespaced) definition with explicitly typed fields.
   *
   * @param name - the predicate name.
   * @param fields - the fields, in order.
   */
  public static PredicateDefinition define(String name, Field... fields)
  {
    return new PredicateDefinition(name, "", ImmutableList.copyOf(fields), true);
  }

  /**
   * @return a copy of this definition in the specified namespace.  An empty namespace means none.
   */
  public PredicateDefinition inNamespace(String newNamespace)
  {
    return new PredicateDefinition(name, newNamespace == null ? "" : newNamespace, fields, show);
  }

  /**
   * @return a copy of this definition that isn't shown in solver output.
   */
  public PredicateDefinition hidden()
  {
    return new PredicateDefinition(name, namespace, fields, false);
  }

  /**
   * @return a copy of this definition that is shown in solver output.
   */
  public PredicateDefinition shown()
  {
    return new PredicateDefinition(name, namespace, fields, true);
  }

  /**
   * @return the full, rendered name, including any namespace prefix.
   */
  public String getName()
  {
    return namespace.isEmpty() ? name : namespace + "_" + name;
  }

  public String getBaseName()
  {
    return name;
  }

  public String getNamespace()
  {
    return namespace;
  }

  public List<Field> getFields()
  {
    return fields;
  }

  /**
   * @return the index of the named field, or -1 if there isn't one.
   */
  public int indexOf(String fieldName)
  {
    for (int ii = 0; ii < fields.size(); ii++)
    {
      if (fields.get(ii).getName().equals(fieldName))
      {
        return ii;
      }
    }
    return -1;
  }

  public int arity()
  {
    return fields.size();
  }

  public boolean isShown()
  {
    return show;
  }

  /**
   * @return the <tt>name/arity</tt> signature, as used by <tt>#show</tt>.
   */
  public String getSignature()
  {
    return getName() + "/" + arity();
  }

  /**
   * @return an instance of this predicate with the specified arguments, in field order.  Integers and strings are
   * converted to constants.
   *
   * @throws ArityMismatchException if the number of arguments doesn't match the number of fields.
   */
  public Predicate of(Object... arguments)
  {
    if (arguments.length != fields.size())
    {
      throw new ArityMismatchException(getName(), fields.size(), arguments.length, getSignature());
    }
    return new Predicate(this, Terms.coerceAll(ImmutableList.copyOf(arguments)));
  }

  /**
   * @return an instance of this predicate with arguments given by field name.
   *
   * @throws IllegalArgumentException if a field is missing or unknown.
   */
  public Predicate ofFields(Map<String, ?> arguments)
  {
    for (String lKey : arguments.keySet())
    {
      checkArgument(indexOf(lKey) >= 0, "Predicate %s has no field '%s'", getName(), lKey);
    }

    List<Term> lArguments = new ArrayList<>();
    for (Field lField : fields)
    {
      checkArgument(arguments.containsKey(lField.getName()),
                    "Missing value for field '%s' of predicate %s",
                    lField.getName(),
                    getName());
      lArguments.add(Terms.coerce(arguments.get(lField.getName())));
    }
    return new Predicate(this, lArguments);
  }

  @Override
  public boolean equals(Object o)
  {
    if (!(o instanceof PredicateDefinition))
    {
      return false;
    }
    PredicateDefinition other = (PredicateDefinition)o;
    return name.equals(other.name) &&
           namespace.equals(other.namespace) &&
           fields.equals(other.fields) &&
           show == other.show;
  }

  @Override
  public int hashCode()
  {
    return Objects.hashCode(name, namespace, fields, show);
  }

  @Override
  public String toString()
  {
    return getName() + fields + (show ? "" : " (hidden)");
  }
}

package org.aspgen.base.util.asp.grammar;

import java.util.List;

import org.aspgen.base.validator.ContainmentRules;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * An instance of a {@link PredicateDefinition}: an atom such as <tt>cell(1, C)</tt>.
 *
 * A predicate may be a literal in its own right, or a (function) argument of another predicate.
 */
@SuppressWarnings("serial")
public final class Predicate extends Term implements Literal
{
  private final PredicateDefinition definition;
  private final ImmutableList<Term> arguments;
  private transient Boolean         ground;

  Predicate(PredicateDefinition definition, List<Term> arguments)
  {
    for (int ii = 0; ii < arguments.size(); ii++)
    {
      ContainmentRules.checkArgument(definition, definition.getFields().get(ii), arguments.get(ii));
    }

    this.definition = definition;
    this.arguments = ImmutableList.copyOf(arguments);
    ground = null;
  }

  public PredicateDefinition getDefinition()
  {
    return definition;
  }

  /**
   * @return the full, rendered name of this predicate.
   */
  public String getName()
  {
    return definition.getName();
  }

  public int arity()
  {
    return arguments.size();
  }

  public boolean isShown()
  {
    return definition.isShown();
  }

  public List<Term> getArguments()
  {
    return arguments;
  }

  public Term get(int index)
  {
    return arguments.get(index);
  }

  /**
   * @return the argument for the named field.
   *
   * @throws IllegalArgumentException if there's no such field.
   */
  public Term get(String fieldName)
  {
    int lIndex = definition.indexOf(fieldName);
    if (lIndex < 0)
    {
      throw new IllegalArgumentException("Predicate " + getName() + " has no field '" + fieldName + "'");
    }
    return arguments.get(lIndex);
  }

  /**
   * @return the classical negation of this predicate, <tt>-p</tt>.
   */
  public ClassicalNegation negate()
  {
    return new ClassicalNegation(this);
  }

  @Override
  public Term not()
  {
    return DefaultNegation.of(this);
  }

  private boolean computeGround()
  {
    for (Term term : arguments)
    {
      if (!term.isGround())
      {
        return false;
      }
    }

    return true;
  }

  @Override
  public boolean isGround()
  {
    if (ground == null)
    {
      ground = computeGround();
    }

    return ground;
  }

  @Override
  public TermKind getKind()
  {
    return TermKind.PREDICATE;
  }

  @Override
  public List<Term> getChildren()
  {
    return arguments;
  }

  @Override
  public String render()
  {
    if (arguments.isEmpty())
    {
      return getName();
    }

    RenderContext lContext = (arguments.size() == 1) ? RenderContext.LONE_ARGUMENT : RenderContext.DEFAULT;
    StringBuilder sb = new StringBuilder(getName());
    sb.append("(");
    for (int ii = 0; ii < arguments.size(); ii++)
    {
      if (ii > 0)
      {
        sb.append(", ");
      }
      sb.append(arguments.get(ii).render(lContext));
    }
    sb.append(")");

    return sb.toString();
  }

  @Override
  public boolean equals(Object o)
  {
    if (!(o instanceof Predicate))
    {
      return false;
    }
    Predicate other = (Predicate)o;
    return definition.equals(other.definition) && arguments.equals(other.arguments);
  }

  @Override
  public int hashCode()
  {
    return Objects.hashCode(definition, arguments);
  }
}

package org.aspgen.base.util.asp.grammar;

import java.io.Serializable;
import java.util.List;

import org.aspgen.base.validator.Position;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * One element of an aggregate: a tuple of terms and the conditions under which it counts,
 * <tt>t1, t2 : c1, c2</tt>.  Elements are immutable; {@link #when(Term...)} returns a new one.
 */
@SuppressWarnings("serial")
public final class AggregateElement implements Serializable
{
  private final ImmutableList<Term> terms;
  private final ImmutableList<Term> conditions;

  private AggregateElement(ImmutableList<Term> terms, ImmutableList<Term> conditions)
  {
    if (terms.isEmpty())
    {
      throw new IllegalArgumentException("An aggregate element needs at least one term");
    }
    for (Term lTerm : terms)
    {
      lTerm.validateIn(Position.AGGREGATE_ELEMENT);
    }
    for (Term lCondition : conditions)
    {
      lCondition.validateIn(Position.CONDITION);
    }

    this.terms = terms;
    this.conditions = conditions;
  }

  /**
   * @return an unconditional element with the specified tuple.
   */
  public static AggregateElement of(Object... terms)
  {
    return new AggregateElement(Terms.coerceAll(ImmutableList.copyOf(terms)), ImmutableList.<Term>of());
  }

  /**
   * @return an element made from a conditional literal <tt>p(X) : q(X)</tt>, whose head becomes the tuple.
   */
  public static AggregateElement of(ConditionalLiteral literal)
  {
    literal.validateIn(Position.AGGREGATE_ELEMENT);
    return new AggregateElement(ImmutableList.of(literal.getHead()), ImmutableList.copyOf(literal.getConditions()));
  }

  /**
   * @return a copy of this element with the specified conditions added.
   */
  public AggregateElement when(Term... additionalConditions)
  {
    return new AggregateElement(terms,
                                ImmutableList.<Term>builder()
                                             .addAll(conditions)
                                             .add(additionalConditions)
                                             .build());
  }

  public List<Term> getTerms()
  {
    return terms;
  }

  public List<Term> getConditions()
  {
    return conditions;
  }

  public boolean isGround()
  {
    return Terms.allGround(terms) && Terms.allGround(conditions);
  }

  public String render()
  {
    if (conditions.isEmpty())
    {
      return Terms.renderAll(terms, ", ");
    }
    return Terms.renderAll(terms, ", ") + " : " + Terms.renderAll(conditions, ", ");
  }

  @Override
  public boolean equals(Object o)
  {
    if (!(o instanceof AggregateElement))
    {
      return false;
    }
    AggregateElement other = (AggregateElement)o;
    return terms.equals(other.terms) && conditions.equals(other.conditions);
  }

  @Override
  public int hashCode()
  {
    return Objects.hashCode(terms, conditions);
  }

  @Override
  public String toString()
  {
    return render();
  }
}

package org.aspgen.base.util.asp.grammar;

import java.util.List;

import org.aspgen.base.util.asp.exceptions.PositionException;
import org.aspgen.base.validator.ContainmentRules;
import org.aspgen.base.validator.ContainmentSlot;
import org.aspgen.base.validator.Position;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * A literal that only holds under a condition, <tt>h : c1, c2</tt>.  Legal only as an element of an aggregate or
 * choice (and in conditional <tt>#show</tt> directives).
 */
@SuppressWarnings("serial")
public final class ConditionalLiteral extends Term
{
  private final Term                head;
  private final ImmutableList<Term> conditions;

  public ConditionalLiteral(Term head, List<? extends Term> conditions)
  {
    ContainmentRules.check(ContainmentSlot.CONDITIONAL_HEAD, "conditional literal", head);
    for (Term lCondition : conditions)
    {
      lCondition.validateIn(Position.CONDITION);
    }

    this.head = head;
    this.conditions = ImmutableList.copyOf(conditions);
  }

  public static ConditionalLiteral of(Term head, Term... conditions)
  {
    return new ConditionalLiteral(head, ImmutableList.copyOf(conditions));
  }

  public Term getHead()
  {
    return head;
  }

  public List<Term> getConditions()
  {
    return conditions;
  }

  /**
   * As well as the general position check, elements place limits on the head: an aggregate element needs a
   * predicate, a choice element needs a predicate or classical negation.
   */
  @Override
  public void validateIn(Position xiPosition)
  {
    super.validateIn(xiPosition);

    if ((xiPosition == Position.AGGREGATE_ELEMENT) && !(head instanceof Predicate))
    {
      throw new PositionException("An aggregate element's conditional literal must have a predicate head, not " +
                                  head.getKind().describe(), this);
    }
    if ((xiPosition == Position.CHOICE_ELEMENT) &&
        !(head instanceof Predicate) &&
        !(head instanceof ClassicalNegation))
    {
      throw new PositionException("A choice element's conditional literal must have a predicate head, not " +
                                  head.getKind().describe(), this);
    }
  }

  @Override
  public boolean isGround()
  {
    return head.isGround() && Terms.allGround(conditions);
  }

  @Override
  public TermKind getKind()
  {
    return TermKind.CONDITIONAL_LITERAL;
  }

  @Override
  public List<Term> getChildren()
  {
    return ImmutableList.<Term>builder().add(head).addAll(conditions).build();
  }

  @Override
  public String render()
  {
    if (conditions.isEmpty())
    {
      return head.render();
    }
    return head.render() + " : " + Terms.renderAll(conditions, ", ");
  }

  @Override
  public boolean equals(Object o)
  {
    if (!(o instanceof ConditionalLiteral))
    {
      return false;
    }
    ConditionalLiteral other = (ConditionalLiteral)o;
    return head.equals(other.head) && conditions.equals(other.conditions);
  }

  @Override
  public int hashCode()
  {
    return Objects.hashCode(head, conditions);
  }
}

package org.aspgen.base.util.asp.grammar;

import java.util.ArrayList;
import java.util.List;

import org.aspgen.base.validator.ContainmentRules;
import org.aspgen.base.validator.ContainmentSlot;
import org.aspgen.base.validator.Position;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * A choice, <tt>lo { e1; e2 : c } hi</tt>.  Legal only as a rule head.
 *
 * Elements are predicates, classical negations or conditional literals with one of those as head.  Bounds are
 * non-negative integers or non-string values and may each be set once.  Choices are immutable, so every method here
 * returns a new choice.
 */
@SuppressWarnings("serial")
public final class Choice extends Term
{
  private final ImmutableList<Term> elements;
  private final Term                lowerBound;
  private final Term                upperBound;
  private final boolean             exact;

  private Choice(ImmutableList<Term> elements, Term lowerBound, Term upperBound, boolean exact)
  {
    this.elements = elements;
    this.lowerBound = lowerBound;
    this.upperBound = upperBound;
    this.exact = exact;
  }

  /**
   * @return an unbounded choice over the specified elements.
   */
  public static Choice of(Term... elements)
  {
    Choice lChoice = new Choice(ImmutableList.<Term>of(), null, null, false);
    for (Term lElement : elements)
    {
      lChoice = lChoice.add(lElement);
    }
    return lChoice;
  }

  /**
   * @return a copy of this choice with the specified element appended.
   */
  public Choice add(Term element)
  {
    element.validateIn(Position.CHOICE_ELEMENT);
    return new Choice(ImmutableList.<Term>builder().addAll(elements).add(element).build(),
                      lowerBound,
                      upperBound,
                      exact);
  }

  /**
   * @return a copy of this choice with the element <tt>element : conditions</tt> appended.
   */
  public Choice add(Term element, Term... conditions)
  {
    if (conditions.length == 0)
    {
      return add(element);
    }
    return add(ConditionalLiteral.of(element, conditions));
  }

  /**
   * @return a copy of this choice requiring exactly the specified number of elements to hold.
   *
   * @throws IllegalStateException if a bound is already set.
   */
  public Choice exactly(Object count)
  {
    if (lowerBound != null || upperBound != null)
    {
      throw new IllegalStateException("Choice cardinality is already set: " + render());
    }
    Term lCount = cardinality(count);
    return new Choice(elements, lCount, lCount, true);
  }

  /**
   * @return a copy of this choice requiring at least the specified number of elements to hold.
   *
   * @throws IllegalStateException if a lower bound is already set.
   */
  public Choice atLeast(Object count)
  {
    if (lowerBound != null)
    {
      throw new IllegalStateException("Choice lower bound is already set: " + render());
    }
    return new Choice(elements, cardinality(count), upperBound, false);
  }

  /**
   * @return a copy of this choice allowing at most the specified number of elements to hold.
   *
   * @throws IllegalStateException if an upper bound is already set.
   */
  public Choice atMost(Object count)
  {
    if (upperBound != null)
    {
      throw new IllegalStateException("Choice upper bound is already set: " + render());
    }
    return new Choice(elements, lowerBound, cardinality(count), false);
  }

  private static Term cardinality(Object count)
  {
    if ((count instanceof Integer) && ((Integer)count < 0))
    {
      throw new IllegalArgumentException("Choice cardinality must be non-negative, not " + count);
    }
    Term lTerm = Terms.coerce(count);
    ContainmentRules.check(ContainmentSlot.CARDINALITY, "choice", lTerm);
    if ((lTerm instanceof Constant) && ((Constant)lTerm).getValue() < 0)
    {
      throw new IllegalArgumentException("Choice cardinality must be non-negative, not " + lTerm);
    }
    return lTerm;
  }

  public List<Term> getElements()
  {
    return elements;
  }

  /**
   * @return the lower bound, or null if there isn't one.
   */
  public Term getLowerBound()
  {
    return lowerBound;
  }

  /**
   * @return the upper bound, or null if there isn't one.
   */
  public Term getUpperBound()
  {
    return upperBound;
  }

  private boolean isExact()
  {
    return exact ||
           ((lowerBound != null) && (upperBound != null) && lowerBound.render().equals(upperBound.render()));
  }

  @Override
  public boolean isGround()
  {
    return Terms.allGround(getChildren());
  }

  @Override
  public TermKind getKind()
  {
    return TermKind.CHOICE;
  }

  @Override
  public List<Term> getChildren()
  {
    List<Term> lChildren = new ArrayList<>(elements);
    if (lowerBound != null)
    {
      lChildren.add(lowerBound);
    }
    if (upperBound != null && !exact)
    {
      lChildren.add(upperBound);
    }
    return lChildren;
  }

  @Override
  public String render()
  {
    String lBody = elements.isEmpty() ? "{ }" : "{ " + Terms.renderAll(elements, "; ") + " }";

    if (isExact())
    {
      return lBody + " = " + lowerBound.render();
    }

    StringBuilder lBuilder = new StringBuilder();
    if (lowerBound != null)
    {
      lBuilder.append(lowerBound.render()).append(" ");
    }
    lBuilder.append(lBody);
    if (upperBound != null)
    {
      lBuilder.append(" ").append(upperBound.render());
    }
    return lBuilder.toString();
  }

  @Override
  public boolean equals(Object o)
  {
    if (!(o instanceof Choice))
    {
      return false;
    }
    Choice other = (Choice)o;
    return elements.equals(other.elements) &&
           Objects.equal(lowerBound, other.lowerBound) &&
           Objects.equal(upperBound, other.upperBound) &&
           isExact() == other.isExact();
  }

  @Override
  public int hashCode()
  {
    return Objects.hashCode(elements, lowerBound, upperBound);
  }
}

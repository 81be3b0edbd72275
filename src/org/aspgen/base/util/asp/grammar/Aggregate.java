package org.aspgen.base.util.asp.grammar;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * An aggregate over a set of elements, such as <tt>#count{X : cell(X, Y)}</tt>.  Aggregates are only meaningful inside
 * a {@link Comparison}; {@link #assignTo(Variable)} gives the common <tt>N = #count{...}</tt> form.
 *
 * Aggregates are immutable.  Adding an element returns a new aggregate of the same kind.
 */
@SuppressWarnings("serial")
public abstract class Aggregate extends ComparableTerm
{
  private final ImmutableList<AggregateElement> elements;

  protected Aggregate(List<AggregateElement> elements)
  {
    this.elements = ImmutableList.copyOf(elements);
  }

  /**
   * @return the function this aggregate computes.
   */
  public abstract AggregateFunction getFunction();

  /**
   * @return a new aggregate of the same kind with the specified elements.
   */
  protected abstract Aggregate withElements(List<AggregateElement> newElements);

  public List<AggregateElement> getElements()
  {
    return elements;
  }

  /**
   * @return a copy of this aggregate with the specified element appended.
   */
  public Aggregate add(AggregateElement element)
  {
    return withElements(ImmutableList.<AggregateElement>builder().addAll(elements).add(element).build());
  }

  /**
   * @return a copy of this aggregate with an element <tt>term : conditions</tt> appended.
   */
  public Aggregate add(Object term, Term... conditions)
  {
    return add(AggregateElement.of(term).when(conditions));
  }

  /**
   * @return a copy of this aggregate with the conditional literal <tt>p(X) : q(X)</tt> appended as an element.
   */
  public Aggregate add(ConditionalLiteral literal)
  {
    return add(AggregateElement.of(literal));
  }

  /**
   * @return the comparison <tt>variable = aggregate</tt>.
   */
  public Comparison assignTo(Variable variable)
  {
    return new Comparison(variable, ComparisonOperator.EQUAL, this);
  }

  @Override
  public boolean isGround()
  {
    for (AggregateElement lElement : elements)
    {
      if (!lElement.isGround())
      {
        return false;
      }
    }
    return true;
  }

  @Override
  public TermKind getKind()
  {
    return TermKind.AGGREGATE;
  }

  @Override
  public List<Term> getChildren()
  {
    List<Term> lChildren = new ArrayList<>();
    for (AggregateElement lElement : elements)
    {
      lChildren.addAll(lElement.getTerms());
      lChildren.addAll(lElement.getConditions());
    }
    return lChildren;
  }

  @Override
  public String render()
  {
    StringBuilder lBuilder = new StringBuilder(getFunction().getKeyword());
    lBuilder.append("{");
    for (int ii = 0; ii < elements.size(); ii++)
    {
      if (ii > 0)
      {
        lBuilder.append("; ");
      }
      lBuilder.append(elements.get(ii).render());
    }
    lBuilder.append("}");
    return lBuilder.toString();
  }

  @Override
  public boolean equals(Object o)
  {
    return (o != null) && (o.getClass() == getClass()) && ((Aggregate)o).elements.equals(elements);
  }

  @Override
  public int hashCode()
  {
    return 31 * getFunction().hashCode() + elements.hashCode();
  }
}

package org.aspgen.base.util.asp.grammar;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The maximum weight over the element tuples whose conditions hold, <tt>#max{...}</tt>.
 */
@SuppressWarnings("serial")
public final class Max extends Aggregate
{
  public Max(List<AggregateElement> elements)
  {
    super(elements);
  }

  public static Max of(AggregateElement... elements)
  {
    return new Max(ImmutableList.copyOf(elements));
  }

  /**
   * @return an aggregate with the single element <tt>term : conditions</tt>.
   */
  public static Max over(Object term, Term... conditions)
  {
    return of(AggregateElement.of(term).when(conditions));
  }

  @Override
  public AggregateFunction getFunction()
  {
    return AggregateFunction.MAX;
  }

  @Override
  protected Max withElements(List<AggregateElement> newElements)
  {
    return new Max(newElements);
  }
}

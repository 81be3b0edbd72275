package org.aspgen.base.util.asp.grammar;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Sums the first term (the weight) of the distinct element tuples whose conditions hold, <tt>#sum{...}</tt>.
 */
@SuppressWarnings("serial")
public final class Sum extends Aggregate
{
  public Sum(List<AggregateElement> elements)
  {
    super(elements);
  }

  public static Sum of(AggregateElement... elements)
  {
    return new Sum(ImmutableList.copyOf(elements));
  }

  /**
   * @return an aggregate with the single element <tt>term : conditions</tt>.
   */
  public static Sum over(Object term, Term... conditions)
  {
    return of(AggregateElement.of(term).when(conditions));
  }

  @Override
  public AggregateFunction getFunction()
  {
    return AggregateFunction.SUM;
  }

  @Override
  protected Sum withElements(List<AggregateElement> newElements)
  {
    return new Sum(newElements);
  }
}

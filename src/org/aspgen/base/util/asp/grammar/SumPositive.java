package org.aspgen.base.util.asp.grammar;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Like {@link Sum}, but only positive weights contribute, <tt>#sum+{...}</tt>.
 */
@SuppressWarnings("serial")
public final class SumPositive extends Aggregate
{
  public SumPositive(List<AggregateElement> elements)
  {
    super(elements);
  }

  public static SumPositive of(AggregateElement... elements)
  {
    return new SumPositive(ImmutableList.copyOf(elements));
  }

  /**
   * @return an aggregate with the single element <tt>term : conditions</tt>.
   */
  public static SumPositive over(Object term, Term... conditions)
  {
    return of(AggregateElement.of(term).when(conditions));
  }

  @Override
  public AggregateFunction getFunction()
  {
    return AggregateFunction.SUM_PLUS;
  }

  @Override
  protected SumPositive withElements(List<AggregateElement> newElements)
  {
    return new SumPositive(newElements);
  }
}

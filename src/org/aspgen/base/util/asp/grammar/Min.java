package org.aspgen.base.util.asp.grammar;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The minimum weight over the element tuples whose conditions hold, <tt>#min{...}</tt>.
 */
@SuppressWarnings("serial")
public final class Min extends Aggregate
{
  public Min(List<AggregateElement> elements)
  {
    super(elements);
  }

  public static Min of(AggregateElement... elements)
  {
    return new Min(ImmutableList.copyOf(elements));
  }

  /**
   * @return an aggregate with the single element <tt>term : conditions</tt>.
   */
  public static Min over(Object term, Term... conditions)
  {
    return of(AggregateElement.of(term).when(conditions));
  }

  @Override
  public AggregateFunction getFunction()
  {
    return AggregateFunction.MIN;
  }

  @Override
  protected Min withElements(List<AggregateElement> newElements)
  {
    return new Min(newElements);
  }
}

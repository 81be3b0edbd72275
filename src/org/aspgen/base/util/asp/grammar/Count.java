package org.aspgen.base.util.asp.grammar;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Counts the distinct element tuples whose conditions hold, <tt>#count{...}</tt>.
 */
@SuppressWarnings("serial")
public final class Count extends Aggregate
{
  public Count(List<AggregateElement> elements)
  {
    super(elements);
  }

  public static Count of(AggregateElement... elements)
  {
    return new Count(ImmutableList.copyOf(elements));
  }

  /**
   * @return an aggregate with the single element <tt>term : conditions</tt>.
   */
  public static Count over(Object term, Term... conditions)
  {
    return of(AggregateElement.of(term).when(conditions));
  }

  @Override
  public AggregateFunction getFunction()
  {
    return AggregateFunction.COUNT;
  }

  @Override
  protected Count withElements(List<AggregateElement> newElements)
  {
    return new Count(newElements);
  }
}

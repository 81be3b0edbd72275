package org.aspgen.base.util.asp.grammar;

/**
 * A term that may appear on either side of a {@link Comparison}: values, expressions and aggregates.
 */
@SuppressWarnings("serial")
public abstract class ComparableTerm extends Term implements ComparisonOperand
{
  @Override
  public Comparison eq(Object xiOther)
  {
    return new Comparison(this, ComparisonOperator.EQUAL, Terms.coerce(xiOther));
  }

  @Override
  public Comparison ne(Object xiOther)
  {
    return new Comparison(this, ComparisonOperator.NOT_EQUAL, Terms.coerce(xiOther));
  }

  @Override
  public Comparison lt(Object xiOther)
  {
    return new Comparison(this, ComparisonOperator.LESS_THAN, Terms.coerce(xiOther));
  }

  @Override
  public Comparison le(Object xiOther)
  {
    return new Comparison(this, ComparisonOperator.LESS_EQUAL, Terms.coerce(xiOther));
  }

  @Override
  public Comparison gt(Object xiOther)
  {
    return new Comparison(this, ComparisonOperator.GREATER_THAN, Terms.coerce(xiOther));
  }

  @Override
  public Comparison ge(Object xiOther)
  {
    return new Comparison(this, ComparisonOperator.GREATER_EQUAL, Terms.coerce(xiOther));
  }
}

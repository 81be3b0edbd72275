package org.aspgen.base.util.asp.grammar;

/**
 * A term that can be compared.  The methods here build {@link Comparison}s with this term on the left.
 */
public interface ComparisonOperand
{
  public Comparison eq(Object xiOther);

  public Comparison ne(Object xiOther);

  public Comparison lt(Object xiOther);

  public Comparison le(Object xiOther);

  public Comparison gt(Object xiOther);

  public Comparison ge(Object xiOther);
}

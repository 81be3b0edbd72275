package org.aspgen.base.util.asp.grammar;

/**
 * A term that can take part in arithmetic.  The methods here build {@link Expression}s, so that arithmetic reads
 * naturally at the call site: <tt>x.plus(1).times(y)</tt>.
 */
public interface Operand
{
  public Expression plus(Object xiOther);

  public Expression minus(Object xiOther);

  public Expression times(Object xiOther);

  public Expression dividedBy(Object xiOther);

  public Expression negated();

  public Expression abs();
}

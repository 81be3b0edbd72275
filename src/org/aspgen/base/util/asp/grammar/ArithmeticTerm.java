package org.aspgen.base.util.asp.grammar;

/**
 * A term that may be an operand of arithmetic: values and expressions.
 */
@SuppressWarnings("serial")
public abstract class ArithmeticTerm extends ComparableTerm implements Operand
{
  @Override
  public Expression plus(Object xiOther)
  {
    return new Expression(this, Operation.ADD, Terms.coerce(xiOther));
  }

  @Override
  public Expression minus(Object xiOther)
  {
    return new Expression(this, Operation.SUBTRACT, Terms.coerce(xiOther));
  }

  @Override
  public Expression times(Object xiOther)
  {
    return new Expression(this, Operation.MULTIPLY, Terms.coerce(xiOther));
  }

  @Override
  public Expression dividedBy(Object xiOther)
  {
    return new Expression(this, Operation.INTEGER_DIVIDE, Terms.coerce(xiOther));
  }

  @Override
  public Expression negated()
  {
    return new Expression(Operation.UNARY_MINUS, this);
  }

  @Override
  public Expression abs()
  {
    return new Expression(Operation.ABS, this);
  }
}

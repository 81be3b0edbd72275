package org.aspgen.base.util.asp.grammar;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A negated literal: either classical (<tt>-p</tt>) or default (<tt>not l</tt>).
 */
@SuppressWarnings("serial")
public abstract class NegatedLiteral extends Term implements Literal
{
  private final Term operand;

  protected NegatedLiteral(Term operand)
  {
    this.operand = operand;
  }

  public Term getOperand()
  {
    return operand;
  }

  /**
   * @return the text rendered before the operand.
   */
  protected abstract String getPrefix();

  @Override
  public Term not()
  {
    return DefaultNegation.of(this);
  }

  @Override
  public boolean isGround()
  {
    return operand.isGround();
  }

  @Override
  public List<Term> getChildren()
  {
    return ImmutableList.of(operand);
  }

  @Override
  public String render()
  {
    String lOperand = operand.render();
    if (operand instanceof Comparison)
    {
      lOperand = "(" + lOperand + ")";
    }
    return getPrefix() + lOperand;
  }

  @Override
  public boolean equals(Object o)
  {
    return (o != null) && (o.getClass() == getClass()) && ((NegatedLiteral)o).operand.equals(operand);
  }

  @Override
  public int hashCode()
  {
    return 31 * getClass().hashCode() + operand.hashCode();
  }
}

package org.aspgen.base.util.asp.grammar;

import org.aspgen.base.validator.ContainmentRules;
import org.aspgen.base.validator.ContainmentSlot;

/**
 * Default negation (negation as failure), <tt>not l</tt>.  Only legal in rule bodies and conditions.
 */
@SuppressWarnings("serial")
public final class DefaultNegation extends NegatedLiteral
{
  public DefaultNegation(Term operand)
  {
    super(checked(operand));
  }

  private static Term checked(Term operand)
  {
    ContainmentRules.check(ContainmentSlot.DEFAULT_NEGATION_OPERAND, "default negation", operand);
    return operand;
  }

  /**
   * @return the default negation of the specified literal.  Triple negation collapses, so <tt>not not not p</tt> is
   * returned as <tt>not p</tt>.  Double negation is kept, since it isn't equivalent to the plain literal.
   */
  public static Term of(Term operand)
  {
    if ((operand instanceof DefaultNegation) &&
        (((DefaultNegation)operand).getOperand() instanceof DefaultNegation))
    {
      return ((DefaultNegation)operand).getOperand();
    }
    return new DefaultNegation(operand);
  }

  @Override
  protected String getPrefix()
  {
    return "not ";
  }

  @Override
  public TermKind getKind()
  {
    return TermKind.DEFAULT_NEGATION;
  }
}

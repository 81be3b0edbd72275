package org.aspgen.base.util.asp.grammar;

import org.aspgen.base.validator.ContainmentRules;
import org.aspgen.base.validator.ContainmentSlot;

/**
 * Classical (strong) negation of a predicate, <tt>-p(X)</tt>.  Legal in rule heads as well as bodies.
 */
@SuppressWarnings("serial")
public final class ClassicalNegation extends NegatedLiteral
{
  public ClassicalNegation(Predicate predicate)
  {
    super(predicate);
  }

  /**
   * @return the classical negation of the specified term.  Negating a classical negation gives back the predicate.
   *
   * @throws org.aspgen.base.util.asp.exceptions.ContainmentException if the term isn't a predicate or classical
   * negation.
   */
  public static Term of(Term operand)
  {
    if (operand instanceof ClassicalNegation)
    {
      return ((ClassicalNegation)operand).getPredicate();
    }
    ContainmentRules.check(ContainmentSlot.CLASSICAL_NEGATION_OPERAND, "classical negation", operand);
    return new ClassicalNegation((Predicate)operand);
  }

  public Predicate getPredicate()
  {
    return (Predicate)getOperand();
  }

  /**
   * @return the predicate that this negates.
   */
  public Predicate negate()
  {
    return getPredicate();
  }

  @Override
  protected String getPrefix()
  {
    return "-";
  }

  @Override
  public TermKind getKind()
  {
    return TermKind.CLASSICAL_NEGATION;
  }
}

package org.aspgen.base.util.asp.compose;

import org.aspgen.base.util.asp.grammar.ComparisonOperator;

/**
 * A bound on a count, as used by {@link ProgramComposer#countConstraint}.  Each bound knows the comparison that
 * violates it, which is what the generated constraint forbids.
 */
public enum CountBound
{
  EXACTLY(ComparisonOperator.NOT_EQUAL),
  NOT_EQUAL(ComparisonOperator.EQUAL),
  AT_LEAST(ComparisonOperator.LESS_THAN),
  AT_MOST(ComparisonOperator.GREATER_THAN),
  GREATER_THAN(ComparisonOperator.LESS_EQUAL),
  LESS_THAN(ComparisonOperator.GREATER_EQUAL);

  private final ComparisonOperator mViolation;

  private CountBound(ComparisonOperator xiViolation)
  {
    mViolation = xiViolation;
  }

  /**
   * @return the operator which, comparing the count with the bound value, holds exactly when the bound is broken.
   */
  public ComparisonOperator getViolation()
  {
    return mViolation;
  }
}

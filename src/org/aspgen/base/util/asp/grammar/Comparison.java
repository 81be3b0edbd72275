package org.aspgen.base.util.asp.grammar;

import java.util.List;

import org.aspgen.base.util.asp.exceptions.ContainmentException;
import org.aspgen.base.validator.ContainmentRules;
import org.aspgen.base.validator.ContainmentSlot;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * A comparison between two terms, <tt>l op r</tt>.
 *
 * Either side may be a value, an expression or an aggregate (but not both sides aggregates).  A pool may only appear
 * on the right of <tt>=</tt>, with a variable on the left, which binds the variable to each member of the pool.
 */
@SuppressWarnings("serial")
public final class Comparison extends Term implements Literal
{
  private final Term               left;
  private final ComparisonOperator operator;
  private final Term               right;

  public Comparison(Term left, ComparisonOperator operator, Term right)
  {
    ContainmentRules.check(ContainmentSlot.COMPARISON_LEFT, "comparison", left);
    ContainmentRules.check(ContainmentSlot.COMPARISON_RIGHT, "comparison", right);

    if (right instanceof Pool)
    {
      if (operator != ComparisonOperator.EQUAL || !(left instanceof Variable))
      {
        throw new ContainmentException("A pool may only be compared as 'Variable = pool', not with " +
                                       left.render() + " " + operator.getSymbol(),
                                       right);
      }
    }
    if ((left instanceof Aggregate) && (right instanceof Aggregate))
    {
      throw new ContainmentException("Only one side of a comparison may be an aggregate", right);
    }

    this.left = left;
    this.operator = operator;
    this.right = right;
  }

  public static Comparison of(Object left, ComparisonOperator operator, Object right)
  {
    return new Comparison(Terms.coerce(left), operator, Terms.coerce(right));
  }

  public Term getLeft()
  {
    return left;
  }

  public ComparisonOperator getOperator()
  {
    return operator;
  }

  public Term getRight()
  {
    return right;
  }

  @Override
  public Term not()
  {
    return DefaultNegation.of(this);
  }

  @Override
  public boolean isGround()
  {
    return left.isGround() && right.isGround();
  }

  @Override
  public TermKind getKind()
  {
    return TermKind.COMPARISON;
  }

  @Override
  public List<Term> getChildren()
  {
    return ImmutableList.of(left, right);
  }

  @Override
  public String render()
  {
    return left.render() + " " + operator.getSymbol() + " " + right.render();
  }

  @Override
  public boolean equals(Object o)
  {
    if (!(o instanceof Comparison))
    {
      return false;
    }
    Comparison other = (Comparison)o;
    return operator == other.operator && left.equals(other.left) && right.equals(other.right);
  }

  @Override
  public int hashCode()
  {
    return Objects.hashCode(left, operator, right);
  }
}

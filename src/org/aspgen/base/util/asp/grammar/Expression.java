package org.aspgen.base.util.asp.grammar;

import java.util.List;

import org.aspgen.base.validator.ContainmentRules;
import org.aspgen.base.validator.ContainmentSlot;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * An arithmetic expression: a binary operation (<tt>+ - * /</tt>) or a unary one (negation, absolute value).
 *
 * Expressions render with the minimum of parentheses needed to re-parse to the same tree under the usual precedence
 * and left-associativity rules.  Integer division doesn't associate with multiplication, so a division on the right
 * of a multiplication keeps its parentheses: <tt>X * (Y / Z)</tt>.
 */
@SuppressWarnings("serial")
public final class Expression extends ArithmeticTerm
{
  private final Operation operation;
  private final Term      left;
  private final Term      right;
  private transient Boolean ground;

  /**
   * Create a binary expression.
   */
  public Expression(Term left, Operation operation, Term right)
  {
    if (operation.isUnary())
    {
      throw new IllegalArgumentException(operation + " is not a binary operation");
    }
    ContainmentRules.check(ContainmentSlot.EXPRESSION_OPERAND, "expression", left);
    ContainmentRules.check(ContainmentSlot.EXPRESSION_OPERAND, "expression", right);

    this.operation = operation;
    this.left = left;
    this.right = right;
    ground = null;
  }

  /**
   * Create a unary expression.
   */
  public Expression(Operation operation, Term operand)
  {
    if (!operation.isUnary())
    {
      throw new IllegalArgumentException(operation + " is not a unary operation");
    }
    ContainmentRules.check(ContainmentSlot.EXPRESSION_OPERAND, "expression", operand);

    this.operation = operation;
    this.left = operand;
    this.right = null;
    ground = null;
  }

  public Operation getOperation()
  {
    return operation;
  }

  /**
   * @return the left operand, or the only operand of a unary expression.
   */
  public Term getLeft()
  {
    return left;
  }

  /**
   * @return the right operand, or null for a unary expression.
   */
  public Term getRight()
  {
    return right;
  }

  public boolean isUnary()
  {
    return operation.isUnary();
  }

  @Override
  public boolean isGround()
  {
    if (ground == null)
    {
      ground = left.isGround() && (right == null || right.isGround());
    }
    return ground;
  }

  @Override
  public TermKind getKind()
  {
    return TermKind.EXPRESSION;
  }

  @Override
  public List<Term> getChildren()
  {
    return (right == null) ? ImmutableList.of(left) : ImmutableList.of(left, right);
  }

  @Override
  public String render()
  {
    switch (operation)
    {
      case ABS:
        return "|" + left.render() + "|";

      case UNARY_MINUS:
        return "-" + (needsParensUnderUnaryMinus(left) ? "(" + left.render() + ")" : left.render());

      default:
        return renderOperand(left, false) + " " + operation.getSymbol() + " " + renderOperand(right, true);
    }
  }

  private static boolean needsParensUnderUnaryMinus(Term operand)
  {
    if (operand instanceof Expression)
    {
      Expression lExpression = (Expression)operand;
      return !lExpression.isUnary() || lExpression.operation == Operation.UNARY_MINUS;
    }
    return (operand instanceof Constant) && ((Constant)operand).getValue() < 0;
  }

  private String renderOperand(Term operand, boolean isRight)
  {
    String lText = operand.render();
    if (!(operand instanceof Expression) || ((Expression)operand).isUnary())
    {
      return lText;
    }

    Operation lChild = ((Expression)operand).operation;
    boolean lParens;
    if (lChild.getPrecedence() > operation.getPrecedence())
    {
      lParens = true;
    }
    else if (lChild.getPrecedence() == operation.getPrecedence() && isRight)
    {
      lParens = (operation == Operation.SUBTRACT) ||
                (operation == Operation.INTEGER_DIVIDE) ||
                (lChild == Operation.INTEGER_DIVIDE);
    }
    else
    {
      lParens = false;
    }

    return lParens ? "(" + lText + ")" : lText;
  }

  @Override
  public boolean equals(Object o)
  {
    if (!(o instanceof Expression))
    {
      return false;
    }
    Expression other = (Expression)o;
    return operation == other.operation && left.equals(other.left) && Objects.equal(right, other.right);
  }

  @Override
  public int hashCode()
  {
    return Objects.hashCode(operation, left, right);
  }
}

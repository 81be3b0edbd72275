package org.aspgen.base.util.asp.grammar;

/**
 * Arithmetic operations.  Lower precedence values bind more tightly.
 */
public enum Operation
{
  ADD("+", 2),
  SUBTRACT("-", 2),
  MULTIPLY("*", 1),
  INTEGER_DIVIDE("/", 1),
  UNARY_MINUS("-", 0),
  ABS("|", 0);

  private final String mSymbol;
  private final int mPrecedence;

  private Operation(String xiSymbol, int xiPrecedence)
  {
    mSymbol = xiSymbol;
    mPrecedence = xiPrecedence;
  }

  public String getSymbol()
  {
    return mSymbol;
  }

  public int getPrecedence()
  {
    return mPrecedence;
  }

  public boolean isUnary()
  {
    return mPrecedence == 0;
  }
}

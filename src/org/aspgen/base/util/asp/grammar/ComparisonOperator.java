package org.aspgen.base.util.asp.grammar;

public enum ComparisonOperator
{
  EQUAL("="),
  NOT_EQUAL("!="),
  LESS_THAN("<"),
  LESS_EQUAL("<="),
  GREATER_THAN(">"),
  GREATER_EQUAL(">=");

  private final String mSymbol;

  private ComparisonOperator(String xiSymbol)
  {
    mSymbol = xiSymbol;
  }

  public String getSymbol()
  {
    return mSymbol;
  }
}

package org.aspgen.base.util.asp.grammar;

public enum AggregateFunction
{
  COUNT("#count"),
  SUM("#sum"),
  SUM_PLUS("#sum+"),
  MIN("#min"),
  MAX("#max");

  private final String mKeyword;

  private AggregateFunction(String xiKeyword)
  {
    mKeyword = xiKeyword;
  }

  public String getKeyword()
  {
    return mKeyword;
  }
}

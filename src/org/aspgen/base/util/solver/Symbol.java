package org.aspgen.base.util.solver;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * A ground symbol as printed by the solver: a number, a quoted string or a function (possibly with no arguments, and
 * possibly classically negated).
 */
public final class Symbol
{
  public enum Type
  {
    NUMBER,
    STRING,
    FUNCTION;
  }

  private final Type                  mType;
  private final int                   mNumber;
  private final String                mText;
  private final ImmutableList<Symbol> mArguments;
  private final boolean               mNegated;

  private Symbol(Type xiType, int xiNumber, String xiText, List<Symbol> xiArguments, boolean xiNegated)
  {
    mType = xiType;
    mNumber = xiNumber;
    mText = xiText;
    mArguments = ImmutableList.copyOf(xiArguments);
    mNegated = xiNegated;
  }

  public static Symbol number(int xiValue)
  {
    return new Symbol(Type.NUMBER, xiValue, null, ImmutableList.<Symbol>of(), false);
  }

  public static Symbol string(String xiValue)
  {
    return new Symbol(Type.STRING, 0, xiValue, ImmutableList.<Symbol>of(), false);
  }

  public static Symbol function(String xiName, List<Symbol> xiArguments, boolean xiNegated)
  {
    return new Symbol(Type.FUNCTION, 0, xiName, xiArguments, xiNegated);
  }

  public Type getType()
  {
    return mType;
  }

  public int getNumber()
  {
    return mNumber;
  }

  /**
   * @return the function name, or the (unquoted) string value.
   */
  public String getText()
  {
    return mText;
  }

  public List<Symbol> getArguments()
  {
    return mArguments;
  }

  public boolean isNegated()
  {
    return mNegated;
  }

  @Override
  public String toString()
  {
    switch (mType)
    {
      case NUMBER:
        return Integer.toString(mNumber);
      case STRING:
        return "\"" + mText + "\"";
      default:
        String lName = (mNegated ? "-" : "") + mText;
        return mArguments.isEmpty() ? lName : lName + "(" + Joiner.on(',').join(mArguments) + ")";
    }
  }
}

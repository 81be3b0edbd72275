package org.aspgen.base.util.asp.grammar;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Static helpers for working with terms.
 */
public final class Terms
{
  private Terms()
  {
  }

  /**
   * Convert a convenience value into a term.  Integers become {@link Constant}s and strings become
   * {@link StringConstant}s.  Terms are returned unchanged.
   *
   * @param xiValue - the value to convert.
   *
   * @throws IllegalArgumentException if the value can't be represented as a term.
   */
  public static Term coerce(Object xiValue)
  {
    if (xiValue instanceof Term)
    {
      return (Term)xiValue;
    }
    if (xiValue instanceof Integer)
    {
      return new Constant((Integer)xiValue);
    }
    if (xiValue instanceof String)
    {
      return new StringConstant((String)xiValue);
    }
    throw new IllegalArgumentException("Can't convert " + xiValue +
                                       ((xiValue == null) ? "" : " (" + xiValue.getClass().getSimpleName() + ")") +
                                       " to a term");
  }

  /**
   * @return the list of terms corresponding to the specified convenience values.
   *
   * @param xiValues - the values to convert.
   */
  public static ImmutableList<Term> coerceAll(Iterable<?> xiValues)
  {
    List<Term> lTerms = new ArrayList<>();
    for (Object lValue : xiValues)
    {
      lTerms.add(coerce(lValue));
    }
    return ImmutableList.copyOf(lTerms);
  }

  /**
   * @return whether all of the specified terms are ground.
   *
   * @param xiTerms - the terms.
   */
  public static boolean allGround(Iterable<? extends Term> xiTerms)
  {
    for (Term lTerm : xiTerms)
    {
      if (!lTerm.isGround())
      {
        return false;
      }
    }
    return true;
  }

  /**
   * @return the renderings of the specified terms, joined with the specified separator.
   *
   * @param xiTerms - the terms.
   * @param xiSeparator - the separator.
   */
  public static String renderAll(Iterable<? extends Term> xiTerms, String xiSeparator)
  {
    return Joiner.on(xiSeparator).join(xiTerms);
  }
}

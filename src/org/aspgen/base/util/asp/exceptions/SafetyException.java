package org.aspgen.base.util.asp.exceptions;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

/**
 * Thrown when a rule contains variables that no positive body literal binds.
 */
public class SafetyException extends AspException
{
  private static final long serialVersionUID = 1L;

  private final ImmutableList<String> mUnsafeVariables;

  public SafetyException(Object xiRule, Iterable<String> xiUnsafeVariables)
  {
    this(xiRule, Ordering.natural().immutableSortedCopy(xiUnsafeVariables));
  }

  private SafetyException(Object xiRule, ImmutableList<String> xiSorted)
  {
    super("Unsafe variable(s) " + xiSorted + " in rule: " + xiRule, xiRule);
    mUnsafeVariables = xiSorted;
  }

  /**
   * @return the names of the unsafe variables, sorted.
   */
  public List<String> getUnsafeVariables()
  {
    return mUnsafeVariables;
  }
}

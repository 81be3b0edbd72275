package org.aspgen.base.util.asp.grammar;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A simple term with no children: a variable or a constant of some sort.
 */
@SuppressWarnings("serial")
public abstract class Value extends ArithmeticTerm
{
  @Override
  public final List<Term> getChildren()
  {
    return ImmutableList.of();
  }
}

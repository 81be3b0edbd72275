package org.aspgen.base.util.asp.grammar;

/**
 * Marker for terms with a truth value: predicates, comparisons and their negations.
 */
public interface Literal
{
  /**
   * @return the default negation (<tt>not</tt>) of this literal.
   */
  public Term not();
}

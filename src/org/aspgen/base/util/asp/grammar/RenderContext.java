package org.aspgen.base.util.asp.grammar;

/**
 * Where a term is being rendered, for the few terms whose text depends on it.
 */
public enum RenderContext
{
  /**
   * Anywhere not listed below.
   */
  DEFAULT,

  /**
   * As the only argument of a predicate.  An explicit pool drops its parentheses here: <tt>p(1;2;3)</tt>.
   */
  LONE_ARGUMENT;
}

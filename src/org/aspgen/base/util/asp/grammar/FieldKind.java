package org.aspgen.base.util.asp.grammar;

/**
 * The declared type of a predicate field.  This decides, at construction time, whether an argument may be a nested
 * predicate, and, when decoding solver output, whether a bare symbol is a predicate or a symbolic constant.
 */
public enum FieldKind
{
  /**
   * A value: a variable, constant, expression or pool of constants.
   */
  VALUE,

  /**
   * A nested predicate (or a variable standing for one, or a pool of them).
   */
  PREDICATE,

  /**
   * Either of the above.
   */
  ANY;
}

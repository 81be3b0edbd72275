package org.aspgen.base.util.asp.grammar;

/**
 * The closed set of term kinds.  Validators switch over these rather than testing classes.
 */
public enum TermKind
{
  VARIABLE("variable"),
  NUMBER("number"),
  STRING("string constant"),
  SYMBOLIC_CONSTANT("symbolic constant"),
  PREDICATE("predicate"),
  RANGE_POOL("range pool"),
  EXPLICIT_POOL("explicit pool"),
  EXPRESSION("expression"),
  COMPARISON("comparison"),
  CLASSICAL_NEGATION("classical negation"),
  DEFAULT_NEGATION("default negation"),
  CONDITIONAL_LITERAL("conditional literal"),
  AGGREGATE("aggregate"),
  CHOICE("choice");

  private final String mDescription;

  private TermKind(String xiDescription)
  {
    mDescription = xiDescription;
  }

  /**
   * @return a human-readable name, for use in error messages.
   */
  public String describe()
  {
    return mDescription;
  }
}

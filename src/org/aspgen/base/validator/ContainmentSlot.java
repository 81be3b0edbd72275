package org.aspgen.base.validator;

import java.util.EnumSet;
import java.util.Set;

import org.aspgen.base.util.asp.grammar.TermKind;

/**
 * The places where one term directly contains another, with the kinds of child each accepts.
 */
public enum ContainmentSlot
{
  PREDICATE_ARGUMENT("an argument",
                     EnumSet.of(TermKind.VARIABLE, TermKind.NUMBER, TermKind.STRING, TermKind.SYMBOLIC_CONSTANT,
                                TermKind.PREDICATE, TermKind.EXPRESSION, TermKind.RANGE_POOL,
                                TermKind.EXPLICIT_POOL)),
  EXPRESSION_OPERAND("an operand",
                     EnumSet.of(TermKind.VARIABLE, TermKind.NUMBER, TermKind.SYMBOLIC_CONSTANT,
                                TermKind.EXPRESSION)),
  COMPARISON_LEFT("the left side",
                  EnumSet.of(TermKind.VARIABLE, TermKind.NUMBER, TermKind.STRING, TermKind.SYMBOLIC_CONSTANT,
                             TermKind.EXPRESSION, TermKind.AGGREGATE)),
  COMPARISON_RIGHT("the right side",
                   EnumSet.of(TermKind.VARIABLE, TermKind.NUMBER, TermKind.STRING, TermKind.SYMBOLIC_CONSTANT,
                              TermKind.EXPRESSION, TermKind.AGGREGATE, TermKind.RANGE_POOL,
                              TermKind.EXPLICIT_POOL)),
  RANGE_BOUND("a bound",
              EnumSet.of(TermKind.NUMBER, TermKind.SYMBOLIC_CONSTANT, TermKind.EXPRESSION)),
  POOL_MEMBER("a member",
              EnumSet.of(TermKind.NUMBER, TermKind.STRING, TermKind.SYMBOLIC_CONSTANT, TermKind.PREDICATE)),
  CLASSICAL_NEGATION_OPERAND("the operand",
                             EnumSet.of(TermKind.PREDICATE)),
  DEFAULT_NEGATION_OPERAND("the operand",
                           EnumSet.of(TermKind.PREDICATE, TermKind.CLASSICAL_NEGATION, TermKind.DEFAULT_NEGATION,
                                      TermKind.COMPARISON)),
  CONDITIONAL_HEAD("the head",
                   EnumSet.of(TermKind.PREDICATE, TermKind.CLASSICAL_NEGATION, TermKind.DEFAULT_NEGATION,
                              TermKind.COMPARISON)),
  CARDINALITY("a cardinality bound",
              EnumSet.of(TermKind.VARIABLE, TermKind.NUMBER, TermKind.SYMBOLIC_CONSTANT));

  private final String mDescription;
  private final Set<TermKind> mAccepted;

  private ContainmentSlot(String xiDescription, Set<TermKind> xiAccepted)
  {
    mDescription = xiDescription;
    mAccepted = xiAccepted;
  }

  public boolean accepts(TermKind xiKind)
  {
    return mAccepted.contains(xiKind);
  }

  public String describe()
  {
    return mDescription;
  }
}

package org.aspgen.base.validator;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import org.aspgen.base.util.asp.exceptions.PositionException;
import org.aspgen.base.util.asp.grammar.Term;
import org.aspgen.base.util.asp.grammar.TermKind;

/**
 * The syntactic slots a term can be placed in, and which kinds of term each will accept.
 */
public enum Position
{
  RULE_HEAD("a rule head"),
  RULE_BODY("a rule body"),
  AGGREGATE_ELEMENT("an aggregate element"),
  CHOICE_ELEMENT("a choice element"),
  CONDITION("a condition");

  private static final Map<TermKind, Set<Position>> PERMITTED = new EnumMap<>(TermKind.class);
  static
  {
    PERMITTED.put(TermKind.VARIABLE, EnumSet.of(AGGREGATE_ELEMENT));
    PERMITTED.put(TermKind.NUMBER, EnumSet.of(AGGREGATE_ELEMENT));
    PERMITTED.put(TermKind.STRING, EnumSet.of(AGGREGATE_ELEMENT));
    PERMITTED.put(TermKind.SYMBOLIC_CONSTANT, EnumSet.of(AGGREGATE_ELEMENT));
    PERMITTED.put(TermKind.EXPRESSION, EnumSet.of(AGGREGATE_ELEMENT));
    PERMITTED.put(TermKind.PREDICATE,
                  EnumSet.of(RULE_HEAD, RULE_BODY, AGGREGATE_ELEMENT, CHOICE_ELEMENT, CONDITION));
    PERMITTED.put(TermKind.CLASSICAL_NEGATION, EnumSet.of(RULE_HEAD, RULE_BODY, CHOICE_ELEMENT, CONDITION));
    PERMITTED.put(TermKind.DEFAULT_NEGATION, EnumSet.of(RULE_BODY, CONDITION));
    PERMITTED.put(TermKind.COMPARISON, EnumSet.of(RULE_BODY, CONDITION));
    PERMITTED.put(TermKind.CONDITIONAL_LITERAL, EnumSet.of(AGGREGATE_ELEMENT, CHOICE_ELEMENT));
    PERMITTED.put(TermKind.CHOICE, EnumSet.of(RULE_HEAD));
    PERMITTED.put(TermKind.AGGREGATE, EnumSet.noneOf(Position.class));
    PERMITTED.put(TermKind.RANGE_POOL, EnumSet.noneOf(Position.class));
    PERMITTED.put(TermKind.EXPLICIT_POOL, EnumSet.noneOf(Position.class));
  }

  private final String mDescription;

  private Position(String xiDescription)
  {
    mDescription = xiDescription;
  }

  /**
   * @return whether a term of the specified kind may be placed in this position.
   */
  public boolean permits(TermKind xiKind)
  {
    return PERMITTED.get(xiKind).contains(this);
  }

  /**
   * Check that the specified term may be placed in this position.
   *
   * @param xiTerm - the term.
   *
   * @throws PositionException if it may not.
   */
  public void check(Term xiTerm)
  {
    if (!permits(xiTerm.getKind()))
    {
      throw new PositionException("Can't use " + xiTerm.getKind().describe() + " '" + xiTerm.render() +
                                  "' as " + mDescription, xiTerm);
    }
  }

  public String describe()
  {
    return mDescription;
  }
}

package org.aspgen.base.util.asp.program;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.aspgen.base.util.asp.exceptions.PositionException;
import org.aspgen.base.util.asp.grammar.Term;
import org.aspgen.base.util.asp.grammar.Terms;
import org.aspgen.base.validator.Position;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * A rule, <tt>head :- body.</tt>  A rule without a body is a fact and a rule without a head is a constraint.  A rule
 * must have at least one of the two.
 *
 * The head and each body literal are checked against their positions when the rule is built.  The checks that need
 * the rest of the program (safety, constant registration, arity) run when the rule is added to a {@link Program}.
 */
public final class Rule implements ProgramElement
{
  private final Term                mHead;
  private final ImmutableList<Term> mBody;

  /**
   * Create a rule.
   *
   * @param xiHead - the head, or null for a constraint.
   * @param xiBody - the body literals, in order.  Empty for a fact.
   *
   * @throws PositionException if the rule is empty or any part is in the wrong position.
   */
  public Rule(Term xiHead, List<? extends Term> xiBody)
  {
    if ((xiHead == null) && xiBody.isEmpty())
    {
      throw new PositionException("A rule must have a head, a body or both", null);
    }
    if (xiHead != null)
    {
      xiHead.validateIn(Position.RULE_HEAD);
    }
    for (Term lLiteral : xiBody)
    {
      lLiteral.validateIn(Position.RULE_BODY);
    }

    mHead = xiHead;
    mBody = ImmutableList.copyOf(xiBody);
  }

  /**
   * @return the fact <tt>head.</tt>
   */
  public static Rule fact(Term xiHead)
  {
    return new Rule(xiHead, ImmutableList.<Term>of());
  }

  /**
   * @return the rule <tt>head :- body.</tt>
   */
  public static Rule of(Term xiHead, Term... xiBody)
  {
    return new Rule(xiHead, ImmutableList.copyOf(xiBody));
  }

  /**
   * @return the constraint <tt>:- body.</tt>
   */
  public static Rule constraint(Term... xiBody)
  {
    return new Rule(null, ImmutableList.copyOf(xiBody));
  }

  /**
   * @return the head, or null if this is a constraint.
   */
  public Term getHead()
  {
    return mHead;
  }

  public List<Term> getBody()
  {
    return mBody;
  }

  public boolean isFact()
  {
    return mBody.isEmpty();
  }

  public boolean isConstraint()
  {
    return mHead == null;
  }

  /**
   * @return the head (if any) followed by the body literals.
   */
  public List<Term> getTerms()
  {
    List<Term> lTerms = new ArrayList<>();
    if (mHead != null)
    {
      lTerms.add(mHead);
    }
    lTerms.addAll(mBody);
    return lTerms;
  }

  /**
   * @return every term of the specified type in this rule, depth first, head before body.
   */
  public <T extends Term> Set<T> collect(Class<T> xiType)
  {
    Set<T> lResult = new LinkedHashSet<>();
    for (Term lTerm : getTerms())
    {
      lTerm.collect(xiType, lResult);
    }
    return lResult;
  }

  @Override
  public String render()
  {
    if (mBody.isEmpty())
    {
      return mHead.render() + ".";
    }

    String lBody = Terms.renderAll(mBody, ", ");
    if (mHead == null)
    {
      return ":- " + lBody + ".";
    }
    return mHead.render() + " :- " + lBody + ".";
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (!(xiOther instanceof Rule))
    {
      return false;
    }
    Rule lOther = (Rule)xiOther;
    return Objects.equal(mHead, lOther.mHead) && mBody.equals(lOther.mBody);
  }

  @Override
  public int hashCode()
  {
    return Objects.hashCode(mHead, mBody);
  }

  @Override
  public String toString()
  {
    return render();
  }
}

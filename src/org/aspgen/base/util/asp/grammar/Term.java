package org.aspgen.base.util.asp.grammar;

import java.io.Serializable;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.aspgen.base.validator.Position;

/**
 * The root of the term hierarchy.  A program is built entirely out of terms, rules and layout elements.
 *
 * <pre>
 * Term
 * +- ComparableTerm
 * |  +- ArithmeticTerm
 * |  |  +- Value ........ Variable, Constant, StringConstant, SymbolicConstant
 * |  |  +- Expression
 * |  +- Aggregate ...... Count, Sum, SumPositive, Min, Max
 * +- Predicate
 * +- Pool ............. RangePool, ExplicitPool
 * +- Comparison
 * +- NegatedLiteral ... ClassicalNegation, DefaultNegation
 * +- ConditionalLiteral
 * +- Choice
 * </pre>
 *
 * All terms are immutable, compare structurally and render to the same text whenever they are equal.  Each
 * constructor checks which kinds of child it has been given, so an ill-formed term can't be built at all.  Whether a
 * well-formed term may sit in a particular place in a rule is checked separately, by {@link #validateIn(Position)}.
 */
@SuppressWarnings("serial")
public abstract class Term implements Renderable, ContextValidatable, GroundednessQueryable, Serializable
{
  /**
   * @return the kind of this term.
   */
  public abstract TermKind getKind();

  /**
   * @return the direct sub-terms of this term, in rendering order.
   */
  public abstract List<Term> getChildren();

  /**
   * @return the rendering of this term in the specified context.  Most terms render the same everywhere.
   *
   * @param xiContext - the rendering context.
   */
  public String render(RenderContext xiContext)
  {
    return render();
  }

  @Override
  public void validateIn(Position xiPosition)
  {
    xiPosition.check(this);
  }

  /**
   * Collect every term of the specified type in this term (itself included), depth first, in rendering order.
   *
   * @param xiType - the class of terms to collect.
   * @param xiOut - the collection to add them to.
   */
  public final <T extends Term> void collect(Class<T> xiType, Collection<? super T> xiOut)
  {
    if (xiType.isInstance(this))
    {
      xiOut.add(xiType.cast(this));
    }

    for (Term lChild : getChildren())
    {
      lChild.collect(xiType, xiOut);
    }
  }

  /**
   * @return the names of the (non-anonymous) variables in this term, in order of first appearance.
   */
  public final Set<String> getVariableNames()
  {
    Set<Variable> lVariables = new LinkedHashSet<>();
    collect(Variable.class, lVariables);

    Set<String> lNames = new LinkedHashSet<>();
    for (Variable lVariable : lVariables)
    {
      if (!lVariable.isAnonymous())
      {
        lNames.add(lVariable.getName());
      }
    }
    return lNames;
  }

  @Override
  public String toString()
  {
    return render();
  }
}

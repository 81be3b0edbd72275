package org.aspgen.base.util.solver;

import java.util.ArrayList;
import java.util.List;

import org.aspgen.base.util.asp.grammar.ClassicalNegation;
import org.aspgen.base.util.asp.grammar.Predicate;
import org.aspgen.base.util.asp.grammar.PredicateDefinition;
import org.aspgen.base.util.asp.grammar.Term;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;

/**
 * A model whose atoms have been decoded into predicates.
 */
public final class DecodedModel
{
  private final ImmutableList<Term>                              mAll;
  private final ImmutableListMultimap<String, Predicate>         mPositive;
  private final ImmutableListMultimap<String, ClassicalNegation> mNegated;
  private final ImmutableList<String>                            mUnrecognized;

  DecodedModel(List<Term> xiDecoded, List<String> xiUnrecognized)
  {
    mAll = ImmutableList.copyOf(xiDecoded);
    mUnrecognized = ImmutableList.copyOf(xiUnrecognized);

    ImmutableListMultimap.Builder<String, Predicate> lPositive = ImmutableListMultimap.builder();
    ImmutableListMultimap.Builder<String, ClassicalNegation> lNegated = ImmutableListMultimap.builder();
    for (Term lTerm : mAll)
    {
      if (lTerm instanceof ClassicalNegation)
      {
        ClassicalNegation lNegation = (ClassicalNegation)lTerm;
        lNegated.put(lNegation.getPredicate().getName(), lNegation);
      }
      else
      {
        Predicate lPredicate = (Predicate)lTerm;
        lPositive.put(lPredicate.getName(), lPredicate);
      }
    }
    mPositive = lPositive.build();
    mNegated = lNegated.build();
  }

  /**
   * @return the (positive) instances of the specified predicate, in the order the solver printed them.
   */
  public List<Predicate> get(PredicateDefinition xiDefinition)
  {
    return mPositive.get(xiDefinition.getName());
  }

  /**
   * @return the (positive) instances of the predicate with the specified (full) name.
   */
  public List<Predicate> get(String xiName)
  {
    return mPositive.get(xiName);
  }

  /**
   * @return the classically negated instances of the specified predicate.
   */
  public List<ClassicalNegation> getNegated(PredicateDefinition xiDefinition)
  {
    return mNegated.get(xiDefinition.getName());
  }

  public boolean contains(Term xiTerm)
  {
    return mAll.contains(xiTerm);
  }

  /**
   * @return every decoded atom, in output order.
   */
  public List<Term> getAll()
  {
    return mAll;
  }

  /**
   * @return the atoms that couldn't be decoded, as text.
   */
  public List<String> getUnrecognized()
  {
    return mUnrecognized;
  }

  /**
   * @return the positive atoms keyed by predicate name.
   */
  public ListMultimap<String, Predicate> asMultimap()
  {
    return mPositive;
  }

  @Override
  public String toString()
  {
    List<String> lAtoms = new ArrayList<>();
    for (Term lTerm : mAll)
    {
      lAtoms.add(lTerm.render());
    }
    lAtoms.addAll(mUnrecognized);
    return lAtoms.toString();
  }
}

package org.aspgen.base.util.asp.grammar;

import java.util.List;

import org.aspgen.base.util.asp.exceptions.ContainmentException;
import org.aspgen.base.validator.ContainmentRules;
import org.aspgen.base.validator.ContainmentSlot;

import com.google.common.collect.ImmutableList;

/**
 * An explicit list of alternatives, <tt>(a;b;c)</tt>, kept in the order given.  Members are constants or ground
 * predicates.
 */
@SuppressWarnings("serial")
public final class ExplicitPool extends Pool
{
  private final ImmutableList<Term> members;

  public ExplicitPool(List<?> members)
  {
    ImmutableList<Term> lMembers = Terms.coerceAll(members);
    if (lMembers.isEmpty())
    {
      throw new ContainmentException("An explicit pool must have at least one member", "()");
    }
    for (Term lMember : lMembers)
    {
      ContainmentRules.check(ContainmentSlot.POOL_MEMBER, "pool", lMember);
    }
    this.members = lMembers;
  }

  public static ExplicitPool of(Object... members)
  {
    return new ExplicitPool(ImmutableList.copyOf(members));
  }

  public List<Term> getMembers()
  {
    return members;
  }

  /**
   * @return whether any member is a predicate.
   */
  public boolean containsPredicates()
  {
    for (Term lMember : members)
    {
      if (lMember instanceof Predicate)
      {
        return true;
      }
    }
    return false;
  }

  @Override
  public TermKind getKind()
  {
    return TermKind.EXPLICIT_POOL;
  }

  @Override
  public List<Term> getChildren()
  {
    return members;
  }

  @Override
  public String render()
  {
    return "(" + Terms.renderAll(members, ";") + ")";
  }

  @Override
  public String render(RenderContext xiContext)
  {
    if (xiContext == RenderContext.LONE_ARGUMENT)
    {
      return Terms.renderAll(members, ";");
    }
    return render();
  }

  @Override
  public boolean equals(Object o)
  {
    return (o instanceof ExplicitPool) && ((ExplicitPool)o).members.equals(members);
  }

  @Override
  public int hashCode()
  {
    return members.hashCode();
  }
}

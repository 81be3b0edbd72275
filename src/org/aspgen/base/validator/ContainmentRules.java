package org.aspgen.base.validator;

import org.aspgen.base.util.asp.exceptions.ContainmentException;
import org.aspgen.base.util.asp.grammar.ExplicitPool;
import org.aspgen.base.util.asp.grammar.Field;
import org.aspgen.base.util.asp.grammar.PredicateDefinition;
import org.aspgen.base.util.asp.grammar.Term;
import org.aspgen.base.util.asp.grammar.TermKind;
import org.aspgen.base.util.asp.grammar.Variable;

/**
 * Structural typing of terms.  Every term constructor calls in here for each of its children, so an ill-formed term
 * can never be built.
 */
public final class ContainmentRules
{
  private ContainmentRules()
  {
  }

  /**
   * Check that a child may be placed in the specified slot.
   *
   * @param xiSlot - the slot.
   * @param xiParent - a description of the containing term, for the error message.
   * @param xiChild - the proposed child.
   *
   * @throws ContainmentException if the child isn't permitted.
   */
  public static void check(ContainmentSlot xiSlot, String xiParent, Term xiChild)
  {
    if (xiChild == null)
    {
      throw new ContainmentException("Missing " + xiSlot.describe() + " of " + xiParent, null);
    }

    if (!xiSlot.accepts(xiChild.getKind()))
    {
      throw new ContainmentException("Can't use " + xiChild.getKind().describe() + " '" + xiChild.render() +
                                     "' as " + xiSlot.describe() + " of " + xiParent, xiChild);
    }

    switch (xiSlot)
    {
      case RANGE_BOUND:
      case POOL_MEMBER:
        if (!xiChild.isGround())
        {
          throw new ContainmentException("Members of " + xiParent + " must be ground: " + xiChild.render(), xiChild);
        }
        break;

      case EXPRESSION_OPERAND:
        if ((xiChild instanceof Variable) && ((Variable)xiChild).isAnonymous())
        {
          throw new ContainmentException("The anonymous variable can't be an operand of an expression", xiChild);
        }
        break;

      default:
        break;
    }
  }

  /**
   * Check that a term may be the argument for a particular field of a predicate.  As well as the general rules for
   * arguments, the field's declared kind decides whether nested predicates are allowed.
   *
   * @param xiDefinition - the predicate being built.
   * @param xiField - the field.
   * @param xiArgument - the proposed argument.
   *
   * @throws ContainmentException if the argument isn't permitted.
   */
  public static void checkArgument(PredicateDefinition xiDefinition, Field xiField, Term xiArgument)
  {
    String lParent = "predicate " + xiDefinition.getName();
    check(ContainmentSlot.PREDICATE_ARGUMENT, lParent, xiArgument);

    TermKind lKind = xiArgument.getKind();
    switch (xiField.getKind())
    {
      case VALUE:
        if ((lKind == TermKind.PREDICATE) ||
            ((lKind == TermKind.EXPLICIT_POOL) && ((ExplicitPool)xiArgument).containsPredicates()))
        {
          throw new ContainmentException("Field '" + xiField.getName() + "' of " + lParent +
                                         " holds a value, not a predicate: " + xiArgument.render(), xiArgument);
        }
        break;

      case PREDICATE:
        if ((lKind != TermKind.PREDICATE) &&
            (lKind != TermKind.VARIABLE) &&
            ((lKind != TermKind.EXPLICIT_POOL) || !allPredicates((ExplicitPool)xiArgument)))
        {
          throw new ContainmentException("Field '" + xiField.getName() + "' of " + lParent +
                                         " holds a predicate, not " + lKind.describe() + ": " +
                                         xiArgument.render(), xiArgument);
        }
        break;

      default:
        break;
    }
  }

  private static boolean allPredicates(ExplicitPool xiPool)
  {
    for (Term lMember : xiPool.getMembers())
    {
      if (lMember.getKind() != TermKind.PREDICATE)
      {
        return false;
      }
    }
    return true;
  }
}

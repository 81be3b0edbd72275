package org.aspgen.base.validator;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.aspgen.base.util.asp.exceptions.SafetyException;
import org.aspgen.base.util.asp.grammar.Aggregate;
import org.aspgen.base.util.asp.grammar.AggregateElement;
import org.aspgen.base.util.asp.grammar.Choice;
import org.aspgen.base.util.asp.grammar.ClassicalNegation;
import org.aspgen.base.util.asp.grammar.Comparison;
import org.aspgen.base.util.asp.grammar.ComparisonOperator;
import org.aspgen.base.util.asp.grammar.ConditionalLiteral;
import org.aspgen.base.util.asp.grammar.NegatedLiteral;
import org.aspgen.base.util.asp.grammar.Pool;
import org.aspgen.base.util.asp.grammar.Predicate;
import org.aspgen.base.util.asp.grammar.Term;
import org.aspgen.base.util.asp.grammar.Variable;
import org.aspgen.base.util.asp.program.Rule;
import org.aspgen.base.util.asp.program.SymbolTable;

/**
 * Validator that checks every variable in a rule is bound.
 *
 * Variables are bound by
 * <ul>
 * <li>appearing in a positive body literal (a predicate or classical negation), other than inside arithmetic;</li>
 * <li>an assignment <tt>X = t</tt> (either way round) where everything in <tt>t</tt> is already bound;</li>
 * <li>an assignment from a pool, <tt>X = 1..n</tt>;</li>
 * <li>an assignment from an aggregate, <tt>N = #count{...}</tt>, once the aggregate's global variables are bound.</li>
 * </ul>
 * Assignments are applied repeatedly until nothing new is bound.  The elements of aggregates and choices have their
 * own local scope, in which positive conditions bind further variables.  The anonymous variable is ignored in bodies
 * and conditions, but is never safe in a head.
 */
public final class SafetyValidator implements RuleValidator
{
  private static final String ANONYMOUS = Variable.ANY.getName();

  @Override
  public void checkValidity(Rule xiRule, SymbolTable xiSymbols)
  {
    Set<String> lUnsafe = findUnsafeVariables(xiRule);
    if (!lUnsafe.isEmpty())
    {
      throw new SafetyException(xiRule, lUnsafe);
    }
  }

  /**
   * @return the names of the unsafe variables in the specified rule, sorted.
   *
   * @param xiRule - the rule.
   */
  public static Set<String> findUnsafeVariables(Rule xiRule)
  {
    Set<String> lUnsafe = new TreeSet<>();
    Set<String> lBound = bind(xiRule.getBody(), new HashSet<String>(), xiRule);

    for (Term lLiteral : xiRule.getBody())
    {
      checkBodyLiteral(lLiteral, lBound, xiRule, lUnsafe);
    }

    Term lHead = xiRule.getHead();
    if (lHead instanceof Choice)
    {
      Choice lChoice = (Choice)lHead;
      checkBoundTerm(lChoice.getLowerBound(), lBound, lUnsafe);
      checkBoundTerm(lChoice.getUpperBound(), lBound, lUnsafe);
      for (Term lElement : lChoice.getElements())
      {
        checkElement(lElement, lBound, xiRule, lUnsafe);
      }
    }
    else if (lHead != null)
    {
      checkHeadLiteral(lHead, lBound, lUnsafe);
    }

    return lUnsafe;
  }

  /**
   * @return the variables bound by a list of literals, starting from those already bound outside it.
   */
  private static Set<String> bind(List<Term> xiLiterals, Set<String> xiOuter, Rule xiRule)
  {
    Set<String> lBound = new HashSet<>(xiOuter);
    for (Term lLiteral : xiLiterals)
    {
      if ((lLiteral instanceof Predicate) || (lLiteral instanceof ClassicalNegation))
      {
        addBindingVariables(lLiteral, lBound);
      }
    }

    boolean lChanged = true;
    while (lChanged)
    {
      lChanged = false;
      for (Term lLiteral : xiLiterals)
      {
        if ((lLiteral instanceof Comparison) &&
            (((Comparison)lLiteral).getOperator() == ComparisonOperator.EQUAL))
        {
          Comparison lComparison = (Comparison)lLiteral;
          lChanged |= tryAssign(lComparison.getLeft(), lComparison.getRight(), lBound, xiRule);
          lChanged |= tryAssign(lComparison.getRight(), lComparison.getLeft(), lBound, xiRule);
        }
      }
    }

    return lBound;
  }

  /**
   * Add the variables that a positive literal binds: those in argument positions, including inside nested
   * predicates, but not inside expressions.
   */
  private static void addBindingVariables(Term xiTerm, Set<String> xiBound)
  {
    switch (xiTerm.getKind())
    {
      case VARIABLE:
        if (!((Variable)xiTerm).isAnonymous())
        {
          xiBound.add(((Variable)xiTerm).getName());
        }
        break;

      case PREDICATE:
      case CLASSICAL_NEGATION:
        for (Term lChild : xiTerm.getChildren())
        {
          addBindingVariables(lChild, xiBound);
        }
        break;

      default:
        // Expressions and pools don't bind.  Nothing else can be an argument.
        break;
    }
  }

  private static boolean tryAssign(Term xiTarget, Term xiSource, Set<String> xiBound, Rule xiRule)
  {
    if (!(xiTarget instanceof Variable))
    {
      return false;
    }

    Variable lVariable = (Variable)xiTarget;
    if (lVariable.isAnonymous() || xiBound.contains(lVariable.getName()))
    {
      return false;
    }

    if (isDetermined(xiSource, xiBound, xiRule))
    {
      xiBound.add(lVariable.getName());
      return true;
    }
    return false;
  }

  private static boolean isDetermined(Term xiTerm, Set<String> xiBound, Rule xiRule)
  {
    if (xiTerm instanceof Pool)
    {
      return true;
    }
    if (xiTerm instanceof Aggregate)
    {
      return xiBound.containsAll(getGlobalVariables((Aggregate)xiTerm, xiRule));
    }
    return xiBound.containsAll(xiTerm.getVariableNames());
  }

  /**
   * @return the variables of an aggregate that also appear elsewhere in the rule.  The rest are local to the
   * aggregate's elements.
   */
  private static Set<String> getGlobalVariables(Aggregate xiAggregate, Rule xiRule)
  {
    Set<String> lOutside = new HashSet<>();
    for (Term lTerm : xiRule.getTerms())
    {
      collectVariablesExcept(lTerm, xiAggregate, lOutside);
    }

    Set<String> lGlobal = new HashSet<>(xiAggregate.getVariableNames());
    lGlobal.retainAll(lOutside);
    return lGlobal;
  }

  private static void collectVariablesExcept(Term xiTerm, Term xiExcluded, Set<String> xiOut)
  {
    if (xiTerm == xiExcluded)
    {
      return;
    }
    if ((xiTerm instanceof Variable) && !((Variable)xiTerm).isAnonymous())
    {
      xiOut.add(((Variable)xiTerm).getName());
    }
    for (Term lChild : xiTerm.getChildren())
    {
      collectVariablesExcept(lChild, xiExcluded, xiOut);
    }
  }

  private static void checkHeadLiteral(Term xiHead, Set<String> xiBound, Set<String> xiUnsafe)
  {
    for (String lName : xiHead.getVariableNames())
    {
      if (!xiBound.contains(lName))
      {
        xiUnsafe.add(lName);
      }
    }
    if (containsAnonymous(xiHead))
    {
      xiUnsafe.add(ANONYMOUS);
    }
  }

  private static void checkBoundTerm(Term xiTerm, Set<String> xiBound, Set<String> xiUnsafe)
  {
    if (xiTerm != null)
    {
      checkHeadLiteral(xiTerm, xiBound, xiUnsafe);
    }
  }

  /**
   * Check a literal that may appear in a body or condition.  Positive literals only need their arithmetic checked;
   * everything else must be entirely bound.
   */
  private static void checkBodyLiteral(Term xiLiteral, Set<String> xiBound, Rule xiRule, Set<String> xiUnsafe)
  {
    switch (xiLiteral.getKind())
    {
      case PREDICATE:
      case CLASSICAL_NEGATION:
      case VARIABLE:
      case NUMBER:
      case STRING:
      case SYMBOLIC_CONSTANT:
      case EXPRESSION:
        addUnbound(xiLiteral.getVariableNames(), xiBound, xiUnsafe);
        break;

      case RANGE_POOL:
      case EXPLICIT_POOL:
        break;

      case DEFAULT_NEGATION:
        checkBodyLiteral(((NegatedLiteral)xiLiteral).getOperand(), xiBound, xiRule, xiUnsafe);
        break;

      case COMPARISON:
        checkBodyLiteral(((Comparison)xiLiteral).getLeft(), xiBound, xiRule, xiUnsafe);
        checkBodyLiteral(((Comparison)xiLiteral).getRight(), xiBound, xiRule, xiUnsafe);
        break;

      case AGGREGATE:
        for (AggregateElement lElement : ((Aggregate)xiLiteral).getElements())
        {
          Set<String> lLocal = bind(lElement.getConditions(), xiBound, xiRule);
          for (Term lTerm : lElement.getTerms())
          {
            addUnbound(lTerm.getVariableNames(), lLocal, xiUnsafe);
          }
          for (Term lCondition : lElement.getConditions())
          {
            checkBodyLiteral(lCondition, lLocal, xiRule, xiUnsafe);
          }
        }
        break;

      case CONDITIONAL_LITERAL:
      case CHOICE:
        // Not legal in a body.  Position validation has already rejected these.
        throw new IllegalStateException("Unexpected " + xiLiteral.getKind().describe() + " in body of " + xiRule);
    }
  }

  /**
   * Check a choice element, with its own conditions providing local bindings.
   */
  private static void checkElement(Term xiElement, Set<String> xiBound, Rule xiRule, Set<String> xiUnsafe)
  {
    if (xiElement instanceof ConditionalLiteral)
    {
      ConditionalLiteral lConditional = (ConditionalLiteral)xiElement;
      Set<String> lLocal = bind(lConditional.getConditions(), xiBound, xiRule);
      checkHeadLiteral(lConditional.getHead(), lLocal, xiUnsafe);
      for (Term lCondition : lConditional.getConditions())
      {
        checkBodyLiteral(lCondition, lLocal, xiRule, xiUnsafe);
      }
    }
    else
    {
      checkHeadLiteral(xiElement, xiBound, xiUnsafe);
    }
  }

  private static void addUnbound(Set<String> xiNames, Set<String> xiBound, Set<String> xiUnsafe)
  {
    for (String lName : xiNames)
    {
      if (!xiBound.contains(lName))
      {
        xiUnsafe.add(lName);
      }
    }
  }

  private static boolean containsAnonymous(Term xiTerm)
  {
    Set<Variable> lVariables = new HashSet<>();
    xiTerm.collect(Variable.class, lVariables);
    return lVariables.contains(Variable.ANY);
  }
}

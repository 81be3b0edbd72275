package org.aspgen.base.validator;

import java.util.HashMap;
import java.util.Map;

import org.aspgen.base.util.asp.grammar.Predicate;
import org.aspgen.base.util.asp.grammar.PredicateDefinition;
import org.aspgen.base.util.asp.program.Rule;
import org.aspgen.base.util.asp.program.SymbolTable;

/**
 * Validator that checks every predicate used by a rule (nested ones included) agrees with the definition registered
 * under its name, and that the rule doesn't itself use one name in two different ways.
 */
public final class ArityValidator implements RuleValidator
{
  @Override
  public void checkValidity(Rule xiRule, SymbolTable xiSymbols)
  {
    Map<String, PredicateDefinition> lSeen = new HashMap<>();
    for (Predicate lPredicate : xiRule.collect(Predicate.class))
    {
      PredicateDefinition lDefinition = lPredicate.getDefinition();
      xiSymbols.checkCompatible(lDefinition, xiRule);
      SymbolTable.checkCompatible(lSeen.get(lDefinition.getName()), lDefinition, xiRule);
      lSeen.put(lDefinition.getName(), lDefinition);
    }
  }
}

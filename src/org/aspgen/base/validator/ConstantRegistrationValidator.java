package org.aspgen.base.validator;

import org.aspgen.base.util.asp.exceptions.UnregisteredConstantException;
import org.aspgen.base.util.asp.grammar.SymbolicConstant;
import org.aspgen.base.util.asp.program.Rule;
import org.aspgen.base.util.asp.program.SymbolTable;

/**
 * Validator that checks every symbolic constant used by a rule has been registered.
 */
public final class ConstantRegistrationValidator implements RuleValidator
{
  @Override
  public void checkValidity(Rule xiRule, SymbolTable xiSymbols)
  {
    for (SymbolicConstant lConstant : xiRule.collect(SymbolicConstant.class))
    {
      if (!xiSymbols.isConstantRegistered(lConstant.getName()))
      {
        throw new UnregisteredConstantException(lConstant.getName(), xiRule);
      }
    }
  }
}

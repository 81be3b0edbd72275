package org.aspgen.base.validator;

import org.aspgen.base.util.asp.program.Rule;
import org.aspgen.base.util.asp.program.SymbolTable;

/**
 * A check that a rule is valid in the context of the program it's being added to.  Validators only inspect; they
 * never modify the symbol table.
 */
public interface RuleValidator
{
  /**
   * @param xiRule - the rule.
   * @param xiSymbols - the symbols registered with the program so far.
   *
   * @throws org.aspgen.base.util.asp.exceptions.AspException if the rule is invalid.
   */
  void checkValidity(Rule xiRule, SymbolTable xiSymbols);
}

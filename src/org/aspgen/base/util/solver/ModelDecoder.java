package org.aspgen.base.util.solver;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.aspgen.base.util.asp.exceptions.AspException;
import org.aspgen.base.util.asp.grammar.ClassicalNegation;
import org.aspgen.base.util.asp.grammar.Constant;
import org.aspgen.base.util.asp.grammar.Field;
import org.aspgen.base.util.asp.grammar.FieldKind;
import org.aspgen.base.util.asp.grammar.Predicate;
import org.aspgen.base.util.asp.grammar.PredicateDefinition;
import org.aspgen.base.util.asp.grammar.StringConstant;
import org.aspgen.base.util.asp.grammar.SymbolicConstant;
import org.aspgen.base.util.asp.grammar.Term;
import org.aspgen.base.util.asp.program.SymbolTable;

/**
 * Decoder that turns the atoms of a model back into typed predicates, using the definitions registered with a
 * program.
 *
 * A bare symbol in a field declared to hold a predicate becomes a nullary predicate.  In a value field it becomes a
 * symbolic constant.  In a field that may hold either, it's a predicate if a nullary predicate of that name is
 * registered.
 */
public final class ModelDecoder
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final SymbolTable mSymbols;

  public ModelDecoder(SymbolTable xiSymbols)
  {
    mSymbols = xiSymbols;
  }

  /**
   * @return the decoded model.  Atoms that don't correspond to a registered definition are kept, as text, in the
   * model's unrecognized list.
   *
   * @param xiAtoms - the atoms of the model, as printed by the solver.
   */
  public DecodedModel decode(List<String> xiAtoms)
  {
    List<Term> lDecoded = new ArrayList<>();
    List<String> lUnrecognized = new ArrayList<>();

    for (String lAtom : xiAtoms)
    {
      Term lTerm = decodeAtom(lAtom);
      if (lTerm == null)
      {
        lUnrecognized.add(lAtom);
      }
      else
      {
        lDecoded.add(lTerm);
      }
    }

    if (!lUnrecognized.isEmpty())
    {
      LOGGER.debug("Couldn't decode " + lUnrecognized.size() + " atom(s): " + lUnrecognized);
    }
    return new DecodedModel(lDecoded, lUnrecognized);
  }

  /**
   * @return the predicate (or classically negated predicate) for a single atom, or null if it can't be decoded.
   */
  public Term decodeAtom(String xiAtom)
  {
    Symbol lSymbol;
    try
    {
      lSymbol = AtomParser.parse(xiAtom);
    }
    catch (IllegalArgumentException lEx)
    {
      LOGGER.debug("Unparseable atom: " + lEx.getMessage());
      return null;
    }

    if (lSymbol.getType() != Symbol.Type.FUNCTION)
    {
      return null;
    }

    Predicate lPredicate = toPredicate(lSymbol);
    if (lPredicate == null)
    {
      return null;
    }
    return lSymbol.isNegated() ? new ClassicalNegation(lPredicate) : lPredicate;
  }

  private Predicate toPredicate(Symbol xiSymbol)
  {
    PredicateDefinition lDefinition = mSymbols.getDefinition(xiSymbol.getText());
    if ((lDefinition == null) || (lDefinition.arity() != xiSymbol.getArguments().size()))
    {
      return null;
    }

    Object[] lArguments = new Object[lDefinition.arity()];
    for (int ii = 0; ii < lArguments.length; ii++)
    {
      lArguments[ii] = toArgument(xiSymbol.getArguments().get(ii), lDefinition.getFields().get(ii));
      if (lArguments[ii] == null)
      {
        return null;
      }
    }

    try
    {
      return lDefinition.of(lArguments);
    }
    catch (AspException | IllegalArgumentException lEx)
    {
      LOGGER.debug("Can't rebuild " + xiSymbol + ": " + lEx.getMessage());
      return null;
    }
  }

  private Term toArgument(Symbol xiSymbol, Field xiField)
  {
    switch (xiSymbol.getType())
    {
      case NUMBER:
        return (xiField.getKind() == FieldKind.PREDICATE) ? null : Constant.of(xiSymbol.getNumber());

      case STRING:
        if (xiField.getKind() == FieldKind.PREDICATE)
        {
          return null;
        }
        try
        {
          return StringConstant.of(xiSymbol.getText());
        }
        catch (IllegalArgumentException lEx)
        {
          LOGGER.debug("Can't represent string " + xiSymbol + ": " + lEx.getMessage());
          return null;
        }

      default:
        if (xiSymbol.isNegated())
        {
          return null;
        }
        if (!xiSymbol.getArguments().isEmpty())
        {
          return (xiField.getKind() == FieldKind.VALUE) ? null : toPredicate(xiSymbol);
        }
        return toBareSymbol(xiSymbol, xiField.getKind());
    }
  }

  private Term toBareSymbol(Symbol xiSymbol, FieldKind xiKind)
  {
    PredicateDefinition lDefinition = mSymbols.getDefinition(xiSymbol.getText());
    boolean lNullaryPredicate = (lDefinition != null) && (lDefinition.arity() == 0);

    if ((xiKind == FieldKind.PREDICATE) || ((xiKind == FieldKind.ANY) && lNullaryPredicate))
    {
      return toPredicate(xiSymbol);
    }
    return SymbolicConstant.isValidName(xiSymbol.getText()) ? SymbolicConstant.of(xiSymbol.getText()) : null;
  }
}

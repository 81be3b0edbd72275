package org.aspgen.base.util.asp.program;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.aspgen.base.util.asp.exceptions.ArityMismatchException;
import org.aspgen.base.util.asp.exceptions.DuplicateRegistrationException;
import org.aspgen.base.util.asp.exceptions.UnregisteredConstantException;
import org.aspgen.base.util.asp.grammar.PredicateDefinition;
import org.aspgen.base.util.asp.grammar.SymbolicConstant;

/**
 * The constants and predicate definitions registered with a program, in registration order.
 */
public final class SymbolTable
{
  private final Map<String, ConstantDefinition>  mConstants  = new LinkedHashMap<>();
  private final Map<String, PredicateDefinition> mPredicates = new LinkedHashMap<>();

  /**
   * @return a copy of this table, which can be modified independently.
   */
  public SymbolTable copy()
  {
    SymbolTable lCopy = new SymbolTable();
    lCopy.mConstants.putAll(mConstants);
    lCopy.mPredicates.putAll(mPredicates);
    return lCopy;
  }

  /**
   * Replace the contents of this table with those of another.
   */
  void restore(SymbolTable xiOther)
  {
    mConstants.clear();
    mConstants.putAll(xiOther.mConstants);
    mPredicates.clear();
    mPredicates.putAll(xiOther.mPredicates);
  }

  public boolean isConstantRegistered(String xiName)
  {
    return mConstants.containsKey(xiName);
  }

  /**
   * @return the named constant, or null if it isn't registered.
   */
  public ConstantDefinition getConstant(String xiName)
  {
    return mConstants.get(xiName);
  }

  public Collection<ConstantDefinition> getConstants()
  {
    return Collections.unmodifiableCollection(mConstants.values());
  }

  /**
   * Register a constant.  Registering the same name with the same default again is allowed and has no effect.
   *
   * @param xiName - the name.
   * @param xiDefault - the default value, an Integer or String.
   *
   * @return the term for referring to the constant.
   *
   * @throws DuplicateRegistrationException if the name is already registered with a different default.
   */
  SymbolicConstant registerConstant(String xiName, Object xiDefault)
  {
    SymbolicConstant lTerm = new SymbolicConstant(xiName);
    ConstantDefinition lNew = new ConstantDefinition(xiName, xiDefault, null);
    ConstantDefinition lExisting = mConstants.get(xiName);
    if (lExisting == null)
    {
      mConstants.put(xiName, lNew);
    }
    else if (!lExisting.getDefaultValue().equals(xiDefault))
    {
      throw new DuplicateRegistrationException(xiName, lExisting, lNew);
    }
    return lTerm;
  }

  /**
   * Override the value of a registered constant.
   *
   * @throws UnregisteredConstantException if it isn't registered.
   */
  void overrideConstant(String xiName, Object xiValue)
  {
    ConstantDefinition lExisting = mConstants.get(xiName);
    if (lExisting == null)
    {
      throw new UnregisteredConstantException(xiName, null);
    }
    mConstants.put(xiName, lExisting.withOverride(xiValue));
  }

  /**
   * @return the definition registered under the specified (full) name, or null if there isn't one.
   */
  public PredicateDefinition getDefinition(String xiName)
  {
    return mPredicates.get(xiName);
  }

  public Collection<PredicateDefinition> getDefinitions()
  {
    return Collections.unmodifiableCollection(mPredicates.values());
  }

  /**
   * Check that a definition is compatible with whatever is already registered under its name.
   *
   * @param xiDefinition - the definition.
   * @param xiElement - the element that uses it, for error messages.
   *
   * @throws ArityMismatchException if the name is registered with a different arity.
   * @throws DuplicateRegistrationException if the name is registered, with the same arity, but different metadata.
   */
  public void checkCompatible(PredicateDefinition xiDefinition, Object xiElement)
  {
    checkCompatible(mPredicates.get(xiDefinition.getName()), xiDefinition, xiElement);
  }

  /**
   * Check that two definitions sharing a name are compatible.
   *
   * @param xiExisting - the existing definition, or null if there isn't one.
   * @param xiDefinition - the new definition.
   * @param xiElement - the element that uses it, for error messages.
   */
  public static void checkCompatible(PredicateDefinition xiExisting, PredicateDefinition xiDefinition, Object xiElement)
  {
    if (xiExisting == null || xiExisting.equals(xiDefinition))
    {
      return;
    }
    if (xiExisting.arity() != xiDefinition.arity())
    {
      throw new ArityMismatchException(xiDefinition.getName(), xiExisting.arity(), xiDefinition.arity(), xiElement);
    }
    throw new DuplicateRegistrationException(xiDefinition.getName(), xiExisting, xiDefinition);
  }

  /**
   * Register a predicate definition.
   *
   * @throws ArityMismatchException, DuplicateRegistrationException as for {@link #checkCompatible}.
   */
  void registerPredicate(PredicateDefinition xiDefinition)
  {
    checkCompatible(xiDefinition, xiDefinition.getSignature());
    mPredicates.put(xiDefinition.getName(), xiDefinition);
  }
}

package org.aspgen.base.util.asp.exceptions;

/**
 * Thrown when a predicate name is used with an arity other than the one it was first registered with.
 */
public class ArityMismatchException extends AspException
{
  private static final long serialVersionUID = 1L;

  public ArityMismatchException(String xiPredicateName, int xiRegisteredArity, int xiUsedArity, Object xiElement)
  {
    super("Predicate '" + xiPredicateName + "' is registered with arity " + xiRegisteredArity +
          " but used with arity " + xiUsedArity + " in: " + xiElement, xiElement);
  }
}

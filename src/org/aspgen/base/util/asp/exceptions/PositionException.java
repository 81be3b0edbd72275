package org.aspgen.base.util.asp.exceptions;

/**
 * Thrown when a term is placed in a syntactic slot (rule head, rule body, element list, condition) that it can't
 * occupy.
 */
public class PositionException extends AspException
{
  private static final long serialVersionUID = 1L;

  public PositionException(String xiMessage, Object xiOffendingElement)
  {
    super(xiMessage, xiOffendingElement);
  }
}

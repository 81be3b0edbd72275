package org.aspgen.base.util.asp.exceptions;

/**
 * Thrown when a term is given a child of a kind that it can't directly contain.
 */
public class ContainmentException extends AspException
{
  private static final long serialVersionUID = 1L;

  public ContainmentException(String xiMessage, Object xiOffendingElement)
  {
    super(xiMessage, xiOffendingElement);
  }
}

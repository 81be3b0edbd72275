package org.aspgen.base.util.asp.exceptions;

/**
 * Abstract class for exceptions that are a result of building an invalid ASP program.
 *
 * Every subclass names the offending element (by its rendering) so that failures can be traced back to the term or
 * rule that caused them.
 */
public abstract class AspException extends RuntimeException
{
  private static final long serialVersionUID = 1L;

  private final String mOffendingElement;

  protected AspException(String xiMessage, Object xiOffendingElement)
  {
    super(xiMessage);
    mOffendingElement = (xiOffendingElement == null) ? null : xiOffendingElement.toString();
  }

  protected AspException(String xiMessage, Object xiOffendingElement, Throwable xiCause)
  {
    super(xiMessage, xiCause);
    mOffendingElement = (xiOffendingElement == null) ? null : xiOffendingElement.toString();
  }

  /**
   * @return the rendering of the term or rule that caused this failure, or null if there isn't a single one.
   */
  public String getOffendingElement()
  {
    return mOffendingElement;
  }
}

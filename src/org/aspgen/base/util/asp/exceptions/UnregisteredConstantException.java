package org.aspgen.base.util.asp.exceptions;

/**
 * Thrown when a symbolic constant is referenced without having been registered with the program.
 */
public class UnregisteredConstantException extends AspException
{
  private static final long serialVersionUID = 1L;

  private final String mConstantName;

  public UnregisteredConstantException(String xiConstantName, Object xiElement)
  {
    super("Symbolic constant '" + xiConstantName + "' is not registered" +
          ((xiElement == null) ? "" : " (used in: " + xiElement + ")"), xiElement);
    mConstantName = xiConstantName;
  }

  public String getConstantName()
  {
    return mConstantName;
  }
}

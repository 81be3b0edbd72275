package org.aspgen.base.util.asp.exceptions;

/**
 * Thrown when a constant or predicate definition is registered a second time with conflicting metadata.
 */
public class DuplicateRegistrationException extends AspException
{
  private static final long serialVersionUID = 1L;

  public DuplicateRegistrationException(String xiName, Object xiExisting, Object xiConflicting)
  {
    super("'" + xiName + "' is already registered as " + xiExisting + ", can't re-register as " + xiConflicting,
          xiConflicting);
  }
}

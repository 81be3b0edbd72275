package org.aspgen.base.util.asp.grammar;

public interface GroundednessQueryable
{
  /**
   * @return whether this contains no variables.
   */
  boolean isGround();
}

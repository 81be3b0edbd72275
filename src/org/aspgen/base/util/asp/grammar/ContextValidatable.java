package org.aspgen.base.util.asp.grammar;

import org.aspgen.base.validator.Position;

/**
 * Something that knows whether it may appear in a given syntactic position.
 */
public interface ContextValidatable
{
  /**
   * Check that this may be placed in the specified position.
   *
   * @param xiPosition - the syntactic slot.
   *
   * @throws org.aspgen.base.util.asp.exceptions.PositionException if it may not.
   */
  void validateIn(Position xiPosition);
}

package org.aspgen.base.util.asp.grammar;

/**
 * A set of alternatives that expands, during grounding, into one instance per member.  Pools are always ground.
 */
@SuppressWarnings("serial")
public abstract class Pool extends Term
{
  @Override
  public boolean isGround()
  {
    return true;
  }
}

package org.aspgen.base.util.asp.exceptions;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Thrown when a memoized predicate generator (directly or indirectly) requests its own result.
 */
public class CycleException extends AspException
{
  private static final long serialVersionUID = 1L;

  private final ImmutableList<String> mPath;

  /**
   * @param xiPath - the chain of cache keys, outermost first, ending with the key that was re-entered.
   */
  public CycleException(List<String> xiPath)
  {
    super("Cyclic predicate generation: " + Joiner.on(" -> ").join(xiPath), xiPath.get(xiPath.size() - 1));
    mPath = ImmutableList.copyOf(xiPath);
  }

  public List<String> getPath()
  {
    return mPath;
  }
}

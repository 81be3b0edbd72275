package org.aspgen.base.util.solver;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Exception thrown when solving fails.
 */
public class SolverException extends Exception
{
  private static final long serialVersionUID = 1L;

  private final List<SolverMessage> mMessages;

  public SolverException(String xiMessage)
  {
    super(xiMessage);
    mMessages = Collections.emptyList();
  }

  public SolverException(String xiMessage, Throwable xiCause)
  {
    super(xiMessage, xiCause);
    mMessages = Collections.emptyList();
  }

  public SolverException(String xiMessage, List<SolverMessage> xiMessages)
  {
    super(xiMessage);
    mMessages = ImmutableList.copyOf(xiMessages);
  }

  /**
   * @return the messages the solver reported, if any.
   */
  public List<SolverMessage> getSolverMessages()
  {
    return mMessages;
  }
}

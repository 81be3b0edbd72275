package org.aspgen.base.util.solver;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The result of a solve: the outcome, the models found (each an ordered list of atoms, as text) and any messages.
 */
public final class SolveResult
{
  private final SolveOutcome                      mOutcome;
  private final boolean                           mExhausted;
  private final boolean                           mTimedOut;
  private final ImmutableList<List<String>>       mModels;
  private final ImmutableList<SolverMessage>      mMessages;

  public SolveResult(SolveOutcome xiOutcome,
                     boolean xiExhausted,
                     boolean xiTimedOut,
                     List<List<String>> xiModels,
                     List<SolverMessage> xiMessages)
  {
    mOutcome = xiOutcome;
    mExhausted = xiExhausted;
    mTimedOut = xiTimedOut;

    ImmutableList.Builder<List<String>> lModels = ImmutableList.builder();
    for (List<String> lModel : xiModels)
    {
      lModels.add(ImmutableList.copyOf(lModel));
    }
    mModels = lModels.build();
    mMessages = ImmutableList.copyOf(xiMessages);
  }

  public SolveOutcome getOutcome()
  {
    return mOutcome;
  }

  public boolean isSatisfiable()
  {
    return mOutcome == SolveOutcome.SATISFIABLE;
  }

  /**
   * @return whether the solver searched the whole space, so that the models returned are all there are.
   */
  public boolean isExhausted()
  {
    return mExhausted;
  }

  public boolean isTimedOut()
  {
    return mTimedOut;
  }

  public List<List<String>> getModels()
  {
    return mModels;
  }

  public List<SolverMessage> getMessages()
  {
    return mMessages;
  }

  @Override
  public String toString()
  {
    return mOutcome + ", " + mModels.size() + " model(s)" + (mExhausted ? ", exhausted" : "") +
           (mTimedOut ? ", timed out" : "");
  }
}

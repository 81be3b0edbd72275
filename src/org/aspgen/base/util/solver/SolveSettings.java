package org.aspgen.base.util.solver;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.aspgen.base.util.config.AspConfiguration;
import org.aspgen.base.util.config.AspConfiguration.CfgItem;

/**
 * Immutable settings for a single solve.
 */
public final class SolveSettings
{
  private final int          mMaxModels;
  private final int          mTimeoutSeconds;
  private final MessageLevel mStopOnLevel;

  private SolveSettings(int xiMaxModels, int xiTimeoutSeconds, MessageLevel xiStopOnLevel)
  {
    checkArgument(xiMaxModels >= 0, "Model limit must be non-negative: %s", xiMaxModels);
    checkArgument(xiTimeoutSeconds >= 0, "Timeout must be non-negative: %s", xiTimeoutSeconds);
    mMaxModels = xiMaxModels;
    mTimeoutSeconds = xiTimeoutSeconds;
    mStopOnLevel = checkNotNull(xiStopOnLevel);
  }

  /**
   * @return settings taken from configuration: all models (up to the configured cap), the configured timeout and the
   * configured stop level.
   */
  public static SolveSettings fromConfiguration()
  {
    return new SolveSettings(0,
                             AspConfiguration.getCfgInt(CfgItem.SOLVE_TIMEOUT_SECONDS),
                             MessageLevel.fromString(AspConfiguration.getCfgStr(CfgItem.STOP_ON_MESSAGE_LEVEL)));
  }

  /**
   * @return a copy of these settings asking for at most the specified number of models.  0 means "all", subject to
   * the configured cap.
   */
  public SolveSettings withMaxModels(int xiMaxModels)
  {
    return new SolveSettings(xiMaxModels, mTimeoutSeconds, mStopOnLevel);
  }

  /**
   * @return a copy of these settings with the specified time limit.  0 means no limit.
   */
  public SolveSettings withTimeoutSeconds(int xiTimeoutSeconds)
  {
    return new SolveSettings(mMaxModels, xiTimeoutSeconds, mStopOnLevel);
  }

  /**
   * @return a copy of these settings that abort on messages at or above the specified level.
   */
  public SolveSettings withStopOnLevel(MessageLevel xiLevel)
  {
    return new SolveSettings(mMaxModels, mTimeoutSeconds, xiLevel);
  }

  /**
   * @return the number of models requested, as given (0 for all).
   */
  public int getMaxModels()
  {
    return mMaxModels;
  }

  /**
   * @return the number of models to actually ask the solver for.  Requests for "all" models are capped.
   */
  public int getEffectiveMaxModels()
  {
    return (mMaxModels == 0) ? AspConfiguration.getCfgInt(CfgItem.MAX_MODELS) : mMaxModels;
  }

  public int getTimeoutSeconds()
  {
    return mTimeoutSeconds;
  }

  public MessageLevel getStopOnLevel()
  {
    return mStopOnLevel;
  }

  @Override
  public String toString()
  {
    return "models=" + getEffectiveMaxModels() + ", timeout=" + mTimeoutSeconds + "s, stop on " + mStopOnLevel;
  }
}

package org.aspgen.base.util.solver;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.aspgen.base.util.config.AspConfiguration;
import org.aspgen.base.util.config.AspConfiguration.CfgItem;

import com.google.common.base.Joiner;
import com.google.common.io.Files;

/**
 * Solver that runs clingo as a child process.  The program is written to the solver's standard input.  Standard
 * output and error go to temporary files so that neither pipe can fill up and block the solver.
 */
public class ClingoSolver implements Solver
{
  private static final Logger LOGGER = LogManager.getLogger();

  // Exit code bits used by clingo to report errors (as opposed to search results).
  private static final int EXIT_ERROR  = 64;
  private static final int EXIT_NO_RUN = 128;

  private final String mExecutable;

  /**
   * Create a solver using the configured executable.
   */
  public ClingoSolver()
  {
    this(AspConfiguration.getCfgStr(CfgItem.CLINGO_EXECUTABLE));
  }

  /**
   * @param xiExecutable - path to (or name of) the clingo executable.
   */
  public ClingoSolver(String xiExecutable)
  {
    mExecutable = xiExecutable;
  }

  /**
   * @return the command line for a solve with the specified settings.
   */
  List<String> buildCommand(SolveSettings xiSettings)
  {
    List<String> lCommand = new ArrayList<>();
    lCommand.add(mExecutable);
    lCommand.add("--models=" + xiSettings.getEffectiveMaxModels());
    if (xiSettings.getTimeoutSeconds() > 0)
    {
      lCommand.add("--time-limit=" + xiSettings.getTimeoutSeconds());
    }
    return lCommand;
  }

  @Override
  public SolveResult solve(String xiProgram, SolveSettings xiSettings) throws SolverException
  {
    List<String> lCommand = buildCommand(xiSettings);
    LOGGER.debug("Running " + Joiner.on(' ').join(lCommand) + " (" + xiSettings + ")");

    File lOut = null;
    File lErr = null;
    try
    {
      lOut = File.createTempFile("aspgen", ".out");
      lErr = File.createTempFile("aspgen", ".err");

      int lExitCode = run(lCommand, xiProgram, lOut, lErr, xiSettings);

      String lStdout = Files.asCharSource(lOut, StandardCharsets.UTF_8).read();
      String lStderr = Files.asCharSource(lErr, StandardCharsets.UTF_8).read();
      return interpret(lExitCode, lStdout, lStderr, xiProgram, xiSettings);
    }
    catch (IOException lEx)
    {
      throw new SolverException("Failed to run " + mExecutable, lEx);
    }
    finally
    {
      deleteQuietly(lOut);
      deleteQuietly(lErr);
    }
  }

  private static int run(List<String> xiCommand,
                         String xiProgram,
                         File xiOut,
                         File xiErr,
                         SolveSettings xiSettings) throws IOException, SolverException
  {
    ProcessBuilder lBuilder = new ProcessBuilder(xiCommand);
    lBuilder.redirectOutput(xiOut);
    lBuilder.redirectError(xiErr);
    return awaitExit(lBuilder.start(), xiProgram, xiSettings);
  }

  /**
   * Feed the program to a started solver process and wait for it to exit.  The process is killed if this returns by
   * any route other than the process exiting.
   *
   * @return the process's exit code.
   */
  static int awaitExit(Process xiProcess, String xiProgram, SolveSettings xiSettings)
    throws IOException, SolverException
  {
    boolean lExited = false;
    try
    {
      try (OutputStream lInput = xiProcess.getOutputStream())
      {
        lInput.write(xiProgram.getBytes(StandardCharsets.UTF_8));
      }

      if (xiSettings.getTimeoutSeconds() > 0)
      {
        long lWait = xiSettings.getTimeoutSeconds() + AspConfiguration.getCfgInt(CfgItem.PROCESS_GRACE_SECONDS);
        if (!xiProcess.waitFor(lWait, TimeUnit.SECONDS))
        {
          throw new SolverException("Solver didn't finish within " + lWait + "s");
        }
      }
      else
      {
        xiProcess.waitFor();
      }
      lExited = true;
    }
    catch (InterruptedException lEx)
    {
      Thread.currentThread().interrupt();
      throw new SolverException("Interrupted while waiting for solver", lEx);
    }
    finally
    {
      if (!lExited)
      {
        LOGGER.debug("Killing solver process");
        xiProcess.destroyForcibly();
      }
    }

    return xiProcess.exitValue();
  }

  /**
   * @return the result of a completed solver run.
   *
   * @throws SolverException if the solver failed, or reported a message at or above the stop level.
   */
  static SolveResult interpret(int xiExitCode,
                               String xiStdout,
                               String xiStderr,
                               String xiProgram,
                               SolveSettings xiSettings) throws SolverException
  {
    List<SolverMessage> lMessages = SolverMessageLog.parse(xiStderr);
    for (SolverMessage lMessage : lMessages)
    {
      LOGGER.warn(SolverMessageLog.format(lMessage, xiProgram));
    }

    if ((xiExitCode & (EXIT_ERROR | EXIT_NO_RUN)) != 0)
    {
      throw new SolverException("Solver failed with exit code " + xiExitCode + describe(lMessages, xiProgram),
                                lMessages);
    }

    MessageLevel lHighest = SolverMessageLog.getHighestLevel(lMessages);
    if ((lHighest != null) && lHighest.isAtLeast(xiSettings.getStopOnLevel()))
    {
      throw new SolverException("Solver reported " + lHighest + " level message(s)" +
                                  describe(lMessages, xiProgram),
                                lMessages);
    }

    return ClingoOutputParser.parse(xiStdout, lMessages);
  }

  private static String describe(List<SolverMessage> xiMessages, String xiProgram)
  {
    String lFormatted = SolverMessageLog.formatAll(xiMessages, xiProgram, "solving");
    return (lFormatted == null) ? "" : "\n" + lFormatted;
  }

  private static void deleteQuietly(File xiFile)
  {
    if ((xiFile != null) && !xiFile.delete())
    {
      LOGGER.debug("Failed to delete " + xiFile);
    }
  }
}

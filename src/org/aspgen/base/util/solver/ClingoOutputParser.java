package org.aspgen.base.util.solver;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Splitter;

/**
 * Parser for the solver's standard (text) output.
 *
 * <pre>
 * Answer: 1
 * cell(1,2) cell(2,1)
 * SATISFIABLE
 *
 * Models       : 1+
 * </pre>
 *
 * A "+" after the model count means the search space wasn't exhausted.
 */
public final class ClingoOutputParser
{
  private static final Pattern ANSWER = Pattern.compile("^Answer:\\s*\\d+\\s*$");
  private static final Pattern MODELS = Pattern.compile("^Models\\s*:\\s*(\\d+)(\\+?)\\s*$");
  private static final Pattern TIME_LIMIT = Pattern.compile("^(TIME LIMIT|INTERRUPTED)\\s*:\\s*1\\s*$");

  private ClingoOutputParser()
  {
  }

  /**
   * @return the result described by the specified output.
   *
   * @param xiOutput - everything the solver wrote to its standard output.
   * @param xiMessages - the messages it reported.
   */
  public static SolveResult parse(String xiOutput, List<SolverMessage> xiMessages)
  {
    List<String> lLines = Splitter.onPattern("\r?\n").splitToList(xiOutput);
    List<List<String>> lModels = new ArrayList<>();
    SolveOutcome lOutcome = SolveOutcome.UNKNOWN;
    boolean lExhausted = false;
    boolean lTimedOut = false;

    for (int ii = 0; ii < lLines.size(); ii++)
    {
      String lLine = lLines.get(ii).trim();

      if (ANSWER.matcher(lLine).matches())
      {
        // The atoms follow on the next line, which is empty if nothing is shown.
        String lAtoms = (ii + 1 < lLines.size()) ? lLines.get(ii + 1) : "";
        lModels.add(AtomParser.splitAtoms(lAtoms));
        ii++;
        continue;
      }

      switch (lLine)
      {
        case "SATISFIABLE":
        case "OPTIMUM FOUND":
          lOutcome = SolveOutcome.SATISFIABLE;
          continue;
        case "UNSATISFIABLE":
          lOutcome = SolveOutcome.UNSATISFIABLE;
          continue;
        case "UNKNOWN":
          lOutcome = SolveOutcome.UNKNOWN;
          continue;
        default:
          break;
      }

      Matcher lMatcher = MODELS.matcher(lLine);
      if (lMatcher.matches())
      {
        lExhausted = lMatcher.group(2).isEmpty();
        continue;
      }

      if (TIME_LIMIT.matcher(lLine).matches())
      {
        lTimedOut = true;
      }
    }

    // Interrupted searches may report models without a final verdict.
    if ((lOutcome == SolveOutcome.UNKNOWN) && !lModels.isEmpty())
    {
      lOutcome = SolveOutcome.SATISFIABLE;
    }
    if (lTimedOut)
    {
      lExhausted = false;
    }

    return new SolveResult(lOutcome, lExhausted, lTimedOut, lModels, xiMessages);
  }
}

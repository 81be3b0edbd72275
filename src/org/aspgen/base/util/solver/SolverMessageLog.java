package org.aspgen.base.util.solver;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang.StringUtils;

import com.google.common.base.Splitter;

/**
 * Parsing and formatting of the messages the solver writes to its error stream.
 *
 * Located messages look like <tt>&lt;stdin&gt;:3:5-10: error: syntax error</tt> (the end may also be
 * <tt>line:column</tt>).  Indented lines continue the previous message.  The solver's own failures look like
 * <tt>*** ERROR: (clingo): parsing failed</tt>.
 */
public final class SolverMessageLog
{
  private static final Pattern LOCATED = Pattern.compile(
      "^<?([^:>]*)>?:(\\d+):(\\d+)(?:-(?:\\d+:)?(\\d+))?:\\s*(\\w+):\\s*(.*)$");
  private static final Pattern TOOL = Pattern.compile("^\\*\\*\\* (\\w+)\\s*: \\(([^)]*)\\):\\s*(.*)$");
  private static final Pattern LEVELLED = Pattern.compile("^(\\w+):\\s*(.+)$");

  private static final String RULER = StringUtils.repeat("-", 60);

  private SolverMessageLog()
  {
  }

  /**
   * @return the messages in the specified error output.
   *
   * @param xiErrorOutput - everything the solver wrote to its error stream.
   */
  public static List<SolverMessage> parse(String xiErrorOutput)
  {
    List<SolverMessage> lMessages = new ArrayList<>();
    for (String lLine : Splitter.onPattern("\r?\n").split(xiErrorOutput))
    {
      if (StringUtils.isBlank(lLine))
      {
        continue;
      }

      Matcher lMatcher = LOCATED.matcher(lLine);
      if (lMatcher.matches())
      {
        int lStart = Integer.parseInt(lMatcher.group(3));
        int lEnd = (lMatcher.group(4) == null) ? lStart + 1 : Integer.parseInt(lMatcher.group(4));
        lMessages.add(new SolverMessage(lMatcher.group(1),
                                        Integer.parseInt(lMatcher.group(2)),
                                        lStart,
                                        lEnd,
                                        lMatcher.group(5),
                                        lMatcher.group(6)));
        continue;
      }

      lMatcher = TOOL.matcher(lLine);
      if (lMatcher.matches())
      {
        lMessages.add(new SolverMessage(lMatcher.group(2), 0, 0, 0, lMatcher.group(1), lMatcher.group(3)));
        continue;
      }

      if (Character.isWhitespace(lLine.charAt(0)) && !lMessages.isEmpty())
      {
        int lLast = lMessages.size() - 1;
        lMessages.set(lLast, lMessages.get(lLast).withContinuation(lLine.trim()));
        continue;
      }

      lMatcher = LEVELLED.matcher(lLine);
      if (lMatcher.matches())
      {
        lMessages.add(new SolverMessage("<unknown>", 0, 0, 0, lMatcher.group(1), lMatcher.group(2)));
      }
      else
      {
        lMessages.add(new SolverMessage("<unknown>", 0, 0, 0, "info", lLine));
      }
    }
    return lMessages;
  }

  /**
   * @return the highest level among the messages, or null if there are none.
   */
  public static MessageLevel getHighestLevel(List<SolverMessage> xiMessages)
  {
    MessageLevel lHighest = null;
    for (SolverMessage lMessage : xiMessages)
    {
      if (lHighest == null || lMessage.getLevel().isAtLeast(lHighest))
      {
        lHighest = lMessage.getLevel();
      }
    }
    return lHighest;
  }

  /**
   * @return a message formatted for people, with the program line it refers to (and the one before) and a marker
   * under the offending columns.
   *
   * @param xiMessage - the message.
   * @param xiProgram - the program text the message refers to.
   */
  public static String format(SolverMessage xiMessage, String xiProgram)
  {
    List<String> lSource = Splitter.onPattern("\r?\n").splitToList(xiProgram);
    StringBuilder lBuilder = new StringBuilder();
    lBuilder.append(xiMessage.getSeverity().toUpperCase()).append(": ").append(xiMessage.getText()).append("\n");

    if (xiMessage.hasLocation())
    {
      lBuilder.append("  at line ").append(xiMessage.getLine())
              .append(", columns ").append(xiMessage.getColumnStart()).append("-").append(xiMessage.getColumnEnd())
              .append("\n\n");
      lBuilder.append("  in ").append(xiMessage.getFileName()).append("\n");

      int lLine = xiMessage.getLine();
      if (lLine <= lSource.size())
      {
        if (lLine > 1)
        {
          lBuilder.append(String.format("%4d | %s\n", lLine - 1, lSource.get(lLine - 2)));
        }
        lBuilder.append(String.format("%4d | %s\n", lLine, lSource.get(lLine - 1)));

        if (xiMessage.getColumnStart() > 0)
        {
          int lWidth = Math.max(1, xiMessage.getColumnEnd() - xiMessage.getColumnStart());
          lBuilder.append("       ")
                  .append(StringUtils.repeat(" ", xiMessage.getColumnStart() - 1))
                  .append(StringUtils.repeat("^", lWidth))
                  .append("\n");
        }
      }
    }

    return lBuilder.toString();
  }

  /**
   * @return all of the messages, formatted, or null if there aren't any.
   *
   * @param xiMessages - the messages.
   * @param xiProgram - the program text they refer to.
   * @param xiVerb - what the solver was doing, e.g. "solving".
   */
  public static String formatAll(List<SolverMessage> xiMessages, String xiProgram, String xiVerb)
  {
    if (xiMessages.isEmpty())
    {
      return null;
    }

    StringBuilder lBuilder = new StringBuilder();
    lBuilder.append(RULER).append("\n");
    lBuilder.append("Found ").append(xiMessages.size()).append(xiMessages.size() == 1 ? " message" : " messages")
            .append(" during ").append(xiVerb).append(":\n\n");
    for (SolverMessage lMessage : xiMessages)
    {
      lBuilder.append(format(lMessage, xiProgram)).append("\n").append(RULER).append("\n");
    }
    return lBuilder.toString();
  }
}

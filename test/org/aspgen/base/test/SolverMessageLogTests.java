package org.aspgen.base.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Collections;
import java.util.List;

import org.aspgen.base.util.solver.MessageLevel;
import org.aspgen.base.util.solver.SolverMessage;
import org.aspgen.base.util.solver.SolverMessageLog;
import org.junit.Test;

public class SolverMessageLogTests
{
  private static final String PROGRAM = "a.\nbad x.\nc.\n";

  @Test
  public void testLocatedMessage()
  {
    List<SolverMessage> lMessages = SolverMessageLog.parse("<stdin>:2:5-6: error: syntax error, unexpected <IDENTIFIER>\n");

    assertEquals(1, lMessages.size());
    SolverMessage lMessage = lMessages.get(0);
    assertEquals("stdin", lMessage.getFileName());
    assertEquals(2, lMessage.getLine());
    assertEquals(5, lMessage.getColumnStart());
    assertEquals(6, lMessage.getColumnEnd());
    assertEquals(MessageLevel.ERROR, lMessage.getLevel());
    assertEquals("syntax error, unexpected <IDENTIFIER>", lMessage.getText());
    assertTrue(lMessage.hasLocation());
  }

  @Test
  public void testMultiLineLocation()
  {
    SolverMessage lMessage = SolverMessageLog.parse("<stdin>:3:5-4:2: info: x").get(0);
    assertEquals(3, lMessage.getLine());
    assertEquals(5, lMessage.getColumnStart());
    assertEquals(2, lMessage.getColumnEnd());
    assertEquals(MessageLevel.INFO, lMessage.getLevel());
  }

  @Test
  public void testContinuationLines()
  {
    List<SolverMessage> lMessages = SolverMessageLog.parse(
        "<stdin>:2:1-5: info: atom does not occur in any rule head:\n" +
        "  q(X)\n" +
        "\n");

    assertEquals(1, lMessages.size());
    assertEquals("atom does not occur in any rule head:\nq(X)", lMessages.get(0).getText());
  }

  @Test
  public void testToolAndUnlocatedMessages()
  {
    List<SolverMessage> lMessages = SolverMessageLog.parse("*** ERROR: (clingo): parsing failed\n" +
                                                           "warning: something odd\n" +
                                                           "plain text\n");

    assertEquals(3, lMessages.size());
    assertEquals("clingo", lMessages.get(0).getFileName());
    assertEquals(MessageLevel.ERROR, lMessages.get(0).getLevel());
    assertEquals("parsing failed", lMessages.get(0).getText());
    assertFalse(lMessages.get(0).hasLocation());
    assertEquals(MessageLevel.WARNING, lMessages.get(1).getLevel());
    assertEquals("something odd", lMessages.get(1).getText());
    assertEquals(MessageLevel.INFO, lMessages.get(2).getLevel());
    assertEquals("plain text", lMessages.get(2).getText());
  }

  @Test
  public void testHighestLevel()
  {
    assertNull(SolverMessageLog.getHighestLevel(Collections.<SolverMessage>emptyList()));
    assertEquals(MessageLevel.ERROR,
                 SolverMessageLog.getHighestLevel(SolverMessageLog.parse("info: a\nerror: b\nwarning: c\n")));
  }

  @Test
  public void testLevelNames()
  {
    assertEquals(MessageLevel.WARNING, MessageLevel.fromString("Warn"));
    assertEquals(MessageLevel.CRITICAL, MessageLevel.fromString("FATAL"));
    assertEquals(MessageLevel.INFO, MessageLevel.fromString("chatter"));
    assertEquals(MessageLevel.INFO, MessageLevel.fromString(null));
    assertTrue(MessageLevel.ERROR.isAtLeast(MessageLevel.INFO));
    assertTrue(MessageLevel.INFO.isAtLeast(MessageLevel.INFO));
    assertFalse(MessageLevel.DEBUG.isAtLeast(MessageLevel.INFO));
  }

  @Test
  public void testFormat()
  {
    SolverMessage lMessage = new SolverMessage("stdin", 2, 1, 4, "error", "syntax error");

    assertEquals("ERROR: syntax error\n" +
                 "  at line 2, columns 1-4\n" +
                 "\n" +
                 "  in stdin\n" +
                 "   1 | a.\n" +
                 "   2 | bad x.\n" +
                 "       ^^^\n",
                 SolverMessageLog.format(lMessage, PROGRAM));
  }

  @Test
  public void testFormatFirstLine()
  {
    SolverMessage lMessage = new SolverMessage("stdin", 1, 2, 3, "info", "odd");

    assertEquals("INFO: odd\n" +
                 "  at line 1, columns 2-3\n" +
                 "\n" +
                 "  in stdin\n" +
                 "   1 | a.\n" +
                 "        ^\n",
                 SolverMessageLog.format(lMessage, PROGRAM));
  }

  @Test
  public void testFormatAll()
  {
    assertNull(SolverMessageLog.formatAll(Collections.<SolverMessage>emptyList(), PROGRAM, "solving"));

    String lFormatted = SolverMessageLog.formatAll(SolverMessageLog.parse("error: first\nerror: second\n"),
                                                   PROGRAM,
                                                   "solving");
    assertTrue(lFormatted.contains("Found 2 messages during solving:"));
    assertTrue(lFormatted.contains("ERROR: first\n"));
    assertTrue(lFormatted.contains("ERROR: second\n"));
  }
}

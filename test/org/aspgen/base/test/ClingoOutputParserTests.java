package org.aspgen.base.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.aspgen.base.util.solver.ClingoOutputParser;
import org.aspgen.base.util.solver.SolveOutcome;
import org.aspgen.base.util.solver.SolveResult;
import org.aspgen.base.util.solver.SolverMessage;
import org.junit.Test;

public class ClingoOutputParserTests
{
  private static final List<SolverMessage> NO_MESSAGES = Collections.emptyList();

  @Test
  public void testAllModels()
  {
    SolveResult lResult = ClingoOutputParser.parse("clingo version 5.6.2\n" +
                                                   "Reading from stdin\n" +
                                                   "Solving...\n" +
                                                   "Answer: 1\n" +
                                                   "p(1) q(\"a b\")\n" +
                                                   "Answer: 2\n" +
                                                   "p(2)\n" +
                                                   "SATISFIABLE\n" +
                                                   "\n" +
                                                   "Models       : 2\n" +
                                                   "Calls        : 1\n" +
                                                   "Time         : 0.001s\n",
                                                   NO_MESSAGES);

    assertEquals(SolveOutcome.SATISFIABLE, lResult.getOutcome());
    assertTrue(lResult.isSatisfiable());
    assertTrue(lResult.isExhausted());
    assertFalse(lResult.isTimedOut());
    assertEquals(Arrays.asList(Arrays.asList("p(1)", "q(\"a b\")"), Arrays.asList("p(2)")), lResult.getModels());
  }

  @Test
  public void testMoreModelsAvailable()
  {
    SolveResult lResult = ClingoOutputParser.parse("Answer: 1\np(1)\nSATISFIABLE\n\nModels       : 1+\n", NO_MESSAGES);

    assertTrue(lResult.isSatisfiable());
    assertFalse(lResult.isExhausted());
  }

  @Test
  public void testUnsatisfiable()
  {
    SolveResult lResult = ClingoOutputParser.parse("Solving...\nUNSATISFIABLE\n\nModels       : 0\n", NO_MESSAGES);

    assertEquals(SolveOutcome.UNSATISFIABLE, lResult.getOutcome());
    assertFalse(lResult.isSatisfiable());
    assertTrue(lResult.isExhausted());
    assertTrue(lResult.getModels().isEmpty());
  }

  @Test
  public void testEmptyModel()
  {
    SolveResult lResult = ClingoOutputParser.parse("Answer: 1\n\nSATISFIABLE\n\nModels       : 1\n", NO_MESSAGES);

    assertEquals(1, lResult.getModels().size());
    assertTrue(lResult.getModels().get(0).isEmpty());
  }

  @Test
  public void testOptimum()
  {
    SolveResult lResult = ClingoOutputParser.parse("Answer: 1\np(3)\nOptimization: 3\nOPTIMUM FOUND\n",
                                                   NO_MESSAGES);

    assertEquals(SolveOutcome.SATISFIABLE, lResult.getOutcome());
  }

  @Test
  public void testTimeLimit()
  {
    SolveResult lResult = ClingoOutputParser.parse("Answer: 1\n" +
                                                   "p(1)\n" +
                                                   "UNKNOWN\n" +
                                                   "\n" +
                                                   "TIME LIMIT   : 1\n" +
                                                   "Models       : 1\n",
                                                   NO_MESSAGES);

    assertTrue(lResult.isTimedOut());
    assertFalse(lResult.isExhausted());
    assertEquals(SolveOutcome.SATISFIABLE, lResult.getOutcome());
  }

  @Test
  public void testUnknownWithoutModels()
  {
    SolveResult lResult = ClingoOutputParser.parse("UNKNOWN\n\nINTERRUPTED  : 1\nModels       : 0+\n", NO_MESSAGES);

    assertEquals(SolveOutcome.UNKNOWN, lResult.getOutcome());
    assertTrue(lResult.isTimedOut());
  }
}

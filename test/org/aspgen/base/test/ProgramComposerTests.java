package org.aspgen.base.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import org.aspgen.base.util.asp.compose.CountBound;
import org.aspgen.base.util.asp.compose.Module;
import org.aspgen.base.util.asp.compose.ProgramComposer;
import org.aspgen.base.util.asp.grammar.PredicateDefinition;
import org.aspgen.base.util.asp.grammar.RangePool;
import org.aspgen.base.util.asp.grammar.Term;
import org.aspgen.base.util.asp.grammar.Variable;
import org.aspgen.base.util.solver.DecodedModel;
import org.aspgen.base.util.solver.SolveOutcome;
import org.aspgen.base.util.solver.SolveResult;
import org.aspgen.base.util.solver.SolveSettings;
import org.aspgen.base.util.solver.Solver;
import org.aspgen.base.util.solver.SolverMessage;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

public class ProgramComposerTests
{
  private static final Variable X = Variable.of("X");
  private static final Variable R = Variable.of("R");

  private static class Grid extends Module
  {
    final PredicateDefinition mCell = define("cell", "row", "value");
    final PredicateDefinition mRow = define("row", "row");
    int mFinalized;

    Grid(ProgramComposer xiComposer, boolean xiPrimary)
    {
      super(xiComposer, "Grid", xiPrimary);
    }

    @Override
    public void finalizeModule()
    {
      mFinalized++;
      fact(mRow.of(RangePool.of(1, 2)));
    }
  }

  private static class Other extends Module
  {
    Other(ProgramComposer xiComposer)
    {
      super(xiComposer, "Other", false);
    }
  }

  /**
   * Solver that returns canned models.
   */
  private static class CannedSolver implements Solver
  {
    private final List<List<String>> mModels;
    String mProgram;

    CannedSolver(List<List<String>> xiModels)
    {
      mModels = xiModels;
    }

    @Override
    public SolveResult solve(String xiProgram, SolveSettings xiSettings)
    {
      mProgram = xiProgram;
      return new SolveResult(SolveOutcome.SATISFIABLE,
                             true,
                             false,
                             mModels,
                             Collections.<SolverMessage>emptyList());
    }
  }

  @Test
  public void testCountConstraint()
  {
    ProgramComposer lComposer = new ProgramComposer("Count");
    Grid lGrid = new Grid(lComposer, true);

    lGrid.countConstraint(X,
                          ImmutableList.<Term>of(lGrid.mCell.of(R, X)),
                          ImmutableList.<Term>of(lGrid.mRow.of(R)),
                          CountBound.EXACTLY,
                          1);
    lGrid.countConstraint(X,
                          ImmutableList.<Term>of(lGrid.mCell.of(1, X)),
                          ImmutableList.<Term>of(),
                          CountBound.AT_MOST,
                          3);

    assertEquals(":- row(R), N = #count{X : cell(R, X)}, N != 1.",
                 lComposer.getProgram().getRules().get(0).render());
    assertEquals(":- N = #count{X : cell(1, X)}, N > 3.",
                 lComposer.getProgram().getRules().get(1).render());
  }

  @Test
  public void testCountVariableAvoidsClashes()
  {
    ProgramComposer lComposer = new ProgramComposer("Count");
    Grid lGrid = new Grid(lComposer, true);
    Variable lN = Variable.of("N");

    lGrid.countConstraint(lN,
                          ImmutableList.<Term>of(lGrid.mCell.of(1, lN)),
                          ImmutableList.<Term>of(),
                          CountBound.AT_LEAST,
                          1);

    assertEquals(":- C = #count{N : cell(1, N)}, C < 1.", lComposer.getProgram().getRules().get(0).render());
  }

  @Test
  public void testUniqueVariable()
  {
    List<String> lPreferred = Arrays.asList("N", "C", "Count");

    assertEquals("N", ProgramComposer.uniqueVariable(new HashSet<String>(), lPreferred).getName());
    assertEquals("C", ProgramComposer.uniqueVariable(new HashSet<>(Arrays.asList("N")), lPreferred).getName());
    assertEquals("Count1",
                 ProgramComposer.uniqueVariable(new HashSet<>(Arrays.asList("N", "C", "Count")), lPreferred)
                                .getName());
    assertEquals("Count2",
                 ProgramComposer.uniqueVariable(new HashSet<>(Arrays.asList("N", "C", "Count", "Count1")), lPreferred)
                                .getName());
  }

  @Test
  public void testFinalizeRunsOnce()
  {
    ProgramComposer lComposer = new ProgramComposer("Final");
    Grid lGrid = new Grid(lComposer, true);

    String lFirst = lComposer.render();
    String lSecond = lComposer.render();

    assertEquals(1, lGrid.mFinalized);
    assertEquals(lFirst, lSecond);
    assertEquals("% Final\n" +
                 "\n" +
                 "row(1..2).\n" +
                 "\n" +
                 "#show.\n" +
                 "#show row/1.\n",
                 lFirst);
  }

  @Test
  public void testModulesGetSegmentsAndNamespaces()
  {
    ProgramComposer lComposer = new ProgramComposer("Modules");
    Grid lGrid = new Grid(lComposer, true);
    Other lOther = new Other(lComposer);

    assertEquals("", lGrid.getNamespace());
    assertEquals("other", lOther.getNamespace());
    assertSame(lOther, lComposer.getModule("other"));
    assertTrue(lComposer.getProgram().hasSegment("grid"));
    assertTrue(lComposer.getProgram().hasSegment("other"));
    assertEquals(2, lComposer.getModules().size());
  }

  @Test(expected=IllegalArgumentException.class)
  public void testDuplicateModuleName()
  {
    ProgramComposer lComposer = new ProgramComposer("Modules");
    new Grid(lComposer, true);
    new Grid(lComposer, false);
  }

  @Test(expected=IllegalArgumentException.class)
  public void testMissingModule()
  {
    new ProgramComposer("Modules").getModule("grid");
  }

  @Test(expected=IllegalArgumentException.class)
  public void testBadModuleName()
  {
    new Module(new ProgramComposer("Modules"), "my-module", false)
    {
      // No predicates.
    };
  }

  @Test
  public void testSolveDecodesModels() throws Exception
  {
    ProgramComposer lComposer = new ProgramComposer("Solve");
    Grid lGrid = new Grid(lComposer, false);
    lGrid.fact(lGrid.mCell.of(1, 7));

    CannedSolver lSolver = new CannedSolver(ImmutableList.<List<String>>of(
                                              ImmutableList.of("grid_cell(1,7)", "grid_row(1)", "mystery(3)")));
    List<DecodedModel> lModels = lComposer.solve(lSolver, SolveSettings.fromConfiguration());

    assertEquals(lComposer.render(), lSolver.mProgram);
    assertEquals(1, lModels.size());
    DecodedModel lModel = lModels.get(0);
    assertEquals(Arrays.asList(lGrid.mCell.of(1, 7)), lModel.get(lGrid.mCell));
    assertEquals(Arrays.asList("mystery(3)"), lModel.getUnrecognized());
  }
}

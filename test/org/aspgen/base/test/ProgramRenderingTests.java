package org.aspgen.base.test;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.aspgen.base.util.asp.grammar.ConditionalLiteral;
import org.aspgen.base.util.asp.grammar.Count;
import org.aspgen.base.util.asp.grammar.Field;
import org.aspgen.base.util.asp.grammar.PredicateDefinition;
import org.aspgen.base.util.asp.grammar.RangePool;
import org.aspgen.base.util.asp.grammar.SymbolicConstant;
import org.aspgen.base.util.asp.grammar.Variable;
import org.aspgen.base.util.asp.program.Program;
import org.aspgen.base.util.asp.program.Rule;
import org.junit.Test;

public class ProgramRenderingTests
{
  private static final PredicateDefinition LIMIT = PredicateDefinition.define("limit", "value");
  private static final PredicateDefinition NUM   = PredicateDefinition.define("num", "n");
  private static final PredicateDefinition FLAG  = PredicateDefinition.define("flag");

  private static final Variable X = Variable.of("X");

  @Test
  public void testConstantAndShowBlocks()
  {
    Program lProgram = new Program();
    SymbolicConstant lMax = lProgram.registerConstant("max", 5);
    lProgram.fact(LIMIT.of(lMax));

    assertEquals("#const max = 5.\n" +
                 "\n" +
                 "limit(max).\n" +
                 "\n" +
                 "#show.\n" +
                 "#show limit/1.\n",
                 lProgram.render());
  }

  @Test
  public void testHeaderAndRuleOrder()
  {
    Program lProgram = new Program("Numbers");
    lProgram.fact(NUM.of(RangePool.of(1, 3)));
    lProgram.when(NUM.of(X), LIMIT.of(X));
    lProgram.forbid(LIMIT.of(2));

    assertEquals("% Numbers\n" +
                 "\n" +
                 "num(1..3).\n" +
                 "limit(X) :- num(X).\n" +
                 ":- limit(2).\n" +
                 "\n" +
                 "#show.\n" +
                 "#show num/1.\n" +
                 "#show limit/1.\n",
                 lProgram.render());
  }

  @Test
  public void testEmptyProgram()
  {
    assertEquals("", new Program().render());
  }

  @Test
  public void testCommentsOnly()
  {
    Program lProgram = new Program();
    lProgram.comment("nothing here");
    assertEquals("% nothing here\n", lProgram.render());
  }

  @Test
  public void testConstantValues()
  {
    Program lProgram = new Program();
    lProgram.registerConstant("size", 3);
    lProgram.registerConstant("name", "grid");
    lProgram.overrideConstant("size", 9);

    SymbolicConstant lAgain = lProgram.registerConstant("size", 3);
    lProgram.fact(NUM.of(lAgain));

    assertEquals("#const size = 9.\n" +
                 "#const name = \"grid\".\n" +
                 "\n" +
                 "num(size).\n" +
                 "\n" +
                 "#show.\n" +
                 "#show num/1.\n",
                 lProgram.render());
  }

  @Test
  public void testSegments()
  {
    Program lProgram = new Program();
    lProgram.addSegment("cell_values");
    lProgram.addSegment("unused");
    lProgram.fact("cell_values", NUM.of(1));
    lProgram.fact(FLAG.of());

    assertEquals(Arrays.asList("Rules", "cell_values", "unused"), lProgram.getSegmentNames());
    assertEquals("% ===== Rules =====\n" +
                 "flag.\n" +
                 "\n" +
                 "% ===== Cell Values =====\n" +
                 "num(1).\n" +
                 "\n" +
                 "#show.\n" +
                 "#show flag/0.\n" +
                 "#show num/1.\n",
                 lProgram.render());
  }

  @Test
  public void testSingleSegmentHasNoBanner()
  {
    Program lProgram = new Program();
    lProgram.addSegment("grid");
    lProgram.fact("grid", NUM.of(1));

    assertEquals("num(1).\n\n#show.\n#show num/1.\n", lProgram.render());
  }

  @Test
  public void testSections()
  {
    Program lProgram = new Program();
    lProgram.section("Domain");
    lProgram.fact(NUM.of(1));
    lProgram.section("Limits");
    lProgram.fact(LIMIT.of(1));
    lProgram.blankLine();
    lProgram.comment("line one\nline two");

    assertEquals("% Domain\n" +
                 "num(1).\n" +
                 "\n" +
                 "% Limits\n" +
                 "limit(1).\n" +
                 "\n" +
                 "%*\nline one\nline two\n*%\n" +
                 "\n" +
                 "#show.\n" +
                 "#show num/1.\n" +
                 "#show limit/1.\n",
                 lProgram.render());
  }

  @Test
  public void testHiddenPredicates()
  {
    Program lProgram = new Program();
    lProgram.fact(NUM.hidden().of(1));

    assertEquals("num(1).\n\n#show.\n", lProgram.render());
  }

  @Test
  public void testShownPredicates()
  {
    PredicateDefinition lCell = PredicateDefinition.define("cell", "n").inNamespace("grid").hidden();
    Program lProgram = new Program();
    lProgram.when(lCell.of(X), LIMIT.of(X));
    lProgram.fact(lCell.of(RangePool.of(1, 2)));

    assertEquals("grid_cell", lCell.getName());
    assertEquals("cell", lCell.getBaseName());
    assertEquals(Arrays.asList(LIMIT), lProgram.getShownPredicates());
    assertEquals(lCell, lCell.shown().hidden());
  }

  @Test
  public void testNestedPredicatesAreShown()
  {
    PredicateDefinition lHolds = PredicateDefinition.define("holds", Field.predicate("fact"));
    Program lProgram = new Program();
    lProgram.fact(lHolds.of(NUM.of(1)));

    assertEquals("holds(num(1)).\n\n#show.\n#show holds/1.\n#show num/1.\n", lProgram.render());
  }

  @Test
  public void testAggregatesDoNotHideTheirPredicates()
  {
    Program lProgram = new Program();
    lProgram.forbid(Count.over(X, NUM.of(X)).gt(3));

    assertEquals(":- #count{X : num(X)} > 3.\n\n#show.\n#show num/1.\n", lProgram.render());
  }

  @Test
  public void testConditionalShow()
  {
    Program lProgram = new Program();
    lProgram.fact(NUM.of(RangePool.of(1, 5)));
    lProgram.fact(FLAG.of());
    lProgram.showWhen(NUM, ConditionalLiteral.of(NUM.of(X), NUM.of(X), X.gt(2)));

    assertEquals("num(1..5).\n" +
                 "flag.\n" +
                 "\n" +
                 "#show.\n" +
                 "#show num(X) : num(X), X > 2.\n" +
                 "#show flag/0.\n",
                 lProgram.render());
  }

  @Test
  public void testRenderingIsIdempotent()
  {
    Program lProgram = new Program("Idempotent");
    lProgram.registerConstant("n", 4);
    lProgram.fact(NUM.of(RangePool.of(1, SymbolicConstant.of("n"))));
    lProgram.addRule(Rule.constraint(NUM.of(X), X.gt(3)));

    String lFirst = lProgram.render();
    assertEquals(lFirst, lProgram.render());
    assertEquals(lFirst, lProgram.toString());
  }
}

package org.aspgen.base.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.aspgen.base.util.asp.grammar.AggregateElement;
import org.aspgen.base.util.asp.grammar.Choice;
import org.aspgen.base.util.asp.grammar.ClassicalNegation;
import org.aspgen.base.util.asp.grammar.Comparison;
import org.aspgen.base.util.asp.grammar.ComparisonOperand;
import org.aspgen.base.util.asp.grammar.ComparisonOperator;
import org.aspgen.base.util.asp.grammar.ConditionalLiteral;
import org.aspgen.base.util.asp.grammar.Constant;
import org.aspgen.base.util.asp.grammar.Count;
import org.aspgen.base.util.asp.grammar.DefaultNegation;
import org.aspgen.base.util.asp.grammar.ExplicitPool;
import org.aspgen.base.util.asp.grammar.Max;
import org.aspgen.base.util.asp.grammar.Min;
import org.aspgen.base.util.asp.grammar.Operand;
import org.aspgen.base.util.asp.grammar.Predicate;
import org.aspgen.base.util.asp.grammar.PredicateDefinition;
import org.aspgen.base.util.asp.grammar.RangePool;
import org.aspgen.base.util.asp.grammar.StringConstant;
import org.aspgen.base.util.asp.grammar.Sum;
import org.aspgen.base.util.asp.grammar.SumPositive;
import org.aspgen.base.util.asp.grammar.SymbolicConstant;
import org.aspgen.base.util.asp.grammar.Term;
import org.aspgen.base.util.asp.grammar.Terms;
import org.aspgen.base.util.asp.grammar.Variable;
import org.aspgen.base.util.asp.program.Comment;
import org.aspgen.base.util.asp.program.Rule;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

public class TermRenderingTests
{
  private static final PredicateDefinition CELL = PredicateDefinition.define("cell", "row", "col");
  private static final PredicateDefinition NUM  = PredicateDefinition.define("num", "n");
  private static final PredicateDefinition FLAG = PredicateDefinition.define("flag");

  private static final Variable X = Variable.of("X");
  private static final Variable Y = Variable.of("Y");
  private static final Variable N = Variable.of("N");

  @Test
  public void testPredicates()
  {
    assertEquals("cell(1, C)", CELL.of(1, Variable.of("C")).render());
    assertEquals("flag", FLAG.of().render());
    assertEquals("grid_cell(1, 2)", CELL.inNamespace("grid").of(1, 2).render());
    assertEquals("num(\"a b\")", NUM.of("a b").render());
    assertEquals("num(max)", NUM.of(SymbolicConstant.of("max")).render());
    assertEquals("num(X + 1)", NUM.of(X.plus(1)).render());

    Predicate lCell = CELL.of(3, 4);
    assertEquals(3, ((Constant)lCell.get("row")).getValue());
    assertEquals(lCell.get(1), lCell.get("col"));
  }

  @Test
  public void testNestedPredicates()
  {
    PredicateDefinition lHas = PredicateDefinition.define("has", "item");
    assertEquals("has(cell(1, 2))", lHas.of(CELL.of(1, 2)).render());
  }

  @Test
  public void testPools()
  {
    assertEquals("num(1..5)", NUM.of(RangePool.of(1, 5)).render());
    assertEquals("num(1;3;2)", NUM.of(ExplicitPool.of(1, 3, 2)).render());
    assertEquals("cell((1;2), 3)", CELL.of(ExplicitPool.of(1, 2), 3).render());
    assertEquals("X = 1..n", X.in(RangePool.of(1, SymbolicConstant.of("n"))).render());
    assertTrue(RangePool.of(1, 5).isGround());
  }

  @Test
  public void testNegation()
  {
    Predicate lCell = CELL.of(1, 2);
    assertEquals("-cell(1, 2)", lCell.negate().render());
    assertSame(lCell, ClassicalNegation.of(lCell.negate()));

    assertEquals("not cell(1, 2)", lCell.not().render());
    assertEquals("not -cell(1, 2)", lCell.negate().not().render());
    assertEquals("not (X < Y)", X.lt(Y).not().render());

    Term lDouble = DefaultNegation.of(DefaultNegation.of(lCell));
    assertEquals("not not cell(1, 2)", lDouble.render());
    assertEquals("not cell(1, 2)", DefaultNegation.of(lDouble).render());
  }

  @Test
  public void testComparisons()
  {
    assertEquals("X != Y", X.ne(Y).render());
    assertEquals("X + 1 >= 2 * Y", X.plus(1).ge(Y.times(2)).render());
    assertEquals("X = \"a\"", X.eq("a").render());
  }

  @Test
  public void testConditionalLiterals()
  {
    assertEquals("cell(X, Y) : num(X), num(Y)",
                 ConditionalLiteral.of(CELL.of(X, Y), NUM.of(X), NUM.of(Y)).render());
    assertEquals("cell(X, Y)", ConditionalLiteral.of(CELL.of(X, Y)).render());
  }

  @Test
  public void testAggregates()
  {
    assertEquals("#count{X : cell(X, Y)}", Count.over(X, CELL.of(X, Y)).render());
    assertEquals("N = #count{X : cell(X, Y)}", Count.over(X, CELL.of(X, Y)).assignTo(N).render());
    assertEquals("#sum{X, Y : cell(X, Y); 1 : flag}",
                 Sum.of(AggregateElement.of(X, Y).when(CELL.of(X, Y)), AggregateElement.of(1).when(FLAG.of()))
                    .render());
    assertEquals("#sum+{X : num(X)}", SumPositive.over(X, NUM.of(X)).render());
    assertEquals("#min{X : num(X)}", Min.over(X, NUM.of(X)).render());
    assertEquals("#max{X : num(X), not flag}", Max.over(X, NUM.of(X), FLAG.of().not()).render());
    assertEquals("#count{cell(X, Y) : num(X)}",
                 Count.of(AggregateElement.of(ConditionalLiteral.of(CELL.of(X, Y), NUM.of(X)))).render());
    assertEquals("#count{}", Count.of().render());
  }

  @Test
  public void testAggregatesAreImmutable()
  {
    Count lEmpty = Count.of();
    Term lOne = lEmpty.add(X, NUM.of(X));
    assertEquals("#count{}", lEmpty.render());
    assertEquals("#count{X : num(X)}", lOne.render());
    assertNotEquals(lEmpty, lOne);
  }

  @Test
  public void testChoices()
  {
    Predicate lA = NUM.of(1);
    Predicate lB = NUM.of(2);

    assertEquals("{ }", Choice.of().render());
    assertEquals("{ num(1); num(2) }", Choice.of(lA, lB).render());
    assertEquals("1 { num(1); num(2) } 2", Choice.of(lA, lB).atLeast(1).atMost(2).render());
    assertEquals("1 { num(1); num(2) }", Choice.of(lA, lB).atLeast(1).render());
    assertEquals("{ num(1); num(2) } 1", Choice.of(lA, lB).atMost(1).render());
    assertEquals("{ num(1); num(2) } = 1", Choice.of(lA, lB).exactly(1).render());
    assertEquals("{ num(1); num(2) } = 2", Choice.of(lA, lB).atLeast(2).atMost(2).render());
    assertEquals("{ cell(X, 1) : num(X) }", Choice.of().add(CELL.of(X, 1), NUM.of(X)).render());
    assertEquals("{ -num(1) }", Choice.of(lA.negate()).render());
  }

  @Test(expected = IllegalStateException.class)
  public void testChoiceBoundCanOnlyBeSetOnce()
  {
    Choice.of(NUM.of(1)).atLeast(1).atLeast(2);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testChoiceBoundMustBeNonNegative()
  {
    Choice.of(NUM.of(1)).atMost(-1);
  }

  @Test
  public void testRules()
  {
    assertEquals("num(1).", Rule.fact(NUM.of(1)).render());
    assertEquals(":- num(X), not cell(X, X).", Rule.constraint(NUM.of(X), CELL.of(X, X).not()).render());
    assertEquals("cell(X, X) :- num(X).", Rule.of(CELL.of(X, X), NUM.of(X)).render());
    assertEquals("{ num(1); num(2) } = 1.", Rule.fact(Choice.of(NUM.of(1), NUM.of(2)).exactly(1)).render());
  }

  @Test
  public void testComments()
  {
    assertEquals("% hello", new Comment("hello").render());
    assertEquals("%*\nline one\nline two\n*%", new Comment("line one\nline two").render());
  }

  @Test
  public void testStructuralEquality()
  {
    assertEquals(CELL.of(1, X), CELL.of(1, Variable.of("X")));
    assertEquals(CELL.of(1, X).hashCode(), CELL.of(1, Variable.of("X")).hashCode());
    assertNotEquals(CELL.of(1, X), CELL.inNamespace("grid").of(1, X));
    assertEquals(Comparison.of(X, ComparisonOperator.EQUAL, 1), X.eq(1));
    assertEquals(StringConstant.of("a"), NUM.of("a").get(0));
  }

  @Test
  public void testGroundness()
  {
    assertTrue(CELL.of(1, 2).isGround());
    assertFalse(CELL.of(1, X).isGround());
    assertTrue(NUM.of(RangePool.of(1, 3)).isGround());
    assertFalse(X.plus(1).isGround());
    assertTrue(Count.over(1, NUM.of(1)).isGround());
  }

  @Test
  public void testBuilderMethodsByTermFamily()
  {
    assertEquals("X + 1 >= 3", X.plus(1).ge(3).render());
    assertEquals("#count{X : num(X)} <= 2", Count.over(X, NUM.of(X)).le(2).render());

    // Aggregates can be compared but not used in arithmetic.
    Term lCount = Count.over(X, NUM.of(X));
    Term lSum = X.plus(1);
    assertTrue(lCount instanceof ComparisonOperand);
    assertFalse(lCount instanceof Operand);
    assertTrue(lSum instanceof Operand);
    assertTrue(NUM.of(1).not() instanceof DefaultNegation);
  }

  @Test
  public void testRenderAll()
  {
    assertEquals("X, 1, \"a\"", Terms.renderAll(Arrays.asList(X, Constant.of(1), StringConstant.of("a")), ", "));
    assertEquals("", Terms.renderAll(ImmutableList.<Term>of(), "; "));
  }
}

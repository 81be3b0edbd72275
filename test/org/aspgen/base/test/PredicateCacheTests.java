package org.aspgen.base.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.aspgen.base.util.asp.compose.Module;
import org.aspgen.base.util.asp.compose.ProgramComposer;
import org.aspgen.base.util.asp.exceptions.CycleException;
import org.aspgen.base.util.asp.grammar.PredicateDefinition;
import org.aspgen.base.util.asp.grammar.RangePool;
import org.aspgen.base.util.asp.grammar.Variable;
import org.junit.Test;

import com.google.common.base.Supplier;

public class PredicateCacheTests
{
  private static final Variable X = Variable.of("X");

  /**
   * Module with a mix of well-behaved, cyclic and failing generators.
   */
  private static class Numbers extends Module
  {
    int mGenerations;

    Numbers(ProgramComposer xiComposer, String xiName)
    {
      super(xiComposer, xiName, false);
    }

    PredicateDefinition number()
    {
      return cached("number", new Supplier<PredicateDefinition>()
      {
        @Override
        public PredicateDefinition get()
        {
          mGenerations++;
          PredicateDefinition lNumber = define("number", "n");
          fact(lNumber.of(RangePool.of(1, 9)));
          return lNumber;
        }
      });
    }

    PredicateDefinition even()
    {
      return cached("even", new Supplier<PredicateDefinition>()
      {
        @Override
        public PredicateDefinition get()
        {
          PredicateDefinition lEven = define("even", "n");
          when(Arrays.asList(number().of(X), X.dividedBy(2).times(2).eq(X)), lEven.of(X));
          return lEven;
        }
      });
    }

    PredicateDefinition loopA()
    {
      return cached("a", new Supplier<PredicateDefinition>()
      {
        @Override
        public PredicateDefinition get()
        {
          number();
          return loopB();
        }
      });
    }

    PredicateDefinition loopB()
    {
      return cached("b", new Supplier<PredicateDefinition>()
      {
        @Override
        public PredicateDefinition get()
        {
          return loopA();
        }
      });
    }

    PredicateDefinition broken()
    {
      return cached("broken", new Supplier<PredicateDefinition>()
      {
        @Override
        public PredicateDefinition get()
        {
          PredicateDefinition lNumber = number();
          fact(lNumber.of(10));
          throw new IllegalStateException("Generator failed");
        }
      });
    }
  }

  @Test
  public void testGeneratesOnce()
  {
    ProgramComposer lComposer = new ProgramComposer("Cache");
    Numbers lNumbers = new Numbers(lComposer, "Numbers");

    PredicateDefinition lFirst = lNumbers.number();
    assertSame(lFirst, lNumbers.number());
    assertSame(lFirst, lNumbers.number());

    assertEquals(1, lNumbers.mGenerations);
    assertEquals(1, lComposer.getProgram().getRules().size());
    assertEquals("numbers_number", lFirst.getName());
    assertTrue(lComposer.getPredicateCache().contains(lNumbers, "number"));
    assertEquals("% Cache\n" +
                 "\n" +
                 "numbers_number(1..9).\n" +
                 "\n" +
                 "#show.\n" +
                 "#show numbers_number/1.\n",
                 lComposer.render());
  }

  @Test
  public void testNestedGeneration()
  {
    ProgramComposer lComposer = new ProgramComposer("Cache");
    Numbers lNumbers = new Numbers(lComposer, "numbers");

    lNumbers.even();
    lNumbers.even();
    lNumbers.number();

    assertEquals(1, lNumbers.mGenerations);
    assertEquals(2, lComposer.getPredicateCache().size());
    assertEquals(Arrays.asList("numbers_number(1..9).", "numbers_even(X) :- numbers_number(X), X / 2 * 2 = X."),
                 Arrays.asList(lComposer.getProgram().getRules().get(0).render(),
                               lComposer.getProgram().getRules().get(1).render()));
  }

  @Test
  public void testModulesAreCachedSeparately()
  {
    ProgramComposer lComposer = new ProgramComposer("Cache");
    Numbers lFirst = new Numbers(lComposer, "first");
    Numbers lSecond = new Numbers(lComposer, "second");

    assertNotSame(lFirst.number(), lSecond.number());
    assertEquals(1, lFirst.mGenerations);
    assertEquals(1, lSecond.mGenerations);
    assertEquals(2, lComposer.getProgram().getRules().size());
  }

  @Test
  public void testCycleIsReported()
  {
    ProgramComposer lComposer = new ProgramComposer("Cache");
    Numbers lNumbers = new Numbers(lComposer, "numbers");

    try
    {
      lNumbers.loopA();
      fail("Expected a cycle to be detected");
    }
    catch (CycleException lEx)
    {
      assertEquals(Arrays.asList("numbers.a", "numbers.b", "numbers.a"), lEx.getPath());
      assertEquals("Cyclic predicate generation: numbers.a -> numbers.b -> numbers.a", lEx.getMessage());
    }

    // Everything the failed generators did is undone.
    assertEquals(0, lComposer.getPredicateCache().size());
    assertTrue(lComposer.getProgram().getRules().isEmpty());
  }

  @Test
  public void testFailedGenerationIsRolledBack()
  {
    ProgramComposer lComposer = new ProgramComposer("Cache");
    Numbers lNumbers = new Numbers(lComposer, "numbers");
    String lEmpty = lComposer.getProgram().render();

    try
    {
      lNumbers.broken();
      fail("Expected the generator to fail");
    }
    catch (IllegalStateException lEx)
    {
      assertEquals("Generator failed", lEx.getMessage());
    }

    assertFalse(lComposer.getPredicateCache().contains(lNumbers, "broken"));
    assertFalse(lComposer.getPredicateCache().contains(lNumbers, "number"));
    assertEquals(lEmpty, lComposer.getProgram().render());

    // A later request runs the generator afresh.
    lNumbers.number();
    assertEquals(2, lNumbers.mGenerations);
    assertEquals(1, lComposer.getProgram().getRules().size());
  }
}

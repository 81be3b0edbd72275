package org.aspgen.base.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;

import org.aspgen.base.util.solver.AtomParser;
import org.aspgen.base.util.solver.Symbol;
import org.junit.Test;

public class AtomParserTests
{
  @Test
  public void testSplitAtoms()
  {
    assertEquals(Arrays.asList("p(1,\"a b\")", "q", "-r(x)"), AtomParser.splitAtoms("p(1,\"a b\") q -r(x)"));
    assertEquals(Arrays.asList("p(f(1, 2))", "s(\"(\")"), AtomParser.splitAtoms("  p(f(1, 2))   s(\"(\")  "));
    assertEquals(Collections.emptyList(), AtomParser.splitAtoms(""));
  }

  @Test
  public void testNumbers()
  {
    Symbol lSymbol = AtomParser.parse("p(-3,42)");
    assertEquals(Symbol.Type.FUNCTION, lSymbol.getType());
    assertEquals("p", lSymbol.getText());
    assertEquals(-3, lSymbol.getArguments().get(0).getNumber());
    assertEquals(42, lSymbol.getArguments().get(1).getNumber());
  }

  @Test
  public void testNestedFunctions()
  {
    Symbol lSymbol = AtomParser.parse("holds(on(a, b), 3)");
    Symbol lOn = lSymbol.getArguments().get(0);

    assertEquals("on", lOn.getText());
    assertEquals(2, lOn.getArguments().size());
    assertEquals(Symbol.Type.FUNCTION, lOn.getArguments().get(0).getType());
    assertTrue(lOn.getArguments().get(0).getArguments().isEmpty());
    assertEquals("holds(on(a,b),3)", lSymbol.toString());
  }

  @Test
  public void testClassicalNegation()
  {
    Symbol lSymbol = AtomParser.parse("-alive(bob)");
    assertTrue(lSymbol.isNegated());
    assertEquals("alive", lSymbol.getText());
    assertEquals("-alive(bob)", lSymbol.toString());
  }

  @Test
  public void testStrings()
  {
    Symbol lSymbol = AtomParser.parse("name(\"say \\\"hi\\\"\")");
    Symbol lName = lSymbol.getArguments().get(0);
    assertEquals(Symbol.Type.STRING, lName.getType());
    assertEquals("say \"hi\"", lName.getText());
  }

  @Test
  public void testPrimedNames()
  {
    assertEquals("x'", AtomParser.parse("x'").getText());
  }

  @Test
  public void testErrors()
  {
    assertRejected("p(1", "Expected ')' at position 3 of atom 'p(1'");
    assertRejected("p(1))", "Unexpected trailing text at position 4 of atom 'p(1))'");
    assertRejected("P(1)", "Unexpected character 'P' at position 0 of atom 'P(1)'");
    assertRejected("p(\"open)", "Unterminated string at position 8 of atom 'p(\"open)'");
  }

  private static void assertRejected(String xiAtom, String xiMessage)
  {
    try
    {
      AtomParser.parse(xiAtom);
      fail("Expected '" + xiAtom + "' to be rejected");
    }
    catch (IllegalArgumentException lEx)
    {
      assertEquals(xiMessage, lEx.getMessage());
    }
  }
}

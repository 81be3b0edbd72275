package org.aspgen.base.util.solver;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for atoms in the solver's output.  Handles functions (nested to any depth), negative numbers, quoted strings
 * and classical negation.  Tuples and the special symbols <tt>#inf</tt> and <tt>#sup</tt> aren't supported.
 */
public final class AtomParser
{
  private final String mText;
  private int mPos;

  private AtomParser(String xiText)
  {
    mText = xiText;
    mPos = 0;
  }

  /**
   * @return the atoms on a line of output.  Atoms are separated by white space outside quotes and brackets.
   *
   * @param xiLine - the line.
   */
  public static List<String> splitAtoms(String xiLine)
  {
    List<String> lAtoms = new ArrayList<>();
    StringBuilder lCurrent = new StringBuilder();
    int lDepth = 0;
    boolean lInString = false;

    for (int ii = 0; ii < xiLine.length(); ii++)
    {
      char c = xiLine.charAt(ii);
      if (lInString)
      {
        lCurrent.append(c);
        if (c == '\\' && ii + 1 < xiLine.length())
        {
          lCurrent.append(xiLine.charAt(++ii));
        }
        else if (c == '"')
        {
          lInString = false;
        }
        continue;
      }

      if (Character.isWhitespace(c) && lDepth == 0)
      {
        if (lCurrent.length() > 0)
        {
          lAtoms.add(lCurrent.toString());
          lCurrent.setLength(0);
        }
        continue;
      }

      if (c == '"')
      {
        lInString = true;
      }
      else if (c == '(')
      {
        lDepth++;
      }
      else if (c == ')')
      {
        lDepth--;
      }
      lCurrent.append(c);
    }

    if (lCurrent.length() > 0)
    {
      lAtoms.add(lCurrent.toString());
    }
    return lAtoms;
  }

  /**
   * @return the parsed atom.
   *
   * @param xiAtom - the text of a single atom.
   *
   * @throws IllegalArgumentException if the text can't be parsed.
   */
  public static Symbol parse(String xiAtom)
  {
    AtomParser lParser = new AtomParser(xiAtom.trim());
    Symbol lSymbol = lParser.parseSymbol();
    if (lParser.mPos != lParser.mText.length())
    {
      throw lParser.error("Unexpected trailing text");
    }
    return lSymbol;
  }

  private Symbol parseSymbol()
  {
    skipWhitespace();
    if (mPos >= mText.length())
    {
      throw error("Unexpected end of atom");
    }

    char c = mText.charAt(mPos);
    if (c == '"')
    {
      return Symbol.string(parseString());
    }

    boolean lNegative = false;
    if (c == '-')
    {
      lNegative = true;
      mPos++;
      if (mPos >= mText.length())
      {
        throw error("Unexpected end of atom");
      }
      c = mText.charAt(mPos);
    }

    if (Character.isDigit(c))
    {
      int lStart = mPos;
      while (mPos < mText.length() && Character.isDigit(mText.charAt(mPos)))
      {
        mPos++;
      }
      int lValue = Integer.parseInt(mText.substring(lStart, mPos));
      return Symbol.number(lNegative ? -lValue : lValue);
    }

    if (Character.isLowerCase(c) || c == '_')
    {
      int lStart = mPos;
      while (mPos < mText.length() &&
             (Character.isLetterOrDigit(mText.charAt(mPos)) || mText.charAt(mPos) == '_' ||
              mText.charAt(mPos) == '\''))
      {
        mPos++;
      }
      String lName = mText.substring(lStart, mPos);

      List<Symbol> lArguments = new ArrayList<>();
      skipWhitespace();
      if (mPos < mText.length() && mText.charAt(mPos) == '(')
      {
        mPos++;
        lArguments.add(parseSymbol());
        skipWhitespace();
        while (mPos < mText.length() && mText.charAt(mPos) == ',')
        {
          mPos++;
          lArguments.add(parseSymbol());
          skipWhitespace();
        }
        expect(')');
      }
      return Symbol.function(lName, lArguments, lNegative);
    }

    throw error("Unexpected character '" + c + "'");
  }

  private String parseString()
  {
    expect('"');
    StringBuilder lValue = new StringBuilder();
    while (mPos < mText.length())
    {
      char c = mText.charAt(mPos++);
      if (c == '"')
      {
        return lValue.toString();
      }
      if (c == '\\' && mPos < mText.length())
      {
        char lEscaped = mText.charAt(mPos++);
        lValue.append(lEscaped == 'n' ? '\n' : lEscaped);
      }
      else
      {
        lValue.append(c);
      }
    }
    throw error("Unterminated string");
  }

  private void expect(char xiExpected)
  {
    skipWhitespace();
    if (mPos >= mText.length() || mText.charAt(mPos) != xiExpected)
    {
      throw error("Expected '" + xiExpected + "'");
    }
    mPos++;
  }

  private void skipWhitespace()
  {
    while (mPos < mText.length() && Character.isWhitespace(mText.charAt(mPos)))
    {
      mPos++;
    }
  }

  private IllegalArgumentException error(String xiProblem)
  {
    return new IllegalArgumentException(xiProblem + " at position " + mPos + " of atom '" + mText + "'");
  }
}

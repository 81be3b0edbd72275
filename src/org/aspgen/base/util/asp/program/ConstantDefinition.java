package org.aspgen.base.util.asp.program;

import org.aspgen.base.util.asp.grammar.StringConstant;
import org.aspgen.base.util.asp.grammar.SymbolicConstant;

import com.google.common.base.Objects;

/**
 * A registered symbolic constant: its name, default value and (optional) override.  Values are integers or strings.
 */
public final class ConstantDefinition
{
  private final String mName;
  private final Object mDefault;
  private final Object mOverride;

  ConstantDefinition(String xiName, Object xiDefault, Object xiOverride)
  {
    mName = xiName;
    mDefault = checkValue(xiDefault);
    mOverride = (xiOverride == null) ? null : checkValue(xiOverride);
  }

  private static Object checkValue(Object xiValue)
  {
    if (xiValue instanceof String)
    {
      // Validates the text.
      new StringConstant((String)xiValue);
    }
    else if (!(xiValue instanceof Integer))
    {
      throw new IllegalArgumentException("Constant values must be integers or strings, not " + xiValue);
    }
    return xiValue;
  }

  public String getName()
  {
    return mName;
  }

  public Object getDefaultValue()
  {
    return mDefault;
  }

  /**
   * @return the override, or null if there isn't one.
   */
  public Object getOverride()
  {
    return mOverride;
  }

  /**
   * @return the value in effect: the override if there is one, otherwise the default.
   */
  public Object getValue()
  {
    return (mOverride == null) ? mDefault : mOverride;
  }

  ConstantDefinition withOverride(Object xiOverride)
  {
    return new ConstantDefinition(mName, mDefault, xiOverride);
  }

  public SymbolicConstant toTerm()
  {
    return new SymbolicConstant(mName);
  }

  /**
   * @return the <tt>#const</tt> directive.
   */
  public String render()
  {
    Object lValue = getValue();
    String lText = (lValue instanceof String) ? "\"" + lValue + "\"" : lValue.toString();
    return "#const " + mName + " = " + lText + ".";
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (!(xiOther instanceof ConstantDefinition))
    {
      return false;
    }
    ConstantDefinition lOther = (ConstantDefinition)xiOther;
    return mName.equals(lOther.mName) &&
           mDefault.equals(lOther.mDefault) &&
           Objects.equal(mOverride, lOther.mOverride);
  }

  @Override
  public int hashCode()
  {
    return Objects.hashCode(mName, mDefault, mOverride);
  }

  @Override
  public String toString()
  {
    return render();
  }
}

package org.aspgen.base.util.asp.grammar;

import java.util.List;

import org.aspgen.base.util.asp.exceptions.ContainmentException;
import org.aspgen.base.validator.ContainmentRules;
import org.aspgen.base.validator.ContainmentSlot;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * An integer range, <tt>lo..hi</tt>.  Both ends must be ground numbers, symbolic constants or ground expressions.
 * Two literal bounds must not describe an empty range.
 */
@SuppressWarnings("serial")
public final class RangePool extends Pool
{
  private final Term start;
  private final Term end;

  public RangePool(Object start, Object end)
  {
    Term lStart = Terms.coerce(start);
    Term lEnd = Terms.coerce(end);
    ContainmentRules.check(ContainmentSlot.RANGE_BOUND, "range", lStart);
    ContainmentRules.check(ContainmentSlot.RANGE_BOUND, "range", lEnd);

    this.start = lStart;
    this.end = lEnd;

    if ((lStart instanceof Constant) && (lEnd instanceof Constant) &&
        (((Constant)lStart).getValue() > ((Constant)lEnd).getValue()))
    {
      throw new ContainmentException("Range " + render() + " is empty: lower bound exceeds upper bound", this);
    }
  }

  public static RangePool of(Object start, Object end)
  {
    return new RangePool(start, end);
  }

  public Term getStart()
  {
    return start;
  }

  public Term getEnd()
  {
    return end;
  }

  @Override
  public TermKind getKind()
  {
    return TermKind.RANGE_POOL;
  }

  @Override
  public List<Term> getChildren()
  {
    return ImmutableList.of(start, end);
  }

  @Override
  public String render()
  {
    return start.render() + ".." + end.render();
  }

  @Override
  public boolean equals(Object o)
  {
    if (!(o instanceof RangePool))
    {
      return false;
    }
    RangePool other = (RangePool)o;
    return start.equals(other.start) && end.equals(other.end);
  }

  @Override
  public int hashCode()
  {
    return Objects.hashCode(start, end);
  }
}

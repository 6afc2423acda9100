package org.zen.logic.value;

public final class NumberValue extends Value
{
  private final double value;

  NumberValue(double value)
  {
    this.value = value;
  }

  @Override
  public ValueType getType()
  {
    return ValueType.NUMBER;
  }

  public double getValue()
  {
    return value;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    return (xiOther instanceof NumberValue) && (Double.compare(value, ((NumberValue)xiOther).value) == 0);
  }

  @Override
  public int hashCode()
  {
    return Double.hashCode(value);
  }

  @Override
  public String toString()
  {
    if ((value == Math.rint(value)) && !Double.isInfinite(value) && (Math.abs(value) < 1e15))
    {
      return Long.toString((long)value);
    }
    return Double.toString(value);
  }
}

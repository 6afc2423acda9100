package org.zen.logic.value;

public final class BooleanValue extends Value
{
  static final BooleanValue TRUE  = new BooleanValue(true);
  static final BooleanValue FALSE = new BooleanValue(false);

  private final boolean value;

  private BooleanValue(boolean value)
  {
    this.value = value;
  }

  @Override
  public ValueType getType()
  {
    return ValueType.BOOLEAN;
  }

  public boolean getValue()
  {
    return value;
  }

  @Override
  public String toString()
  {
    return Boolean.toString(value);
  }
}

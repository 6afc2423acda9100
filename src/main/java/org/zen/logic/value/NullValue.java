package org.zen.logic.value;

public final class NullValue extends Value
{
  static final NullValue INSTANCE = new NullValue();

  private NullValue()
  {
  }

  @Override
  public ValueType getType()
  {
    return ValueType.NULL;
  }

  @Override
  public String toString()
  {
    return "null";
  }
}

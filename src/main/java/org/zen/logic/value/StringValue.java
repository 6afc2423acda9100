package org.zen.logic.value;

public final class StringValue extends Value
{
  private final String value;

  StringValue(String value)
  {
    this.value = value;
  }

  @Override
  public ValueType getType()
  {
    return ValueType.STRING;
  }

  public String getValue()
  {
    return value;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    return (xiOther instanceof StringValue) && value.equals(((StringValue)xiOther).value);
  }

  @Override
  public int hashCode()
  {
    return value.hashCode();
  }

  @Override
  public String toString()
  {
    return "\"" + value + "\"";
  }
}

package org.zen.logic.value;

/**
 * Marks a statement that can be neither proven nor refuted within the system.
 */
public final class UndecidableValue extends Value
{
  static final UndecidableValue INSTANCE = new UndecidableValue();

  private UndecidableValue()
  {
  }

  @Override
  public ValueType getType()
  {
    return ValueType.UNDECIDABLE;
  }

  @Override
  public String toString()
  {
    return "Undecidable";
  }
}

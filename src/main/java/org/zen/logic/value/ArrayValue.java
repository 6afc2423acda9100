package org.zen.logic.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An ordered, growable list of values.
 */
public final class ArrayValue extends Value implements Iterable<Value>
{
  private final List<Value> elements = new ArrayList<>();

  ArrayValue()
  {
  }

  @Override
  public ValueType getType()
  {
    return ValueType.ARRAY;
  }

  /**
   * Append an element.
   *
   * @return this array, for chaining.
   */
  public ArrayValue add(Value xiElement)
  {
    elements.add(xiElement == null ? NullValue.INSTANCE : xiElement);
    return this;
  }

  public Value get(int xiIndex)
  {
    return elements.get(xiIndex);
  }

  public int size()
  {
    return elements.size();
  }

  public boolean isEmpty()
  {
    return elements.isEmpty();
  }

  public List<Value> getElements()
  {
    return Collections.unmodifiableList(elements);
  }

  @Override
  public Iterator<Value> iterator()
  {
    return getElements().iterator();
  }

  @Override
  public boolean equals(Object xiOther)
  {
    return (xiOther instanceof ArrayValue) && elements.equals(((ArrayValue)xiOther).elements);
  }

  @Override
  public int hashCode()
  {
    return elements.hashCode();
  }

  @Override
  public String toString()
  {
    return elements.toString();
  }
}

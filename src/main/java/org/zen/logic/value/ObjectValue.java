package org.zen.logic.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * String-keyed map of values.  Keys iterate in the order they were first set.
 */
public final class ObjectValue extends Value
{
  private final Map<String, Value> fields = new LinkedHashMap<>();

  ObjectValue()
  {
  }

  @Override
  public ValueType getType()
  {
    return ValueType.OBJECT;
  }

  /**
   * Set a field, replacing any previous value.
   *
   * @return this object, for chaining.
   */
  public ObjectValue set(String xiKey, Value xiValue)
  {
    fields.put(xiKey, xiValue == null ? NullValue.INSTANCE : xiValue);
    return this;
  }

  /**
   * @return the value of the field, or null if it isn't set.
   */
  public Value get(String xiKey)
  {
    return fields.get(xiKey);
  }

  public boolean has(String xiKey)
  {
    return fields.containsKey(xiKey);
  }

  public Set<String> keys()
  {
    return Collections.unmodifiableSet(fields.keySet());
  }

  public int size()
  {
    return fields.size();
  }

  @Override
  public boolean equals(Object xiOther)
  {
    return (xiOther instanceof ObjectValue) && fields.equals(((ObjectValue)xiOther).fields);
  }

  @Override
  public int hashCode()
  {
    return fields.hashCode();
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder("{");
    boolean lFirst = true;
    for (Map.Entry<String, Value> lEntry : fields.entrySet())
    {
      if (!lFirst)
      {
        sb.append(", ");
      }
      lFirst = false;
      sb.append(lEntry.getKey()).append(": ").append(lEntry.getValue());
    }
    return sb.append('}').toString();
  }
}

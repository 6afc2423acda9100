package org.zen.logic.value;

/**
 * The <code>Value</code> class is the root of the hierarchy of boxed values that cross between scripts and the
 * logic system.
 *
 * <pre>
 *   Value
 *   |
 *   +-- NullValue
 *   +-- BooleanValue
 *   +-- NumberValue
 *   +-- StringValue
 *   +-- ArrayValue        ordered list of values
 *   +-- ObjectValue       string keys to values, in insertion order
 *   +-- UndecidableValue
 *   +-- ErrorValue        message and numeric error code
 * </pre>
 *
 * Instances are created through {@link Values}.
 */
public abstract class Value
{
  public abstract ValueType getType();

  public boolean is(ValueType xiType)
  {
    return getType() == xiType;
  }

  public boolean isError()
  {
    return getType() == ValueType.ERROR;
  }

  @Override
  public abstract String toString();
}

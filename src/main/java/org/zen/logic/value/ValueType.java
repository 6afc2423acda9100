package org.zen.logic.value;

/**
 * Type tag of a boxed {@link Value}.
 */
public enum ValueType
{
  NULL,
  BOOLEAN,
  NUMBER,
  STRING,
  ARRAY,
  OBJECT,

  /**
   * The result of checking a statement that looks self-referential.
   */
  UNDECIDABLE,

  ERROR;
}

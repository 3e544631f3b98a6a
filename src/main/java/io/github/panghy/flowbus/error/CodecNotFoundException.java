package io.github.panghy.flowbus.error;

import java.lang.reflect.Type;

/**
 * Exception thrown when no codec is registered for a value type that has to cross the bus.
 */
public class CodecNotFoundException extends BusDefinitionException {

  private final Type valueType;

  /**
   * Creates a new codec-not-found exception.
   *
   * @param valueType The type that has no codec
   */
  public CodecNotFoundException(Type valueType) {
    super(null, "No codec registered for type " + valueType.getTypeName());
    this.valueType = valueType;
  }

  /**
   * Gets the type that has no codec.
   *
   * @return The value type
   */
  public Type getValueType() {
    return valueType;
  }
}

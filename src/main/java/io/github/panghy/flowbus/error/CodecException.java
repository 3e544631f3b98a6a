package io.github.panghy.flowbus.error;

/**
 * Exception thrown when a value cannot be converted to or from its string wire form.
 * This happens if the text is malformed for the target type, or if a value that
 * has no wire form (such as {@code null}) is passed to a codec.
 */
public class CodecException extends BusException {

  private final Class<?> type;

  /**
   * Creates a new codec exception with a custom message.
   *
   * @param type    The type that couldn't be encoded or decoded
   * @param message The error message
   */
  public CodecException(Class<?> type, String message) {
    super(ErrorCode.CONVERSION_ERROR, message);
    this.type = type;
  }

  /**
   * Creates a new codec exception with a custom message and cause.
   *
   * @param type    The type that couldn't be encoded or decoded
   * @param message The error message
   * @param cause   The underlying cause
   */
  public CodecException(Class<?> type, String message, Throwable cause) {
    super(ErrorCode.CONVERSION_ERROR, message, cause);
    this.type = type;
  }

  /**
   * Gets the type that couldn't be encoded or decoded.
   *
   * @return The type
   */
  public Class<?> getType() {
    return type;
  }
}

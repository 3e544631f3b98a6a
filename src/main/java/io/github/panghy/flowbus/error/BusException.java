package io.github.panghy.flowbus.error;

/**
 * Base exception class for errors raised by the FlowBus service machinery.
 *
 * <p>BusException is the root of a small hierarchy that separates the different
 * ways a service interaction can fail: a service definition that cannot be
 * marshaled, a registration that collides with an existing one, a bus-level call
 * failure, a value that cannot be converted from its wire form, and a call on an
 * access facade that was never connected. Each subclass carries a fixed
 * {@link ErrorCode} so that callers can branch on the failure class without
 * inspecting messages.</p>
 */
public class BusException extends RuntimeException {

  /**
   * Enumeration of error codes for bus exceptions.
   */
  public enum ErrorCode {
    /**
     * Unknown or unspecified error.
     */
    UNKNOWN(2000),

    /**
     * The service definition is invalid (missing codec, overloaded method, bad interface).
     */
    DEFINITION_ERROR(2001),

    /**
     * An object path or service name could not be registered on the bus.
     */
    REGISTRATION_ERROR(2002),

    /**
     * The remote service name is not known to the bus.
     */
    SERVICE_UNAVAILABLE(2003),

    /**
     * The remote object, interface or method does not exist.
     */
    METHOD_NOT_FOUND(2004),

    /**
     * The remote implementation failed while handling the call.
     */
    INVOCATION_ERROR(2005),

    /**
     * The call did not have the shape the receiver expected (e.g. wrong argument count).
     */
    INVALID_ARGUMENT(2006),

    /**
     * A value could not be converted to or from its string wire form.
     */
    CONVERSION_ERROR(2007),

    /**
     * The access facade has no attached import stub.
     */
    NOT_ATTACHED(2008);

    private final int code;

    ErrorCode(int code) {
      this.code = code;
    }

    /**
     * Gets the numeric code for this error.
     *
     * @return The error code
     */
    public int getCode() {
      return code;
    }

    /**
     * Gets an ErrorCode from its numeric value.
     *
     * @param code The numeric error code
     * @return The corresponding ErrorCode, or UNKNOWN if not found
     */
    public static ErrorCode fromCode(int code) {
      for (ErrorCode errorCode : values()) {
        if (errorCode.code == code) {
          return errorCode;
        }
      }
      return UNKNOWN;
    }
  }

  private final ErrorCode errorCode;

  /**
   * Creates a new bus exception with the specified error code.
   *
   * @param errorCode The error code
   */
  public BusException(ErrorCode errorCode) {
    super("Bus error: " + errorCode);
    this.errorCode = errorCode;
  }

  /**
   * Creates a new bus exception with the specified error code and message.
   *
   * @param errorCode The error code
   * @param message   The error message
   */
  public BusException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  /**
   * Creates a new bus exception with the specified error code, message, and cause.
   *
   * @param errorCode The error code
   * @param message   The error message
   * @param cause     The underlying cause
   */
  public BusException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  /**
   * Gets the error code for this exception.
   *
   * @return The error code
   */
  public ErrorCode getErrorCode() {
    return errorCode;
  }

  /**
   * Gets the numeric value of the error code.
   *
   * @return The numeric error code
   */
  public int getErrorCodeValue() {
    return errorCode.getCode();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" +
        "errorCode=" + errorCode +
        ", message='" + getMessage() + '\'' +
        '}';
  }
}

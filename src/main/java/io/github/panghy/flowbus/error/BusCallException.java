package io.github.panghy.flowbus.error;

/**
 * Exception thrown when a call could not be completed by the bus.
 * This covers unknown service names, missing objects or methods, a badly shaped
 * call and a failure inside the remote implementation. It is never used for a
 * reply that arrived but could not be decoded; that is a {@link CodecException}.
 */
public class BusCallException extends BusException {

  private final String serviceName;
  private final String methodName;

  /**
   * Creates a new call exception.
   *
   * @param errorCode   The error code describing the failure
   * @param serviceName The called service name
   * @param methodName  The called method name
   * @param message     The error message
   */
  public BusCallException(ErrorCode errorCode, String serviceName, String methodName, String message) {
    super(errorCode, message);
    this.serviceName = serviceName;
    this.methodName = methodName;
  }

  /**
   * Creates a new call exception with a cause.
   *
   * @param errorCode   The error code describing the failure
   * @param serviceName The called service name
   * @param methodName  The called method name
   * @param message     The error message
   * @param cause       The underlying cause
   */
  public BusCallException(ErrorCode errorCode, String serviceName, String methodName, String message,
                          Throwable cause) {
    super(errorCode, message, cause);
    this.serviceName = serviceName;
    this.methodName = methodName;
  }

  /**
   * Gets the called service name.
   *
   * @return The service name
   */
  public String getServiceName() {
    return serviceName;
  }

  /**
   * Gets the called method name.
   *
   * @return The method name
   */
  public String getMethodName() {
    return methodName;
  }
}

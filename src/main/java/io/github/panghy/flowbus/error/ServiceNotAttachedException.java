package io.github.panghy.flowbus.error;

/**
 * Exception thrown when a method is called on an access facade that has not been
 * connected to its remote service. This is a lifecycle error of the caller, not a
 * transient failure of the remote peer.
 */
public class ServiceNotAttachedException extends BusException {

  private final String serviceName;

  /**
   * Creates a new not-attached exception.
   *
   * @param serviceName The service the facade stands for
   * @param methodName  The method that was called
   */
  public ServiceNotAttachedException(String serviceName, String methodName) {
    super(ErrorCode.NOT_ATTACHED,
        "Service " + serviceName + " is not connected; cannot call " + methodName);
    this.serviceName = serviceName;
  }

  /**
   * Gets the service the facade stands for.
   *
   * @return The service name
   */
  public String getServiceName() {
    return serviceName;
  }
}

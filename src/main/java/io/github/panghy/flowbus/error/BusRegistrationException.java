package io.github.panghy.flowbus.error;

/**
 * Exception thrown when an object path or a service name cannot be claimed on the bus.
 */
public class BusRegistrationException extends BusException {

  private final String target;

  /**
   * Creates a new registration exception.
   *
   * @param target  The object path or service name that could not be registered
   * @param message The error message
   */
  public BusRegistrationException(String target, String message) {
    super(ErrorCode.REGISTRATION_ERROR, message);
    this.target = target;
  }

  /**
   * Gets the object path or service name that could not be registered.
   *
   * @return The registration target
   */
  public String getTarget() {
    return target;
  }
}

package io.github.panghy.flowbus.error;

/**
 * Exception thrown when a service definition cannot be turned into bus roles.
 * This is raised while a {@link io.github.panghy.flowbus.service.ServiceDescriptor}
 * or {@link io.github.panghy.flowbus.ServiceDefinition} is built, e.g. when the
 * service interface overloads a method name or a notification returns a value.
 */
public class BusDefinitionException extends BusException {

  private final Class<?> serviceInterface;

  /**
   * Creates a new definition exception.
   *
   * @param serviceInterface The interface being defined (may be null if unknown)
   * @param message          The error message
   */
  public BusDefinitionException(Class<?> serviceInterface, String message) {
    super(ErrorCode.DEFINITION_ERROR, message);
    this.serviceInterface = serviceInterface;
  }

  /**
   * Gets the interface whose definition failed.
   *
   * @return The service interface, or null
   */
  public Class<?> getServiceInterface() {
    return serviceInterface;
  }
}

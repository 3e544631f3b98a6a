package io.github.panghy.flowbus;

/**
 * Configuration for service definitions.
 *
 * <p>The configuration covers:</p>
 * <ul>
 *   <li>Registration wait - how long {@link ServiceDefinition#waitForServiceRegistration()}
 *       blocks before giving up (default: forever)</li>
 *   <li>Registration rollback - whether a claimed object path is released when the
 *       service name cannot be claimed (default: true)</li>
 *   <li>Codec validation - whether every wire type must have a codec when the
 *       definition is built (default: true)</li>
 * </ul>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * FlowBusConfiguration config = FlowBusConfiguration.builder()
 *     .registrationWaitTimeoutMs(5_000)   // give up waiting after 5s
 *     .rollbackOnRegistrationFailure(true)
 *     .build();
 * }</pre>
 */
public class FlowBusConfiguration {

  /**
   * Default registration wait timeout (0, wait forever).
   */
  public static final long DEFAULT_REGISTRATION_WAIT_TIMEOUT_MS = 0;

  /**
   * Default for releasing the object path after a failed name registration.
   */
  public static final boolean DEFAULT_ROLLBACK_ON_REGISTRATION_FAILURE = true;

  /**
   * Default for checking codecs when a definition is built.
   */
  public static final boolean DEFAULT_VALIDATE_CODECS_AT_DEFINITION = true;

  private final long registrationWaitTimeoutMs;
  private final boolean rollbackOnRegistrationFailure;
  private final boolean validateCodecsAtDefinition;

  private FlowBusConfiguration(Builder builder) {
    this.registrationWaitTimeoutMs = builder.registrationWaitTimeoutMs;
    this.rollbackOnRegistrationFailure = builder.rollbackOnRegistrationFailure;
    this.validateCodecsAtDefinition = builder.validateCodecsAtDefinition;
  }

  /**
   * Gets how long to wait for a service name to appear, in milliseconds.
   * 0 means wait forever.
   *
   * @return The registration wait timeout in milliseconds
   */
  public long getRegistrationWaitTimeoutMs() {
    return registrationWaitTimeoutMs;
  }

  public boolean isRollbackOnRegistrationFailure() {
    return rollbackOnRegistrationFailure;
  }

  public boolean isValidateCodecsAtDefinition() {
    return validateCodecsAtDefinition;
  }

  /**
   * Creates a new builder for FlowBusConfiguration.
   *
   * @return A new builder instance
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a default configuration with standard settings.
   *
   * @return A default configuration
   */
  public static FlowBusConfiguration defaultConfig() {
    return builder().build();
  }

  @Override
  public String toString() {
    return "FlowBusConfiguration{" +
        "registrationWaitTimeoutMs=" + registrationWaitTimeoutMs +
        ", rollbackOnRegistrationFailure=" + rollbackOnRegistrationFailure +
        ", validateCodecsAtDefinition=" + validateCodecsAtDefinition +
        '}';
  }

  /**
   * Builder for FlowBusConfiguration.
   */
  public static class Builder {
    private long registrationWaitTimeoutMs = DEFAULT_REGISTRATION_WAIT_TIMEOUT_MS;
    private boolean rollbackOnRegistrationFailure = DEFAULT_ROLLBACK_ON_REGISTRATION_FAILURE;
    private boolean validateCodecsAtDefinition = DEFAULT_VALIDATE_CODECS_AT_DEFINITION;

    private Builder() {
    }

    /**
     * Sets how long to wait for a service name to be registered.
     * A value of 0 waits forever.
     *
     * @param timeoutMs The timeout in milliseconds (must be non-negative, 0 to wait forever)
     * @return This builder for chaining
     * @throws IllegalArgumentException if timeoutMs is negative
     */
    public Builder registrationWaitTimeoutMs(long timeoutMs) {
      if (timeoutMs < 0) {
        throw new IllegalArgumentException("Registration wait timeout must be non-negative, got: " + timeoutMs);
      }
      this.registrationWaitTimeoutMs = timeoutMs;
      return this;
    }

    /**
     * Sets whether the object path is unregistered again when the service name is taken.
     *
     * @param rollback true to release the path
     * @return This builder for chaining
     */
    public Builder rollbackOnRegistrationFailure(boolean rollback) {
      this.rollbackOnRegistrationFailure = rollback;
      return this;
    }

    /**
     * Sets whether building a definition fails when a wire type has no codec.
     * When disabled a missing codec is only reported on first use.
     *
     * @param validate true to validate at definition time
     * @return This builder for chaining
     */
    public Builder validateCodecsAtDefinition(boolean validate) {
      this.validateCodecsAtDefinition = validate;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return A new FlowBusConfiguration instance
     */
    public FlowBusConfiguration build() {
      return new FlowBusConfiguration(this);
    }
  }
}

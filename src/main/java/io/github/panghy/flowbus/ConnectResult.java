package io.github.panghy.flowbus;

/**
 * Outcome of connecting an access facade to its remote service.
 */
public enum ConnectResult {
  /**
   * A stub was created and attached.
   */
  CONNECTED,
  /**
   * The service name is not registered on the bus.
   */
  NOT_REGISTERED,
  /**
   * The object given is not an access facade of the definition's service.
   */
  WRONG_FACADE,
  /**
   * The facade already has a stub attached; the existing binding was kept.
   */
  ALREADY_ATTACHED;

  /**
   * Checks for success.
   *
   * @return true if this is {@link #CONNECTED}
   */
  public boolean isConnected() {
    return this == CONNECTED;
  }
}

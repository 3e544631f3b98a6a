package io.github.panghy.flowbus.service;

/**
 * Capability of a service that fires one-way notifications.
 *
 * <p>A service interface declares notifications by extending this interface with a
 * notification interface {@code N}, whose abstract methods all return
 * {@code void}; each of them is one notification. The two listener methods are a
 * local capability of every role (implementation, import stub, access facade) and
 * are never exported as bus methods.</p>
 *
 * <pre>{@code
 * public interface ThermostatEvents {
 *   void temperatureChanged(double celsius, String sensor);
 * }
 *
 * public interface Thermostat extends NotificationSource<ThermostatEvents> {
 *   double target();
 *   void setTarget(double celsius);
 * }
 * }</pre>
 *
 * @param <N> The notification interface
 */
public interface NotificationSource<N> {

  /**
   * Registers a listener that receives every notification, in emission order.
   *
   * @param listener The listener
   */
  void addListener(N listener);

  /**
   * Removes a previously registered listener.
   *
   * @param listener The listener
   * @return true if the listener was registered
   */
  boolean removeListener(N listener);
}

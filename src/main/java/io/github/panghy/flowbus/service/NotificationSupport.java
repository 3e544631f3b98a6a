package io.github.panghy.flowbus.service;

/**
 * Base class for service implementations that fire notifications.
 *
 * <pre>{@code
 * public class ThermostatImpl extends NotificationSupport<ThermostatEvents> implements Thermostat {
 *   public ThermostatImpl() {
 *     super(ThermostatEvents.class);
 *   }
 *
 *   public void setTarget(double celsius) {
 *     this.target = celsius;
 *     emit().temperatureChanged(celsius, "target");
 *   }
 * }
 * }</pre>
 *
 * @param <N> The notification interface
 */
public abstract class NotificationSupport<N> implements NotificationSource<N> {

  private final NotificationHub<N> hub;

  protected NotificationSupport(Class<N> notificationInterface) {
    this.hub = new NotificationHub<>(notificationInterface);
  }

  /**
   * Gets the emitter through which this service fires its notifications.
   *
   * @return The emitter
   */
  protected N emit() {
    return hub.emitter();
  }

  @Override
  public void addListener(N listener) {
    hub.addListener(listener);
  }

  @Override
  public boolean removeListener(N listener) {
    return hub.removeListener(listener);
  }
}

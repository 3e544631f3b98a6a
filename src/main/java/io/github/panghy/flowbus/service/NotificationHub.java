package io.github.panghy.flowbus.service;

import io.github.panghy.flowbus.error.BusException;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Proxy;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans notifications out to a list of listeners.
 *
 * <p>The hub owns an emitter, a proxy implementing the notification interface;
 * calling a notification method on the emitter calls the same method, with the
 * same arguments, on every registered listener in registration order. An
 * exception from a listener stops the fan-out and reaches the emitting caller.</p>
 *
 * @param <N> The notification interface
 */
public final class NotificationHub<N> implements NotificationSource<N> {

  private final Class<N> notificationInterface;
  private final List<N> listeners = new CopyOnWriteArrayList<>();
  private final N emitter;

  /**
   * Creates a hub for a notification interface.
   *
   * @param notificationInterface The notification interface
   */
  public NotificationHub(Class<N> notificationInterface) {
    if (notificationInterface == null || !notificationInterface.isInterface()) {
      throw new IllegalArgumentException("Notifications must be declared by an interface");
    }
    this.notificationInterface = notificationInterface;
    this.emitter = notificationInterface.cast(Proxy.newProxyInstance(
        notificationInterface.getClassLoader(),
        new Class<?>[]{notificationInterface},
        new FanOutHandler()));
  }

  /**
   * Gets the notification interface this hub relays.
   *
   * @return The notification interface
   */
  public Class<N> getNotificationInterface() {
    return notificationInterface;
  }

  /**
   * Gets the emitter; notifications called on it reach every listener.
   *
   * @return The emitter
   */
  public N emitter() {
    return emitter;
  }

  @Override
  public void addListener(N listener) {
    if (listener == null) {
      throw new IllegalArgumentException("Listener cannot be null");
    }
    listeners.add(listener);
  }

  @Override
  public boolean removeListener(N listener) {
    return listeners.remove(listener);
  }

  /**
   * Gets the number of registered listeners.
   *
   * @return The listener count
   */
  public int listenerCount() {
    return listeners.size();
  }

  private final class FanOutHandler implements InvocationHandler {

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
      if (method.getDeclaringClass() == Object.class) {
        return switch (method.getName()) {
          case "equals" -> proxy == args[0];
          case "hashCode" -> System.identityHashCode(proxy);
          case "toString" -> "NotificationEmitter[" + notificationInterface.getSimpleName() + "]";
          default -> throw new UnsupportedOperationException("Unsupported Object method: " + method.getName());
        };
      }
      if (method.isDefault()) {
        return InvocationHandler.invokeDefault(proxy, method, args);
      }
      if (Modifier.isStatic(method.getModifiers())) {
        throw new UnsupportedOperationException("Static method: " + method.getName());
      }
      for (N listener : listeners) {
        try {
          method.invoke(listener, args);
        } catch (InvocationTargetException e) {
          throw e.getCause();
        } catch (IllegalAccessException e) {
          throw new BusException(BusException.ErrorCode.INVOCATION_ERROR,
              "Cannot deliver notification " + method.getName(), e);
        }
      }
      return null;
    }
  }
}

package io.github.panghy.flowbus.bus.local;

import io.github.panghy.flowbus.bus.BusObject;
import io.github.panghy.flowbus.bus.MessageBus;
import io.github.panghy.flowbus.bus.Registration;
import io.github.panghy.flowbus.error.BusCallException;
import io.github.panghy.flowbus.error.BusException;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Logger;

import static io.github.panghy.flowbus.util.LoggingUtil.debug;
import static io.github.panghy.flowbus.util.LoggingUtil.warn;

/**
 * In-process implementation of {@link MessageBus}.
 *
 * <p>Everything is dispatched synchronously on the calling thread: a call runs
 * the target object's handler before returning, an emitted notification reaches
 * every subscriber before {@link #emit} returns, and a watch callback runs inside
 * the {@link #registerName} that triggered it. Exporter and importer can live in
 * the same JVM, which makes this bus the default for tests and single-process
 * deployments.</p>
 *
 * <p>Key features:</p>
 * <ul>
 *   <li>Thread-safe storage of exported objects, claimed names, watches and subscriptions</li>
 *   <li>Error replies mapped to {@link BusCallException} with a descriptive error code</li>
 *   <li>Failures in watch callbacks and subscribers are logged and do not stop delivery to the others</li>
 * </ul>
 *
 * <p>Notifications are matched on object path, interface and name. The service
 * name given to {@link #subscribe} is kept for logging only, since a single
 * in-process bus has no separate connections to tell senders apart.</p>
 */
public class LocalMessageBus implements MessageBus {

  private static final Logger LOGGER = Logger.getLogger(LocalMessageBus.class.getName());

  // Maps object paths to the exported objects
  private final Map<String, BusObject> objects = new ConcurrentHashMap<>();

  // Claimed service names
  private final Set<String> names = ConcurrentHashMap.newKeySet();

  // Maps service names to the callbacks waiting for them
  private final Map<String, List<Runnable>> watches = new ConcurrentHashMap<>();

  private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

  @Override
  public boolean registerObject(String objectPath, BusObject object) {
    if (objectPath == null || object == null) {
      throw new IllegalArgumentException("Object path and object cannot be null");
    }
    boolean registered = objects.putIfAbsent(objectPath, object) == null;
    debug(LOGGER, () -> "registerObject " + objectPath + " -> " + registered);
    return registered;
  }

  @Override
  public boolean unregisterObject(String objectPath) {
    return objectPath != null && objects.remove(objectPath) != null;
  }

  @Override
  public boolean registerName(String serviceName) {
    if (serviceName == null || serviceName.isEmpty()) {
      throw new IllegalArgumentException("Service name cannot be empty");
    }
    if (!names.add(serviceName)) {
      debug(LOGGER, () -> "registerName " + serviceName + " already owned");
      return false;
    }
    debug(LOGGER, () -> "registerName " + serviceName);
    List<Runnable> callbacks = watches.get(serviceName);
    if (callbacks != null) {
      for (Runnable callback : callbacks) {
        try {
          callback.run();
        } catch (RuntimeException e) {
          warn(LOGGER, "Registration watch for " + serviceName + " failed", e);
        }
      }
    }
    return true;
  }

  @Override
  public boolean unregisterName(String serviceName) {
    return serviceName != null && names.remove(serviceName);
  }

  @Override
  public boolean isNameRegistered(String serviceName) {
    return serviceName != null && names.contains(serviceName);
  }

  @Override
  public Registration watchRegistration(String serviceName, Runnable onRegistered) {
    if (serviceName == null || onRegistered == null) {
      throw new IllegalArgumentException("Service name and callback cannot be null");
    }
    // Each watch gets its own wrapper so the same callback can be watched twice
    Runnable watch = onRegistered::run;
    watches.computeIfAbsent(serviceName, k -> new CopyOnWriteArrayList<>()).add(watch);
    return () -> watches.computeIfPresent(serviceName, (name, callbacks) -> {
      callbacks.remove(watch);
      return callbacks.isEmpty() ? null : callbacks;
    });
  }

  @Override
  public String call(String serviceName, String objectPath, String interfaceName, String method,
                     List<String> args) {
    if (!isNameRegistered(serviceName)) {
      throw new BusCallException(BusException.ErrorCode.SERVICE_UNAVAILABLE, serviceName, method,
          "The name " + serviceName + " is not owned by anyone on this bus");
    }
    BusObject target = objects.get(objectPath);
    if (target == null) {
      throw new BusCallException(BusException.ErrorCode.METHOD_NOT_FOUND, serviceName, method,
          "No object at path " + objectPath);
    }
    if (!target.interfaceName().equals(interfaceName)) {
      throw new BusCallException(BusException.ErrorCode.METHOD_NOT_FOUND, serviceName, method,
          "Object " + objectPath + " does not implement " + interfaceName);
    }
    debug(LOGGER, () -> "call " + serviceName + " " + objectPath + " " + interfaceName + "." + method + args);
    try {
      return target.invoke(method, args == null ? List.of() : List.copyOf(args));
    } catch (BusCallException e) {
      throw e;
    } catch (BusException e) {
      throw new BusCallException(e.getErrorCode(), serviceName, method, e.getMessage(), e);
    } catch (RuntimeException e) {
      throw new BusCallException(BusException.ErrorCode.INVOCATION_ERROR, serviceName, method,
          "Call to " + interfaceName + "." + method + " failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void emit(String objectPath, String interfaceName, String name, List<String> args) {
    List<String> payload = args == null ? List.of() : List.copyOf(args);
    debug(LOGGER, () -> "emit " + objectPath + " " + interfaceName + "." + name + payload);
    for (Subscription subscription : subscriptions) {
      if (subscription.matches(objectPath, interfaceName, name)) {
        try {
          subscription.listener().accept(payload);
        } catch (RuntimeException e) {
          warn(LOGGER, "Subscriber of " + interfaceName + "." + name + " on "
              + subscription.serviceName() + " failed", e);
        }
      }
    }
  }

  @Override
  public Registration subscribe(String serviceName, String objectPath, String interfaceName, String name,
                                Consumer<List<String>> listener) {
    if (objectPath == null || interfaceName == null || name == null || listener == null) {
      throw new IllegalArgumentException("Object path, interface, name and listener cannot be null");
    }
    Subscription subscription = new Subscription(serviceName, objectPath, interfaceName, name, listener);
    subscriptions.add(subscription);
    return () -> subscriptions.remove(subscription);
  }

  /**
   * Gets the number of live subscriptions, for diagnostics.
   *
   * @return The subscription count
   */
  public int subscriptionCount() {
    return subscriptions.size();
  }

  /**
   * @return The number of service names with at least one open watch
   */
  public int watchedNameCount() {
    return watches.size();
  }

  private record Subscription(String serviceName, String objectPath, String interfaceName, String name,
                              Consumer<List<String>> listener) {

    boolean matches(String path, String iface, String member) {
      return objectPath.equals(path) && interfaceName.equals(iface) && name.equals(member);
    }

    // Identity semantics so two identical subscriptions can be closed independently
    @Override
    public boolean equals(Object o) {
      return this == o;
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(this);
    }
  }
}

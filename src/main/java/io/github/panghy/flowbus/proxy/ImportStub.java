package io.github.panghy.flowbus.proxy;

import io.github.panghy.flowbus.bus.MessageBus;
import io.github.panghy.flowbus.bus.Registration;
import io.github.panghy.flowbus.error.BusException;
import io.github.panghy.flowbus.marshal.CallMarshaler;
import io.github.panghy.flowbus.service.MethodSignature;
import io.github.panghy.flowbus.service.NotificationHub;
import io.github.panghy.flowbus.service.NotificationSignature;
import io.github.panghy.flowbus.service.NotificationSource;
import io.github.panghy.flowbus.service.ServiceDescriptor;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static io.github.panghy.flowbus.util.LoggingUtil.debug;

/**
 * Client-side representation of a remote service.
 *
 * <p>The stub's {@link #getService() service} is a dynamic proxy implementing the
 * service interface. Every call on it is marshaled, sent as a blocking
 * {@link MessageBus#call} to the remote object, and the reply is decoded into
 * the declared return type. Creating a stub does not contact the remote side.</p>
 *
 * <p>For every notification the stub holds a bus subscription; events are
 * decoded and re-emitted as typed notifications to the listeners registered
 * through the proxy's {@code addListener}.</p>
 *
 * @param <S> The service interface
 */
public final class ImportStub<S> implements AutoCloseable {

  private static final Logger LOGGER = Logger.getLogger(ImportStub.class.getName());

  private final ServiceDescriptor<S> descriptor;
  private final MessageBus bus;
  private final CallMarshaler marshaler;
  private final NotificationHub<Object> hub;
  private final List<Registration> subscriptions = new ArrayList<>();
  private final S service;

  @SuppressWarnings("unchecked")
  private ImportStub(ServiceDescriptor<S> descriptor, MessageBus bus, CallMarshaler marshaler) {
    this.descriptor = descriptor;
    this.bus = bus;
    this.marshaler = marshaler;
    this.hub = descriptor.getNotificationInterface()
        .map(n -> new NotificationHub<>((Class<Object>) n))
        .orElse(null);
    Class<S> serviceInterface = descriptor.getServiceInterface();
    this.service = serviceInterface.cast(Proxy.newProxyInstance(
        serviceInterface.getClassLoader(),
        new Class<?>[]{serviceInterface},
        new RemoteInvocationHandler()));
  }

  /**
   * Creates a stub for a remote service and subscribes to its notifications.
   *
   * @param descriptor The service descriptor
   * @param bus        The bus the service lives on
   * @param marshaler  The marshaler for arguments and results
   * @param <S>        The service type
   * @return A new stub
   */
  public static <S> ImportStub<S> create(ServiceDescriptor<S> descriptor, MessageBus bus, CallMarshaler marshaler) {
    if (descriptor == null || bus == null || marshaler == null) {
      throw new IllegalArgumentException("Descriptor, bus and marshaler cannot be null");
    }
    ImportStub<S> stub = new ImportStub<>(descriptor, bus, marshaler);
    stub.subscribe();
    return stub;
  }

  /**
   * Gets the proxy implementing the service interface.
   *
   * @return The remote service proxy
   */
  public S getService() {
    return service;
  }

  public ServiceDescriptor<S> getDescriptor() {
    return descriptor;
  }

  /**
   * Gets the hub local notification listeners are registered with.
   *
   * @return The hub, or null if the service declares no notifications
   */
  NotificationHub<Object> hub() {
    return hub;
  }

  /**
   * Calls a remote method.
   *
   * @param signature The method signature
   * @param args      The typed arguments
   * @return The decoded reply, or null for void methods
   */
  Object call(MethodSignature signature, Object[] args) {
    List<String> wire = marshaler.marshal(signature.parameterKindArray(), args);
    String reply = bus.call(descriptor.getServiceName(), descriptor.getObjectPath(),
        descriptor.getInterfaceName(), signature.name(), wire);
    return marshaler.unwrapReturn(signature.returnKind(), reply);
  }

  /**
   * Cancels the notification subscriptions.
   */
  @Override
  public void close() {
    synchronized (subscriptions) {
      subscriptions.forEach(Registration::close);
      subscriptions.clear();
    }
  }

  @Override
  public String toString() {
    return "ImportStub[" + descriptor.getServiceName() + " " + descriptor.getObjectPath() + "]";
  }

  private void subscribe() {
    synchronized (subscriptions) {
      for (NotificationSignature notification : descriptor.getNotifications()) {
        subscriptions.add(bus.subscribe(descriptor.getServiceName(), descriptor.getObjectPath(),
            descriptor.getInterfaceName(), notification.name(), wire -> deliver(notification, wire)));
      }
    }
  }

  private void deliver(NotificationSignature notification, List<String> wire) {
    Object[] args = marshaler.unmarshal(notification.parameterKindArray(), wire);
    debug(LOGGER, () -> "Relaying " + descriptor.getServiceName() + "." + notification.name());
    invokeOn(hub.emitter(), notification.method(), args);
  }

  static Object invokeOn(Object target, Method method, Object[] args) {
    try {
      return method.invoke(target, args);
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new BusException(BusException.ErrorCode.INVOCATION_ERROR, cause.getMessage(), cause);
    } catch (IllegalAccessException e) {
      throw new BusException(BusException.ErrorCode.INVOCATION_ERROR, "Cannot access " + method, e);
    }
  }

  private class RemoteInvocationHandler implements InvocationHandler {

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
      // Handle Object methods
      if (method.getDeclaringClass() == Object.class) {
        return switch (method.getName()) {
          case "equals" -> proxy == args[0];
          case "hashCode" -> System.identityHashCode(proxy);
          case "toString" -> ImportStub.this.toString();
          default -> throw new UnsupportedOperationException("Unsupported Object method: " + method.getName());
        };
      }
      if (method.getDeclaringClass() == NotificationSource.class) {
        if (hub == null) {
          throw new UnsupportedOperationException(descriptor.getServiceName() + " has no notifications");
        }
        return invokeOn(hub, method, args);
      }
      if (method.isDefault()) {
        return InvocationHandler.invokeDefault(proxy, method, args);
      }
      MethodSignature signature = descriptor.findMethod(method.getName())
          .orElseThrow(() -> new UnsupportedOperationException("Not a bus method: " + method.getName()));
      return call(signature, args);
    }
  }
}

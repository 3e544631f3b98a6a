package io.github.panghy.flowbus.proxy;

import io.github.panghy.flowbus.bus.BusObject;
import io.github.panghy.flowbus.bus.MessageBus;
import io.github.panghy.flowbus.error.BusException;
import io.github.panghy.flowbus.error.BusRegistrationException;
import io.github.panghy.flowbus.marshal.CallMarshaler;
import io.github.panghy.flowbus.service.MethodSignature;
import io.github.panghy.flowbus.service.NotificationSignature;
import io.github.panghy.flowbus.service.NotificationSource;
import io.github.panghy.flowbus.service.ServiceDescriptor;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import static io.github.panghy.flowbus.util.LoggingUtil.debug;
import static io.github.panghy.flowbus.util.LoggingUtil.info;
import static io.github.panghy.flowbus.util.LoggingUtil.warn;

/**
 * Exposes a local implementation of a service on the bus.
 *
 * <p>An adapter is the server side of a service. It claims the descriptor's
 * object path and service name, answers incoming calls by decoding the string
 * arguments, invoking the implementation and encoding the result, and, when the
 * implementation is a {@link NotificationSource}, forwards every local
 * notification to the bus as an event of the same name.</p>
 *
 * <p>Adapters are created by {@link #export} and stay registered until
 * {@link #close()}.</p>
 *
 * @param <S> The service interface
 */
public final class ExportAdapter<S> implements BusObject, AutoCloseable {

  private static final Logger LOGGER = Logger.getLogger(ExportAdapter.class.getName());

  private final ServiceDescriptor<S> descriptor;
  private final S implementation;
  private final MessageBus bus;
  private final CallMarshaler marshaler;
  private final Object notificationForwarder;
  private final AtomicBoolean closed = new AtomicBoolean();

  private ExportAdapter(ServiceDescriptor<S> descriptor, S implementation, MessageBus bus,
                        CallMarshaler marshaler) {
    this.descriptor = descriptor;
    this.implementation = implementation;
    this.bus = bus;
    this.marshaler = marshaler;
    this.notificationForwarder = descriptor.getNotificationInterface()
        .filter(n -> implementation instanceof NotificationSource<?>)
        .map(this::createForwarder)
        .orElse(null);
  }

  /**
   * Exports an implementation: registers the object path, then the service name,
   * then starts forwarding notifications.
   *
   * @param descriptor     The service descriptor
   * @param implementation The local implementation
   * @param bus            The bus to export on
   * @param marshaler      The marshaler for arguments and results
   * @param rollback       Whether to unregister the object path when the name cannot be claimed
   * @param <S>            The service type
   * @return The registered adapter
   * @throws BusRegistrationException if the path or the name is already taken
   */
  public static <S> ExportAdapter<S> export(ServiceDescriptor<S> descriptor, S implementation, MessageBus bus,
                                            CallMarshaler marshaler, boolean rollback) {
    if (descriptor == null || implementation == null || bus == null || marshaler == null) {
      throw new IllegalArgumentException("Descriptor, implementation, bus and marshaler cannot be null");
    }
    ExportAdapter<S> adapter = new ExportAdapter<>(descriptor, implementation, bus, marshaler);
    String path = descriptor.getObjectPath();
    String name = descriptor.getServiceName();

    if (!bus.registerObject(path, adapter)) {
      warn(LOGGER, "Failed to register object " + path + " for " + name);
      throw new BusRegistrationException(path, "Object path " + path + " is already registered");
    }
    if (!bus.registerName(name)) {
      warn(LOGGER, "Failed to register service name " + name);
      if (rollback) {
        bus.unregisterObject(path);
      }
      throw new BusRegistrationException(name, "Service name " + name + " is already registered");
    }
    adapter.startForwarding();
    info(LOGGER, "Exported " + name + " at " + path);
    return adapter;
  }

  /**
   * Gets the exported implementation.
   *
   * @return The implementation
   */
  public S getImplementation() {
    return implementation;
  }

  public ServiceDescriptor<S> getDescriptor() {
    return descriptor;
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public String interfaceName() {
    return descriptor.getInterfaceName();
  }

  @Override
  public String invoke(String method, List<String> args) {
    MethodSignature signature = descriptor.findMethod(method)
        .orElseThrow(() -> new BusException(BusException.ErrorCode.METHOD_NOT_FOUND,
            "Interface " + descriptor.getInterfaceName() + " has no method " + method));
    Object[] decoded = marshaler.unmarshal(signature.parameterKindArray(), args);
    debug(LOGGER, () -> "Invoking " + descriptor.getServiceName() + "." + method);
    Object result;
    try {
      result = signature.method().invoke(implementation, decoded);
    } catch (InvocationTargetException e) {
      throw rethrow(e.getCause());
    } catch (IllegalAccessException e) {
      throw new BusException(BusException.ErrorCode.INVOCATION_ERROR,
          "Cannot access " + signature.method(), e);
    }
    return marshaler.wrapReturn(signature.returnKind(), result);
  }

  /**
   * Stops forwarding notifications and releases the service name and object path.
   * Calling this more than once has no further effect.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    if (notificationForwarder != null) {
      source().removeListener(notificationForwarder);
    }
    bus.unregisterName(descriptor.getServiceName());
    bus.unregisterObject(descriptor.getObjectPath());
    info(LOGGER, "Closed export of " + descriptor.getServiceName());
  }

  @Override
  public String toString() {
    return "ExportAdapter[" + descriptor.getServiceName() + " -> "
        + implementation.getClass().getSimpleName() + "]";
  }

  private void startForwarding() {
    if (notificationForwarder != null) {
      source().addListener(notificationForwarder);
    }
  }

  @SuppressWarnings("unchecked")
  private NotificationSource<Object> source() {
    return (NotificationSource<Object>) implementation;
  }

  private Object createForwarder(Class<?> notificationInterface) {
    return Proxy.newProxyInstance(
        notificationInterface.getClassLoader(),
        new Class<?>[]{notificationInterface},
        new ForwardingHandler());
  }

  private static RuntimeException rethrow(Throwable cause) {
    if (cause instanceof RuntimeException runtime) {
      return runtime;
    }
    if (cause instanceof Error error) {
      throw error;
    }
    return new BusException(BusException.ErrorCode.INVOCATION_ERROR, cause.getMessage(), cause);
  }

  /**
   * Listener installed on the implementation; turns each notification into a bus event.
   */
  private class ForwardingHandler implements InvocationHandler {

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
      if (method.getDeclaringClass() == Object.class) {
        return switch (method.getName()) {
          case "equals" -> proxy == args[0];
          case "hashCode" -> System.identityHashCode(proxy);
          case "toString" -> "NotificationForwarder[" + descriptor.getServiceName() + "]";
          default -> throw new UnsupportedOperationException("Unsupported Object method: " + method.getName());
        };
      }
      if (method.isDefault()) {
        return InvocationHandler.invokeDefault(proxy, method, args);
      }
      NotificationSignature signature = descriptor.findNotification(method.getName())
          .orElseThrow(() -> new BusException(BusException.ErrorCode.METHOD_NOT_FOUND,
              "Unknown notification " + method.getName()));
      List<String> wire = marshaler.marshal(signature.parameterKindArray(), args);
      bus.emit(descriptor.getObjectPath(), descriptor.getInterfaceName(), signature.name(), wire);
      return null;
    }
  }
}

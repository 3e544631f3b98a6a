package io.github.panghy.flowbus.proxy;

import io.github.panghy.flowbus.error.ServiceNotAttachedException;
import io.github.panghy.flowbus.service.MethodSignature;
import io.github.panghy.flowbus.service.NotificationHub;
import io.github.panghy.flowbus.service.NotificationSource;
import io.github.panghy.flowbus.service.ServiceDescriptor;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

import static io.github.panghy.flowbus.util.LoggingUtil.debug;

/**
 * A stable, always-callable handle to a service that may not be connected yet.
 *
 * <p>The facade's {@link #getService() service} is a dynamic proxy implementing
 * the service interface. Until an {@link ImportStub} is attached every forwarded
 * call fails with {@link ServiceNotAttachedException} without any bus traffic;
 * afterwards calls go to the stub. A facade is attached at most once and owns
 * the attached stub.</p>
 *
 * <p>Notification listeners can be added to the facade before it is attached;
 * they start receiving notifications once a stub is attached.</p>
 *
 * @param <S> The service interface
 */
public final class AccessFacade<S> {

  private static final Logger LOGGER = Logger.getLogger(AccessFacade.class.getName());

  private final ServiceDescriptor<S> descriptor;
  private final NotificationHub<Object> hub;
  private final AtomicReference<ImportStub<S>> stub = new AtomicReference<>();
  private final S service;

  @SuppressWarnings("unchecked")
  private AccessFacade(ServiceDescriptor<S> descriptor) {
    this.descriptor = descriptor;
    this.hub = descriptor.getNotificationInterface()
        .map(n -> new NotificationHub<>((Class<Object>) n))
        .orElse(null);
    Class<S> serviceInterface = descriptor.getServiceInterface();
    this.service = serviceInterface.cast(Proxy.newProxyInstance(
        serviceInterface.getClassLoader(),
        new Class<?>[]{serviceInterface},
        new FacadeInvocationHandler(this)));
  }

  /**
   * Creates an unattached facade.
   *
   * @param descriptor The service descriptor
   * @param <S>        The service type
   * @return A new facade
   */
  public static <S> AccessFacade<S> create(ServiceDescriptor<S> descriptor) {
    if (descriptor == null) {
      throw new IllegalArgumentException("Descriptor cannot be null");
    }
    return new AccessFacade<>(descriptor);
  }

  /**
   * Finds the facade behind a service proxy.
   *
   * @param service Any object
   * @return The facade whose proxy the object is, or empty if it is not a facade proxy
   */
  public static Optional<AccessFacade<?>> of(Object service) {
    if (service == null || !Proxy.isProxyClass(service.getClass())) {
      return Optional.empty();
    }
    InvocationHandler handler = Proxy.getInvocationHandler(service);
    if (handler instanceof FacadeInvocationHandler facadeHandler) {
      return Optional.of(facadeHandler.facade);
    }
    return Optional.empty();
  }

  /**
   * Gets the proxy implementing the service interface.
   *
   * @return The facade proxy
   */
  public S getService() {
    return service;
  }

  public ServiceDescriptor<S> getDescriptor() {
    return descriptor;
  }

  public boolean isAttached() {
    return stub.get() != null;
  }

  /**
   * Gets the attached stub.
   *
   * @return The stub, or empty while unattached
   */
  public Optional<ImportStub<S>> getStub() {
    return Optional.ofNullable(stub.get());
  }

  /**
   * Attaches a stub. Only the first attach succeeds; later ones leave the
   * existing binding untouched.
   *
   * @param importStub The stub to forward calls to
   * @return true if the stub was attached, false if the facade was already attached
   */
  public boolean attach(ImportStub<S> importStub) {
    if (importStub == null) {
      throw new IllegalArgumentException("Stub cannot be null");
    }
    if (importStub.getDescriptor() != descriptor) {
      throw new IllegalArgumentException("Stub was created for " + importStub.getDescriptor()
          + ", not " + descriptor);
    }
    if (!stub.compareAndSet(null, importStub)) {
      return false;
    }
    if (hub != null) {
      importStub.hub().addListener(hub.emitter());
    }
    debug(LOGGER, () -> "Attached " + importStub + " to facade of " + descriptor.getServiceName());
    return true;
  }

  @Override
  public String toString() {
    ImportStub<S> current = stub.get();
    return "AccessFacade[" + descriptor.getServiceName() + (current == null ? " (unattached)]" : " -> " + current + "]");
  }

  private Object handle(Object proxy, Method method, Object[] args) throws Throwable {
    if (method.getDeclaringClass() == Object.class) {
      return switch (method.getName()) {
        case "equals" -> proxy == args[0];
        case "hashCode" -> System.identityHashCode(proxy);
        case "toString" -> toString();
        default -> throw new UnsupportedOperationException("Unsupported Object method: " + method.getName());
      };
    }
    if (method.getDeclaringClass() == NotificationSource.class) {
      if (hub == null) {
        throw new UnsupportedOperationException(descriptor.getServiceName() + " has no notifications");
      }
      return ImportStub.invokeOn(hub, method, args);
    }
    if (method.isDefault()) {
      return InvocationHandler.invokeDefault(proxy, method, args);
    }
    MethodSignature signature = descriptor.findMethod(method.getName())
        .orElseThrow(() -> new UnsupportedOperationException("Not a bus method: " + method.getName()));
    ImportStub<S> current = stub.get();
    if (current == null) {
      throw new ServiceNotAttachedException(descriptor.getServiceName(), signature.name());
    }
    return current.call(signature, args);
  }

  private static final class FacadeInvocationHandler implements InvocationHandler {
    private final AccessFacade<?> facade;

    FacadeInvocationHandler(AccessFacade<?> facade) {
      this.facade = facade;
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
      return facade.handle(proxy, method, args);
    }
  }
}

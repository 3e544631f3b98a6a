package io.github.panghy.flowbus.service;

import io.github.panghy.flowbus.error.BusDefinitionException;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static description of one service on the bus.
 *
 * <p>A descriptor names where the service lives (service name, object path,
 * interface name, bus) and lists the signatures of its methods and
 * notifications. The signature tables are derived once from the service
 * interface by reflection and are shared, read-only, by the export adapter, the
 * import stub and the access facade built for the service.</p>
 *
 * <p>Rules enforced while building:</p>
 * <ul>
 *   <li>the service type must be an interface</li>
 *   <li>method and notification names must be unique (no overloads)</li>
 *   <li>notifications must return {@code void}</li>
 *   <li>a service extending {@link NotificationSource} must bind its type argument to an interface</li>
 * </ul>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * ServiceDescriptor<Thermostat> descriptor = ServiceDescriptor.builder(Thermostat.class)
 *     .serviceName("org.example.Thermostat")
 *     .objectPath("/org/example/Thermostat")
 *     .bus(BusSelector.SESSION)
 *     .build();
 * }</pre>
 *
 * @param <S> The service interface
 */
public final class ServiceDescriptor<S> {

  private final Class<S> serviceInterface;
  private final Class<?> notificationInterface;
  private final String serviceName;
  private final String objectPath;
  private final String interfaceName;
  private final BusSelector bus;
  private final List<MethodSignature> methods;
  private final List<NotificationSignature> notifications;
  private final Map<String, MethodSignature> methodsByName;
  private final Map<String, NotificationSignature> notificationsByName;

  private ServiceDescriptor(Builder<S> builder) {
    this.serviceInterface = builder.serviceInterface;
    this.serviceName = builder.serviceName;
    this.objectPath = builder.objectPath != null
        ? builder.objectPath
        : "/" + builder.serviceName.replace('.', '/');
    this.interfaceName = builder.interfaceName != null ? builder.interfaceName : serviceInterface.getName();
    this.bus = builder.bus;
    this.notificationInterface = findNotificationInterface(serviceInterface);

    Map<String, MethodSignature> byName = new LinkedHashMap<>();
    for (Method method : sortedByName(serviceInterface.getMethods())) {
      if (!isExported(method)) {
        continue;
      }
      if (byName.put(method.getName(), MethodSignature.of(method)) != null) {
        throw new BusDefinitionException(serviceInterface,
            "Method " + method.getName() + " is overloaded; bus methods are addressed by name only");
      }
    }
    this.methodsByName = Collections.unmodifiableMap(byName);
    this.methods = List.copyOf(byName.values());

    Map<String, NotificationSignature> notificationMap = new LinkedHashMap<>();
    if (notificationInterface != null) {
      for (Method method : sortedByName(notificationInterface.getMethods())) {
        if (method.isDefault() || Modifier.isStatic(method.getModifiers())) {
          continue;
        }
        if (method.getReturnType() != void.class) {
          throw new BusDefinitionException(serviceInterface,
              "Notification " + method.getName() + " must return void");
        }
        if (notificationMap.put(method.getName(), NotificationSignature.of(method)) != null) {
          throw new BusDefinitionException(serviceInterface,
              "Notification " + method.getName() + " is overloaded");
        }
      }
    }
    this.notificationsByName = Collections.unmodifiableMap(notificationMap);
    this.notifications = List.copyOf(notificationMap.values());
  }

  /**
   * Creates a builder for a service interface.
   *
   * @param serviceInterface The service interface
   * @param <S>              The service type
   * @return A new builder
   */
  public static <S> Builder<S> builder(Class<S> serviceInterface) {
    return new Builder<>(serviceInterface);
  }

  public Class<S> getServiceInterface() {
    return serviceInterface;
  }

  /**
   * Gets the notification interface, if the service declares notifications.
   *
   * @return The notification interface
   */
  public Optional<Class<?>> getNotificationInterface() {
    return Optional.ofNullable(notificationInterface);
  }

  public String getServiceName() {
    return serviceName;
  }

  public String getObjectPath() {
    return objectPath;
  }

  public String getInterfaceName() {
    return interfaceName;
  }

  public BusSelector getBus() {
    return bus;
  }

  /**
   * Gets the exported methods, ordered by name.
   *
   * @return The method signatures
   */
  public List<MethodSignature> getMethods() {
    return methods;
  }

  /**
   * Gets the notifications, ordered by name.
   *
   * @return The notification signatures
   */
  public List<NotificationSignature> getNotifications() {
    return notifications;
  }

  /**
   * Looks up a method by its bus name.
   *
   * @param name The method name
   * @return The signature, or empty if the service has no such method
   */
  public Optional<MethodSignature> findMethod(String name) {
    return Optional.ofNullable(methodsByName.get(name));
  }

  /**
   * Looks up a notification by its bus name.
   *
   * @param name The notification name
   * @return The signature, or empty if the service has no such notification
   */
  public Optional<NotificationSignature> findNotification(String name) {
    return Optional.ofNullable(notificationsByName.get(name));
  }

  /**
   * Collects every type that crosses the bus for this service: parameter and
   * non-void return types of methods, and notification parameter types.
   *
   * @return The distinct wire types
   */
  public Set<Type> wireTypes() {
    Set<Type> types = new HashSet<>();
    for (MethodSignature method : methods) {
      types.addAll(method.parameterKinds());
      if (!method.isVoid()) {
        types.add(method.returnKind());
      }
    }
    for (NotificationSignature notification : notifications) {
      types.addAll(notification.parameterKinds());
    }
    return types;
  }

  /**
   * Checks whether an interface method is exported as a bus method.
   * Object methods, the notification listener capability, static and default
   * methods stay local.
   *
   * @param method The method
   * @return true if the method is part of the bus surface
   */
  public static boolean isExported(Method method) {
    return method.getDeclaringClass() != Object.class
        && method.getDeclaringClass() != NotificationSource.class
        && !method.isDefault()
        && !Modifier.isStatic(method.getModifiers());
  }

  private static Method[] sortedByName(Method[] methods) {
    Method[] sorted = methods.clone();
    Arrays.sort(sorted, Comparator.comparing(Method::getName));
    return sorted;
  }

  private static Class<?> findNotificationInterface(Class<?> type) {
    if (!NotificationSource.class.isAssignableFrom(type)) {
      return null;
    }
    Type argument = sourceArgument(type, Map.of());
    if (argument instanceof Class<?> clazz && clazz.isInterface()) {
      return clazz;
    }
    throw new BusDefinitionException(type,
        "NotificationSource of " + type.getName() + " must be bound to a notification interface");
  }

  // Walks up the superinterfaces, substituting type arguments, until NotificationSource is reached
  private static Type sourceArgument(Class<?> type, Map<TypeVariable<?>, Type> bindings) {
    for (Type candidate : type.getGenericInterfaces()) {
      if (candidate instanceof ParameterizedType parameterized) {
        Class<?> raw = (Class<?>) parameterized.getRawType();
        if (!NotificationSource.class.isAssignableFrom(raw)) {
          continue;
        }
        Type[] arguments = parameterized.getActualTypeArguments();
        for (int i = 0; i < arguments.length; i++) {
          arguments[i] = bindings.getOrDefault(arguments[i], arguments[i]);
        }
        if (raw == NotificationSource.class) {
          return arguments[0];
        }
        Map<TypeVariable<?>, Type> next = new HashMap<>();
        TypeVariable<?>[] parameters = raw.getTypeParameters();
        for (int i = 0; i < parameters.length; i++) {
          next.put(parameters[i], arguments[i]);
        }
        return sourceArgument(raw, next);
      } else if (candidate instanceof Class<?> raw && NotificationSource.class.isAssignableFrom(raw)) {
        // raw NotificationSource has no argument to find
        return raw == NotificationSource.class ? null : sourceArgument(raw, Map.of());
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "ServiceDescriptor{" +
        "service=" + serviceName +
        ", path=" + objectPath +
        ", interface=" + interfaceName +
        ", bus=" + bus +
        '}';
  }

  /**
   * Builder for ServiceDescriptor.
   *
   * @param <S> The service interface
   */
  public static final class Builder<S> {
    private final Class<S> serviceInterface;
    private String serviceName;
    private String objectPath;
    private String interfaceName;
    private BusSelector bus = BusSelector.SESSION;

    private Builder(Class<S> serviceInterface) {
      if (serviceInterface == null || !serviceInterface.isInterface()) {
        throw new BusDefinitionException(serviceInterface, "A service must be described by an interface");
      }
      this.serviceInterface = serviceInterface;
    }

    /**
     * Sets the well-known bus name of the service (required).
     *
     * @param serviceName The service name, e.g. "org.example.Thermostat"
     * @return This builder for chaining
     */
    public Builder<S> serviceName(String serviceName) {
      if (serviceName == null || serviceName.isBlank()) {
        throw new IllegalArgumentException("Service name cannot be empty");
      }
      this.serviceName = serviceName;
      return this;
    }

    /**
     * Sets the object path. Defaults to the service name with dots turned into slashes.
     *
     * @param objectPath The object path; must start with '/'
     * @return This builder for chaining
     */
    public Builder<S> objectPath(String objectPath) {
      if (objectPath == null || !objectPath.startsWith("/")) {
        throw new IllegalArgumentException("Object path must start with '/', got: " + objectPath);
      }
      this.objectPath = objectPath;
      return this;
    }

    /**
     * Sets the bus interface name. Defaults to the Java interface's binary name.
     *
     * @param interfaceName The interface name
     * @return This builder for chaining
     */
    public Builder<S> interfaceName(String interfaceName) {
      if (interfaceName == null || interfaceName.isBlank()) {
        throw new IllegalArgumentException("Interface name cannot be empty");
      }
      this.interfaceName = interfaceName;
      return this;
    }

    /**
     * Selects the bus. Defaults to the session bus.
     *
     * @param bus The bus selector
     * @return This builder for chaining
     */
    public Builder<S> bus(BusSelector bus) {
      if (bus == null) {
        throw new IllegalArgumentException("Bus selector cannot be null");
      }
      this.bus = bus;
      return this;
    }

    /**
     * Builds the descriptor, deriving the signature tables from the interface.
     *
     * @return A new ServiceDescriptor
     * @throws BusDefinitionException if the interface breaks a definition rule
     */
    public ServiceDescriptor<S> build() {
      if (serviceName == null) {
        throw new BusDefinitionException(serviceInterface, "Service name is required");
      }
      return new ServiceDescriptor<>(this);
    }
  }
}

package io.github.panghy.flowbus.service;

import java.lang.reflect.Method;
import java.lang.reflect.Type;
import java.util.List;

/**
 * A one-way notification of a service. Notifications never return a value.
 *
 * @param name           The notification name, used unchanged on the wire
 * @param method         The method on the notification interface
 * @param parameterKinds The declared (generic) parameter types, in order
 */
public record NotificationSignature(String name, Method method, List<Type> parameterKinds) {

  public NotificationSignature {
    parameterKinds = List.copyOf(parameterKinds);
  }

  /**
   * Creates the signature of a notification interface method.
   *
   * @param method The method
   * @return Its signature
   */
  public static NotificationSignature of(Method method) {
    return new NotificationSignature(method.getName(), method, List.of(method.getGenericParameterTypes()));
  }

  /**
   * Gets the parameter types as an array, the form the marshaler takes.
   *
   * @return The parameter types
   */
  public Type[] parameterKindArray() {
    return parameterKinds.toArray(new Type[0]);
  }
}

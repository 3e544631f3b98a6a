package io.github.panghy.flowbus.service;

import io.github.panghy.flowbus.marshal.CallMarshaler;

import java.lang.reflect.Method;
import java.lang.reflect.Type;
import java.util.List;

/**
 * A two-way method of a service: its bus name, its Java method, and the declared
 * types of its parameters and return value.
 *
 * @param name           The method name, used unchanged on the wire
 * @param method         The method on the service interface
 * @param parameterKinds The declared (generic) parameter types, in order
 * @param returnKind     The declared (generic) return type; {@code void.class} for none
 */
public record MethodSignature(String name, Method method, List<Type> parameterKinds, Type returnKind) {

  public MethodSignature {
    parameterKinds = List.copyOf(parameterKinds);
  }

  /**
   * Creates the signature of an interface method.
   *
   * @param method The method
   * @return Its signature
   */
  public static MethodSignature of(Method method) {
    return new MethodSignature(method.getName(), method,
        List.of(method.getGenericParameterTypes()), method.getGenericReturnType());
  }

  /**
   * Gets the parameter types as an array, the form the marshaler takes.
   *
   * @return The parameter types
   */
  public Type[] parameterKindArray() {
    return parameterKinds.toArray(new Type[0]);
  }

  /**
   * Checks whether the method returns no value.
   *
   * @return true for void methods
   */
  public boolean isVoid() {
    return CallMarshaler.isVoid(returnKind);
  }
}

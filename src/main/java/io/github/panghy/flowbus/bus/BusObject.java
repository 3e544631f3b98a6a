package io.github.panghy.flowbus.bus;

import java.util.List;

/**
 * An object exported at a path on the bus, callable by method name with string arguments.
 */
public interface BusObject {

  /**
   * Gets the bus interface this object implements.
   *
   * @return The interface name
   */
  String interfaceName();

  /**
   * Handles one incoming call.
   *
   * @param method The called method name
   * @param args   The string arguments, in declaration order
   * @return The string reply
   */
  String invoke(String method, List<String> args);
}

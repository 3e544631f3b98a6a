package io.github.panghy.flowbus.bus;

import io.github.panghy.flowbus.error.BusCallException;

import java.util.List;
import java.util.function.Consumer;

/**
 * The primitives FlowBus needs from an inter-process message bus.
 *
 * <p>Everything above this interface (export adapters, import stubs, access
 * facades, the service directory) talks to the transport only through these
 * operations. Every argument, reply and notification argument is a single
 * string; no structural encoding is defined at this level.</p>
 *
 * <p>The primitives fall into four groups:</p>
 * <ul>
 *   <li>Registration: claim an object path, claim a service name</li>
 *   <li>Discovery: check whether a name is claimed, watch for a name being claimed</li>
 *   <li>Calls: invoke a method by name on a remote object and wait for the reply</li>
 *   <li>Events: emit a notification from an object, subscribe to a remote object's notifications</li>
 * </ul>
 */
public interface MessageBus {

  /**
   * Exports an object at a path.
   *
   * @param objectPath The object path
   * @param object     The object handling calls at that path
   * @return true if the path was free and is now owned by the object
   */
  boolean registerObject(String objectPath, BusObject object);

  /**
   * Removes the object exported at a path.
   *
   * @param objectPath The object path
   * @return true if an object was registered there
   */
  boolean unregisterObject(String objectPath);

  /**
   * Claims a well-known service name.
   *
   * @param serviceName The service name
   * @return true if the name was free and is now claimed
   */
  boolean registerName(String serviceName);

  /**
   * Releases a service name.
   *
   * @param serviceName The service name
   * @return true if the name was claimed
   */
  boolean unregisterName(String serviceName);

  /**
   * Checks whether a service name is currently claimed.
   *
   * @param serviceName The service name
   * @return true if claimed
   */
  boolean isNameRegistered(String serviceName);

  /**
   * Watches for a service name being claimed. The callback runs every time the
   * name is registered until the watch is closed.
   *
   * @param serviceName  The service name
   * @param onRegistered The callback
   * @return Handle that cancels the watch
   */
  Registration watchRegistration(String serviceName, Runnable onRegistered);

  /**
   * Calls a method on a remote object and blocks until the reply arrives.
   *
   * @param serviceName   The destination service name
   * @param objectPath    The destination object path
   * @param interfaceName The interface the method belongs to
   * @param method        The method name
   * @param args          The string arguments, in declaration order
   * @return The string reply
   * @throws BusCallException if the call cannot be delivered or the remote side fails
   */
  String call(String serviceName, String objectPath, String interfaceName, String method, List<String> args);

  /**
   * Emits a notification from an exported object.
   *
   * @param objectPath    The emitting object path
   * @param interfaceName The interface the notification belongs to
   * @param name          The notification name
   * @param args          The string arguments, in declaration order
   */
  void emit(String objectPath, String interfaceName, String name, List<String> args);

  /**
   * Subscribes to a notification of a remote object.
   *
   * @param serviceName   The emitting service name
   * @param objectPath    The emitting object path
   * @param interfaceName The interface the notification belongs to
   * @param name          The notification name
   * @param listener      Receives the string arguments of every matching notification
   * @return Handle that cancels the subscription
   */
  Registration subscribe(String serviceName, String objectPath, String interfaceName, String name,
                         Consumer<List<String>> listener);
}

package io.github.panghy.flowbus;

import io.github.panghy.flowbus.bus.MessageBus;
import io.github.panghy.flowbus.bus.Registration;
import io.github.panghy.flowbus.error.BusException;
import io.github.panghy.flowbus.proxy.AccessFacade;
import io.github.panghy.flowbus.proxy.ImportStub;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

import static io.github.panghy.flowbus.util.LoggingUtil.debug;
import static io.github.panghy.flowbus.util.LoggingUtil.info;
import static io.github.panghy.flowbus.util.LoggingUtil.warn;

/**
 * Discovery and connection of services on a bus.
 *
 * <p>The directory answers whether a service name is registered, blocks until
 * one is, and binds an {@link AccessFacade} to its remote service by creating an
 * {@link ImportStub} and attaching it. Connection problems are reported as a
 * {@link ConnectResult} with a logged warning; nothing is thrown.</p>
 *
 * <p>Waiting and connecting are two separate steps. A service that disappears
 * between them yields a stub whose calls fail with a bus error.</p>
 */
public final class ServiceDirectory {

  private static final Logger LOGGER = Logger.getLogger(ServiceDirectory.class.getName());

  private ServiceDirectory() {
  }

  /**
   * Checks whether a service name is registered.
   *
   * @param serviceName The service name
   * @param bus         The bus to check
   * @return true if the name is currently registered
   */
  public static boolean isRegistered(String serviceName, MessageBus bus) {
    return bus.isNameRegistered(serviceName);
  }

  /**
   * Blocks the calling thread until a service name is registered.
   * Returns immediately if it already is.
   *
   * @param serviceName The service name
   * @param bus         The bus to watch
   * @return true once registered, false if the thread was interrupted while waiting
   */
  public static boolean waitForRegistration(String serviceName, MessageBus bus) {
    return waitForRegistration(serviceName, bus, null);
  }

  /**
   * Blocks the calling thread until a service name is registered or a timeout elapses.
   *
   * @param serviceName The service name
   * @param bus         The bus to watch
   * @param timeout     The maximum time to wait, or null to wait forever
   * @return true once registered, false on timeout or interruption
   */
  public static boolean waitForRegistration(String serviceName, MessageBus bus, Duration timeout) {
    if (bus.isNameRegistered(serviceName)) {
      return true;
    }
    CompletableFuture<Void> registered = new CompletableFuture<>();
    try (Registration ignored = bus.watchRegistration(serviceName, () -> registered.complete(null))) {
      // The name may have appeared before the watch was installed
      if (bus.isNameRegistered(serviceName)) {
        return true;
      }
      debug(LOGGER, () -> "Waiting for " + serviceName + " to be registered");
      if (timeout == null) {
        registered.get();
      } else {
        registered.get(saturatedNanos(timeout), TimeUnit.NANOSECONDS);
      }
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      warn(LOGGER, "Interrupted while waiting for " + serviceName);
      return false;
    } catch (TimeoutException e) {
      warn(LOGGER, "Timed out after " + timeout + " waiting for " + serviceName);
      return false;
    } catch (ExecutionException e) {
      throw new BusException(BusException.ErrorCode.UNKNOWN,
          "Registration watch for " + serviceName + " failed", e.getCause());
    }
  }

  private static long saturatedNanos(Duration timeout) {
    try {
      return timeout.toNanos();
    } catch (ArithmeticException e) {
      return timeout.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
    }
  }

  /**
   * Connects an access facade to the remote service of a definition.
   *
   * @param definition The service definition
   * @param facade     The facade proxy, as returned by {@link ServiceDefinition#createServiceInterface()}
   * @param <S>        The service type
   * @return The outcome; {@link ConnectResult#CONNECTED} when a stub was attached
   */
  @SuppressWarnings("unchecked")
  public static <S> ConnectResult connectService(ServiceDefinition<S> definition, Object facade) {
    String serviceName = definition.serviceName();
    MessageBus bus = definition.bus();
    if (!isRegistered(serviceName, bus)) {
      warn(LOGGER, "Cannot connect to " + serviceName + ": service is not registered");
      return ConnectResult.NOT_REGISTERED;
    }
    Optional<AccessFacade<?>> found = AccessFacade.of(facade);
    if (found.isEmpty() || found.get().getDescriptor() != definition.descriptor()) {
      warn(LOGGER, "Cannot connect to " + serviceName + ": " + facade + " is not an access facade of it");
      return ConnectResult.WRONG_FACADE;
    }
    AccessFacade<S> accessFacade = (AccessFacade<S>) found.get();
    if (accessFacade.isAttached()) {
      warn(LOGGER, "Cannot connect to " + serviceName + ": facade is already connected");
      return ConnectResult.ALREADY_ATTACHED;
    }
    ImportStub<S> stub = ImportStub.create(definition.descriptor(), bus, definition.marshaler());
    if (!accessFacade.attach(stub)) {
      stub.close();
      warn(LOGGER, "Cannot connect to " + serviceName + ": facade was connected concurrently");
      return ConnectResult.ALREADY_ATTACHED;
    }
    info(LOGGER, "Connected to " + serviceName + " at " + definition.objectPath());
    return ConnectResult.CONNECTED;
  }

  /**
   * Waits for a service to be registered, then connects a facade to it.
   *
   * @param definition The service definition
   * @param facade     The facade proxy
   * @param <S>        The service type
   * @return The outcome of the connect, or {@link ConnectResult#NOT_REGISTERED} if the wait gave up
   */
  public static <S> ConnectResult waitAndConnectService(ServiceDefinition<S> definition, Object facade) {
    if (!definition.waitForServiceRegistration()) {
      return ConnectResult.NOT_REGISTERED;
    }
    return connectService(definition, facade);
  }
}

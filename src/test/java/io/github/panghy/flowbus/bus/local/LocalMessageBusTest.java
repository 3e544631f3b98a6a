package io.github.panghy.flowbus.bus.local;

import io.github.panghy.flowbus.bus.BusObject;
import io.github.panghy.flowbus.bus.Registration;
import io.github.panghy.flowbus.error.BusCallException;
import io.github.panghy.flowbus.error.BusException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the {@link LocalMessageBus} class.
 */
public class LocalMessageBusTest {

  private static final String SERVICE = "org.example.Echo";
  private static final String PATH = "/org/example/Echo";
  private static final String IFACE = "org.example.IEcho";

  private LocalMessageBus bus;
  private BusObject echo;

  @BeforeEach
  public void setUp() {
    bus = new LocalMessageBus();
    echo = mock(BusObject.class);
    when(echo.interfaceName()).thenReturn(IFACE);
  }

  @Test
  public void testRegistrationIsExclusive() {
    assertTrue(bus.registerObject(PATH, echo));
    assertFalse(bus.registerObject(PATH, mock(BusObject.class)));
    assertTrue(bus.registerName(SERVICE));
    assertFalse(bus.registerName(SERVICE));
    assertTrue(bus.isNameRegistered(SERVICE));

    assertTrue(bus.unregisterName(SERVICE));
    assertFalse(bus.unregisterName(SERVICE));
    assertFalse(bus.isNameRegistered(SERVICE));
    assertTrue(bus.unregisterObject(PATH));
    assertFalse(bus.unregisterObject(PATH));
  }

  @Test
  public void testCallIsDispatchedToObject() {
    bus.registerObject(PATH, echo);
    bus.registerName(SERVICE);
    when(echo.invoke(eq("say"), any())).thenReturn("hello");

    String reply = bus.call(SERVICE, PATH, IFACE, "say", List.of("a", "b"));

    assertEquals("hello", reply);
    verify(echo).invoke("say", List.of("a", "b"));
  }

  @Test
  public void testCallToUnknownService() {
    BusCallException e = assertThrows(BusCallException.class,
        () -> bus.call(SERVICE, PATH, IFACE, "say", List.of()));
    assertEquals(BusException.ErrorCode.SERVICE_UNAVAILABLE, e.getErrorCode());
    assertEquals(SERVICE, e.getServiceName());
    assertEquals("say", e.getMethodName());
  }

  @Test
  public void testCallToMissingObjectOrInterface() {
    bus.registerName(SERVICE);
    BusCallException missingObject = assertThrows(BusCallException.class,
        () -> bus.call(SERVICE, PATH, IFACE, "say", List.of()));
    assertEquals(BusException.ErrorCode.METHOD_NOT_FOUND, missingObject.getErrorCode());

    bus.registerObject(PATH, echo);
    BusCallException wrongInterface = assertThrows(BusCallException.class,
        () -> bus.call(SERVICE, PATH, "org.example.Other", "say", List.of()));
    assertEquals(BusException.ErrorCode.METHOD_NOT_FOUND, wrongInterface.getErrorCode());
  }

  @Test
  public void testHandlerFailures() {
    bus.registerObject(PATH, echo);
    bus.registerName(SERVICE);
    IllegalStateException failure = new IllegalStateException("handler broke");
    when(echo.invoke(eq("fail"), any())).thenThrow(failure);
    when(echo.invoke(eq("missing"), any()))
        .thenThrow(new BusException(BusException.ErrorCode.METHOD_NOT_FOUND, "no method"));

    BusCallException invocation = assertThrows(BusCallException.class,
        () -> bus.call(SERVICE, PATH, IFACE, "fail", List.of()));
    assertEquals(BusException.ErrorCode.INVOCATION_ERROR, invocation.getErrorCode());
    assertSame(failure, invocation.getCause());

    BusCallException missing = assertThrows(BusCallException.class,
        () -> bus.call(SERVICE, PATH, IFACE, "missing", List.of()));
    assertEquals(BusException.ErrorCode.METHOD_NOT_FOUND, missing.getErrorCode());
    assertEquals("missing", missing.getMethodName());
  }

  @Test
  public void testWatchFiresOnRegistrationOfThatName() {
    AtomicInteger fired = new AtomicInteger();
    Registration watch = bus.watchRegistration(SERVICE, fired::incrementAndGet);

    bus.registerName("org.example.Unrelated");
    assertEquals(0, fired.get());

    bus.registerName(SERVICE);
    assertEquals(1, fired.get());

    // A failed re-registration does not fire
    bus.registerName(SERVICE);
    assertEquals(1, fired.get());

    bus.unregisterName(SERVICE);
    watch.close();
    bus.registerName(SERVICE);
    assertEquals(1, fired.get());
  }

  @Test
  public void testClosingLastWatchForgetsTheName() {
    Registration first = bus.watchRegistration(SERVICE, () -> { });
    Registration second = bus.watchRegistration(SERVICE, () -> { });
    assertEquals(1, bus.watchedNameCount());

    first.close();
    assertEquals(1, bus.watchedNameCount());

    second.close();
    assertEquals(0, bus.watchedNameCount());
    // Closing twice is harmless
    second.close();
    assertEquals(0, bus.watchedNameCount());
  }

  @Test
  public void testFailingWatchDoesNotStopOthers() {
    AtomicInteger fired = new AtomicInteger();
    bus.watchRegistration(SERVICE, () -> {
      throw new IllegalStateException("watch broke");
    });
    bus.watchRegistration(SERVICE, fired::incrementAndGet);

    assertTrue(bus.registerName(SERVICE));
    assertEquals(1, fired.get());
  }

  @Test
  public void testNotificationsReachMatchingSubscribersInOrder() {
    List<String> received = new ArrayList<>();
    bus.subscribe(SERVICE, PATH, IFACE, "changed", args -> received.add("first" + args));
    bus.subscribe(SERVICE, PATH, IFACE, "changed", args -> received.add("second" + args));
    bus.subscribe(SERVICE, PATH, IFACE, "other", args -> received.add("other" + args));
    bus.subscribe(SERVICE, "/elsewhere", IFACE, "changed", args -> received.add("elsewhere" + args));

    bus.emit(PATH, IFACE, "changed", List.of("1", "x"));

    assertEquals(List.of("first[1, x]", "second[1, x]"), received);
  }

  @Test
  public void testClosedSubscriptionStopsDelivery() {
    List<List<String>> received = new ArrayList<>();
    Registration subscription = bus.subscribe(SERVICE, PATH, IFACE, "changed", received::add);
    assertEquals(1, bus.subscriptionCount());

    subscription.close();
    subscription.close();
    bus.emit(PATH, IFACE, "changed", List.of("1"));

    assertTrue(received.isEmpty());
    assertEquals(0, bus.subscriptionCount());
  }

  @Test
  public void testFailingSubscriberDoesNotStopOthers() {
    List<List<String>> received = new ArrayList<>();
    bus.subscribe(SERVICE, PATH, IFACE, "changed", args -> {
      throw new IllegalStateException("subscriber broke");
    });
    bus.subscribe(SERVICE, PATH, IFACE, "changed", received::add);

    bus.emit(PATH, IFACE, "changed", List.of("2"));

    assertEquals(List.of(List.of("2")), received);
  }
}

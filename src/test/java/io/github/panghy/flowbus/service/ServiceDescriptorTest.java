package io.github.panghy.flowbus.service;

import io.github.panghy.flowbus.error.BusDefinitionException;
import io.github.panghy.flowbus.examples.Calculator;
import io.github.panghy.flowbus.examples.Thermostat;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for the {@link ServiceDescriptor} class.
 */
public class ServiceDescriptorTest {

  public interface Overloaded {
    int get(int key);

    int get(String key);
  }

  public interface Events {
    int changed();
  }

  public interface BadNotifications extends NotificationSource<Events> {
    void ping();
  }

  @SuppressWarnings("rawtypes")
  public interface RawSource extends NotificationSource {
    void ping();
  }

  public interface Base<N> extends NotificationSource<N> {
  }

  public interface Derived extends Base<Thermostat.Events> {
    void ping();
  }

  @Test
  public void testMethodsAreSortedByName() {
    ServiceDescriptor<Thermostat> descriptor = ServiceDescriptor.builder(Thermostat.class)
        .serviceName("org.example.Thermostat")
        .build();

    List<String> names = descriptor.getMethods().stream().map(MethodSignature::name).toList();
    // Default and listener methods are not exported
    assertEquals(List.of("describe", "getMode", "getTemperature", "setTarget"), names);
  }

  @Test
  public void testSignatures() {
    ServiceDescriptor<Thermostat> descriptor = ServiceDescriptor.builder(Thermostat.class)
        .serviceName("org.example.Thermostat")
        .build();

    MethodSignature setTarget = descriptor.findMethod("setTarget").orElseThrow();
    assertEquals(List.of(int.class, String.class), setTarget.parameterKinds());
    assertTrue(setTarget.isVoid());

    MethodSignature getMode = descriptor.findMethod("getMode").orElseThrow();
    assertEquals(Thermostat.Mode.class, getMode.returnKind());
    assertFalse(getMode.isVoid());

    assertTrue(descriptor.findMethod("summary").isEmpty());
    assertTrue(descriptor.findMethod("addListener").isEmpty());
  }

  @Test
  public void testNotifications() {
    ServiceDescriptor<Thermostat> descriptor = ServiceDescriptor.builder(Thermostat.class)
        .serviceName("org.example.Thermostat")
        .build();

    assertEquals(Thermostat.Events.class, descriptor.getNotificationInterface().orElseThrow());
    List<String> names = descriptor.getNotifications().stream().map(NotificationSignature::name).toList();
    assertEquals(List.of("modeChanged", "temperatureChanged"), names);
    assertEquals(List.of(int.class, String.class),
        descriptor.findNotification("temperatureChanged").orElseThrow().parameterKinds());
  }

  @Test
  public void testWireTypes() {
    ServiceDescriptor<Thermostat> descriptor = ServiceDescriptor.builder(Thermostat.class)
        .serviceName("org.example.Thermostat")
        .build();

    assertEquals(Set.of(int.class, String.class, boolean.class, Thermostat.Mode.class),
        descriptor.wireTypes());
  }

  @Test
  public void testDefaults() {
    ServiceDescriptor<Calculator> descriptor = ServiceDescriptor.builder(Calculator.class)
        .serviceName("org.example.Calculator")
        .build();

    assertEquals("/org/example/Calculator", descriptor.getObjectPath());
    assertEquals(Calculator.class.getName(), descriptor.getInterfaceName());
    assertSame(BusSelector.SESSION, descriptor.getBus());
    assertTrue(descriptor.getNotificationInterface().isEmpty());
    assertTrue(descriptor.getNotifications().isEmpty());
  }

  @Test
  public void testExplicitNames() {
    ServiceDescriptor<Calculator> descriptor = ServiceDescriptor.builder(Calculator.class)
        .serviceName("org.example.Calculator")
        .objectPath("/calc")
        .interfaceName("org.example.ICalculator")
        .bus(BusSelector.SYSTEM)
        .build();

    assertEquals("/calc", descriptor.getObjectPath());
    assertEquals("org.example.ICalculator", descriptor.getInterfaceName());
    assertEquals(BusSelector.SYSTEM, descriptor.getBus());
    assertTrue(descriptor.toString().contains("org.example.Calculator"));
  }

  @Test
  public void testInheritedNotificationInterface() {
    ServiceDescriptor<Derived> descriptor = ServiceDescriptor.builder(Derived.class)
        .serviceName("org.example.Derived")
        .build();

    assertEquals(Thermostat.Events.class, descriptor.getNotificationInterface().orElseThrow());
  }

  @Test
  public void testDefinitionErrors() {
    assertThrows(BusDefinitionException.class, () -> ServiceDescriptor.builder(String.class));
    assertThrows(BusDefinitionException.class,
        () -> ServiceDescriptor.builder(Overloaded.class).serviceName("a.B").build());
    assertThrows(BusDefinitionException.class,
        () -> ServiceDescriptor.builder(BadNotifications.class).serviceName("a.B").build());
    assertThrows(BusDefinitionException.class,
        () -> ServiceDescriptor.builder(RawSource.class).serviceName("a.B").build());
    // Service name is required
    assertThrows(BusDefinitionException.class, () -> ServiceDescriptor.builder(Calculator.class).build());
  }

  @Test
  public void testInvalidBuilderArguments() {
    ServiceDescriptor.Builder<Calculator> builder = ServiceDescriptor.builder(Calculator.class);
    assertThrows(IllegalArgumentException.class, () -> builder.serviceName(" "));
    assertThrows(IllegalArgumentException.class, () -> builder.objectPath("no/leading/slash"));
    assertThrows(IllegalArgumentException.class, () -> builder.interfaceName(""));
    assertThrows(IllegalArgumentException.class, () -> builder.bus(null));
  }

  @Test
  public void testBusSelector() {
    assertEquals("session", BusSelector.SESSION.toString());
    assertEquals("system", BusSelector.SYSTEM.toString());
    assertEquals("custom:test", BusSelector.custom("test").toString());
    assertEquals(BusSelector.custom("test"), BusSelector.custom("test"));
    assertThrows(IllegalArgumentException.class, () -> BusSelector.custom(""));
    assertThrows(IllegalArgumentException.class, () -> new BusSelector(BusType.SESSION, "named"));
  }
}

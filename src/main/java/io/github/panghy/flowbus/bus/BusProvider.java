package io.github.panghy.flowbus.bus;

import io.github.panghy.flowbus.bus.local.LocalMessageBus;
import io.github.panghy.flowbus.service.BusSelector;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Resolves a {@link BusSelector} to a connected {@link MessageBus}.
 *
 * <p>The system and session buses are created lazily on first use by the
 * provider's bus factory; custom buses must be registered by name before they
 * are selected. A process normally shares the default provider obtained from
 * {@link #getDefault()}; tests install their own with {@link #setDefault}.</p>
 */
public class BusProvider {

  // Holds the default provider instance
  private static final AtomicReference<BusProvider> defaultProvider = new AtomicReference<>();

  private final Supplier<MessageBus> busFactory;
  private final AtomicReference<MessageBus> systemBus = new AtomicReference<>();
  private final AtomicReference<MessageBus> sessionBus = new AtomicReference<>();
  private final Map<String, MessageBus> customBuses = new ConcurrentHashMap<>();

  /**
   * Creates a provider whose system and session buses are in-process {@link LocalMessageBus} instances.
   */
  public BusProvider() {
    this(LocalMessageBus::new);
  }

  /**
   * Creates a provider that connects system and session buses with a factory.
   *
   * @param busFactory Creates one bus per standard selector on first use
   */
  public BusProvider(Supplier<MessageBus> busFactory) {
    if (busFactory == null) {
      throw new IllegalArgumentException("Bus factory cannot be null");
    }
    this.busFactory = busFactory;
  }

  /**
   * Gets the default provider, creating it on first use.
   *
   * @return The default BusProvider
   */
  public static BusProvider getDefault() {
    BusProvider provider = defaultProvider.get();
    if (provider == null) {
      synchronized (BusProvider.class) {
        provider = defaultProvider.get();
        if (provider == null) {
          provider = new BusProvider();
          defaultProvider.set(provider);
        }
      }
    }
    return provider;
  }

  /**
   * Replaces the default provider. Passing null makes the next
   * {@link #getDefault()} create a fresh one.
   *
   * @param provider The provider to set as default
   */
  public static void setDefault(BusProvider provider) {
    defaultProvider.set(provider);
  }

  /**
   * Gets the bus a selector points at.
   *
   * @param selector The bus selector
   * @return The connected bus
   * @throws IllegalStateException if a custom bus is selected that was never registered
   */
  public MessageBus getBus(BusSelector selector) {
    if (selector == null) {
      throw new IllegalArgumentException("Bus selector cannot be null");
    }
    return switch (selector.type()) {
      case SYSTEM -> connect(systemBus);
      case SESSION -> connect(sessionBus);
      case CUSTOM -> {
        MessageBus bus = customBuses.get(selector.name());
        if (bus == null) {
          throw new IllegalStateException("No custom bus registered under " + selector.name());
        }
        yield bus;
      }
    };
  }

  /**
   * Registers a custom bus under a name, replacing any previous one.
   *
   * @param name The name used by {@link BusSelector#custom(String)}
   * @param bus  The bus
   */
  public void registerCustomBus(String name, MessageBus bus) {
    if (name == null || name.isBlank() || bus == null) {
      throw new IllegalArgumentException("Custom bus name and bus cannot be empty");
    }
    customBuses.put(name, bus);
  }

  private MessageBus connect(AtomicReference<MessageBus> slot) {
    MessageBus bus = slot.get();
    if (bus == null) {
      synchronized (slot) {
        bus = slot.get();
        if (bus == null) {
          bus = busFactory.get();
          slot.set(bus);
        }
      }
    }
    return bus;
  }
}

package io.github.panghy.flowbus.service;

import java.util.Objects;

/**
 * Identifies the bus instance a service is configured for.
 *
 * <p>For {@link BusType#SYSTEM} and {@link BusType#SESSION} the name is always null.
 * For {@link BusType#CUSTOM} the name selects one of the buses registered with
 * {@link io.github.panghy.flowbus.bus.BusProvider#registerCustomBus}.</p>
 *
 * @param type The kind of bus
 * @param name The custom bus name, only for {@link BusType#CUSTOM}
 */
public record BusSelector(BusType type, String name) {

  public static final BusSelector SYSTEM = new BusSelector(BusType.SYSTEM, null);
  public static final BusSelector SESSION = new BusSelector(BusType.SESSION, null);

  public BusSelector {
    Objects.requireNonNull(type, "Bus type cannot be null");
    if (type == BusType.CUSTOM) {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("A custom bus needs a name");
      }
    } else if (name != null) {
      throw new IllegalArgumentException("Only custom buses are named");
    }
  }

  /**
   * Selects a custom bus by name.
   *
   * @param name The name the bus was registered under
   * @return The selector
   */
  public static BusSelector custom(String name) {
    return new BusSelector(BusType.CUSTOM, name);
  }

  @Override
  public String toString() {
    return type == BusType.CUSTOM ? "custom:" + name : type.name().toLowerCase();
  }
}

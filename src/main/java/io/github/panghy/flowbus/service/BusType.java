package io.github.panghy.flowbus.service;

/**
 * Which bus a service lives on.
 */
public enum BusType {
  /**
   * The machine-wide system bus.
   */
  SYSTEM,

  /**
   * The per-login session bus.
   */
  SESSION,

  /**
   * A bus registered by name with the {@link io.github.panghy.flowbus.bus.BusProvider}.
   */
  CUSTOM
}

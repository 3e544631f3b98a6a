package io.github.panghy.flowbus.bus;

/**
 * Handle for a watch or a subscription on the bus; closing it cancels it.
 */
@FunctionalInterface
public interface Registration extends AutoCloseable {

  /**
   * Cancels the watch or subscription. Closing twice has no further effect.
   */
  @Override
  void close();
}

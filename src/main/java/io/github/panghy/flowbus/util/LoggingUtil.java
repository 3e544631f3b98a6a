package io.github.panghy.flowbus.util;

import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logging helpers for FlowBus on top of JUL (java.util.logging).
 *
 * <p>Records are attributed to the class and method that called the helper, not to
 * this class, so log output points at the bus role that produced it. Message
 * suppliers are only evaluated when the level is enabled, which keeps per-call
 * debug logging on the marshaling path free when FINE is off.</p>
 */
public final class LoggingUtil {

  private static final StackWalker WALKER = StackWalker.getInstance();

  private LoggingUtil() {
  }

  private static StackWalker.StackFrame caller() {
    return WALKER.walk(frames -> frames
        .filter(f -> !f.getClassName().equals(LoggingUtil.class.getName()))
        .findFirst()
        .orElseThrow());
  }

  private static void log(Logger logger, Level level, Supplier<String> message, Throwable throwable) {
    if (!logger.isLoggable(level)) {
      return;
    }
    StackWalker.StackFrame frame = caller();
    if (throwable == null) {
      logger.logp(level, frame.getClassName(), frame.getMethodName(), message.get());
    } else {
      logger.logp(level, frame.getClassName(), frame.getMethodName(), message.get(), throwable);
    }
  }

  /**
   * Logs a debug (FINE) message built lazily.
   *
   * @param logger  The logger to use
   * @param message Supplier of the message
   */
  public static void debug(Logger logger, Supplier<String> message) {
    log(logger, Level.FINE, message, null);
  }

  /**
   * Logs an info message.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void info(Logger logger, String message) {
    log(logger, Level.INFO, () -> message, null);
  }

  /**
   * Logs a warning message.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void warn(Logger logger, String message) {
    log(logger, Level.WARNING, () -> message, null);
  }

  /**
   * Logs a warning message with the exception that caused it.
   *
   * @param logger    The logger to use
   * @param message   The message to log
   * @param throwable The exception to log
   */
  public static void warn(Logger logger, String message, Throwable throwable) {
    log(logger, Level.WARNING, () -> message, throwable);
  }
}

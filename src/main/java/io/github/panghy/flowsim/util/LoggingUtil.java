package io.github.panghy.flowsim.util;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logging helpers shared by the clocks, processes and workers.
 * Records are attributed to the calling class and method rather than to this class.
 */
public final class LoggingUtil {

  private LoggingUtil() {
  }

  private static StackTraceElement getCaller() {
    StackTraceElement[] stack = Thread.currentThread().getStackTrace();
    // 0=getStackTrace, 1=getCaller, 2=log
    for (int i = 3; i < stack.length; i++) {
      if (!stack[i].getClassName().equals(LoggingUtil.class.getName())) {
        return stack[i];
      }
    }
    return stack[stack.length - 1];
  }

  private static void log(Logger logger, Level level, String message, Throwable throwable) {
    if (!logger.isLoggable(level)) {
      return;
    }
    StackTraceElement caller = getCaller();
    if (throwable == null) {
      logger.logp(level, caller.getClassName(), caller.getMethodName(), message);
    } else {
      logger.logp(level, caller.getClassName(), caller.getMethodName(), message, throwable);
    }
  }

  /**
   * Logs a message at FINE, used for step and message tracing.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void debug(Logger logger, String message) {
    log(logger, Level.FINE, message, null);
  }

  /**
   * Logs a message at INFO, used for run summaries and worker lifecycle.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void info(Logger logger, String message) {
    log(logger, Level.INFO, message, null);
  }

  /**
   * Logs a recoverable diagnostic at WARNING.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void warn(Logger logger, String message) {
    log(logger, Level.WARNING, message, null);
  }

  /**
   * Logs a recoverable fault at WARNING with its stack trace.
   *
   * @param logger    The logger to use
   * @param message   The message to log
   * @param throwable The fault
   */
  public static void warn(Logger logger, String message, Throwable throwable) {
    log(logger, Level.WARNING, message, throwable);
  }

  /**
   * Logs a fatal fault at SEVERE with its stack trace.
   *
   * @param logger    The logger to use
   * @param message   The message to log
   * @param throwable The fault
   */
  public static void error(Logger logger, String message, Throwable throwable) {
    log(logger, Level.SEVERE, message, throwable);
  }
}

package io.arbor.utils;

import org.slf4j.Logger;

import static java.util.Objects.requireNonNull;

/**
 * Guards SLF4J calls with the level checks of the wrapped logger.
 */
public final class LogWrapper {

  /** Logger. */
  private final Logger logger;

  /**
   * Constructor.
   *
   * @param logger logger
   */
  public LogWrapper(final Logger logger) {
    this.logger = requireNonNull(logger);
  }

  /**
   * Log debugging information.
   *
   * @param message message pattern
   * @param arguments arguments of the pattern
   */
  public void debug(final String message, final Object... arguments) {
    if (logger.isDebugEnabled()) {
      logger.debug(message, arguments);
    }
  }

  /**
   * Log a warning.
   *
   * @param message message pattern
   * @param arguments arguments of the pattern, the last one may be a throwable
   */
  public void warn(final String message, final Object... arguments) {
    if (logger.isWarnEnabled()) {
      logger.warn(message, arguments);
    }
  }
}

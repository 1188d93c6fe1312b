package ca.gc.cra.tracing.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts tracing log levels at runtime.
 * <p><strong>Why:</strong> Lets operators turn on debug output for enablement changes and capture sessions through
 * configuration ({@code logging.verbose}) without editing logback files.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single thread bootstrapping the runtime.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String TRACING_LOGGER = "ca.gc.cra.tracing";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the {@code ca.gc.cra.tracing} logger to DEBUG.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(TRACING_LOGGER);
      if (!Level.DEBUG.equals(logger.getLevel())) {
        logger.setLevel(Level.DEBUG);
        log.debug("Verbose tracing logging enabled");
      }
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}

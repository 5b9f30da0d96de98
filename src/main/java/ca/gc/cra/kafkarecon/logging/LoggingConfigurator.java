package ca.gc.cra.kafkarecon.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures runtime logging for the interactive recon shell.
 * <p><strong>Why:</strong> Lets operators raise verbosity (including the Kafka client's own loggers) while
 * troubleshooting a connection without editing {@code logback.xml}.
 * <p><strong>Thread-safety:</strong> Intended for the single bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String KAFKA_CLIENT_LOGGER = "org.apache.kafka";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger and the Kafka client loggers to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!Level.DEBUG.equals(root.getLevel())) {
        root.setLevel(Level.DEBUG);
      }
      context.getLogger(KAFKA_CLIENT_LOGGER).setLevel(Level.DEBUG);
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}

/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and keep client secrets out of operator output.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Security:</strong> Provides redaction helpers so passwords and JAAS settings loaded from configuration
 * files never reach the console or the log.
 *
 * @since 0.1.0
 */
package ca.gc.cra.kafkarecon.logging;

package ca.gc.cra.kafkarecon.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission.
 * <p><strong>Why:</strong> Lets the connection manager and discoverer count failures and time requests without
 * binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates.</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code recon.metadata.failure})
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier using dotted naming
   * @param value observed value (e.g., milliseconds); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}

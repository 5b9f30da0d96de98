/**
 * Metrics adapter bridging {@link ca.gc.cra.kafkarecon.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Thread-safe; instruments are cached per metric key.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code recon.*} namespace.</p>
 * <p><strong>Security:</strong> Only counters and latencies are exported; no configuration values or cluster data.</p>
 */
package ca.gc.cra.kafkarecon.infrastructure.metrics;

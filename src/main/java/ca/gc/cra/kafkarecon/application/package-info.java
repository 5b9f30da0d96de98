/**
 * <strong>Purpose:</strong> The recon engine: session lifecycle, connection management, and cluster discovery.
 * <p><strong>Pipeline role:</strong> {@code load -> connect -> cluster -> disconnect}, repeatable within one process.
 * <p><strong>Concurrency:</strong> One command at a time per session; the session rejects overlapping operations.
 * <p><strong>Observability:</strong> Operator diagnostics go through {@code ReconOutput}; counters through
 * {@code MetricsPort}; debug detail through SLF4J.
 *
 * @since 0.1.0
 */
package ca.gc.cra.kafkarecon.application;

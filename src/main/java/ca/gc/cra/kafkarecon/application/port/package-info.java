/**
 * <strong>Purpose:</strong> Ports between the recon engine and the outside world: Kafka clients, operator output,
 * and metrics.
 * <p><strong>Role:</strong> Application layer contracts; adapters in {@code ca.gc.cra.kafkarecon.adapter.kafka},
 * {@code ca.gc.cra.kafkarecon.api}, and {@code ca.gc.cra.kafkarecon.infrastructure} implement them.</p>
 * <p><strong>Concurrency:</strong> Client ports are used by one session thread at a time.</p>
 * <p><strong>Observability:</strong> Failures cross the boundary as checked exceptions so the engine can
 * report them per handle or per broker.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.kafkarecon.application.port;

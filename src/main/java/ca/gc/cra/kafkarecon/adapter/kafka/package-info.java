/**
 * Kafka adapters implementing the recon client ports with {@code kafka-clients}.
 * <p><strong>Role:</strong> Adapter layer; implements {@link ca.gc.cra.kafkarecon.application.port.ClientFactory},
 * {@link ca.gc.cra.kafkarecon.application.port.AdminPort} and
 * {@link ca.gc.cra.kafkarecon.application.port.ConsumerPort}.</p>
 * <p><strong>Concurrency:</strong> Each adapter wraps one client used from the session thread.</p>
 * <p><strong>Security:</strong> PEM material is read from the configured paths and passed inline to the client;
 * file contents are never logged.</p>
 */
package ca.gc.cra.kafkarecon.adapter.kafka;

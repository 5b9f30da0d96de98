/**
 * Domain representations of discovered cluster topology and broker configuration.
 * <p><strong>Role:</strong> Values produced by the Kafka adapters and consumed by the cluster discoverer.</p>
 * <p><strong>Concurrency:</strong> Types are immutable; safe across threads.</p>
 * <p><strong>Security:</strong> Snapshot claims (origin broker, controller) are untrusted until validated against
 * the broker set.</p>
 */
package ca.gc.cra.kafkarecon.domain.cluster;

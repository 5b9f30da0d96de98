/**
 * <strong>Purpose:</strong> Cluster discovery: topology metadata, identity claim validation, and per-broker
 * security configuration review.
 * <p><strong>Pipeline:</strong> metadata fetch, broker validation, then (admin sessions only) one configuration
 * request per broker.</p>
 * <p><strong>Concurrency:</strong> Runs on the session thread under the session's exclusive guard.</p>
 * <p><strong>Observability:</strong> Emits {@code recon.metadata.*}, {@code recon.validation.mismatch}, and
 * {@code recon.broker.config.*}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.kafkarecon.application.discovery;

/**
 * <strong>Purpose:</strong> Command-line entry point and interactive shell of kafka-recon.
 * <p><strong>Role:</strong> Adapter layer on the operator side; parses process arguments, runs the
 * read-evaluate-report loop, and renders diagnostics and tables on stdout.</p>
 * <p><strong>Concurrency:</strong> The shell runs on the main thread; a shutdown hook releases client handles on
 * interrupt.</p>
 * <p><strong>Security:</strong> Configuration values whose keys name credentials are redacted before display.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.kafkarecon.api;

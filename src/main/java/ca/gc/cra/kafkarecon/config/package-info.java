/**
 * Client configuration store, JSON loading, and discovery policy for the recon shell.
 * <p><strong>Role:</strong> Session bootstrap layer; the {@link ca.gc.cra.kafkarecon.config.ConfigStore} feeds the
 * connection manager and the {@link ca.gc.cra.kafkarecon.config.ReconPolicy} bounds discovery.</p>
 * <p><strong>Concurrency:</strong> The store is mutable and owned by one session; policies are immutable.</p>
 * <p><strong>Security:</strong> Values of credential keys are redacted before display; see
 * {@code ca.gc.cra.kafkarecon.logging.Logs}.</p>
 */
package ca.gc.cra.kafkarecon.config;

/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing, policy loading, and shell commands.
 * <p><strong>Role:</strong> Domain support; rejects invalid operator input before the Kafka adapters allocate
 * clients or open files.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 * <p><strong>Security:</strong> Rejects control characters so operator input cannot inject terminal escapes
 * into shell output.
 *
 * @since 0.1.0
 */
package ca.gc.cra.kafkarecon.validation;

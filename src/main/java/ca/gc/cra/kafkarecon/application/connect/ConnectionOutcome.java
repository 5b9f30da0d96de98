package ca.gc.cra.kafkarecon.application.connect;

import java.util.Optional;

/**
 * Summary of one connect attempt.
 *
 * @param adminConnected whether an admin handle was built
 * @param consumerConnected whether a consumer handle was built
 * @param resolvedBroker bootstrap address selected for this attempt, empty when the attempt aborted first
 * @param generatedGroupId consumer group id synthesized for this attempt, if any
 * @since 0.1.0
 */
public record ConnectionOutcome(
    boolean adminConnected,
    boolean consumerConnected,
    Optional<String> resolvedBroker,
    Optional<String> generatedGroupId) {

  static ConnectionOutcome aborted(Optional<String> generatedGroupId) {
    return new ConnectionOutcome(false, false, Optional.empty(), generatedGroupId);
  }
}

package ca.gc.cra.kafkarecon.config;

import ca.gc.cra.kafkarecon.validation.Numbers;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable discovery policy applied by the cluster discoverer.
 * <p><strong>Why:</strong> Request ceilings and display widths are operator policy, not protocol requirements.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; safe to share.</p>
 *
 * @param requestTimeout ceiling for each blocking metadata or configuration request
 * @param nameWidth maximum characters of a configuration name shown in reports
 * @param valueWidth maximum characters of a configuration value shown in reports
 * @param brokerConfigAllowList broker configuration names included in reports
 * @since 0.1.0
 */
public record ReconPolicy(
    Duration requestTimeout,
    int nameWidth,
    int valueWidth,
    Set<String> brokerConfigAllowList) {

  static final long MAX_TIMEOUT_MS = 600_000L;
  static final int MAX_WIDTH = 1_024;

  /**
   * Validates bounds and copies the allow-list.
   */
  public ReconPolicy {
    Objects.requireNonNull(requestTimeout, "requestTimeout");
    Numbers.requireRange("requestTimeoutMs", requestTimeout.toMillis(), 1, MAX_TIMEOUT_MS);
    Numbers.requireRange("nameWidth", nameWidth, 1, MAX_WIDTH);
    Numbers.requireRange("valueWidth", valueWidth, 1, MAX_WIDTH);
    brokerConfigAllowList = Set.copyOf(Objects.requireNonNull(brokerConfigAllowList, "brokerConfigAllowList"));
  }

  /**
   * Built-in policy used when no policy document is available.
   *
   * @return 15 second requests, 40/20 character columns, TLS client authentication only
   */
  public static ReconPolicy defaults() {
    return new ReconPolicy(Duration.ofSeconds(15), 40, 20, Set.of("ssl.client.auth"));
  }
}

package ca.gc.cra.kafkarecon.domain.cluster;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable result of one topology query.
 * <p><strong>Why:</strong> Reports and identity checks run against a single consistent view of the cluster.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param clusterId cluster identifier; {@code null} when the responder did not expose one
 * @param originBrokerName name of the broker that served this snapshot
 * @param originBrokerId claimed id of the broker that served this snapshot
 * @param controllerId claimed id of the controller
 * @param brokers cluster members keyed by id
 * @since 0.1.0
 */
public record MetadataSnapshot(
    String clusterId,
    String originBrokerName,
    int originBrokerId,
    int controllerId,
    Map<Integer, BrokerRecord> brokers) {

  /** Id used when a responder reports no broker for a claim. */
  public static final int UNKNOWN_BROKER_ID = -1;

  public MetadataSnapshot {
    Objects.requireNonNull(originBrokerName, "originBrokerName");
    brokers = Map.copyOf(Objects.requireNonNull(brokers, "brokers"));
  }

  /**
   * Returns the brokers ordered by ascending id.
   *
   * @return sorted immutable list
   */
  public List<BrokerRecord> sortedBrokers() {
    return brokers.values().stream()
        .sorted(Comparator.comparingInt(BrokerRecord::id))
        .toList();
  }

  /**
   * Checks a broker id claim against the member list.
   *
   * @param brokerId claimed id
   * @return {@code true} when the id names a member of this snapshot
   */
  public boolean isMember(int brokerId) {
    return brokers.containsKey(brokerId);
  }

  public boolean originValid() {
    return isMember(originBrokerId);
  }

  public boolean controllerValid() {
    return isMember(controllerId);
  }
}

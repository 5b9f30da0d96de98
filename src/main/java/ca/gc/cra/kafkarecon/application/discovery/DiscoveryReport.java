package ca.gc.cra.kafkarecon.application.discovery;

import ca.gc.cra.kafkarecon.domain.cluster.MetadataSnapshot;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one {@link ClusterDiscoverer#describeCluster} run.
 *
 * @param stage how far discovery progressed
 * @param snapshot topology snapshot, present once metadata was fetched
 * @param originValid whether the origin broker claim names a member
 * @param controllerValid whether the controller claim names a member
 * @param describedBrokers brokers whose configuration was fetched, in request order
 * @param failedBrokers brokers whose configuration request failed, with the reported reason
 * @since 0.1.0
 */
public record DiscoveryReport(
    Stage stage,
    Optional<MetadataSnapshot> snapshot,
    boolean originValid,
    boolean controllerValid,
    List<Integer> describedBrokers,
    Map<Integer, String> failedBrokers) {

  /** Progress marker of a discovery run. */
  public enum Stage {
    /** No handle was present; nothing was requested. */
    NOT_CONNECTED,
    /** The topology request failed; nothing further was reported. */
    METADATA_FAILED,
    /** Topology was reported and, for admin sessions, every broker was attempted. */
    COMPLETED
  }

  public DiscoveryReport {
    Objects.requireNonNull(stage, "stage");
    Objects.requireNonNull(snapshot, "snapshot");
    describedBrokers = List.copyOf(describedBrokers);
    failedBrokers = Collections.unmodifiableMap(new LinkedHashMap<>(failedBrokers));
  }

  static DiscoveryReport notConnected() {
    return new DiscoveryReport(Stage.NOT_CONNECTED, Optional.empty(), false, false, List.of(), Map.of());
  }

  static DiscoveryReport metadataFailed() {
    return new DiscoveryReport(Stage.METADATA_FAILED, Optional.empty(), false, false, List.of(), Map.of());
  }

  /**
   * Counts identity claims that did not match the broker set.
   *
   * @return 0, 1, or 2
   */
  public int mismatches() {
    if (snapshot.isEmpty()) {
      return 0;
    }
    return (originValid ? 0 : 1) + (controllerValid ? 0 : 1);
  }
}

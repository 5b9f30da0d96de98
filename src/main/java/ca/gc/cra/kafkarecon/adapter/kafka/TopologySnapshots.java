package ca.gc.cra.kafkarecon.adapter.kafka;

import ca.gc.cra.kafkarecon.domain.cluster.BrokerRecord;
import ca.gc.cra.kafkarecon.domain.cluster.MetadataSnapshot;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.apache.kafka.common.Node;

/**
 * Builds {@link MetadataSnapshot} values from the node views returned by the Java clients.
 *
 * <p>The Java clients do not report which broker answered a metadata request. The origin is derived by matching
 * the bootstrap address this handle was built with against the advertised listeners; when none matches, the
 * origin is named after the bootstrap address and carries {@link MetadataSnapshot#UNKNOWN_BROKER_ID}.</p>
 */
final class TopologySnapshots {
  static final String BOOTSTRAP_SUFFIX = "/bootstrap";

  private TopologySnapshots() {
    // Utility
  }

  /**
   * Assembles a snapshot.
   *
   * @param clusterId cluster id, or {@code null} when unknown
   * @param nodes advertised brokers; empty or {@code null} nodes are skipped
   * @param controller controller node, or {@code null} when not visible to the caller
   * @param bootstrap bootstrap address the handle was built with
   * @return snapshot with origin resolved against {@code bootstrap}
   */
  static MetadataSnapshot fromNodes(String clusterId, Collection<Node> nodes, Node controller, String bootstrap) {
    Map<Integer, BrokerRecord> brokers = new LinkedHashMap<>();
    if (nodes != null) {
      for (Node node : nodes) {
        if (node == null || node.isEmpty() || node.host() == null) {
          continue;
        }
        brokers.putIfAbsent(node.id(), new BrokerRecord(node.id(), node.host(), node.port()));
      }
    }
    int controllerId = (controller == null || controller.isEmpty())
        ? MetadataSnapshot.UNKNOWN_BROKER_ID
        : controller.id();

    String endpoint = normalizeEndpoint(bootstrap);
    for (BrokerRecord broker : brokers.values()) {
      if (broker.endpoint().toLowerCase(Locale.ROOT).equals(endpoint)) {
        return new MetadataSnapshot(
            clusterId, broker.endpoint() + "/" + broker.id(), broker.id(), controllerId, brokers);
      }
    }
    return new MetadataSnapshot(
        clusterId, endpoint + BOOTSTRAP_SUFFIX, MetadataSnapshot.UNKNOWN_BROKER_ID, controllerId, brokers);
  }

  /**
   * Strips an optional listener prefix ({@code SSL://}) and lowercases the host part.
   */
  static String normalizeEndpoint(String bootstrap) {
    if (bootstrap == null) {
      return "";
    }
    String trimmed = bootstrap.trim();
    int scheme = trimmed.indexOf("://");
    if (scheme >= 0) {
      trimmed = trimmed.substring(scheme + 3);
    }
    return trimmed.toLowerCase(Locale.ROOT);
  }
}

package ca.gc.cra.kafkarecon.adapter.kafka;

import ca.gc.cra.kafkarecon.application.port.ClusterQueryException;
import ca.gc.cra.kafkarecon.application.port.ConsumerPort;
import ca.gc.cra.kafkarecon.domain.cluster.MetadataSnapshot;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.errors.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ConsumerPort} backed by a Kafka {@link Consumer}.
 * <p><strong>Why:</strong> Principals without admin rights can still enumerate brokers through the partition
 * metadata every consumer is allowed to fetch.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Collect brokers from the leader and replica nodes of every visible partition.</li>
 *   <li>Report the cluster id announced to the consumer's {@link ClusterIdListener}.</li>
 * </ul>
 * <p>The controller is not visible to consumers and is reported as
 * {@link MetadataSnapshot#UNKNOWN_BROKER_ID}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; consumers are single-threaded.</p>
 *
 * @since 0.1.0
 */
final class KafkaConsumerAdapter implements ConsumerPort {
  private static final Logger log = LoggerFactory.getLogger(KafkaConsumerAdapter.class);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final Consumer<byte[], byte[]> consumer;
  private final ClusterIdListener clusterIds;
  private final String bootstrap;

  KafkaConsumerAdapter(Consumer<byte[], byte[]> consumer, ClusterIdListener clusterIds, String bootstrap) {
    this.consumer = Objects.requireNonNull(consumer, "consumer");
    this.clusterIds = Objects.requireNonNull(clusterIds, "clusterIds");
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
  }

  @Override
  public MetadataSnapshot listTopologyMetadata(Duration timeout) throws ClusterQueryException {
    Objects.requireNonNull(timeout, "timeout");
    Map<String, List<PartitionInfo>> topics;
    try {
      topics = consumer.listTopics(timeout);
    } catch (TimeoutException ex) {
      throw new ClusterQueryException("Timed out after " + timeout.toMillis() + " ms", ex);
    } catch (KafkaException ex) {
      throw new ClusterQueryException(KafkaErrors.describe(ex), ex);
    }

    List<Node> nodes = new ArrayList<>();
    for (List<PartitionInfo> partitions : topics.values()) {
      for (PartitionInfo partition : partitions) {
        nodes.add(partition.leader());
        if (partition.replicas() != null) {
          nodes.addAll(Arrays.asList(partition.replicas()));
        }
      }
    }
    nodes.removeIf(Objects::isNull);
    MetadataSnapshot snapshot =
        TopologySnapshots.fromNodes(clusterIds.clusterId().orElse(null), nodes, null, bootstrap);
    log.debug("Consumer metadata from {} lists {} topics and {} brokers",
        bootstrap, topics.size(), snapshot.brokers().size());
    return snapshot;
  }

  @Override
  public void close() {
    consumer.close(CLOSE_TIMEOUT);
  }
}

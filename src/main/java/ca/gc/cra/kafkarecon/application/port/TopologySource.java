package ca.gc.cra.kafkarecon.application.port;

import ca.gc.cra.kafkarecon.domain.cluster.MetadataSnapshot;
import java.time.Duration;

/**
 * <strong>What:</strong> Client capability that can describe cluster topology.
 * <p><strong>Role:</strong> Common contract of {@link AdminPort} and {@link ConsumerPort}; the discoverer fetches
 * metadata from whichever handle is present.</p>
 * <p><strong>Thread-safety:</strong> Implementations need not be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface TopologySource extends AutoCloseable {

  /**
   * Fetches a topology snapshot.
   *
   * @param timeout ceiling for the blocking request
   * @return snapshot describing the cluster members and identity claims
   * @throws ClusterQueryException on timeout or protocol failure
   */
  MetadataSnapshot listTopologyMetadata(Duration timeout) throws ClusterQueryException;

  /**
   * Releases the underlying client.
   */
  @Override
  void close();
}

package ca.gc.cra.kafkarecon.application.port;

import ca.gc.cra.kafkarecon.domain.cluster.ResourceConfigEntry;
import java.time.Duration;
import java.util.Map;

/**
 * Administrative client capability used read-only by the recon engine.
 *
 * @since 0.1.0
 */
public interface AdminPort extends TopologySource {

  /**
   * Describes the broker-scoped configuration resource of one broker.
   *
   * @param brokerId broker id taken from a metadata snapshot
   * @param timeout ceiling for the blocking request
   * @return entries keyed by configuration name
   * @throws ClusterQueryException on timeout, authorization, or protocol failure
   */
  Map<String, ResourceConfigEntry> describeBrokerConfig(int brokerId, Duration timeout)
      throws ClusterQueryException;
}

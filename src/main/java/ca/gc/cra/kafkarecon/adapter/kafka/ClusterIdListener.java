package ca.gc.cra.kafkarecon.adapter.kafka;

import java.util.Optional;
import org.apache.kafka.common.ClusterResource;
import org.apache.kafka.common.ClusterResourceListener;
import org.apache.kafka.common.serialization.Deserializer;

/**
 * Pass-through key deserializer that captures the cluster id announced in consumer metadata responses.
 *
 * <p>The consumer API exposes no cluster id; the client notifies deserializers implementing
 * {@link ClusterResourceListener} whenever its metadata is refreshed.</p>
 */
final class ClusterIdListener implements Deserializer<byte[]>, ClusterResourceListener {
  private volatile String clusterId;

  @Override
  public void onUpdate(ClusterResource clusterResource) {
    if (clusterResource != null && clusterResource.clusterId() != null) {
      this.clusterId = clusterResource.clusterId();
    }
  }

  @Override
  public byte[] deserialize(String topic, byte[] data) {
    return data;
  }

  Optional<String> clusterId() {
    return Optional.ofNullable(clusterId);
  }
}

package ca.gc.cra.kafkarecon.adapter.kafka;

import ca.gc.cra.kafkarecon.application.port.AdminPort;
import ca.gc.cra.kafkarecon.application.port.ClusterQueryException;
import ca.gc.cra.kafkarecon.domain.cluster.MetadataSnapshot;
import ca.gc.cra.kafkarecon.domain.cluster.ResourceConfigEntry;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.Config;
import org.apache.kafka.clients.admin.ConfigEntry;
import org.apache.kafka.clients.admin.DescribeClusterOptions;
import org.apache.kafka.clients.admin.DescribeClusterResult;
import org.apache.kafka.clients.admin.DescribeConfigsOptions;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.config.ConfigResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link AdminPort} backed by a Kafka {@link Admin} client.
 * <p><strong>Why:</strong> The admin API exposes the controller and broker configuration, which consumers cannot
 * see.</p>
 * <p><strong>Thread-safety:</strong> The wrapped client is thread-safe; the adapter adds no state.</p>
 *
 * @since 0.1.0
 */
final class KafkaAdminAdapter implements AdminPort {
  private static final Logger log = LoggerFactory.getLogger(KafkaAdminAdapter.class);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final Admin admin;
  private final String bootstrap;

  KafkaAdminAdapter(Admin admin, String bootstrap) {
    this.admin = Objects.requireNonNull(admin, "admin");
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
  }

  @Override
  public MetadataSnapshot listTopologyMetadata(Duration timeout) throws ClusterQueryException {
    int timeoutMs = timeoutMillis(timeout);
    try {
      DescribeClusterResult result = admin.describeCluster(new DescribeClusterOptions().timeoutMs(timeoutMs));
      KafkaFuture.allOf(result.clusterId(), result.controller(), result.nodes())
          .get(timeoutMs, TimeUnit.MILLISECONDS);
      MetadataSnapshot snapshot = TopologySnapshots.fromNodes(
          result.clusterId().get(), result.nodes().get(), result.controller().get(), bootstrap);
      log.debug("Admin metadata from {} lists {} brokers", bootstrap, snapshot.brokers().size());
      return snapshot;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new ClusterQueryException("Interrupted while waiting for cluster metadata", ex);
    } catch (ExecutionException ex) {
      throw new ClusterQueryException(KafkaErrors.describe(ex.getCause()), ex.getCause());
    } catch (java.util.concurrent.TimeoutException ex) {
      throw new ClusterQueryException("Timed out after " + timeoutMs + " ms", ex);
    } catch (KafkaException ex) {
      throw new ClusterQueryException(KafkaErrors.describe(ex), ex);
    }
  }

  @Override
  public Map<String, ResourceConfigEntry> describeBrokerConfig(int brokerId, Duration timeout)
      throws ClusterQueryException {
    int timeoutMs = timeoutMillis(timeout);
    ConfigResource resource = new ConfigResource(ConfigResource.Type.BROKER, Integer.toString(brokerId));
    try {
      Config config = admin.describeConfigs(List.of(resource), new DescribeConfigsOptions().timeoutMs(timeoutMs))
          .values()
          .get(resource)
          .get(timeoutMs, TimeUnit.MILLISECONDS);
      return toEntries(config);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new ClusterQueryException("Interrupted while describing broker " + brokerId, ex);
    } catch (ExecutionException ex) {
      throw new ClusterQueryException(KafkaErrors.describe(ex.getCause()), ex.getCause());
    } catch (java.util.concurrent.TimeoutException ex) {
      throw new ClusterQueryException("Timed out after " + timeoutMs + " ms", ex);
    } catch (KafkaException ex) {
      throw new ClusterQueryException(KafkaErrors.describe(ex), ex);
    }
  }

  @Override
  public void close() {
    admin.close(CLOSE_TIMEOUT);
  }

  static Map<String, ResourceConfigEntry> toEntries(Config config) {
    Map<String, ResourceConfigEntry> entries = new LinkedHashMap<>();
    if (config == null) {
      return entries;
    }
    for (ConfigEntry entry : config.entries()) {
      entries.put(entry.name(), new ResourceConfigEntry(
          entry.name(),
          entry.value(),
          entry.source() == null ? null : entry.source().name(),
          entry.isReadOnly(),
          entry.isSensitive()));
    }
    return entries;
  }

  static int timeoutMillis(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    long millis = Math.max(1L, timeout.toMillis());
    return (int) Math.min(Integer.MAX_VALUE, millis);
  }
}

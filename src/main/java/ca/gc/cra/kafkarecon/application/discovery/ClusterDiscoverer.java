package ca.gc.cra.kafkarecon.application.discovery;

import ca.gc.cra.kafkarecon.application.discovery.DiscoveryReport.Stage;
import ca.gc.cra.kafkarecon.application.port.AdminPort;
import ca.gc.cra.kafkarecon.application.port.ClusterQueryException;
import ca.gc.cra.kafkarecon.application.port.ConsumerPort;
import ca.gc.cra.kafkarecon.application.port.MetricsPort;
import ca.gc.cra.kafkarecon.application.port.ReconOutput;
import ca.gc.cra.kafkarecon.application.port.TopologySource;
import ca.gc.cra.kafkarecon.application.session.ReconSession;
import ca.gc.cra.kafkarecon.config.ReconPolicy;
import ca.gc.cra.kafkarecon.domain.cluster.BrokerRecord;
import ca.gc.cra.kafkarecon.domain.cluster.MetadataSnapshot;
import ca.gc.cra.kafkarecon.domain.cluster.ResourceConfigEntry;
import ca.gc.cra.kafkarecon.logging.Logs;
import ca.gc.cra.kafkarecon.validation.Strings;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reports cluster identity, membership, and the security-relevant configuration of every
 * broker reachable through the session's handles.
 * <p><strong>Why:</strong> Metadata responses carry claims (origin broker, controller) that a reviewer must see
 * checked against the advertised broker set, not taken on trust.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Fetch topology from the admin handle when present, otherwise from the consumer handle.</li>
 *   <li>Report and validate origin and controller claims; mismatches are findings, not failures.</li>
 *   <li>Describe each broker's configuration in isolation so one failing broker never hides the others.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds only immutable policy and collaborators; runs under
 * {@link ReconSession#exclusive}.</p>
 *
 * @since 0.1.0
 */
public final class ClusterDiscoverer {
  private static final Logger log = LoggerFactory.getLogger(ClusterDiscoverer.class);

  static final List<String> BROKER_HEADERS = List.of("ID", "Host", "Port");
  static final List<String> CONFIG_HEADERS = List.of("Name", "Value", "Source", "Read Only", "Sensitive");

  private final ReconPolicy policy;
  private final ReconOutput output;
  private final MetricsPort metrics;

  public ClusterDiscoverer(ReconPolicy policy, ReconOutput output, MetricsPort metrics) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.output = Objects.requireNonNull(output, "output");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Runs discovery against the session's current handles.
   *
   * @param session connected (or not) session
   * @return how far discovery progressed and what it found
   * @throws IllegalStateException when another operation is running on the session
   */
  public DiscoveryReport describeCluster(ReconSession session) {
    Objects.requireNonNull(session, "session");
    return session.exclusive("cluster", () -> discover(session));
  }

  private DiscoveryReport discover(ReconSession session) {
    Optional<AdminPort> admin = session.admin();
    Optional<ConsumerPort> consumer = session.consumer();
    TopologySource source;
    if (admin.isPresent()) {
      source = admin.get();
    } else if (consumer.isPresent()) {
      source = consumer.get();
    } else {
      output.failure("Not connected");
      return DiscoveryReport.notConnected();
    }

    Optional<MetadataSnapshot> fetched = fetchMetadata(source);
    if (fetched.isEmpty()) {
      return DiscoveryReport.metadataFailed();
    }
    MetadataSnapshot snapshot = fetched.get();

    output.success("Cluster ID: " + (snapshot.clusterId() == null ? "unknown" : snapshot.clusterId()));
    output.blank();
    output.success("Metadata origin broker name: " + snapshot.originBrokerName());
    output.blank();
    output.table(BROKER_HEADERS, brokerRows(snapshot));
    output.blank();

    boolean originValid = snapshot.originValid();
    if (originValid) {
      output.success("Metadata origin broker ID: " + snapshot.originBrokerId());
    } else {
      metrics.increment("recon.validation.mismatch");
      output.failure("Invalid metadata origin broker ID: " + snapshot.originBrokerId());
    }
    output.blank();
    boolean controllerValid = snapshot.controllerValid();
    if (controllerValid) {
      output.success("Controller broker ID: " + snapshot.controllerId());
    } else {
      metrics.increment("recon.validation.mismatch");
      output.failure("Invalid controller broker ID: " + snapshot.controllerId());
    }
    output.blank();

    List<Integer> described = new ArrayList<>();
    Map<Integer, String> failed = new LinkedHashMap<>();
    if (admin.isPresent()) {
      for (BrokerRecord broker : snapshot.sortedBrokers()) {
        describeBroker(admin.get(), broker.id(), described, failed);
      }
    }
    return new DiscoveryReport(
        Stage.COMPLETED, Optional.of(snapshot), originValid, controllerValid, described, failed);
  }

  private Optional<MetadataSnapshot> fetchMetadata(TopologySource source) {
    long started = System.nanoTime();
    try {
      return Optional.of(source.listTopologyMetadata(policy.requestTimeout()));
    } catch (ClusterQueryException ex) {
      metrics.increment("recon.metadata.failure");
      log.debug("Metadata request failed", ex);
      output.failure("Could not query metadata: " + ex.getMessage());
      output.blank();
      return Optional.empty();
    } finally {
      metrics.observe("recon.metadata.latencyMs", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
    }
  }

  private void describeBroker(
      AdminPort admin, int brokerId, List<Integer> described, Map<Integer, String> failed) {
    Map<String, ResourceConfigEntry> entries;
    try {
      entries = admin.describeBrokerConfig(brokerId, policy.requestTimeout());
    } catch (ClusterQueryException | RuntimeException ex) {
      String reason = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
      metrics.increment("recon.broker.config.failure");
      log.debug("Configuration request for broker {} failed", brokerId, ex);
      failed.put(brokerId, reason);
      output.failure("Could not describe broker " + brokerId + ": " + reason);
      output.blank();
      return;
    }
    metrics.increment("recon.broker.config.success");
    described.add(brokerId);

    List<List<Object>> rows = configRows(entries);
    if (rows.isEmpty()) {
      output.failure("Broker " + brokerId + ": no reviewed configuration entries returned");
    } else {
      output.success("Broker " + brokerId + " configuration:");
      output.blank();
      output.table(CONFIG_HEADERS, rows);
    }
    output.blank();
  }

  static List<List<Object>> brokerRows(MetadataSnapshot snapshot) {
    List<List<Object>> rows = new ArrayList<>();
    for (BrokerRecord broker : snapshot.sortedBrokers()) {
      rows.add(List.of(broker.id(), broker.host(), broker.port()));
    }
    return rows;
  }

  /**
   * Filters entries to the allow-list and formats them as display rows sorted by name.
   */
  List<List<Object>> configRows(Map<String, ResourceConfigEntry> entries) {
    List<List<Object>> rows = new ArrayList<>();
    for (ResourceConfigEntry entry : new TreeMap<>(entries).values()) {
      if (!policy.brokerConfigAllowList().contains(entry.name())) {
        continue;
      }
      rows.add(List.of(
          Strings.truncate(entry.name(), policy.nameWidth()),
          displayValue(entry),
          entry.source(),
          entry.readOnly() ? "Yes" : "",
          entry.sensitive() ? "Yes" : ""));
    }
    return rows;
  }

  private String displayValue(ResourceConfigEntry entry) {
    if (entry.value() == null) {
      return "-";
    }
    if (entry.sensitive()) {
      return Logs.redact(entry.value());
    }
    return Strings.truncate(entry.value(), policy.valueWidth());
  }
}

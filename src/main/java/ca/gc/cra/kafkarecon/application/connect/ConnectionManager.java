package ca.gc.cra.kafkarecon.application.connect;

import static ca.gc.cra.kafkarecon.config.ClientConfigKeys.ADMIN_KEYS;
import static ca.gc.cra.kafkarecon.config.ClientConfigKeys.BOOTSTRAP_SERVERS;
import static ca.gc.cra.kafkarecon.config.ClientConfigKeys.ENABLE_PARTITION_EOF;
import static ca.gc.cra.kafkarecon.config.ClientConfigKeys.GROUP_ID;

import ca.gc.cra.kafkarecon.application.port.AdminPort;
import ca.gc.cra.kafkarecon.application.port.ClientCreationException;
import ca.gc.cra.kafkarecon.application.port.ClientFactory;
import ca.gc.cra.kafkarecon.application.port.ConsumerPort;
import ca.gc.cra.kafkarecon.application.port.MetricsPort;
import ca.gc.cra.kafkarecon.application.port.ReconOutput;
import ca.gc.cra.kafkarecon.application.port.TopologySource;
import ca.gc.cra.kafkarecon.application.session.ReconSession;
import ca.gc.cra.kafkarecon.config.ConfigMerger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns the session configuration into an admin handle and a consumer handle against one
 * bootstrap broker.
 * <p><strong>Why:</strong> The two clients need different views of the configuration: the admin client only gets
 * security settings, the consumer gets everything plus forced end-of-partition notification.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Synthesize a consumer group id when none is configured.</li>
 *   <li>Pick one bootstrap candidate at random when a list is configured.</li>
 *   <li>Build each handle independently; a failure of one never prevents the other.</li>
 *   <li>Release handles on disconnect, reporting each one.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from collaborators; session access is serialized by
 * {@link ReconSession#exclusive(String, Supplier)}.</p>
 * <p><strong>Observability:</strong> Every outcome is reported through {@link ReconOutput}; counters
 * {@code recon.connect.admin.*} and {@code recon.connect.consumer.*}.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionManager {
  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  private final ClientFactory clients;
  private final ReconOutput output;
  private final MetricsPort metrics;
  private final Random random;
  private final Supplier<String> groupIds;

  /**
   * Creates a manager with random bootstrap selection and UUID based group ids.
   *
   * @param clients factory building Kafka handles
   * @param output operator diagnostic channel
   * @param metrics metrics sink
   */
  public ConnectionManager(ClientFactory clients, ReconOutput output, MetricsPort metrics) {
    this(clients, output, metrics, new Random(), ConnectionManager::randomGroupId);
  }

  ConnectionManager(
      ClientFactory clients,
      ReconOutput output,
      MetricsPort metrics,
      Random random,
      Supplier<String> groupIds) {
    this.clients = Objects.requireNonNull(clients, "clients");
    this.output = Objects.requireNonNull(output, "output");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.random = Objects.requireNonNull(random, "random");
    this.groupIds = Objects.requireNonNull(groupIds, "groupIds");
  }

  /**
   * Builds the session's handles from its configuration.
   *
   * <p>Never throws for configuration or client failures; they are reported and reflected in the outcome.</p>
   *
   * @param session session whose slots are filled
   * @return what was connected
   * @throws IllegalStateException when another operation is running on the session
   */
  public ConnectionOutcome connect(ReconSession session) {
    Objects.requireNonNull(session, "session");
    return session.exclusive("connect", () -> doConnect(session));
  }

  /**
   * Releases whichever handles the session holds.
   *
   * @param session session whose slots are emptied
   * @return {@code true} when at least one handle was released
   * @throws IllegalStateException when another operation is running on the session
   */
  public boolean disconnect(ReconSession session) {
    Objects.requireNonNull(session, "session");
    return session.exclusive("disconnect", () -> {
      if (!session.isConnected()) {
        output.failure("Not connected");
        return false;
      }
      release(session);
      return true;
    });
  }

  private ConnectionOutcome doConnect(ReconSession session) {
    if (session.config().isEmpty()) {
      output.failure("Configuration required");
      return ConnectionOutcome.aborted(Optional.empty());
    }
    if (session.isConnected()) {
      output.success("Closing existing connection to " + session.brokerLabel());
      output.blank();
      release(session);
      output.blank();
    }

    Map<String, Object> effective = session.config().snapshot();
    Optional<String> generatedGroupId = Optional.empty();
    if (!effective.containsKey(GROUP_ID)) {
      String groupId = groupIds.get();
      effective.put(GROUP_ID, groupId);
      generatedGroupId = Optional.of(groupId);
      output.success("Group ID not configured, using: " + groupId);
      output.blank();
    }

    Optional<String> bootstrap = resolveBootstrap(effective.get(BOOTSTRAP_SERVERS));
    if (bootstrap.isEmpty()) {
      output.failure("Bootstrap server not configured");
      return ConnectionOutcome.aborted(generatedGroupId);
    }
    String resolved = bootstrap.get();
    log.debug("Connecting via bootstrap server {}", resolved);

    boolean adminConnected = connectAdmin(session, effective, resolved);
    output.blank();
    boolean consumerConnected = connectConsumer(session, effective, resolved);
    return new ConnectionOutcome(adminConnected, consumerConnected, Optional.of(resolved), generatedGroupId);
  }

  private boolean connectAdmin(ReconSession session, Map<String, Object> effective, String resolved) {
    Map<String, Object> adminConfig = ConfigMerger.project(effective, ADMIN_KEYS);
    adminConfig.put(BOOTSTRAP_SERVERS, resolved);
    try {
      AdminPort handle = clients.createAdmin(adminConfig);
      session.attachAdmin(handle, resolved);
      metrics.increment("recon.connect.admin.success");
      output.success("Admin client connected");
      return true;
    } catch (ClientCreationException | RuntimeException ex) {
      metrics.increment("recon.connect.admin.failure");
      log.debug("Admin client construction failed for {}", resolved, ex);
      output.failure("Admin client connection failed: " + ex.getMessage());
      return false;
    }
  }

  private boolean connectConsumer(ReconSession session, Map<String, Object> effective, String resolved) {
    Map<String, Object> consumerConfig = ConfigMerger.union(
        effective, Map.of(BOOTSTRAP_SERVERS, resolved, ENABLE_PARTITION_EOF, Boolean.TRUE));
    try {
      ConsumerPort handle = clients.createConsumer(consumerConfig);
      session.attachConsumer(handle, resolved);
      metrics.increment("recon.connect.consumer.success");
      output.success("Consumer connected");
      return true;
    } catch (ClientCreationException | RuntimeException ex) {
      metrics.increment("recon.connect.consumer.failure");
      log.debug("Consumer construction failed for {}", resolved, ex);
      output.failure("Consumer connection failed: " + ex.getMessage());
      return false;
    }
  }

  private void release(ReconSession session) {
    session.detachAdmin().ifPresent(handle -> close("Admin", handle));
    session.detachConsumer().ifPresent(handle -> close("Consumer", handle));
  }

  private void close(String kind, TopologySource handle) {
    try {
      handle.close();
      output.success(kind + " disconnected");
    } catch (RuntimeException ex) {
      log.debug("{} close failed", kind, ex);
      output.failure(kind + " close failed: " + ex.getMessage());
    }
  }

  Optional<String> resolveBootstrap(Object configured) {
    if (configured instanceof List<?> candidates) {
      List<String> usable = new ArrayList<>();
      for (Object candidate : candidates) {
        if (candidate != null && !String.valueOf(candidate).isBlank()) {
          usable.add(String.valueOf(candidate).trim());
        }
      }
      if (usable.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(usable.get(random.nextInt(usable.size())));
    }
    if (configured == null || String.valueOf(configured).isBlank()) {
      return Optional.empty();
    }
    return Optional.of(String.valueOf(configured).trim());
  }

  private static String randomGroupId() {
    return UUID.randomUUID().toString().replace("-", "");
  }
}

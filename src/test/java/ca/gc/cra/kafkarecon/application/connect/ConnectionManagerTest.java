package ca.gc.cra.kafkarecon.application.connect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.kafkarecon.application.session.ReconSession;
import ca.gc.cra.kafkarecon.application.support.FakeClientFactory;
import ca.gc.cra.kafkarecon.application.support.RecordingMetrics;
import ca.gc.cra.kafkarecon.application.support.RecordingReconOutput;
import ca.gc.cra.kafkarecon.config.ConfigStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConnectionManagerTest {
  @TempDir Path tempDir;

  private FakeClientFactory clients;
  private RecordingReconOutput output;
  private RecordingMetrics metrics;
  private ConnectionManager manager;
  private ReconSession session;

  @BeforeEach
  void setUp() {
    clients = new FakeClientFactory();
    output = new RecordingReconOutput();
    metrics = new RecordingMetrics();
    manager = new ConnectionManager(clients, output, metrics, new Random(7), () -> "feedface");
    session = new ReconSession(new ConfigStore());
  }

  @Test
  void emptyConfigurationIsRejectedBeforeAnyClientIsBuilt() {
    ConnectionOutcome outcome = manager.connect(session);

    assertFalse(outcome.adminConnected());
    assertFalse(outcome.consumerConnected());
    assertEquals(List.of("-Configuration required"), output.messages());
    assertTrue(clients.adminConfigs.isEmpty());
    assertTrue(clients.consumerConfigs.isEmpty());
  }

  @Test
  void missingBootstrapAbortsAfterGroupIdDefaulting() throws Exception {
    load("{\"security.protocol\": \"SSL\"}");

    ConnectionOutcome outcome = manager.connect(session);

    assertEquals(List.of(
        "+Group ID not configured, using: feedface",
        "-Bootstrap server not configured"), output.messages());
    assertEquals(Optional.of("feedface"), outcome.generatedGroupId());
    assertEquals(Optional.empty(), outcome.resolvedBroker());
    assertTrue(clients.adminConfigs.isEmpty());
    assertTrue(clients.consumerConfigs.isEmpty());
    assertFalse(session.isConnected());
  }

  @Test
  void emptyBootstrapListCountsAsMissing() throws Exception {
    load("{\"bootstrap.servers\": [], \"group.id\": \"g\"}");

    manager.connect(session);

    assertEquals(List.of("-Bootstrap server not configured"), output.messages());
  }

  @Test
  void adminReceivesOnlySecurityKeysAndResolvedBootstrap() throws Exception {
    load("""
        {"bootstrap.servers": "kafka-1:9093", "group.id": "recon", "security.protocol": "SSL",
         "ssl.ca.location": "/etc/ca.pem", "auto.offset.reset": "earliest", "client.id": "x"}
        """);

    manager.connect(session);

    assertEquals(Map.of(
        "bootstrap.servers", "kafka-1:9093",
        "security.protocol", "SSL",
        "ssl.ca.location", "/etc/ca.pem"), clients.adminConfigs.get(0));
  }

  @Test
  void consumerReceivesEverythingPlusOverrides() throws Exception {
    load("""
        {"bootstrap.servers": ["kafka-1:9093"], "group.id": "recon", "auto.offset.reset": "earliest",
         "enable.partition.eof": false}
        """);

    manager.connect(session);

    Map<String, Object> consumer = clients.consumerConfigs.get(0);
    assertEquals("kafka-1:9093", consumer.get("bootstrap.servers"));
    assertEquals("recon", consumer.get("group.id"));
    assertEquals("earliest", consumer.get("auto.offset.reset"));
    assertEquals(Boolean.TRUE, consumer.get("enable.partition.eof"));
  }

  @Test
  void generatedGroupIdIsUsedForThisConnectOnly() throws Exception {
    load("{\"bootstrap.servers\": \"kafka-1:9093\"}");

    manager.connect(session);

    assertEquals("feedface", clients.consumerConfigs.get(0).get("group.id"));
    assertFalse(clients.adminConfigs.get(0).containsKey("group.id"));
    assertFalse(session.config().snapshot().containsKey("group.id"), "store is only mutated by load");
  }

  @Test
  void bootstrapListResolvesToOneOfItsCandidates() throws Exception {
    load("{\"bootstrap.servers\": [\"a:9092\", \"b:9092\", \"c:9092\"], \"group.id\": \"g\"}");
    Set<String> seen = new java.util.HashSet<>();

    for (int i = 0; i < 60; i++) {
      ConnectionOutcome outcome = manager.connect(session);
      seen.add(outcome.resolvedBroker().orElseThrow());
    }

    assertEquals(Set.of("a:9092", "b:9092", "c:9092"), seen);
    Set<Object> adminTargets = clients.adminConfigs.stream()
        .map(c -> c.get("bootstrap.servers"))
        .collect(Collectors.toSet());
    assertTrue(Set.of("a:9092", "b:9092", "c:9092").containsAll(adminTargets));
  }

  @Test
  void successfulConnectLabelsSessionAndCountsSuccesses() throws Exception {
    load("{\"bootstrap.servers\": \"kafka-1:9093\", \"group.id\": \"g\"}");

    ConnectionOutcome outcome = manager.connect(session);

    assertTrue(outcome.adminConnected());
    assertTrue(outcome.consumerConnected());
    assertEquals("kafka-1:9093", session.brokerLabel());
    assertEquals(List.of("+Admin client connected", "+Consumer connected"), output.messages());
    assertEquals(1, metrics.count("recon.connect.admin.success"));
    assertEquals(1, metrics.count("recon.connect.consumer.success"));
  }

  @Test
  void adminFailureDoesNotPreventConsumer() throws Exception {
    load("{\"bootstrap.servers\": \"kafka-1:9093\", \"group.id\": \"g\"}");
    clients.adminFailure = "No resolvable bootstrap urls";

    ConnectionOutcome outcome = manager.connect(session);

    assertFalse(outcome.adminConnected());
    assertTrue(outcome.consumerConnected());
    assertTrue(output.hasFailure("Admin client connection failed: No resolvable bootstrap urls"));
    assertTrue(output.hasSuccess("Consumer connected"));
    assertTrue(session.admin().isEmpty());
    assertTrue(session.consumer().isPresent());
    assertEquals("kafka-1:9093", session.brokerLabel());
    assertEquals(1, metrics.count("recon.connect.admin.failure"));
  }

  @Test
  void bothFailuresLeaveSessionDisconnected() throws Exception {
    load("{\"bootstrap.servers\": \"kafka-1:9093\", \"group.id\": \"g\"}");
    clients.adminFailure = "bad admin";
    clients.consumerFailure = "bad consumer";

    ConnectionOutcome outcome = manager.connect(session);

    assertFalse(outcome.adminConnected());
    assertFalse(outcome.consumerConnected());
    assertEquals(ReconSession.NOT_CONNECTED, session.brokerLabel());
    assertTrue(output.hasFailure("Consumer connection failed: bad consumer"));
  }

  @Test
  void reconnectReleasesPreviousHandles() throws Exception {
    load("{\"bootstrap.servers\": \"kafka-1:9093\", \"group.id\": \"g\"}");
    manager.connect(session);
    output.events.clear();

    manager.connect(session);

    assertEquals(1, clients.admins.get(0).closeCalls);
    assertEquals(1, clients.consumers.get(0).closeCalls);
    assertTrue(output.hasSuccess("Closing existing connection to kafka-1:9093"));
    assertTrue(session.admin().orElseThrow() == clients.admins.get(1));
  }

  @Test
  void disconnectClosesBothAndResetsLabel() throws Exception {
    load("{\"bootstrap.servers\": \"kafka-1:9093\", \"group.id\": \"g\"}");
    manager.connect(session);
    output.events.clear();

    assertTrue(manager.disconnect(session));

    assertEquals(List.of("+Admin disconnected", "+Consumer disconnected"), output.messages());
    assertFalse(session.isConnected());
    assertEquals(ReconSession.NOT_CONNECTED, session.brokerLabel());
    assertEquals(1, clients.admins.get(0).closeCalls);
  }

  @Test
  void disconnectWithoutHandlesReportsNotConnected() {
    assertFalse(manager.disconnect(session));

    assertEquals(List.of("-Not connected"), output.messages());
  }

  @Test
  void disconnectReportsCloseFailurePerHandle() throws Exception {
    load("{\"bootstrap.servers\": \"kafka-1:9093\", \"group.id\": \"g\"}");
    manager.connect(session);
    clients.consumers.get(0).closeFailure = new IllegalStateException("already closed");
    output.events.clear();

    manager.disconnect(session);

    assertEquals(List.of("+Admin disconnected", "-Consumer close failed: already closed"), output.messages());
    assertFalse(session.isConnected());
  }

  @Test
  void defaultGroupIdsAreRandomHexAndFreshPerConnect() throws Exception {
    ConnectionManager defaults = new ConnectionManager(clients, output, metrics);
    load("{\"bootstrap.servers\": \"kafka:9092\"}");

    ConnectionOutcome first = defaults.connect(session);
    ConnectionOutcome second = defaults.connect(session);

    String firstId = first.generatedGroupId().orElseThrow();
    String secondId = second.generatedGroupId().orElseThrow();
    assertTrue(firstId.matches("[0-9a-f]{32}"), firstId);
    assertTrue(secondId.matches("[0-9a-f]{32}"), secondId);
    assertNotEquals(firstId, secondId);
    assertEquals(firstId, clients.consumerConfigs.get(0).get("group.id"));
    assertEquals(secondId, clients.consumerConfigs.get(1).get("group.id"));
    assertFalse(session.config().snapshot().containsKey("group.id"));
    assertTrue(output.hasSuccess("Group ID not configured, using: " + secondId));
  }

  @Test
  void scalarBootstrapResolvesAsIs() {
    assertEquals(Optional.of("kafka:9092"), manager.resolveBootstrap(" kafka:9092 "));
    assertEquals(Optional.empty(), manager.resolveBootstrap("  "));
    assertEquals(Optional.empty(), manager.resolveBootstrap(null));
  }

  private void load(String json) throws Exception {
    Path file = tempDir.resolve("client-" + System.nanoTime() + ".json");
    try {
      Files.writeString(file, json);
    } catch (IOException ex) {
      throw new IllegalStateException(ex);
    }
    session.config().load(file);
  }
}

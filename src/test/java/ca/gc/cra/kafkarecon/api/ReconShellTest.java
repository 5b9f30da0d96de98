package ca.gc.cra.kafkarecon.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.kafkarecon.application.connect.ConnectionManager;
import ca.gc.cra.kafkarecon.application.discovery.ClusterDiscoverer;
import ca.gc.cra.kafkarecon.application.session.ReconSession;
import ca.gc.cra.kafkarecon.application.support.ClusterFixtures;
import ca.gc.cra.kafkarecon.application.support.FakeClientFactory;
import ca.gc.cra.kafkarecon.application.support.RecordingMetrics;
import ca.gc.cra.kafkarecon.config.ReconPolicy;
import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReconShellTest {
  @TempDir Path tempDir;

  private final StringWriter buffer = new StringWriter();
  private final FakeClientFactory clients = new FakeClientFactory();
  private ReconSession session;

  @BeforeEach
  void setUp() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    session = new ReconSession();
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
    session.close();
  }

  @Test
  void startsWithoutConfigurationAndStopsOnEndOfInput() throws Exception {
    ReconShell shell = shell("");

    shell.loadInitial(null);
    shell.run();

    assertTrue(buffer.toString().contains(" (+) Started without initial configuration"));
    assertTrue(buffer.toString().contains(" ┌──(not connected)"));
    assertTrue(buffer.toString().contains(" └─$ "));
  }

  @Test
  void helpListsCommandsAndExitStopsTheLoop() throws Exception {
    ReconShell shell = shell("help\nexit\nconfig\n");

    shell.run();

    String out = buffer.toString();
    assertTrue(out.contains("   Command      Description"));
    assertTrue(out.contains("   load <file>  load kafka config from json file"));
    assertFalse(out.contains("No configuration"));
  }

  @Test
  void unknownCommandsAndBadQuotingAreReported() throws Exception {
    ReconShell shell = shell("scan\nload 'broken\n\n   \nexit\n");

    shell.run();

    String out = buffer.toString();
    assertTrue(out.contains(" (-) Command not found: scan"));
    assertTrue(out.contains(" (-) Could not parse command: No closing quotation"));
  }

  @Test
  void loadRequiresExactlyOneArgument() {
    ReconShell shell = shell("");

    assertTrue(shell.execute(List.of("load")));
    assertTrue(shell.execute(List.of("load", "a.json", "b.json")));

    assertEquals(2, count(" (-) usage: load <file>"));
  }

  @Test
  void loadedConfigurationIsShownWithSecretsRedacted() throws Exception {
    Path file = Files.writeString(tempDir.resolve("lab.json"),
        "{\"bootstrap.servers\": [\"kafka-1:9093\", \"kafka-2:9093\"], \"ssl.key.password\": \"hunter2\"}");
    ReconShell shell = shell("");

    shell.loadInitial(file);
    shell.execute(List.of("config"));

    String out = buffer.toString();
    assertTrue(out.contains(" (+) Loaded configuration from file:"));
    assertTrue(out.contains("   bootstrap.servers  kafka-1:9093"));
    assertTrue(out.contains("    ...               kafka-2:9093"));
    assertTrue(out.contains("[REDACTED]"));
    assertFalse(out.contains("hunter2"));
    assertEquals(2, count("   ssl.key.password"));
  }

  @Test
  void loadFailuresLeaveConfigurationUntouched() throws Exception {
    Path array = Files.writeString(tempDir.resolve("array.json"), "[1, 2]");
    ReconShell shell = shell("");

    shell.execute(List.of("load", array.toString()));
    shell.execute(List.of("load", tempDir.resolve("missing.json").toString()));
    shell.execute(List.of("config"));

    String out = buffer.toString();
    assertTrue(out.contains(" (-) Configuration must be an object"));
    assertTrue(out.contains(" (-) Could not load file: " + tempDir.resolve("missing.json")));
    assertTrue(out.contains(" (-) No configuration"));
  }

  @Test
  void connectUpdatesPromptAndClusterReportsTopology() throws Exception {
    Path file = Files.writeString(tempDir.resolve("lab.json"),
        "{\"bootstrap.servers\": \"kafka-1:9093\", \"group.id\": \"recon\"}");
    ReconShell shell = shell("");
    shell.loadInitial(file);

    shell.execute(List.of("connect"));
    clients.admins.get(0).snapshot = ClusterFixtures.threeBrokers(1, 2);
    clients.admins.get(0).configs.put(1, Map.of("ssl.client.auth",
        ClusterFixtures.entry("ssl.client.auth", "required")));
    shell.execute(List.of("cluster"));

    String out = buffer.toString();
    assertEquals("kafka-1:9093", session.brokerLabel());
    assertTrue(out.contains(" (+) Admin client connected"));
    assertTrue(out.contains(" (+) Consumer connected"));
    assertTrue(out.contains(" (+) Cluster ID: lkc-123"));
    assertTrue(out.contains(" (+) Broker 1 configuration:"));
    assertTrue(out.contains("   ssl.client.auth  required  STATIC_BROKER_CONFIG  Yes"));
  }

  @Test
  void disconnectWithoutConnectionReportsIt() {
    ReconShell shell = shell("");

    shell.execute(List.of("disconnect"));
    shell.execute(List.of("cluster"));
    shell.execute(List.of("connect"));

    assertEquals(2, count(" (-) Not connected"));
    assertTrue(buffer.toString().contains(" (-) Configuration required"));
  }

  private ReconShell shell(String input) {
    ConsoleReconOutput output = new ConsoleReconOutput();
    RecordingMetrics metrics = new RecordingMetrics();
    return new ReconShell(
        session,
        new ConnectionManager(clients, output, metrics),
        new ClusterDiscoverer(ReconPolicy.defaults(), output, metrics),
        output,
        new BufferedReader(new StringReader(input)));
  }

  private int count(String fragment) {
    String out = buffer.toString();
    int count = 0;
    int from = 0;
    while ((from = out.indexOf(fragment, from)) >= 0) {
      count++;
      from += fragment.length();
    }
    return count;
  }
}

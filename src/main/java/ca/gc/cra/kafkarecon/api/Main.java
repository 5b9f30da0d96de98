package ca.gc.cra.kafkarecon.api;

import ca.gc.cra.kafkarecon.adapter.kafka.KafkaClientFactory;
import ca.gc.cra.kafkarecon.application.connect.ConnectionManager;
import ca.gc.cra.kafkarecon.application.discovery.ClusterDiscoverer;
import ca.gc.cra.kafkarecon.application.session.ReconSession;
import ca.gc.cra.kafkarecon.config.ReconPolicy;
import ca.gc.cra.kafkarecon.config.YamlPolicyLoader;
import ca.gc.cra.kafkarecon.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.kafkarecon.logging.LoggingConfigurator;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * kafka-recon launcher: parses arguments, wires the session, and runs the interactive shell.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: kafka-recon [-c <file> | --config <file>] [policy=<file>] [--verbose] [--help]";
  private static final String HELP_TEXT = """
      kafka-recon: interactive reconnaissance of Apache Kafka clusters

      Usage:
        kafka-recon [options]

      Options:
        -c, --config <file>          load kafka configuration from json file
        config=<file>                same as --config
        policy=<file>                discovery policy YAML (timeouts, column widths, reviewed settings)
        metricsExporter=otlp|none    export metrics over OTLP (default none)
        otelEndpoint=<url>           OTLP collector endpoint
        otelResourceAttributes=k=v,...  extra OpenTelemetry resource attributes
        --verbose                    enable DEBUG logging on stderr
        --help                       show this message

      Shell commands: type 'help' at the prompt.
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    System.exit(exit.code());
  }

  /**
   * Runs the tool against {@code stdin} without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @param stdin shell input
   * @return exit code
   */
  static ExitCode run(String[] args, BufferedReader stdin) {
    CliInput input;
    Map<String, String> options;
    try {
      input = CliInput.parse(args);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      if (!input.unknownFlags().isEmpty()) {
        throw new IllegalArgumentException("unknown option: " + input.unknownFlags().iterator().next());
      }
      options = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled");
    }

    Optional<Path> configFile;
    Optional<Path> policyFile;
    try {
      TelemetryConfigurator.configureMetrics(options);
      configFile = ConfigCliUtils.extractPath(options, "config");
      policyFile = ConfigCliUtils.extractPath(options, "policy");
      if (!options.isEmpty()) {
        throw new IllegalArgumentException("unknown argument: " + options.keySet().iterator().next());
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ReconPolicy policy;
    try {
      policy = policyFile.isPresent() ? YamlPolicyLoader.load(policyFile.get()) : YamlPolicyLoader.loadDefaults();
    } catch (IOException | IllegalArgumentException ex) {
      log.error("Invalid discovery policy", ex);
      CliPrinter.println(" (-) Could not load policy: " + ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
    ReconSession session = new ReconSession();
    AtomicBoolean finished = new AtomicBoolean();
    Thread shutdownHook = new Thread(() -> {
      if (finished.compareAndSet(false, true)) {
        CliPrinter.println("");
        session.close();
        metrics.close();
      }
    }, "kafka-recon-shutdown");
    Runtime.getRuntime().addShutdownHook(shutdownHook);

    ConsoleReconOutput output = new ConsoleReconOutput();
    ReconShell shell = new ReconShell(
        session,
        new ConnectionManager(new KafkaClientFactory(), output, metrics),
        new ClusterDiscoverer(policy, output, metrics),
        output,
        stdin);
    try {
      shell.loadInitial(configFile.orElse(null));
      shell.run();
      return ExitCode.SUCCESS;
    } catch (InterruptedIOException ex) {
      log.debug("Shell input interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (IOException | RuntimeException ex) {
      log.debug("Shell terminated abnormally", ex);
      output.failure("ERROR: " + ex.getMessage());
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      if (finished.compareAndSet(false, true)) {
        session.close();
        metrics.close();
      }
      removeHook(shutdownHook);
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; hook left registered");
    }
  }
}

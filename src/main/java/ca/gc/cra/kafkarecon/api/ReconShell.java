package ca.gc.cra.kafkarecon.api;

import ca.gc.cra.kafkarecon.application.connect.ConnectionManager;
import ca.gc.cra.kafkarecon.application.discovery.ClusterDiscoverer;
import ca.gc.cra.kafkarecon.application.session.ReconSession;
import ca.gc.cra.kafkarecon.config.ConfigLoadException;
import ca.gc.cra.kafkarecon.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Interactive read-evaluate-report loop over one {@link ReconSession}.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Prompt with the current broker label and tokenize input with shell quoting.</li>
 *   <li>Dispatch {@code config}, {@code load}, {@code connect}, {@code disconnect}, {@code cluster},
 *       {@code help}/{@code ?}, and {@code exit}.</li>
 *   <li>Report unexpected failures as {@code ERROR: <message>} and keep the loop alive.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Runs on a single thread.</p>
 *
 * @since 0.1.0
 */
final class ReconShell {
  private static final Logger log = LoggerFactory.getLogger(ReconShell.class);

  static final List<String> HELP_HEADERS = List.of("Command", "Description");
  static final List<List<Object>> HELP_ROWS = List.of(
      List.of("cluster", "show cluster identity, brokers, and broker security settings"),
      List.of("config", "show current configuration"),
      List.of("connect", "create consumer and admin client"),
      List.of("disconnect", "close consumer and admin client"),
      List.of("exit", "exit the script"),
      List.of("help", "show this help message"),
      List.of("load <file>", "load kafka config from json file"));

  private final ReconSession session;
  private final ConnectionManager connections;
  private final ClusterDiscoverer discoverer;
  private final ConsoleReconOutput output;
  private final BufferedReader input;

  ReconShell(
      ReconSession session,
      ConnectionManager connections,
      ClusterDiscoverer discoverer,
      ConsoleReconOutput output,
      BufferedReader input) {
    this.session = Objects.requireNonNull(session, "session");
    this.connections = Objects.requireNonNull(connections, "connections");
    this.discoverer = Objects.requireNonNull(discoverer, "discoverer");
    this.output = Objects.requireNonNull(output, "output");
    this.input = Objects.requireNonNull(input, "input");
  }

  /**
   * Loads the configuration named on the command line, if any.
   *
   * @param configFile initial configuration file, or {@code null}
   */
  void loadInitial(Path configFile) {
    output.blank();
    if (configFile == null) {
      output.success("Started without initial configuration");
      return;
    }
    load(configFile.toString());
  }

  /**
   * Runs until {@code exit} or end of input.
   *
   * @throws IOException when reading the input fails
   */
  void run() throws IOException {
    while (true) {
      output.blank();
      output.prompt(session.brokerLabel());
      String line = input.readLine();
      if (line == null) {
        output.blank();
        return;
      }
      List<String> words;
      try {
        words = CommandLineTokenizer.tokenize(line);
      } catch (IllegalArgumentException ex) {
        output.blank();
        output.failure("Could not parse command: " + ex.getMessage());
        continue;
      }
      if (words.isEmpty()) {
        continue;
      }
      output.blank();
      if (!execute(words)) {
        return;
      }
    }
  }

  /**
   * Executes one tokenized command.
   *
   * @param words command name followed by its arguments
   * @return {@code false} when the shell should stop
   */
  boolean execute(List<String> words) {
    String command = words.get(0);
    log.debug("Executing command {}", command);
    try {
      switch (command.toLowerCase(Locale.ROOT)) {
        case "exit" -> {
          return false;
        }
        case "help", "?" -> output.table(HELP_HEADERS, HELP_ROWS);
        case "config" -> printConfig(session.config().describe());
        case "load" -> {
          if (words.size() != 2) {
            output.failure("usage: load <file>");
          } else {
            load(words.get(1));
          }
        }
        case "connect" -> connections.connect(session);
        case "disconnect" -> connections.disconnect(session);
        case "cluster" -> discoverer.describeCluster(session);
        default -> output.failure("Command not found: " + command);
      }
    } catch (RuntimeException ex) {
      log.debug("Command {} failed", command, ex);
      output.failure("ERROR: " + ex.getMessage());
    }
    return true;
  }

  private void load(String file) {
    Path path;
    try {
      path = Path.of(file);
    } catch (InvalidPathException ex) {
      output.failure("Could not load file: " + file + " (invalid path)");
      return;
    }
    Map<String, Object> delta;
    try {
      delta = session.config().load(path);
    } catch (ConfigLoadException ex) {
      log.debug("Configuration load failed for {}", path, ex);
      if (ex.reason() == ConfigLoadException.Reason.NOT_AN_OBJECT) {
        output.failure("Configuration must be an object");
      } else {
        output.failure("Could not load file: " + file + " (" + ex.getMessage() + ")");
      }
      return;
    }
    output.success("Loaded configuration from file:");
    output.blank();
    printConfig(new ArrayList<>(delta.entrySet()));
  }

  private void printConfig(List<Map.Entry<String, Object>> entries) {
    if (entries.isEmpty()) {
      output.failure("No configuration");
      return;
    }
    List<List<Object>> rows = new ArrayList<>(entries.size());
    for (Map.Entry<String, Object> entry : entries) {
      rows.add(List.of(entry.getKey(), Logs.displayValue(entry.getKey(), entry.getValue())));
    }
    output.table(List.of("Key", "Value"), rows);
  }
}

package ca.gc.cra.kafkarecon.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed process arguments split into flags and {@code key=value} pairs.
 *
 * <p>{@code -c <file>}, {@code --config <file>} and {@code --config=<file>} are normalized to
 * {@code config=<file>} so they reach the same key/value handling as the other options.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final Set<String> CONFIG_FLAGS = Set.of("-c", "--config");
  private static final String CONFIG_KEY = "config";

  private final String[] keyValueArgs;
  private final Set<String> flags;
  private final boolean help;
  private final boolean verbose;

  private CliInput(String[] keyValueArgs, Set<String> flags, boolean help, boolean verbose) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation
   * @throws IllegalArgumentException when {@code -c}/{@code --config} is the last argument
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of(), false, false);
    }

    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    for (int i = 0; i < args.length; i++) {
      String raw = args[i];
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
        flags.add("--verbose");
      } else if (CONFIG_FLAGS.contains(lower)) {
        if (i + 1 >= args.length || args[i + 1] == null || args[i + 1].isBlank()) {
          throw new IllegalArgumentException(arg + " requires a configuration file argument");
        }
        kv.add(CONFIG_KEY + "=" + args[++i].trim());
      } else if (lower.startsWith("--config=")) {
        kv.add(CONFIG_KEY + "=" + arg.substring("--config=".length()));
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv.toArray(String[]::new), Set.copyOf(flags), help, verbose);
  }

  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }

  /**
   * Returns normalized flags that no option consumed, such as a mistyped {@code --verbos}.
   *
   * @return lowercase flags other than help and verbose
   */
  public Set<String> unknownFlags() {
    Set<String> unknown = new LinkedHashSet<>(flags);
    unknown.remove("--help");
    unknown.remove("--verbose");
    return unknown;
  }
}

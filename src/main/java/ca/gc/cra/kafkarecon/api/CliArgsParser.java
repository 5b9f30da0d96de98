package ca.gc.cra.kafkarecon.api;

import ca.gc.cra.kafkarecon.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} arguments into a mutable lookup map.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Splits each argument on its first {@code '='}; later duplicates win.
   *
   * @param args key/value arguments; {@code null} returns an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException when an argument is not {@code key=value} or carries control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      map.put(key, Strings.requireNonBlank(key, arg.substring(idx + 1)));
    }
    return map;
  }
}

package ca.gc.cra.kafkarecon.api;

import ca.gc.cra.kafkarecon.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Helpers for pulling file arguments out of the parsed key/value map.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes {@code key} from {@code args} and converts it to a path.
   *
   * @param args mutable argument map
   * @param key argument name
   * @return path when the argument was present
   * @throws IllegalArgumentException when the value is not a usable path
   */
  static Optional<Path> extractPath(Map<String, String> args, String key) {
    if (args == null) {
      return Optional.empty();
    }
    String value = args.remove(key);
    if (value == null) {
      return Optional.empty();
    }
    String sanitized = Strings.requireNonBlank(key, value);
    try {
      return Optional.of(Path.of(sanitized));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + sanitized, ex);
    }
  }
}

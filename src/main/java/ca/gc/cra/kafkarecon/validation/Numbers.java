package ca.gc.cra.kafkarecon.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by policy loading and CLI parsing.
 * <p><strong>Why:</strong> Guards request timeouts and display widths before discovery uses them.
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., characters, ms)
   * @param min minimum inclusive value in the same units as {@code value}
   * @param max maximum inclusive value in the same units as {@code value}
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Converts a loosely typed configuration value (number or numeric string) into a {@code long}.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate value; must be a {@link Number} or a decimal string
   * @return parsed value
   * @throws IllegalArgumentException if the value is missing or not an integral number
   */
  public static long requireLong(String name, Object value) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      return ((Number) value).longValue();
    }
    if (value instanceof String text) {
      try {
        return Long.parseLong(text.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(label + " must be numeric (was " + text + ")", ex);
      }
    }
    throw new IllegalArgumentException(label + " must be an integer (was " + value + ")");
  }
}

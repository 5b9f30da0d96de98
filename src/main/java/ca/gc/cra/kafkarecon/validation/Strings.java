package ca.gc.cra.kafkarecon.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings supplied on the command line or in policy files.
 * <p><strong>Why:</strong> File paths, command arguments, and telemetry attributes must be sanitized before the
 * shell opens files or the Kafka adapters build clients.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Verify printable ASCII constraints for observability-friendly attributes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a value contains only printable ASCII characters and is within the supplied length budget.
   *
   * @param name logical name for diagnostics
   * @param value candidate string; must be non-null
   * @param maxLength maximum permitted length in characters
   * @return validated value containing only characters {@code 0x20-0x7E}
   * @throws IllegalArgumentException if the value exceeds {@code maxLength} or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Returns at most {@code maxChars} leading characters of {@code value}.
   *
   * @param value text to shorten; {@code null} is returned unchanged
   * @param maxChars maximum number of characters to keep; must not be negative
   * @return prefix of {@code value}
   */
  public static String truncate(String value, int maxChars) {
    if (maxChars < 0) {
      throw new IllegalArgumentException("maxChars must not be negative");
    }
    if (value == null || value.length() <= maxChars) {
      return value;
    }
    return value.substring(0, maxChars);
  }

  /**
   * Checks whether the supplied text contains ISO control characters.
   *
   * @param value text to scan
   * @return {@code true} when at least one control character is present
   */
  public static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}

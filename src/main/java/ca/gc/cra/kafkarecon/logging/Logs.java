package ca.gc.cra.kafkarecon.logging;

import java.util.List;
import java.util.Locale;

/**
 * <strong>What:</strong> Logging hygiene helpers that minimize credential exposure.
 * <p><strong>Why:</strong> Client configuration files routinely carry key passwords and SASL JAAS lines; the
 * {@code config} and {@code load} commands and debug logs must not echo them.
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final List<String> SECRET_MARKERS =
      List.of("password", "secret", "sasl.jaas.config", "token");

  private Logs() {
    // Utility
  }

  /**
   * Returns a standard redacted placeholder for sensitive content.
   *
   * @param value ignored original value; retained for fluent API usage
   * @return the redacted placeholder string
   */
  public static String redact(Object value) {
    return REDACTED_PLACEHOLDER;
  }

  /**
   * Indicates whether a configuration key names a credential.
   *
   * @param key configuration key; {@code null} is never secret
   * @return {@code true} when the key contains a known secret marker
   */
  public static boolean isSecretKey(String key) {
    if (key == null) {
      return false;
    }
    String lower = key.toLowerCase(Locale.ROOT);
    for (String marker : SECRET_MARKERS) {
      if (lower.contains(marker)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the value to display for a configuration key, redacting credentials.
   *
   * @param key configuration key
   * @param value configured value
   * @return {@code value} unchanged, or the redaction placeholder when the key is secret
   */
  public static Object displayValue(String key, Object value) {
    return isSecretKey(key) ? redact(value) : value;
  }
}

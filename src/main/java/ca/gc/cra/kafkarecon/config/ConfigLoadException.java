package ca.gc.cra.kafkarecon.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Raised when a client configuration file cannot be merged into the {@link ConfigStore}.
 *
 * <p>The store is left untouched whenever this exception is thrown.</p>
 *
 * @since 0.1.0
 */
public final class ConfigLoadException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Broad category of the load failure. */
  public enum Reason {
    /** File missing or unreadable. */
    UNREADABLE,
    /** File is not valid JSON. */
    MALFORMED,
    /** Document parsed but its top level is not an object. */
    NOT_AN_OBJECT,
    /** Object contains a value that is not a scalar or an array of scalars. */
    UNSUPPORTED_VALUE
  }

  private final transient Path path;
  private final Reason reason;

  /**
   * Creates a load failure.
   *
   * @param path file that failed to load
   * @param reason failure category
   * @param message human-readable detail
   * @param cause underlying exception; may be {@code null}
   */
  public ConfigLoadException(Path path, Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.path = path;
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  /**
   * Returns the file that failed to load.
   *
   * @return configuration file path
   */
  public Path path() {
    return path;
  }

  /**
   * Returns the failure category.
   *
   * @return reason
   */
  public Reason reason() {
    return reason;
  }
}

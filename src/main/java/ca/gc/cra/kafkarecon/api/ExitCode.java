package ca.gc.cra.kafkarecon.api;

/**
 * <strong>What:</strong> Process exit codes of the kafka-recon launcher.
 * <p><strong>Why:</strong> Wrappers and scripts distinguish bad arguments from bad policy files and crashes.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Shell ended through {@code exit} or end of input. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Discovery policy was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value passed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}

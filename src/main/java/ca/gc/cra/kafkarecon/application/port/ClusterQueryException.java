package ca.gc.cra.kafkarecon.application.port;

/**
 * Raised when a metadata or configuration request to the cluster times out or fails.
 *
 * @since 0.1.0
 */
public final class ClusterQueryException extends Exception {
  private static final long serialVersionUID = 1L;

  public ClusterQueryException(String message) {
    super(message);
  }

  public ClusterQueryException(String message, Throwable cause) {
    super(message, cause);
  }
}

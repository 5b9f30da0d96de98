package ca.gc.cra.kafkarecon.application.port;

/**
 * Raised when an admin or consumer client cannot be constructed from the supplied configuration.
 *
 * @since 0.1.0
 */
public final class ClientCreationException extends Exception {
  private static final long serialVersionUID = 1L;

  public ClientCreationException(String message) {
    super(message);
  }

  public ClientCreationException(String message, Throwable cause) {
    super(message, cause);
  }
}

package ca.gc.cra.kafkarecon.adapter.kafka;

/**
 * Formats client exceptions into single-line operator diagnostics.
 */
final class KafkaErrors {

  private KafkaErrors() {
    // Utility
  }

  /**
   * Returns the exception message followed by the message of its cause when the cause adds detail.
   *
   * @param error failure raised by a Kafka client
   * @return single-line reason
   */
  static String describe(Throwable error) {
    if (error == null) {
      return "unknown error";
    }
    String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    Throwable cause = error.getCause();
    if (cause != null && cause != error && cause.getMessage() != null && !message.contains(cause.getMessage())) {
      message = message + ": " + cause.getMessage();
    }
    return message.replace('\n', ' ').replace('\r', ' ');
  }
}

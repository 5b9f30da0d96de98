package ca.gc.cra.kafkarecon.application.port;

import java.util.List;

/**
 * <strong>What:</strong> Operator-facing diagnostic channel of the recon engine.
 * <p><strong>Why:</strong> Every outcome, including failures that never propagate as exceptions, must reach the
 * operator in order.</p>
 * <p><strong>Role:</strong> Driven port implemented by the console adapter and by recording fakes in tests.</p>
 *
 * @since 0.1.0
 */
public interface ReconOutput {

  /**
   * Reports a successful step or a discovered fact.
   *
   * @param message single-line message
   */
  void success(String message);

  /**
   * Reports a failed step or an inconsistency in returned data.
   *
   * @param message single-line message
   */
  void failure(String message);

  /**
   * Renders rows under a header line; a cell that is a {@link List} spans several lines.
   *
   * @param headers column headers
   * @param rows row cells in header order
   */
  void table(List<String> headers, List<List<Object>> rows);

  /**
   * Separates report sections.
   */
  void blank();
}

package ca.gc.cra.kafkarecon.api;

import ca.gc.cra.kafkarecon.application.port.ReconOutput;
import java.util.List;

/**
 * {@link ReconOutput} writing to the console through {@link CliPrinter}.
 *
 * <p>Successes are prefixed {@code " (+) "}, failures {@code " (-) "}.</p>
 */
final class ConsoleReconOutput implements ReconOutput {
  static final String SUCCESS_PREFIX = " (+) ";
  static final String FAILURE_PREFIX = " (-) ";

  @Override
  public void success(String message) {
    CliPrinter.println(SUCCESS_PREFIX + message);
  }

  @Override
  public void failure(String message) {
    CliPrinter.println(FAILURE_PREFIX + message);
  }

  @Override
  public void table(List<String> headers, List<List<Object>> rows) {
    CliPrinter.printLines(TableRenderer.render(headers, rows));
  }

  @Override
  public void blank() {
    CliPrinter.println("");
  }

  /**
   * Prints the two-line prompt naming the targeted broker; the cursor stays on the second line.
   *
   * @param brokerLabel label of the current broker
   */
  void prompt(String brokerLabel) {
    CliPrinter.println(" ┌──(" + brokerLabel + ")");
    CliPrinter.print(" └─$ ");
  }
}

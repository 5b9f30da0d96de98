package ca.gc.cra.kafkarecon.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console writer for shell output.
 *
 * <p>Writes through the native stdout descriptor in UTF-8 so prompt glyphs render regardless of the platform
 * default charset, and so log output on stderr never interleaves mid-line.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints text without a line terminator and flushes, for prompts.
   *
   * @param text text to emit
   */
  public static void print(String text) {
    PrintWriter writer = writer();
    writer.print(text);
    writer.flush();
  }

  /**
   * Prints zero or more lines.
   *
   * @param lines lines to emit
   */
  public static void printLines(Iterable<String> lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}

package io.flightqc.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output for usage text and dry-run plans, kept apart from log output.
 *
 * <p>Writes to the stdout file descriptor directly so Logback's stderr appender and this output never
 * interleave on the same stream.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {}

  /**
   * Writes one line to stdout.
   *
   * @param message line to write
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Writes each line in order and flushes once at the end; {@code null} writes nothing.
   *
   * @param lines lines to write, such as a usage block or the resolved dry-run settings
   */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
    writer.flush();
  }

  /**
   * Redirects output for a test until {@link #clearTestWriter()} is called.
   *
   * @param writer writer that captures the output
   */
  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  /** Restores stdout after {@link #setWriterForTesting(PrintWriter)}. */
  static void clearTestWriter() {
    override = null;
  }

  /**
   * Returns the test override when one is set, otherwise stdout.
   *
   * @return active writer
   */
  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}

package ca.gc.cra.subscan.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Console output for usage text, dry-run plans, and the live result stream.
 *
 * <p>Writes to the stdout file descriptor directly so results stay on stdout while Logback owns stderr.</p>
 */
public final class CliPrinter {
  private static final int PLAN_LABEL_WIDTH = 17;
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints a dry-run plan: a headline, one aligned {@code label : value} row per entry, and a closing hint.
   *
   * @param headline first line of the plan
   * @param rows labels mapped to their rendered values, in display order
   * @param footer last line of the plan
   */
  public static void printPlan(String headline, Map<String, String> rows, String footer) {
    PrintWriter writer = writer();
    writer.println(headline);
    rows.forEach((label, value) -> {
      StringBuilder line = new StringBuilder(" ").append(label);
      while (line.length() < PLAN_LABEL_WIDTH + 1) {
        line.append(' ');
      }
      writer.println(line.append(": ").append(value));
    });
    writer.println(" " + footer);
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  /**
   * Resolves the active writer, preferring a test override. Result sinks print through the same writer.
   *
   * @return writer used for CLI output
   */
  static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}

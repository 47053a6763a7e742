package org.atrack.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes user-facing CLI text (help, usage, dry-run plans) to stdout; logs go through SLF4J instead.
 *
 * @since 0.1.0
 */
final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter testWriter;

  private CliPrinter() {}

  static void println(String message) {
    PrintWriter out = writer();
    out.println(message);
    out.flush();
  }

  static void printLines(List<String> lines) {
    PrintWriter out = writer();
    lines.forEach(out::println);
    out.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    testWriter = writer;
  }

  static void clearTestWriter() {
    testWriter = null;
  }

  private static PrintWriter writer() {
    PrintWriter override = testWriter;
    return override != null ? override : STDOUT;
  }
}

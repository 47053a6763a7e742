package org.atrack.api;

import org.atrack.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code atrack} dispatcher. Flags before the command name apply to the dispatcher; everything after it is handed
 * to the command.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  static final String SUMMARY_USAGE = "usage: atrack <candidates|detect> [options]";
  static final String HELP_TEXT = """
      A-Track moving-object detection

      Usage:
        atrack <command> [options]

      Commands:
        candidates  Select transient candidates per image (candidates --help for details)
        detect      Detect moving objects across the image sequence (detect --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandAt = 0;
    while (commandAt < safeArgs.length && safeArgs[commandAt] != null && safeArgs[commandAt].startsWith("-")) {
      commandAt++;
    }
    CliInput globals = CliInput.parse(Arrays.copyOfRange(safeArgs, 0, commandAt));
    if (globals.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (globals.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    if (commandAt >= safeArgs.length || safeArgs[commandAt] == null) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safeArgs[commandAt].trim().toLowerCase(Locale.ROOT);
    String[] rest = Arrays.copyOfRange(safeArgs, commandAt + 1, safeArgs.length);
    return switch (command) {
      case "candidates" -> CandidatesCli.run(rest);
      case "detect" -> DetectCli.run(rest);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}

package org.atrack.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits raw arguments into {@code key=value} pairs and {@code --flags}.
 *
 * <p>{@code --help}/{@code -h} and {@code --verbose}/{@code -v} are normalized; any other token starting with
 * {@code -} and lacking {@code =} is kept as a lower-cased flag.</p>
 *
 * @since 0.1.0
 */
final class CliInput {
  static final String HELP = "--help";
  static final String VERBOSE = "--verbose";
  static final String DRY_RUN = "--dry-run";
  static final String ALLOW_OVERWRITE = "--allow-overwrite";

  private final String[] keyValueArgs;
  private final Set<String> flags;

  private CliInput(String[] keyValueArgs, Set<String> flags) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  static CliInput parse(String[] args) {
    List<String> pairs = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        if (arg.startsWith("-") && arg.indexOf('=') < 0) {
          flags.add(normalizeFlag(arg.toLowerCase(Locale.ROOT)));
        } else {
          pairs.add(arg);
        }
      }
    }
    return new CliInput(pairs.toArray(new String[0]), Set.copyOf(flags));
  }

  private static String normalizeFlag(String flag) {
    return switch (flag) {
      case "-h" -> HELP;
      case "-v", "--debug" -> VERBOSE;
      default -> flag;
    };
  }

  String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  boolean help() {
    return flags.contains(HELP);
  }

  boolean verbose() {
    return flags.contains(VERBOSE);
  }

  boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  Set<String> flags() {
    return flags;
  }
}

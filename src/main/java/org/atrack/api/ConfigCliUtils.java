package org.atrack.api;

import java.util.Locale;
import java.util.Map;

final class ConfigCliUtils {
  static final String CONFIG_KEY = "config";

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config=PATH} argument so it never reaches the merged configuration.
   *
   * @param args mutable CLI map
   * @return trimmed path or {@code null}
   */
  static String extractConfigPath(Map<String, String> args) {
    String value = args.remove(CONFIG_KEY);
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Reads a strict boolean; blank or absent yields {@code defaultValue}.
   *
   * @throws IllegalArgumentException when the value is neither {@code true} nor {@code false}
   */
  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + value + "')");
    };
  }
}

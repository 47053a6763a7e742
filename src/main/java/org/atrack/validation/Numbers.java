package org.atrack.validation;

/**
 * Numeric range checks for configuration values.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Ensures {@code value} lies within {@code [min, max]}.
   *
   * @param name key reported in the error message
   * @param value value to check
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException when out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Ensures {@code value} is finite and strictly positive.
   *
   * @param name key reported in the error message
   * @param value value to check
   * @return {@code value}
   * @throws IllegalArgumentException when zero, negative, NaN or infinite
   */
  public static double requirePositive(String name, double value) {
    if (!Double.isFinite(value) || value <= 0) {
      throw new IllegalArgumentException(label(name) + " must be a positive number (was " + value + ")");
    }
    return value;
  }

  /**
   * Ensures {@code value} is finite and not negative.
   *
   * @param name key reported in the error message
   * @param value value to check
   * @return {@code value}
   * @throws IllegalArgumentException when negative, NaN or infinite
   */
  public static double requireNonNegative(String name, double value) {
    if (!Double.isFinite(value) || value < 0) {
      throw new IllegalArgumentException(label(name) + " must be >= 0 (was " + value + ")");
    }
    return value;
  }

  /**
   * Ensures {@code value} is not NaN. Infinities are accepted as "no limit".
   *
   * @param name key reported in the error message
   * @param value value to check
   * @return {@code value}
   */
  public static double requireNumber(String name, double value) {
    if (Double.isNaN(value)) {
      throw new IllegalArgumentException(label(name) + " must be a number");
    }
    return value;
  }

  /**
   * Parses a decimal value from a configuration string.
   *
   * @param name key reported in the error message
   * @param raw raw text
   * @return parsed value
   * @throws IllegalArgumentException when {@code raw} is blank or not a number
   */
  public static double parseDouble(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw);
    try {
      return Double.parseDouble(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was '" + trimmed + "')", ex);
    }
  }

  /**
   * Parses an integer from a configuration string.
   *
   * @param name key reported in the error message
   * @param raw raw text
   * @return parsed value
   * @throws IllegalArgumentException when {@code raw} is blank or not an integer
   */
  public static int parseInt(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw);
    try {
      return Integer.parseInt(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + trimmed + "')", ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}

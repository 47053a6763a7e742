package org.atrack.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rectangular pixel region whose sources are discarded before candidate selection.
 *
 * <p>Bounds are inclusive: a source at {@code (x, y)} is inside when {@code xMin <= x <= xMax} and
 * {@code yMin <= y <= yMax}.</p>
 *
 * @param xMin lower x bound
 * @param xMax upper x bound
 * @param yMin lower y bound
 * @param yMax upper y bound
 * @since 0.1.0
 */
public record ExclusionZone(double xMin, double xMax, double yMin, double yMax) {
  private static final Pattern QUOTED = Pattern.compile("\"\\s*([^\"]*?)\\s*\"");

  public ExclusionZone {
    if (Double.isNaN(xMin) || Double.isNaN(xMax) || Double.isNaN(yMin) || Double.isNaN(yMax)) {
      throw new IllegalArgumentException("exclusion zone bounds must be numbers");
    }
    if (xMin > xMax || yMin > yMax) {
      throw new IllegalArgumentException(
          "exclusion zone bounds must satisfy min <= max (was x " + xMin + ":" + xMax
              + ", y " + yMin + ":" + yMax + ")");
    }
  }

  /**
   * Tests whether a pixel position falls inside this zone.
   *
   * @param x pixel x
   * @param y pixel y
   * @return {@code true} when inside, bounds included
   */
  public boolean contains(double x, double y) {
    return !(x < xMin || x > xMax || y < yMin || y > yMax);
  }

  /**
   * Parses the {@code rejectArea} syntax: zones separated by {@code ;}, each written as
   * {@code "x1:x2","y1:y2"}. {@code False}, {@code none} or a blank value mean no zones.
   *
   * @param raw configuration text; may be {@code null}
   * @return parsed zones in declaration order
   * @throws IllegalArgumentException when a zone is malformed
   */
  public static List<ExclusionZone> parseList(String raw) {
    if (raw == null) {
      return List.of();
    }
    String trimmed = raw.trim();
    String lower = trimmed.toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty() || lower.equals("false") || lower.equals("none")) {
      return List.of();
    }
    List<ExclusionZone> zones = new ArrayList<>();
    for (String entry : trimmed.split(";")) {
      if (entry.isBlank()) {
        continue;
      }
      zones.add(parseOne(entry));
    }
    return List.copyOf(zones);
  }

  /**
   * Renders zones back into {@code rejectArea} syntax.
   *
   * @param zones zones to format
   * @return text accepted by {@link #parseList(String)}
   */
  public static String format(List<ExclusionZone> zones) {
    if (zones == null || zones.isEmpty()) {
      return "False";
    }
    StringBuilder sb = new StringBuilder();
    for (ExclusionZone zone : zones) {
      if (sb.length() > 0) {
        sb.append(';');
      }
      sb.append('"').append(zone.xMin()).append(':').append(zone.xMax()).append("\",\"")
          .append(zone.yMin()).append(':').append(zone.yMax()).append('"');
    }
    return sb.toString();
  }

  private static ExclusionZone parseOne(String entry) {
    Matcher matcher = QUOTED.matcher(entry);
    List<String> ranges = new ArrayList<>(2);
    while (matcher.find()) {
      ranges.add(matcher.group(1));
    }
    if (ranges.size() != 2) {
      throw new IllegalArgumentException(
          "rejectArea entry must look like \"x1:x2\",\"y1:y2\" (was " + entry.trim() + ")");
    }
    double[] x = parseRange("x", ranges.get(0));
    double[] y = parseRange("y", ranges.get(1));
    return new ExclusionZone(x[0], x[1], y[0], y[1]);
  }

  private static double[] parseRange(String axis, String range) {
    String[] bounds = range.split(":");
    if (bounds.length != 2) {
      throw new IllegalArgumentException("rejectArea " + axis + " range must be min:max (was " + range + ")");
    }
    try {
      return new double[] {Double.parseDouble(bounds[0].trim()), Double.parseDouble(bounds[1].trim())};
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("rejectArea " + axis + " range is not numeric: " + range, ex);
    }
  }
}

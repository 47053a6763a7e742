package org.atrack.infrastructure.catalog;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;

/**
 * Parses observation timestamps from {@code date-obs} / {@code time-obs} header values.
 *
 * <p>When {@code date-obs} has no {@code T}, {@code time-obs} is appended as {@code date + "T" + time}. The value
 * is parsed as {@code yyyy-MM-dd'T'HH:mm:ss.fraction}, then as {@code yyyy-MM-dd'T'HH:mm:ss}, and read as UTC.</p>
 *
 * @since 0.1.0
 */
public final class ObservationTimestamps {
  private static final DateTimeFormatter WITH_FRACTION = new DateTimeFormatterBuilder()
      .appendPattern("uuuu-MM-dd'T'HH:mm:ss")
      .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
      .toFormatter()
      .withResolverStyle(ResolverStyle.STRICT);
  private static final DateTimeFormatter WHOLE_SECONDS =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

  private ObservationTimestamps() {}

  /**
   * Combines and parses observation date and time.
   *
   * @param dateObs {@code date-obs} value, with or without a time part
   * @param timeObs {@code time-obs} value; required only when {@code dateObs} has no {@code T}
   * @return exposure start instant
   * @throws IllegalArgumentException when the value matches neither pattern or the time part is missing
   */
  public static Instant parse(String dateObs, String timeObs) {
    if (dateObs == null || dateObs.isBlank()) {
      throw new IllegalArgumentException("date-obs is missing");
    }
    String combined = dateObs.trim();
    if (combined.indexOf('T') < 0) {
      if (timeObs == null || timeObs.isBlank()) {
        throw new IllegalArgumentException("date-obs '" + combined + "' has no time and time-obs is missing");
      }
      combined = combined + "T" + timeObs.trim();
    }
    try {
      return LocalDateTime.parse(combined, WITH_FRACTION).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException primary) {
      try {
        return LocalDateTime.parse(combined, WHOLE_SECONDS).toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException fallback) {
        fallback.addSuppressed(primary);
        throw new IllegalArgumentException("unparseable observation time '" + combined + "'", fallback);
      }
    }
  }
}

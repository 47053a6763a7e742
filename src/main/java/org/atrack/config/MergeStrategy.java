package org.atrack.config;

import java.util.Locale;

/** How segments sharing points are combined into tracks. */
public enum MergeStrategy {
  /** Single ordered pass; the first track sharing a point absorbs the segment. */
  GREEDY,
  /** Connected components over shared points; independent of segment order. */
  CONNECTED;

  /**
   * Parses a strategy name case-insensitively.
   *
   * @param raw name; blank selects {@link #GREEDY}
   * @return strategy
   * @throws IllegalArgumentException for unknown names
   */
  public static MergeStrategy parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return GREEDY;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("mergeStrategy must be GREEDY or CONNECTED (was " + raw + ")", ex);
    }
  }
}

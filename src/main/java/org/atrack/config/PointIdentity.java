package org.atrack.config;

import java.util.Locale;

/** Rule deciding whether two detections are the same point when merging segments. */
public enum PointIdentity {
  /** Identical right ascension and declination. */
  EXACT,
  /** Same image and positions within {@code pointTolerance} arcseconds. */
  TOLERANCE;

  /**
   * Parses an identity rule case-insensitively.
   *
   * @param raw name; blank selects {@link #EXACT}
   * @return identity rule
   * @throws IllegalArgumentException for unknown names
   */
  public static PointIdentity parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return EXACT;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("pointIdentity must be EXACT or TOLERANCE (was " + raw + ")", ex);
    }
  }
}

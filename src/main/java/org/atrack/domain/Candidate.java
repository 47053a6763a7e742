package org.atrack.domain;

import java.util.Objects;

/**
 * A transient source tagged with the image it was detected in.
 *
 * <p>Candidates are the points that segments and tracks are built from.</p>
 *
 * @param imageIndex image the record belongs to
 * @param record the source measurements
 * @since 0.1.0
 */
public record Candidate(int imageIndex, SourceRecord record) {

  public Candidate {
    if (imageIndex < 0) {
      throw new IllegalArgumentException("imageIndex must be >= 0 (was " + imageIndex + ")");
    }
    Objects.requireNonNull(record, "record");
  }

  public double ra() {
    return record.ra();
  }

  public double dec() {
    return record.dec();
  }
}

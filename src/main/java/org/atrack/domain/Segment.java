package org.atrack.domain;

import java.util.List;
import java.util.Objects;

/**
 * Three candidates from three distinct images consistent with straight, constant-rate motion.
 *
 * @param first point from the earliest image
 * @param second point from the middle image
 * @param third point from the latest image
 * @since 0.1.0
 */
public record Segment(Candidate first, Candidate second, Candidate third) {

  public Segment {
    Objects.requireNonNull(first, "first");
    Objects.requireNonNull(second, "second");
    Objects.requireNonNull(third, "third");
    if (!(first.imageIndex() < second.imageIndex() && second.imageIndex() < third.imageIndex())) {
      throw new IllegalArgumentException(
          "segment points must come from strictly increasing images (was "
              + first.imageIndex() + "," + second.imageIndex() + "," + third.imageIndex() + ")");
    }
  }

  public List<Candidate> points() {
    return List.of(first, second, third);
  }
}

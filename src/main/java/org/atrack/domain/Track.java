package org.atrack.domain;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A moving object's detections: at least three candidates from distinct images, ordered by image index.
 *
 * @param points candidates sorted by image index ascending
 * @since 0.1.0
 */
public record Track(List<Candidate> points) {

  public Track {
    Objects.requireNonNull(points, "points");
    if (points.size() < 3) {
      throw new IllegalArgumentException("track requires at least 3 points (was " + points.size() + ")");
    }
    List<Candidate> sorted = new ArrayList<>(points);
    sorted.sort(Comparator.comparingInt(Candidate::imageIndex));
    Set<Integer> images = new HashSet<>();
    for (Candidate point : sorted) {
      if (!images.add(point.imageIndex())) {
        throw new IllegalArgumentException("track holds two points from image " + point.imageIndex());
      }
    }
    points = List.copyOf(sorted);
  }

  public Candidate first() {
    return points.get(0);
  }

  public Candidate last() {
    return points.get(points.size() - 1);
  }

  public int size() {
    return points.size();
  }
}

package org.atrack.domain;

/** Confidence class assigned to a track from its angular speed. */
public enum TrackClass {
  /** Speed reached the configured minimum. */
  MOVING,
  /** Speed below the minimum, or not measurable. */
  UNCERTAIN
}

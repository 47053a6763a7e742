package org.atrack.domain;

import java.util.Objects;

/**
 * A track with its assigned identifier, measured angular speed and class.
 *
 * @param objectId sequential 1-based identifier
 * @param track the detections
 * @param angularSpeedRadPerMin speed in radians per minute
 * @param classification moving or uncertain
 * @since 0.1.0
 */
public record ClassifiedTrack(int objectId, Track track, double angularSpeedRadPerMin, TrackClass classification) {

  public ClassifiedTrack {
    if (objectId < 1) {
      throw new IllegalArgumentException("objectId must be >= 1 (was " + objectId + ")");
    }
    Objects.requireNonNull(track, "track");
    Objects.requireNonNull(classification, "classification");
  }

  /**
   * Speed in arcseconds per minute, the unit reports use.
   *
   * @return converted speed
   */
  public double speedArcsecPerMin() {
    return Angles.radiansToArcsec(angularSpeedRadPerMin);
  }

  public boolean isMoving() {
    return classification == TrackClass.MOVING;
  }
}

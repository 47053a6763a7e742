package org.atrack.application.pipeline;

import org.atrack.config.DetectionConfig;
import org.atrack.domain.ClassifiedTrack;
import org.atrack.domain.ImageMetadata;
import org.atrack.domain.SkyGeometry;
import org.atrack.domain.Track;
import org.atrack.domain.TrackClass;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Measures each track's angular speed and splits tracks into moving and uncertain objects.
 *
 * <p>Speed is {@code 60 * d(first, last) / elapsed} in radians per minute, where {@code elapsed} runs between the
 * exposure midpoints of the first and last images. Zero or non-finite elapsed time gives speed 0; a negative
 * elapsed time (images out of time order) gives a negative speed, which is always uncertain. Object
 * ids are assigned 1, 2, ... in track order.</p>
 *
 * @since 0.1.0
 */
public final class TrackClassifier {
  private static final Logger log = LoggerFactory.getLogger(TrackClassifier.class);

  private final double minSpeedRadPerMin;

  public TrackClassifier(DetectionConfig config) {
    this(config.minSpeedRadPerMin());
  }

  /**
   * Creates a classifier.
   *
   * @param minSpeedRadPerMin speed threshold for {@link TrackClass#MOVING}, radians per minute
   */
  public TrackClassifier(double minSpeedRadPerMin) {
    this.minSpeedRadPerMin = minSpeedRadPerMin;
  }

  /**
   * Classifies tracks.
   *
   * @param tracks merged tracks
   * @param metadata calibration of every image referenced by the tracks
   * @return moving and uncertain tracks
   * @throws IllegalArgumentException when a track references an image without metadata
   */
  public Classification classify(List<Track> tracks, Map<Integer, ImageMetadata> metadata) {
    Objects.requireNonNull(tracks, "tracks");
    Objects.requireNonNull(metadata, "metadata");
    List<ClassifiedTrack> moving = new ArrayList<>();
    List<ClassifiedTrack> uncertain = new ArrayList<>();
    for (int i = 0; i < tracks.size(); i++) {
      Track track = tracks.get(i);
      double speed = angularSpeed(track, metadata);
      TrackClass classification = speed >= minSpeedRadPerMin ? TrackClass.MOVING : TrackClass.UNCERTAIN;
      ClassifiedTrack classified = new ClassifiedTrack(i + 1, track, speed, classification);
      if (classification == TrackClass.MOVING) {
        moving.add(classified);
      } else {
        uncertain.add(classified);
      }
    }
    log.debug("Classified {} tracks: {} moving, {} uncertain", tracks.size(), moving.size(), uncertain.size());
    return new Classification(moving, uncertain);
  }

  /**
   * Angular speed of a track in radians per minute.
   *
   * @param track track
   * @param metadata image calibration keyed by image index
   * @return speed, negative when the last image precedes the first, or 0 when the elapsed time is zero or
   *     non-finite
   */
  public static double angularSpeed(Track track, Map<Integer, ImageMetadata> metadata) {
    ImageMetadata first = lookup(metadata, track.first().imageIndex());
    ImageMetadata last = lookup(metadata, track.last().imageIndex());
    double elapsed = last.secondsSince(first);
    if (elapsed == 0.0 || !Double.isFinite(elapsed)) {
      return 0.0;
    }
    double length = SkyGeometry.angularDistance(track.first(), track.last());
    double speed = 60.0 * length / elapsed;
    return Double.isFinite(speed) ? speed : 0.0;
  }

  private static ImageMetadata lookup(Map<Integer, ImageMetadata> metadata, int imageIndex) {
    ImageMetadata image = metadata.get(imageIndex);
    if (image == null) {
      throw new IllegalArgumentException("no metadata for image " + imageIndex);
    }
    return image;
  }

  /**
   * Classification outcome.
   *
   * @param moving tracks at or above the speed threshold
   * @param uncertain tracks below it
   */
  public record Classification(List<ClassifiedTrack> moving, List<ClassifiedTrack> uncertain) {
    public Classification {
      moving = List.copyOf(moving);
      uncertain = List.copyOf(uncertain);
    }

    /** Every classified track ordered by object id. */
    public List<ClassifiedTrack> all() {
      List<ClassifiedTrack> all = new ArrayList<>(moving.size() + uncertain.size());
      all.addAll(moving);
      all.addAll(uncertain);
      all.sort(Comparator.comparingInt(ClassifiedTrack::objectId));
      return all;
    }

    public boolean isEmpty() {
      return moving.isEmpty() && uncertain.isEmpty();
    }
  }
}

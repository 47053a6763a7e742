package org.atrack.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Capture calibration for one image: start timestamp, exposure duration and detector binning.
 *
 * @param timestamp exposure start, UTC
 * @param exposureSeconds exposure duration in seconds
 * @param binning horizontal binning factor, at least 1
 * @since 0.1.0
 */
public record ImageMetadata(Instant timestamp, double exposureSeconds, int binning) {

  public ImageMetadata {
    Objects.requireNonNull(timestamp, "timestamp");
    if (!Double.isFinite(exposureSeconds) || exposureSeconds < 0) {
      throw new IllegalArgumentException("exposureSeconds must be finite and >= 0 (was " + exposureSeconds + ")");
    }
    if (binning < 1) {
      throw new IllegalArgumentException("binning must be >= 1 (was " + binning + ")");
    }
  }

  /**
   * Creates metadata with the default binning of 1.
   *
   * @param timestamp exposure start
   * @param exposureSeconds exposure duration
   * @return metadata
   */
  public static ImageMetadata unbinned(Instant timestamp, double exposureSeconds) {
    return new ImageMetadata(timestamp, exposureSeconds, 1);
  }

  /**
   * Exposure start as fractional seconds since the epoch.
   *
   * @return epoch seconds including the nanosecond fraction
   */
  public double epochSeconds() {
    return timestamp.getEpochSecond() + timestamp.getNano() / 1_000_000_000.0;
  }

  /**
   * Mid-exposure time as fractional epoch seconds.
   *
   * @return start plus half the exposure
   */
  public double midExposureSeconds() {
    return epochSeconds() + exposureSeconds / 2.0;
  }

  /**
   * Elapsed time from {@code earlier} to this image, corrected for the exposure difference.
   *
   * <p>Equals {@code (t_this - t_earlier) + (exp_this - exp_earlier) / 2}.</p>
   *
   * @param earlier metadata of the earlier image
   * @return elapsed seconds between exposure midpoints
   */
  public double secondsSince(ImageMetadata earlier) {
    Objects.requireNonNull(earlier, "earlier");
    return (epochSeconds() - earlier.epochSeconds())
        + (exposureSeconds - earlier.exposureSeconds()) / 2.0;
  }
}

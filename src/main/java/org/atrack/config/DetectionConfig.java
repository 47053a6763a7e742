package org.atrack.config;

import org.atrack.domain.Angles;
import org.atrack.validation.Numbers;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Thresholds for candidate filtering, segment search, merging and speed classification.
 * <p><strong>Why:</strong> One immutable value passed to every pipeline stage replaces process-wide settings, so
 * concurrent runs and tests can use different thresholds side by side.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link org.atrack.application.pipeline.CandidateFilter},
 * {@link org.atrack.application.pipeline.SegmentDetector}, {@link org.atrack.application.pipeline.SegmentMerger}
 * and {@link org.atrack.application.pipeline.TrackClassifier}.</p>
 * <p><strong>Units:</strong> pixel quantities are converted to angles with {@code pixelScale}
 * (arcseconds per pixel); the {@code *Rad} accessors return radians.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param minFwhm minimum FWHM in pixels
 * @param fwhmCoefficient multiplier applied to the master catalog's mean FWHM to obtain the maximum FWHM
 * @param maxFlux maximum flux (saturation guard)
 * @param maxFlagSum maximum sum of extraction flags
 * @param maxElongation maximum elongation
 * @param minSnr minimum signal-to-noise ratio, exclusive
 * @param minTravel minimum travel between two images, in pixels
 * @param maxHeight maximum distance of the third point from the segment line, in pixels
 * @param pixelScale arcseconds per pixel
 * @param maxAngularVelocity maximum angular velocity searched, in arcseconds per second
 * @param tolerance allowed deviation of the third point from linear extrapolation, in pixels
 * @param minSpeed minimum speed of a confident moving object, in arcseconds per minute
 * @param exclusionZones pixel rectangles removed before candidate selection
 * @param mergeStrategy how segments combine into tracks
 * @param pointIdentity rule deciding when two detections are the same point
 * @param pointTolerance match radius in arcseconds for {@link PointIdentity#TOLERANCE}
 * @since 0.1.0
 */
public record DetectionConfig(
    double minFwhm,
    double fwhmCoefficient,
    double maxFlux,
    int maxFlagSum,
    double maxElongation,
    double minSnr,
    double minTravel,
    double maxHeight,
    double pixelScale,
    double maxAngularVelocity,
    double tolerance,
    double minSpeed,
    List<ExclusionZone> exclusionZones,
    MergeStrategy mergeStrategy,
    PointIdentity pointIdentity,
    double pointTolerance) {

  /**
   * Validates thresholds and normalizes optional members.
   *
   * @throws IllegalArgumentException naming the first invalid threshold
   */
  public DetectionConfig {
    Numbers.requireNonNegative("minFwhm", minFwhm);
    Numbers.requirePositive("fwhmCoefficient", fwhmCoefficient);
    Numbers.requireNumber("maxFlux", maxFlux);
    Numbers.requireNumber("maxElongation", maxElongation);
    Numbers.requireNumber("minSnr", minSnr);
    Numbers.requireNonNegative("minTravel", minTravel);
    Numbers.requirePositive("maxHeight", maxHeight);
    Numbers.requirePositive("pixelScale", pixelScale);
    Numbers.requirePositive("maxAngularVelocity", maxAngularVelocity);
    Numbers.requireNonNegative("tolerance", tolerance);
    Numbers.requireNonNegative("minSpeed", minSpeed);
    Numbers.requireNonNegative("pointTolerance", pointTolerance);
    exclusionZones = List.copyOf(Objects.requireNonNullElse(exclusionZones, List.of()));
    mergeStrategy = Objects.requireNonNullElse(mergeStrategy, MergeStrategy.GREEDY);
    pointIdentity = Objects.requireNonNullElse(pointIdentity, PointIdentity.EXACT);
  }

  /**
   * Returns the stock thresholds for a one arcsecond per pixel camera.
   *
   * @return default configuration
   */
  public static DetectionConfig defaults() {
    return new DetectionConfig(
        1.0,
        1.5,
        600_000.0,
        16,
        1.8,
        5.0,
        1.0,
        1.0,
        1.0,
        0.05,
        2.0,
        0.1,
        List.of(),
        MergeStrategy.GREEDY,
        PointIdentity.EXACT,
        0.0);
  }

  /**
   * Builds a configuration from flattened key/value options, falling back to {@link #defaults()} per key.
   *
   * @param options keys such as {@code minFwhm}, {@code pixelScale}, {@code rejectArea}
   * @return populated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static DetectionConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    DetectionConfig d = defaults();
    return new DetectionConfig(
        doubleOr(options, "minFwhm", d.minFwhm()),
        doubleOr(options, "fwhmCoefficient", d.fwhmCoefficient()),
        doubleOr(options, "maxFlux", d.maxFlux()),
        intOr(options, "maxFlagSum", d.maxFlagSum()),
        doubleOr(options, "maxElongation", d.maxElongation()),
        doubleOr(options, "minSnr", d.minSnr()),
        doubleOr(options, "minTravel", d.minTravel()),
        doubleOr(options, "maxHeight", d.maxHeight()),
        doubleOr(options, "pixelScale", d.pixelScale()),
        doubleOr(options, "maxAngularVelocity", d.maxAngularVelocity()),
        doubleOr(options, "tolerance", d.tolerance()),
        doubleOr(options, "minSpeed", d.minSpeed()),
        ExclusionZone.parseList(options.get("rejectArea")),
        MergeStrategy.parse(options.get("mergeStrategy")),
        PointIdentity.parse(options.get("pointIdentity")),
        doubleOr(options, "pointTolerance", d.pointTolerance()));
  }

  /**
   * Flattens this configuration into the key/value form accepted by {@link #fromMap(Map)}.
   *
   * @return ordered option map
   */
  public Map<String, String> toMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("minFwhm", Double.toString(minFwhm));
    map.put("fwhmCoefficient", Double.toString(fwhmCoefficient));
    map.put("maxFlux", Double.toString(maxFlux));
    map.put("maxFlagSum", Integer.toString(maxFlagSum));
    map.put("maxElongation", Double.toString(maxElongation));
    map.put("minSnr", Double.toString(minSnr));
    map.put("minTravel", Double.toString(minTravel));
    map.put("maxHeight", Double.toString(maxHeight));
    map.put("pixelScale", Double.toString(pixelScale));
    map.put("maxAngularVelocity", Double.toString(maxAngularVelocity));
    map.put("tolerance", Double.toString(tolerance));
    map.put("minSpeed", Double.toString(minSpeed));
    map.put("rejectArea", ExclusionZone.format(exclusionZones));
    map.put("mergeStrategy", mergeStrategy.name());
    map.put("pointIdentity", pointIdentity.name());
    map.put("pointTolerance", Double.toString(pointTolerance));
    return map;
  }

  /** Match radius of the transience test against the master catalog, in radians. */
  public double transienceRadiusRad() {
    return Angles.arcsecToRadians(minTravel * pixelScale);
  }

  /** Minimum length of the longest segment edge, in radians; the comparison is strict. */
  public double minSegmentLengthRad() {
    return 2.0 * Angles.arcsecToRadians(minTravel * pixelScale);
  }

  /** Maximum collinearity height, in radians; the comparison is strict. */
  public double maxHeightRad() {
    return Angles.arcsecToRadians(maxHeight * pixelScale);
  }

  /** Extrapolation tolerance for the third point, in radians. */
  public double toleranceRad() {
    return Angles.arcsecToRadians(tolerance * pixelScale);
  }

  /** Maximum angular velocity, in radians per second. */
  public double maxAngularVelocityRadPerSec() {
    return Angles.arcsecToRadians(maxAngularVelocity);
  }

  /** Moving-object speed threshold, in radians per minute. */
  public double minSpeedRadPerMin() {
    return Angles.arcsecToRadians(minSpeed);
  }

  /** Point match radius for {@link PointIdentity#TOLERANCE}, in radians. */
  public double pointToleranceRad() {
    return Angles.arcsecToRadians(pointTolerance);
  }

  private static double doubleOr(Map<String, String> options, String key, double fallback) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseDouble(key, raw);
  }

  private static int intOr(Map<String, String> options, String key, int fallback) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseInt(key, raw);
  }
}

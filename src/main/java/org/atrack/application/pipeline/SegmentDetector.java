package org.atrack.application.pipeline;

import org.atrack.config.DetectionConfig;
import org.atrack.domain.Candidate;
import org.atrack.domain.CandidateSet;
import org.atrack.domain.ImageMetadata;
import org.atrack.domain.ImageTriplet;
import org.atrack.domain.Segment;
import org.atrack.domain.SkyGeometry;
import org.atrack.domain.SkyGeometry.Triangle;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Finds 3-point segments consistent with straight, constant-rate motion.
 * <p><strong>How:</strong> for a triplet {@code (i, j, k)} every pair {@code (p, q)} from images {@code i} and
 * {@code j} within the velocity-bounded radius is extrapolated to image {@code k}. A point {@code r} is accepted
 * when its distance from {@code q} matches the rate of {@code p -> q} within the tolerance. Accepted triples are
 * kept when long enough and collinear enough.</p>
 * <p><strong>Degenerate input:</strong> a triplet whose first two images have zero (or non-finite) elapsed time
 * yields no segments.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable configuration; workers share one instance and
 * the read-only {@link CandidateSet}.</p>
 *
 * @since 0.1.0
 */
public final class SegmentDetector {
  private static final Logger log = LoggerFactory.getLogger(SegmentDetector.class);

  private final DetectionConfig config;

  public SegmentDetector(DetectionConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Searches every triplet of a partition.
   *
   * @param candidates per-image candidates and metadata
   * @param triplets triplets assigned to this worker
   * @return accepted segments in discovery order
   */
  public List<Segment> detect(CandidateSet candidates, List<ImageTriplet> triplets) {
    Objects.requireNonNull(candidates, "candidates");
    Objects.requireNonNull(triplets, "triplets");
    List<Segment> segments = new ArrayList<>();
    for (ImageTriplet triplet : triplets) {
      detect(candidates, triplet, segments);
    }
    return segments;
  }

  /**
   * Searches one triplet and appends accepted segments to {@code out}.
   *
   * @param candidates per-image candidates and metadata
   * @param triplet image indices {@code i < j < k}
   * @param out destination list
   * @return number of segments appended
   */
  public int detect(CandidateSet candidates, ImageTriplet triplet, List<Segment> out) {
    ImageMetadata imageI = candidates.metadata(triplet.first());
    ImageMetadata imageJ = candidates.metadata(triplet.second());
    ImageMetadata imageK = candidates.metadata(triplet.third());

    double dtIJ = imageJ.secondsSince(imageI);
    if (dtIJ == 0.0 || !Double.isFinite(dtIJ)) {
      log.debug("Skipping triplet {}: elapsed time between first two images is {}", triplet, dtIJ);
      return 0;
    }
    double dtJK = imageK.secondsSince(imageJ);
    double maxDistance = dtIJ * config.maxAngularVelocityRadPerSec() / imageI.binning();
    double tolerance = config.toleranceRad();
    double minLength = config.minSegmentLengthRad();
    double maxHeight = config.maxHeightRad();

    List<Candidate> pointsI = candidates.candidates(triplet.first());
    List<Candidate> pointsJ = candidates.candidates(triplet.second());
    List<Candidate> pointsK = candidates.candidates(triplet.third());

    int accepted = 0;
    for (Candidate p : pointsI) {
      for (Candidate q : pointsJ) {
        if (!SkyGeometry.isWithin(p, q, maxDistance)) {
          continue;
        }
        double dIJ = SkyGeometry.angularDistance(p, q);
        double expected = dtJK * dIJ / dtIJ;
        for (Candidate r : pointsK) {
          double dJK = SkyGeometry.angularDistance(q, r);
          if (dJK < expected - tolerance || dJK > expected + tolerance) {
            continue;
          }
          Triangle ordered = SkyGeometry.longestEdgeOrder(p, q, r);
          double length = SkyGeometry.angularDistance(ordered.first(), ordered.second());
          double height = SkyGeometry.pointLineDistance(ordered.first(), ordered.second(), ordered.third());
          if (length > minLength && height < maxHeight) {
            out.add(new Segment(p, q, r));
            accepted++;
          }
        }
      }
    }
    if (accepted > 0) {
      log.debug("Triplet {} produced {} segment(s)", triplet, accepted);
    }
    return accepted;
  }
}

package org.atrack.application.pipeline;

import static org.atrack.testutil.Fixtures.ARCSEC;
import static org.atrack.testutil.Fixtures.candidate;
import static org.atrack.testutil.Fixtures.config;
import static org.atrack.testutil.Fixtures.imageCandidates;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.atrack.domain.Candidate;
import org.atrack.domain.CandidateSet;
import org.atrack.domain.ImageCandidates;
import org.atrack.domain.ImageMetadata;
import org.atrack.domain.ImageTriplet;
import org.atrack.domain.Segment;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SegmentDetectorTest {
  private static final ImageTriplet FIRST_THREE = new ImageTriplet(0, 1, 2);

  private static Candidate along(int image, double arcsec) {
    return candidate(image, 150.0 + arcsec * ARCSEC, 0.0);
  }

  @Test
  void acceptsLinearMotionAtConstantRate() {
    Candidate p = along(0, 0);
    Candidate q = along(1, 10);
    Candidate r = along(2, 20);
    CandidateSet set = new CandidateSet(List.of(
        imageCandidates(0, 0, p), imageCandidates(1, 600, q), imageCandidates(2, 1200, r)));

    List<Segment> segments = new SegmentDetector(config()).detect(set, List.of(FIRST_THREE));

    assertEquals(1, segments.size());
    assertSame(p, segments.get(0).first());
    assertSame(q, segments.get(0).second());
    assertSame(r, segments.get(0).third());
  }

  @Test
  void extrapolationScalesWithUnevenSpacing() {
    CandidateSet set = new CandidateSet(List.of(
        imageCandidates(0, 0, along(0, 0)),
        imageCandidates(1, 600, along(1, 10)),
        imageCandidates(2, 1800, along(2, 30), along(2, 20))));

    List<Segment> segments = new SegmentDetector(config()).detect(set, List.of(FIRST_THREE));

    assertEquals(1, segments.size());
    assertEquals(150.0 + 30 * ARCSEC, segments.get(0).third().ra(), 1e-12);
  }

  @Test
  void rejectsPairsBeyondVelocityBound() {
    // 600 s at 0.05 arcsec/s allows 30 arcsec between the first two images
    CandidateSet set = new CandidateSet(List.of(
        imageCandidates(0, 0, along(0, 0)),
        imageCandidates(1, 600, along(1, 31)),
        imageCandidates(2, 1200, along(2, 62))));

    assertTrue(new SegmentDetector(config()).detect(set, List.of(FIRST_THREE)).isEmpty());
  }

  @Test
  void binningOfFirstImageShrinksSearchRadius() {
    ImageMetadata binned = new ImageMetadata(Instant.parse("2021-03-04T01:00:00Z"), 60.0, 2);
    CandidateSet set = new CandidateSet(List.of(
        new ImageCandidates(0, "img-000", binned, List.of(along(0, 0))),
        imageCandidates(1, 600, along(1, 20)),
        imageCandidates(2, 1200, along(2, 40))));

    assertTrue(new SegmentDetector(config()).detect(set, List.of(FIRST_THREE)).isEmpty());
  }

  @Test
  void rejectsShortAndBentTriples() {
    CandidateSet shortTrack = new CandidateSet(List.of(
        imageCandidates(0, 0, along(0, 0)),
        imageCandidates(1, 600, along(1, 0.5)),
        imageCandidates(2, 1200, along(2, 1.0))));
    CandidateSet bent = new CandidateSet(List.of(
        imageCandidates(0, 0, along(0, 0)),
        imageCandidates(1, 600, candidate(1, 150.0 + 10 * ARCSEC, 5 * ARCSEC)),
        imageCandidates(2, 1200, along(2, 22))));
    SegmentDetector detector = new SegmentDetector(config("tolerance", "5.0"));

    assertTrue(detector.detect(shortTrack, List.of(FIRST_THREE)).isEmpty());
    assertTrue(detector.detect(bent, List.of(FIRST_THREE)).isEmpty());
  }

  @Test
  void simultaneousFirstImagesProduceNothing() {
    CandidateSet set = new CandidateSet(List.of(
        imageCandidates(0, 0, along(0, 0)),
        imageCandidates(1, 0, along(1, 10)),
        imageCandidates(2, 600, along(2, 20))));
    List<Segment> out = new ArrayList<>();

    int accepted = new SegmentDetector(config()).detect(set, FIRST_THREE, out);

    assertEquals(0, accepted);
    assertTrue(out.isEmpty());
  }

  @Test
  void everyTripletOfASteadyMoverIsFound() {
    List<ImageCandidates> images = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      images.add(imageCandidates(i, 600.0 * i, along(i, 10.0 * i)));
    }
    CandidateSet set = new CandidateSet(images);

    List<Segment> segments = new SegmentDetector(config())
        .detect(set, ImageTriplet.combinations(set.imageIndices()));

    assertEquals(4, segments.size());
  }
}

package org.atrack.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.atrack.domain.Angles;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DetectionConfigTest {

  @Test
  void emptyMapGivesDefaults() {
    assertEquals(DetectionConfig.defaults(), DetectionConfig.fromMap(Map.of()));
  }

  @Test
  void pixelQuantitiesScaleWithPixelScale() {
    DetectionConfig config = DetectionConfig.fromMap(Map.of(
        "pixelScale", "0.5",
        "minTravel", "4",
        "maxHeight", "2",
        "tolerance", "6"));

    assertEquals(Angles.arcsecToRadians(2.0), config.transienceRadiusRad(), 1e-15);
    assertEquals(Angles.arcsecToRadians(4.0), config.minSegmentLengthRad(), 1e-15);
    assertEquals(Angles.arcsecToRadians(1.0), config.maxHeightRad(), 1e-15);
    assertEquals(Angles.arcsecToRadians(3.0), config.toleranceRad(), 1e-15);
  }

  @Test
  void parsesEnumsAndZones() {
    DetectionConfig config = DetectionConfig.fromMap(Map.of(
        "mergeStrategy", "connected",
        "pointIdentity", "tolerance",
        "pointTolerance", "0.5",
        "rejectArea", "\"0:10\",\"0:10\""));

    assertEquals(MergeStrategy.CONNECTED, config.mergeStrategy());
    assertEquals(PointIdentity.TOLERANCE, config.pointIdentity());
    assertEquals(1, config.exclusionZones().size());
    assertEquals(Angles.arcsecToRadians(0.5), config.pointToleranceRad(), 1e-15);
  }

  @Test
  void toMapRoundTripsThroughFromMap() {
    DetectionConfig config = DetectionConfig.fromMap(Map.of(
        "minSpeed", "0.25", "rejectArea", "\"1:2\",\"3:4\"", "mergeStrategy", "CONNECTED"));

    assertEquals(config, DetectionConfig.fromMap(config.toMap()));
  }

  @Test
  void invalidValuesNameTheKey() {
    IllegalArgumentException malformed = assertThrows(IllegalArgumentException.class,
        () -> DetectionConfig.fromMap(Map.of("pixelScale", "wide")));
    assertTrue(malformed.getMessage().contains("pixelScale"));

    IllegalArgumentException negative = assertThrows(IllegalArgumentException.class,
        () -> DetectionConfig.fromMap(Map.of("maxAngularVelocity", "-1")));
    assertTrue(negative.getMessage().contains("maxAngularVelocity"));

    assertThrows(IllegalArgumentException.class,
        () -> DetectionConfig.fromMap(Map.of("mergeStrategy", "sometimes")));
  }
}

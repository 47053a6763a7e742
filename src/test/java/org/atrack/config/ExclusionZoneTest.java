package org.atrack.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ExclusionZoneTest {

  @Test
  void parsesSemicolonSeparatedQuotedRanges() {
    List<ExclusionZone> zones = ExclusionZone.parseList("\"1:120\",\"1:4096\"; \"3980:4096\", \"1:4096\"");

    assertEquals(List.of(new ExclusionZone(1, 120, 1, 4096), new ExclusionZone(3980, 4096, 1, 4096)), zones);
  }

  @Test
  void falseNoneAndBlankMeanNoZones() {
    assertTrue(ExclusionZone.parseList(null).isEmpty());
    assertTrue(ExclusionZone.parseList("  ").isEmpty());
    assertTrue(ExclusionZone.parseList("False").isEmpty());
    assertTrue(ExclusionZone.parseList("none").isEmpty());
  }

  @Test
  void boundsAreInclusive() {
    ExclusionZone zone = new ExclusionZone(10, 20, 30, 40);

    assertTrue(zone.contains(10, 30));
    assertTrue(zone.contains(20, 40));
    assertFalse(zone.contains(9.99, 35));
    assertFalse(zone.contains(15, 40.01));
  }

  @Test
  void malformedEntriesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> ExclusionZone.parseList("\"1:120\""));
    assertThrows(IllegalArgumentException.class, () -> ExclusionZone.parseList("\"1-120\",\"1:5\""));
    assertThrows(IllegalArgumentException.class, () -> ExclusionZone.parseList("\"a:b\",\"1:5\""));
    assertThrows(IllegalArgumentException.class, () -> new ExclusionZone(5, 1, 0, 1));
  }

  @Test
  void formatParsesBackToTheSameZones() {
    List<ExclusionZone> zones = List.of(new ExclusionZone(1, 2.5, 3, 4), new ExclusionZone(0, 0, 7, 8));

    assertEquals(zones, ExclusionZone.parseList(ExclusionZone.format(zones)));
    assertEquals("False", ExclusionZone.format(List.of()));
  }
}

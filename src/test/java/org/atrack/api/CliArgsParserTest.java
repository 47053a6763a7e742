package org.atrack.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "catalogs=/data/night", " workers=4 ", "rejectArea=\"1:2\",\"3:4\"", "master="});

    assertEquals("/data/night", map.get("catalogs"));
    assertEquals("4", map.get("workers"));
    assertEquals("\"1:2\",\"3:4\"", map.get("rejectArea"));
    assertEquals("", map.get("master"));
  }

  @Test
  void valuesMayContainEqualsSigns() {
    assertEquals("site=lasilla,t=1",
        CliArgsParser.toMap(new String[] {"otelResourceAttributes=site=lasilla,t=1"}).get("otelResourceAttributes"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"catalogs"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"1abc=x"}));
    assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"workers=2", "workers=3"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"out=a\u0007b"}));
  }

  @Test
  void nullAndBlankArgumentsAreIgnored() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {null, "  "}).isEmpty());
  }
}

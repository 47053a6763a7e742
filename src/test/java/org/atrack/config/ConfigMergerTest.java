package org.atrack.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlOverridesDefaultsAndWarns() {
    Map<String, String> defaults = Map.of("catalogs", "", "minSpeed", "0.1", "workers", "8");
    Map<String, String> yaml = Map.of("catalogs", "/data/night", "minSpeed", "0.5");
    Map<String, String> cli = Map.of("minSpeed", "1.0");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "detect", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("/data/night", merged.get("catalogs"));
    assertEquals("1.0", merged.get("minSpeed"));
    assertEquals("8", merged.get("workers"));
    assertEquals(List.of("CLI overrides YAML for key: minSpeed"), warnings);
  }

  @Test
  void catalogsAreRequired() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "candidates", Optional.empty(), Map.of(), DefaultsForMode.asFlatMap("candidates"), msg -> {}));
  }

  @Test
  void toleranceIdentityNeedsAPositiveTolerance() {
    Map<String, String> cli = Map.of("catalogs", "/data", "pointIdentity", "TOLERANCE");

    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "detect", Optional.empty(), cli, DefaultsForMode.asFlatMap("detect"), msg -> {}));

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "detect",
        Optional.of(Map.of("pointTolerance", "0.3")),
        cli,
        DefaultsForMode.asFlatMap("detect"),
        msg -> {});
    assertEquals("0.3", merged.get("pointTolerance"));
  }
}

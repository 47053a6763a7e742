package org.atrack.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each A-Track command.
 *
 * <p>Threshold defaults come from {@link DetectionConfig#defaults()} so the two never drift apart.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode command name ({@code candidates} or {@code detect})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for unknown commands
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "candidates" -> buildCandidatesDefaults();
      case "detect" -> buildDetectDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("out", RunConfig.defaultOutputDirectory().toString());
    map.put("frames", "");
    map.put("master", "");
    map.put("workers", Integer.toString(RunConfig.defaultWorkers()));
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildCandidatesDefaults() {
    Map<String, String> all = DetectionConfig.defaults().toMap();
    Map<String, String> map = new LinkedHashMap<>();
    for (String key : new String[] {
        "minFwhm", "fwhmCoefficient", "maxFlux", "maxFlagSum", "maxElongation", "minSnr",
        "minTravel", "pixelScale", "rejectArea"}) {
      map.put(key, all.get(key));
    }
    return map;
  }

  private static Map<String, String> buildDetectDefaults() {
    Map<String, String> map = new LinkedHashMap<>(DetectionConfig.defaults().toMap());
    map.put("keepSegments", "false");
    return map;
  }
}

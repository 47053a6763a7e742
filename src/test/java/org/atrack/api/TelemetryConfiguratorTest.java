package org.atrack.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.atrack.infrastructure.metrics.TelemetrySettings;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {

  @Test
  void consumesTelemetryKeys() {
    Map<String, String> config = new HashMap<>(Map.of(
        "metricsExporter", "OTLP",
        "otelEndpoint", "https://collector.example:4317",
        "otelResourceAttributes", "site=lasilla",
        "catalogs", "/data"));

    TelemetrySettings settings = TelemetryConfigurator.configure(config);

    assertEquals(TelemetrySettings.Exporter.OTLP, settings.exporter());
    assertEquals("https://collector.example:4317", settings.endpoint());
    assertEquals(Map.of("site", "lasilla"), settings.resourceAttributes());
    assertFalse(config.containsKey("metricsExporter"));
    assertEquals(Map.of("catalogs", "/data"), config);
  }

  @Test
  void rejectsUnknownExporterAndBadEndpoint() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configure(new HashMap<>(Map.of("metricsExporter", "statsd"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configure(new HashMap<>(Map.of("otelEndpoint", "grpc://collector:4317"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configure(new HashMap<>(Map.of("otelEndpoint", "http:///nohost"))));
  }

  @Test
  void dryRunAndOverwriteFlagsParseStrictly() {
    assertEquals(true, ConfigCliUtils.parseBoolean(Map.of("dryRun", " TRUE "), "dryRun", false));
    assertEquals(false, ConfigCliUtils.parseBoolean(Map.of(), "dryRun", false));
    assertThrows(IllegalArgumentException.class,
        () -> ConfigCliUtils.parseBoolean(Map.of("allowOverwrite", "yes"), "allowOverwrite", false));
  }
}

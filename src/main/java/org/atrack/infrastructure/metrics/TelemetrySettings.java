package org.atrack.infrastructure.metrics;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exporter settings resolved from system properties first, then {@code OTEL_*} environment variables.
 *
 * @param exporter exporter mode
 * @param endpoint OTLP gRPC endpoint
 * @param resourceAttributes extra resource attributes
 * @param exportInterval periodic export interval
 * @since 0.1.0
 */
public record TelemetrySettings(
    Exporter exporter, String endpoint, Map<String, String> resourceAttributes, Duration exportInterval) {
  private static final Logger log = LoggerFactory.getLogger(TelemetrySettings.class);

  static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

  public TelemetrySettings {
    Objects.requireNonNull(exporter, "exporter");
    Objects.requireNonNull(endpoint, "endpoint");
    resourceAttributes = Map.copyOf(resourceAttributes);
    Objects.requireNonNull(exportInterval, "exportInterval");
  }

  /** Metrics exporter selection. */
  public enum Exporter {
    OTLP,
    NONE;

    static Exporter parse(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "otlp" -> OTLP;
        case "none" -> NONE;
        default -> {
          log.warn("Unknown metrics exporter '{}'; metrics disabled", raw);
          yield NONE;
        }
      };
    }
  }

  /**
   * Resolves settings from the JVM system properties and process environment.
   *
   * @return settings
   */
  public static TelemetrySettings fromEnvironment() {
    return resolve(System.getProperties(), System::getenv);
  }

  static TelemetrySettings resolve(Properties properties, Function<String, String> env) {
    Exporter exporter = Exporter.parse(
        pick(properties.getProperty("otel.metrics.exporter"), env.apply("OTEL_METRICS_EXPORTER")));
    String endpoint = pick(
        properties.getProperty("otel.exporter.otlp.endpoint"), env.apply("OTEL_EXPORTER_OTLP_ENDPOINT"));
    String attributes = pick(
        properties.getProperty("otel.resource.attributes"), env.apply("OTEL_RESOURCE_ATTRIBUTES"));
    return new TelemetrySettings(
        exporter,
        endpoint == null ? DEFAULT_ENDPOINT : endpoint,
        parseAttributes(attributes),
        DEFAULT_INTERVAL);
  }

  /**
   * Parses {@code k1=v1,k2=v2}; malformed entries are logged and skipped.
   *
   * @param raw attribute list, may be {@code null}
   * @return attributes in declaration order
   */
  public static Map<String, String> parseAttributes(String raw) {
    Map<String, String> attributes = new LinkedHashMap<>();
    if (raw == null) {
      return attributes;
    }
    for (String entry : raw.split(",")) {
      String trimmed = entry.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      int eq = trimmed.indexOf('=');
      String key = eq < 0 ? "" : trimmed.substring(0, eq).trim();
      String value = eq < 0 ? "" : trimmed.substring(eq + 1).trim();
      if (key.isEmpty() || value.isEmpty()) {
        log.warn("Ignoring malformed resource attribute '{}'", trimmed);
        continue;
      }
      attributes.put(key, value);
    }
    return attributes;
  }

  private static String pick(String property, String environment) {
    if (property != null && !property.isBlank()) {
      return property.trim();
    }
    if (environment != null && !environment.isBlank()) {
      return environment.trim();
    }
    return null;
  }
}

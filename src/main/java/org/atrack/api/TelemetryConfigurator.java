package org.atrack.api;

import org.atrack.infrastructure.metrics.TelemetrySettings;
import org.atrack.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} keys into
 * {@link TelemetrySettings}, removing them from the configuration map. Blank keys fall back to the
 * {@code otel.*} system properties and {@code OTEL_*} environment variables.
 *
 * @since 0.1.0
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  static TelemetrySettings configure(Map<String, String> config) {
    TelemetrySettings environment = TelemetrySettings.fromEnvironment();
    String exporterRaw = trim(config.remove("metricsExporter"));
    String endpointRaw = trim(config.remove("otelEndpoint"));
    String attributesRaw = trim(config.remove("otelResourceAttributes"));

    TelemetrySettings.Exporter exporter = environment.exporter();
    if (!exporterRaw.isEmpty()) {
      exporter = switch (exporterRaw.toLowerCase(Locale.ROOT)) {
        case "otlp" -> TelemetrySettings.Exporter.OTLP;
        case "none" -> TelemetrySettings.Exporter.NONE;
        default -> throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      };
    }
    String endpoint = environment.endpoint();
    if (!endpointRaw.isEmpty()) {
      validateEndpoint(endpointRaw);
      endpoint = endpointRaw;
    }
    Map<String, String> attributes = environment.resourceAttributes();
    if (!attributesRaw.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributesRaw, MAX_ATTRIBUTES_LENGTH);
      attributes = TelemetrySettings.parseAttributes(attributesRaw);
    }
    log.debug("Metrics exporter {} (endpoint {})", exporter, endpoint);
    return new TelemetrySettings(exporter, endpoint, attributes, environment.exportInterval());
  }

  private static void validateEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}

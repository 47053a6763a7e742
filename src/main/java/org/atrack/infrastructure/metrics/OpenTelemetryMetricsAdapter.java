package org.atrack.infrastructure.metrics;

import org.atrack.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} that records counters and observations with OpenTelemetry.
 * <p>{@link #increment(String)} feeds a monotonic {@code LongCounter}; {@link #observe(String, long)} feeds a
 * {@code LongHistogram}, in nanoseconds for keys ending with {@code .nanos}. Every point carries the original key as
 * attribute {@code atrack.metric.key}.</p>
 * <p><strong>Thread-safety:</strong> safe for concurrent use by worker threads; instruments are created once per
 * key.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("atrack.metric.key");
  private static final String NANOS_SUFFIX = ".nanos";

  private final OpenTelemetryBootstrap.MeterHandle handle;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /** Creates an adapter configured from system properties and environment. */
  public OpenTelemetryMetricsAdapter() {
    this(TelemetrySettings.fromEnvironment());
  }

  /**
   * Creates an adapter for explicit settings.
   *
   * @param settings exporter settings
   */
  public OpenTelemetryMetricsAdapter(TelemetrySettings settings) {
    this(OpenTelemetryBootstrap.initialize(settings));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.MeterHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
  }

  /**
   * Reports whether points are actually exported.
   *
   * @return {@code true} when running without an exporter
   */
  public boolean isNoop() {
    return handle.isNoop();
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    if (handle.isNoop()) {
      return;
    }
    Counter counter = counters.computeIfAbsent(key, this::newCounter);
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    if (handle.isNoop()) {
      return;
    }
    Histogram histogram = histograms.computeIfAbsent(key, this::newHistogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  /** Pushes pending points to the exporter. */
  public void forceFlush() {
    handle.forceFlush();
  }

  /** Flushes and shuts the meter provider down. */
  @Override
  public void close() {
    handle.close();
  }

  private Counter newCounter(String key) {
    Meter meter = handle.meter();
    LongCounter counter = meter.counterBuilder(instrumentName(key))
        .setUnit("1")
        .setDescription("A-Track count of " + key)
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY, key));
  }

  private Histogram newHistogram(String key) {
    Meter meter = handle.meter();
    LongHistogram histogram = meter.histogramBuilder(instrumentName(key))
        .ofLongs()
        .setUnit(key.endsWith(NANOS_SUFFIX) ? "ns" : "1")
        .setDescription("A-Track observation of " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY, key));
  }

  /**
   * Maps a metric key to a valid instrument name: lower case, letters, digits, {@code _ . -}, starting with a
   * letter.
   *
   * @param key metric key
   * @return instrument name
   */
  static String instrumentName(String key) {
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder name = new StringBuilder("atrack.");
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      boolean allowed = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '.' || c == '-';
      name.append(allowed ? c : '_');
    }
    String result = name.toString();
    if (!result.equals("atrack." + key)) {
      log.debug("Metric key '{}' exported as '{}'", key, result);
    }
    return result;
  }

  private record Counter(LongCounter instrument, Attributes attributes) {}

  private record Histogram(LongHistogram instrument, Attributes attributes) {}
}

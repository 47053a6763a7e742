package org.atrack.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the detection pipeline.
 * <p><strong>Why:</strong> Lets pipeline stages count candidates, segments and tracks without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} serves tests and
 * library callers.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from worker threads.</p>
 *
 * @implNote Metric keys use dotted names such as {@code detect.segments}; callers never pass {@code null}.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier, e.g. {@code candidates.images}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key metric identifier, e.g. {@code detect.phase.merge.nanos}
   * @param value observed value; semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}

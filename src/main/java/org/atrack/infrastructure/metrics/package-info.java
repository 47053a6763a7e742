/**
 * OpenTelemetry-backed {@link org.atrack.application.port.MetricsPort} implementation and its SDK bootstrap.
 *
 * <p>The exporter is selected by {@code otel.metrics.exporter} ({@code otlp} or {@code none}); the CLI sets it from
 * the {@code metricsExporter} key.</p>
 */
package org.atrack.infrastructure.metrics;

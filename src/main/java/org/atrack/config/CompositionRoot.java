package org.atrack.config;

import org.atrack.application.pipeline.DetectionUseCase;
import org.atrack.application.port.CandidateSink;
import org.atrack.application.port.CatalogSource;
import org.atrack.application.port.MetricsPort;
import org.atrack.application.port.SegmentBatchStore;
import org.atrack.application.port.TrackSink;
import org.atrack.infrastructure.catalog.DirectoryCatalogSource;
import org.atrack.infrastructure.persistence.CandidateCsvWriter;
import org.atrack.infrastructure.persistence.InMemorySegmentBatchStore;
import org.atrack.infrastructure.persistence.NdjsonSegmentBatchStore;
import org.atrack.infrastructure.persistence.NdjsonTrackWriter;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the detection use case to file adapters for one run.
 * <p><strong>Role:</strong> the only place that picks concrete adapters; the CLIs never construct them directly.</p>
 * <ul>
 *   <li>{@code candidates}: candidate CSV files, in-memory segment store, no track output.</li>
 *   <li>{@code detect}: candidate CSV files, NDJSON segment batches under {@code <out>/segments}, NDJSON tracks.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final DetectionConfig detection;
  private final RunConfig run;
  private final MetricsPort metrics;

  /**
   * Creates a composition root.
   *
   * @param detection detection thresholds
   * @param run paths and worker settings
   * @param metrics metrics adapter shared by every component
   */
  public CompositionRoot(DetectionConfig detection, RunConfig run, MetricsPort metrics) {
    this.detection = Objects.requireNonNull(detection, "detection");
    this.run = Objects.requireNonNull(run, "run");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public CatalogSource catalogSource() {
    return new DirectoryCatalogSource(run.catalogDirectory(), run.effectiveFramesManifest(), run.masterCatalog());
  }

  /** Use case for the {@code candidates} command. */
  public DetectionUseCase candidatesUseCase() {
    return build(new InMemorySegmentBatchStore(), TrackSink.NONE);
  }

  /** Use case for the {@code detect} command. */
  public DetectionUseCase detectUseCase() {
    return build(new NdjsonSegmentBatchStore(run.segmentsDirectory()), new NdjsonTrackWriter(run.tracksFile()));
  }

  private DetectionUseCase build(SegmentBatchStore segments, TrackSink tracks) {
    CandidateSink candidates = new CandidateCsvWriter(run.candidatesDirectory());
    return new DetectionUseCase(detection, run.workers(), run.keepSegments(), segments, candidates, tracks, metrics);
  }

  public MetricsPort metrics() {
    return metrics;
  }
}

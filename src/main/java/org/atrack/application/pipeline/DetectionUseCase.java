package org.atrack.application.pipeline;

import org.atrack.application.pipeline.CandidateFilter.ScreenedMaster;
import org.atrack.application.pipeline.TrackClassifier.Classification;
import org.atrack.application.port.CandidateSink;
import org.atrack.application.port.MetricsPort;
import org.atrack.application.port.SegmentBatchStore;
import org.atrack.application.port.TrackSink;
import org.atrack.config.DetectionConfig;
import org.atrack.domain.CandidateSet;
import org.atrack.domain.Catalog;
import org.atrack.domain.ClassifiedTrack;
import org.atrack.domain.ImageCandidates;
import org.atrack.domain.ImageTriplet;
import org.atrack.domain.MasterCatalog;
import org.atrack.domain.Segment;
import org.atrack.domain.Track;
import org.atrack.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs moving-object detection end to end over the catalogs of one image sequence.
 * <p><strong>Why:</strong> Keeps phase ordering, worker pools and failure handling in one place so the stage classes
 * stay pure.</p>
 * <p><strong>Role:</strong> Application-layer use case driven by the {@code candidates} and {@code detect} CLIs.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Filter every image in parallel, one task per image, and hand each result to the {@link CandidateSink}.</li>
 *   <li>Partition all image triplets across workers; each worker writes its segments to the
 *   {@link SegmentBatchStore} under its own index.</li>
 *   <li>Join all workers, merge the stored batches into tracks, classify them and hand them to the
 *   {@link TrackSink}.</li>
 * </ul>
 * <p><strong>Failure:</strong> the first failing worker cancels the rest of its phase and the run aborts with that
 * worker's exception; no partial result is merged.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe for concurrent runs sharing one {@link SegmentBatchStore}.</p>
 * <p><strong>Observability:</strong> MDC keys {@code image} and {@code worker} tag worker log lines; metrics
 * {@code candidates.*}, {@code detect.*} and {@code detect.phase.<name>.nanos}.</p>
 *
 * @since 0.1.0
 */
public final class DetectionUseCase {
  private static final Logger log = LoggerFactory.getLogger(DetectionUseCase.class);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

  private final int workers;
  private final boolean keepSegments;
  private final CandidateFilter filter;
  private final SegmentDetector detector;
  private final SegmentMerger merger;
  private final TrackClassifier classifier;
  private final SegmentBatchStore segmentStore;
  private final CandidateSink candidateSink;
  private final TrackSink trackSink;
  private final MetricsPort metrics;

  /**
   * Creates a use case.
   *
   * @param config detection thresholds
   * @param workers worker pool size for both parallel phases
   * @param keepSegments keep stored segment batches after merging
   * @param segmentStore exchange area for worker segment batches
   * @param candidateSink receiver of per-image candidates
   * @param trackSink receiver of classified tracks
   * @param metrics metrics port
   */
  public DetectionUseCase(
      DetectionConfig config,
      int workers,
      boolean keepSegments,
      SegmentBatchStore segmentStore,
      CandidateSink candidateSink,
      TrackSink trackSink,
      MetricsPort metrics) {
    Objects.requireNonNull(config, "config");
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be >= 1 (was " + workers + ")");
    }
    this.workers = workers;
    this.keepSegments = keepSegments;
    this.filter = new CandidateFilter(config);
    this.detector = new SegmentDetector(config);
    this.merger = new SegmentMerger(config);
    this.classifier = new TrackClassifier(config);
    this.segmentStore = Objects.requireNonNull(segmentStore, "segmentStore");
    this.candidateSink = Objects.requireNonNull(candidateSink, "candidateSink");
    this.trackSink = Objects.requireNonNull(trackSink, "trackSink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs every phase.
   *
   * @param catalogs per-image catalogs ordered by image index
   * @param master stacked master catalog
   * @return candidates, tracks and their classification
   * @throws IOException when a sink or the segment store fails
   * @throws InterruptedException when interrupted while waiting for workers
   */
  public DetectionResult run(List<Catalog> catalogs, MasterCatalog master)
      throws IOException, InterruptedException {
    CandidateSet candidates = selectCandidates(catalogs, master);
    List<Segment> segments = detectSegments(candidates);

    long mergeStart = System.nanoTime();
    List<Track> tracks = merger.merge(segments);
    metrics.observe("detect.phase.merge.nanos", System.nanoTime() - mergeStart);
    metrics.observe("detect.tracks", tracks.size());

    Classification classification = classifier.classify(tracks, candidates.metadataByImage());
    for (ClassifiedTrack track : classification.all()) {
      metrics.increment(track.isMoving() ? "detect.tracks.moving" : "detect.tracks.uncertain");
    }
    trackSink.write(classification.all());

    if (classification.isEmpty()) {
      log.info("Could not find any moving objects in {} images", candidates.imageCount());
    } else {
      log.info("Detected {} moving objects and {} uncertain objects from {} segments",
          classification.moving().size(), classification.uncertain().size(), segments.size());
    }
    return new DetectionResult(candidates, segments.size(), tracks, classification);
  }

  /**
   * Filters every image in parallel.
   *
   * @param catalogs per-image catalogs
   * @param master stacked master catalog
   * @return candidates keyed by image index
   * @throws IOException when the candidate sink fails
   * @throws InterruptedException when interrupted while waiting for workers
   */
  public CandidateSet selectCandidates(List<Catalog> catalogs, MasterCatalog master)
      throws IOException, InterruptedException {
    Objects.requireNonNull(catalogs, "catalogs");
    long start = System.nanoTime();
    ScreenedMaster screened = filter.screenMaster(master);

    List<Callable<ImageCandidates>> tasks = new ArrayList<>(catalogs.size());
    for (Catalog catalog : catalogs) {
      tasks.add(() -> withMdc("image", catalog.name(), () -> {
        ImageCandidates selected = filter.select(catalog, screened);
        candidateSink.write(selected);
        metrics.increment("candidates.images");
        metrics.observe("candidates.kept", selected.candidates().size());
        return selected;
      }));
    }
    CandidateSet candidates = new CandidateSet(runParallel("filter", tasks));
    metrics.observe("detect.phase.filter.nanos", System.nanoTime() - start);
    log.info("Selected {} candidates across {} images", candidates.totalCandidates(), candidates.imageCount());
    return candidates;
  }

  /**
   * Searches all image triplets in parallel and returns the joined segments.
   *
   * @param candidates per-image candidates
   * @return segments in worker order
   * @throws IOException when the segment store fails
   * @throws InterruptedException when interrupted while waiting for workers
   */
  public List<Segment> detectSegments(CandidateSet candidates) throws IOException, InterruptedException {
    Objects.requireNonNull(candidates, "candidates");
    long start = System.nanoTime();
    List<ImageTriplet> triplets = ImageTriplet.combinations(candidates.imageIndices());
    List<List<ImageTriplet>> partitions = WorkloadPartitioner.partition(triplets, workers);
    log.info("Searching {} triplets on {} workers", triplets.size(), partitions.size());

    segmentStore.clear();
    List<Callable<Integer>> tasks = new ArrayList<>(partitions.size());
    for (int w = 0; w < partitions.size(); w++) {
      int worker = w;
      List<ImageTriplet> partition = partitions.get(w);
      tasks.add(() -> withMdc("worker", Integer.toString(worker), () -> {
        List<Segment> found = detector.detect(candidates, partition);
        segmentStore.write(worker, found);
        metrics.observe("detect.triplets", partition.size());
        metrics.observe("detect.segments", found.size());
        log.debug("Worker {} searched {} triplets and found {} segments", worker, partition.size(), found.size());
        return found.size();
      }));
    }
    runParallel("detect", tasks);

    List<Segment> segments = segmentStore.readAll();
    if (!keepSegments) {
      segmentStore.clear();
    }
    metrics.observe("detect.phase.detect.nanos", System.nanoTime() - start);
    log.info("Found {} segments", segments.size());
    return segments;
  }

  private <T> List<T> runParallel(String phase, List<Callable<T>> tasks)
      throws IOException, InterruptedException {
    if (tasks.isEmpty()) {
      return List.of();
    }
    ExecutorService executor = ExecutorFactories.newWorkerPool(
        Math.min(workers, tasks.size()),
        "atrack-" + phase,
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
    CompletionService<T> completion = new ExecutorCompletionService<>(executor);
    List<Future<T>> futures = new ArrayList<>(tasks.size());
    Map<Future<T>, Integer> positions = new IdentityHashMap<>();
    try {
      for (int i = 0; i < tasks.size(); i++) {
        Future<T> future = completion.submit(tasks.get(i));
        futures.add(future);
        positions.put(future, i);
      }
      List<T> results = new ArrayList<>(tasks.size());
      for (int i = 0; i < tasks.size(); i++) {
        results.add(null);
      }
      for (int done = 0; done < tasks.size(); done++) {
        Future<T> future = completion.take();
        try {
          results.set(positions.get(future), future.get());
        } catch (ExecutionException ex) {
          log.error("{} worker failed; cancelling remaining tasks", phase, ex.getCause());
          cancelAll(futures);
          executor.shutdownNow();
          rethrow(phase, ex.getCause());
        }
      }
      return results;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("{} phase interrupted; requesting shutdown", phase);
      cancelAll(futures);
      executor.shutdownNow();
      throw ex;
    } finally {
      if (!executor.isShutdown()) {
        ExecutorFactories.shutdownAndAwait(executor, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      }
    }
  }

  private static <T> void cancelAll(List<Future<T>> futures) {
    for (Future<T> future : futures) {
      future.cancel(true);
    }
  }

  private static void rethrow(String phase, Throwable cause) throws IOException {
    if (cause instanceof IOException io) {
      throw io;
    }
    if (cause instanceof RuntimeException runtime) {
      throw runtime;
    }
    if (cause instanceof Error error) {
      throw error;
    }
    throw new IllegalStateException(phase + " worker failed", cause);
  }

  private static <T> T withMdc(String key, String value, Callable<T> body) throws Exception {
    String previous = MDC.get(key);
    MDC.put(key, value);
    try {
      return body.call();
    } finally {
      if (previous == null) {
        MDC.remove(key);
      } else {
        MDC.put(key, previous);
      }
    }
  }

  /**
   * Outcome of a full detection run.
   *
   * @param candidates filtered candidates per image
   * @param segmentCount number of segments found before merging
   * @param tracks merged tracks in object id order
   * @param classification moving and uncertain tracks
   */
  public record DetectionResult(
      CandidateSet candidates, int segmentCount, List<Track> tracks, Classification classification) {
    public DetectionResult {
      Objects.requireNonNull(candidates, "candidates");
      tracks = List.copyOf(tracks);
      Objects.requireNonNull(classification, "classification");
    }
  }
}

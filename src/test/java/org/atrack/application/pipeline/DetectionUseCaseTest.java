package org.atrack.application.pipeline;

import static org.atrack.testutil.Fixtures.catalog;
import static org.atrack.testutil.Fixtures.config;
import static org.atrack.testutil.Fixtures.movingObjectSequence;
import static org.atrack.testutil.Fixtures.star;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.atrack.application.pipeline.DetectionUseCase.DetectionResult;
import org.atrack.application.port.CandidateSink;
import org.atrack.application.port.SegmentBatchStore;
import org.atrack.application.port.TrackSink;
import org.atrack.config.DetectionConfig;
import org.atrack.domain.Catalog;
import org.atrack.domain.ClassifiedTrack;
import org.atrack.domain.ImageCandidates;
import org.atrack.domain.MasterCatalog;
import org.atrack.domain.Segment;
import org.atrack.domain.TrackClass;
import org.atrack.infrastructure.persistence.InMemorySegmentBatchStore;
import org.atrack.testutil.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DetectionUseCaseTest {
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private RecordingMetricsPort metrics;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(DetectionUseCase.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    metrics = new RecordingMetricsPort();
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
      appender.stop();
    }
  }

  private DetectionUseCase useCase(
      DetectionConfig config, int workers, SegmentBatchStore store, CandidateSink candidates, TrackSink tracks) {
    return new DetectionUseCase(config, workers, false, store, candidates, tracks, metrics);
  }

  @Test
  void detectsObjectMovingAcrossFourFrames() throws Exception {
    List<Catalog> catalogs = movingObjectSequence(10);
    List<ImageCandidates> written = Collections.synchronizedList(new ArrayList<>());
    List<ClassifiedTrack> sunk = new ArrayList<>();

    DetectionResult result = useCase(config(), 3, new InMemorySegmentBatchStore(), written::add, sunk::addAll)
        .run(catalogs, MasterCatalogBuilder.union(catalogs));

    assertEquals(4, result.candidates().totalCandidates());
    assertEquals(4, written.size());
    assertEquals(4, result.segmentCount());
    assertEquals(1, result.tracks().size());
    assertEquals(4, result.tracks().get(0).size());
    assertEquals(1, sunk.size());
    ClassifiedTrack track = sunk.get(0);
    assertEquals(1, track.objectId());
    assertEquals(TrackClass.MOVING, track.classification());
    assertEquals(1.0, track.speedArcsecPerMin(), 1e-6);

    assertEquals(4, metrics.count("candidates.images"));
    assertEquals(4, metrics.observedSum("candidates.kept"));
    assertEquals(4, metrics.observedSum("detect.triplets"));
    assertEquals(4, metrics.observedSum("detect.segments"));
    assertEquals(List.of(1L), metrics.observed("detect.tracks"));
    assertEquals(1, metrics.count("detect.tracks.moving"));
    assertEquals(1, metrics.observed("detect.phase.filter.nanos").size());
    assertEquals(1, metrics.observed("detect.phase.detect.nanos").size());
    assertEquals(1, metrics.observed("detect.phase.merge.nanos").size());
  }

  @Test
  void slowTrackIsReportedAsUncertain() throws Exception {
    List<Catalog> catalogs = movingObjectSequence(10);

    DetectionResult result = useCase(config("minSpeed", "2"), 2, new InMemorySegmentBatchStore(),
        CandidateSink.NONE, TrackSink.NONE).run(catalogs, MasterCatalogBuilder.union(catalogs));

    assertTrue(result.classification().moving().isEmpty());
    assertEquals(1, result.classification().uncertain().size());
    assertEquals(1, metrics.count("detect.tracks.uncertain"));
  }

  @Test
  void resultDoesNotDependOnWorkerCount() throws Exception {
    List<Catalog> catalogs = movingObjectSequence(10);
    MasterCatalog master = MasterCatalogBuilder.union(catalogs);

    DetectionResult single = useCase(config(), 1, new InMemorySegmentBatchStore(),
        CandidateSink.NONE, TrackSink.NONE).run(catalogs, master);
    DetectionResult many = useCase(config(), 8, new InMemorySegmentBatchStore(),
        CandidateSink.NONE, TrackSink.NONE).run(catalogs, master);

    assertEquals(single.tracks(), many.tracks());
  }

  @Test
  void staticFieldReportsNoMovingObjects() throws Exception {
    List<Catalog> catalogs = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      catalogs.add(catalog(i, 600.0 * i, star(150.2, 0.1), star(149.8, -0.1)));
    }
    List<ClassifiedTrack> sunk = new ArrayList<>();

    DetectionResult result = useCase(config(), 2, new InMemorySegmentBatchStore(), CandidateSink.NONE, sunk::addAll)
        .run(catalogs, MasterCatalogBuilder.union(catalogs));

    assertEquals(0, result.candidates().totalCandidates());
    assertTrue(result.tracks().isEmpty());
    assertTrue(sunk.isEmpty());
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.INFO
            && event.getFormattedMessage().contains("Could not find any moving objects"));
    assertTrue(logged);
  }

  @Test
  void emptyMasterYieldsNoCandidates() throws Exception {
    List<Catalog> catalogs = movingObjectSequence(10);

    DetectionResult result = useCase(config(), 2, new InMemorySegmentBatchStore(),
        CandidateSink.NONE, TrackSink.NONE).run(catalogs, new MasterCatalog(List.of()));

    assertEquals(0, result.candidates().totalCandidates());
    assertEquals(4, result.candidates().imageCount());
    assertTrue(result.classification().isEmpty());
  }

  @Test
  void failingWorkerAbortsBeforeMerging() {
    List<Catalog> catalogs = movingObjectSequence(10);
    IOException failure = new IOException("disk full");
    InMemorySegmentBatchStore delegate = new InMemorySegmentBatchStore();
    SegmentBatchStore failing = new SegmentBatchStore() {
      @Override
      public void write(int worker, List<Segment> segments) throws IOException {
        if (worker == 1) {
          throw failure;
        }
        delegate.write(worker, segments);
      }

      @Override
      public List<Segment> readAll() {
        return delegate.readAll();
      }

      @Override
      public void clear() {
        delegate.clear();
      }
    };
    AtomicBoolean tracksWritten = new AtomicBoolean();

    IOException thrown = assertThrows(IOException.class,
        () -> useCase(config(), 2, failing, CandidateSink.NONE, tracks -> tracksWritten.set(true))
            .run(catalogs, MasterCatalogBuilder.union(catalogs)));

    assertSame(failure, thrown);
    assertFalse(tracksWritten.get());
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("detect worker failed"));
    assertTrue(logged);
  }

  @Test
  void failingCandidateSinkPropagates() {
    List<Catalog> catalogs = movingObjectSequence(10);
    CandidateSink broken = image -> {
      throw new IOException("cannot write " + image.name());
    };

    assertThrows(IOException.class,
        () -> useCase(config(), 2, new InMemorySegmentBatchStore(), broken, TrackSink.NONE)
            .run(catalogs, MasterCatalogBuilder.union(catalogs)));
  }
}

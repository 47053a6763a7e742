package org.atrack.infrastructure.persistence;

import org.atrack.application.port.SegmentBatchStore;
import org.atrack.domain.Segment;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Heap-backed {@link SegmentBatchStore} for library use and tests.
 * <p>Thread-safe; batches are returned in worker order.</p>
 */
public final class InMemorySegmentBatchStore implements SegmentBatchStore {
  private final Map<Integer, List<Segment>> batches = new TreeMap<>();

  @Override
  public synchronized void write(int worker, List<Segment> segments) {
    if (batches.putIfAbsent(worker, List.copyOf(segments)) != null) {
      throw new IllegalStateException("batch already written for worker " + worker);
    }
  }

  @Override
  public synchronized List<Segment> readAll() {
    List<Segment> all = new ArrayList<>();
    batches.values().forEach(all::addAll);
    return all;
  }

  @Override
  public synchronized void clear() {
    batches.clear();
  }

  /**
   * Number of stored batches.
   *
   * @return batch count
   */
  public synchronized int batchCount() {
    return batches.size();
  }
}

package org.atrack.application.port;

import org.atrack.domain.Segment;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Exchange area for segments found by detection workers.
 * <p><strong>Role:</strong> Each worker writes one batch under its own index; the merge phase reads every batch
 * after all workers have finished.</p>
 * <p><strong>Thread-safety:</strong> {@link #write} is called concurrently with distinct worker indices;
 * {@link #readAll} and {@link #clear} run on the coordinating thread only.</p>
 *
 * @since 0.1.0
 */
public interface SegmentBatchStore {
  /**
   * Stores the segments found by one worker.
   *
   * @param worker zero-based worker index, unique per batch
   * @param segments segments in discovery order
   * @throws IOException when the batch cannot be persisted
   */
  void write(int worker, List<Segment> segments) throws IOException;

  /**
   * Reads every stored batch in worker order and concatenates their segments.
   *
   * @return all segments, worker 0 first
   * @throws IOException when a batch cannot be read
   */
  List<Segment> readAll() throws IOException;

  /**
   * Discards every stored batch.
   *
   * @throws IOException when batches cannot be removed
   */
  void clear() throws IOException;
}

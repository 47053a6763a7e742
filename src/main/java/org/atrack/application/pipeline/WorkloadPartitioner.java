package org.atrack.application.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits ordered work into contiguous, nearly equal chunks, one per worker.
 *
 * <p>At each step {@code k} (starting at the smaller of the worker count and item count, decreasing by one) the next
 * {@code ceil(remaining / k)} items form a partition. The result has at most {@code workerCount} non-empty
 * partitions of non-increasing size whose concatenation is the input.</p>
 *
 * @since 0.1.0
 */
public final class WorkloadPartitioner {

  private WorkloadPartitioner() {}

  /**
   * Partitions {@code items} for {@code workerCount} workers.
   *
   * @param items ordered work items
   * @param workerCount number of workers, at least 1
   * @param <T> item type
   * @return partitions in input order; empty when {@code items} is empty
   * @throws IllegalArgumentException when {@code workerCount < 1}
   */
  public static <T> List<List<T>> partition(List<T> items, int workerCount) {
    Objects.requireNonNull(items, "items");
    if (workerCount < 1) {
      throw new IllegalArgumentException("workerCount must be >= 1 (was " + workerCount + ")");
    }
    List<List<T>> partitions = new ArrayList<>(Math.min(workerCount, items.size()));
    int offset = 0;
    for (int k = Math.min(workerCount, items.size()); k > 0 && offset < items.size(); k--) {
      int remaining = items.size() - offset;
      int size = remaining / k + (remaining % k == 0 ? 0 : 1);
      partitions.add(List.copyOf(items.subList(offset, offset + size)));
      offset += size;
    }
    return partitions;
  }
}

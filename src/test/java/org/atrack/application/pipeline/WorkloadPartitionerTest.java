package org.atrack.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class WorkloadPartitionerTest {

  @Test
  void splitsIntoNearlyEqualContiguousChunks() {
    List<Integer> items = IntStream.range(0, 10).boxed().toList();

    List<List<Integer>> parts = WorkloadPartitioner.partition(items, 3);

    assertEquals(List.of(List.of(0, 1, 2, 3), List.of(4, 5, 6), List.of(7, 8, 9)), parts);
  }

  @Test
  void fewerItemsThanWorkersLeavesWorkersIdle() {
    List<List<String>> parts = WorkloadPartitioner.partition(List.of("a", "b"), 5);

    assertEquals(List.of(List.of("a"), List.of("b")), parts);
  }

  @Test
  void hugeWorkerCountGivesOneItemPerPartition() {
    List<List<String>> parts = WorkloadPartitioner.partition(List.of("a", "b"), Integer.MAX_VALUE);

    assertEquals(List.of(List.of("a"), List.of("b")), parts);
  }

  @Test
  void coversEveryItemExactlyOnceWithNonIncreasingSizes() {
    List<Integer> items = IntStream.range(0, 56).boxed().toList();

    List<List<Integer>> parts = WorkloadPartitioner.partition(items, 8);

    List<Integer> joined = new ArrayList<>();
    parts.forEach(joined::addAll);
    assertEquals(items, joined);
    for (int i = 1; i < parts.size(); i++) {
      assertEquals(true, parts.get(i).size() <= parts.get(i - 1).size());
    }
  }

  @Test
  void emptyInputAndInvalidWorkerCount() {
    assertEquals(List.of(), WorkloadPartitioner.partition(List.of(), 4));
    assertThrows(IllegalArgumentException.class, () -> WorkloadPartitioner.partition(List.of(1), 0));
  }
}

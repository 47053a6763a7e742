package org.atrack.infrastructure.persistence;

import static org.atrack.testutil.Fixtures.candidate;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.atrack.domain.Segment;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemorySegmentBatchStoreTest {

  @Test
  void keepsWorkerOrderAndRejectsDuplicates() {
    InMemorySegmentBatchStore store = new InMemorySegmentBatchStore();
    Segment a = new Segment(candidate(0, 1.0, 0.0), candidate(1, 1.001, 0.0), candidate(2, 1.002, 0.0));
    Segment b = new Segment(candidate(0, 2.0, 0.0), candidate(1, 2.001, 0.0), candidate(2, 2.002, 0.0));

    store.write(3, List.of(b));
    store.write(0, List.of(a));

    assertEquals(List.of(a, b), store.readAll());
    assertEquals(2, store.batchCount());
    assertThrows(IllegalStateException.class, () -> store.write(3, List.of()));

    store.clear();
    assertEquals(0, store.batchCount());
  }
}

package org.atrack.testutil;

import org.atrack.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/** Thread-safe metrics double that remembers every counter increment and observation. */
public final class RecordingMetricsPort implements MetricsPort {
  private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
  private final Map<String, List<Long>> observations = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
  }

  @Override
  public void observe(String key, long value) {
    List<Long> values = observations.computeIfAbsent(key, k -> new ArrayList<>());
    synchronized (values) {
      values.add(value);
    }
  }

  public long count(String key) {
    AtomicLong counter = counters.get(key);
    return counter == null ? 0 : counter.get();
  }

  public List<Long> observed(String key) {
    List<Long> values = observations.get(key);
    if (values == null) {
      return List.of();
    }
    synchronized (values) {
      return List.copyOf(values);
    }
  }

  public long observedSum(String key) {
    long sum = 0;
    for (long value : observed(key)) {
      sum += value;
    }
    return sum;
  }
}

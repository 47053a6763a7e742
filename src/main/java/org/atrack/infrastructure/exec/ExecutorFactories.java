package org.atrack.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the fixed-size worker pools used by the detection phases.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size pool whose queue holds every submitted task until a worker is free.
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix, e.g. {@code atrack-detect}
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "atrack-worker" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(false);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Stops a pool, waiting for running tasks, and forces termination if they overrun the timeout.
   *
   * @param executor pool to stop
   * @param timeout how long to wait at each stage
   * @param unit unit of {@code timeout}
   * @return {@code true} when the pool terminated
   * @throws InterruptedException when interrupted while waiting
   */
  public static boolean shutdownAndAwait(ExecutorService executor, long timeout, TimeUnit unit)
      throws InterruptedException {
    executor.shutdown();
    if (executor.awaitTermination(timeout, unit)) {
      return true;
    }
    executor.shutdownNow();
    return executor.awaitTermination(timeout, unit);
  }
}

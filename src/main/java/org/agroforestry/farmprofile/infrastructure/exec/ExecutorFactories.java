package org.agroforestry.farmprofile.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executor services used by bulk profiling and remote query timeouts.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size worker pool with a bounded task queue, one slot per queued farm.
   *
   * @param size number of worker threads
   * @param queueCapacity capacity of the task queue; must hold every task submitted beyond {@code size}
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor; tasks beyond the queue capacity are rejected
   */
  public static ThreadPoolExecutor newBulkPool(
      int size, int queueCapacity, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(queueCapacity),
        namedThreads(prefix, "farm-bulk", false, handler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds an unbounded cached pool of daemon threads for blocking remote calls run under a timeout.
   *
   * @param prefix thread-name prefix
   * @return cached executor whose idle threads expire after 60 seconds
   */
  public static ThreadPoolExecutor newQueryPool(String prefix) {
    return new ThreadPoolExecutor(
        0,
        Integer.MAX_VALUE,
        60L,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        namedThreads(prefix, "farm-query", true, null));
  }

  private static ThreadFactory namedThreads(
      String prefix, String fallback, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallback : prefix;
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      if (handler != null) {
        thread.setUncaughtExceptionHandler(handler);
      }
      return thread;
    };
  }
}

package com.findawise.pointers.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the engine's named thread pools.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  private static final UncaughtExceptionHandler LOGGING_HANDLER =
      (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex);

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size pool for fetch or validation work. Tasks queue when every thread is busy,
   * so a batch larger than the pool simply runs in waves.
   *
   * @param size number of worker threads
   * @param prefix thread-name prefix, e.g. {@code pointer-validate}
   * @return configured executor
   */
  public static ExecutorService newWorkerPool(int size, String prefix) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        namedFactory(prefix, "pointer-worker", true),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds the single-thread scheduler driving validation cycles.
   *
   * @param prefix thread-name prefix
   * @return scheduler that drops pending ticks on shutdown
   */
  public static ScheduledExecutorService newCycleScheduler(String prefix) {
    ScheduledThreadPoolExecutor scheduler =
        new ScheduledThreadPoolExecutor(1, namedFactory(prefix, "pointer-cycle", true));
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return scheduler;
  }

  /**
   * Shuts an executor down, waiting up to {@code timeoutMillis} before forcing it.
   *
   * @param executor executor to stop; ignored when {@code null}
   * @param timeoutMillis grace period
   */
  public static void shutdownQuietly(ExecutorService executor, long timeoutMillis) {
    if (executor == null) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
        log.warn("Executor did not terminate within {} ms; forcing shutdown", timeoutMillis);
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }

  private static ThreadFactory namedFactory(String prefix, String defaultPrefix, boolean daemon) {
    String threadPrefix = prefix == null || prefix.isBlank() ? defaultPrefix : prefix;
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(Objects.requireNonNull(runnable, "runnable"));
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(LOGGING_HANDLER);
      return thread;
    };
  }
}

package com.findawise.pointers.infrastructure.exec;

import com.findawise.pointers.application.port.CycleScheduler;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CycleScheduler} over a {@link ScheduledExecutorService}. Ticks use fixed delay, so a long
 * cycle pushes the next one back instead of stacking.
 */
public final class ScheduledExecutorCycleScheduler implements CycleScheduler, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ScheduledExecutorCycleScheduler.class);

  private final ScheduledExecutorService executor;

  public ScheduledExecutorCycleScheduler() {
    this(ExecutorFactories.newCycleScheduler("pointer-cycle"));
  }

  public ScheduledExecutorCycleScheduler(ScheduledExecutorService executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  @Override
  public ScheduledCycle schedule(String name, Runnable tick, Duration interval) {
    Objects.requireNonNull(tick, "tick");
    long periodMillis = Objects.requireNonNull(interval, "interval").toMillis();
    if (periodMillis <= 0) {
      throw new IllegalArgumentException("interval must be positive");
    }
    ScheduledFuture<?> future =
        executor.scheduleWithFixedDelay(tick, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    log.info("Scheduled {} every {} ms", name, periodMillis);
    return () -> {
      future.cancel(false);
      log.info("Cancelled schedule {}", name);
    };
  }

  @Override
  public void close() {
    ExecutorFactories.shutdownQuietly(executor, 5_000L);
  }
}

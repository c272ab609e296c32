package com.findawise.pointers.application.validation;

import com.findawise.pointers.application.port.CycleScheduler;
import com.findawise.pointers.application.port.MetricsPort;
import com.findawise.pointers.domain.pointer.ValidationStatus;
import com.findawise.pointers.domain.validation.ValidationCycleReport;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Periodic re-validation of queued pointers.
 * <p><strong>Cycle:</strong> snapshot the queue, split it into batches of {@code batchSize}, validate each
 * batch concurrently and wait for the whole batch before starting the next. A failing validator affects
 * only its own pointer.</p>
 * <p><strong>Scheduling:</strong> ticks come from a {@link CycleScheduler}; a tick that arrives while a cycle
 * is still running is skipped.</p>
 * <p><strong>Observability:</strong> {@code validation.cycle.count}, {@code validation.cycle.skipped},
 * {@code validation.cycle.attempted}, {@code validation.cycle.durationMillis}.</p>
 *
 * @since 0.1.0
 */
public final class ValidationWorker implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ValidationWorker.class);
  /** Default number of pointers validated concurrently. */
  public static final int DEFAULT_BATCH_SIZE = 10;
  /** Default delay between cycles. */
  public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(5);

  private final ValidationQueue queue;
  private final PointerValidationService validationService;
  private final CycleScheduler scheduler;
  private final int batchSize;
  private final Duration interval;
  private final MetricsPort metrics;
  private final AtomicBoolean cycleRunning = new AtomicBoolean();
  private final AtomicReference<CycleScheduler.ScheduledCycle> schedule = new AtomicReference<>();
  private final AtomicReference<ValidationCycleReport> lastReport = new AtomicReference<>();

  public ValidationWorker(
      ValidationQueue queue,
      PointerValidationService validationService,
      CycleScheduler scheduler,
      int batchSize,
      Duration interval,
      MetricsPort metrics) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.validationService = Objects.requireNonNull(validationService, "validationService");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be at least 1");
    }
    this.batchSize = batchSize;
    this.interval = Objects.requireNonNull(interval, "interval");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Starts scheduled cycles. Calling {@code start} on a started worker has no effect.
   */
  public void start() {
    CycleScheduler.ScheduledCycle cycle = scheduler.schedule("pointer-validation", this::tick, interval);
    if (!schedule.compareAndSet(null, cycle)) {
      cycle.close();
      return;
    }
    log.info("Validation worker started (interval={}s, batchSize={})", interval.toSeconds(), batchSize);
  }

  public boolean isStarted() {
    return schedule.get() != null;
  }

  /**
   * Runs one cycle over the current queue snapshot.
   *
   * @return cycle report; an empty report when another cycle is in progress
   */
  public ValidationCycleReport runCycle() {
    if (!cycleRunning.compareAndSet(false, true)) {
      metrics.increment("validation.cycle.skipped");
      log.debug("Validation cycle already running; skipping tick");
      return ValidationCycleReport.empty();
    }
    long startNanos = System.nanoTime();
    try {
      List<ValidationQueue.Ticket> snapshot = queue.snapshot();
      Map<ValidationStatus, Integer> statusCounts = new EnumMap<>(ValidationStatus.class);
      int errors = 0;
      int stale = 0;
      int deferred = 0;
      int batches = 0;
      for (int offset = 0; offset < snapshot.size(); offset += batchSize) {
        List<ValidationQueue.Ticket> batch = snapshot.subList(offset, Math.min(offset + batchSize, snapshot.size()));
        batches++;
        List<CompletableFuture<ValidationAttempt>> futures = new ArrayList<>(batch.size());
        for (ValidationQueue.Ticket ticket : batch) {
          futures.add(validationService.validateQueued(ticket));
        }
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        for (CompletableFuture<ValidationAttempt> future : futures) {
          ValidationAttempt attempt = future.join();
          switch (attempt.disposition()) {
            case APPLIED -> statusCounts.merge(attempt.result().status(), 1, Integer::sum);
            case ERROR -> errors++;
            case STALE, MISSING -> stale++;
            case DEFERRED -> deferred++;
            default -> throw new IllegalStateException("Unexpected disposition " + attempt.disposition());
          }
        }
      }
      long durationMillis = (System.nanoTime() - startNanos) / 1_000_000L;
      ValidationCycleReport report =
          new ValidationCycleReport(snapshot.size(), batches, statusCounts, errors, stale, durationMillis);
      lastReport.set(report);
      metrics.increment("validation.cycle.count");
      metrics.observe("validation.cycle.attempted", snapshot.size());
      metrics.observe("validation.cycle.durationMillis", durationMillis);
      if (deferred > 0) {
        metrics.observe("validation.cycle.deferred", deferred);
        log.warn("{} pointer(s) waited longer than the validation timeout for a thread; left queued", deferred);
      }
      if (!snapshot.isEmpty()) {
        log.info("Validation cycle finished: attempted={} batches={} applied={} errors={} stale={} in {} ms",
            report.attempted(), batches, report.applied(), errors, stale, durationMillis);
      }
      return report;
    } finally {
      cycleRunning.set(false);
    }
  }

  public Optional<ValidationCycleReport> lastReport() {
    return Optional.ofNullable(lastReport.get());
  }

  @Override
  public void close() {
    CycleScheduler.ScheduledCycle cycle = schedule.getAndSet(null);
    if (cycle != null) {
      cycle.close();
      log.info("Validation worker stopped");
    }
  }

  private void tick() {
    try {
      runCycle();
    } catch (RuntimeException ex) {
      metrics.increment("validation.cycle.error");
      log.error("Validation cycle failed", ex);
    }
  }
}

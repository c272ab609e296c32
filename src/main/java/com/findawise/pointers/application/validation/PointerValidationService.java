package com.findawise.pointers.application.validation;

import com.findawise.pointers.application.pointer.PointerRegistry;
import com.findawise.pointers.application.port.ClockPort;
import com.findawise.pointers.application.port.MetricsPort;
import com.findawise.pointers.application.port.PointerValidator;
import com.findawise.pointers.domain.error.PointerValidationException;
import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.pointer.PointerType;
import com.findawise.pointers.domain.validation.PointerValidationResult;
import com.findawise.pointers.domain.validation.ValidationCheck;
import com.findawise.pointers.domain.validation.ValidationOutcome;
import com.findawise.pointers.domain.validation.ValidationTransitions;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Validates single pointers and writes outcomes back to the registry.
 * <p><strong>Semantics:</strong>
 * <ul>
 *   <li>The validator registered for the pointer type runs on the validation executor, bounded by a
 *   timeout counted from the moment it starts; expiry is reported as {@link ValidationOutcome#TIMEOUT}
 *   and interrupts the validator.</li>
 *   <li>A validator that cannot get a thread within the timeout is withdrawn; the pointer keeps its
 *   status and stays queued for the next cycle.</li>
 *   <li>The outcome is applied only when the pointer's target revision is unchanged since the validator
 *   started.</li>
 *   <li>A validator that throws leaves the pointer status unchanged; the failure is logged and counted.</li>
 *   <li>Otherwise the queue ticket observed at the start is completed whatever the outcome.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class PointerValidationService {
  private static final Logger log = LoggerFactory.getLogger(PointerValidationService.class);
  private static final int QUEUED = 0;
  private static final int RUNNING = 1;
  private static final int FINISHED = 2;

  private final PointerRegistry registry;
  private final ValidationQueue queue;
  private final Map<PointerType, PointerValidator> validators;
  private final ExecutorService executor;
  private final Duration timeout;
  private final MetricsPort metrics;
  private final ClockPort clock;

  public PointerValidationService(
      PointerRegistry registry,
      ValidationQueue queue,
      Map<PointerType, PointerValidator> validators,
      ExecutorService executor,
      Duration timeout,
      MetricsPort metrics,
      ClockPort clock) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.validators = Map.copyOf(Objects.requireNonNull(validators, "validators"));
    this.executor = Objects.requireNonNull(executor, "executor");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Validates a pointer on demand, outside the schedule.
   *
   * @param pointerId pointer to validate
   * @return validation result; an unknown id yields {@link ValidationOutcome#NOT_FOUND}
   */
  public PointerValidationResult validatePointer(String pointerId) {
    Objects.requireNonNull(pointerId, "pointerId");
    OptionalLong observed = queue.ticketOf(pointerId);
    Optional<ValidationQueue.Ticket> ticket = observed.isPresent()
        ? Optional.of(new ValidationQueue.Ticket(pointerId, observed.getAsLong()))
        : Optional.empty();
    return validate(pointerId, ticket).join().result();
  }

  /**
   * Validates the pointer behind a queue ticket.
   *
   * @param ticket queue entry taken from a snapshot
   * @return future completing with the attempt; never completes exceptionally
   */
  public CompletableFuture<ValidationAttempt> validateQueued(ValidationQueue.Ticket ticket) {
    return validate(ticket.pointerId(), Optional.of(ticket));
  }

  private CompletableFuture<ValidationAttempt> validate(String pointerId, Optional<ValidationQueue.Ticket> ticket) {
    Optional<ContentPointer> maybePointer = registry.get(pointerId);
    if (maybePointer.isEmpty()) {
      ticket.ifPresent(queue::complete);
      metrics.increment("pointer.validate.missing");
      return CompletableFuture.completedFuture(new ValidationAttempt(
          PointerValidationResult.notFound(pointerId, clock.now()), ValidationAttempt.Disposition.MISSING));
    }
    ContentPointer pointer = maybePointer.get();
    long startNanos = System.nanoTime();
    CompletableFuture<ValidationCheck> check;
    try {
      check = submit(pointer, validatorFor(pointer.pointerType()));
    } catch (RuntimeException ex) {
      check = CompletableFuture.failedFuture(ex);
    }
    return check
        .handle((result, error) -> finish(pointer, result, error, startNanos))
        .whenComplete((attempt, error) -> {
          if (attempt == null || attempt.disposition() != ValidationAttempt.Disposition.DEFERRED) {
            ticket.ifPresent(queue::complete);
          }
        });
  }

  /**
   * Runs the validator on the executor. The deadline starts when the validator starts; expiry
   * interrupts the worker thread so it returns to the pool. A task still waiting for a thread when
   * the deadline passes is withdrawn and fails with {@link NotStartedException}.
   */
  private CompletableFuture<ValidationCheck> submit(ContentPointer pointer, PointerValidator validator) {
    CompletableFuture<ValidationCheck> check = new CompletableFuture<>();
    AtomicInteger state = new AtomicInteger(QUEUED);
    AtomicReference<Future<?>> task = new AtomicReference<>();
    Executor deadline = CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    task.set(executor.submit(() -> {
      if (!state.compareAndSet(QUEUED, RUNNING)) {
        return;
      }
      deadline.execute(() -> {
        if (state.compareAndSet(RUNNING, FINISHED)) {
          interrupt(task);
          check.completeExceptionally(new TimeoutException("validator exceeded " + timeout.toMillis() + " ms"));
        }
      });
      ValidationCheck result;
      try {
        result = validator.validate(pointer);
      } catch (RuntimeException ex) {
        if (state.compareAndSet(RUNNING, FINISHED)) {
          check.completeExceptionally(ex);
        }
        return;
      }
      if (state.compareAndSet(RUNNING, FINISHED)) {
        check.complete(result);
      }
    }));
    deadline.execute(() -> {
      if (state.compareAndSet(QUEUED, FINISHED)) {
        Future<?> pending = task.get();
        if (pending != null) {
          pending.cancel(false);
        }
        check.completeExceptionally(new NotStartedException());
      }
    });
    return check;
  }

  private static void interrupt(AtomicReference<Future<?>> task) {
    Future<?> running = task.get();
    if (running != null) {
      running.cancel(true);
    }
  }

  private ValidationAttempt finish(ContentPointer pointer, ValidationCheck check, Throwable error, long startNanos) {
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    Instant checkedAt = clock.now();
    ValidationCheck effective = check;
    if (error != null) {
      Throwable cause = unwrap(error);
      if (cause instanceof NotStartedException) {
        metrics.increment("pointer.validate.deferred");
        log.debug("Validator for pointer {} did not start within {} ms; left queued", pointer.id(), timeout.toMillis());
        return new ValidationAttempt(
            new PointerValidationResult(
                pointer.id(),
                ValidationOutcome.TIMEOUT,
                pointer.validationStatus(),
                "Validator did not start within " + timeout.toMillis() + " ms",
                null,
                elapsedMillis,
                checkedAt,
                false),
            ValidationAttempt.Disposition.DEFERRED);
      }
      if (cause instanceof TimeoutException) {
        effective = ValidationCheck.of(
            ValidationOutcome.TIMEOUT, "Validation timed out after " + timeout.toMillis() + " ms");
      } else {
        metrics.increment("pointer.validate.error");
        log.error("Validator failed for pointer {} ({} -> {}); status left {}",
            pointer.id(), pointer.pointerType().wireName(), pointer.targetId(),
            pointer.validationStatus().wireName(), cause);
        return new ValidationAttempt(
            new PointerValidationResult(
                pointer.id(),
                ValidationOutcome.BROKEN,
                pointer.validationStatus(),
                "Validator failed: " + describe(cause),
                null,
                elapsedMillis,
                checkedAt,
                false),
            ValidationAttempt.Disposition.ERROR);
      }
    }
    if (effective == null) {
      effective = ValidationCheck.of(ValidationOutcome.BROKEN, "Validator returned no outcome");
    }

    metrics.observe("pointer.validate.latencyNanos", System.nanoTime() - startNanos);
    Optional<ContentPointer> applied =
        registry.applyValidation(pointer.id(), pointer.targetRevision(), effective, checkedAt);
    PointerValidationResult result = new PointerValidationResult(
        pointer.id(),
        effective.outcome(),
        ValidationTransitions.statusFor(effective.outcome()),
        effective.message(),
        effective.redirectTarget(),
        elapsedMillis,
        checkedAt,
        applied.isPresent());
    if (applied.isEmpty()) {
      metrics.increment("pointer.validate.stale");
      log.debug("Discarded validation of pointer {}: retargeted or deleted while validating", pointer.id());
      return new ValidationAttempt(result, ValidationAttempt.Disposition.STALE);
    }
    metrics.increment("pointer.validate." + result.status().wireName());
    if (result.status() != pointer.validationStatus()) {
      log.info("Pointer {} validation {} -> {} ({})",
          pointer.id(), pointer.validationStatus().wireName(), result.status().wireName(),
          effective.outcome().wireName());
    }
    return new ValidationAttempt(result, ValidationAttempt.Disposition.APPLIED);
  }

  private PointerValidator validatorFor(PointerType type) {
    PointerValidator validator = validators.get(type);
    if (validator == null) {
      validator = validators.get(PointerType.DYNAMIC);
    }
    if (validator == null) {
      throw new PointerValidationException("No validator registered for pointer type " + type.wireName());
    }
    return validator;
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /** Raised when no executor thread picked the validator up before its deadline. */
  private static final class NotStartedException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    NotStartedException() {
      super("validator did not start", null, false, false);
    }
  }

  private static String describe(Throwable error) {
    String message = error.getMessage();
    return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
  }
}

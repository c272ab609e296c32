package com.findawise.pointers.domain.validation;

import com.findawise.pointers.domain.pointer.ValidationStatus;
import java.time.Instant;
import java.util.Objects;

/**
 * Result of validating one pointer.
 *
 * @param pointerId validated pointer
 * @param outcome raw validator outcome
 * @param status status the outcome persists as
 * @param message human readable detail; empty when none
 * @param redirectTarget new location when {@code outcome} is {@code REDIRECTED}; may be {@code null}
 * @param responseTimeMillis validator latency
 * @param checkedAt completion instant
 * @param applied whether the status was written back to the registry
 * @since 0.1.0
 */
public record PointerValidationResult(
    String pointerId,
    ValidationOutcome outcome,
    ValidationStatus status,
    String message,
    String redirectTarget,
    long responseTimeMillis,
    Instant checkedAt,
    boolean applied) {

  public PointerValidationResult {
    Objects.requireNonNull(pointerId, "pointerId");
    Objects.requireNonNull(outcome, "outcome");
    Objects.requireNonNull(status, "status");
    message = message == null ? "" : message;
  }

  /**
   * Result reported for an id the registry does not know.
   *
   * @param pointerId requested id
   * @param checkedAt evaluation instant
   * @return not-found result that was not applied
   */
  public static PointerValidationResult notFound(String pointerId, Instant checkedAt) {
    return new PointerValidationResult(
        pointerId,
        ValidationOutcome.NOT_FOUND,
        ValidationTransitions.statusFor(ValidationOutcome.NOT_FOUND),
        "Pointer not found",
        null,
        0L,
        checkedAt,
        false);
  }
}

package com.findawise.pointers.domain.validation;

import java.util.Objects;

/**
 * Outcome reported by a validator adapter before it is stamped with timing and applied.
 *
 * @param outcome validator outcome
 * @param message detail for logs; empty when none
 * @param redirectTarget new location for redirects; may be {@code null}
 * @since 0.1.0
 */
public record ValidationCheck(ValidationOutcome outcome, String message, String redirectTarget) {
  public ValidationCheck {
    Objects.requireNonNull(outcome, "outcome");
    message = message == null ? "" : message;
  }

  public static ValidationCheck of(ValidationOutcome outcome) {
    return new ValidationCheck(outcome, "", null);
  }

  public static ValidationCheck of(ValidationOutcome outcome, String message) {
    return new ValidationCheck(outcome, message, null);
  }

  public static ValidationCheck redirected(String location) {
    return new ValidationCheck(ValidationOutcome.REDIRECTED, "Redirected to " + location, location);
  }
}

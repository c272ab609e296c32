package com.findawise.pointers.domain.validation;

import com.findawise.pointers.domain.pointer.ValidationStatus;
import java.util.Objects;

/**
 * Transition function from validator outcomes to persisted pointer statuses.
 *
 * <p>Outcomes that mean "unreachable right now" ({@code TIMEOUT}, {@code FORBIDDEN}, {@code NOT_FOUND})
 * all persist as {@link ValidationStatus#BROKEN}; the raw outcome is kept next to the status on the pointer.
 * The function depends only on the outcome, so applying the same outcome twice yields the same status.</p>
 *
 * @since 0.1.0
 */
public final class ValidationTransitions {
  private ValidationTransitions() {}

  /**
   * Maps an outcome to the status it persists as.
   *
   * @param outcome validator outcome; must not be {@code null}
   * @return resulting status, never {@link ValidationStatus#PENDING}
   */
  public static ValidationStatus statusFor(ValidationOutcome outcome) {
    return switch (Objects.requireNonNull(outcome, "outcome")) {
      case VALID -> ValidationStatus.VALID;
      case REDIRECTED -> ValidationStatus.REDIRECTED;
      case EXPIRED -> ValidationStatus.EXPIRED;
      case BROKEN, TIMEOUT, FORBIDDEN, NOT_FOUND -> ValidationStatus.BROKEN;
    };
  }
}

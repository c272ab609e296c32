package com.findawise.pointers.application.validation;

import com.findawise.pointers.domain.validation.PointerValidationResult;
import java.util.Objects;

/**
 * Result of one validation attempt together with what happened to it.
 *
 * @param result validation result reported to callers
 * @param disposition how the result was handled
 * @since 0.1.0
 */
public record ValidationAttempt(PointerValidationResult result, Disposition disposition) {
  public ValidationAttempt {
    Objects.requireNonNull(result, "result");
    Objects.requireNonNull(disposition, "disposition");
  }

  /** Handling of a validation result. */
  public enum Disposition {
    /** Status written back to the registry. */
    APPLIED,
    /** Pointer was retargeted or deleted while the validator ran; result dropped. */
    STALE,
    /** Validator failed to run; status unchanged. */
    ERROR,
    /** Pointer unknown when the attempt started. */
    MISSING,
    /** No thread picked the validator up in time; pointer left queued. */
    DEFERRED
  }
}

package com.findawise.pointers.domain.validation;

import java.util.Locale;

/**
 * Raw result reported by a validator for a single target.
 *
 * <p>The set is wider than {@link com.findawise.pointers.domain.pointer.ValidationStatus}; see
 * {@link ValidationTransitions} for how outcomes collapse into persisted statuses.</p>
 *
 * @since 0.1.0
 */
public enum ValidationOutcome {
  VALID,
  BROKEN,
  REDIRECTED,
  EXPIRED,
  TIMEOUT,
  FORBIDDEN,
  NOT_FOUND;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static ValidationOutcome fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("validation outcome must not be blank");
    }
    return valueOf(raw.trim().toUpperCase(Locale.ROOT));
  }
}

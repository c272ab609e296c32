package com.findawise.pointers.domain.pointer;

import java.util.Locale;

/**
 * Persisted reachability status of a pointer.
 *
 * <p>{@link #PENDING} is assigned on creation and after a change of target; every other value is
 * produced by a validation run.</p>
 *
 * @since 0.1.0
 */
public enum ValidationStatus {
  PENDING,
  VALID,
  BROKEN,
  EXPIRED,
  REDIRECTED;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static ValidationStatus fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("validation status must not be blank");
    }
    return valueOf(raw.trim().toUpperCase(Locale.ROOT));
  }
}

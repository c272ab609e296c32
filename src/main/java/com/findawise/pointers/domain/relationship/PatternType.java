package com.findawise.pointers.domain.relationship;

import java.util.Locale;

/** Signal family a relationship pattern is derived from. */
public enum PatternType {
  SEMANTIC,
  BEHAVIORAL,
  CONTEXTUAL,
  TEMPORAL,
  COLLABORATIVE;

  public static PatternType fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("pattern type must not be blank");
    }
    return valueOf(raw.trim().toUpperCase(Locale.ROOT));
  }
}

package com.findawise.pointers.domain.relationship;

import java.util.Locale;

/** Comparison applied by a {@link PatternCondition}. */
public enum ConditionOperator {
  EQUALS,
  CONTAINS,
  MATCHES,
  GREATER,
  LESS;

  public static ConditionOperator fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("condition operator must not be blank");
    }
    return valueOf(raw.trim().toUpperCase(Locale.ROOT));
  }
}

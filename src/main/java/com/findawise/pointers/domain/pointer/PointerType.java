package com.findawise.pointers.domain.pointer;

import java.util.Locale;

/**
 * Kind of target a pointer refers to; selects the retrieval and validation strategy.
 *
 * @since 0.1.0
 */
public enum PointerType {
  SLUG,
  URL,
  ID,
  API,
  FILE,
  DYNAMIC,
  EXTERNAL;

  /**
   * Returns the lower-case name used in configuration, logs and audit payloads.
   *
   * @return wire name such as {@code slug}
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolves a wire name, ignoring case and surrounding whitespace.
   *
   * @param raw wire name
   * @return matching type
   * @throws IllegalArgumentException when {@code raw} is blank or unknown
   */
  public static PointerType fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("pointer type must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown pointer type: " + raw, ex);
    }
  }
}

package com.findawise.pointers.domain.pointer;

import java.util.Locale;

/**
 * Semantic relation between a pointer's source and target.
 *
 * @since 0.1.0
 */
public enum RelationshipType {
  RELATED,
  PREREQUISITE,
  FOLLOW_UP,
  ALTERNATIVE,
  COMPLEMENT,
  UPGRADE,
  EMBEDDED;

  /**
   * Returns the lower-case name used on the wire (e.g. {@code follow_up}).
   *
   * @return wire name
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolves a wire name; hyphens are accepted in place of underscores.
   *
   * @param raw wire name
   * @return matching relationship type
   * @throws IllegalArgumentException when {@code raw} is blank or unknown
   */
  public static RelationshipType fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("relationship type must not be blank");
    }
    String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown relationship type: " + raw, ex);
    }
  }
}

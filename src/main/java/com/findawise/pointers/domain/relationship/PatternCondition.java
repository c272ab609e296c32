package com.findawise.pointers.domain.relationship;

import java.util.Objects;
import java.util.Optional;

/**
 * Single weighted predicate over a candidate content node.
 *
 * <p>A value of the form {@code ${source.<field>}} is resolved against the source node at evaluation
 * time, so patterns can express "shares a tag with the source".</p>
 *
 * @param field content node field name (e.g. {@code tags}, {@code type}, {@code qualityScore})
 * @param operator comparison
 * @param value literal or source reference
 * @param weight relative contribution to the pattern's match ratio, positive
 * @since 0.1.0
 */
public record PatternCondition(String field, ConditionOperator operator, String value, double weight) {
  private static final String SOURCE_PREFIX = "${source.";

  public PatternCondition {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(operator, "operator");
    value = value == null ? "" : value;
    if (weight <= 0.0 || Double.isNaN(weight)) {
      throw new IllegalArgumentException("condition weight must be positive (was " + weight + ")");
    }
  }

  /**
   * Returns the source field referenced by {@link #value()}, if any.
   *
   * @return referenced field name
   */
  public Optional<String> sourceReference() {
    if (value.startsWith(SOURCE_PREFIX) && value.endsWith("}")) {
      return Optional.of(value.substring(SOURCE_PREFIX.length(), value.length() - 1));
    }
    return Optional.empty();
  }
}

package com.findawise.pointers.domain.relationship;

import com.findawise.pointers.domain.pointer.RelationshipType;
import java.util.List;
import java.util.Objects;

/**
 * Learned or curated rule proposing a relationship between two content nodes.
 *
 * @param id unique pattern identifier
 * @param patternType signal family
 * @param relationshipType relationship proposed on match
 * @param description operator facing summary
 * @param strength base confidence in {@code [0,1]}
 * @param conditions weighted predicates; at least one
 * @param usageCount number of suggestions whose outcome was reported back
 * @param successRate share of reported suggestions that were accepted
 * @param lastUsedMillis epoch millis of the last reported outcome; zero when never used
 * @since 0.1.0
 */
public record RelationshipPattern(
    String id,
    PatternType patternType,
    RelationshipType relationshipType,
    String description,
    double strength,
    List<PatternCondition> conditions,
    long usageCount,
    double successRate,
    long lastUsedMillis) {

  /** Minimum reported outcomes before the success rate influences confidence. */
  public static final long MIN_SAMPLES_FOR_PERFORMANCE = 5;

  public RelationshipPattern {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(patternType, "patternType");
    Objects.requireNonNull(relationshipType, "relationshipType");
    description = description == null ? "" : description;
    if (strength < 0.0 || strength > 1.0) {
      throw new IllegalArgumentException("pattern strength must be between 0 and 1 (was " + strength + ")");
    }
    conditions = List.copyOf(Objects.requireNonNull(conditions, "conditions"));
    if (conditions.isEmpty()) {
      throw new IllegalArgumentException("pattern " + id + " must declare at least one condition");
    }
  }

  public double totalWeight() {
    return conditions.stream().mapToDouble(PatternCondition::weight).sum();
  }

  /**
   * Multiplier derived from reported outcomes; neutral until enough samples exist.
   *
   * @return factor in {@code [0.5, 1]}
   */
  public double performanceFactor() {
    if (usageCount < MIN_SAMPLES_FOR_PERFORMANCE) {
      return 1.0;
    }
    return 0.5 + 0.5 * successRate;
  }

  /**
   * Returns a copy with one more reported outcome folded into the success rate.
   *
   * @param accepted whether the suggestion was accepted
   * @param nowMillis time of the report
   * @return updated pattern
   */
  public RelationshipPattern withOutcome(boolean accepted, long nowMillis) {
    long nextUsage = usageCount + 1;
    double nextRate = ((successRate * usageCount) + (accepted ? 1.0 : 0.0)) / nextUsage;
    return new RelationshipPattern(
        id, patternType, relationshipType, description, strength, conditions, nextUsage, nextRate, nowMillis);
  }
}

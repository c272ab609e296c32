package com.findawise.pointers.domain.relationship;

import com.findawise.pointers.domain.pointer.RelationshipType;
import java.util.Objects;

/**
 * Proposed pointer between two content nodes. Suggestions never mutate the registry.
 *
 * @param sourceId source content node
 * @param targetId suggested target content node
 * @param relationshipType proposed relation
 * @param confidence confidence in {@code [0,1]}
 * @param reasoning human readable justification
 * @param origin generator that produced the suggestion
 * @param patternId matching pattern for {@link SuggestionOrigin#PATTERN}; otherwise {@code null}
 * @since 0.1.0
 */
public record RelationshipSuggestion(
    String sourceId,
    String targetId,
    RelationshipType relationshipType,
    double confidence,
    String reasoning,
    SuggestionOrigin origin,
    String patternId) {

  public RelationshipSuggestion {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(targetId, "targetId");
    Objects.requireNonNull(relationshipType, "relationshipType");
    Objects.requireNonNull(origin, "origin");
    confidence = Math.max(0.0, Math.min(1.0, confidence));
    reasoning = reasoning == null ? "" : reasoning;
  }
}

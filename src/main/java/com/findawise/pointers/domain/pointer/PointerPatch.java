package com.findawise.pointers.domain.pointer;

/**
 * Partial update applied to an existing pointer; {@code null} components leave the current value untouched.
 *
 * <p>Validation status and access counters are deliberately absent: they change only through validation
 * runs and fresh retrievals.</p>
 *
 * @since 0.1.0
 */
public record PointerPatch(
    String targetId,
    PointerType pointerType,
    RelationshipType relationshipType,
    Double confidenceScore,
    Integer priority,
    Integer ttlSeconds,
    PointerMetadata metadata,
    FallbackContent fallbackContent,
    PointerAnalytics analytics) {

  public static final PointerPatch EMPTY = new PointerPatch(null, null, null, null, null, null, null, null, null);

  public static PointerPatch retarget(String targetId) {
    return EMPTY.withTargetId(targetId);
  }

  public PointerPatch withTargetId(String value) {
    return new PointerPatch(value, pointerType, relationshipType, confidenceScore, priority, ttlSeconds, metadata,
        fallbackContent, analytics);
  }

  public PointerPatch withPointerType(PointerType value) {
    return new PointerPatch(targetId, value, relationshipType, confidenceScore, priority, ttlSeconds, metadata,
        fallbackContent, analytics);
  }

  public PointerPatch withRelationship(RelationshipType value) {
    return new PointerPatch(targetId, pointerType, value, confidenceScore, priority, ttlSeconds, metadata,
        fallbackContent, analytics);
  }

  public PointerPatch withConfidence(Double value) {
    return new PointerPatch(targetId, pointerType, relationshipType, value, priority, ttlSeconds, metadata,
        fallbackContent, analytics);
  }

  public PointerPatch withPriority(Integer value) {
    return new PointerPatch(targetId, pointerType, relationshipType, confidenceScore, value, ttlSeconds, metadata,
        fallbackContent, analytics);
  }

  public PointerPatch withTtlSeconds(Integer value) {
    return new PointerPatch(targetId, pointerType, relationshipType, confidenceScore, priority, value, metadata,
        fallbackContent, analytics);
  }

  public PointerPatch withMetadata(PointerMetadata value) {
    return new PointerPatch(targetId, pointerType, relationshipType, confidenceScore, priority, ttlSeconds, value,
        fallbackContent, analytics);
  }

  public PointerPatch withFallback(FallbackContent value) {
    return new PointerPatch(targetId, pointerType, relationshipType, confidenceScore, priority, ttlSeconds, metadata,
        value, analytics);
  }

  public PointerPatch withAnalytics(PointerAnalytics value) {
    return new PointerPatch(targetId, pointerType, relationshipType, confidenceScore, priority, ttlSeconds, metadata,
        fallbackContent, value);
  }
}

package com.findawise.pointers.domain.pointer;

/**
 * Caller-supplied fields for registering a new pointer. Unset optional fields take engine defaults
 * (relationship {@code related}, confidence 0.5, priority 1, default metadata).
 *
 * @param sourceId content entity holding the pointer
 * @param targetId target locator
 * @param pointerType retrieval strategy selector; {@code null} selects {@link PointerType#SLUG}
 * @param relationshipType relation; {@code null} selects {@link RelationshipType#RELATED}
 * @param confidenceScore confidence; {@code null} selects 0.5
 * @param priority ordering hint; {@code null} selects 1
 * @param ttlSeconds cache lifetime override; may be {@code null}
 * @param metadata descriptive attributes; {@code null} selects defaults
 * @param fallbackContent content served on retrieval failure; may be {@code null}
 * @since 0.1.0
 */
public record PointerDraft(
    String sourceId,
    String targetId,
    PointerType pointerType,
    RelationshipType relationshipType,
    Double confidenceScore,
    Integer priority,
    Integer ttlSeconds,
    PointerMetadata metadata,
    FallbackContent fallbackContent) {

  public PointerDraft {
    pointerType = pointerType == null ? PointerType.SLUG : pointerType;
  }

  /**
   * Starts a draft with only the mandatory fields set.
   *
   * @param sourceId source entity
   * @param targetId target locator
   * @param pointerType retrieval strategy selector
   * @return draft with defaults for every optional field
   */
  public static PointerDraft of(String sourceId, String targetId, PointerType pointerType) {
    return new PointerDraft(sourceId, targetId, pointerType, null, null, null, null, null, null);
  }

  public PointerDraft withRelationship(RelationshipType value) {
    return new PointerDraft(sourceId, targetId, pointerType, value, confidenceScore, priority, ttlSeconds,
        metadata, fallbackContent);
  }

  public PointerDraft withConfidence(double value) {
    return new PointerDraft(sourceId, targetId, pointerType, relationshipType, value, priority, ttlSeconds,
        metadata, fallbackContent);
  }

  public PointerDraft withPriority(int value) {
    return new PointerDraft(sourceId, targetId, pointerType, relationshipType, confidenceScore, value, ttlSeconds,
        metadata, fallbackContent);
  }

  public PointerDraft withTtlSeconds(Integer value) {
    return new PointerDraft(sourceId, targetId, pointerType, relationshipType, confidenceScore, priority, value,
        metadata, fallbackContent);
  }

  public PointerDraft withMetadata(PointerMetadata value) {
    return new PointerDraft(sourceId, targetId, pointerType, relationshipType, confidenceScore, priority, ttlSeconds,
        value, fallbackContent);
  }

  public PointerDraft withDomain(String domain) {
    PointerMetadata base = metadata == null ? PointerMetadata.defaults() : metadata;
    return withMetadata(base.withDomain(domain));
  }

  public PointerDraft withFallback(FallbackContent value) {
    return new PointerDraft(sourceId, targetId, pointerType, relationshipType, confidenceScore, priority, ttlSeconds,
        metadata, value);
  }
}

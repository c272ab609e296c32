package com.findawise.pointers.domain.pointer;

import com.findawise.pointers.domain.validation.ValidationOutcome;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable reference from one content entity to another.
 * <p><strong>Why:</strong> Pointers let pages link to content without embedding it, so the engine can
 * resolve, cache and re-validate targets independently of the pages that use them.</p>
 * <p><strong>Role:</strong> Core domain value stored by the pointer registry and exchanged through every
 * engine operation.</p>
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>{@code id}, {@code sourceId} and {@code targetId} are non-blank.</li>
 *   <li>{@code confidenceScore} lies in {@code [0,1]}; {@code accessCount} is never negative.</li>
 *   <li>{@code targetRevision} increases each time {@code targetId} or {@code pointerType} changes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; state changes produce new instances via {@link #toBuilder()}.</p>
 *
 * @param id unique identifier, never reused
 * @param sourceId content entity holding the pointer
 * @param targetId content entity or locator the pointer resolves to
 * @param pointerType retrieval strategy selector
 * @param relationshipType semantic relation between source and target
 * @param validationStatus persisted reachability status
 * @param lastValidationOutcome raw outcome of the last validation run; {@code null} until validated
 * @param confidenceScore confidence in the relationship, {@code [0,1]}
 * @param priority ordering hint; higher values are more prominent
 * @param ttlSeconds cache lifetime override; {@code null} selects the engine default
 * @param accessCount successful fresh retrievals, monotonic
 * @param targetRevision generation counter of the target binding
 * @param createdAt creation instant
 * @param updatedAt last mutation instant
 * @param lastValidated instant of the last applied validation; may be {@code null}
 * @param lastAccessed instant of the last fresh retrieval; may be {@code null}
 * @param metadata descriptive attributes
 * @param fallbackContent content served when retrieval fails; may be {@code null}
 * @param analytics engagement counters
 * @since 0.1.0
 */
public record ContentPointer(
    String id,
    String sourceId,
    String targetId,
    PointerType pointerType,
    RelationshipType relationshipType,
    ValidationStatus validationStatus,
    ValidationOutcome lastValidationOutcome,
    double confidenceScore,
    int priority,
    Integer ttlSeconds,
    long accessCount,
    long targetRevision,
    Instant createdAt,
    Instant updatedAt,
    Instant lastValidated,
    Instant lastAccessed,
    PointerMetadata metadata,
    FallbackContent fallbackContent,
    PointerAnalytics analytics) {

  public ContentPointer {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(targetId, "targetId");
    Objects.requireNonNull(pointerType, "pointerType");
    Objects.requireNonNull(relationshipType, "relationshipType");
    Objects.requireNonNull(validationStatus, "validationStatus");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
    if (confidenceScore < 0.0 || confidenceScore > 1.0 || Double.isNaN(confidenceScore)) {
      throw new IllegalArgumentException("confidenceScore must be between 0 and 1 (was " + confidenceScore + ")");
    }
    if (accessCount < 0) {
      throw new IllegalArgumentException("accessCount must not be negative");
    }
    metadata = metadata == null ? PointerMetadata.defaults() : metadata;
    analytics = analytics == null ? PointerAnalytics.EMPTY : analytics;
  }

  /**
   * Resolves the cache lifetime for this pointer.
   *
   * @param defaultTtlSeconds engine default applied when no override is set
   * @return lifetime in seconds
   */
  public int effectiveTtlSeconds(int defaultTtlSeconds) {
    return ttlSeconds == null ? defaultTtlSeconds : ttlSeconds;
  }

  /**
   * Returns the key resolved content is cached under: the metadata override when set, else the target id.
   *
   * @return content cache key
   */
  public String contentCacheKey() {
    String override = metadata.cacheKey();
    return override == null || override.isBlank() ? targetId : override;
  }

  public Optional<FallbackContent> fallback() {
    return Optional.ofNullable(fallbackContent);
  }

  public Optional<String> domain() {
    return Optional.ofNullable(metadata.domain());
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.id = id;
    builder.sourceId = sourceId;
    builder.targetId = targetId;
    builder.pointerType = pointerType;
    builder.relationshipType = relationshipType;
    builder.validationStatus = validationStatus;
    builder.lastValidationOutcome = lastValidationOutcome;
    builder.confidenceScore = confidenceScore;
    builder.priority = priority;
    builder.ttlSeconds = ttlSeconds;
    builder.accessCount = accessCount;
    builder.targetRevision = targetRevision;
    builder.createdAt = createdAt;
    builder.updatedAt = updatedAt;
    builder.lastValidated = lastValidated;
    builder.lastAccessed = lastAccessed;
    builder.metadata = metadata;
    builder.fallbackContent = fallbackContent;
    builder.analytics = analytics;
    return builder;
  }

  /** Mutable builder for {@link ContentPointer}; not thread-safe. */
  public static final class Builder {
    private String id;
    private String sourceId;
    private String targetId;
    private PointerType pointerType = PointerType.SLUG;
    private RelationshipType relationshipType = RelationshipType.RELATED;
    private ValidationStatus validationStatus = ValidationStatus.PENDING;
    private ValidationOutcome lastValidationOutcome;
    private double confidenceScore = 0.5;
    private int priority = 1;
    private Integer ttlSeconds;
    private long accessCount;
    private long targetRevision;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastValidated;
    private Instant lastAccessed;
    private PointerMetadata metadata = PointerMetadata.defaults();
    private FallbackContent fallbackContent;
    private PointerAnalytics analytics = PointerAnalytics.EMPTY;

    private Builder() {}

    public Builder id(String value) {
      this.id = value;
      return this;
    }

    public Builder sourceId(String value) {
      this.sourceId = value;
      return this;
    }

    public Builder targetId(String value) {
      this.targetId = value;
      return this;
    }

    public Builder pointerType(PointerType value) {
      this.pointerType = value;
      return this;
    }

    public Builder relationshipType(RelationshipType value) {
      this.relationshipType = value;
      return this;
    }

    public Builder validationStatus(ValidationStatus value) {
      this.validationStatus = value;
      return this;
    }

    public Builder lastValidationOutcome(ValidationOutcome value) {
      this.lastValidationOutcome = value;
      return this;
    }

    public Builder confidenceScore(double value) {
      this.confidenceScore = value;
      return this;
    }

    public Builder priority(int value) {
      this.priority = value;
      return this;
    }

    public Builder ttlSeconds(Integer value) {
      this.ttlSeconds = value;
      return this;
    }

    public Builder accessCount(long value) {
      this.accessCount = value;
      return this;
    }

    public Builder targetRevision(long value) {
      this.targetRevision = value;
      return this;
    }

    public Builder createdAt(Instant value) {
      this.createdAt = value;
      return this;
    }

    public Builder updatedAt(Instant value) {
      this.updatedAt = value;
      return this;
    }

    public Builder lastValidated(Instant value) {
      this.lastValidated = value;
      return this;
    }

    public Builder lastAccessed(Instant value) {
      this.lastAccessed = value;
      return this;
    }

    public Builder metadata(PointerMetadata value) {
      this.metadata = value;
      return this;
    }

    public Builder fallbackContent(FallbackContent value) {
      this.fallbackContent = value;
      return this;
    }

    public Builder analytics(PointerAnalytics value) {
      this.analytics = value;
      return this;
    }

    public ContentPointer build() {
      return new ContentPointer(
          id,
          sourceId,
          targetId,
          pointerType,
          relationshipType,
          validationStatus,
          lastValidationOutcome,
          confidenceScore,
          priority,
          ttlSeconds,
          accessCount,
          targetRevision,
          createdAt,
          updatedAt,
          lastValidated,
          lastAccessed,
          metadata,
          fallbackContent,
          analytics);
    }
  }
}

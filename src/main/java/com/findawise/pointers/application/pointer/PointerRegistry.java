package com.findawise.pointers.application.pointer;

import com.findawise.pointers.application.cache.TtlCache;
import com.findawise.pointers.application.port.AuditSinkPort;
import com.findawise.pointers.application.port.ClockPort;
import com.findawise.pointers.application.port.MetricsPort;
import com.findawise.pointers.application.port.PointerStorePort;
import com.findawise.pointers.application.validation.ValidationQueue;
import com.findawise.pointers.domain.audit.AuditEvent;
import com.findawise.pointers.domain.audit.AuditSeverity;
import com.findawise.pointers.domain.error.PointerNotFoundException;
import com.findawise.pointers.domain.error.PointerSecurityException;
import com.findawise.pointers.domain.fetch.RetrievedContent;
import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.pointer.PointerDraft;
import com.findawise.pointers.domain.pointer.PointerMetadata;
import com.findawise.pointers.domain.pointer.PointerPatch;
import com.findawise.pointers.domain.pointer.PointerType;
import com.findawise.pointers.domain.pointer.RelationshipType;
import com.findawise.pointers.domain.pointer.ValidationStatus;
import com.findawise.pointers.domain.validation.ValidationCheck;
import com.findawise.pointers.domain.validation.ValidationTransitions;
import com.findawise.pointers.validation.Numbers;
import com.findawise.pointers.validation.Strings;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Authoritative in-memory set of content pointers with write-through persistence.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create, update and delete pointers behind the {@link PointerSecurityFilter}.</li>
 *   <li>Queue pointers for validation on creation and whenever their target binding changes.</li>
 *   <li>Apply validation outcomes and access statistics; no other path mutates those fields.</li>
 *   <li>Persist every mutation through {@link PointerStorePort} and emit an {@link AuditEvent}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Pointers are immutable values in a {@link ConcurrentHashMap}; every
 * mutation is an atomic {@code compute} on the pointer's entry, and the store write happens inside it so
 * writes for one id reach the store in mutation order.</p>
 * <p><strong>Observability:</strong> Counters {@code pointer.create}, {@code pointer.rejected},
 * {@code pointer.update}, {@code pointer.delete}, {@code pointer.store.error}.</p>
 *
 * @since 0.1.0
 */
public final class PointerRegistry {
  private static final Logger log = LoggerFactory.getLogger(PointerRegistry.class);

  private final Map<String, ContentPointer> pointers = new ConcurrentHashMap<>();
  private final PointerSecurityFilter securityFilter;
  private final ValidationQueue validationQueue;
  private final TtlCache<RetrievedContent> contentCache;
  private final PointerStorePort store;
  private final AuditSinkPort auditSink;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Supplier<String> idGenerator;

  public PointerRegistry(
      PointerSecurityFilter securityFilter,
      ValidationQueue validationQueue,
      TtlCache<RetrievedContent> contentCache,
      PointerStorePort store,
      AuditSinkPort auditSink,
      MetricsPort metrics,
      ClockPort clock) {
    this(securityFilter, validationQueue, contentCache, store, auditSink, metrics, clock,
        () -> UUID.randomUUID().toString());
  }

  PointerRegistry(
      PointerSecurityFilter securityFilter,
      ValidationQueue validationQueue,
      TtlCache<RetrievedContent> contentCache,
      PointerStorePort store,
      AuditSinkPort auditSink,
      MetricsPort metrics,
      ClockPort clock,
      Supplier<String> idGenerator) {
    this.securityFilter = Objects.requireNonNull(securityFilter, "securityFilter");
    this.validationQueue = Objects.requireNonNull(validationQueue, "validationQueue");
    this.contentCache = Objects.requireNonNull(contentCache, "contentCache");
    this.store = Objects.requireNonNull(store, "store");
    this.auditSink = auditSink == null ? AuditSinkPort.NO_OP : auditSink;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
  }

  /**
   * Registers a new pointer in {@link ValidationStatus#PENDING} and queues it for validation.
   *
   * @param draft caller supplied fields
   * @return stored pointer
   * @throws PointerSecurityException when the security filter rejects the target; nothing is stored
   * @throws IllegalArgumentException when identifiers are blank or scores are out of range
   */
  public ContentPointer create(PointerDraft draft) {
    Objects.requireNonNull(draft, "draft");
    String sourceId = Strings.requireNonBlank("sourceId", draft.sourceId());
    String targetId = Strings.requireNonBlank("targetId", draft.targetId());
    double confidence = draft.confidenceScore() == null
        ? 0.5
        : Numbers.requireUnitInterval("confidenceScore", draft.confidenceScore());
    PointerMetadata metadata = draft.metadata() == null ? PointerMetadata.defaults() : draft.metadata();
    validateTtl(draft.ttlSeconds());

    PointerSecurityFilter.Verdict verdict =
        securityFilter.check(draft.pointerType(), targetId, metadata.domain());
    if (!verdict.allowed()) {
      reject(null, draft.pointerType(), targetId, verdict);
    }

    Instant now = clock.now();
    ContentPointer.Builder builder = ContentPointer.builder()
        .sourceId(sourceId)
        .targetId(targetId)
        .pointerType(draft.pointerType())
        .relationshipType(draft.relationshipType() == null ? RelationshipType.RELATED : draft.relationshipType())
        .validationStatus(ValidationStatus.PENDING)
        .confidenceScore(confidence)
        .priority(draft.priority() == null ? 1 : draft.priority())
        .ttlSeconds(draft.ttlSeconds())
        .createdAt(now)
        .updatedAt(now)
        .metadata(metadata)
        .fallbackContent(draft.fallbackContent());

    ContentPointer created;
    while (true) {
      ContentPointer candidate = builder.id(idGenerator.get()).build();
      AtomicBoolean inserted = new AtomicBoolean();
      pointers.computeIfAbsent(candidate.id(), id -> {
        inserted.set(true);
        persist(candidate);
        return candidate;
      });
      if (inserted.get()) {
        created = candidate;
        break;
      }
      log.warn("Generated pointer id {} collided with an existing pointer; regenerating", candidate.id());
    }

    validationQueue.enqueue(created.id());
    metrics.increment("pointer.create");
    log.info("Created pointer {} ({} -> {}, type={})",
        created.id(), created.sourceId(), created.targetId(), created.pointerType().wireName());
    Map<String, String> attributes = describe(created);
    if (!verdict.warnings().isEmpty()) {
      attributes.put("warnings", String.join("; ", verdict.warnings()));
      log.warn("Pointer {} accepted with warnings: {}", created.id(), verdict.warnings());
    }
    audit("create_pointer", created.id(), AuditSeverity.INFO, attributes);
    return created;
  }

  /**
   * Applies a partial update.
   *
   * <p>When {@code targetId} or {@code pointerType} actually changes, the pointer returns to
   * {@link ValidationStatus#PENDING}, its target revision advances, its cached content is dropped and it is
   * queued for validation.</p>
   *
   * @param pointerId pointer to update
   * @param patch fields to change
   * @return updated pointer
   * @throws PointerNotFoundException when the id is unknown
   * @throws PointerSecurityException when a changed target binding is rejected; nothing is changed
   */
  public ContentPointer update(String pointerId, PointerPatch patch) {
    Objects.requireNonNull(pointerId, "pointerId");
    Objects.requireNonNull(patch, "patch");
    AtomicReference<ContentPointer> previous = new AtomicReference<>();
    AtomicReference<PointerSecurityFilter.Verdict> verdictRef = new AtomicReference<>();
    ContentPointer updated;
    try {
      updated = pointers.computeIfPresent(pointerId, (id, current) -> {
        ContentPointer next = applyPatch(current, patch, verdictRef);
        previous.set(current);
        persist(next);
        return next;
      });
    } catch (PointerSecurityException ex) {
      PointerSecurityFilter.Verdict verdict = verdictRef.get();
      auditRejection(pointerId, patch.pointerType(), patch.targetId(),
          verdict == null ? ex.reasons() : verdict.rejections());
      throw ex;
    }
    if (updated == null) {
      throw new PointerNotFoundException(pointerId);
    }

    ContentPointer before = previous.get();
    boolean critical = isCriticalChange(before, updated);
    if (critical) {
      // content cached for the old binding no longer answers for this pointer
      contentCache.delete(before.contentCacheKey(), TtlCache.CONTENT_NAMESPACE);
      contentCache.delete(updated.contentCacheKey(), TtlCache.CONTENT_NAMESPACE);
      validationQueue.enqueue(updated.id());
      log.info("Pointer {} retargeted to {} ({}); queued for validation",
          updated.id(), updated.targetId(), updated.pointerType().wireName());
    }
    metrics.increment("pointer.update");
    Map<String, String> attributes = describe(updated);
    attributes.put("critical", Boolean.toString(critical));
    PointerSecurityFilter.Verdict verdict = verdictRef.get();
    if (verdict != null && !verdict.warnings().isEmpty()) {
      attributes.put("warnings", String.join("; ", verdict.warnings()));
    }
    audit("update_pointer", updated.id(), AuditSeverity.INFO, attributes);
    return updated;
  }

  /**
   * Removes a pointer from the registry, the validation queue, the content cache and the store.
   *
   * @param pointerId pointer to delete
   * @return {@code true} when the pointer existed
   */
  public boolean delete(String pointerId) {
    Objects.requireNonNull(pointerId, "pointerId");
    AtomicReference<ContentPointer> removed = new AtomicReference<>();
    pointers.computeIfPresent(pointerId, (id, current) -> {
      removed.set(current);
      try {
        store.delete(id);
      } catch (IOException ex) {
        metrics.increment("pointer.store.error");
        log.error("Failed to delete pointer {} from store", id, ex);
      }
      return null;
    });
    ContentPointer pointer = removed.get();
    if (pointer == null) {
      return false;
    }
    validationQueue.remove(pointerId);
    contentCache.delete(pointer.contentCacheKey(), TtlCache.CONTENT_NAMESPACE);
    metrics.increment("pointer.delete");
    log.info("Deleted pointer {}", pointerId);
    audit("delete_pointer", pointerId, AuditSeverity.WARN, describe(pointer));
    return true;
  }

  public Optional<ContentPointer> get(String pointerId) {
    if (pointerId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(pointers.get(pointerId));
  }

  /**
   * Lists pointers held by a source, highest priority first.
   *
   * @param sourceId source entity
   * @return matching pointers
   */
  public List<ContentPointer> listBySource(String sourceId) {
    return filterSorted(p -> p.sourceId().equals(sourceId));
  }

  /**
   * Lists pointers resolving to a target, highest priority first.
   *
   * @param targetId target locator
   * @return matching pointers
   */
  public List<ContentPointer> listByTarget(String targetId) {
    return filterSorted(p -> p.targetId().equals(targetId));
  }

  /**
   * Returns a snapshot of every pointer, ordered by creation time.
   *
   * @return immutable snapshot
   */
  public List<ContentPointer> all() {
    List<ContentPointer> snapshot = new ArrayList<>(pointers.values());
    snapshot.sort(Comparator.comparing(ContentPointer::createdAt).thenComparing(ContentPointer::id));
    return List.copyOf(snapshot);
  }

  public int size() {
    return pointers.size();
  }

  /**
   * Records a fresh retrieval: increments {@code accessCount} and stamps {@code lastAccessed}.
   *
   * @param pointerId accessed pointer; unknown ids are ignored
   */
  public void recordAccess(String pointerId) {
    Instant now = clock.now();
    pointers.computeIfPresent(pointerId, (id, current) -> {
      ContentPointer next = current.toBuilder()
          .accessCount(current.accessCount() + 1)
          .lastAccessed(now)
          .build();
      persist(next);
      return next;
    });
  }

  /**
   * Writes a validation outcome back, unless the pointer was deleted or retargeted since the validator
   * started.
   *
   * @param pointerId validated pointer
   * @param expectedRevision target revision the validator ran against
   * @param check validator outcome
   * @param checkedAt completion instant
   * @return updated pointer, or empty when the result was discarded
   */
  public Optional<ContentPointer> applyValidation(
      String pointerId, long expectedRevision, ValidationCheck check, Instant checkedAt) {
    Objects.requireNonNull(check, "check");
    AtomicBoolean applied = new AtomicBoolean();
    ContentPointer result = pointers.computeIfPresent(pointerId, (id, current) -> {
      if (current.targetRevision() != expectedRevision) {
        return current;
      }
      ContentPointer next = current.toBuilder()
          .validationStatus(ValidationTransitions.statusFor(check.outcome()))
          .lastValidationOutcome(check.outcome())
          .lastValidated(checkedAt)
          .build();
      persist(next);
      applied.set(true);
      return next;
    });
    return applied.get() ? Optional.of(result) : Optional.empty();
  }

  /**
   * Restores pointers from the store, replacing the in-memory set, and queues pending ones.
   *
   * @return number of restored pointers
   * @throws IOException when the store cannot be read
   */
  public int loadFromStore() throws IOException {
    List<ContentPointer> stored = store.loadAll();
    pointers.clear();
    int pending = 0;
    for (ContentPointer pointer : stored) {
      pointers.put(pointer.id(), pointer);
      if (pointer.validationStatus() == ValidationStatus.PENDING) {
        validationQueue.enqueue(pointer.id());
        pending++;
      }
    }
    log.info("Restored {} pointers from store ({} pending validation)", stored.size(), pending);
    return stored.size();
  }

  private ContentPointer applyPatch(
      ContentPointer current,
      PointerPatch patch,
      AtomicReference<PointerSecurityFilter.Verdict> verdictRef) {
    String targetId = patch.targetId() == null
        ? current.targetId()
        : Strings.requireNonBlank("targetId", patch.targetId());
    PointerType pointerType = patch.pointerType() == null ? current.pointerType() : patch.pointerType();
    PointerMetadata metadata = patch.metadata() == null ? current.metadata() : patch.metadata();
    boolean critical = !targetId.equals(current.targetId()) || pointerType != current.pointerType();
    boolean domainChanged = !Objects.equals(metadata.domain(), current.metadata().domain());

    if (critical || domainChanged) {
      PointerSecurityFilter.Verdict verdict = securityFilter.check(pointerType, targetId, metadata.domain());
      verdictRef.set(verdict);
      if (!verdict.allowed()) {
        throw new PointerSecurityException(verdict.rejections());
      }
    }
    validateTtl(patch.ttlSeconds());

    ContentPointer.Builder builder = current.toBuilder()
        .targetId(targetId)
        .pointerType(pointerType)
        .metadata(metadata)
        .updatedAt(clock.now());
    if (patch.relationshipType() != null) {
      builder.relationshipType(patch.relationshipType());
    }
    if (patch.confidenceScore() != null) {
      builder.confidenceScore(Numbers.requireUnitInterval("confidenceScore", patch.confidenceScore()));
    }
    if (patch.priority() != null) {
      builder.priority(patch.priority());
    }
    if (patch.ttlSeconds() != null) {
      builder.ttlSeconds(patch.ttlSeconds());
    }
    if (patch.fallbackContent() != null) {
      builder.fallbackContent(patch.fallbackContent());
    }
    if (patch.analytics() != null) {
      builder.analytics(patch.analytics());
    }
    if (critical) {
      builder.validationStatus(ValidationStatus.PENDING)
          .lastValidationOutcome(null)
          .targetRevision(current.targetRevision() + 1);
    }
    return builder.build();
  }

  private static boolean isCriticalChange(ContentPointer before, ContentPointer after) {
    return before.targetRevision() != after.targetRevision();
  }

  private static void validateTtl(Integer ttlSeconds) {
    if (ttlSeconds != null && ttlSeconds <= 0) {
      throw new IllegalArgumentException("ttlSeconds must be positive (was " + ttlSeconds + ")");
    }
  }

  private void reject(String pointerId, PointerType type, String targetId, PointerSecurityFilter.Verdict verdict) {
    auditRejection(pointerId, type, targetId, verdict.rejections());
    throw new PointerSecurityException(verdict.rejections());
  }

  private void auditRejection(String pointerId, PointerType type, String targetId, List<String> reasons) {
    metrics.increment("pointer.rejected");
    log.warn("Rejected pointer {} -> {}: {}", pointerId == null ? "<new>" : pointerId, targetId, reasons);
    Map<String, String> attributes = new LinkedHashMap<>();
    if (type != null) {
      attributes.put("pointerType", type.wireName());
    }
    if (targetId != null) {
      attributes.put("targetId", targetId);
    }
    attributes.put("reasons", String.join("; ", reasons));
    audit("reject_pointer", pointerId, AuditSeverity.WARN, attributes);
  }

  private List<ContentPointer> filterSorted(Predicate<ContentPointer> filter) {
    List<ContentPointer> matches = new ArrayList<>();
    for (ContentPointer pointer : pointers.values()) {
      if (filter.test(pointer)) {
        matches.add(pointer);
      }
    }
    matches.sort(Comparator.comparingInt(ContentPointer::priority).reversed()
        .thenComparing(ContentPointer::createdAt)
        .thenComparing(ContentPointer::id));
    return List.copyOf(matches);
  }

  private void persist(ContentPointer pointer) {
    try {
      store.save(pointer);
    } catch (IOException ex) {
      metrics.increment("pointer.store.error");
      log.error("Failed to persist pointer {}; registry keeps the in-memory copy", pointer.id(), ex);
    }
  }

  private static Map<String, String> describe(ContentPointer pointer) {
    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put("sourceId", pointer.sourceId());
    attributes.put("targetId", pointer.targetId());
    attributes.put("pointerType", pointer.pointerType().wireName());
    attributes.put("relationshipType", pointer.relationshipType().wireName());
    attributes.put("validationStatus", pointer.validationStatus().wireName());
    return attributes;
  }

  private void audit(String action, String pointerId, AuditSeverity severity, Map<String, String> attributes) {
    AuditEvent event = new AuditEvent(AuditEvent.COMPONENT, action, pointerId, severity, attributes, clock.now());
    try {
      auditSink.publish(event);
    } catch (RuntimeException ex) {
      metrics.increment("pointer.audit.error");
      log.warn("Audit sink failed for {} on pointer {}", action, pointerId, ex);
    }
  }
}

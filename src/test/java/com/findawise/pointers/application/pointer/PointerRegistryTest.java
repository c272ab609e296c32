package com.findawise.pointers.application.pointer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.findawise.pointers.application.cache.TtlCache;
import com.findawise.pointers.application.port.PointerStorePort;
import com.findawise.pointers.application.validation.ValidationQueue;
import com.findawise.pointers.domain.audit.AuditSeverity;
import com.findawise.pointers.domain.error.PointerNotFoundException;
import com.findawise.pointers.domain.error.PointerSecurityException;
import com.findawise.pointers.domain.fetch.RetrievedContent;
import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.pointer.PointerDraft;
import com.findawise.pointers.domain.pointer.PointerPatch;
import com.findawise.pointers.domain.pointer.PointerType;
import com.findawise.pointers.domain.pointer.RelationshipType;
import com.findawise.pointers.domain.pointer.ValidationStatus;
import com.findawise.pointers.domain.validation.ValidationCheck;
import com.findawise.pointers.domain.validation.ValidationOutcome;
import com.findawise.pointers.infrastructure.persistence.InMemoryPointerStore;
import com.findawise.pointers.testing.ManualClock;
import com.findawise.pointers.testing.RecordingAuditSink;
import com.findawise.pointers.testing.RecordingMetricsPort;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PointerRegistryTest {
  private final ManualClock clock = new ManualClock();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final RecordingAuditSink audit = new RecordingAuditSink();
  private final ValidationQueue queue = new ValidationQueue();
  private final InMemoryPointerStore store = new InMemoryPointerStore();
  private TtlCache<RetrievedContent> cache;
  private PointerRegistry registry;

  @BeforeEach
  void setUp() {
    cache = new TtlCache<>(clock, metrics, 100);
    AtomicInteger ids = new AtomicInteger();
    registry = new PointerRegistry(PointerSecurityFilter.defaults(), queue, cache, store, audit, metrics, clock,
        () -> "p" + ids.incrementAndGet());
  }

  @Test
  void createStoresPendingPointerQueuesAndAudits() throws IOException {
    ContentPointer created = registry.create(PointerDraft.of("article-1", "budgeting-101", PointerType.SLUG));

    assertEquals("p1", created.id());
    assertEquals(ValidationStatus.PENDING, created.validationStatus());
    assertEquals(RelationshipType.RELATED, created.relationshipType());
    assertEquals(0.5, created.confidenceScore());
    assertEquals(1, created.priority());
    assertEquals(clock.now(), created.createdAt());
    assertTrue(queue.contains("p1"));
    assertEquals(List.of(created), store.loadAll());
    assertEquals(List.of("create_pointer"), audit.actions());
    assertEquals(1L, metrics.counter("pointer.create"));
  }

  @Test
  void createRejectsBlankIdentifiersAndOutOfRangeScores() {
    assertThrows(IllegalArgumentException.class,
        () -> registry.create(PointerDraft.of(" ", "t", PointerType.SLUG)));
    assertThrows(IllegalArgumentException.class,
        () -> registry.create(PointerDraft.of("s", "t", PointerType.SLUG).withConfidence(1.5)));
    assertThrows(IllegalArgumentException.class,
        () -> registry.create(PointerDraft.of("s", "t", PointerType.SLUG).withTtlSeconds(0)));
    assertEquals(0, registry.size());
  }

  @Test
  void rejectedCreateStoresNothingAndAuditsRejection() {
    PointerSecurityException ex = assertThrows(PointerSecurityException.class,
        () -> registry.create(PointerDraft.of("s", "javascript:alert(1)", PointerType.URL)));

    assertFalse(ex.reasons().isEmpty());
    assertEquals(0, registry.size());
    assertEquals(0, queue.size());
    assertEquals(List.of("reject_pointer"), audit.actions());
    assertEquals(AuditSeverity.WARN, audit.events().get(0).severity());
    assertEquals(1L, metrics.counter("pointer.rejected"));
  }

  @Test
  void retargetResetsStatusAdvancesRevisionAndRequeues() {
    ContentPointer created = registry.create(PointerDraft.of("s", "old-slug", PointerType.SLUG));
    registry.applyValidation(created.id(), created.targetRevision(), ValidationCheck.of(ValidationOutcome.VALID),
        clock.now());
    queue.clear();
    clock.advance(Duration.ofMinutes(1));

    ContentPointer updated = registry.update(created.id(), PointerPatch.retarget("new-slug"));

    assertEquals("new-slug", updated.targetId());
    assertEquals(ValidationStatus.PENDING, updated.validationStatus());
    assertNull(updated.lastValidationOutcome());
    assertEquals(created.targetRevision() + 1, updated.targetRevision());
    assertEquals(clock.now(), updated.updatedAt());
    assertTrue(queue.contains(created.id()));
  }

  @Test
  void nonCriticalUpdateKeepsStatusAndQueue() {
    ContentPointer created = registry.create(PointerDraft.of("s", "slug", PointerType.SLUG));
    registry.applyValidation(created.id(), 0L, ValidationCheck.of(ValidationOutcome.VALID), clock.now());
    queue.clear();

    ContentPointer updated = registry.update(created.id(), PointerPatch.EMPTY.withPriority(5).withConfidence(0.9));

    assertEquals(ValidationStatus.VALID, updated.validationStatus());
    assertEquals(5, updated.priority());
    assertEquals(0.9, updated.confidenceScore());
    assertEquals(created.targetRevision(), updated.targetRevision());
    assertFalse(queue.contains(created.id()));
  }

  @Test
  void rejectedUpdateLeavesPointerUnchanged() {
    ContentPointer created = registry.create(PointerDraft.of("s", "https://ok.example/a", PointerType.URL));

    assertThrows(PointerSecurityException.class,
        () -> registry.update(created.id(), PointerPatch.retarget("https://spam.com/x")));

    assertEquals(created, registry.get(created.id()).orElseThrow());
    assertEquals("reject_pointer", audit.actions().get(audit.actions().size() - 1));
  }

  @Test
  void updateOfUnknownPointerThrows() {
    assertThrows(PointerNotFoundException.class, () -> registry.update("missing", PointerPatch.EMPTY));
  }

  @Test
  void deleteRemovesFromQueueCacheAndStore() throws IOException {
    ContentPointer created = registry.create(PointerDraft.of("s", "slug", PointerType.SLUG));
    cache.set(created.contentCacheKey(), new RetrievedContent("x", "text/html", "cms"), Duration.ofMinutes(1),
        TtlCache.CONTENT_NAMESPACE);

    assertTrue(registry.delete(created.id()));

    assertTrue(registry.get(created.id()).isEmpty());
    assertFalse(queue.contains(created.id()));
    assertTrue(cache.get(created.contentCacheKey(), TtlCache.CONTENT_NAMESPACE).isEmpty());
    assertTrue(store.loadAll().isEmpty());
    assertFalse(registry.delete(created.id()));
  }

  @Test
  void changingOnlyPointerTypeDropsCachedContent() {
    ContentPointer created = registry.create(PointerDraft.of("s", "guide", PointerType.SLUG));
    cache.set(created.contentCacheKey(), new RetrievedContent("<p>slug</p>", "text/html", "cms"),
        Duration.ofMinutes(10), TtlCache.CONTENT_NAMESPACE);

    ContentPointer updated = registry.update(created.id(), PointerPatch.EMPTY.withPointerType(PointerType.ID));

    assertEquals("guide", updated.targetId());
    assertEquals(PointerType.ID, updated.pointerType());
    assertTrue(cache.get(updated.contentCacheKey(), TtlCache.CONTENT_NAMESPACE).isEmpty());
    assertTrue(queue.contains(created.id()));
  }

  @Test
  void nonCriticalUpdateKeepsCachedContent() {
    ContentPointer created = registry.create(PointerDraft.of("s", "guide", PointerType.SLUG));
    cache.set(created.contentCacheKey(), new RetrievedContent("<p>slug</p>", "text/html", "cms"),
        Duration.ofMinutes(10), TtlCache.CONTENT_NAMESPACE);

    registry.update(created.id(), PointerPatch.EMPTY.withPriority(3));

    assertTrue(cache.get(created.contentCacheKey(), TtlCache.CONTENT_NAMESPACE).isPresent());
  }

  @Test
  void draftWithoutPointerTypeRegistersAsSlug() {
    ContentPointer created = registry.create(
        new PointerDraft("s", "budgeting-101", null, null, null, null, null, null, null));

    assertEquals(PointerType.SLUG, created.pointerType());
    assertTrue(queue.contains(created.id()));
  }

  @Test
  void validationForOldRevisionIsDiscarded() {
    ContentPointer created = registry.create(PointerDraft.of("s", "a", PointerType.SLUG));
    registry.update(created.id(), PointerPatch.retarget("b"));

    assertTrue(registry.applyValidation(created.id(), 0L, ValidationCheck.of(ValidationOutcome.VALID), clock.now())
        .isEmpty());
    assertEquals(ValidationStatus.PENDING, registry.get(created.id()).orElseThrow().validationStatus());
  }

  @Test
  void applyValidationMapsOutcomeToStatusAndKeepsRawOutcome() {
    ContentPointer created = registry.create(PointerDraft.of("s", "a", PointerType.SLUG));

    ContentPointer validated = registry.applyValidation(
        created.id(), 0L, ValidationCheck.of(ValidationOutcome.TIMEOUT), clock.now()).orElseThrow();

    assertEquals(ValidationStatus.BROKEN, validated.validationStatus());
    assertEquals(ValidationOutcome.TIMEOUT, validated.lastValidationOutcome());
    assertEquals(clock.now(), validated.lastValidated());
  }

  @Test
  void listsAreOrderedByPriorityThenCreation() {
    ContentPointer low = registry.create(PointerDraft.of("s", "t1", PointerType.SLUG).withPriority(1));
    clock.advance(Duration.ofSeconds(1));
    ContentPointer high = registry.create(PointerDraft.of("s", "t2", PointerType.SLUG).withPriority(9));
    clock.advance(Duration.ofSeconds(1));
    ContentPointer lowLater = registry.create(PointerDraft.of("s", "t1", PointerType.ID).withPriority(1));

    assertEquals(List.of(high, low, lowLater), registry.listBySource("s"));
    assertEquals(List.of(low, lowLater), registry.listByTarget("t1"));
    assertTrue(registry.listBySource("other").isEmpty());
  }

  @Test
  void recordAccessIncrementsCountAndStampsTime() {
    ContentPointer created = registry.create(PointerDraft.of("s", "a", PointerType.SLUG));
    clock.advance(Duration.ofSeconds(3));

    registry.recordAccess(created.id());
    registry.recordAccess(created.id());

    ContentPointer accessed = registry.get(created.id()).orElseThrow();
    assertEquals(2L, accessed.accessCount());
    assertEquals(clock.now(), accessed.lastAccessed());
  }

  @Test
  void storeFailureKeepsInMemoryCopyAndCountsError() {
    PointerStorePort failing = new PointerStorePort() {
      @Override
      public void save(ContentPointer pointer) throws IOException {
        throw new IOException("disk full");
      }

      @Override
      public void delete(String pointerId) throws IOException {
        throw new IOException("disk full");
      }

      @Override
      public List<ContentPointer> loadAll() {
        return List.of();
      }
    };
    PointerRegistry fragile = new PointerRegistry(
        PointerSecurityFilter.defaults(), queue, cache, failing, audit, metrics, clock);

    ContentPointer created = fragile.create(PointerDraft.of("s", "a", PointerType.SLUG));

    assertTrue(fragile.get(created.id()).isPresent());
    assertEquals(1L, metrics.counter("pointer.store.error"));
  }

  @Test
  void loadFromStoreReplacesContentsAndQueuesPendingOnly() throws IOException {
    ContentPointer pending = registry.create(PointerDraft.of("s", "a", PointerType.SLUG));
    ContentPointer valid = registry.create(PointerDraft.of("s", "b", PointerType.SLUG));
    registry.applyValidation(valid.id(), 0L, ValidationCheck.of(ValidationOutcome.VALID), clock.now());
    ValidationQueue freshQueue = new ValidationQueue();
    PointerRegistry restored = new PointerRegistry(
        PointerSecurityFilter.defaults(), freshQueue, cache, store, audit, metrics, clock);

    assertEquals(2, restored.loadFromStore());

    assertEquals(2, restored.size());
    assertTrue(freshQueue.contains(pending.id()));
    assertFalse(freshQueue.contains(valid.id()));
  }
}

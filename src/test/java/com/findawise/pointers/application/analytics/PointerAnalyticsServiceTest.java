package com.findawise.pointers.application.analytics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.findawise.pointers.application.cache.TtlCache;
import com.findawise.pointers.application.pointer.PointerRegistry;
import com.findawise.pointers.application.pointer.PointerSecurityFilter;
import com.findawise.pointers.application.validation.ValidationQueue;
import com.findawise.pointers.domain.analytics.DuplicateGroup;
import com.findawise.pointers.domain.analytics.PointerAnalyticsReport;
import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.pointer.PointerDraft;
import com.findawise.pointers.domain.pointer.PointerType;
import com.findawise.pointers.domain.pointer.RelationshipType;
import com.findawise.pointers.domain.pointer.ValidationStatus;
import com.findawise.pointers.domain.validation.ValidationCheck;
import com.findawise.pointers.domain.validation.ValidationOutcome;
import com.findawise.pointers.infrastructure.persistence.InMemoryPointerStore;
import com.findawise.pointers.testing.ManualClock;
import com.findawise.pointers.testing.RecordingAuditSink;
import com.findawise.pointers.testing.RecordingMetricsPort;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PointerAnalyticsServiceTest {
  private final ManualClock clock = new ManualClock();
  private final ValidationQueue queue = new ValidationQueue();
  private PointerRegistry registry;
  private PointerAnalyticsService analytics;

  @BeforeEach
  void setUp() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    PointerSecurityFilter filter = PointerSecurityFilter.defaults();
    registry = new PointerRegistry(filter, queue, new TtlCache<>(clock, metrics, 10), new InMemoryPointerStore(),
        new RecordingAuditSink(), metrics, clock);
    analytics = new PointerAnalyticsService(registry, filter, queue);
  }

  @Test
  void emptyRegistryYieldsZeroReport() {
    PointerAnalyticsReport report = analytics.report();

    assertEquals(0, report.totalPointers());
    assertEquals(0.0, report.averageConfidence());
    assertEquals(0, report.validPointers());
    assertTrue(report.topDomains().isEmpty());
    assertTrue(analytics.duplicatePointers().isEmpty());
  }

  @Test
  void reportAggregatesStatusesDomainsAndRelationships() {
    ContentPointer valid = registry.create(PointerDraft.of("s1", "https://github.com/a", PointerType.URL)
        .withDomain("github.com").withConfidence(0.9).withRelationship(RelationshipType.FOLLOW_UP));
    clock.advance(Duration.ofSeconds(1));
    ContentPointer broken = registry.create(PointerDraft.of("s2", "https://github.com/b", PointerType.URL)
        .withDomain("github.com").withConfidence(0.5));
    clock.advance(Duration.ofSeconds(1));
    registry.create(PointerDraft.of("s3", "https://example.org/c", PointerType.URL)
        .withDomain("example.org").withConfidence(0.4));
    registry.applyValidation(valid.id(), 0L, ValidationCheck.of(ValidationOutcome.VALID), clock.now());
    registry.applyValidation(broken.id(), 0L, ValidationCheck.of(ValidationOutcome.NOT_FOUND), clock.now());
    queue.remove(valid.id());
    queue.remove(broken.id());

    PointerAnalyticsReport report = analytics.report();

    assertEquals(3, report.totalPointers());
    assertEquals(1, report.validPointers());
    assertEquals(1, report.brokenPointers());
    assertEquals(1, report.pendingPointers());
    assertEquals(0, report.statusCounts().get(ValidationStatus.EXPIRED));
    assertEquals(0.6, report.averageConfidence(), 1e-9);
    assertEquals(List.of(new PointerAnalyticsReport.DomainCount("github.com", 2),
        new PointerAnalyticsReport.DomainCount("example.org", 1)), report.topDomains());
    assertEquals(new PointerAnalyticsReport.RelationshipCount(RelationshipType.RELATED, 2),
        report.relationshipDistribution().get(0));
    assertEquals(2, report.trustedDomainPointers());
    assertEquals(1, report.pendingValidations());
    assertEquals(List.of(broken.id()), analytics.brokenPointers().stream().map(ContentPointer::id).toList());
  }

  @Test
  void duplicatesGroupPointersSharingTarget() {
    ContentPointer first = registry.create(PointerDraft.of("s1", "shared", PointerType.SLUG));
    clock.advance(Duration.ofSeconds(1));
    ContentPointer second = registry.create(PointerDraft.of("s2", "shared", PointerType.SLUG));
    registry.create(PointerDraft.of("s3", "unique", PointerType.SLUG));

    List<DuplicateGroup> groups = analytics.duplicatePointers();

    assertEquals(1, groups.size());
    assertEquals("shared", groups.get(0).targetId());
    assertEquals(List.of(first, second), groups.get(0).pointers());
  }
}

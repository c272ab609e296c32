package com.findawise.pointers.application.relationship;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.findawise.pointers.application.cache.TtlCache;
import com.findawise.pointers.application.pointer.PointerRegistry;
import com.findawise.pointers.application.pointer.PointerSecurityFilter;
import com.findawise.pointers.application.port.RelevanceScorer;
import com.findawise.pointers.application.validation.ValidationQueue;
import com.findawise.pointers.domain.content.ContentNode;
import com.findawise.pointers.domain.content.ContentNodeStatus;
import com.findawise.pointers.domain.content.ContentNodeType;
import com.findawise.pointers.domain.error.ContentNodeNotFoundException;
import com.findawise.pointers.domain.pointer.PointerDraft;
import com.findawise.pointers.domain.pointer.PointerType;
import com.findawise.pointers.domain.pointer.RelationshipType;
import com.findawise.pointers.domain.relationship.DetectionOptions;
import com.findawise.pointers.domain.relationship.RelationshipPattern;
import com.findawise.pointers.domain.relationship.RelationshipSuggestion;
import com.findawise.pointers.domain.relationship.SuggestionOrigin;
import com.findawise.pointers.infrastructure.content.InMemoryContentNodeStore;
import com.findawise.pointers.infrastructure.persistence.InMemoryPointerStore;
import com.findawise.pointers.infrastructure.scoring.CosineSimilarityScorer;
import com.findawise.pointers.testing.ManualClock;
import com.findawise.pointers.testing.RecordingAuditSink;
import com.findawise.pointers.testing.RecordingMetricsPort;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RelationshipDetectorTest {
  private final ManualClock clock = new ManualClock();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final InMemoryContentNodeStore nodes = new InMemoryContentNodeStore();
  private PointerRegistry registry;
  private PatternCatalog catalog;

  @BeforeEach
  void setUp() throws IOException {
    registry = new PointerRegistry(PointerSecurityFilter.defaults(), new ValidationQueue(),
        new TtlCache<>(clock, metrics, 10), new InMemoryPointerStore(), new RecordingAuditSink(), metrics, clock);
    catalog = new PatternCatalog(new RelationshipPatternLoader().loadDefaults());
    nodes.put(node("c1", ContentNodeType.COURSE, List.of("budgeting"), List.of("finance")));
    nodes.put(node("q1", ContentNodeType.QUIZ, List.of("budgeting"), List.of()));
    nodes.put(node("a1", ContentNodeType.ARTICLE, List.of(), List.of("finance")));
    nodes.put(node("v1", ContentNodeType.VIDEO, List.of("cooking"), List.of("food")));
  }

  @Test
  void patternAndSimilarityCandidatesAreMergedAndRanked() {
    List<RelationshipSuggestion> suggestions = detector(null).detect("c1", DetectionOptions.defaults());

    assertEquals(3, suggestions.size());
    RelationshipSuggestion top = suggestions.get(0);
    assertEquals("q1", top.targetId());
    assertEquals(RelationshipType.FOLLOW_UP, top.relationshipType());
    assertEquals(0.8, top.confidence(), 1e-9);
    assertEquals(SuggestionOrigin.PATTERN, top.origin());
    assertEquals("course-to-quiz-follow-up", top.patternId());

    RelationshipSuggestion category = suggestions.get(1);
    assertEquals("a1", category.targetId());
    assertEquals(RelationshipType.RELATED, category.relationshipType());
    assertEquals(0.6, category.confidence(), 1e-9, "pattern confidence beats the weaker similarity score");

    RelationshipSuggestion similar = suggestions.get(2);
    assertEquals("q1", similar.targetId());
    assertEquals(SuggestionOrigin.SIMILARITY, similar.origin());
    assertEquals(0.5, similar.confidence(), 1e-9);
    assertTrue(suggestions.stream().noneMatch(s -> s.targetId().equals("v1")));
  }

  @Test
  void existingPointersAreExcludedUnlessDisabled() {
    registry.create(PointerDraft.of("c1", "q1", PointerType.ID));

    List<RelationshipSuggestion> excluded = detector(null).detect("c1", DetectionOptions.defaults());
    List<RelationshipSuggestion> included =
        detector(null).detect("c1", DetectionOptions.defaults().withExcludeExisting(false));

    assertTrue(excluded.stream().noneMatch(s -> s.targetId().equals("q1")));
    assertTrue(included.stream().anyMatch(s -> s.targetId().equals("q1")));
  }

  @Test
  void minConfidenceAndMaxSuggestionsAreApplied() {
    DetectionOptions options = DetectionOptions.defaults().withMinConfidence(0.55).withMaxSuggestions(1);

    List<RelationshipSuggestion> suggestions = detector(null).detect("c1", options);

    assertEquals(1, suggestions.size());
    assertEquals("q1", suggestions.get(0).targetId());
  }

  @Test
  void failingExternalScorerIsIgnored() {
    RelevanceScorer failing = (source, candidates) -> {
      throw new IllegalStateException("scorer offline");
    };

    List<RelationshipSuggestion> suggestions =
        detector(failing).detect("c1", DetectionOptions.defaults().withExternalScorer(true));

    assertEquals(3, suggestions.size());
    assertEquals(1L, metrics.counter("relationship.detect.externalError"));
  }

  @Test
  void externalSuggestionsJoinTheRanking() {
    RelevanceScorer scorer = (source, candidates) -> List.of(new RelationshipSuggestion(
        source.id(), "v1", RelationshipType.COMPLEMENT, 0.95, "model", SuggestionOrigin.EXTERNAL, null));

    List<RelationshipSuggestion> withScorer =
        detector(scorer).detect("c1", DetectionOptions.defaults().withExternalScorer(true));
    List<RelationshipSuggestion> withoutScorer = detector(scorer).detect("c1", DetectionOptions.defaults());

    assertEquals("v1", withScorer.get(0).targetId());
    assertEquals(SuggestionOrigin.EXTERNAL, withScorer.get(0).origin());
    assertTrue(withoutScorer.stream().noneMatch(s -> s.targetId().equals("v1")));
  }

  @Test
  void unknownSourceThrows() {
    assertThrows(ContentNodeNotFoundException.class,
        () -> detector(null).detect("missing", DetectionOptions.defaults()));
  }

  @Test
  void feedbackUpdatesPatternStatistics() {
    RelationshipDetector detector = detector(null);

    RelationshipPattern afterAccept = detector.recordFeedback("same-category-related", true).orElseThrow();
    RelationshipPattern afterReject = detector.recordFeedback("same-category-related", false).orElseThrow();

    assertEquals(1L, afterAccept.usageCount());
    assertEquals(1.0, afterAccept.successRate(), 1e-9);
    assertEquals(2L, afterReject.usageCount());
    assertEquals(0.5, afterReject.successRate(), 1e-9);
    assertEquals(clock.nowMillis(), afterReject.lastUsedMillis());
    assertTrue(detector.recordFeedback("no-such-pattern", true).isEmpty());
    assertEquals(1L, metrics.counter("relationship.feedback.accepted"));
  }

  @Test
  void poorlyPerformingPatternLosesConfidence() {
    RelationshipDetector detector = detector(null);
    for (int i = 0; i < 5; i++) {
      detector.recordFeedback("course-to-quiz-follow-up", false);
    }

    RelationshipSuggestion followUp = detector.detect("c1", DetectionOptions.defaults()).stream()
        .filter(s -> s.relationshipType() == RelationshipType.FOLLOW_UP)
        .findFirst()
        .orElseThrow();

    assertEquals(0.4, followUp.confidence(), 1e-9);
  }

  private RelationshipDetector detector(RelevanceScorer scorer) {
    return new RelationshipDetector(nodes, registry, catalog, new CosineSimilarityScorer(), scorer, metrics, clock);
  }

  private static ContentNode node(String id, ContentNodeType type, List<String> tags, List<String> categories) {
    return new ContentNode(id, type, id, "", "", id, null, tags, categories, "en", ContentNodeStatus.ACTIVE,
        0.5, 1.0, List.of());
  }
}

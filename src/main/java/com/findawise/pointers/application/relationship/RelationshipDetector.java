package com.findawise.pointers.application.relationship;

import com.findawise.pointers.application.pointer.PointerRegistry;
import com.findawise.pointers.application.port.ClockPort;
import com.findawise.pointers.application.port.ContentNodeSource;
import com.findawise.pointers.application.port.MetricsPort;
import com.findawise.pointers.application.port.RelevanceScorer;
import com.findawise.pointers.application.port.SimilarityScorer;
import com.findawise.pointers.domain.content.ContentNode;
import com.findawise.pointers.domain.error.ContentNodeNotFoundException;
import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.pointer.RelationshipType;
import com.findawise.pointers.domain.relationship.DetectionOptions;
import com.findawise.pointers.domain.relationship.RelationshipPattern;
import com.findawise.pointers.domain.relationship.RelationshipSuggestion;
import com.findawise.pointers.domain.relationship.SuggestionOrigin;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Proposes relationships between content nodes.
 * <p><strong>Candidate sources:</strong>
 * <ul>
 *   <li>Patterns: confidence is the pattern strength scaled by the weighted share of satisfied conditions
 *   and by the pattern's reported success rate.</li>
 *   <li>Similarity: nodes scored by the {@link SimilarityScorer}; near-identical nodes of the same type are
 *   proposed as alternatives, others as related.</li>
 *   <li>External relevance scorer, when requested and configured; its failures are logged and ignored.</li>
 * </ul>
 * <p>Candidates are merged per (target, relationship) keeping the highest confidence, filtered by
 * {@link DetectionOptions#minConfidence()}, sorted by descending confidence and truncated. Detection never
 * modifies the registry.</p>
 *
 * @since 0.1.0
 */
public final class RelationshipDetector {
  private static final Logger log = LoggerFactory.getLogger(RelationshipDetector.class);
  /** Similarity from which same-type nodes are proposed as alternatives. */
  static final double ALTERNATIVE_SIMILARITY = 0.9;

  private final ContentNodeSource nodes;
  private final PointerRegistry registry;
  private final PatternCatalog catalog;
  private final SimilarityScorer similarityScorer;
  private final RelevanceScorer relevanceScorer;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final PatternMatcher matcher = new PatternMatcher();

  /**
   * Creates a detector.
   *
   * @param nodes content store
   * @param registry registry consulted for existing pointers
   * @param catalog relationship patterns
   * @param similarityScorer similarity measure
   * @param relevanceScorer external scorer; {@code null} when none is configured
   * @param metrics metrics sink
   * @param clock time source for feedback timestamps
   */
  public RelationshipDetector(
      ContentNodeSource nodes,
      PointerRegistry registry,
      PatternCatalog catalog,
      SimilarityScorer similarityScorer,
      RelevanceScorer relevanceScorer,
      MetricsPort metrics,
      ClockPort clock) {
    this.nodes = Objects.requireNonNull(nodes, "nodes");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.similarityScorer = Objects.requireNonNull(similarityScorer, "similarityScorer");
    this.relevanceScorer = relevanceScorer;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Proposes relationships for a source node.
   *
   * @param sourceId source content node id
   * @param options detection options
   * @return suggestions, highest confidence first
   * @throws ContentNodeNotFoundException when the source node is unknown
   */
  public List<RelationshipSuggestion> detect(String sourceId, DetectionOptions options) {
    DetectionOptions effective = options == null ? DetectionOptions.defaults() : options;
    long startNanos = System.nanoTime();
    ContentNode source = nodes.findById(sourceId)
        .orElseThrow(() -> new ContentNodeNotFoundException(sourceId));

    List<ContentNode> candidates = new ArrayList<>();
    for (ContentNode node : nodes.listAll()) {
      if (!node.id().equals(source.id())) {
        candidates.add(node);
      }
    }

    Map<String, RelationshipSuggestion> merged = new LinkedHashMap<>();
    for (RelationshipSuggestion suggestion : patternSuggestions(source, candidates)) {
      merge(merged, suggestion);
    }
    for (RelationshipSuggestion suggestion : similaritySuggestions(source, candidates)) {
      merge(merged, suggestion);
    }
    if (effective.includeExternalScorer()) {
      for (RelationshipSuggestion suggestion : externalSuggestions(source, candidates)) {
        merge(merged, suggestion);
      }
    }

    Set<String> excluded = new HashSet<>();
    excluded.add(source.id());
    if (effective.excludeExisting()) {
      for (ContentPointer pointer : registry.listBySource(source.id())) {
        excluded.add(pointer.targetId());
      }
    }

    List<RelationshipSuggestion> result = merged.values().stream()
        .filter(s -> !excluded.contains(s.targetId()))
        .filter(s -> s.confidence() >= effective.minConfidence())
        .sorted(Comparator.comparingDouble(RelationshipSuggestion::confidence).reversed()
            .thenComparing(RelationshipSuggestion::targetId)
            .thenComparing(s -> s.relationshipType().name()))
        .limit(effective.maxSuggestions())
        .toList();

    metrics.increment("relationship.detect.count");
    metrics.observe("relationship.detect.latencyNanos", System.nanoTime() - startNanos);
    log.debug("Detected {} relationship suggestions for {} from {} candidates",
        result.size(), sourceId, candidates.size());
    return result;
  }

  /**
   * Reports whether a pattern-based suggestion was accepted, adjusting the pattern's success rate.
   *
   * @param patternId pattern that produced the suggestion
   * @param accepted whether the suggestion was accepted
   * @return updated pattern, or empty when the pattern is unknown
   */
  public Optional<RelationshipPattern> recordFeedback(String patternId, boolean accepted) {
    Optional<RelationshipPattern> updated = catalog.recordOutcome(patternId, accepted, clock.nowMillis());
    if (updated.isEmpty()) {
      log.warn("Feedback for unknown relationship pattern {}", patternId);
    } else {
      metrics.increment("relationship.feedback." + (accepted ? "accepted" : "rejected"));
    }
    return updated;
  }

  private List<RelationshipSuggestion> patternSuggestions(ContentNode source, List<ContentNode> candidates) {
    List<RelationshipSuggestion> suggestions = new ArrayList<>();
    for (RelationshipPattern pattern : catalog.patterns()) {
      for (ContentNode candidate : candidates) {
        double ratio = matcher.matchRatio(pattern, source, candidate);
        if (ratio <= 0.0) {
          continue;
        }
        double confidence = pattern.strength() * ratio * pattern.performanceFactor();
        suggestions.add(new RelationshipSuggestion(
            source.id(),
            candidate.id(),
            pattern.relationshipType(),
            confidence,
            String.format(Locale.ROOT, "Pattern %s matched %.0f%% of conditions", pattern.id(), ratio * 100),
            SuggestionOrigin.PATTERN,
            pattern.id()));
      }
    }
    return suggestions;
  }

  private List<RelationshipSuggestion> similaritySuggestions(ContentNode source, List<ContentNode> candidates) {
    List<RelationshipSuggestion> suggestions = new ArrayList<>();
    for (ContentNode candidate : candidates) {
      double similarity = similarityScorer.similarity(source, candidate);
      if (similarity <= 0.0) {
        continue;
      }
      RelationshipType type = similarity >= ALTERNATIVE_SIMILARITY && source.type() == candidate.type()
          ? RelationshipType.ALTERNATIVE
          : RelationshipType.RELATED;
      suggestions.add(new RelationshipSuggestion(
          source.id(),
          candidate.id(),
          type,
          similarity,
          String.format(Locale.ROOT, "Content similarity %.2f", similarity),
          SuggestionOrigin.SIMILARITY,
          null));
    }
    return suggestions;
  }

  private List<RelationshipSuggestion> externalSuggestions(ContentNode source, List<ContentNode> candidates) {
    if (relevanceScorer == null) {
      log.debug("External relevance scoring requested but no scorer is configured");
      return List.of();
    }
    try {
      List<RelationshipSuggestion> suggestions = relevanceScorer.suggest(source, List.copyOf(candidates));
      if (suggestions == null) {
        return List.of();
      }
      List<RelationshipSuggestion> accepted = new ArrayList<>();
      for (RelationshipSuggestion suggestion : suggestions) {
        if (suggestion != null && suggestion.sourceId().equals(source.id())) {
          accepted.add(suggestion);
        }
      }
      return accepted;
    } catch (RuntimeException ex) {
      metrics.increment("relationship.detect.externalError");
      log.warn("External relevance scorer failed for {}; continuing without it", source.id(), ex);
      return List.of();
    }
  }

  private static void merge(Map<String, RelationshipSuggestion> merged, RelationshipSuggestion suggestion) {
    String key = suggestion.targetId() + '|' + suggestion.relationshipType().name();
    merged.merge(key, suggestion, (existing, incoming) ->
        incoming.confidence() > existing.confidence() ? incoming : existing);
  }
}

package com.findawise.pointers.application.relationship;

import com.findawise.pointers.domain.relationship.RelationshipPattern;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Current set of relationship patterns.
 *
 * <p>The set is swapped atomically on reload; feedback updates replace single patterns with
 * compare-and-set retries, so readers always see a consistent snapshot.</p>
 *
 * @since 0.1.0
 */
public final class PatternCatalog {
  private final AtomicReference<Map<String, RelationshipPattern>> patterns =
      new AtomicReference<>(Map.of());

  public PatternCatalog() {}

  public PatternCatalog(List<RelationshipPattern> initial) {
    replaceAll(initial);
  }

  /**
   * Replaces every pattern.
   *
   * @param next new patterns; ids must be unique
   * @throws IllegalArgumentException on duplicate ids
   */
  public void replaceAll(List<RelationshipPattern> next) {
    Objects.requireNonNull(next, "next");
    Map<String, RelationshipPattern> byId = new LinkedHashMap<>();
    for (RelationshipPattern pattern : next) {
      if (byId.putIfAbsent(pattern.id(), pattern) != null) {
        throw new IllegalArgumentException("Duplicate pattern id detected: " + pattern.id());
      }
    }
    patterns.set(Collections.unmodifiableMap(byId));
  }

  public List<RelationshipPattern> patterns() {
    return new ArrayList<>(patterns.get().values());
  }

  public Optional<RelationshipPattern> find(String patternId) {
    return Optional.ofNullable(patterns.get().get(patternId));
  }

  public int size() {
    return patterns.get().size();
  }

  /**
   * Folds a reported suggestion outcome into the pattern's statistics.
   *
   * @param patternId pattern that produced the suggestion
   * @param accepted whether the suggestion was accepted
   * @param nowMillis report time
   * @return updated pattern, or empty when the id is unknown
   */
  public Optional<RelationshipPattern> recordOutcome(String patternId, boolean accepted, long nowMillis) {
    while (true) {
      Map<String, RelationshipPattern> current = patterns.get();
      RelationshipPattern pattern = current.get(patternId);
      if (pattern == null) {
        return Optional.empty();
      }
      RelationshipPattern updated = pattern.withOutcome(accepted, nowMillis);
      Map<String, RelationshipPattern> next = new LinkedHashMap<>(current);
      next.put(patternId, updated);
      if (patterns.compareAndSet(current, Collections.unmodifiableMap(next))) {
        return Optional.of(updated);
      }
    }
  }
}

package com.findawise.pointers.application.analytics;

import com.findawise.pointers.application.pointer.PointerRegistry;
import com.findawise.pointers.application.pointer.PointerSecurityFilter;
import com.findawise.pointers.application.validation.ValidationQueue;
import com.findawise.pointers.domain.analytics.DuplicateGroup;
import com.findawise.pointers.domain.analytics.PointerAnalyticsReport;
import com.findawise.pointers.domain.analytics.PointerAnalyticsReport.DomainCount;
import com.findawise.pointers.domain.analytics.PointerAnalyticsReport.RelationshipCount;
import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.pointer.RelationshipType;
import com.findawise.pointers.domain.pointer.ValidationStatus;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Read-only aggregates over the pointer registry. Each call works on one registry snapshot.
 *
 * @since 0.1.0
 */
public final class PointerAnalyticsService {
  static final int TOP_DOMAINS = 10;

  private final PointerRegistry registry;
  private final PointerSecurityFilter securityFilter;
  private final ValidationQueue validationQueue;

  public PointerAnalyticsService(
      PointerRegistry registry, PointerSecurityFilter securityFilter, ValidationQueue validationQueue) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.securityFilter = Objects.requireNonNull(securityFilter, "securityFilter");
    this.validationQueue = Objects.requireNonNull(validationQueue, "validationQueue");
  }

  /**
   * Lists pointers whose status is {@link ValidationStatus#BROKEN}.
   *
   * @return broken pointers ordered by creation time
   */
  public List<ContentPointer> brokenPointers() {
    return registry.all().stream()
        .filter(p -> p.validationStatus() == ValidationStatus.BROKEN)
        .toList();
  }

  /**
   * Groups pointers sharing a target id; only groups with two or more pointers are returned.
   *
   * @return duplicate groups ordered by target id
   */
  public List<DuplicateGroup> duplicatePointers() {
    Map<String, List<ContentPointer>> byTarget = new TreeMap<>();
    for (ContentPointer pointer : registry.all()) {
      byTarget.computeIfAbsent(pointer.targetId(), k -> new ArrayList<>()).add(pointer);
    }
    List<DuplicateGroup> groups = new ArrayList<>();
    for (Map.Entry<String, List<ContentPointer>> entry : byTarget.entrySet()) {
      if (entry.getValue().size() > 1) {
        groups.add(new DuplicateGroup(entry.getKey(), entry.getValue()));
      }
    }
    return List.copyOf(groups);
  }

  /**
   * Builds the aggregate report.
   *
   * @return analytics report; an empty registry yields zero counts and zero average confidence
   */
  public PointerAnalyticsReport report() {
    List<ContentPointer> pointers = registry.all();
    Map<ValidationStatus, Integer> statusCounts = new EnumMap<>(ValidationStatus.class);
    Map<String, Integer> domainCounts = new HashMap<>();
    Map<RelationshipType, Integer> relationshipCounts = new EnumMap<>(RelationshipType.class);
    double confidenceSum = 0.0;
    int trusted = 0;

    for (ContentPointer pointer : pointers) {
      statusCounts.merge(pointer.validationStatus(), 1, Integer::sum);
      relationshipCounts.merge(pointer.relationshipType(), 1, Integer::sum);
      confidenceSum += pointer.confidenceScore();
      String domain = pointer.metadata().domain();
      if (domain != null) {
        domainCounts.merge(domain, 1, Integer::sum);
        if (securityFilter.isTrusted(domain)) {
          trusted++;
        }
      }
    }

    List<DomainCount> topDomains = domainCounts.entrySet().stream()
        .map(e -> new DomainCount(e.getKey(), e.getValue()))
        .sorted(Comparator.comparingInt(DomainCount::count).reversed().thenComparing(DomainCount::domain))
        .limit(TOP_DOMAINS)
        .toList();
    List<RelationshipCount> relationships = relationshipCounts.entrySet().stream()
        .map(e -> new RelationshipCount(e.getKey(), e.getValue()))
        .sorted(Comparator.comparingInt(RelationshipCount::count).reversed()
            .thenComparing(RelationshipCount::relationshipType))
        .toList();
    double average = pointers.isEmpty() ? 0.0 : confidenceSum / pointers.size();

    return new PointerAnalyticsReport(
        pointers.size(), statusCounts, average, topDomains, relationships, trusted, validationQueue.size());
  }
}

package com.findawise.pointers.domain.analytics;

import com.findawise.pointers.domain.pointer.RelationshipType;
import com.findawise.pointers.domain.pointer.ValidationStatus;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view over the registry.
 *
 * @param totalPointers number of registered pointers
 * @param statusCounts pointers per validation status; every status present
 * @param averageConfidence mean confidence, zero for an empty registry
 * @param topDomains up to ten most referenced domains, descending by count
 * @param relationshipDistribution relationship types in use, descending by count
 * @param trustedDomainPointers pointers whose domain is on the allow list
 * @param pendingValidations entries waiting in the validation queue
 * @since 0.1.0
 */
public record PointerAnalyticsReport(
    int totalPointers,
    Map<ValidationStatus, Integer> statusCounts,
    double averageConfidence,
    List<DomainCount> topDomains,
    List<RelationshipCount> relationshipDistribution,
    int trustedDomainPointers,
    int pendingValidations) {

  public PointerAnalyticsReport {
    EnumMap<ValidationStatus, Integer> copy = new EnumMap<>(ValidationStatus.class);
    for (ValidationStatus status : ValidationStatus.values()) {
      copy.put(status, 0);
    }
    if (statusCounts != null) {
      copy.putAll(statusCounts);
    }
    statusCounts = Collections.unmodifiableMap(copy);
    topDomains = List.copyOf(topDomains);
    relationshipDistribution = List.copyOf(relationshipDistribution);
  }

  public int validPointers() {
    return statusCounts.get(ValidationStatus.VALID);
  }

  public int brokenPointers() {
    return statusCounts.get(ValidationStatus.BROKEN);
  }

  public int pendingPointers() {
    return statusCounts.get(ValidationStatus.PENDING);
  }

  /** Domain with its pointer count. */
  public record DomainCount(String domain, int count) {}

  /** Relationship type with its pointer count. */
  public record RelationshipCount(RelationshipType relationshipType, int count) {}
}

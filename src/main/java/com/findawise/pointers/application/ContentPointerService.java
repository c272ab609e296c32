package com.findawise.pointers.application;

import com.findawise.pointers.application.analytics.PointerAnalyticsService;
import com.findawise.pointers.application.fetch.ContentFetcher;
import com.findawise.pointers.application.pointer.PointerRegistry;
import com.findawise.pointers.application.relationship.RelationshipDetector;
import com.findawise.pointers.application.validation.PointerValidationService;
import com.findawise.pointers.application.validation.ValidationWorker;
import com.findawise.pointers.domain.analytics.DuplicateGroup;
import com.findawise.pointers.domain.analytics.PointerAnalyticsReport;
import com.findawise.pointers.domain.fetch.FetchOptions;
import com.findawise.pointers.domain.fetch.FetchResult;
import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.pointer.PointerDraft;
import com.findawise.pointers.domain.pointer.PointerPatch;
import com.findawise.pointers.domain.relationship.DetectionOptions;
import com.findawise.pointers.domain.relationship.RelationshipPattern;
import com.findawise.pointers.domain.relationship.RelationshipSuggestion;
import com.findawise.pointers.domain.validation.PointerValidationResult;
import com.findawise.pointers.domain.validation.ValidationCycleReport;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> single entry point of the pointer engine, composing registry, fetcher,
 * validation, relationship detection and analytics.
 *
 * <p><strong>Lifecycle:</strong> {@link #start()} restores pointers from the store and starts the
 * validation schedule; {@link #close()} stops the schedule, then closes owned resources (executors,
 * store, audit sink, metrics) in registration order.
 *
 * <p><strong>Errors:</strong> registry operations throw the engine's unchecked exceptions; fetch and
 * validation report failures in their results and never throw.
 *
 * @since 0.1.0
 */
public final class ContentPointerService implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ContentPointerService.class);

  private final PointerRegistry registry;
  private final ContentFetcher fetcher;
  private final PointerValidationService validationService;
  private final ValidationWorker worker;
  private final RelationshipDetector detector;
  private final PointerAnalyticsService analytics;
  private final List<AutoCloseable> resources;
  private final AtomicBoolean closed = new AtomicBoolean();

  @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Collaborators are shared services wired once by the composition root.")
  public ContentPointerService(
      PointerRegistry registry,
      ContentFetcher fetcher,
      PointerValidationService validationService,
      ValidationWorker worker,
      RelationshipDetector detector,
      PointerAnalyticsService analytics,
      List<? extends AutoCloseable> resources) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.validationService = Objects.requireNonNull(validationService, "validationService");
    this.worker = Objects.requireNonNull(worker, "worker");
    this.detector = Objects.requireNonNull(detector, "detector");
    this.analytics = Objects.requireNonNull(analytics, "analytics");
    this.resources = resources == null ? List.of() : List.copyOf(resources);
  }

  /**
   * Restores stored pointers and starts scheduled validation.
   *
   * @throws IOException when the store cannot be read; the worker is not started in that case
   */
  public void start() throws IOException {
    restore();
    worker.start();
  }

  /**
   * Restores stored pointers without starting the schedule, for one-shot commands.
   *
   * @return number of restored pointers
   * @throws IOException when the store cannot be read
   */
  public int restore() throws IOException {
    return registry.loadFromStore();
  }

  public ContentPointer createPointer(PointerDraft draft) {
    return registry.create(draft);
  }

  public ContentPointer updatePointer(String pointerId, PointerPatch patch) {
    return registry.update(pointerId, patch);
  }

  public boolean deletePointer(String pointerId) {
    return registry.delete(pointerId);
  }

  public Optional<ContentPointer> getPointer(String pointerId) {
    return registry.get(pointerId);
  }

  public List<ContentPointer> getPointersBySource(String sourceId) {
    return registry.listBySource(sourceId);
  }

  public List<ContentPointer> getPointersByTarget(String targetId) {
    return registry.listByTarget(targetId);
  }

  /** Resolves content with the configured defaults: cache on, fallback on, configured timeout. */
  public FetchResult fetchContent(String pointerId) {
    return fetcher.fetch(pointerId, null);
  }

  public FetchResult fetchContent(String pointerId, FetchOptions options) {
    return fetcher.fetch(pointerId, options);
  }

  public PointerValidationResult validatePointer(String pointerId) {
    return validationService.validatePointer(pointerId);
  }

  /** Runs one validation cycle now, independent of the schedule. */
  public ValidationCycleReport runValidationCycle() {
    return worker.runCycle();
  }

  public List<RelationshipSuggestion> detectRelationships(String sourceId, DetectionOptions options) {
    return detector.detect(sourceId, options);
  }

  /**
   * Records whether a pattern-originated suggestion was accepted.
   *
   * @param patternId pattern that produced the suggestion
   * @param accepted {@code true} when the suggestion became a pointer
   * @return updated pattern, or empty for an unknown id
   */
  public Optional<RelationshipPattern> recordSuggestionFeedback(String patternId, boolean accepted) {
    return detector.recordFeedback(patternId, accepted);
  }

  public List<ContentPointer> getBrokenPointers() {
    return analytics.brokenPointers();
  }

  public List<DuplicateGroup> getDuplicatePointers() {
    return analytics.duplicatePointers();
  }

  public PointerAnalyticsReport getPointerAnalytics() {
    return analytics.report();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    worker.close();
    List<Exception> failures = new ArrayList<>();
    for (AutoCloseable resource : resources) {
      try {
        resource.close();
      } catch (Exception ex) {
        failures.add(ex);
        log.warn("Failed to close {}", resource.getClass().getSimpleName(), ex);
      }
    }
    if (failures.isEmpty()) {
      log.info("Content pointer service closed");
    }
  }
}

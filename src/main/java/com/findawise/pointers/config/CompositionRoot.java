package com.findawise.pointers.config;

import com.findawise.pointers.adapter.kafka.KafkaAuditSinkAdapter;
import com.findawise.pointers.application.ContentPointerService;
import com.findawise.pointers.application.analytics.PointerAnalyticsService;
import com.findawise.pointers.application.cache.TtlCache;
import com.findawise.pointers.application.fetch.ContentFetcher;
import com.findawise.pointers.application.pointer.PointerRegistry;
import com.findawise.pointers.application.pointer.PointerSecurityFilter;
import com.findawise.pointers.application.port.AuditSinkPort;
import com.findawise.pointers.application.port.ClockPort;
import com.findawise.pointers.application.port.ContentNodeSource;
import com.findawise.pointers.application.port.ContentRetriever;
import com.findawise.pointers.application.port.CycleScheduler;
import com.findawise.pointers.application.port.DynamicContentGenerator;
import com.findawise.pointers.application.port.MetricsPort;
import com.findawise.pointers.application.port.PointerStorePort;
import com.findawise.pointers.application.port.PointerValidator;
import com.findawise.pointers.application.port.RelevanceScorer;
import com.findawise.pointers.application.relationship.PatternCatalog;
import com.findawise.pointers.application.relationship.RelationshipDetector;
import com.findawise.pointers.application.relationship.RelationshipPatternLoader;
import com.findawise.pointers.application.validation.PointerValidationService;
import com.findawise.pointers.application.validation.ValidationQueue;
import com.findawise.pointers.application.validation.ValidationWorker;
import com.findawise.pointers.domain.fetch.RetrievedContent;
import com.findawise.pointers.domain.pointer.PointerType;
import com.findawise.pointers.domain.relationship.RelationshipPattern;
import com.findawise.pointers.infrastructure.audit.LoggingAuditSink;
import com.findawise.pointers.infrastructure.content.ContentNodeYamlLoader;
import com.findawise.pointers.infrastructure.content.InMemoryContentNodeStore;
import com.findawise.pointers.infrastructure.exec.ExecutorFactories;
import com.findawise.pointers.infrastructure.exec.ScheduledExecutorCycleScheduler;
import com.findawise.pointers.infrastructure.persistence.InMemoryPointerStore;
import com.findawise.pointers.infrastructure.persistence.JsonFilePointerStore;
import com.findawise.pointers.infrastructure.retrieval.ContentStoreRetriever;
import com.findawise.pointers.infrastructure.retrieval.DynamicContentRetriever;
import com.findawise.pointers.infrastructure.retrieval.FileContentRetriever;
import com.findawise.pointers.infrastructure.retrieval.FileSandbox;
import com.findawise.pointers.infrastructure.retrieval.PlaceholderContentGenerator;
import com.findawise.pointers.infrastructure.retrieval.UnconfiguredTransportRetriever;
import com.findawise.pointers.infrastructure.scoring.CosineSimilarityScorer;
import com.findawise.pointers.infrastructure.validator.ContentStoreValidator;
import com.findawise.pointers.infrastructure.validator.DynamicValidator;
import com.findawise.pointers.infrastructure.validator.FileValidator;
import com.findawise.pointers.infrastructure.validator.UrlSyntaxValidator;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> wires a {@link ContentPointerService} from {@link EngineConfig}.
 * <p><strong>Why:</strong> the one place where configuration turns into concrete adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select store and audit sink backends.</li>
 *   <li>Build the retriever and validator tables keyed by pointer type.</li>
 *   <li>Create the fetch and validation pools and the cycle scheduler, handing them to the
 *       service so {@link ContentPointerService#close()} releases them.</li>
 * </ul>
 * <p>Transport-backed retrievers or validators for {@code url}/{@code api}, a custom content
 * source, a generator or an external relevance scorer can be injected before {@link #build()}.</p>
 * <p><strong>Thread-safety:</strong> configure and build on one thread during startup.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final EngineConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Map<PointerType, ContentRetriever> retrieverOverrides = new EnumMap<>(PointerType.class);
  private final Map<PointerType, PointerValidator> validatorOverrides = new EnumMap<>(PointerType.class);
  private ContentNodeSource contentNodes;
  private DynamicContentGenerator generator = new PlaceholderContentGenerator();
  private RelevanceScorer relevanceScorer;
  private CycleScheduler scheduler;
  private PointerStorePort store;
  private AuditSinkPort auditSink;

  public CompositionRoot(EngineConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public CompositionRoot withRetriever(PointerType type, ContentRetriever retriever) {
    retrieverOverrides.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(retriever, "retriever"));
    return this;
  }

  public CompositionRoot withValidator(PointerType type, PointerValidator validator) {
    validatorOverrides.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(validator, "validator"));
    return this;
  }

  public CompositionRoot withContentNodes(ContentNodeSource source) {
    this.contentNodes = Objects.requireNonNull(source, "source");
    return this;
  }

  public CompositionRoot withGenerator(DynamicContentGenerator value) {
    this.generator = Objects.requireNonNull(value, "generator");
    return this;
  }

  public CompositionRoot withRelevanceScorer(RelevanceScorer value) {
    this.relevanceScorer = value;
    return this;
  }

  /** Replaces the scheduled-executor scheduler, e.g. with a manually ticked one in tests. */
  public CompositionRoot withScheduler(CycleScheduler value) {
    this.scheduler = Objects.requireNonNull(value, "scheduler");
    return this;
  }

  public CompositionRoot withStore(PointerStorePort value) {
    this.store = Objects.requireNonNull(value, "store");
    return this;
  }

  public CompositionRoot withAuditSink(AuditSinkPort value) {
    this.auditSink = Objects.requireNonNull(value, "auditSink");
    return this;
  }

  /**
   * Builds the service. Nothing is restored from the store until {@code start()} or
   * {@code restore()} is called on the result.
   *
   * @return wired service owning its pools, store and audit sink
   * @throws IOException when the store directory, pattern file or content catalog cannot be read
   */
  public ContentPointerService build() throws IOException {
    List<AutoCloseable> resources = new ArrayList<>();
    ExecutorService validationPool = null;
    ExecutorService fetchPool = null;
    try {
      PointerStorePort pointerStore = store != null ? store : createStore();
      AuditSinkPort audit = auditSink != null ? auditSink : createAuditSink();
      ContentNodeSource nodes = contentNodes != null ? contentNodes : loadContentNodes();
      CycleScheduler cycleScheduler = scheduler;
      if (cycleScheduler == null) {
        ScheduledExecutorCycleScheduler owned = new ScheduledExecutorCycleScheduler();
        resources.add(owned);
        cycleScheduler = owned;
      }

      PointerSecurityFilter securityFilter =
          new PointerSecurityFilter(config.denyDomains(), config.allowDomains());
      ValidationQueue queue = new ValidationQueue();
      TtlCache<RetrievedContent> cache = new TtlCache<>(clock, metrics, config.cacheMaxEntries());
      PointerRegistry registry =
          new PointerRegistry(securityFilter, queue, cache, pointerStore, audit, metrics, clock);

      validationPool = ExecutorFactories.newWorkerPool(config.validationBatchSize(), "pointer-validate");
      fetchPool = ExecutorFactories.newWorkerPool(config.fetchWorkers(), "pointer-fetch");
      ExecutorService validationExecutor = validationPool;
      ExecutorService fetchExecutor = fetchPool;
      resources.add(() -> ExecutorFactories.shutdownQuietly(validationExecutor, 5_000L));
      resources.add(() -> ExecutorFactories.shutdownQuietly(fetchExecutor, 5_000L));
      resources.add(pointerStore);
      resources.add(audit);

      FileSandbox sandbox = new FileSandbox(config.contentFileRoot());
      ContentFetcher fetcher = new ContentFetcher(
          registry, cache, retrievers(nodes, sandbox), fetchExecutor, config.cacheDefaultTtlSeconds(),
          config.fetchTimeout(), metrics);
      PointerValidationService validation = new PointerValidationService(
          registry, queue, validators(nodes, sandbox), validationExecutor, config.validationTimeout(), metrics, clock);
      ValidationWorker worker = new ValidationWorker(
          queue, validation, cycleScheduler, config.validationBatchSize(), config.validationInterval(), metrics);
      RelationshipDetector detector = new RelationshipDetector(
          nodes, registry, new PatternCatalog(loadPatterns()), new CosineSimilarityScorer(),
          relevanceScorer, metrics, clock);
      PointerAnalyticsService analytics = new PointerAnalyticsService(registry, securityFilter, queue);

      if (metrics instanceof AutoCloseable closeableMetrics) {
        resources.add(closeableMetrics);
      }
      log.info("Content pointer engine wired (store={}, audit={}, batchSize={}, interval={}s)",
          config.storeType(), config.auditSink(), config.validationBatchSize(),
          config.validationInterval().toSeconds());
      return new ContentPointerService(registry, fetcher, validation, worker, detector, analytics, resources);
    } catch (IOException | RuntimeException ex) {
      ExecutorFactories.shutdownQuietly(validationPool, 1_000L);
      ExecutorFactories.shutdownQuietly(fetchPool, 1_000L);
      throw ex;
    }
  }

  Map<PointerType, ContentRetriever> retrievers(ContentNodeSource nodes, FileSandbox sandbox) {
    Map<PointerType, ContentRetriever> table = new EnumMap<>(PointerType.class);
    ContentRetriever transport = new UnconfiguredTransportRetriever();
    table.put(PointerType.SLUG, new ContentStoreRetriever(nodes, ContentStoreRetriever.Lookup.SLUG));
    table.put(PointerType.ID, new ContentStoreRetriever(nodes, ContentStoreRetriever.Lookup.ID));
    table.put(PointerType.FILE, new FileContentRetriever(sandbox.root()));
    table.put(PointerType.DYNAMIC, new DynamicContentRetriever(generator));
    table.put(PointerType.URL, transport);
    table.put(PointerType.API, transport);
    table.putAll(retrieverOverrides);
    return table;
  }

  Map<PointerType, PointerValidator> validators(ContentNodeSource nodes, FileSandbox sandbox) {
    Map<PointerType, PointerValidator> table = new EnumMap<>(PointerType.class);
    PointerValidator urls = new UrlSyntaxValidator();
    table.put(PointerType.SLUG, new ContentStoreValidator(nodes, ContentStoreRetriever.Lookup.SLUG));
    table.put(PointerType.ID, new ContentStoreValidator(nodes, ContentStoreRetriever.Lookup.ID));
    table.put(PointerType.FILE, new FileValidator(sandbox));
    table.put(PointerType.DYNAMIC, new DynamicValidator());
    table.put(PointerType.URL, urls);
    table.put(PointerType.API, urls);
    table.putAll(validatorOverrides);
    return table;
  }

  private PointerStorePort createStore() throws IOException {
    return switch (config.storeType()) {
      case FILE -> new JsonFilePointerStore(config.storeDirectory(), metrics);
      case MEMORY -> new InMemoryPointerStore();
    };
  }

  private AuditSinkPort createAuditSink() {
    return switch (config.auditSink()) {
      case KAFKA -> new KafkaAuditSinkAdapter(config.kafkaBootstrap().orElseThrow(), config.kafkaTopic(), metrics);
      case LOG -> new LoggingAuditSink(metrics);
    };
  }

  private ContentNodeSource loadContentNodes() throws IOException {
    if (config.contentNodesFile().isEmpty()) {
      log.info("No content catalog configured; slug and id pointers will not resolve");
      return new InMemoryContentNodeStore();
    }
    return new ContentNodeYamlLoader().load(config.contentNodesFile().get());
  }

  private List<RelationshipPattern> loadPatterns() throws IOException {
    RelationshipPatternLoader loader = new RelationshipPatternLoader();
    return config.patternsFile().isPresent() ? loader.load(config.patternsFile().get()) : loader.loadDefaults();
  }
}

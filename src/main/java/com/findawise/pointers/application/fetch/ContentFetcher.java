package com.findawise.pointers.application.fetch;

import com.findawise.pointers.application.cache.TtlCache;
import com.findawise.pointers.application.pointer.PointerRegistry;
import com.findawise.pointers.application.port.ContentRetriever;
import com.findawise.pointers.application.port.MetricsPort;
import com.findawise.pointers.domain.fetch.FetchOptions;
import com.findawise.pointers.domain.fetch.FetchResult;
import com.findawise.pointers.domain.fetch.RetrievedContent;
import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.pointer.FallbackContent;
import com.findawise.pointers.domain.pointer.PointerType;
import com.findawise.pointers.logging.Logs;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves pointers to content.
 * <p><strong>Flow:</strong> cache lookup by the pointer's content cache key, then the retriever registered
 * for the pointer type (types without one use the {@code dynamic} retriever), then a cache write and an
 * access record. When retrieval fails and the caller allows it, the pointer's fallback content is served.</p>
 * <p><strong>Contract:</strong> {@link #fetch(String, FetchOptions)} never throws; every failure is a
 * {@link FetchResult} with {@code success=false}.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; retrievals run on the supplied executor.</p>
 * <p><strong>Observability:</strong> {@code pointer.fetch.cacheHit}, {@code pointer.fetch.cacheMiss},
 * {@code pointer.fetch.fallback}, {@code pointer.fetch.failure}, {@code pointer.fetch.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class ContentFetcher {
  private static final Logger log = LoggerFactory.getLogger(ContentFetcher.class);
  private static final int MAX_LOGGED_ERROR_BYTES = 256;

  private final PointerRegistry registry;
  private final TtlCache<RetrievedContent> cache;
  private final Map<PointerType, ContentRetriever> retrievers;
  private final ExecutorService executor;
  private final int defaultTtlSeconds;
  private final FetchOptions defaultOptions;
  private final MetricsPort metrics;

  /**
   * Creates a fetcher.
   *
   * @param registry pointer registry, also the sink for access statistics
   * @param cache content cache
   * @param retrievers retriever per pointer type
   * @param executor executor running retrievals so they can be bounded by a timeout
   * @param defaultTtlSeconds cache lifetime for pointers without a ttl
   * @param defaultTimeout retrieval deadline used when the caller passes no options
   * @param metrics metrics sink
   */
  public ContentFetcher(
      PointerRegistry registry,
      TtlCache<RetrievedContent> cache,
      Map<PointerType, ContentRetriever> retrievers,
      ExecutorService executor,
      int defaultTtlSeconds,
      Duration defaultTimeout,
      MetricsPort metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.retrievers = Map.copyOf(Objects.requireNonNull(retrievers, "retrievers"));
    this.executor = Objects.requireNonNull(executor, "executor");
    if (defaultTtlSeconds <= 0) {
      throw new IllegalArgumentException("defaultTtlSeconds must be positive");
    }
    this.defaultTtlSeconds = defaultTtlSeconds;
    this.defaultOptions = FetchOptions.defaults().withTimeout(Objects.requireNonNull(defaultTimeout, "defaultTimeout"));
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Resolves a pointer's content.
   *
   * @param pointerId pointer to resolve
   * @param options per-call options; {@code null} uses cache, fallback and the configured timeout
   * @return fetch result; never {@code null}
   */
  public FetchResult fetch(String pointerId, FetchOptions options) {
    FetchOptions effective = options == null ? defaultOptions : options;
    Optional<ContentPointer> maybePointer = registry.get(pointerId);
    if (maybePointer.isEmpty()) {
      metrics.increment("pointer.fetch.notFound");
      return FetchResult.failure("Pointer not found", 0L);
    }
    ContentPointer pointer = maybePointer.get();
    String cacheKey = pointer.contentCacheKey();

    if (effective.useCache()) {
      Optional<RetrievedContent> cached = cache.get(cacheKey, TtlCache.CONTENT_NAMESPACE);
      if (cached.isPresent()) {
        metrics.increment("pointer.fetch.cacheHit");
        return FetchResult.fromCache(cached.get());
      }
      metrics.increment("pointer.fetch.cacheMiss");
    }

    long start = System.nanoTime();
    try {
      RetrievedContent content = retrieve(pointer, effective.timeout());
      long elapsedNanos = System.nanoTime() - start;
      metrics.observe("pointer.fetch.latencyNanos", elapsedNanos);
      if (effective.useCache()) {
        Duration ttl = Duration.ofSeconds(pointer.effectiveTtlSeconds(defaultTtlSeconds));
        cache.set(cacheKey, content, ttl, TtlCache.CONTENT_NAMESPACE);
      }
      registry.recordAccess(pointer.id());
      return FetchResult.fresh(content, TimeUnit.NANOSECONDS.toMillis(elapsedNanos));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return failOrFallback(pointer, effective, "interrupted", start);
    } catch (RuntimeException ex) {
      return failOrFallback(pointer, effective, describe(ex), start);
    }
  }

  /**
   * Runs the retriever on the executor. The deadline is counted from the moment the retriever starts;
   * on expiry the worker thread is interrupted so it returns to the pool. Waiting for a free thread is
   * bounded by the same timeout.
   */
  private RetrievedContent retrieve(ContentPointer pointer, Duration timeout) throws InterruptedException {
    ContentRetriever retriever = retrieverFor(pointer.pointerType());
    CountDownLatch started = new CountDownLatch(1);
    Future<RetrievedContent> future;
    try {
      future = executor.submit(() -> {
        started.countDown();
        return retriever.retrieve(pointer);
      });
    } catch (RejectedExecutionException ex) {
      throw new IllegalStateException("Fetch executor rejected retrieval", ex);
    }
    if (!started.await(timeout.toMillis(), TimeUnit.MILLISECONDS) && future.cancel(false)) {
      throw new IllegalStateException("Retrieval did not start within " + timeout.toMillis() + " ms");
    }
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw new IllegalStateException("Timed out after " + timeout.toMillis() + " ms", ex);
    } catch (InterruptedException ex) {
      future.cancel(true);
      throw ex;
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException(cause.getMessage(), cause);
    }
  }

  private ContentRetriever retrieverFor(PointerType type) {
    ContentRetriever retriever = retrievers.get(type);
    if (retriever == null) {
      retriever = retrievers.get(PointerType.DYNAMIC);
    }
    if (retriever == null) {
      throw new IllegalStateException("No retriever registered for pointer type " + type.wireName());
    }
    return retriever;
  }

  private FetchResult failOrFallback(ContentPointer pointer, FetchOptions options, String reason, long startNanos) {
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    Optional<FallbackContent> fallback = pointer.fallback();
    if (options.fallback() && fallback.isPresent()) {
      metrics.increment("pointer.fetch.fallback");
      log.warn("Serving fallback for pointer {} after fetch failure: {}",
          pointer.id(), Logs.truncate(reason, MAX_LOGGED_ERROR_BYTES));
      return FetchResult.fallback(render(fallback.get()), elapsedMillis, reason);
    }
    metrics.increment("pointer.fetch.failure");
    log.warn("Fetch failed for pointer {} ({} -> {}): {}",
        pointer.id(), pointer.pointerType().wireName(), pointer.targetId(),
        Logs.truncate(reason, MAX_LOGGED_ERROR_BYTES));
    return FetchResult.failure(reason, elapsedMillis);
  }

  static String render(FallbackContent fallback) {
    if (fallback.hasHtml()) {
      return fallback.html();
    }
    return "<h1>" + escapeHtml(fallback.title()) + "</h1><p>" + escapeHtml(fallback.description()) + "</p>";
  }

  /**
   * Escapes the five HTML-significant characters.
   *
   * @param text raw text
   * @return text safe to embed in element content or quoted attributes
   */
  public static String escapeHtml(String text) {
    StringBuilder sb = new StringBuilder(text.length() + 16);
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '<' -> sb.append("&lt;");
        case '>' -> sb.append("&gt;");
        case '&' -> sb.append("&amp;");
        case '"' -> sb.append("&quot;");
        case '\'' -> sb.append("&#39;");
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }

  private static String describe(RuntimeException ex) {
    String message = ex.getMessage();
    return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
  }
}

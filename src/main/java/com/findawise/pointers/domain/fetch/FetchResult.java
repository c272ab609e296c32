package com.findawise.pointers.domain.fetch;

import java.util.Optional;

/**
 * Outcome of {@code fetchContent}. Failures are values, never exceptions.
 *
 * @param success whether {@code content} holds usable content
 * @param content body; {@code null} on failure
 * @param contentType MIME type; {@code null} on failure
 * @param source channel label: a retriever label, {@code cache} or {@code fallback}
 * @param cached whether the content came from the cache
 * @param fetchTimeMillis time spent retrieving; zero for cache hits
 * @param error failure detail; {@code null} for clean successes
 * @since 0.1.0
 */
public record FetchResult(
    boolean success,
    String content,
    String contentType,
    String source,
    boolean cached,
    long fetchTimeMillis,
    String error) {

  public static final String SOURCE_CACHE = "cache";
  public static final String SOURCE_FALLBACK = "fallback";

  public static FetchResult fresh(RetrievedContent retrieved, long fetchTimeMillis) {
    return new FetchResult(
        true, retrieved.content(), retrieved.contentType(), retrieved.source(), false, fetchTimeMillis, null);
  }

  public static FetchResult fromCache(RetrievedContent cached) {
    return new FetchResult(true, cached.content(), cached.contentType(), SOURCE_CACHE, true, 0L, null);
  }

  public static FetchResult fallback(String html, long fetchTimeMillis, String reason) {
    return new FetchResult(
        true, html, "text/html", SOURCE_FALLBACK, false, fetchTimeMillis, "Primary fetch failed: " + reason);
  }

  public static FetchResult failure(String error, long fetchTimeMillis) {
    return new FetchResult(false, null, null, null, false, fetchTimeMillis, error);
  }

  public Optional<String> errorMessage() {
    return Optional.ofNullable(error);
  }
}

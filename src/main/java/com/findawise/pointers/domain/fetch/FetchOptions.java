package com.findawise.pointers.domain.fetch;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-call options for content retrieval.
 *
 * @param useCache consult and populate the content cache
 * @param timeout upper bound on the primary retrieval
 * @param fallback serve the pointer's fallback content when retrieval fails
 * @since 0.1.0
 */
public record FetchOptions(boolean useCache, Duration timeout, boolean fallback) {
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

  public FetchOptions {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }

  public static FetchOptions defaults() {
    return new FetchOptions(true, DEFAULT_TIMEOUT, true);
  }

  public FetchOptions withoutCache() {
    return new FetchOptions(false, timeout, fallback);
  }

  public FetchOptions withoutFallback() {
    return new FetchOptions(useCache, timeout, false);
  }

  public FetchOptions withTimeout(Duration value) {
    return new FetchOptions(useCache, value, fallback);
  }
}

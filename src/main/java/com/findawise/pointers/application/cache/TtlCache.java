package com.findawise.pointers.application.cache;

import com.findawise.pointers.application.port.ClockPort;
import com.findawise.pointers.application.port.MetricsPort;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

/**
 * <strong>What:</strong> Namespaced key/value cache with per-entry time-to-live, backed by Caffeine.
 * <p><strong>Why:</strong> Avoids repeated retrieval of pointer targets; fetch results are cached under the
 * {@code content} namespace keyed by target id.</p>
 * <p><strong>Semantics:</strong>
 * <ul>
 *   <li>Entries are stored under {@code namespace:key}.</li>
 *   <li>Each entry expires after its own ttl, measured on the engine clock; expired entries are never
 *   returned.</li>
 *   <li>A read past expiry removes the entry and reports a miss.</li>
 *   <li>At the size cap, inserting a new key first runs maintenance to reclaim expired entries; if the cache
 *   is still full, the entry closest to expiry is evicted. Caffeine's size bound stays in place as a
 *   backstop.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Reads are lock-free; insertions that may evict serialize on an internal
 * lock.</p>
 *
 * @param <V> cached value type
 * @since 0.1.0
 */
public final class TtlCache<V> {
  /** Namespace used for resolved pointer content. */
  public static final String CONTENT_NAMESPACE = "content";

  private final Cache<String, Entry<V>> cache;
  private final Object insertLock = new Object();
  private final MetricsPort metrics;
  private final int maxEntries;

  /**
   * Creates a cache.
   *
   * @param clock time source for expiry
   * @param metrics metrics sink for hit, miss, expiry and eviction counters
   * @param maxEntries capacity, positive
   */
  public TtlCache(ClockPort clock, MetricsPort metrics, int maxEntries) {
    Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    if (maxEntries <= 0) {
      throw new IllegalArgumentException("maxEntries must be positive");
    }
    this.maxEntries = maxEntries;
    this.cache = Caffeine.newBuilder()
        .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.nowMillis()))
        .expireAfter(new EntryExpiry<V>())
        .maximumSize(maxEntries)
        .executor(Runnable::run)
        .evictionListener((String key, Entry<V> entry, RemovalCause cause) -> recordRemoval(cause))
        .build();
  }

  /**
   * Stores a value, replacing any previous value under the same key.
   *
   * @param key entry key within the namespace
   * @param value value to cache; must not be {@code null}
   * @param ttl time to live, positive
   * @param namespace key namespace
   */
  public void set(String key, V value, Duration ttl, String namespace) {
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    String composite = compositeKey(namespace, key);
    Entry<V> entry = new Entry<>(value, ttl.toNanos());
    ConcurrentMap<String, Entry<V>> view = cache.asMap();
    if (view.containsKey(composite)) {
      cache.put(composite, entry);
      return;
    }
    synchronized (insertLock) {
      if (!view.containsKey(composite) && cache.estimatedSize() >= maxEntries) {
        cache.cleanUp();
        if (size() >= maxEntries) {
          evictSoonestExpiring();
        }
      }
      cache.put(composite, entry);
    }
  }

  /**
   * Reads a live value.
   *
   * @param key entry key
   * @param namespace key namespace
   * @return cached value, or empty when absent or expired
   */
  public Optional<V> get(String key, String namespace) {
    String composite = compositeKey(namespace, key);
    Entry<V> entry = cache.getIfPresent(composite);
    if (entry == null) {
      // drops an expired entry still held by the map
      cache.invalidate(composite);
      metrics.increment("cache.miss");
      return Optional.empty();
    }
    metrics.increment("cache.hit");
    return Optional.of(entry.value());
  }

  /**
   * Removes an entry.
   *
   * @return {@code true} when a live entry was present
   */
  public boolean delete(String key, String namespace) {
    return cache.asMap().remove(compositeKey(namespace, key)) != null;
  }

  public void clear() {
    cache.invalidateAll();
  }

  /**
   * Removes every entry of one namespace.
   *
   * @param namespace namespace to clear
   * @return number of removed live entries
   */
  public int clear(String namespace) {
    String prefix = requireNamespace(namespace) + ':';
    ConcurrentMap<String, Entry<V>> view = cache.asMap();
    int removed = 0;
    for (String composite : List.copyOf(view.keySet())) {
      if (composite.startsWith(prefix) && view.remove(composite) != null) {
        removed++;
      }
    }
    return removed;
  }

  /**
   * Returns the number of live entries.
   *
   * @return entry count, excluding expired entries
   */
  public int size() {
    int live = 0;
    for (String ignored : cache.asMap().keySet()) {
      live++;
    }
    return live;
  }

  /**
   * Runs pending maintenance, reclaiming expired entries.
   *
   * @return number of entries reclaimed by this call
   */
  public int sweepExpired() {
    long before = cache.estimatedSize();
    cache.cleanUp();
    int removed = (int) Math.max(0L, before - cache.estimatedSize());
    if (removed > 0) {
      metrics.observe("cache.swept", removed);
    }
    return removed;
  }

  private void evictSoonestExpiring() {
    Map<String, Entry<V>> soonest = cache.policy().expireVariably()
        .map(expiration -> expiration.oldest(1))
        .orElse(Map.of());
    for (String victim : soonest.keySet()) {
      if (cache.asMap().remove(victim) != null) {
        metrics.increment("cache.evicted");
      }
    }
  }

  private void recordRemoval(RemovalCause cause) {
    if (cause == RemovalCause.EXPIRED) {
      metrics.increment("cache.expired");
    } else if (cause == RemovalCause.SIZE) {
      metrics.increment("cache.evicted");
    }
  }

  private static String compositeKey(String namespace, String key) {
    Objects.requireNonNull(key, "key");
    return requireNamespace(namespace) + ':' + key;
  }

  private static String requireNamespace(String namespace) {
    if (namespace == null || namespace.isBlank()) {
      throw new IllegalArgumentException("namespace must not be blank");
    }
    return namespace;
  }

  private record Entry<V>(V value, long ttlNanos) {}

  /** Expiry fixed at write time; reads do not extend it. */
  private static final class EntryExpiry<V> implements Expiry<String, Entry<V>> {
    @Override
    public long expireAfterCreate(String key, Entry<V> entry, long currentTime) {
      return entry.ttlNanos();
    }

    @Override
    public long expireAfterUpdate(String key, Entry<V> entry, long currentTime, long currentDuration) {
      return entry.ttlNanos();
    }

    @Override
    public long expireAfterRead(String key, Entry<V> entry, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}

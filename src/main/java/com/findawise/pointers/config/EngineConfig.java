package com.findawise.pointers.config;

import com.findawise.pointers.application.pointer.PointerSecurityFilter;
import com.findawise.pointers.validation.Net;
import com.findawise.pointers.validation.Numbers;
import com.findawise.pointers.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> immutable engine settings bound from a flattened key/value map.
 * <p><strong>Why:</strong> keeps range checks and cross-field rules in one place so wiring code can
 * trust every value.</p>
 * <p><strong>Thread-safety:</strong> immutable; safe to share.</p>
 *
 * @param validationInterval delay between validation cycles
 * @param validationBatchSize pointers validated concurrently per batch, at least 1
 * @param validationTimeout per-validator deadline
 * @param fetchTimeout default per-fetch deadline
 * @param fetchWorkers threads in the fetch pool
 * @param cacheDefaultTtlSeconds content cache lifetime for pointers without a ttl
 * @param cacheMaxEntries content cache capacity
 * @param denyDomains domains rejected by the security filter
 * @param allowDomains trusted domains reported by analytics
 * @param patternsFile relationship pattern YAML; empty for the bundled patterns
 * @param storeType pointer store backend
 * @param storeDirectory directory for the file store
 * @param contentFileRoot sandbox root for {@code file} pointers
 * @param contentNodesFile content catalog YAML; empty for an empty catalog
 * @param auditSink audit sink backend
 * @param kafkaBootstrap Kafka bootstrap servers, required when {@code auditSink=KAFKA}
 * @param kafkaTopic audit topic
 * @since 0.1.0
 */
public record EngineConfig(
    Duration validationInterval,
    int validationBatchSize,
    Duration validationTimeout,
    Duration fetchTimeout,
    int fetchWorkers,
    int cacheDefaultTtlSeconds,
    int cacheMaxEntries,
    List<String> denyDomains,
    List<String> allowDomains,
    Optional<Path> patternsFile,
    StoreType storeType,
    Path storeDirectory,
    Path contentFileRoot,
    Optional<Path> contentNodesFile,
    AuditSinkType auditSink,
    Optional<String> kafkaBootstrap,
    String kafkaTopic) {

  public static final String DEFAULT_AUDIT_TOPIC = "pointer.audit.v1";

  public EngineConfig {
    Objects.requireNonNull(validationInterval, "validationInterval");
    Objects.requireNonNull(validationTimeout, "validationTimeout");
    Objects.requireNonNull(fetchTimeout, "fetchTimeout");
    denyDomains = List.copyOf(denyDomains);
    allowDomains = List.copyOf(allowDomains);
    patternsFile = Objects.requireNonNullElse(patternsFile, Optional.empty());
    Objects.requireNonNull(storeType, "storeType");
    Objects.requireNonNull(storeDirectory, "storeDirectory");
    Objects.requireNonNull(contentFileRoot, "contentFileRoot");
    contentNodesFile = Objects.requireNonNullElse(contentNodesFile, Optional.empty());
    Objects.requireNonNull(auditSink, "auditSink");
    kafkaBootstrap = Objects.requireNonNullElse(kafkaBootstrap, Optional.empty());
    kafkaTopic = Strings.sanitizeTopic("audit.kafkaTopic", kafkaTopic);
    if (auditSink == AuditSinkType.KAFKA && kafkaBootstrap.isEmpty()) {
      throw new IllegalArgumentException("audit.kafkaBootstrap is required when audit.sink=kafka");
    }
  }

  /** Settings used when no configuration is supplied. */
  public static EngineConfig defaults() {
    return fromMap(Map.of());
  }

  /**
   * Binds a flattened configuration map.
   *
   * @param values merged configuration; missing keys take their defaults
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static EngineConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    return new EngineConfig(
        Duration.ofSeconds(intValue(values, "validation.intervalSeconds", 300, 1, 86_400)),
        intValue(values, "validation.batchSize", 10, 1, 1_000),
        Duration.ofMillis(intValue(values, "validation.timeoutMillis", 10_000, 1, 600_000)),
        Duration.ofMillis(intValue(values, "fetch.timeoutMillis", 5_000, 1, 600_000)),
        intValue(values, "fetch.workers", 4, 1, 256),
        intValue(values, "cache.defaultTtlSeconds", 3_600, 1, 31_536_000),
        intValue(values, "cache.maxEntries", 10_000, 1, 10_000_000),
        domains(values, "security.denyDomains", PointerSecurityFilter.DEFAULT_DENY),
        domains(values, "security.allowDomains", PointerSecurityFilter.DEFAULT_ALLOW),
        optional(values, "relationship.patternsFile").map(raw -> path("relationship.patternsFile", raw)),
        StoreType.fromString(values.get("store.type")),
        path("store.directory", optional(values, "store.directory").orElse("./pointer-store")),
        path("content.fileRoot", optional(values, "content.fileRoot").orElse("./content")),
        optional(values, "content.nodesFile").map(raw -> path("content.nodesFile", raw)),
        AuditSinkType.fromString(values.get("audit.sink")),
        optional(values, "audit.kafkaBootstrap").map(raw -> Net.validateBootstrapServers("audit.kafkaBootstrap", raw)),
        optional(values, "audit.kafkaTopic").orElse(DEFAULT_AUDIT_TOPIC));
  }

  private static int intValue(Map<String, String> values, String key, int defaultValue, int min, int max) {
    Optional<String> raw = optional(values, key);
    if (raw.isEmpty()) {
      return defaultValue;
    }
    long parsed;
    try {
      parsed = Long.parseLong(raw.get());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw.get() + ")", ex);
    }
    return (int) Numbers.requireRange(key, parsed, min, max);
  }

  private static List<String> domains(Map<String, String> values, String key, List<String> defaults) {
    return values.containsKey(key) ? Strings.splitCsv(values.get(key)) : defaults;
  }

  private static Optional<String> optional(Map<String, String> values, String key) {
    String raw = values.get(key);
    return raw == null || raw.isBlank() ? Optional.empty() : Optional.of(raw.trim());
  }

  private static Path path(String key, String raw) {
    try {
      return Path.of(Strings.requireNonBlank(key, raw));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }

  /** Pointer store backend. */
  public enum StoreType {
    MEMORY,
    FILE;

    static StoreType fromString(String raw) {
      if (raw == null || raw.isBlank()) {
        return MEMORY;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "memory" -> MEMORY;
        case "file" -> FILE;
        default -> throw new IllegalArgumentException("store.type must be memory or file (was " + raw + ")");
      };
    }
  }

  /** Audit sink backend. */
  public enum AuditSinkType {
    LOG,
    KAFKA;

    static AuditSinkType fromString(String raw) {
      if (raw == null || raw.isBlank()) {
        return LOG;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "log" -> LOG;
        case "kafka" -> KAFKA;
        default -> throw new IllegalArgumentException("audit.sink must be log or kafka (was " + raw + ")");
      };
    }
  }
}

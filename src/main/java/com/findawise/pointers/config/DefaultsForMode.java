package com.findawise.pointers.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Embedded defaults for each command, flattened the same way {@link YamlConfigLoader} flattens YAML.
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON = common();

  private DefaultsForMode() {}

  /**
   * Returns defaults for {@code mode}.
   *
   * @param mode {@code validate}, {@code report} or {@code worker}
   * @return immutable defaults
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON);
    switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "validate", "report" -> defaults.put("metricsExporter", "none");
      case "worker" -> defaults.put("metricsExporter", "otlp");
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    return Map.copyOf(defaults);
  }

  private static Map<String, String> common() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("validation.intervalSeconds", "300");
    map.put("validation.batchSize", "10");
    map.put("validation.timeoutMillis", "10000");
    map.put("fetch.timeoutMillis", "5000");
    map.put("fetch.workers", "4");
    map.put("cache.defaultTtlSeconds", "3600");
    map.put("cache.maxEntries", "10000");
    map.put("store.type", "file");
    map.put("store.directory", "./pointer-store");
    map.put("content.fileRoot", "./content");
    map.put("audit.sink", "log");
    map.put("audit.kafkaTopic", EngineConfig.DEFAULT_AUDIT_TOPIC);
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    return Map.copyOf(map);
  }
}

package com.findawise.pointers.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration map.
   *
   * @param mode active command
   * @param yaml optional YAML settings for the command
   * @param cli CLI {@code key=value} overrides
   * @param defaults embedded defaults for the command
   * @param warn receives a message for every CLI key that overrides a YAML key; may be {@code null}
   * @return immutable merged map
   * @throws IllegalArgumentException when cross-key rules fail
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlValues = yaml.orElse(Map.of());
    Map<String, String> cliValues = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlValues);
    for (Map.Entry<String, String> entry : cliValues.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) {
        continue;
      }
      if (yamlValues.containsKey(entry.getKey()) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + entry.getKey());
      }
      merged.put(entry.getKey(), entry.getValue());
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    String sink = trim(effective.get("audit.sink"));
    if (sink.equalsIgnoreCase("kafka") && trim(effective.get("audit.kafkaBootstrap")).isEmpty()) {
      throw new IllegalArgumentException("audit.kafkaBootstrap is required when audit.sink=kafka");
    }
    String storeType = trim(effective.get("store.type"));
    if (storeType.equalsIgnoreCase("file") && trim(effective.get("store.directory")).isEmpty()) {
      throw new IllegalArgumentException("store.directory is required when store.type=file");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}

package com.findawise.pointers.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void commandSectionLayersOverCommon() throws Exception {
    Path file = tempDir.resolve("pointer-engine.yaml");
    Files.writeString(file, String.join("\n",
        "common:",
        "  validation:",
        "    batchSize: 5",
        "    intervalSeconds: 60",
        "  store:",
        "    type: memory",
        "worker:",
        "  validation:",
        "    intervalSeconds: 30",
        "  metricsExporter: none",
        "report:",
        "  format: json",
        ""));

    Map<String, String> worker = YamlConfigLoader.load(file, "worker").orElseThrow();

    assertEquals("5", worker.get("validation.batchSize"));
    assertEquals("30", worker.get("validation.intervalSeconds"));
    assertEquals("memory", worker.get("store.type"));
    assertEquals("none", worker.get("metricsExporter"));
    assertFalse(worker.containsKey("format"));
    assertEquals("json", YamlConfigLoader.load(file, "REPORT").orElseThrow().get("format"));
  }

  @Test
  void missingFileIsEmpty() throws Exception {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "validate");

    assertTrue(result.isEmpty());
  }

  @Test
  void nullValuesBecomeEmptyStrings() {
    Map<String, String> values = YamlConfigLoader.parse(
        new StringReader("common:\n  relationship:\n    patternsFile:\n"), "validate", "inline");

    assertEquals("", values.get("relationship.patternsFile"));
  }

  @Test
  void listsAndMalformedDocumentsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.parse(
        new StringReader("common:\n  security:\n    denyDomains: [a.com, b.com]\n"), "validate", "inline"));
    assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.parse(new StringReader("common: 5\n"), "validate", "inline"));
    assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.parse(new StringReader("common: {broken\n"), "validate", "inline"));
  }
}

package com.findawise.pointers.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {
  @Test
  void oneShotCommandsDisableMetricsExport() {
    assertEquals("none", DefaultsForMode.asFlatMap("validate").get("metricsExporter"));
    assertEquals("none", DefaultsForMode.asFlatMap("report").get("metricsExporter"));
  }

  @Test
  void workerExportsMetricsAndSharesCommonDefaults() {
    Map<String, String> worker = DefaultsForMode.asFlatMap(" Worker ");

    assertEquals("otlp", worker.get("metricsExporter"));
    assertEquals("300", worker.get("validation.intervalSeconds"));
    assertEquals("10", worker.get("validation.batchSize"));
    assertEquals("pointer.audit.v1", worker.get("audit.kafkaTopic"));
  }

  @Test
  void defaultsBindToValidConfig() {
    EngineConfig config = EngineConfig.fromMap(DefaultsForMode.asFlatMap("validate"));

    assertEquals(EngineConfig.StoreType.FILE, config.storeType());
    assertEquals(3_600, config.cacheDefaultTtlSeconds());
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("export"));
  }
}

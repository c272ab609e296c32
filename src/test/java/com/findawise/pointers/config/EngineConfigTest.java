package com.findawise.pointers.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.findawise.pointers.application.pointer.PointerSecurityFilter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EngineConfigTest {
  @Test
  void emptyMapUsesDefaults() {
    EngineConfig config = EngineConfig.defaults();

    assertEquals(Duration.ofSeconds(300), config.validationInterval());
    assertEquals(10, config.validationBatchSize());
    assertEquals(Duration.ofSeconds(10), config.validationTimeout());
    assertEquals(Duration.ofSeconds(5), config.fetchTimeout());
    assertEquals(4, config.fetchWorkers());
    assertEquals(PointerSecurityFilter.DEFAULT_DENY, config.denyDomains());
    assertEquals(PointerSecurityFilter.DEFAULT_ALLOW, config.allowDomains());
    assertEquals(EngineConfig.StoreType.MEMORY, config.storeType());
    assertEquals(EngineConfig.AuditSinkType.LOG, config.auditSink());
    assertTrue(config.patternsFile().isEmpty());
    assertTrue(config.contentNodesFile().isEmpty());
    assertEquals(EngineConfig.DEFAULT_AUDIT_TOPIC, config.kafkaTopic());
  }

  @Test
  void bindsExplicitValues() {
    EngineConfig config = EngineConfig.fromMap(Map.of(
        "validation.intervalSeconds", "60",
        "validation.batchSize", "25",
        "security.denyDomains", "bad.example, worse.example",
        "security.allowDomains", "",
        "relationship.patternsFile", "patterns.yaml",
        "store.type", "FILE",
        "store.directory", "/var/pointers",
        "audit.sink", "kafka",
        "audit.kafkaBootstrap", "Broker-1:9092, broker-2:9093",
        "audit.kafkaTopic", "content.audit"));

    assertEquals(Duration.ofMinutes(1), config.validationInterval());
    assertEquals(25, config.validationBatchSize());
    assertEquals(List.of("bad.example", "worse.example"), config.denyDomains());
    assertEquals(List.of(), config.allowDomains());
    assertEquals(Path.of("patterns.yaml"), config.patternsFile().orElseThrow());
    assertEquals(EngineConfig.StoreType.FILE, config.storeType());
    assertEquals(Path.of("/var/pointers"), config.storeDirectory());
    assertEquals(EngineConfig.AuditSinkType.KAFKA, config.auditSink());
    assertEquals("broker-1:9092,broker-2:9093", config.kafkaBootstrap().orElseThrow());
    assertEquals("content.audit", config.kafkaTopic());
  }

  @Test
  void outOfRangeOrMalformedValuesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> EngineConfig.fromMap(Map.of("validation.batchSize", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> EngineConfig.fromMap(Map.of("fetch.timeoutMillis", "soon")));
    assertThrows(IllegalArgumentException.class,
        () -> EngineConfig.fromMap(Map.of("store.type", "redis")));
    assertThrows(IllegalArgumentException.class,
        () -> EngineConfig.fromMap(Map.of("audit.sink", "kafka")));
    assertThrows(IllegalArgumentException.class,
        () -> EngineConfig.fromMap(Map.of("audit.kafkaBootstrap", "broker-without-port")));
    assertThrows(IllegalArgumentException.class,
        () -> EngineConfig.fromMap(Map.of("audit.kafkaTopic", "bad topic")));
  }
}

package com.findawise.pointers.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.findawise.pointers.domain.audit.AuditEvent;
import com.findawise.pointers.domain.audit.AuditSeverity;
import com.findawise.pointers.testing.RecordingMetricsPort;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

class KafkaAuditSinkAdapterTest {
  private static final Instant AT = Instant.parse("2024-03-01T12:00:00Z");

  @Test
  void publishSendsRecordKeyedByPointerId() {
    MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    KafkaAuditSinkAdapter sink = new KafkaAuditSinkAdapter(producer, "pointer-audit", metrics);

    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put("targetId", "lesson-2");
    attributes.put("type", "content_store");
    sink.publish(new AuditEvent(
        AuditEvent.COMPONENT, "create_pointer", "p-1", AuditSeverity.INFO, attributes, AT));

    List<ProducerRecord<String, String>> history = producer.history();
    assertEquals(1, history.size());
    ProducerRecord<String, String> record = history.get(0);
    assertEquals("pointer-audit", record.topic());
    assertEquals("p-1", record.key());
    assertEquals(
        "{\"schemaVersion\":1,\"component\":\"ContentPointerRegistry\",\"action\":\"create_pointer\","
            + "\"severity\":\"info\",\"pointerId\":\"p-1\",\"timestamp\":\"2024-03-01T12:00:00Z\","
            + "\"metadata\":{\"targetId\":\"lesson-2\",\"type\":\"content_store\"}}",
        record.value());
    assertEquals(1L, metrics.counter("audit.kafka.sent"));
    assertEquals(0L, metrics.counter("audit.kafka.error"));
  }

  @Test
  void rejectedCreationOmitsPointerId() {
    MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
    KafkaAuditSinkAdapter sink = new KafkaAuditSinkAdapter(producer, "pointer-audit", null);

    sink.publish(new AuditEvent(
        AuditEvent.COMPONENT, "create_pointer_rejected", null, AuditSeverity.WARN,
        Map.of("reason", "blocked domain"), AT));

    ProducerRecord<String, String> record = producer.history().get(0);
    assertNull(record.key());
    assertTrue(record.value().contains("\"severity\":\"warn\""));
    assertFalse(record.value().contains("pointerId"));
  }

  @Test
  void sendFailureIncrementsErrorCounter() {
    MockProducer<String, String> producer = new MockProducer<>(false, new StringSerializer(), new StringSerializer());
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    KafkaAuditSinkAdapter sink = new KafkaAuditSinkAdapter(producer, "pointer-audit", metrics);

    sink.publish(new AuditEvent(
        AuditEvent.COMPONENT, "delete_pointer", "p-9", AuditSeverity.INFO, Map.of(), AT));
    producer.errorNext(new RuntimeException("broker down"));

    assertEquals(1L, metrics.counter("audit.kafka.sent"));
    assertEquals(1L, metrics.counter("audit.kafka.error"));
  }

  @Test
  void closeFlushesAndClosesProducer() {
    MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
    KafkaAuditSinkAdapter sink = new KafkaAuditSinkAdapter(producer, "pointer-audit", null);

    sink.close();

    assertTrue(producer.closed());
  }

  @Test
  void constructorRejectsMalformedTopic() {
    MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());

    assertThrows(IllegalArgumentException.class,
        () -> new KafkaAuditSinkAdapter(producer, "bad topic!", null));
  }
}

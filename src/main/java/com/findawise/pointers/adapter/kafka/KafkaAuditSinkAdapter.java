package com.findawise.pointers.adapter.kafka;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.findawise.pointers.application.port.AuditSinkPort;
import com.findawise.pointers.application.port.MetricsPort;
import com.findawise.pointers.domain.audit.AuditEvent;
import com.findawise.pointers.validation.Strings;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes audit events to a Kafka topic as JSON documents keyed by pointer id.
 * <p>Thread-safe when the supplied producer is (the default {@link KafkaProducer} is). Sends are
 * asynchronous; failures surface through the producer callback as a log line and the
 * {@code audit.kafka.error} counter.
 *
 * @implNote {@link #close()} flushes and waits up to five seconds for in-flight records.
 */
public final class KafkaAuditSinkAdapter implements AuditSinkPort {
  private static final Logger log = LoggerFactory.getLogger(KafkaAuditSinkAdapter.class);
  static final int SCHEMA_VERSION = 1;

  private final Producer<String, String> producer;
  private final String topic;
  private final MetricsPort metrics;
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Creates an adapter backed by a new {@link KafkaProducer}.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers
   * @param topic destination topic
   * @param metrics metrics sink; {@code null} disables metrics
   * @throws IllegalArgumentException if either argument is blank or the topic is malformed
   */
  public KafkaAuditSinkAdapter(String bootstrapServers, String topic, MetricsPort metrics) {
    this(createProducer(bootstrapServers), topic, metrics);
  }

  KafkaAuditSinkAdapter(Producer<String, String> producer, String topic, MetricsPort metrics) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.sanitizeTopic("audit.kafkaTopic", topic);
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public void publish(AuditEvent event) {
    Objects.requireNonNull(event, "event");
    String payload = serialize(event);
    producer.send(new ProducerRecord<>(topic, event.pointerId(), payload), (metadata, ex) -> {
      if (ex != null) {
        metrics.increment("audit.kafka.error");
        log.error("Kafka audit publish failed for {} on topic {}", event.action(), topic, ex);
      }
    });
    metrics.increment("audit.kafka.sent");
  }

  @Override
  public void close() {
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }

  String serialize(AuditEvent event) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
      gen.writeStringField("component", event.component());
      gen.writeStringField("action", event.action());
      gen.writeStringField("severity", event.severity().wireName());
      if (event.pointerId() != null) {
        gen.writeStringField("pointerId", event.pointerId());
      }
      gen.writeStringField("timestamp", event.timestamp().toString());
      gen.writeObjectFieldStart("metadata");
      for (Map.Entry<String, String> entry : event.attributes().entrySet()) {
        gen.writeStringField(entry.getKey(), entry.getValue());
      }
      gen.writeEndObject();
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to serialize audit event " + event.action(), ex);
    }
    return out.toString(StandardCharsets.UTF_8);
  }

  private static Producer<String, String> createProducer(String bootstrapServers) {
    String servers = Strings.requireNonBlank("audit.kafkaBootstrap", bootstrapServers);
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, servers);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}

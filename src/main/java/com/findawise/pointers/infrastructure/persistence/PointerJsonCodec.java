package com.findawise.pointers.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.pointer.FallbackContent;
import com.findawise.pointers.domain.pointer.PointerAnalytics;
import com.findawise.pointers.domain.pointer.PointerMetadata;
import com.findawise.pointers.domain.pointer.PointerType;
import com.findawise.pointers.domain.pointer.RelationshipType;
import com.findawise.pointers.domain.pointer.ValidationStatus;
import com.findawise.pointers.domain.validation.ValidationOutcome;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Streaming JSON codec for {@link ContentPointer} documents.
 *
 * <p>Enum values use their wire names; timestamps are ISO-8601 strings. Unknown fields are ignored on
 * read so documents written by newer versions still load.
 */
final class PointerJsonCodec {
  static final int SCHEMA_VERSION = 1;

  private final JsonFactory factory = new JsonFactory();

  byte[] encode(ContentPointer pointer) throws IOException {
    Objects.requireNonNull(pointer, "pointer");
    ByteArrayOutputStream out = new ByteArrayOutputStream(1024);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
      gen.writeStringField("id", pointer.id());
      gen.writeStringField("sourceId", pointer.sourceId());
      gen.writeStringField("targetId", pointer.targetId());
      gen.writeStringField("pointerType", pointer.pointerType().wireName());
      gen.writeStringField("relationshipType", pointer.relationshipType().wireName());
      gen.writeStringField("validationStatus", pointer.validationStatus().wireName());
      if (pointer.lastValidationOutcome() != null) {
        gen.writeStringField("lastValidationOutcome", pointer.lastValidationOutcome().wireName());
      }
      gen.writeNumberField("confidenceScore", pointer.confidenceScore());
      gen.writeNumberField("priority", pointer.priority());
      if (pointer.ttlSeconds() != null) {
        gen.writeNumberField("ttlSeconds", pointer.ttlSeconds());
      }
      gen.writeNumberField("accessCount", pointer.accessCount());
      gen.writeNumberField("targetRevision", pointer.targetRevision());
      writeInstant(gen, "createdAt", pointer.createdAt());
      writeInstant(gen, "updatedAt", pointer.updatedAt());
      writeInstant(gen, "lastValidated", pointer.lastValidated());
      writeInstant(gen, "lastAccessed", pointer.lastAccessed());
      writeMetadata(gen, pointer.metadata());
      if (pointer.fallbackContent() != null) {
        writeFallback(gen, pointer.fallbackContent());
      }
      writeAnalytics(gen, pointer.analytics());
      gen.writeEndObject();
    }
    return out.toByteArray();
  }

  ContentPointer decode(byte[] json) throws IOException {
    Map<String, Object> root = readObject(json);
    return ContentPointer.builder()
        .id(requireString(root, "id"))
        .sourceId(requireString(root, "sourceId"))
        .targetId(requireString(root, "targetId"))
        .pointerType(PointerType.fromWire(requireString(root, "pointerType")))
        .relationshipType(RelationshipType.fromWire(requireString(root, "relationshipType")))
        .validationStatus(ValidationStatus.fromWire(requireString(root, "validationStatus")))
        .lastValidationOutcome(optionalString(root, "lastValidationOutcome") == null
            ? null
            : ValidationOutcome.fromWire(optionalString(root, "lastValidationOutcome")))
        .confidenceScore(number(root, "confidenceScore", 0.5))
        .priority((int) number(root, "priority", 1))
        .ttlSeconds(root.get("ttlSeconds") instanceof Number ttl ? ttl.intValue() : null)
        .accessCount((long) number(root, "accessCount", 0))
        .targetRevision((long) number(root, "targetRevision", 0))
        .createdAt(instant(root, "createdAt"))
        .updatedAt(instant(root, "updatedAt"))
        .lastValidated(instant(root, "lastValidated"))
        .lastAccessed(instant(root, "lastAccessed"))
        .metadata(readMetadata(root.get("metadata")))
        .fallbackContent(readFallback(root.get("fallbackContent")))
        .analytics(readAnalytics(root.get("analytics")))
        .build();
  }

  private static void writeInstant(JsonGenerator gen, String field, Instant value) throws IOException {
    if (value != null) {
      gen.writeStringField(field, value.toString());
    }
  }

  private static void writeMetadata(JsonGenerator gen, PointerMetadata metadata) throws IOException {
    gen.writeObjectFieldStart("metadata");
    gen.writeStringField("context", metadata.context());
    gen.writeArrayFieldStart("tags");
    for (String tag : metadata.tags()) {
      gen.writeString(tag);
    }
    gen.writeEndArray();
    writeOptional(gen, "domain", metadata.domain());
    writeOptional(gen, "contentType", metadata.contentType());
    writeOptional(gen, "language", metadata.language());
    if (metadata.quality() != null) {
      gen.writeNumberField("quality", metadata.quality());
    }
    gen.writeNumberField("userBehaviorFactor", metadata.userBehaviorFactor());
    gen.writeNumberField("aiRelevanceScore", metadata.aiRelevanceScore());
    writeOptional(gen, "cacheKey", metadata.cacheKey());
    gen.writeEndObject();
  }

  private static void writeFallback(JsonGenerator gen, FallbackContent fallback) throws IOException {
    gen.writeObjectFieldStart("fallbackContent");
    gen.writeStringField("title", fallback.title());
    gen.writeStringField("description", fallback.description());
    writeOptional(gen, "html", fallback.html());
    gen.writeEndObject();
  }

  private static void writeAnalytics(JsonGenerator gen, PointerAnalytics analytics) throws IOException {
    gen.writeObjectFieldStart("analytics");
    gen.writeNumberField("clicks", analytics.clicks());
    gen.writeNumberField("conversions", analytics.conversions());
    gen.writeNumberField("bounceRate", analytics.bounceRate());
    gen.writeNumberField("avgTimeOnContentSeconds", analytics.avgTimeOnContentSeconds());
    gen.writeEndObject();
  }

  private static void writeOptional(JsonGenerator gen, String field, String value) throws IOException {
    if (value != null) {
      gen.writeStringField(field, value);
    }
  }

  private static PointerMetadata readMetadata(Object node) {
    if (!(node instanceof Map<?, ?> map)) {
      return PointerMetadata.defaults();
    }
    List<String> tags = new ArrayList<>();
    if (map.get("tags") instanceof List<?> list) {
      for (Object tag : list) {
        if (tag != null) {
          tags.add(tag.toString());
        }
      }
    }
    return new PointerMetadata(
        optionalString(map, "context"),
        tags,
        optionalString(map, "domain"),
        optionalString(map, "contentType"),
        optionalString(map, "language"),
        map.get("quality") instanceof Number quality ? quality.doubleValue() : null,
        number(map, "userBehaviorFactor", PointerMetadata.NEUTRAL_SCORE),
        number(map, "aiRelevanceScore", PointerMetadata.NEUTRAL_SCORE),
        optionalString(map, "cacheKey"));
  }

  private static FallbackContent readFallback(Object node) {
    if (!(node instanceof Map<?, ?> map)) {
      return null;
    }
    return new FallbackContent(
        optionalString(map, "title"), optionalString(map, "description"), optionalString(map, "html"));
  }

  private static PointerAnalytics readAnalytics(Object node) {
    if (!(node instanceof Map<?, ?> map)) {
      return PointerAnalytics.EMPTY;
    }
    return new PointerAnalytics(
        (long) number(map, "clicks", 0),
        (long) number(map, "conversions", 0),
        number(map, "bounceRate", 0.0),
        number(map, "avgTimeOnContentSeconds", 0.0));
  }

  private static String requireString(Map<?, ?> map, String field) throws IOException {
    String value = optionalString(map, field);
    if (value == null || value.isBlank()) {
      throw new IOException("Pointer document is missing '" + field + "'");
    }
    return value;
  }

  private static String optionalString(Map<?, ?> map, String field) {
    Object value = map.get(field);
    return value == null ? null : value.toString();
  }

  private static double number(Map<?, ?> map, String field, double defaultValue) {
    return map.get(field) instanceof Number value ? value.doubleValue() : defaultValue;
  }

  private static Instant instant(Map<?, ?> map, String field) throws IOException {
    String raw = optionalString(map, field);
    if (raw == null) {
      return null;
    }
    try {
      return Instant.parse(raw);
    } catch (RuntimeException ex) {
      throw new IOException("Invalid timestamp in '" + field + "': " + raw, ex);
    }
  }

  private Map<String, Object> readObject(byte[] json) throws IOException {
    try (JsonParser parser = factory.createParser(json)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IOException("Pointer document must be a JSON object");
      }
      return readFields(parser);
    }
  }

  private Map<String, Object> readFields(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      if (token != JsonToken.FIELD_NAME) {
        throw new IOException("Expected field name but found " + token);
      }
      String name = parser.getCurrentName();
      map.put(name, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new IOException("Unexpected end of pointer document");
    }
    return switch (token) {
      case START_OBJECT -> readFields(parser);
      case START_ARRAY -> {
        List<Object> list = new ArrayList<>();
        JsonToken next;
        while ((next = parser.nextToken()) != JsonToken.END_ARRAY) {
          list.add(readValue(parser, next));
        }
        yield list;
      }
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IOException("Unsupported JSON token: " + token);
    };
  }
}

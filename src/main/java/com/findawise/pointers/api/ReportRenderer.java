package com.findawise.pointers.api;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.findawise.pointers.domain.analytics.DuplicateGroup;
import com.findawise.pointers.domain.analytics.PointerAnalyticsReport;
import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.pointer.ValidationStatus;
import com.findawise.pointers.domain.validation.ValidationCycleReport;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders command results as plain text lines or a single JSON document.
 */
final class ReportRenderer {
  private static final JsonFactory JSON = new JsonFactory();

  private ReportRenderer() {}

  static List<String> cycleLines(ValidationCycleReport report, List<ContentPointer> broken) {
    List<String> lines = new ArrayList<>();
    lines.add(String.format(Locale.ROOT,
        "Validation cycle: attempted=%d batches=%d applied=%d errors=%d staleDiscards=%d durationMillis=%d",
        report.attempted(), report.batches(), report.applied(), report.errors(),
        report.staleDiscards(), report.durationMillis()));
    for (ValidationStatus status : ValidationStatus.values()) {
      int count = report.count(status);
      if (count > 0) {
        lines.add("  " + status.wireName() + "=" + count);
      }
    }
    lines.addAll(brokenLines(broken));
    return lines;
  }

  static List<String> analyticsLines(
      PointerAnalyticsReport report, List<ContentPointer> broken, List<DuplicateGroup> duplicates) {
    List<String> lines = new ArrayList<>();
    lines.add("Pointers: " + report.totalPointers());
    for (ValidationStatus status : ValidationStatus.values()) {
      lines.add("  " + status.wireName() + "=" + report.statusCounts().get(status));
    }
    lines.add(String.format(Locale.ROOT, "Average confidence: %.3f", report.averageConfidence()));
    lines.add("Trusted domain pointers: " + report.trustedDomainPointers());
    lines.add("Pending validations: " + report.pendingValidations());
    if (!report.topDomains().isEmpty()) {
      lines.add("Top domains:");
      report.topDomains().forEach(d -> lines.add("  " + d.domain() + " " + d.count()));
    }
    if (!report.relationshipDistribution().isEmpty()) {
      lines.add("Relationships:");
      report.relationshipDistribution()
          .forEach(r -> lines.add("  " + r.relationshipType().wireName() + " " + r.count()));
    }
    lines.addAll(brokenLines(broken));
    if (!duplicates.isEmpty()) {
      lines.add("Duplicate targets: " + duplicates.size());
      for (DuplicateGroup group : duplicates) {
        lines.add("  " + group.targetId() + " x" + group.size());
      }
    }
    return lines;
  }

  private static List<String> brokenLines(List<ContentPointer> broken) {
    if (broken.isEmpty()) {
      return List.of();
    }
    List<String> lines = new ArrayList<>();
    lines.add("Broken pointers: " + broken.size());
    for (ContentPointer pointer : broken) {
      lines.add("  " + pointer.id() + " " + pointer.sourceId() + " -> " + pointer.targetId()
          + " (" + pointer.pointerType().wireName()
          + (pointer.lastValidationOutcome() == null
              ? "" : ", " + pointer.lastValidationOutcome().name().toLowerCase(Locale.ROOT))
          + ")");
    }
    return lines;
  }

  static String cycleJson(ValidationCycleReport report, List<ContentPointer> broken) {
    return render(gen -> {
      gen.writeStartObject();
      gen.writeNumberField("attempted", report.attempted());
      gen.writeNumberField("batches", report.batches());
      gen.writeNumberField("applied", report.applied());
      gen.writeNumberField("errors", report.errors());
      gen.writeNumberField("staleDiscards", report.staleDiscards());
      gen.writeNumberField("durationMillis", report.durationMillis());
      gen.writeObjectFieldStart("statusCounts");
      for (ValidationStatus status : ValidationStatus.values()) {
        gen.writeNumberField(status.wireName(), report.count(status));
      }
      gen.writeEndObject();
      writeBroken(gen, broken);
      gen.writeEndObject();
    });
  }

  static String analyticsJson(
      PointerAnalyticsReport report, List<ContentPointer> broken, List<DuplicateGroup> duplicates) {
    return render(gen -> {
      gen.writeStartObject();
      gen.writeNumberField("totalPointers", report.totalPointers());
      gen.writeObjectFieldStart("statusCounts");
      for (ValidationStatus status : ValidationStatus.values()) {
        gen.writeNumberField(status.wireName(), report.statusCounts().get(status));
      }
      gen.writeEndObject();
      gen.writeNumberField("averageConfidence", report.averageConfidence());
      gen.writeNumberField("trustedDomainPointers", report.trustedDomainPointers());
      gen.writeNumberField("pendingValidations", report.pendingValidations());
      gen.writeArrayFieldStart("topDomains");
      for (PointerAnalyticsReport.DomainCount domain : report.topDomains()) {
        gen.writeStartObject();
        gen.writeStringField("domain", domain.domain());
        gen.writeNumberField("count", domain.count());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("relationshipDistribution");
      for (PointerAnalyticsReport.RelationshipCount relationship : report.relationshipDistribution()) {
        gen.writeStartObject();
        gen.writeStringField("relationshipType", relationship.relationshipType().wireName());
        gen.writeNumberField("count", relationship.count());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      writeBroken(gen, broken);
      gen.writeArrayFieldStart("duplicates");
      for (DuplicateGroup group : duplicates) {
        gen.writeStartObject();
        gen.writeStringField("targetId", group.targetId());
        gen.writeArrayFieldStart("pointerIds");
        for (ContentPointer pointer : group.pointers()) {
          gen.writeString(pointer.id());
        }
        gen.writeEndArray();
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    });
  }

  private static void writeBroken(JsonGenerator gen, List<ContentPointer> broken) throws IOException {
    gen.writeArrayFieldStart("broken");
    for (ContentPointer pointer : broken) {
      gen.writeStartObject();
      gen.writeStringField("id", pointer.id());
      gen.writeStringField("sourceId", pointer.sourceId());
      gen.writeStringField("targetId", pointer.targetId());
      gen.writeStringField("pointerType", pointer.pointerType().wireName());
      if (pointer.lastValidationOutcome() != null) {
        gen.writeStringField("outcome", pointer.lastValidationOutcome().name().toLowerCase(Locale.ROOT));
      }
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static String render(JsonBody body) {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = JSON.createGenerator(out)) {
      body.write(gen);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render JSON report", ex);
    }
    return out.toString();
  }

  @FunctionalInterface
  private interface JsonBody {
    void write(JsonGenerator gen) throws IOException;
  }
}

package com.findawise.pointers.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {
  private String previousExporter;

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    assertTrue(result.isNoop());
    result.forceFlush();
    result.close();
  }

  @Test
  void settingsPreferSystemPropertiesOverEnvironment() {
    Properties props = new Properties();
    props.setProperty("otel.exporter.otlp.endpoint", "http://collector:4317");
    Map<String, String> env = Map.of(
        "OTEL_EXPORTER_OTLP_ENDPOINT", "http://ignored:4317",
        "OTEL_METRICS_EXPORTER", "none",
        "OTEL_RESOURCE_ATTRIBUTES", "deployment.environment=test");

    OpenTelemetryBootstrap.Settings settings = OpenTelemetryBootstrap.Settings.resolve(props, env::get);

    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, settings.exporter());
    assertEquals("http://collector:4317", settings.endpoint());
    assertEquals("test", settings.resourceAttributes().get(AttributeKey.stringKey("deployment.environment")));
  }

  @Test
  void unknownExporterDefaultsToOtlp() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from("prometheus"));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from(null));
  }

  @Test
  void malformedResourceAttributesAreSkipped() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("team=content, =x,broken, region = ca ");

    assertEquals(2, attributes.size());
    assertEquals("content", attributes.get(AttributeKey.stringKey("team")));
    assertEquals("ca", attributes.get(AttributeKey.stringKey("region")));
  }
}

package com.findawise.pointers.api;

import com.findawise.pointers.application.port.MetricsPort;
import com.findawise.pointers.infrastructure.metrics.NoOpMetricsAdapter;
import com.findawise.pointers.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import com.findawise.pointers.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}
 * settings into OpenTelemetry system properties and builds the matching metrics adapter.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Applies telemetry settings and returns the metrics adapter to use.
   *
   * @param settings effective configuration
   * @return no-op adapter for {@code none}, otherwise an OpenTelemetry adapter
   * @throws IllegalArgumentException when a telemetry setting is malformed
   */
  static MetricsPort configureMetrics(Map<String, String> settings) {
    String exporter = settings.getOrDefault("metricsExporter", "otlp").trim().toLowerCase(Locale.ROOT);
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    if (exporter.equals("none")) {
      log.debug("Metrics export disabled");
      return new NoOpMetricsAdapter();
    }
    String endpoint = settings.getOrDefault("otelEndpoint", "").trim();
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
    }
    String attributes = settings.getOrDefault("otelResourceAttributes", "").trim();
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }

    System.setProperty("otel.metrics.exporter", exporter);
    if (!endpoint.isEmpty()) {
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }
    if (!attributes.isEmpty()) {
      System.setProperty("otel.resource.attributes", attributes);
    }
    return new OpenTelemetryMetricsAdapter();
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}

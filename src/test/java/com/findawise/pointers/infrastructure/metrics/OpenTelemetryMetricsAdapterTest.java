package com.findawise.pointers.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("pointer.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterUnderLowercasedName() {
    adapter.increment("pointer.fetch.cacheHit");
    adapter.increment("pointer.fetch.cacheHit");
    adapter.forceFlush();

    MetricData counter = find("pointer.fetch.cachehit").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("pointer.fetch.cacheHit", point.getAttributes().get(METRIC_KEY));

    AttributeKey<String> serviceName = AttributeKey.stringKey("service.name");
    assertEquals("content-pointer-engine", counter.getResource().getAttribute(serviceName));
    AttributeKey<String> namespace = AttributeKey.stringKey("service.namespace");
    assertEquals("com.findawise", counter.getResource().getAttribute(namespace));
  }

  @Test
  void observeRecordsHistogramWithNanosecondUnit() {
    adapter.observe("pointer.validation.latencyNanos", 1_000L);
    adapter.observe("pointer.validation.latencyNanos", 4_000L);
    adapter.forceFlush();

    MetricData histogram = find("pointer.validation.latencynanos").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ns", histogram.getUnit());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(5_000.0, point.getSum());
    assertEquals("pointer.validation.latencyNanos", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void sanitizeReplacesIllegalCharactersAndPrefixesDigits() {
    assertEquals("pointer.status_broken", OpenTelemetryMetricsAdapter.sanitize("pointer.status broken"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitize("9lives"));
    assertEquals("pointer.metric", OpenTelemetryMetricsAdapter.sanitize("  "));
  }

  private Optional<MetricData> find(String name) {
    Optional<MetricData> match = reader.collectAllMetrics().stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst();
    assertTrue(match.isPresent(), "Expected metric " + name + " to be exported");
    return match;
  }
}

package com.findawise.pointers.infrastructure.metrics;

import com.findawise.pointers.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; selected when {@code metricsExporter=none}.
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}

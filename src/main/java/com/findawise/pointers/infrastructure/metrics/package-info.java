/**
 * Metrics adapters: OpenTelemetry (OTLP or disabled) and a discard-everything implementation.
 */
package com.findawise.pointers.infrastructure.metrics;

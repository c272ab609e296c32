package com.findawise.pointers.infrastructure.audit;

import com.findawise.pointers.application.port.AuditSinkPort;
import com.findawise.pointers.application.port.MetricsPort;
import com.findawise.pointers.domain.audit.AuditEvent;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit events as single structured log lines prefixed {@code audit.event}. Warn and error
 * severities log at the matching level.
 */
public final class LoggingAuditSink implements AuditSinkPort {
  private static final Logger log = LoggerFactory.getLogger(LoggingAuditSink.class);

  private final MetricsPort metrics;

  public LoggingAuditSink(MetricsPort metrics) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  public LoggingAuditSink() {
    this(MetricsPort.NO_OP);
  }

  @Override
  public void publish(AuditEvent event) {
    Objects.requireNonNull(event, "event");
    metrics.increment("audit.emitted");

    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("component=" + event.component());
    joiner.add("action=" + event.action());
    joiner.add("severity=" + event.severity().wireName());
    if (event.pointerId() != null) {
      joiner.add("pointer=" + event.pointerId());
    }
    event.attributes().forEach((key, value) -> joiner.add(key + "=" + value));
    joiner.add("at=" + event.timestamp());

    switch (event.severity()) {
      case ERROR -> log.error("audit.event {}", joiner);
      case WARN -> log.warn("audit.event {}", joiner);
      default -> log.info("audit.event {}", joiner);
    }
  }
}

package com.findawise.pointers.domain.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Record of a registry mutation or rejection.
 *
 * @param component emitting component name
 * @param action action identifier such as {@code create_pointer}
 * @param pointerId affected pointer; may be {@code null} for rejected creations
 * @param severity event severity
 * @param attributes additional key/value context, insertion ordered
 * @param timestamp emission instant
 * @since 0.1.0
 */
public record AuditEvent(
    String component,
    String action,
    String pointerId,
    AuditSeverity severity,
    Map<String, String> attributes,
    Instant timestamp) {

  public static final String COMPONENT = "ContentPointerRegistry";

  public AuditEvent {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(timestamp, "timestamp");
    attributes = attributes == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }
}

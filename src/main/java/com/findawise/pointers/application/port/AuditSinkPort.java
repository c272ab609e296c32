package com.findawise.pointers.application.port;

import com.findawise.pointers.domain.audit.AuditEvent;

/**
 * Destination for audit events emitted on registry mutations.
 *
 * <p>Implementations must not throw back into the registry; delivery failures are logged by the sink.</p>
 *
 * @since 0.1.0
 */
public interface AuditSinkPort extends AutoCloseable {
  /**
   * Publishes an audit event.
   *
   * @param event event to publish; never {@code null}
   */
  void publish(AuditEvent event);

  @Override
  default void close() {}

  /** Sink that drops every event. */
  AuditSinkPort NO_OP = event -> {};
}

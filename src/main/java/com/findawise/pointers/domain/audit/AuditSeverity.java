package com.findawise.pointers.domain.audit;

import java.util.Locale;

/** Severity attached to audit events. */
public enum AuditSeverity {
  INFO,
  WARN,
  ERROR;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}

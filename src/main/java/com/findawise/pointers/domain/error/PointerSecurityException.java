package com.findawise.pointers.domain.error;

import java.util.List;

/**
 * Raised when the security filter rejects a pointer. Carries every rejection reason; never retried.
 *
 * @since 0.1.0
 */
public final class PointerSecurityException extends PointerEngineException {
  private static final long serialVersionUID = 1L;

  private final List<String> reasons;

  public PointerSecurityException(List<String> reasons) {
    super("Pointer rejected by security filter: " + String.join("; ", reasons));
    this.reasons = List.copyOf(reasons);
  }

  public List<String> reasons() {
    return reasons;
  }
}

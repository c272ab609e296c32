package com.findawise.pointers.domain.error;

/** Raised when an operation addresses a pointer id the registry does not hold. */
public final class PointerNotFoundException extends PointerEngineException {
  private static final long serialVersionUID = 1L;

  private final String pointerId;

  public PointerNotFoundException(String pointerId) {
    super("Pointer not found: " + pointerId);
    this.pointerId = pointerId;
  }

  public String pointerId() {
    return pointerId;
  }
}

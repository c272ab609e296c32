package com.findawise.pointers.domain.error;

/**
 * Raised when a validator could not execute at all, as opposed to reporting an unreachable target.
 * The validation worker logs it and leaves the pointer status unchanged.
 */
public final class PointerValidationException extends PointerEngineException {
  private static final long serialVersionUID = 1L;

  public PointerValidationException(String message) {
    super(message);
  }

  public PointerValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}

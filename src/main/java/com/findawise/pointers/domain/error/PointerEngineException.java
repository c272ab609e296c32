package com.findawise.pointers.domain.error;

/**
 * Base type for failures raised by the content pointer engine.
 *
 * @since 0.1.0
 */
public class PointerEngineException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public PointerEngineException(String message) {
    super(message);
  }

  public PointerEngineException(String message, Throwable cause) {
    super(message, cause);
  }
}

package com.findawise.pointers.api;

/**
 * Process exit codes shared by every command.
 */
public enum ExitCode {
  SUCCESS(0),
  /** Validation found broken pointers; only {@code validate failOnBroken=true} returns it. */
  BROKEN_POINTERS(1),
  INVALID_ARGS(2),
  IO_ERROR(3),
  CONFIG_ERROR(4),
  RUNTIME_FAILURE(5),
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}

package com.findawise.pointers.application.port;

import java.time.Instant;

/**
 * Port supplying wall-clock time to the registry, cache and validation worker.
 *
 * <p>Every timestamp the engine records (creation, validation, access, cache expiry) is read through this
 * port so tests can drive time deterministically.</p>
 *
 * @since 0.1.0
 * @see com.findawise.pointers.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current time as an {@link Instant}.
   *
   * @return current instant
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }
}

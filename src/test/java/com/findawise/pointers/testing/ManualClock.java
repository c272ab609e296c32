package com.findawise.pointers.testing;

import com.findawise.pointers.application.port.ClockPort;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/** Clock that only moves when told to. */
public final class ManualClock implements ClockPort {
  private final AtomicLong now;

  public ManualClock() {
    this(Instant.parse("2024-01-01T00:00:00Z"));
  }

  public ManualClock(Instant start) {
    this.now = new AtomicLong(start.toEpochMilli());
  }

  @Override
  public long nowMillis() {
    return now.get();
  }

  public void advance(Duration duration) {
    now.addAndGet(duration.toMillis());
  }
}

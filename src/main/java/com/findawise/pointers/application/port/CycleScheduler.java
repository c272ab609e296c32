package com.findawise.pointers.application.port;

import java.time.Duration;

/**
 * Ticker that drives periodic work such as validation cycles.
 *
 * <p>Abstracted so tests can fire ticks by hand instead of waiting for wall-clock intervals.</p>
 *
 * @since 0.1.0
 */
public interface CycleScheduler {
  /**
   * Starts invoking {@code tick} every {@code interval}, measured between the end of one tick and the
   * start of the next.
   *
   * @param name name used for threads and logs
   * @param tick work to run
   * @param interval delay between ticks
   * @return handle that stops the ticks when closed
   */
  ScheduledCycle schedule(String name, Runnable tick, Duration interval);

  /** Handle to a running schedule. */
  interface ScheduledCycle extends AutoCloseable {
    @Override
    void close();
  }
}

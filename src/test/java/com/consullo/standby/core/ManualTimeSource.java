package com.consullo.standby.core;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Hand-driven {@link TimeSource} for tests. Wall clock and monotonic clock advance together.
 */
public final class ManualTimeSource implements TimeSource {

  private Instant now;
  private long nanos;
  private final ZoneId zone;

  public ManualTimeSource(final Instant start, final ZoneId zone) {
    this.now = start;
    this.zone = zone;
    this.nanos = 1_000_000_000L;
  }

  public synchronized void advance(final Duration d) {
    now = now.plus(d);
    nanos += d.toNanos();
  }

  public synchronized void setWallClock(final Instant instant) {
    now = instant;
  }

  @Override
  public synchronized Instant now() {
    return now;
  }

  @Override
  public synchronized long monotonicNanos() {
    return nanos;
  }

  @Override
  public ZoneId zone() {
    return zone;
  }
}

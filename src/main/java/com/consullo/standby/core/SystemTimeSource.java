package com.consullo.standby.core;

import java.time.Instant;
import java.time.ZoneId;

/**
 * {@link TimeSource} backed by {@link System#nanoTime()} and the JVM default zone.
 */
final class SystemTimeSource implements TimeSource {

  static final SystemTimeSource INSTANCE = new SystemTimeSource();

  private SystemTimeSource() {
  }

  @Override
  public Instant now() {
    return Instant.now();
  }

  @Override
  public long monotonicNanos() {
    return System.nanoTime();
  }

  @Override
  public ZoneId zone() {
    // Re-read on every call so a changed host zone is picked up without restart.
    return ZoneId.systemDefault();
  }
}

package com.consullo.standby.core;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Source of wall-clock time, monotonic time and the local time zone.
 *
 * <p>Wall-clock time stamps persisted events. Monotonic time measures the age of a visible prompt and is
 * unaffected by clock adjustments. Implementations must be safe to call from any thread.
 *
 * @since 1.0
 */
public interface TimeSource {

  /**
   * Returns the current wall-clock instant.
   *
   * @return current instant
   */
  Instant now();

  /**
   * Returns a monotonic reading in nanoseconds. Only differences between readings are meaningful.
   *
   * @return monotonic nanos
   */
  long monotonicNanos();

  /**
   * Returns the zone used to map instants to local calendar dates and hours.
   *
   * @return local zone
   */
  ZoneId zone();

  /**
   * Returns the current wall-clock time in epoch seconds.
   *
   * @return epoch seconds
   */
  default long epochSeconds() {
    return now().getEpochSecond();
  }

  /**
   * Returns a time source backed by the system clock and the JVM default zone.
   *
   * @return system time source
   */
  static TimeSource system() {
    return SystemTimeSource.INSTANCE;
  }
}

package com.consullo.standby.reminder;

import java.time.Duration;

/**
 * Reminder scheduling constants.
 *
 * @param tickPeriod period of the countdown tick; each tick adds this many whole seconds to the countdown
 * @param staleThreshold age at which an unacknowledged prompt is logged as a sedentary session
 * @param debounce minimum prompt age before an acknowledgment is honored
 * @param promptWidth prompt width in physical pixels
 * @param promptHeight prompt height in physical pixels
 * @param promptMargin distance of the prompt from the bottom-right corner of the work area
 * @since 1.0
 */
public record SchedulerConfig(
    Duration tickPeriod,
    Duration staleThreshold,
    Duration debounce,
    int promptWidth,
    int promptHeight,
    int promptMargin) {

  public SchedulerConfig {
    if (tickPeriod == null || staleThreshold == null || debounce == null) {
      throw new IllegalArgumentException("tickPeriod/staleThreshold/debounce must not be null.");
    }
    if (tickPeriod.getSeconds() <= 0) {
      throw new IllegalArgumentException("tickPeriod must be at least one second.");
    }
    if (promptWidth <= 0 || promptHeight <= 0 || promptMargin < 0) {
      throw new IllegalArgumentException("prompt geometry must be positive.");
    }
  }

  /**
   * Returns the production values: 5 s tick, 60 s stale threshold, 700 ms debounce, 640x196 prompt, 28 px margin.
   *
   * @return defaults
   */
  public static SchedulerConfig defaults() {
    return new SchedulerConfig(Duration.ofSeconds(5), Duration.ofSeconds(60), Duration.ofMillis(700), 640, 196, 28);
  }

  public long tickSeconds() {
    return tickPeriod.getSeconds();
  }
}

package com.consullo.standby.core.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One completed or lapsed sitting session.
 *
 * @param ts epoch seconds at which the reminder for this session was armed
 * @param durationSecs configured sitting threshold at arming time, in seconds
 * @since 1.0
 */
public record SedentaryEvent(
    @JsonProperty("ts") long ts,
    @JsonProperty("duration_secs") long durationSecs) {

  @JsonCreator
  public SedentaryEvent {
    if (durationSecs < 0) {
      throw new IllegalArgumentException("durationSecs must not be negative: " + durationSecs);
    }
  }
}

package com.consullo.standby.core;

import com.consullo.standby.core.events.SedentaryEvent;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only record of sedentary sessions and stand-ups.
 *
 * <p>Not thread-safe. The live instance is confined to the scheduler's worker thread; readers elsewhere get a
 * {@link #copy()}.
 *
 * @since 1.0
 */
public final class EventLog {

  public static final Duration RETENTION = Duration.ofDays(180);

  private final List<SedentaryEvent> sedentaryEvents;
  private final List<Long> standupTimestamps;

  public EventLog() {
    this(List.of(), List.of());
  }

  public EventLog(List<SedentaryEvent> sedentaryEvents, List<Long> standupTimestamps) {
    if (sedentaryEvents == null || standupTimestamps == null) {
      throw new IllegalArgumentException("sedentaryEvents/standupTimestamps must not be null.");
    }
    this.sedentaryEvents = new ArrayList<>(sedentaryEvents);
    this.standupTimestamps = new ArrayList<>(standupTimestamps);
  }

  public List<SedentaryEvent> sedentaryEvents() {
    return Collections.unmodifiableList(sedentaryEvents);
  }

  public List<Long> standupTimestamps() {
    return Collections.unmodifiableList(standupTimestamps);
  }

  public void appendSedentary(SedentaryEvent event) {
    if (event == null) {
      throw new IllegalArgumentException("event must not be null.");
    }
    sedentaryEvents.add(event);
  }

  public void appendStandup(long ts) {
    standupTimestamps.add(ts);
  }

  /**
   * Drops every event older than {@link #RETENTION} relative to {@code nowEpochSeconds}.
   *
   * @param nowEpochSeconds reference time
   * @return number of events removed
   */
  public int prune(long nowEpochSeconds) {
    long cutoff = nowEpochSeconds - RETENTION.getSeconds();
    int before = size();
    sedentaryEvents.removeIf(e -> e.ts() < cutoff);
    standupTimestamps.removeIf(ts -> ts < cutoff);
    return before - size();
  }

  /**
   * Drops every event at or after {@code startInclusive}.
   *
   * @param startInclusive epoch seconds
   * @return number of events removed
   */
  public int removeFrom(long startInclusive) {
    int before = size();
    sedentaryEvents.removeIf(e -> e.ts() >= startInclusive);
    standupTimestamps.removeIf(ts -> ts >= startInclusive);
    return before - size();
  }

  public int size() {
    return sedentaryEvents.size() + standupTimestamps.size();
  }

  public EventLog copy() {
    return new EventLog(sedentaryEvents, standupTimestamps);
  }
}

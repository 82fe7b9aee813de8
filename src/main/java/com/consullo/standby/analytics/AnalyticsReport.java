package com.consullo.standby.analytics;

import java.util.List;

/**
 * Hourly aggregation of the event log over one {@link Period}.
 *
 * <p>Hour buckets are indexed by local hour of day (0-23) regardless of the calendar date.
 *
 * @param period aggregated period
 * @param periodStartEpochSeconds inclusive lower bound of the period
 * @param hourlySedentary sedentary sessions per hour
 * @param hourlyStandup stand-ups per hour
 * @param hourlySedentaryDelaySecs summed sedentary durations per hour
 * @param sedentarySessions sedentary sessions in the period
 * @param standupSessions stand-ups in the period
 * @param totalSittingSecs summed sedentary durations in the period
 * @param recordCount {@code sedentarySessions + standupSessions}
 * @since 1.0
 */
public record AnalyticsReport(
    Period period,
    long periodStartEpochSeconds,
    List<Integer> hourlySedentary,
    List<Integer> hourlyStandup,
    List<Long> hourlySedentaryDelaySecs,
    int sedentarySessions,
    int standupSessions,
    long totalSittingSecs,
    int recordCount) {

  public static final int HOURS = 24;

  public AnalyticsReport {
    if (hourlySedentary.size() != HOURS || hourlyStandup.size() != HOURS || hourlySedentaryDelaySecs.size() != HOURS) {
      throw new IllegalArgumentException("hourly series must have " + HOURS + " entries.");
    }
    hourlySedentary = List.copyOf(hourlySedentary);
    hourlyStandup = List.copyOf(hourlyStandup);
    hourlySedentaryDelaySecs = List.copyOf(hourlySedentaryDelaySecs);
  }

  public long totalSittingMinutes() {
    return totalSittingSecs / 60;
  }
}

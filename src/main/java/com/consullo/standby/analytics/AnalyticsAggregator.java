package com.consullo.standby.analytics;

import com.consullo.standby.core.EventLog;
import com.consullo.standby.core.events.SedentaryEvent;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Turns an {@link EventLog} into an {@link AnalyticsReport}. Stateless apart from the time resolver.
 *
 * <p>
 * Period starts:
 * <ul>
 * <li>daily: local midnight today</li>
 * <li>weekly: local midnight six calendar days ago (seven days including today)</li>
 * <li>monthly: local midnight of the first of this month</li>
 * </ul>
 * Events with {@code ts >= start} are kept and bucketed by local hour.
 * </p>
 */
public final class AnalyticsAggregator {

  private final LocalTimeResolver resolver;

  public AnalyticsAggregator(final LocalTimeResolver resolver) {
    Validate.notNull(resolver, "resolver must not be null");
    this.resolver = resolver;
  }

  public LocalTimeResolver resolver() {
    return resolver;
  }

  /**
   * Returns the inclusive start of {@code period} for the local date of {@code today}.
   *
   * @param period period
   * @param today current local date
   * @return epoch seconds
   */
  public long periodStart(final Period period, final LocalDate today) {
    Validate.notNull(today, "today must not be null");
    Period p = period == null ? Period.DAILY : period;
    switch (p) {
      case WEEKLY:
        return resolver.midnight(today.minusDays(6));
      case MONTHLY:
        return resolver.midnight(today.withDayOfMonth(1));
      case DAILY:
      default:
        return resolver.midnight(today);
    }
  }

  /**
   * Returns the inclusive start of {@code period} relative to the resolver's current time.
   *
   * @param period period
   * @return epoch seconds
   */
  public long periodStart(final Period period) {
    return periodStart(period, resolver.localNow().toLocalDate());
  }

  /**
   * Aggregates {@code log} over {@code period} relative to the resolver's current time.
   *
   * @param log event log (not modified)
   * @param period period
   * @return report
   */
  public AnalyticsReport aggregate(final EventLog log, final Period period) {
    return aggregate(log, period, resolver.localNow().toLocalDate());
  }

  /**
   * Aggregates {@code log} over {@code period} ending on the local date {@code today}.
   *
   * @param log event log (not modified)
   * @param period period
   * @param today current local date
   * @return report
   */
  public AnalyticsReport aggregate(final EventLog log, final Period period, final LocalDate today) {
    Validate.notNull(log, "log must not be null");
    Period p = period == null ? Period.DAILY : period;
    long start = periodStart(p, today);

    long[] sedentary = new long[AnalyticsReport.HOURS];
    long[] standup = new long[AnalyticsReport.HOURS];
    long[] delay = new long[AnalyticsReport.HOURS];

    int sedentarySessions = 0;
    long totalSittingSecs = 0;
    for (SedentaryEvent e : log.sedentaryEvents()) {
      if (e.ts() < start) {
        continue;
      }
      int hour = resolver.hourOf(e.ts());
      sedentary[hour]++;
      delay[hour] += e.durationSecs();
      sedentarySessions++;
      totalSittingSecs += e.durationSecs();
    }

    int standupSessions = 0;
    for (long ts : log.standupTimestamps()) {
      if (ts < start) {
        continue;
      }
      standup[resolver.hourOf(ts)]++;
      standupSessions++;
    }

    return new AnalyticsReport(
        p,
        start,
        toIntList(sedentary),
        toIntList(standup),
        toLongList(delay),
        sedentarySessions,
        standupSessions,
        totalSittingSecs,
        sedentarySessions + standupSessions);
  }

  private static List<Integer> toIntList(long[] values) {
    List<Integer> out = new ArrayList<>(values.length);
    for (long v : values) {
      out.add((int) v);
    }
    return out;
  }

  private static List<Long> toLongList(long[] values) {
    List<Long> out = new ArrayList<>(values.length);
    for (long v : values) {
      out.add(v);
    }
    return out;
  }
}

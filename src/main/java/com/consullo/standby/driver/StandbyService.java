package com.consullo.standby.driver;

import com.consullo.standby.analytics.AnalyticsExporter;
import com.consullo.standby.analytics.AnalyticsReport;
import com.consullo.standby.analytics.ExportException;
import com.consullo.standby.analytics.Period;
import com.consullo.standby.core.Language;
import com.consullo.standby.core.ReminderSnapshot;
import com.consullo.standby.core.Theme;
import com.consullo.standby.core.events.StandbyListener;
import com.consullo.standby.reminder.ReminderScheduler;
import java.nio.file.Path;
import java.util.Locale;
import java.util.OptionalLong;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Operation surface consumed by the UI layer.
 *
 * <p>
 * Owns:
 * <ul>
 * <li>Reminder scheduler (single worker thread owning all runtime state)</li>
 * <li>Analytics exporter (CSV and PNG files)</li>
 * </ul>
 * Every call is safe from any thread.
 * </p>
 */
public final class StandbyService implements AutoCloseable {

  private final ReminderScheduler scheduler;
  private final AnalyticsExporter exporter;

  private StandbyService(ReminderScheduler scheduler, AnalyticsExporter exporter) {
    this.scheduler = scheduler;
    this.exporter = exporter;
  }

  public static StandbyService create(ReminderScheduler scheduler, AnalyticsExporter exporter) {
    Validate.notNull(scheduler, "scheduler must not be null");
    Validate.notNull(exporter, "exporter must not be null");
    return new StandbyService(scheduler, exporter);
  }

  public void addListener(StandbyListener listener) {
    scheduler.run(m -> m.addListener(listener));
  }

  public void removeListener(StandbyListener listener) {
    scheduler.run(m -> m.removeListener(listener));
  }

  public int setReminderInterval(long minutes) {
    return scheduler.call(m -> m.setIntervalMinutes(minutes));
  }

  public int getReminderInterval() {
    return scheduler.call(m -> m.intervalMinutes());
  }

  public Language setLanguage(String language) {
    return scheduler.call(m -> m.setLanguage(language));
  }

  public Language getLanguage() {
    return scheduler.call(m -> m.language());
  }

  public Language setReminderLanguage(String language) {
    return scheduler.call(m -> m.setReminderLanguage(language));
  }

  public Language getReminderLanguage() {
    return scheduler.call(m -> m.reminderLanguage());
  }

  public Theme setTheme(String theme) {
    return scheduler.call(m -> m.setTheme(theme));
  }

  public Theme getTheme() {
    return scheduler.call(m -> m.theme());
  }

  /**
   * Logs a stand-up outside of any reminder.
   *
   * @return stand-ups logged today
   */
  public int logStandup() {
    return scheduler.call(m -> m.logStandup());
  }

  /**
   * Acknowledges the active reminder. Stale, hidden or too-early acknowledgments are ignored.
   *
   * @param stoodUp true if the user confirmed standing up
   * @param reminderId id from {@link #getActiveReminder()} (may be null)
   */
  public void acknowledgeReminder(boolean stoodUp, Long reminderId) {
    OptionalLong id = reminderId == null ? OptionalLong.empty() : OptionalLong.of(reminderId);
    scheduler.call(m -> m.acknowledge(stoodUp, id));
  }

  public int getStandupCount() {
    return scheduler.call(m -> m.standupCount());
  }

  /**
   * Aggregates analytics for a period key ({@code daily}, {@code weekly}, {@code monthly}; anything else is
   * daily).
   *
   * @param period period key (may be null)
   * @return report
   */
  public AnalyticsReport getAnalytics(String period) {
    Period p = Period.fromKey(period);
    return scheduler.call(m -> m.analytics(p));
  }

  /**
   * Writes the period's analytics as CSV.
   *
   * @param period period key (may be null)
   * @return written file
   * @throws ExportException if there are too few records or the file cannot be written
   */
  public Path exportAnalyticsCsv(String period) throws ExportException {
    return exporter.exportCsv(getAnalytics(period));
  }

  /**
   * Writes a dashboard heatmap.
   *
   * @param dataUrl {@code data:image/png;base64,...} payload
   * @return written file
   * @throws ExportException if the payload is malformed or the file cannot be written
   */
  public Path exportAnalyticsPng(String dataUrl) throws ExportException {
    return exporter.exportPng(dataUrl);
  }

  public void resetDailyRecords() {
    scheduler.call(m -> m.resetDailyRecords());
  }

  public int nextReminderTipIndex() {
    return scheduler.call(m -> m.nextTipIndex());
  }

  public String nextReminderTipText() {
    return scheduler.call(m -> m.nextTipText());
  }

  public ReminderSnapshot getActiveReminder() {
    return scheduler.call(m -> m.activeReminder());
  }

  /**
   * Maps the host locale to a supported language.
   *
   * @return {@code zh-CN} for Chinese locales, {@code en} otherwise
   */
  public Language getSystemLanguage() {
    return systemLanguage(Locale.getDefault());
  }

  static Language systemLanguage(Locale locale) {
    String tag = locale == null ? "" : locale.toLanguageTag();
    return StringUtils.startsWithIgnoreCase(tag, "zh") ? Language.ZH_CN : Language.EN;
  }

  public ReminderScheduler scheduler() {
    return scheduler;
  }

  @Override
  public void close() {
    scheduler.close();
  }
}

package com.consullo.standby.reminder;

import com.consullo.standby.analytics.AnalyticsAggregator;
import com.consullo.standby.analytics.AnalyticsReport;
import com.consullo.standby.analytics.Period;
import com.consullo.standby.core.EventLog;
import com.consullo.standby.core.Language;
import com.consullo.standby.core.ReminderSnapshot;
import com.consullo.standby.core.StandbyConfig;
import com.consullo.standby.core.Theme;
import com.consullo.standby.core.TimeSource;
import com.consullo.standby.core.events.NotificationEvent;
import com.consullo.standby.core.events.SedentaryEvent;
import com.consullo.standby.core.events.StandbyListener;
import com.consullo.standby.store.PersistenceStore;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reminder state machine: counts sitting time, arms reminders and resolves them into events.
 *
 * <p>
 * States:
 * <ul>
 * <li>Idle: each {@link #tick()} adds the tick period to the countdown. When the
 * countdown reaches the configured interval a reminder is armed.</li>
 * <li>Armed: the prompt is visible. A prompt left unanswered for the stale
 * threshold is logged as a sedentary session by the tick; an acknowledgment
 * resolves the session and returns to Idle.</li>
 * </ul>
 * </p>
 *
 * <p>
 * Not thread-safe. Every method must be called from the single thread that
 * owns it, normally the {@link ReminderScheduler} worker. Because there is a
 * single writer, the tick path and the acknowledgment path can never both log
 * the same session.
 * </p>
 */
public final class ReminderStateMachine {

  private static final Logger LOGGER = LoggerFactory.getLogger(ReminderStateMachine.class);

  private final SchedulerConfig schedulerConfig;
  private final PersistenceStore store;
  private final ReminderPresenter presenter;
  private final TipSelector tipSelector;
  private final List<String> tips;
  private final AnalyticsAggregator aggregator;
  private final TimeSource time;
  private final RuntimeState state;

  private final List<StandbyListener> listeners = new CopyOnWriteArrayList<>();

  public ReminderStateMachine(
      final SchedulerConfig schedulerConfig,
      final StandbyConfig initialConfig,
      final EventLog initialLog,
      final PersistenceStore store,
      final ReminderPresenter presenter,
      final TipSelector tipSelector,
      final List<String> tips,
      final AnalyticsAggregator aggregator,
      final TimeSource time) {
    Validate.notNull(schedulerConfig, "schedulerConfig must not be null");
    Validate.notNull(initialConfig, "initialConfig must not be null");
    Validate.notNull(initialLog, "initialLog must not be null");
    Validate.notNull(store, "store must not be null");
    Validate.notNull(presenter, "presenter must not be null");
    Validate.notNull(tipSelector, "tipSelector must not be null");
    Validate.notEmpty(tips, "tips must not be empty");
    Validate.isTrue(tipSelector.count() == tips.size(), "tipSelector must draw from %s tips", tips.size());
    Validate.notNull(aggregator, "aggregator must not be null");
    Validate.notNull(time, "time must not be null");

    this.schedulerConfig = schedulerConfig;
    this.store = store;
    this.presenter = presenter;
    this.tipSelector = tipSelector;
    this.tips = List.copyOf(tips);
    this.aggregator = aggregator;
    this.time = time;
    this.state = new RuntimeState(initialConfig, initialLog, time.monotonicNanos(), ReminderTips.DEFAULT_TIP);
  }

  public void addListener(final StandbyListener listener) {
    Validate.notNull(listener, "listener must not be null");
    listeners.add(listener);
  }

  public void removeListener(final StandbyListener listener) {
    listeners.remove(listener);
  }

  /**
   * Advances the machine by one tick period.
   */
  public void tick() {
    ReminderSession session = state.session;
    if (session.visible) {
      tickArmed(session);
      return;
    }

    state.elapsedSecs += schedulerConfig.tickSeconds();
    long threshold = state.config.intervalSeconds();
    if (state.elapsedSecs < threshold) {
      LOGGER.debug("tick: elapsed={}s threshold={}s", state.elapsedSecs, threshold);
      return;
    }

    if (presenter.promptExists()) {
      arm(threshold);
    } else {
      LOGGER.warn("tick: threshold reached but no prompt window exists; reminder not armed");
    }
    notifyListeners(NotificationEvent.of(NotificationEvent.Type.REMINDER_FIRED, time.now(),
        Long.toString(session.id)));
    state.elapsedSecs = 0L;
  }

  private void tickArmed(final ReminderSession session) {
    if (!presenter.promptExists()) {
      LOGGER.info("tick: prompt window for reminder {} is gone; abandoning session", session.id);
      session.clear();
      return;
    }
    if (!presenter.promptShowing()) {
      LOGGER.debug("tick: re-showing hidden prompt for reminder {}", session.id);
      presenter.reshowPrompt(session.id);
    }

    if (session.startEpochSeconds == null || session.loggedSedentary) {
      return;
    }
    long lag = Math.max(0L, time.epochSeconds() - session.startEpochSeconds);
    if (lag >= schedulerConfig.staleThreshold().getSeconds()) {
      LOGGER.info("tick: reminder {} unanswered for {}s; logging sedentary session", session.id, lag);
      logSedentary(session);
      persistAnalytics();
    }
  }

  private void arm(final long threshold) {
    ReminderSession session = state.session;
    long id = session.id + 1;
    String tip = tips.get(tipSelector.next());
    session.arm(id, tip, threshold, time.epochSeconds(), time.monotonicNanos());

    Optional<PromptPlacement> placement = presenter.primaryWorkArea()
        .map(area -> PromptPlacement.bottomRight(area,
            schedulerConfig.promptWidth(), schedulerConfig.promptHeight(), schedulerConfig.promptMargin()));
    LOGGER.info("Armed reminder {} after {}s", id, threshold);
    presenter.showPrompt(activeReminder(), placement);
  }

  /**
   * Resolves the active reminder.
   *
   * <p>Ignored when {@code reminderId} names another session, when no prompt is visible, or when the prompt
   * is younger than the debounce period.
   *
   * @param stoodUp true if the user confirmed standing up
   * @param reminderId session the acknowledgment refers to, if known
   * @return true if the session was resolved
   */
  public boolean acknowledge(final boolean stoodUp, final OptionalLong reminderId) {
    ReminderSession session = state.session;
    if (reminderId != null && reminderId.isPresent() && reminderId.getAsLong() != session.id) {
      LOGGER.debug("acknowledge: stale id {} (active {})", reminderId.getAsLong(), session.id);
      return false;
    }
    if (!session.visible) {
      LOGGER.debug("acknowledge: no visible reminder");
      return false;
    }
    if (session.shownAtNanos != null
        && time.monotonicNanos() - session.shownAtNanos < schedulerConfig.debounce().toNanos()) {
      LOGGER.debug("acknowledge: within debounce window; ignored");
      return false;
    }

    long now = time.epochSeconds();
    boolean wroteAnalytics = false;
    if (session.startEpochSeconds != null) {
      long lag = Math.max(0L, now - session.startEpochSeconds);
      if (!session.loggedSedentary && lag >= schedulerConfig.staleThreshold().getSeconds()) {
        logSedentary(session);
        wroteAnalytics = true;
      } else if (!session.loggedSedentary && stoodUp) {
        state.eventLog.appendStandup(now);
        wroteAnalytics = true;
      }
    } else if (stoodUp) {
      state.eventLog.appendStandup(now);
      wroteAnalytics = true;
    }

    state.elapsedSecs = 0L;
    session.clear();

    if (wroteAnalytics) {
      saveAnalytics(now);
      notifyListeners(NotificationEvent.of(NotificationEvent.Type.ANALYTICS_UPDATED, time.now()));
      if (stoodUp) {
        notifyListeners(NotificationEvent.of(NotificationEvent.Type.STANDUP_LOGGED, time.now()));
      }
    }
    presenter.hidePrompt();
    LOGGER.info("Reminder {} acknowledged (stoodUp={}, logged={})", session.id, stoodUp, wroteAnalytics);
    return true;
  }

  private void logSedentary(final ReminderSession session) {
    state.eventLog.appendSedentary(new SedentaryEvent(session.startEpochSeconds, session.intervalSecsSnapshot));
    session.loggedSedentary = true;
  }

  /**
   * Logs a stand-up outside of any reminder and restarts the countdown.
   *
   * @return stand-ups logged today
   */
  public int logStandup() {
    state.elapsedSecs = 0L;
    state.session.visible = false;
    long now = time.epochSeconds();
    state.eventLog.appendStandup(now);
    saveAnalytics(now);
    int count = analytics(Period.DAILY).standupSessions();
    notifyListeners(NotificationEvent.of(NotificationEvent.Type.STANDUP_LOGGED, time.now()));
    notifyListeners(NotificationEvent.of(NotificationEvent.Type.ANALYTICS_UPDATED, time.now()));
    return count;
  }

  /**
   * Changes the sitting threshold. Values outside the allowed set fall back to the default. The countdown
   * restarts.
   *
   * @param minutes requested minutes
   * @return applied minutes
   */
  public int setIntervalMinutes(final long minutes) {
    int normalized = StandbyConfig.normalizeIntervalMinutes(minutes);
    state.config = state.config.withIntervalMinutes(normalized);
    state.elapsedSecs = 0L;
    state.lastIntervalChangeNanos = time.monotonicNanos();
    store.saveConfig(state.config);
    LOGGER.info("Interval set to {} minutes", normalized);
    return normalized;
  }

  public int intervalMinutes() {
    return state.config.intervalMinutes();
  }

  public Language setLanguage(final String tag) {
    Language language = Language.fromTag(tag);
    state.config = state.config.withLanguage(language);
    store.saveConfig(state.config);
    notifyListeners(NotificationEvent.of(NotificationEvent.Type.LANGUAGE_CHANGED, time.now(), language.tag()));
    return language;
  }

  public Language language() {
    return state.config.language();
  }

  public Language setReminderLanguage(final String tag) {
    Language language = Language.fromTag(tag);
    state.config = state.config.withReminderLanguage(language);
    store.saveConfig(state.config);
    notifyListeners(NotificationEvent.of(NotificationEvent.Type.REMINDER_LANGUAGE_CHANGED, time.now(),
        language.tag()));
    return language;
  }

  public Language reminderLanguage() {
    return state.config.reminderLanguage();
  }

  public Theme setTheme(final String key) {
    Theme theme = Theme.fromKey(key);
    state.config = state.config.withTheme(theme);
    store.saveConfig(state.config);
    notifyListeners(NotificationEvent.of(NotificationEvent.Type.THEME_CHANGED, time.now(), theme.key()));
    return theme;
  }

  public Theme theme() {
    return state.config.theme();
  }

  public StandbyConfig config() {
    return state.config;
  }

  /**
   * Aggregates the event log over {@code period}, after dropping expired events from memory.
   *
   * @param period period
   * @return report
   */
  public AnalyticsReport analytics(final Period period) {
    state.eventLog.prune(time.epochSeconds());
    return aggregator.aggregate(state.eventLog, period);
  }

  public int standupCount() {
    return analytics(Period.DAILY).standupSessions();
  }

  /**
   * Removes every event logged since local midnight today.
   *
   * @return number of events removed
   */
  public int resetDailyRecords() {
    long start = aggregator.periodStart(Period.DAILY);
    int removed = state.eventLog.removeFrom(start);
    persistAnalytics();
    LOGGER.info("Reset today's records: {} events removed", removed);
    return removed;
  }

  public int nextTipIndex() {
    return tipSelector.next();
  }

  public String nextTipText() {
    return tips.get(tipSelector.next() % tips.size());
  }

  public ReminderSnapshot activeReminder() {
    ReminderSession session = state.session;
    return ReminderSnapshot.builder()
        .id(session.id)
        .text(session.tipText)
        .theme(state.config.theme())
        .visible(session.visible)
        .build();
  }

  public long elapsedSecs() {
    return state.elapsedSecs;
  }

  public long lastIntervalChangeNanos() {
    return state.lastIntervalChangeNanos;
  }

  /**
   * Returns a copy of the event log.
   *
   * @return copy
   */
  public EventLog eventLog() {
    return state.eventLog.copy();
  }

  RuntimeState state() {
    return state;
  }

  private void persistAnalytics() {
    saveAnalytics(time.epochSeconds());
    notifyListeners(NotificationEvent.of(NotificationEvent.Type.ANALYTICS_UPDATED, time.now()));
  }

  /**
   * Drops expired events from the live log, then persists it. Every analytics write goes through here.
   */
  private void saveAnalytics(final long now) {
    int pruned = state.eventLog.prune(now);
    if (pruned > 0) {
      LOGGER.debug("Pruned {} expired events before saving", pruned);
    }
    store.saveAnalytics(state.eventLog, now);
  }

  private void notifyListeners(final NotificationEvent event) {
    for (StandbyListener listener : listeners) {
      try {
        listener.onNotification(event);
      } catch (RuntimeException e) {
        LOGGER.warn("Listener failed on {}: {}", event.type(), e.getMessage(), e);
      }
    }
  }
}

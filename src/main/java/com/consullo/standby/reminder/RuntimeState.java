package com.consullo.standby.reminder;

import com.consullo.standby.core.EventLog;
import com.consullo.standby.core.StandbyConfig;

/**
 * Everything the reminder loop mutates: configuration, countdown, active session and the event log.
 *
 * <p>Confined to the {@link ReminderScheduler} worker thread, so no field is individually locked and
 * multi-field transitions such as arming are atomic with respect to acknowledgments.
 */
final class RuntimeState {

  StandbyConfig config;
  long elapsedSecs;
  long lastIntervalChangeNanos;
  final ReminderSession session;
  final EventLog eventLog;

  RuntimeState(StandbyConfig config, EventLog eventLog, long nowNanos, String initialTip) {
    this.config = config;
    this.eventLog = eventLog;
    this.elapsedSecs = 0L;
    this.lastIntervalChangeNanos = nowNanos;
    this.session = new ReminderSession(config.intervalSeconds(), initialTip);
  }
}

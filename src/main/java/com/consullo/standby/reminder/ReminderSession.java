package com.consullo.standby.reminder;

/**
 * The in-flight reminder. Mutable; owned by {@link RuntimeState}.
 */
final class ReminderSession {

  long id;
  Long startEpochSeconds;
  Long shownAtNanos;
  long intervalSecsSnapshot;
  boolean loggedSedentary;
  String tipText;
  boolean visible;

  ReminderSession(long initialIntervalSecs, String initialTip) {
    this.id = 0L;
    this.intervalSecsSnapshot = initialIntervalSecs;
    this.tipText = initialTip;
  }

  void arm(long newId, String tip, long intervalSecs, long nowEpochSeconds, long nowNanos) {
    this.id = newId;
    this.tipText = tip;
    this.intervalSecsSnapshot = intervalSecs;
    this.startEpochSeconds = nowEpochSeconds;
    this.shownAtNanos = nowNanos;
    this.loggedSedentary = false;
    this.visible = true;
  }

  void clear() {
    this.visible = false;
    this.startEpochSeconds = null;
    this.shownAtNanos = null;
  }
}

package com.consullo.standby.core.events;

import java.time.Instant;

/**
 * Change notification delivered to {@link StandbyListener}s.
 *
 * <p>The presentation layer uses these to refresh views; the core never waits on a listener.
 *
 * @param type what changed
 * @param timestampUtc when the change was made
 * @param detail optional payload such as the new language tag or the fired reminder id (may be null)
 * @since 1.0
 */
public record NotificationEvent(
    Type type,
    Instant timestampUtc,
    String detail) {

  public enum Type {
    REMINDER_FIRED,
    ANALYTICS_UPDATED,
    STANDUP_LOGGED,
    LANGUAGE_CHANGED,
    REMINDER_LANGUAGE_CHANGED,
    THEME_CHANGED
  }

  public NotificationEvent {
    if (type == null || timestampUtc == null) {
      throw new IllegalArgumentException("type/timestampUtc must not be null.");
    }
  }

  /**
   * Creates a notification without payload.
   *
   * @param type type
   * @param ts timestamp
   * @return notification
   */
  public static NotificationEvent of(Type type, Instant ts) {
    return new NotificationEvent(type, ts, null);
  }

  /**
   * Creates a notification carrying a payload.
   *
   * @param type type
   * @param ts timestamp
   * @param detail payload
   * @return notification
   */
  public static NotificationEvent of(Type type, Instant ts, String detail) {
    return new NotificationEvent(type, ts, detail);
  }
}

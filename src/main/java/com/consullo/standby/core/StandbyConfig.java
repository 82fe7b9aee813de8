package com.consullo.standby.core;

import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * User configuration values.
 *
 * <p>Instances are always normalized: {@code intervalMinutes} is one of {@link #ALLOWED_INTERVAL_MINUTES}.
 * Use {@link #normalized(int, String, String, String)} to build one from untrusted input.
 *
 * @param intervalMinutes sitting threshold in minutes
 * @param language UI language
 * @param reminderLanguage prompt language
 * @param theme color theme
 * @since 1.0
 */
public record StandbyConfig(
    int intervalMinutes,
    Language language,
    Language reminderLanguage,
    Theme theme) {

  public static final int DEFAULT_INTERVAL_MINUTES = 50;

  public static final List<Integer> ALLOWED_INTERVAL_MINUTES = List.of(5, 10, 20, 30, 50);

  public StandbyConfig {
    Validate.isTrue(ALLOWED_INTERVAL_MINUTES.contains(intervalMinutes),
        "intervalMinutes must be one of %s: %s", ALLOWED_INTERVAL_MINUTES, intervalMinutes);
    Validate.notNull(language, "language must not be null");
    Validate.notNull(reminderLanguage, "reminderLanguage must not be null");
    Validate.notNull(theme, "theme must not be null");
  }

  /**
   * Returns the default configuration: 50 minutes, English, English, night.
   *
   * @return defaults
   */
  public static StandbyConfig defaults() {
    return new StandbyConfig(DEFAULT_INTERVAL_MINUTES, Language.EN, Language.EN, Theme.NIGHT);
  }

  /**
   * Builds a configuration, replacing every invalid value by its default.
   *
   * @param intervalMinutes requested interval
   * @param language UI language tag (may be null)
   * @param reminderLanguage reminder language tag (may be null)
   * @param theme theme key (may be null)
   * @return normalized configuration
   */
  public static StandbyConfig normalized(int intervalMinutes, String language, String reminderLanguage, String theme) {
    return new StandbyConfig(
        normalizeIntervalMinutes(intervalMinutes),
        Language.fromTag(language),
        Language.fromTag(reminderLanguage),
        Theme.fromKey(theme));
  }

  /**
   * Returns {@code minutes} if allowed, otherwise {@link #DEFAULT_INTERVAL_MINUTES}.
   *
   * @param minutes requested minutes
   * @return allowed minutes
   */
  public static int normalizeIntervalMinutes(long minutes) {
    for (int allowed : ALLOWED_INTERVAL_MINUTES) {
      if (allowed == minutes) {
        return allowed;
      }
    }
    return DEFAULT_INTERVAL_MINUTES;
  }

  public long intervalSeconds() {
    return intervalMinutes * 60L;
  }

  public StandbyConfig withIntervalMinutes(int minutes) {
    return new StandbyConfig(normalizeIntervalMinutes(minutes), language, reminderLanguage, theme);
  }

  public StandbyConfig withLanguage(Language value) {
    return new StandbyConfig(intervalMinutes, value, reminderLanguage, theme);
  }

  public StandbyConfig withReminderLanguage(Language value) {
    return new StandbyConfig(intervalMinutes, language, value, theme);
  }

  public StandbyConfig withTheme(Theme value) {
    return new StandbyConfig(intervalMinutes, language, reminderLanguage, value);
  }
}

package com.consullo.standby.analytics;

/**
 * Reporting window over which events are aggregated.
 *
 * @since 1.0
 */
public enum Period {
  DAILY("daily"),
  WEEKLY("weekly"),
  MONTHLY("monthly");

  private final String key;

  Period(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  /**
   * Parses a period key. Unknown or null input is treated as {@link #DAILY}.
   *
   * @param key period key
   * @return period
   */
  public static Period fromKey(String key) {
    if (WEEKLY.key.equals(key)) {
      return WEEKLY;
    }
    if (MONTHLY.key.equals(key)) {
      return MONTHLY;
    }
    return DAILY;
  }
}

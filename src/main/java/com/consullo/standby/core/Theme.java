package com.consullo.standby.core;

/**
 * Prompt and dashboard color theme.
 *
 * @since 1.0
 */
public enum Theme {
  DAY("day"),
  NIGHT("night");

  private final String key;

  Theme(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  /**
   * Normalizes a persisted or requested key. Anything other than {@code "day"} maps to {@link #NIGHT}.
   *
   * @param key key (may be null)
   * @return normalized theme
   */
  public static Theme fromKey(String key) {
    return DAY.key.equals(key) ? DAY : NIGHT;
  }
}

package com.consullo.standby.core;

/**
 * Supported UI and reminder languages.
 *
 * @since 1.0
 */
public enum Language {
  EN("en"),
  ZH_CN("zh-CN");

  private final String tag;

  Language(String tag) {
    this.tag = tag;
  }

  /**
   * Returns the persisted tag, e.g. {@code "zh-CN"}.
   *
   * @return language tag
   */
  public String tag() {
    return tag;
  }

  /**
   * Normalizes a persisted or requested tag. Anything other than {@code "zh-CN"} maps to {@link #EN}.
   *
   * @param tag tag (may be null)
   * @return normalized language
   */
  public static Language fromTag(String tag) {
    return ZH_CN.tag.equals(tag) ? ZH_CN : EN;
  }
}

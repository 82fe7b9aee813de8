package com.consullo.standby.store;

import com.consullo.standby.core.StandbyConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * On-disk form of {@link StandbyConfig}. Values are raw and may be invalid until normalized.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
class ConfigDocument {

  @JsonProperty("interval_minutes")
  public Long intervalMinutes;

  @JsonProperty("language")
  public String language;

  @JsonProperty("reminder_language")
  public String reminderLanguage;

  @JsonProperty("theme")
  public String theme;

  ConfigDocument() {
  }

  static ConfigDocument from(StandbyConfig config) {
    ConfigDocument doc = new ConfigDocument();
    doc.intervalMinutes = (long) config.intervalMinutes();
    doc.language = config.language().tag();
    doc.reminderLanguage = config.reminderLanguage().tag();
    doc.theme = config.theme().key();
    return doc;
  }

  StandbyConfig toNormalizedConfig() {
    int minutes = intervalMinutes == null
        ? StandbyConfig.DEFAULT_INTERVAL_MINUTES
        : StandbyConfig.normalizeIntervalMinutes(intervalMinutes);
    return StandbyConfig.normalized(minutes, language, reminderLanguage, theme);
  }
}

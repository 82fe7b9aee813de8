package com.consullo.standby.store;

import com.consullo.standby.core.EventLog;
import com.consullo.standby.core.events.SedentaryEvent;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

/**
 * On-disk form of the {@link EventLog}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
class AnalyticsDocument {

  @JsonProperty("reminder_events")
  public List<SedentaryEvent> reminderEvents = new ArrayList<>();

  @JsonProperty("standup_events")
  public List<Long> standupEvents = new ArrayList<>();

  AnalyticsDocument() {
  }

  static AnalyticsDocument from(EventLog log) {
    AnalyticsDocument doc = new AnalyticsDocument();
    doc.reminderEvents = new ArrayList<>(log.sedentaryEvents());
    doc.standupEvents = new ArrayList<>(log.standupTimestamps());
    return doc;
  }

  EventLog toEventLog() {
    List<SedentaryEvent> reminders = new ArrayList<>();
    if (reminderEvents != null) {
      for (SedentaryEvent e : reminderEvents) {
        if (e != null) {
          reminders.add(e);
        }
      }
    }
    List<Long> standups = new ArrayList<>();
    if (standupEvents != null) {
      for (Long ts : standupEvents) {
        if (ts != null) {
          standups.add(ts);
        }
      }
    }
    return new EventLog(reminders, standups);
  }
}

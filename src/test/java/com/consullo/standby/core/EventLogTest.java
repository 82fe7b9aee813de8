package com.consullo.standby.core;

import com.consullo.standby.core.events.SedentaryEvent;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for retention and reset behavior of the event log.
 *
 * @since 1.0
 */
public class EventLogTest {

  private static final long NOW = 1_800_000_000L;
  private static final long RETENTION_SECS = 180L * 86_400L;

  @Test
  @DisplayName("Should drop exactly the events older than 180 days")
  void prune_MixedAges_KeepsOnlyEventsInsideRetention() {
    EventLog log = new EventLog(
        List.of(
            new SedentaryEvent(NOW - RETENTION_SECS - 1, 300),
            new SedentaryEvent(NOW - RETENTION_SECS, 300),
            new SedentaryEvent(NOW - 10, 600)),
        List.of(NOW - RETENTION_SECS - 3600, NOW - 5, NOW));

    int removed = log.prune(NOW);

    assertThat(removed).isEqualTo(2);
    assertThat(log.sedentaryEvents()).extracting(SedentaryEvent::ts)
        .containsExactly(NOW - RETENTION_SECS, NOW - 10);
    assertThat(log.standupTimestamps()).containsExactly(NOW - 5, NOW);
    assertThat(log.sedentaryEvents()).allMatch(e -> e.ts() >= NOW - RETENTION_SECS);
  }

  @Test
  @DisplayName("Should remove events at or after the given start")
  void removeFrom_Boundary_IsInclusive() {
    EventLog log = new EventLog(
        List.of(new SedentaryEvent(99, 60), new SedentaryEvent(100, 60)),
        List.of(50L, 100L, 150L));

    int removed = log.removeFrom(100);

    assertThat(removed).isEqualTo(3);
    assertThat(log.sedentaryEvents()).extracting(SedentaryEvent::ts).containsExactly(99L);
    assertThat(log.standupTimestamps()).containsExactly(50L);
  }

  @Test
  @DisplayName("Should return an independent copy")
  void copy_ThenAppend_DoesNotAffectOriginal() {
    EventLog log = new EventLog();
    log.appendStandup(1L);

    EventLog copy = log.copy();
    copy.appendStandup(2L);

    assertThat(log.size()).isEqualTo(1);
    assertThat(copy.size()).isEqualTo(2);
  }
}

package com.consullo.standby.reminder;

import com.consullo.standby.analytics.AnalyticsAggregator;
import com.consullo.standby.analytics.LocalTimeResolver;
import com.consullo.standby.core.EventLog;
import com.consullo.standby.core.ManualTimeSource;
import com.consullo.standby.core.StandbyConfig;
import com.consullo.standby.core.Theme;
import com.consullo.standby.core.events.NotificationEvent;
import com.consullo.standby.store.PersistenceStore;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

/**
 * Threading tests for {@link ReminderScheduler}.
 *
 * @since 1.0
 */
public class ReminderSchedulerTest {

  private ReminderStateMachine machine;
  private ReminderScheduler scheduler;

  @BeforeEach
  void setUp() {
    ManualTimeSource time = new ManualTimeSource(Instant.parse("2026-10-14T09:00:00Z"), ZoneOffset.UTC);
    machine = new ReminderStateMachine(
        SchedulerConfig.defaults(),
        StandbyConfig.defaults(),
        new EventLog(),
        mock(PersistenceStore.class),
        mock(ReminderPresenter.class),
        new TipSelector(ReminderTips.ENGLISH.size(), new Random(1L)),
        ReminderTips.ENGLISH,
        new AnalyticsAggregator(new LocalTimeResolver(ZoneOffset.UTC, time::now)),
        time);
    scheduler = new ReminderScheduler(machine, Duration.ofMillis(10));
  }

  @AfterEach
  void tearDown() {
    scheduler.close();
  }

  @Test
  @Timeout(10)
  @DisplayName("Should advance the countdown from the worker thread once started")
  void start_Ticks_AdvanceElapsed() throws InterruptedException {
    assertThat(scheduler.isRunning()).isFalse();

    scheduler.start();
    assertThat(scheduler.isRunning()).isTrue();

    while (scheduler.call(ReminderStateMachine::elapsedSecs) < 15L) {
      Thread.sleep(5L);
    }
    assertThat(scheduler.call(ReminderStateMachine::elapsedSecs) % 5L).isZero();
  }

  @Test
  @Timeout(10)
  @DisplayName("Should run requests issued by a listener on the worker thread inline")
  void call_FromListenerOnWorker_DoesNotDeadlock() {
    AtomicReference<Theme> seen = new AtomicReference<>();
    AtomicReference<String> thread = new AtomicReference<>();
    machine.addListener(event -> {
      if (event.type() == NotificationEvent.Type.THEME_CHANGED) {
        thread.set(Thread.currentThread().getName());
        seen.set(scheduler.call(ReminderStateMachine::theme));
      }
    });

    Theme applied = scheduler.call(m -> m.setTheme("day"));

    assertThat(applied).isEqualTo(Theme.DAY);
    assertThat(seen.get()).isEqualTo(Theme.DAY);
    assertThat(thread.get()).isEqualTo("ReminderScheduler");
  }

  @Test
  @DisplayName("Should rethrow a request's runtime exception to the caller")
  void call_RequestThrows_Rethrown() {
    assertThatThrownBy(() -> scheduler.call(m -> {
      throw new IllegalArgumentException("bad request");
    })).isInstanceOf(IllegalArgumentException.class).hasMessage("bad request");

    assertThat(scheduler.call(ReminderStateMachine::intervalMinutes)).isEqualTo(50);
  }

  @Test
  @Timeout(10)
  @DisplayName("Should stop ticking and reject requests after close")
  void close_Stops_RejectsRequests() {
    scheduler.start();

    scheduler.close();

    assertThat(scheduler.isRunning()).isFalse();
    assertThatThrownBy(() -> scheduler.call(ReminderStateMachine::elapsedSecs))
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(scheduler::start).isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("Should reject a non-positive tick period")
  void constructor_ZeroPeriod_Throws() {
    assertThatThrownBy(() -> new ReminderScheduler(machine, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }
}

package com.consullo.standby.demo;

import com.consullo.standby.analytics.AnalyticsReport;
import com.consullo.standby.core.ReminderSnapshot;
import com.consullo.standby.driver.StandbyService;
import com.consullo.standby.driver.StandbyServiceFactory;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Console demo that runs the reminder loop against the real data directory.
 *
 * <p>
 * Usage: {@code StandbyDemo [intervalMinutes]}. Reminders are printed to stdout
 * and acknowledged by typing {@code y} (stood up) or {@code n}. {@code s} logs
 * a stand-up directly, {@code a} prints today's analytics and {@code q} quits.
 *
 * @since 1.0
 */
public final class StandbyDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(StandbyDemo.class);

  static final String USAGE = "Usage: StandbyDemo [intervalMinutes]";

  private StandbyDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args optional interval in minutes
   * @throws Exception if reading stdin fails
   */
  public static void main(final String[] args) throws Exception {
    final OptionalLong interval;
    try {
      interval = intervalArgument(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.println(USAGE);
      return;
    }
    final HeadlessReminderPresenter presenter = new HeadlessReminderPresenter(System.out);

    try (final StandbyService service = StandbyServiceFactory.createDefault(presenter)) {
      if (interval.isPresent()) {
        service.setReminderInterval(interval.getAsLong());
      }
      service.addListener(event -> LOGGER.info("notification: {} {}", event.type(),
          event.detail() == null ? "" : event.detail()));
      System.out.println("Reminding every " + service.getReminderInterval() + " minutes. y/n/s/a/q + Enter.");

      final BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
      String line;
      while ((line = in.readLine()) != null) {
        final String cmd = line.trim();
        if ("q".equals(cmd)) {
          break;
        }
        switch (cmd) {
          case "y":
          case "n": {
            final ReminderSnapshot active = service.getActiveReminder();
            service.acknowledgeReminder("y".equals(cmd), active.getId());
            break;
          }
          case "s":
            System.out.println("Stand-ups today: " + service.logStandup());
            break;
          case "a":
            printReport(service.getAnalytics("daily"));
            break;
          default:
            break;
        }
      }
      LOGGER.info("Demo completed");
    }
  }

  /**
   * Reads the optional interval argument.
   *
   * @param args command-line arguments
   * @return interval in minutes, or empty if none was given
   * @throws IllegalArgumentException if the argument is not a whole number
   */
  static OptionalLong intervalArgument(final String[] args) {
    if (args == null || args.length == 0) {
      return OptionalLong.empty();
    }
    try {
      return OptionalLong.of(Long.parseLong(args[0].trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("intervalMinutes must be a whole number: " + args[0], e);
    }
  }

  private static void printReport(final AnalyticsReport report) {
    System.out.println("=== Today ===");
    for (int hour = 0; hour < AnalyticsReport.HOURS; hour++) {
      final int sedentary = report.hourlySedentary().get(hour);
      final int standup = report.hourlyStandup().get(hour);
      if (sedentary > 0 || standup > 0) {
        System.out.printf("%02d:00  sat %d  stood %d%n", hour, sedentary, standup);
      }
    }
    System.out.println("sitting minutes: " + report.totalSittingMinutes()
        + ", records: " + report.recordCount());
  }
}

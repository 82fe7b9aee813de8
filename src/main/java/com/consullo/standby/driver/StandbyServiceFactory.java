package com.consullo.standby.driver;

import com.consullo.standby.analytics.AnalyticsAggregator;
import com.consullo.standby.analytics.AnalyticsExporter;
import com.consullo.standby.analytics.ExportDirectoryResolver;
import com.consullo.standby.analytics.LocalTimeResolver;
import com.consullo.standby.core.EventLog;
import com.consullo.standby.core.StandbyConfig;
import com.consullo.standby.core.TimeSource;
import com.consullo.standby.reminder.ReminderPresenter;
import com.consullo.standby.reminder.ReminderScheduler;
import com.consullo.standby.reminder.ReminderStateMachine;
import com.consullo.standby.reminder.ReminderTips;
import com.consullo.standby.reminder.SchedulerConfig;
import com.consullo.standby.reminder.TipSelector;
import com.consullo.standby.store.JsonPersistenceStore;
import com.consullo.standby.store.PersistenceStore;
import com.consullo.standby.store.StorePaths;
import java.security.SecureRandom;
import java.util.Random;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating {@link StandbyService}s with sensible defaults.
 *
 * <p>
 * This class centralizes:
 * <ul>
 * <li>where documents live (per-OS application-data directory, legacy sibling)</li>
 * <li>loading configuration and analytics before the first tick</li>
 * <li>production scheduling constants</li>
 * </ul>
 * </p>
 */
public final class StandbyServiceFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(StandbyServiceFactory.class);

  private StandbyServiceFactory() {
  }

  /**
   * Create a started service using the default storage location and the system clock.
   *
   * @param presenter prompt surface
   * @return started service
   */
  public static StandbyService createDefault(ReminderPresenter presenter) {
    StorePaths paths = StorePaths.resolveDefault();
    return create(presenter, paths, ExportDirectoryResolver.defaults(paths.primaryDirectory()),
        SchedulerConfig.defaults(), TimeSource.system(), new SecureRandom(), true);
  }

  /**
   * Create a service.
   *
   * @param presenter prompt surface
   * @param paths document locations
   * @param exportDirectories export directory candidates
   * @param schedulerConfig scheduling constants
   * @param time time source
   * @param random random source for tip selection
   * @param start if true, the periodic tick is started before returning
   * @return service
   */
  public static StandbyService create(
          ReminderPresenter presenter,
          StorePaths paths,
          ExportDirectoryResolver exportDirectories,
          SchedulerConfig schedulerConfig,
          TimeSource time,
          Random random,
          boolean start
  ) {
    Validate.notNull(presenter, "presenter must not be null");
    Validate.notNull(paths, "paths must not be null");
    Validate.notNull(exportDirectories, "exportDirectories must not be null");
    Validate.notNull(schedulerConfig, "schedulerConfig must not be null");
    Validate.notNull(time, "time must not be null");
    Validate.notNull(random, "random must not be null");

    PersistenceStore store = new JsonPersistenceStore(paths);
    StandbyConfig config = store.loadConfig();
    EventLog log = store.loadAnalytics(time.epochSeconds());

    LocalTimeResolver resolver = new LocalTimeResolver(time::zone, time::now);
    ReminderStateMachine machine = new ReminderStateMachine(
            schedulerConfig,
            config,
            log,
            store,
            presenter,
            new TipSelector(ReminderTips.ENGLISH.size(), random),
            ReminderTips.ENGLISH,
            new AnalyticsAggregator(resolver),
            time);

    ReminderScheduler scheduler = new ReminderScheduler(machine, schedulerConfig.tickPeriod());
    if (start) {
      scheduler.start();
    }
    LOGGER.info("Standby service ready (data={})", paths.primaryDirectory());
    return StandbyService.create(scheduler, new AnalyticsExporter(exportDirectories, resolver));
  }
}

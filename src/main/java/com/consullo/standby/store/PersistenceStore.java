package com.consullo.standby.store;

import com.consullo.standby.core.EventLog;
import com.consullo.standby.core.StandbyConfig;

/**
 * Durable storage for the configuration and the event log.
 *
 * <p>Implementations never throw to the caller. A missing or unreadable document is treated as "not yet
 * created" and resolves to defaults; a failed write is skipped and retried naturally on the next mutation.
 *
 * @since 1.0
 */
public interface PersistenceStore {

  /**
   * Loads the configuration from the primary location, falling back to the legacy location and then to
   * defaults. The normalized result is written back to the primary location before returning.
   *
   * @return normalized configuration, never null
   */
  StandbyConfig loadConfig();

  /**
   * Best-effort write of the configuration to the primary location.
   *
   * @param config configuration
   */
  void saveConfig(StandbyConfig config);

  /**
   * Loads the event log with the same fallback chain as {@link #loadConfig()}, pruned to the retention
   * window relative to {@code nowEpochSeconds}.
   *
   * @param nowEpochSeconds reference time for pruning
   * @return event log, empty if nothing could be read
   */
  EventLog loadAnalytics(long nowEpochSeconds);

  /**
   * Best-effort write of the event log, pruned to the retention window. The given log is not modified.
   *
   * @param log event log
   * @param nowEpochSeconds reference time for pruning
   */
  void saveAnalytics(EventLog log, long nowEpochSeconds);
}

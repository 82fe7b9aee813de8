package com.consullo.standby.store;

import com.consullo.standby.core.EventLog;
import com.consullo.standby.core.StandbyConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PersistenceStore} that keeps pretty-printed JSON documents on the local file system.
 *
 * <p>
 * Reads try the primary directory first and then the legacy directory of a pre-migration install.
 * Writes always target the primary directory, so a successful load followed by a save completes the
 * migration. Every failure is logged and absorbed.
 * </p>
 */
public final class JsonPersistenceStore implements PersistenceStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonPersistenceStore.class);

  private final StorePaths paths;
  private final ObjectMapper mapper;

  public JsonPersistenceStore(final StorePaths paths) {
    Validate.notNull(paths, "paths must not be null");
    this.paths = paths;
    this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
  }

  public StorePaths paths() {
    return paths;
  }

  @Override
  public StandbyConfig loadConfig() {
    StandbyConfig config = readDocument(paths.configFile(), ConfigDocument.class)
        .or(() -> paths.legacyConfigFile().flatMap(p -> readDocument(p, ConfigDocument.class)))
        .map(ConfigDocument::toNormalizedConfig)
        .orElseGet(StandbyConfig::defaults);

    // Rewrite immediately so corrupt, outdated or legacy documents heal on first load.
    saveConfig(config);
    LOGGER.info("Loaded config: interval={}min language={} reminderLanguage={} theme={}",
        config.intervalMinutes(), config.language().tag(), config.reminderLanguage().tag(), config.theme().key());
    return config;
  }

  @Override
  public void saveConfig(final StandbyConfig config) {
    if (config == null) {
      LOGGER.warn("saveConfig: ignoring null config");
      return;
    }
    writeDocument(paths.configFile(), ConfigDocument.from(config));
  }

  @Override
  public EventLog loadAnalytics(final long nowEpochSeconds) {
    EventLog log = readDocument(paths.analyticsFile(), AnalyticsDocument.class)
        .or(() -> paths.legacyAnalyticsFile().flatMap(p -> readDocument(p, AnalyticsDocument.class)))
        .map(AnalyticsDocument::toEventLog)
        .orElseGet(EventLog::new);

    int pruned = log.prune(nowEpochSeconds);
    LOGGER.info("Loaded analytics: {} sedentary, {} standup events ({} expired)",
        log.sedentaryEvents().size(), log.standupTimestamps().size(), pruned);
    return log;
  }

  @Override
  public void saveAnalytics(final EventLog log, final long nowEpochSeconds) {
    if (log == null) {
      LOGGER.warn("saveAnalytics: ignoring null log");
      return;
    }
    EventLog pruned = log.copy();
    pruned.prune(nowEpochSeconds);
    writeDocument(paths.analyticsFile(), AnalyticsDocument.from(pruned));
  }

  private <T> Optional<T> readDocument(final Path file, final Class<T> type) {
    if (!Files.isRegularFile(file)) {
      LOGGER.debug("readDocument: {} not present", file);
      return Optional.empty();
    }
    try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return Optional.ofNullable(mapper.readValue(in, type));
    } catch (IOException | RuntimeException e) {
      LOGGER.warn("readDocument: unreadable {} treated as absent: {}", file, e.getMessage());
      return Optional.empty();
    }
  }

  private void writeDocument(final Path file, final Object document) {
    try {
      Path parent = file.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      String json = mapper.writeValueAsString(document);
      Files.writeString(file, json, StandardCharsets.UTF_8);
      LOGGER.debug("writeDocument: wrote {}", file);
    } catch (IOException | RuntimeException e) {
      LOGGER.warn("writeDocument: skipped write of {}: {}", file, e.getMessage(), e);
    }
  }
}

package com.consullo.standby.store;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.SystemUtils;
import org.apache.commons.lang3.Validate;

/**
 * Locations of the persisted documents.
 *
 * @param primaryDirectory current application-data directory; documents are always written here
 * @param legacyDirectory directory of a pre-migration install, read only as a fallback (may be null)
 * @since 1.0
 */
public record StorePaths(
    Path primaryDirectory,
    Path legacyDirectory) {

  public static final String CONFIG_FILE_NAME = "config.json";
  public static final String ANALYTICS_FILE_NAME = "analytics.json";

  public static final String APP_IDENTIFIER = "com.consullo.standby";
  public static final String LEGACY_APP_IDENTIFIER = "com.colinwhispers.standby";

  /** System property that overrides the primary directory. */
  public static final String DATA_DIR_PROPERTY = "standby.data.dir";

  public StorePaths {
    Validate.notNull(primaryDirectory, "primaryDirectory must not be null");
  }

  /**
   * Resolves the per-OS application-data directory and the legacy sibling directory, if it exists.
   *
   * @return store paths
   */
  public static StorePaths resolveDefault() {
    String override = System.getProperty(DATA_DIR_PROPERTY);
    Path primary = StringUtils.isNotBlank(override)
        ? Path.of(override).toAbsolutePath().normalize()
        : applicationDataRoot().resolve(APP_IDENTIFIER);
    Path parent = primary.getParent();
    Path legacy = parent == null ? null : parent.resolve(LEGACY_APP_IDENTIFIER);
    if (legacy != null && !Files.isDirectory(legacy)) {
      legacy = null;
    }
    return new StorePaths(primary, legacy);
  }

  /**
   * Returns the directory under which per-application data directories live on this OS.
   *
   * @return application-data root
   */
  public static Path applicationDataRoot() {
    Path home = SystemUtils.getUserHome().toPath();
    if (SystemUtils.IS_OS_WINDOWS) {
      String appData = System.getenv("APPDATA");
      return StringUtils.isNotBlank(appData) ? Path.of(appData) : home.resolve("AppData").resolve("Roaming");
    }
    if (SystemUtils.IS_OS_MAC) {
      return home.resolve("Library").resolve("Application Support");
    }
    String xdg = System.getenv("XDG_DATA_HOME");
    return StringUtils.isNotBlank(xdg) ? Path.of(xdg) : home.resolve(".local").resolve("share");
  }

  public Path configFile() {
    return primaryDirectory.resolve(CONFIG_FILE_NAME);
  }

  public Path analyticsFile() {
    return primaryDirectory.resolve(ANALYTICS_FILE_NAME);
  }

  public Optional<Path> legacyConfigFile() {
    return Optional.ofNullable(legacyDirectory).map(dir -> dir.resolve(CONFIG_FILE_NAME));
  }

  public Optional<Path> legacyAnalyticsFile() {
    return Optional.ofNullable(legacyDirectory).map(dir -> dir.resolve(ANALYTICS_FILE_NAME));
  }
}

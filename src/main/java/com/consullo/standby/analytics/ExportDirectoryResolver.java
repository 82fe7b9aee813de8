package com.consullo.standby.analytics;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.apache.commons.lang3.SystemUtils;

/**
 * Picks the directory that exports are written to.
 *
 * <p>Candidates are tried in order (downloads, desktop, application data). The first existing directory
 * wins; if none exists yet, the last candidate is used and created on write.
 *
 * @since 1.0
 */
public final class ExportDirectoryResolver {

  private final List<Path> candidates;

  public ExportDirectoryResolver(final List<Path> candidates) {
    if (candidates == null) {
      throw new IllegalArgumentException("candidates must not be null.");
    }
    List<Path> copy = new ArrayList<>(candidates.size());
    for (Path p : candidates) {
      if (p != null) {
        copy.add(p);
      }
    }
    this.candidates = Collections.unmodifiableList(copy);
  }

  /**
   * Creates the default resolver: {@code ~/Downloads}, {@code ~/Desktop}, then {@code applicationData}.
   *
   * @param applicationData application-data directory (may be null)
   * @return resolver
   */
  public static ExportDirectoryResolver defaults(final Path applicationData) {
    Path home = SystemUtils.getUserHome().toPath();
    List<Path> list = new ArrayList<>(3);
    list.add(home.resolve("Downloads"));
    list.add(home.resolve("Desktop"));
    list.add(applicationData);
    return new ExportDirectoryResolver(list);
  }

  public List<Path> candidates() {
    return candidates;
  }

  /**
   * Resolves the export directory.
   *
   * @return directory, or empty if there are no candidates
   */
  public Optional<Path> resolve() {
    Optional<Path> existing = candidates.stream().filter(Objects::nonNull).filter(Files::isDirectory).findFirst();
    if (existing.isPresent()) {
      return existing;
    }
    if (candidates.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(candidates.get(candidates.size() - 1));
  }
}

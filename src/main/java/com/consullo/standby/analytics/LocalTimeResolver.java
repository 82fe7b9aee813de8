package com.consullo.standby.analytics;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.apache.commons.lang3.Validate;

/**
 * Maps between epoch seconds and local calendar time in one zone.
 *
 * <p>
 * A local date-time is resolved in a fixed order: the single valid mapping;
 * otherwise the earliest mapping of a DST overlap; otherwise the latest;
 * otherwise (a DST gap) the current time. Results near DST transitions depend
 * on this order, so it must not change.
 * </p>
 */
public final class LocalTimeResolver {

  private final Supplier<ZoneId> zone;
  private final Supplier<Instant> now;

  public LocalTimeResolver(final ZoneId zone, final Supplier<Instant> now) {
    this(constant(zone), now);
  }

  /**
   * Creates a resolver whose zone is looked up on every conversion, so a host zone change applies to the
   * next query.
   *
   * @param zone zone supplier
   * @param now clock
   */
  public LocalTimeResolver(final Supplier<ZoneId> zone, final Supplier<Instant> now) {
    Validate.notNull(zone, "zone must not be null");
    Validate.notNull(now, "now must not be null");
    this.zone = zone;
    this.now = now;
  }

  private static Supplier<ZoneId> constant(final ZoneId zone) {
    Validate.notNull(zone, "zone must not be null");
    return () -> zone;
  }

  public ZoneId zone() {
    return zone.get();
  }

  /**
   * Resolves a local date-time to epoch seconds using the fallback chain.
   *
   * @param local local date-time
   * @return epoch seconds
   */
  public long toEpochSeconds(final LocalDateTime local) {
    List<ZoneOffset> offsets = zone().getRules().getValidOffsets(local);
    return single(local, offsets)
        .or(() -> earliest(local, offsets))
        .or(() -> latest(local, offsets))
        .orElseGet(() -> now.get().getEpochSecond());
  }

  /**
   * Returns local midnight of {@code date} in epoch seconds.
   *
   * @param date local date
   * @return epoch seconds
   */
  public long midnight(final LocalDate date) {
    return toEpochSeconds(date.atStartOfDay());
  }

  /**
   * Returns the local hour (0-23) of an epoch timestamp, or of the current time if the timestamp is out of
   * the representable range.
   *
   * @param epochSeconds timestamp
   * @return hour of day
   */
  public int hourOf(final long epochSeconds) {
    ZoneId current = zone();
    try {
      return Instant.ofEpochSecond(epochSeconds).atZone(current).getHour();
    } catch (DateTimeException e) {
      return now.get().atZone(current).getHour();
    }
  }

  /**
   * Returns the current local date-time.
   *
   * @return now in this zone
   */
  public LocalDateTime localNow() {
    return LocalDateTime.ofInstant(now.get(), zone());
  }

  private static Optional<Long> single(LocalDateTime local, List<ZoneOffset> offsets) {
    if (offsets.size() != 1) {
      return Optional.empty();
    }
    return Optional.of(local.toEpochSecond(offsets.get(0)));
  }

  private static Optional<Long> earliest(LocalDateTime local, List<ZoneOffset> offsets) {
    return offsets.stream().map(local::toEpochSecond).min(Long::compare);
  }

  private static Optional<Long> latest(LocalDateTime local, List<ZoneOffset> offsets) {
    return offsets.stream().map(local::toEpochSecond).max(Long::compare);
  }
}

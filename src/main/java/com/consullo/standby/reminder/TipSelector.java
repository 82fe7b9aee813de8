package com.consullo.standby.reminder;

import java.util.Random;
import org.apache.commons.lang3.Validate;

/**
 * Draws prompt indices uniformly at random without repeating the previous draw.
 *
 * <p>
 * A draw that collides with the previous index is remapped to
 * {@code (idx + 1 + r) % n} with {@code r} uniform in {@code [0, n-1)}, which
 * covers every other index exactly once. With {@code n <= 1} repeats are
 * unavoidable.
 * </p>
 *
 * <p>Not thread-safe.</p>
 */
public final class TipSelector {

  private final int count;
  private final Random random;

  private Integer lastIndex;

  public TipSelector(final int count, final Random random) {
    Validate.isTrue(count > 0, "count must be positive");
    Validate.notNull(random, "random must not be null");
    this.count = count;
    this.random = random;
  }

  /**
   * Draws the next index in {@code [0, count)}.
   *
   * @return index
   */
  public int next() {
    int idx = random.nextInt(count);
    if (lastIndex != null && count > 1 && idx == lastIndex) {
      idx = (idx + 1 + random.nextInt(count - 1)) % count;
    }
    lastIndex = idx;
    return idx;
  }

  public int count() {
    return count;
  }

  /**
   * Returns the previous draw, or -1 before the first one.
   *
   * @return last index
   */
  public int lastIndex() {
    return lastIndex == null ? -1 : lastIndex;
  }
}

package org.birdguide.hotspot.domain;

import java.util.Arrays;
import java.util.Collection;

/**
 * Immutable twelve-bucket counter indexed by calendar month (1..12).
 *
 * <p>Used for both monthly detections of a species at a hotspot and monthly checklist counts of a hotspot.</p>
 */
public final class MonthlyCounts {
  /** Number of month buckets. */
  public static final int MONTHS = 12;

  private static final MonthlyCounts EMPTY = new MonthlyCounts(new long[MONTHS]);

  private final long[] counts;
  private final long total;

  private MonthlyCounts(long[] counts) {
    this.counts = counts;
    long sum = 0;
    for (long count : counts) {
      sum += count;
    }
    this.total = sum;
  }

  /**
   * Creates a snapshot of the supplied counters; index 0 holds January.
   *
   * @param counts twelve non-negative counters
   * @return immutable snapshot
   * @throws IllegalArgumentException when the array length is not 12 or a counter is negative
   */
  public static MonthlyCounts of(long... counts) {
    if (counts == null || counts.length != MONTHS) {
      throw new IllegalArgumentException("monthly counts require exactly " + MONTHS + " buckets");
    }
    for (long count : counts) {
      if (count < 0) {
        throw new IllegalArgumentException("monthly counts must not be negative");
      }
    }
    return new MonthlyCounts(Arrays.copyOf(counts, MONTHS));
  }

  /**
   * Returns a counter set with every month at zero.
   *
   * @return empty counters
   */
  public static MonthlyCounts empty() {
    return EMPTY;
  }

  /**
   * Validates a month number.
   *
   * @param month candidate month
   * @return the month
   * @throws IllegalArgumentException when outside 1..12
   */
  public static int requireMonth(int month) {
    if (month < 1 || month > MONTHS) {
      throw new IllegalArgumentException("month must be between 1 and 12 (was " + month + ")");
    }
    return month;
  }

  /**
   * Count for one month.
   *
   * @param month 1..12
   * @return counter value
   */
  public long get(int month) {
    return counts[requireMonth(month) - 1];
  }

  /**
   * Sum over the supplied months.
   *
   * @param months months to add up
   * @return sum of the selected buckets
   */
  public long sum(Collection<Integer> months) {
    long sum = 0;
    for (int month : months) {
      sum += get(month);
    }
    return sum;
  }

  /**
   * Sum over all twelve months.
   *
   * @return total count
   */
  public long total() {
    return total;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof MonthlyCounts that && Arrays.equals(counts, that.counts);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(counts);
  }

  @Override
  public String toString() {
    return "MonthlyCounts" + Arrays.toString(counts);
  }
}

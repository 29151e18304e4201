package org.birdguide.hotspot.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Total assignment of the twelve calendar months to the four {@link Season}s.
 * <p><strong>Why:</strong> Seasonal occurrence rates are sums of monthly buckets; a month assigned twice would be
 * counted twice and a missing month would silently vanish, so the partition is checked when it is built.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class SeasonPartition {
  private static final SeasonPartition DEFAULTS = of(defaultAssignment());

  private final Map<Season, List<Integer>> months;
  private final Season[] byMonth;

  private SeasonPartition(Map<Season, List<Integer>> months, Season[] byMonth) {
    this.months = months;
    this.byMonth = byMonth;
  }

  /**
   * Default partition: spring 3-5, summer 6-7, fall 8-11, winter 12-2.
   *
   * @return shared default partition
   */
  public static SeasonPartition defaults() {
    return DEFAULTS;
  }

  /**
   * Builds a partition from an explicit assignment.
   *
   * @param assignment months per season; every season must be present and non-empty
   * @return validated partition
   * @throws IllegalArgumentException when a season is missing or empty, a month is out of range, a month is
   *     assigned to more than one season, or a month is not assigned at all
   */
  public static SeasonPartition of(Map<Season, ? extends Collection<Integer>> assignment) {
    Objects.requireNonNull(assignment, "assignment");
    Season[] byMonth = new Season[MonthlyCounts.MONTHS];
    Map<Season, List<Integer>> copy = new EnumMap<>(Season.class);
    for (Season season : Season.values()) {
      Collection<Integer> seasonMonths = assignment.get(season);
      if (seasonMonths == null || seasonMonths.isEmpty()) {
        throw new IllegalArgumentException("season " + season.key() + " has no months assigned");
      }
      List<Integer> sorted = new ArrayList<>();
      for (Integer month : seasonMonths) {
        if (month == null) {
          throw new IllegalArgumentException("season " + season.key() + " contains a null month");
        }
        MonthlyCounts.requireMonth(month);
        Season existing = byMonth[month - 1];
        if (existing != null) {
          throw new IllegalArgumentException(
              "month " + month + " is assigned to both " + existing.key() + " and " + season.key());
        }
        byMonth[month - 1] = season;
        sorted.add(month);
      }
      Collections.sort(sorted);
      copy.put(season, List.copyOf(sorted));
    }
    for (int month = 1; month <= MonthlyCounts.MONTHS; month++) {
      if (byMonth[month - 1] == null) {
        throw new IllegalArgumentException("month " + month + " is not assigned to any season");
      }
    }
    return new SeasonPartition(Collections.unmodifiableMap(copy), byMonth);
  }

  /**
   * Season containing the given month.
   *
   * @param month 1..12
   * @return owning season
   */
  public Season seasonOf(int month) {
    return byMonth[MonthlyCounts.requireMonth(month) - 1];
  }

  /**
   * Months of a season in ascending order.
   *
   * @param season season to look up
   * @return immutable month list
   */
  public List<Integer> months(Season season) {
    return months.get(Objects.requireNonNull(season, "season"));
  }

  /**
   * Full assignment in {@link Season} declaration order.
   *
   * @return immutable view
   */
  public Map<Season, List<Integer>> asMap() {
    return months;
  }

  private static Map<Season, List<Integer>> defaultAssignment() {
    Map<Season, List<Integer>> map = new EnumMap<>(Season.class);
    map.put(Season.SPRING, List.of(3, 4, 5));
    map.put(Season.SUMMER, List.of(6, 7));
    map.put(Season.FALL, List.of(8, 9, 10, 11));
    map.put(Season.WINTER, List.of(12, 1, 2));
    return map;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof SeasonPartition that && months.equals(that.months);
  }

  @Override
  public int hashCode() {
    return months.hashCode();
  }

  @Override
  public String toString() {
    return "SeasonPartition" + months;
  }
}

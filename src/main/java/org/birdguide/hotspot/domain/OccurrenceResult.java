package org.birdguide.hotspot.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Occurrence of one species at one admitted hotspot.
 * <p><strong>Why:</strong> The unit ranked per species and listed per hotspot in the published guide.</p>
 * <p><strong>Invariants:</strong> {@code 0 <= detectionCount() <= totalChecklists}, {@code rate()} is exactly
 * {@code detectionCount() / totalChecklists}, the monthly map has keys 1..12 and the seasonal map has every
 * {@link Season}. A violation of the first invariant raises {@link ConsistencyFaultException}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param species species identity
 * @param hotspot hotspot attributes
 * @param totalChecklists complete checklists at the hotspot over the whole period
 * @param monthlyDetections detecting checklists per month
 * @param confidence sample-size tier of {@code totalChecklists}
 * @param monthly month to rate, sharing the whole-period denominator
 * @param seasonal season to rate, sharing the whole-period denominator
 * @param abundance reported individual counts
 * @since 0.1.0
 */
public record OccurrenceResult(
    SpeciesKey species,
    Hotspot hotspot,
    long totalChecklists,
    MonthlyCounts monthlyDetections,
    Confidence confidence,
    Map<Integer, Double> monthly,
    Map<Season, Double> seasonal,
    Abundance abundance) {

  public OccurrenceResult {
    Objects.requireNonNull(species, "species");
    Objects.requireNonNull(hotspot, "hotspot");
    Objects.requireNonNull(monthlyDetections, "monthlyDetections");
    Objects.requireNonNull(confidence, "confidence");
    Objects.requireNonNull(monthly, "monthly");
    Objects.requireNonNull(seasonal, "seasonal");
    abundance = abundance == null ? Abundance.NONE : abundance;
    long detections = monthlyDetections.total();
    if (totalChecklists <= 0) {
      throw new ConsistencyFaultException(
          species, hotspot.localityId(), detections, totalChecklists, "Occurrence without checklists");
    }
    if (detections > totalChecklists) {
      throw new ConsistencyFaultException(
          species, hotspot.localityId(), detections, totalChecklists, "Detections exceed checklists");
    }
    if (monthly.size() != MonthlyCounts.MONTHS) {
      throw new IllegalArgumentException("monthly rates require 12 months");
    }
    if (seasonal.size() != Season.values().length) {
      throw new IllegalArgumentException("seasonal rates require every season");
    }
    monthly = Collections.unmodifiableMap(new TreeMap<>(monthly));
    seasonal = Collections.unmodifiableMap(new EnumMap<>(seasonal));
  }

  /**
   * Locality identifier of the hotspot.
   *
   * @return locality id
   */
  public String localityId() {
    return hotspot.localityId();
  }

  /**
   * Number of complete checklists at the hotspot reporting the species.
   *
   * @return detection count
   */
  public long detectionCount() {
    return monthlyDetections.total();
  }

  /**
   * Fraction of complete checklists reporting the species.
   *
   * @return rate in [0, 1]
   */
  public double rate() {
    return (double) detectionCount() / totalChecklists;
  }

  /**
   * Reported individuals averaged over every detection, presence-only ({@code X}) reports included.
   *
   * @return average count, empty when no positive count was reported
   */
  public OptionalDouble averageCount() {
    long detections = detectionCount();
    if (detections == 0 || !abundance.hasCounts()) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of((double) abundance.totalIndividuals() / detections);
  }

  /**
   * Largest single reported count.
   *
   * @return max count, empty when no positive count was reported
   */
  public OptionalLong maxCount() {
    return abundance.maxCount() > 0 ? OptionalLong.of(abundance.maxCount()) : OptionalLong.empty();
  }
}

package org.birdguide.hotspot.application.pipeline;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import org.birdguide.hotspot.domain.ChecklistTotals;
import org.birdguide.hotspot.domain.DetectionTotals;
import org.birdguide.hotspot.domain.GuideThresholds;
import org.birdguide.hotspot.domain.HotspotTally;
import org.birdguide.hotspot.domain.MonthlyCounts;
import org.birdguide.hotspot.domain.OccurrenceResult;
import org.birdguide.hotspot.domain.Season;
import org.birdguide.hotspot.domain.SeasonPartition;
import org.birdguide.hotspot.domain.SpeciesHotspotTally;
import org.birdguide.hotspot.domain.SpeciesKey;

/**
 * <strong>What:</strong> Joins finalized checklist totals with finalized detection tallies into occurrence rates.
 * <p><strong>Why:</strong> Rates need both tallies complete, so this runs only after both passes have
 * finished.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Drop pairs whose locality is unknown or below the inclusion minimum.</li>
 *   <li>Compute overall, monthly and seasonal rates over the whole-period checklist total.</li>
 *   <li>Assign the confidence tier from the checklist total.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable and stateless beyond its configuration; a pure function of its
 * inputs.</p>
 * <p><strong>Observability:</strong> None; the caller logs the dropped-pair counts.</p>
 *
 * @implNote Detections above the checklist total raise
 * {@link org.birdguide.hotspot.domain.ConsistencyFaultException} from {@link OccurrenceResult}; rates are
 * never clamped.
 * @since 0.1.0
 */
public final class OccurrenceCalculator {
  private final GuideThresholds thresholds;
  private final SeasonPartition seasons;

  /**
   * Creates a calculator.
   *
   * @param thresholds inclusion and confidence thresholds
   * @param seasons month to season partition
   */
  public OccurrenceCalculator(GuideThresholds thresholds, SeasonPartition seasons) {
    this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    this.seasons = Objects.requireNonNull(seasons, "seasons");
  }

  /**
   * Computes every occurrence at an admitted hotspot.
   *
   * @param checklists finalized checklist totals
   * @param detections finalized detection tallies
   * @return occurrences grouped by species with drop counters
   * @throws org.birdguide.hotspot.domain.ConsistencyFaultException if a tally has more detections than checklists
   */
  public OccurrenceCalculation calculate(ChecklistTotals checklists, DetectionTotals detections) {
    Objects.requireNonNull(checklists, "checklists");
    Objects.requireNonNull(detections, "detections");
    Map<SpeciesKey, List<OccurrenceResult>> bySpecies = new TreeMap<>();
    long withoutChecklists = 0;
    long belowMinimum = 0;
    for (Map.Entry<SpeciesKey, Map<String, SpeciesHotspotTally>> species : detections.bySpecies().entrySet()) {
      List<OccurrenceResult> results = new ArrayList<>();
      for (SpeciesHotspotTally tally : species.getValue().values()) {
        Optional<HotspotTally> hotspot = checklists.get(tally.localityId());
        if (hotspot.isEmpty()) {
          withoutChecklists++;
          continue;
        }
        Optional<OccurrenceResult> result = calculate(tally, hotspot.get());
        if (result.isPresent()) {
          results.add(result.get());
        } else {
          belowMinimum++;
        }
      }
      if (!results.isEmpty()) {
        bySpecies.put(species.getKey(), results);
      }
    }
    return new OccurrenceCalculation(bySpecies, withoutChecklists, belowMinimum);
  }

  /**
   * Computes the occurrence of one species at one hotspot.
   *
   * @param tally detections of the species at the locality
   * @param hotspot checklist tally of the same locality
   * @return occurrence, or empty when the hotspot is below the inclusion minimum
   * @throws IllegalArgumentException if the tallies name different localities
   * @throws org.birdguide.hotspot.domain.ConsistencyFaultException if detections exceed checklists
   */
  public Optional<OccurrenceResult> calculate(SpeciesHotspotTally tally, HotspotTally hotspot) {
    Objects.requireNonNull(tally, "tally");
    Objects.requireNonNull(hotspot, "hotspot");
    if (!tally.localityId().equals(hotspot.localityId())) {
      throw new IllegalArgumentException(
          "tally for " + tally.localityId() + " joined with " + hotspot.localityId());
    }
    long total = hotspot.checklistCount();
    if (!thresholds.admits(total)) {
      return Optional.empty();
    }
    MonthlyCounts detections = tally.monthlyDetections();
    Map<Integer, Double> monthly = new TreeMap<>();
    for (int month = 1; month <= MonthlyCounts.MONTHS; month++) {
      monthly.put(month, ratio(detections.get(month), total));
    }
    Map<Season, Double> seasonal = new EnumMap<>(Season.class);
    for (Season season : Season.values()) {
      seasonal.put(season, ratio(detections.sum(seasons.months(season)), total));
    }
    return Optional.of(new OccurrenceResult(
        tally.species(),
        hotspot.hotspot(),
        total,
        detections,
        thresholds.confidenceFor(total),
        monthly,
        seasonal,
        tally.abundance()));
  }

  private static double ratio(long numerator, long denominator) {
    return denominator == 0 ? 0.0 : (double) numerator / denominator;
  }
}

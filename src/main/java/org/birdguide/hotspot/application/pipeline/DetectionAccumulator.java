package org.birdguide.hotspot.application.pipeline;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import org.birdguide.hotspot.application.port.MetricsPort;
import org.birdguide.hotspot.domain.Abundance;
import org.birdguide.hotspot.domain.DetectionTotals;
import org.birdguide.hotspot.domain.LocalityType;
import org.birdguide.hotspot.domain.MonthlyCounts;
import org.birdguide.hotspot.domain.ObservationRecord;
import org.birdguide.hotspot.domain.SpeciesHotspotTally;
import org.birdguide.hotspot.domain.SpeciesKey;
import org.birdguide.hotspot.domain.TaxonCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Counts, per species and hotspot, the complete checklists reporting the species, by month.
 * <p><strong>Why:</strong> Supplies the numerator of every occurrence rate. A species logged twice on one
 * checklist must still count once, otherwise rates drift above the true frequency.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Admit species-level observations on complete hotspot checklists only.</li>
 *   <li>Deduplicate on checklist id within each species, locality and month bucket.</li>
 *   <li>Sum and track the maximum of numeric individual counts for first sightings per checklist.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by a single pass.</p>
 * <p><strong>Performance:</strong> Memory grows with species-locality pairs and their detecting checklists;
 * {@link #finish()} drops the checklist sets and keeps twelve counters per pair.</p>
 * <p><strong>Observability:</strong> Increments {@code guide.detections.counted},
 * {@code guide.detections.duplicate}, {@code guide.detections.incomplete} and
 * {@code guide.detections.rejected}.</p>
 *
 * @since 0.1.0
 */
public final class DetectionAccumulator {
  private static final Logger log = LoggerFactory.getLogger(DetectionAccumulator.class);

  private final MetricsPort metrics;
  private final Map<PairKey, PairTally> tallies = new HashMap<>();
  private long duplicateRows;
  private long incompleteRows;
  private long rejectedRows;
  private boolean finished;

  /**
   * Creates an accumulator.
   *
   * @param metrics metrics sink; must not be {@code null}
   */
  public DetectionAccumulator(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Adds one observation row.
   *
   * @param record observation row
   * @return {@code true} when the row added a detection
   * @throws IllegalStateException after {@link #finish()}
   */
  public boolean accept(ObservationRecord record) {
    Objects.requireNonNull(record, "record");
    if (finished) {
      throw new IllegalStateException("detection tallies are already finalized");
    }
    if (record.category() != TaxonCategory.SPECIES || record.localityType() != LocalityType.HOTSPOT) {
      rejectedRows++;
      metrics.increment("guide.detections.rejected");
      return false;
    }
    if (!record.allSpeciesReported()) {
      incompleteRows++;
      metrics.increment("guide.detections.incomplete");
      return false;
    }
    PairKey key = new PairKey(record.species(), record.localityId());
    PairTally tally = tallies.computeIfAbsent(key, k -> new PairTally());
    if (!tally.add(record.checklistId(), record.observationMonth(), record.individualCount())) {
      duplicateRows++;
      metrics.increment("guide.detections.duplicate");
      log.debug("{} already counted on checklist {}", record.species(), record.checklistId());
      return false;
    }
    metrics.increment("guide.detections.counted");
    return true;
  }

  /**
   * Freezes the tallies and releases the dedup sets.
   *
   * @return immutable totals
   * @throws IllegalStateException when called twice
   */
  public DetectionTotals finish() {
    if (finished) {
      throw new IllegalStateException("detection tallies are already finalized");
    }
    finished = true;
    List<SpeciesHotspotTally> frozen = new ArrayList<>(tallies.size());
    for (Map.Entry<PairKey, PairTally> entry : tallies.entrySet()) {
      frozen.add(entry.getValue().freeze(entry.getKey()));
    }
    tallies.clear();
    DetectionTotals totals = new DetectionTotals(frozen, duplicateRows, incompleteRows, rejectedRows);
    log.debug("Detection tallies finalized for {} species ({} duplicate rows)",
        totals.bySpecies().size(), duplicateRows);
    return totals;
  }

  private record PairKey(SpeciesKey species, String localityId) {}

  private static final class PairTally {
    private final Map<Integer, Set<String>> seenByMonth = new HashMap<>();
    private final long[] monthly = new long[MonthlyCounts.MONTHS];
    private long totalIndividuals;
    private long countedDetections;
    private long maxCount;

    private boolean add(String checklistId, int month, OptionalInt individuals) {
      if (!seenByMonth.computeIfAbsent(month, m -> new HashSet<>()).add(checklistId)) {
        return false;
      }
      monthly[month - 1]++;
      if (individuals.isPresent()) {
        int count = individuals.getAsInt();
        totalIndividuals += count;
        countedDetections++;
        maxCount = Math.max(maxCount, count);
      }
      return true;
    }

    private SpeciesHotspotTally freeze(PairKey key) {
      return new SpeciesHotspotTally(key.species(), key.localityId(), MonthlyCounts.of(monthly),
          new Abundance(totalIndividuals, countedDetections, maxCount));
    }
  }
}

package org.birdguide.hotspot.application.pipeline;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.birdguide.hotspot.domain.OccurrenceResult;
import org.birdguide.hotspot.domain.SpeciesKey;

/**
 * Output of {@link OccurrenceCalculator}: occurrences grouped by species plus the pairs that were dropped.
 *
 * @param bySpecies species to occurrences at admitted hotspots, in species order
 * @param pairsWithoutChecklists tallies whose locality had no complete checklist total
 * @param pairsBelowMinimum tallies whose locality fell below the inclusion minimum
 * @since 0.1.0
 */
public record OccurrenceCalculation(
    Map<SpeciesKey, List<OccurrenceResult>> bySpecies, long pairsWithoutChecklists, long pairsBelowMinimum) {
  public OccurrenceCalculation {
    Objects.requireNonNull(bySpecies, "bySpecies");
    TreeMap<SpeciesKey, List<OccurrenceResult>> copy = new TreeMap<>();
    bySpecies.forEach((species, results) -> copy.put(species, List.copyOf(results)));
    bySpecies = Collections.unmodifiableMap(copy);
  }

  /**
   * Number of occurrences across every species.
   *
   * @return result count
   */
  public long resultCount() {
    long count = 0;
    for (List<OccurrenceResult> results : bySpecies.values()) {
      count += results.size();
    }
    return count;
  }
}

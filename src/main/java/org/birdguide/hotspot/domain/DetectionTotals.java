package org.birdguide.hotspot.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Frozen output of the detection pass: species-locality tallies grouped by species.
 *
 * <p>Iteration order is species order, then locality order, so downstream results do not depend on the order
 * of input rows.</p>
 *
 * @since 0.1.0
 */
public final class DetectionTotals {
  private final Map<SpeciesKey, Map<String, SpeciesHotspotTally>> bySpecies;
  private final long duplicateRows;
  private final long incompleteRows;
  private final long rejectedRows;

  /**
   * Creates a snapshot.
   *
   * @param tallies finalized tallies
   * @param duplicateRows rows repeating a species already counted on the same checklist and month
   * @param incompleteRows rows from incomplete checklists
   * @param rejectedRows rows that were not species-level hotspot observations
   */
  public DetectionTotals(
      Collection<SpeciesHotspotTally> tallies, long duplicateRows, long incompleteRows, long rejectedRows) {
    Objects.requireNonNull(tallies, "tallies");
    Map<SpeciesKey, Map<String, SpeciesHotspotTally>> grouped = new TreeMap<>();
    for (SpeciesHotspotTally tally : tallies) {
      Map<String, SpeciesHotspotTally> localities =
          grouped.computeIfAbsent(tally.species(), key -> new TreeMap<>());
      if (localities.put(tally.localityId(), tally) != null) {
        throw new IllegalArgumentException(
            "duplicate tally for " + tally.species() + " at " + tally.localityId());
      }
    }
    grouped.replaceAll((key, value) -> Collections.unmodifiableMap(value));
    this.bySpecies = Collections.unmodifiableMap(grouped);
    this.duplicateRows = duplicateRows;
    this.incompleteRows = incompleteRows;
    this.rejectedRows = rejectedRows;
  }

  /**
   * Tallies grouped by species.
   *
   * @return immutable nested view
   */
  public Map<SpeciesKey, Map<String, SpeciesHotspotTally>> bySpecies() {
    return bySpecies;
  }

  /**
   * Number of species-locality tallies.
   *
   * @return pair count
   */
  public int pairCount() {
    int count = 0;
    for (Map<String, SpeciesHotspotTally> localities : bySpecies.values()) {
      count += localities.size();
    }
    return count;
  }

  public long duplicateRows() {
    return duplicateRows;
  }

  public long incompleteRows() {
    return incompleteRows;
  }

  public long rejectedRows() {
    return rejectedRows;
  }
}

package org.birdguide.hotspot.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Frozen output of the checklist pass: complete-checklist tallies per hotspot, keyed and iterated by locality id.
 *
 * @since 0.1.0
 */
public final class ChecklistTotals {
  private final Map<String, HotspotTally> byLocality;
  private final long duplicateRows;
  private final long nonQualifyingRows;

  /**
   * Creates a snapshot.
   *
   * @param tallies finalized tallies
   * @param duplicateRows qualifying rows whose checklist was already counted
   * @param nonQualifyingRows rows that were not complete hotspot checklists
   */
  public ChecklistTotals(Collection<HotspotTally> tallies, long duplicateRows, long nonQualifyingRows) {
    Objects.requireNonNull(tallies, "tallies");
    Map<String, HotspotTally> sorted = new TreeMap<>();
    for (HotspotTally tally : tallies) {
      if (sorted.put(tally.localityId(), tally) != null) {
        throw new IllegalArgumentException("duplicate tally for " + tally.localityId());
      }
    }
    this.byLocality = Collections.unmodifiableMap(sorted);
    this.duplicateRows = duplicateRows;
    this.nonQualifyingRows = nonQualifyingRows;
  }

  public Optional<HotspotTally> get(String localityId) {
    return Optional.ofNullable(byLocality.get(localityId));
  }

  /**
   * All tallies in locality order.
   *
   * @return immutable tally view
   */
  public Collection<HotspotTally> tallies() {
    return byLocality.values();
  }

  /**
   * Tallies admitted by the thresholds, in locality order.
   *
   * @param thresholds inclusion thresholds
   * @return admitted tallies
   */
  public List<HotspotTally> admitted(GuideThresholds thresholds) {
    List<HotspotTally> admitted = new ArrayList<>();
    for (HotspotTally tally : byLocality.values()) {
      if (thresholds.admits(tally.checklistCount())) {
        admitted.add(tally);
      }
    }
    return admitted;
  }

  /**
   * Number of hotspots with at least one but fewer than the minimum checklists.
   *
   * @param thresholds inclusion thresholds
   * @return excluded hotspot count
   */
  public int excludedBelowMinimum(GuideThresholds thresholds) {
    int excluded = 0;
    for (HotspotTally tally : byLocality.values()) {
      if (tally.checklistCount() > 0 && !thresholds.admits(tally.checklistCount())) {
        excluded++;
      }
    }
    return excluded;
  }

  /**
   * Sum of all hotspot totals.
   *
   * @return distinct complete hotspot checklists
   */
  public long totalChecklists() {
    long total = 0;
    for (HotspotTally tally : byLocality.values()) {
      total += tally.checklistCount();
    }
    return total;
  }

  public int size() {
    return byLocality.size();
  }

  public long duplicateRows() {
    return duplicateRows;
  }

  public long nonQualifyingRows() {
    return nonQualifyingRows;
  }
}

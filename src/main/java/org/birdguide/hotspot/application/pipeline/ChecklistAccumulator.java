package org.birdguide.hotspot.application.pipeline;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.birdguide.hotspot.application.port.MetricsPort;
import org.birdguide.hotspot.domain.ChecklistRecord;
import org.birdguide.hotspot.domain.ChecklistTotals;
import org.birdguide.hotspot.domain.HotspotTally;
import org.birdguide.hotspot.domain.MonthlyCounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Counts distinct complete checklists per hotspot.
 * <p><strong>Why:</strong> Supplies the denominator of every occurrence rate; no rate may be computed until
 * {@link #finish()} has frozen the counts.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Admit only complete checklists at hotspots.</li>
 *   <li>Count each checklist id at most once per locality, however often its row repeats.</li>
 *   <li>Track monthly checklist counts next to the total.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by a single pass.</p>
 * <p><strong>Performance:</strong> Memory grows with distinct localities and their checklist ids, never with
 * the number of rows; the id sets are released by {@link #finish()}.</p>
 * <p><strong>Observability:</strong> Increments {@code guide.checklists.counted},
 * {@code guide.checklists.duplicate} and {@code guide.checklists.nonQualifying}.</p>
 *
 * @since 0.1.0
 */
public final class ChecklistAccumulator {
  private static final Logger log = LoggerFactory.getLogger(ChecklistAccumulator.class);

  private final MetricsPort metrics;
  private final Map<String, LocalityTally> tallies = new HashMap<>();
  private long duplicateRows;
  private long nonQualifyingRows;
  private boolean finished;

  /**
   * Creates an accumulator.
   *
   * @param metrics metrics sink; must not be {@code null}
   */
  public ChecklistAccumulator(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Adds one sampling row.
   *
   * @param record checklist row
   * @return {@code true} when the row increased a hotspot's count
   * @throws IllegalStateException after {@link #finish()}
   */
  public boolean accept(ChecklistRecord record) {
    Objects.requireNonNull(record, "record");
    if (finished) {
      throw new IllegalStateException("checklist tallies are already finalized");
    }
    if (!record.qualifies()) {
      nonQualifyingRows++;
      metrics.increment("guide.checklists.nonQualifying");
      return false;
    }
    LocalityTally tally = tallies.computeIfAbsent(record.localityId(), id -> new LocalityTally(record));
    if (!tally.add(record.checklistId(), record.observationMonth())) {
      duplicateRows++;
      metrics.increment("guide.checklists.duplicate");
      log.debug("Checklist {} already counted for {}", record.checklistId(), record.localityId());
      return false;
    }
    metrics.increment("guide.checklists.counted");
    return true;
  }

  /**
   * Freezes the tallies and releases the dedup sets.
   *
   * @return immutable totals
   * @throws IllegalStateException when called twice
   */
  public ChecklistTotals finish() {
    if (finished) {
      throw new IllegalStateException("checklist tallies are already finalized");
    }
    finished = true;
    List<HotspotTally> frozen = new ArrayList<>(tallies.size());
    for (LocalityTally tally : tallies.values()) {
      frozen.add(tally.freeze());
    }
    tallies.clear();
    ChecklistTotals totals = new ChecklistTotals(frozen, duplicateRows, nonQualifyingRows);
    log.debug("Checklist tallies finalized for {} hotspots ({} duplicate rows)", totals.size(), duplicateRows);
    return totals;
  }

  private static final class LocalityTally {
    private final ChecklistRecord first;
    private final Set<String> seen = new HashSet<>();
    private final long[] monthly = new long[MonthlyCounts.MONTHS];

    private LocalityTally(ChecklistRecord first) {
      this.first = first;
    }

    private boolean add(String checklistId, int month) {
      if (!seen.add(checklistId)) {
        return false;
      }
      monthly[month - 1]++;
      return true;
    }

    private HotspotTally freeze() {
      return new HotspotTally(first.hotspot(), MonthlyCounts.of(monthly));
    }
  }
}

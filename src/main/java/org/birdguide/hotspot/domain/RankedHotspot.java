package org.birdguide.hotspot.domain;

import java.util.Objects;

/**
 * An occurrence result with its ordinal position in a species ranking.
 *
 * @param rank 1-based strict ordinal rank
 * @param occurrence ranked result
 */
public record RankedHotspot(int rank, OccurrenceResult occurrence) {
  public RankedHotspot {
    Objects.requireNonNull(occurrence, "occurrence");
    if (rank < 1) {
      throw new IllegalArgumentException("rank must start at 1 (was " + rank + ")");
    }
  }
}

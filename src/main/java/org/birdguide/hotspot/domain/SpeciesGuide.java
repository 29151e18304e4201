package org.birdguide.hotspot.domain;

import java.util.List;
import java.util.Objects;

/**
 * Ranked hotspots for one species.
 *
 * @param species species identity
 * @param hotspots every admitted hotspot, rank order
 */
public record SpeciesGuide(SpeciesKey species, List<RankedHotspot> hotspots) {
  public SpeciesGuide {
    Objects.requireNonNull(species, "species");
    hotspots = List.copyOf(Objects.requireNonNull(hotspots, "hotspots"));
  }

  /**
   * Sum of detections over all ranked hotspots.
   *
   * @return total detections
   */
  public long totalDetections() {
    long sum = 0;
    for (RankedHotspot hotspot : hotspots) {
      sum += hotspot.occurrence().detectionCount();
    }
    return sum;
  }

  /**
   * Number of admitted hotspots with at least one detection.
   *
   * @return hotspot count
   */
  public int totalHotspotsDetected() {
    return hotspots.size();
  }

  /**
   * Rate of the top-ranked hotspot.
   *
   * @return highest rate, 0 when no hotspot is ranked
   */
  public double highestRate() {
    return hotspots.isEmpty() ? 0.0 : hotspots.get(0).occurrence().rate();
  }

  /**
   * Leading slice of the ranking for summary views.
   *
   * @param limit maximum number of entries
   * @return first {@code limit} ranked hotspots
   */
  public List<RankedHotspot> top(int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must not be negative");
    }
    return hotspots.subList(0, Math.min(limit, hotspots.size()));
  }
}

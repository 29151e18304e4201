package org.birdguide.hotspot.domain;

import java.util.List;
import java.util.Objects;

/**
 * Inverse view: every species detected at one admitted hotspot.
 *
 * @param hotspot hotspot attributes
 * @param totalChecklists complete checklists at the hotspot
 * @param monthlyChecklists complete checklists per month
 * @param species occurrences at this hotspot, rate descending then species order
 */
public record HotspotGuide(
    Hotspot hotspot,
    long totalChecklists,
    MonthlyCounts monthlyChecklists,
    List<OccurrenceResult> species) {
  public HotspotGuide {
    Objects.requireNonNull(hotspot, "hotspot");
    Objects.requireNonNull(monthlyChecklists, "monthlyChecklists");
    species = List.copyOf(Objects.requireNonNull(species, "species"));
  }
}

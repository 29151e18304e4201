package org.birdguide.hotspot.domain;

import java.util.Objects;

/**
 * Finalized detections of one species at one locality.
 *
 * @param species species identity
 * @param localityId locality identifier
 * @param monthlyDetections distinct detecting checklists per month
 * @param abundance reported individual counts
 */
public record SpeciesHotspotTally(
    SpeciesKey species, String localityId, MonthlyCounts monthlyDetections, Abundance abundance) {
  public SpeciesHotspotTally {
    Objects.requireNonNull(species, "species");
    Objects.requireNonNull(localityId, "localityId");
    Objects.requireNonNull(monthlyDetections, "monthlyDetections");
    abundance = abundance == null ? Abundance.NONE : abundance;
  }

  public long detectionCount() {
    return monthlyDetections.total();
  }
}

package org.birdguide.hotspot.domain;

import java.util.Objects;

/**
 * One normalized row of the eBird sampling-event file: checklist-level attributes only.
 *
 * @param checklistId sampling event identifier
 * @param localityId locality identifier; never blank
 * @param localityName locality display name
 * @param latitude decimal degrees
 * @param longitude decimal degrees
 * @param localityType hotspot or personal location
 * @param allSpeciesReported whether the checklist is complete
 * @param observationMonth month of the observation date, 1..12
 */
public record ChecklistRecord(
    String checklistId,
    String localityId,
    String localityName,
    double latitude,
    double longitude,
    LocalityType localityType,
    boolean allSpeciesReported,
    int observationMonth) {

  public ChecklistRecord {
    Objects.requireNonNull(checklistId, "checklistId");
    Objects.requireNonNull(localityId, "localityId");
    Objects.requireNonNull(localityName, "localityName");
    Objects.requireNonNull(localityType, "localityType");
    if (checklistId.isBlank()) {
      throw new IllegalArgumentException("checklistId must not be blank");
    }
    if (localityId.isBlank()) {
      throw new IllegalArgumentException("localityId must not be blank");
    }
    MonthlyCounts.requireMonth(observationMonth);
  }

  /**
   * Whether this checklist counts toward a hotspot's denominator.
   *
   * @return {@code true} for complete checklists at hotspots
   */
  public boolean qualifies() {
    return localityType == LocalityType.HOTSPOT && allSpeciesReported;
  }

  /**
   * Hotspot descriptor built from this row.
   *
   * @return hotspot attributes
   */
  public Hotspot hotspot() {
    return new Hotspot(localityId, localityName, latitude, longitude);
  }
}

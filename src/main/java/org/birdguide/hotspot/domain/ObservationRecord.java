package org.birdguide.hotspot.domain;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * One normalized row of the eBird observation file: a single species reported on a single checklist.
 *
 * @param checklistId sampling event identifier ({@code S...})
 * @param localityId locality identifier; never blank
 * @param localityName locality display name
 * @param latitude decimal degrees
 * @param longitude decimal degrees
 * @param localityType hotspot or personal location
 * @param allSpeciesReported whether the checklist is complete
 * @param category taxonomic category of the row
 * @param species common and scientific name
 * @param observationMonth month of the observation date, 1..12
 * @param individualCount numeric {@code OBSERVATION COUNT}; empty for presence-only ({@code X}) reports
 */
public record ObservationRecord(
    String checklistId,
    String localityId,
    String localityName,
    double latitude,
    double longitude,
    LocalityType localityType,
    boolean allSpeciesReported,
    TaxonCategory category,
    SpeciesKey species,
    int observationMonth,
    OptionalInt individualCount) {

  public ObservationRecord {
    Objects.requireNonNull(checklistId, "checklistId");
    Objects.requireNonNull(localityId, "localityId");
    Objects.requireNonNull(localityName, "localityName");
    Objects.requireNonNull(localityType, "localityType");
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(species, "species");
    individualCount = individualCount == null ? OptionalInt.empty() : individualCount;
    if (checklistId.isBlank()) {
      throw new IllegalArgumentException("checklistId must not be blank");
    }
    if (localityId.isBlank()) {
      throw new IllegalArgumentException("localityId must not be blank");
    }
    MonthlyCounts.requireMonth(observationMonth);
  }
}

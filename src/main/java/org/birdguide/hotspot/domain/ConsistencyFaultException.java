package org.birdguide.hotspot.domain;

/**
 * Raised when derived tallies contradict each other, e.g. more detections than checklists at a hotspot.
 *
 * <p>This signals a dedup or filter defect upstream, never bad input, so the build aborts instead of
 * clamping the rate.</p>
 */
public final class ConsistencyFaultException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final transient SpeciesKey species;
  private final String localityId;
  private final long detections;
  private final long checklists;

  /**
   * Creates a fault describing the offending pair.
   *
   * @param species species of the offending tally
   * @param localityId locality of the offending tally
   * @param detections detection count
   * @param checklists checklist total
   * @param detail what was violated
   */
  public ConsistencyFaultException(
      SpeciesKey species, String localityId, long detections, long checklists, String detail) {
    super(detail + " for " + species + " at " + localityId
        + " (detections=" + detections + ", checklists=" + checklists + ")");
    this.species = species;
    this.localityId = localityId;
    this.detections = detections;
    this.checklists = checklists;
  }

  public SpeciesKey species() {
    return species;
  }

  public String localityId() {
    return localityId;
  }

  public long detections() {
    return detections;
  }

  public long checklists() {
    return checklists;
  }
}

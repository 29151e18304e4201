package org.birdguide.hotspot.infrastructure.source;

import java.nio.file.Path;
import org.birdguide.hotspot.application.port.MetricsPort;
import org.birdguide.hotspot.domain.ChecklistRecord;
import org.birdguide.hotspot.domain.LocalityType;
import org.birdguide.hotspot.domain.ObservationRecord;
import org.birdguide.hotspot.domain.TaxonCategory;

/**
 * Factories for the two eBird inputs with their admission filters.
 *
 * <p>Both filters admit hotspot rows only; completeness is left to the accumulators so incomplete checklists
 * are counted there.</p>
 *
 * @since 0.1.0
 */
public final class EbirdSources {
  private EbirdSources() {
    // Utility
  }

  /**
   * Sampling-event file, one row per checklist.
   *
   * @param file sampling file
   * @param chunkSize rows per chunk
   * @param metrics metrics sink
   * @return checklist source
   */
  public static TsvRecordSource<ChecklistRecord> checklists(Path file, int chunkSize, MetricsPort metrics) {
    return new TsvRecordSource<>(
        file,
        "sampling",
        chunkSize,
        new ChecklistRowMapper(),
        record -> record.localityType() == LocalityType.HOTSPOT,
        metrics);
  }

  /**
   * Observation file, one row per species per checklist.
   *
   * @param file observation file
   * @param chunkSize rows per chunk
   * @param metrics metrics sink
   * @return observation source admitting species-level hotspot rows
   */
  public static TsvRecordSource<ObservationRecord> observations(Path file, int chunkSize, MetricsPort metrics) {
    return new TsvRecordSource<>(
        file,
        "observations",
        chunkSize,
        new ObservationRowMapper(),
        record -> record.localityType() == LocalityType.HOTSPOT && record.category() == TaxonCategory.SPECIES,
        metrics);
  }
}

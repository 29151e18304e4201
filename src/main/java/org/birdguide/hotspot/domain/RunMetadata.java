package org.birdguide.hotspot.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Aggregate facts about one guide build, published as {@code metadata.json}.
 *
 * @param generatedAt build completion time
 * @param version software version
 * @param mainFile observation file name
 * @param samplingFile sampling-event file name
 * @param thresholds thresholds in force
 * @param seasons season partition in force
 * @param topN summary list length
 * @param samplingStats row accounting of the checklist pass
 * @param observationStats row accounting of the detection pass
 * @param totalQualifyingChecklists distinct complete hotspot checklists, all hotspots
 * @param hotspotsIncluded hotspots at or above the minimum
 * @param hotspotsExcludedBelowMinimum hotspots with 1..(minimum-1) checklists
 * @param speciesCount species with at least one ranked hotspot
 * @param duplicateChecklistRows repeated sampling rows for an already counted checklist
 * @param duplicateDetectionRows repeated species rows within one checklist
 * @param incompleteChecklistRows observation rows dropped because the checklist was incomplete
 * @param pairsWithoutChecklists species-hotspot tallies whose hotspot had no complete checklist total
 */
public record RunMetadata(
    Instant generatedAt,
    String version,
    String mainFile,
    String samplingFile,
    GuideThresholds thresholds,
    SeasonPartition seasons,
    int topN,
    SourceStats samplingStats,
    SourceStats observationStats,
    long totalQualifyingChecklists,
    int hotspotsIncluded,
    int hotspotsExcludedBelowMinimum,
    int speciesCount,
    long duplicateChecklistRows,
    long duplicateDetectionRows,
    long incompleteChecklistRows,
    long pairsWithoutChecklists) {
  public RunMetadata {
    Objects.requireNonNull(generatedAt, "generatedAt");
    Objects.requireNonNull(version, "version");
    Objects.requireNonNull(mainFile, "mainFile");
    Objects.requireNonNull(samplingFile, "samplingFile");
    Objects.requireNonNull(thresholds, "thresholds");
    Objects.requireNonNull(seasons, "seasons");
    Objects.requireNonNull(samplingStats, "samplingStats");
    Objects.requireNonNull(observationStats, "observationStats");
  }
}

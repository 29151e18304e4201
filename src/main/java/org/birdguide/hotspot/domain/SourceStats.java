package org.birdguide.hotspot.domain;

import java.util.Objects;

/**
 * Row accounting for one traversal of an input file.
 *
 * @param source file name or logical source label
 * @param rowsRead data rows read, header excluded
 * @param rowsAdmitted rows handed to the accumulator
 * @param rowsFiltered well-formed rows rejected by the admission filter
 * @param rowsSkipped malformed rows dropped
 * @param chunks number of chunks read
 */
public record SourceStats(
    String source, long rowsRead, long rowsAdmitted, long rowsFiltered, long rowsSkipped, long chunks) {
  public SourceStats {
    Objects.requireNonNull(source, "source");
    if (rowsAdmitted + rowsFiltered + rowsSkipped != rowsRead) {
      throw new IllegalArgumentException("row accounting for " + source + " does not add up");
    }
  }

  /**
   * Statistics for a source that produced nothing.
   *
   * @param source label
   * @return zeroed statistics
   */
  public static SourceStats empty(String source) {
    return new SourceStats(source, 0, 0, 0, 0, 0);
  }
}

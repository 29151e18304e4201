package org.birdguide.hotspot.domain;

/**
 * Individual counts reported alongside detections of a species at a hotspot.
 *
 * @param totalIndividuals sum of numeric {@code OBSERVATION COUNT} values, one per detecting checklist
 * @param countedDetections detections that reported a numeric count rather than presence ({@code X})
 * @param maxCount largest single numeric count
 */
public record Abundance(long totalIndividuals, long countedDetections, long maxCount) {
  /** No numeric counts reported. */
  public static final Abundance NONE = new Abundance(0, 0, 0);

  public Abundance {
    if (totalIndividuals < 0 || countedDetections < 0 || maxCount < 0) {
      throw new IllegalArgumentException("abundance counts must not be negative");
    }
    if (maxCount > totalIndividuals) {
      throw new IllegalArgumentException("maxCount must not exceed totalIndividuals");
    }
    if (countedDetections == 0 && totalIndividuals > 0) {
      throw new IllegalArgumentException("individuals reported without a counted detection");
    }
  }

  /**
   * Whether any detection reported a positive individual count.
   *
   * @return {@code false} when every detection was presence-only or counted zero birds
   */
  public boolean hasCounts() {
    return totalIndividuals > 0;
  }
}

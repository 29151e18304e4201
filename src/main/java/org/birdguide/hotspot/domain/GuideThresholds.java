package org.birdguide.hotspot.domain;

/**
 * Checklist-count thresholds for hotspot inclusion and confidence tiers.
 *
 * @param minChecklists hotspots with fewer complete checklists are excluded from every output
 * @param mediumMin smallest checklist count rated {@link Confidence#MEDIUM}
 * @param highMin smallest checklist count rated {@link Confidence#HIGH}
 */
public record GuideThresholds(int minChecklists, int mediumMin, int highMin) {
  private static final GuideThresholds DEFAULTS = new GuideThresholds(10, 30, 100);

  public GuideThresholds {
    if (minChecklists < 1) {
      throw new IllegalArgumentException("minChecklists must be at least 1 (was " + minChecklists + ")");
    }
    if (mediumMin < minChecklists) {
      throw new IllegalArgumentException(
          "mediumMin (" + mediumMin + ") must not be lower than minChecklists (" + minChecklists + ")");
    }
    if (mediumMin >= highMin) {
      throw new IllegalArgumentException(
          "mediumMin (" + mediumMin + ") must be lower than highMin (" + highMin + ")");
    }
  }

  /**
   * Defaults: 10 checklists to be included, 30 for medium, 100 for high.
   *
   * @return default thresholds
   */
  public static GuideThresholds defaults() {
    return DEFAULTS;
  }

  /**
   * Whether a hotspot with this many checklists is included in outputs.
   *
   * @param checklists complete checklist total
   * @return {@code true} when at or above {@link #minChecklists()}
   */
  public boolean admits(long checklists) {
    return checklists >= minChecklists;
  }

  /**
   * Confidence tier for an admitted checklist total.
   *
   * @param checklists complete checklist total
   * @return tier
   */
  public Confidence confidenceFor(long checklists) {
    if (checklists >= highMin) {
      return Confidence.HIGH;
    }
    if (checklists >= mediumMin) {
      return Confidence.MEDIUM;
    }
    return Confidence.LOW;
  }
}

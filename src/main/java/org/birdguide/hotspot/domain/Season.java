package org.birdguide.hotspot.domain;

import java.util.Locale;

/** Named seasonal bucket; the month assignment lives in {@link SeasonPartition}. */
public enum Season {
  SPRING("spring"),
  SUMMER("summer"),
  FALL("fall"),
  WINTER("winter");

  private final String key;

  Season(String key) {
    this.key = key;
  }

  /**
   * Returns the lowercase key used in configuration and JSON output.
   *
   * @return season key such as {@code "spring"}
   */
  public String key() {
    return key;
  }

  /**
   * Resolves a season from its key.
   *
   * @param key case-insensitive season key
   * @return matching season
   * @throws IllegalArgumentException when no season uses the key
   */
  public static Season fromKey(String key) {
    if (key != null) {
      String normalized = key.trim().toLowerCase(Locale.ROOT);
      for (Season season : values()) {
        if (season.key.equals(normalized)) {
          return season;
        }
      }
    }
    throw new IllegalArgumentException("Unknown season: " + key);
  }
}

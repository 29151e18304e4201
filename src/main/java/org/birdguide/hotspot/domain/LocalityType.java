package org.birdguide.hotspot.domain;

import java.util.Locale;

/**
 * Location class of an eBird checklist.
 *
 * <p>eBird exports use {@code H} for public hotspots and several codes ({@code P}, {@code T}, {@code C},
 * {@code S}, {@code PC}) for personal or administrative locations; only hotspots are ranked, so every
 * non-hotspot code collapses into {@link #PERSONAL}.</p>
 */
public enum LocalityType {
  HOTSPOT,
  PERSONAL;

  /**
   * Maps the {@code LOCALITY TYPE} column value.
   *
   * @param code raw column value
   * @return parsed locality type
   * @throws IllegalArgumentException when the code is blank
   */
  public static LocalityType fromCode(String code) {
    if (code == null || code.isBlank()) {
      throw new IllegalArgumentException("locality type must not be blank");
    }
    return code.trim().toUpperCase(Locale.ROOT).equals("H") ? HOTSPOT : PERSONAL;
  }
}

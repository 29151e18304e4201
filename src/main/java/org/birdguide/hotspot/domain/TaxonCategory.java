package org.birdguide.hotspot.domain;

import java.util.Locale;

/**
 * eBird taxonomic category of an observation row. Only {@link #SPECIES} rows count as detections.
 */
public enum TaxonCategory {
  SPECIES,
  HYBRID,
  SLASH,
  SPUH,
  ISSF,
  OTHER;

  /**
   * Maps the {@code CATEGORY} column value; {@code form}, {@code domestic} and {@code intergrade} map to
   * {@link #OTHER}.
   *
   * @param code raw column value
   * @return parsed category
   * @throws IllegalArgumentException when the code is blank
   */
  public static TaxonCategory fromCode(String code) {
    if (code == null || code.isBlank()) {
      throw new IllegalArgumentException("category must not be blank");
    }
    return switch (code.trim().toLowerCase(Locale.ROOT)) {
      case "species" -> SPECIES;
      case "hybrid" -> HYBRID;
      case "slash" -> SLASH;
      case "spuh" -> SPUH;
      case "issf" -> ISSF;
      default -> OTHER;
    };
  }
}

package org.birdguide.hotspot.application.port;

/**
 * Relative locations of the documents making up a published guide.
 *
 * @since 0.1.0
 */
public final class GuideLayout {
  public static final String METADATA = "metadata.json";
  public static final String SPECIES_DIR = "species";
  public static final String HOTSPOTS_DIR = "hotspots";
  public static final String INDEX_DIR = "index";
  public static final String SPECIES_INDEX = INDEX_DIR + "/species_index.json";
  public static final String HOTSPOT_INDEX = INDEX_DIR + "/hotspot_index.json";
  public static final String EXTENSION = ".json";

  /** Decimal places kept for rates in published documents. */
  public static final int RATE_DECIMAL_PLACES = 4;

  private GuideLayout() {
    // Utility
  }

  public static String speciesDocument(String slug) {
    return SPECIES_DIR + "/" + slug + EXTENSION;
  }

  public static String hotspotDocument(String localityId) {
    return HOTSPOTS_DIR + "/" + localityId + EXTENSION;
  }
}

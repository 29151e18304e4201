package org.birdguide.hotspot.domain;

import java.util.Objects;

/**
 * Descriptive attributes of a hotspot, taken from the first qualifying checklist seen for it.
 *
 * @param localityId eBird locality identifier ({@code L...})
 * @param name hotspot display name
 * @param latitude decimal degrees
 * @param longitude decimal degrees
 */
public record Hotspot(String localityId, String name, double latitude, double longitude) {
  public Hotspot {
    Objects.requireNonNull(localityId, "localityId");
    Objects.requireNonNull(name, "name");
    if (localityId.isBlank()) {
      throw new IllegalArgumentException("localityId must not be blank");
    }
  }
}

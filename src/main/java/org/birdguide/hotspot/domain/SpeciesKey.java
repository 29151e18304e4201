package org.birdguide.hotspot.domain;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of a species: English common name plus scientific name.
 *
 * @param commonName eBird common name, e.g. {@code Blue Grosbeak}
 * @param scientificName eBird scientific name, e.g. {@code Passerina caerulea}
 */
public record SpeciesKey(String commonName, String scientificName) implements Comparable<SpeciesKey> {
  private static final Comparator<SpeciesKey> ORDER =
      Comparator.comparing(SpeciesKey::commonName).thenComparing(SpeciesKey::scientificName);

  public SpeciesKey {
    Objects.requireNonNull(commonName, "commonName");
    Objects.requireNonNull(scientificName, "scientificName");
    if (commonName.isBlank()) {
      throw new IllegalArgumentException("commonName must not be blank");
    }
  }

  @Override
  public int compareTo(SpeciesKey other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return commonName + " (" + scientificName + ")";
  }
}

package org.birdguide.hotspot.domain;

import java.util.List;
import java.util.Objects;

/**
 * Complete result of a build: both views plus run metadata, ready for publication.
 *
 * @param species per-species rankings in species order
 * @param hotspots per-hotspot views in locality order
 * @param metadata run metadata
 */
public record GuideBuild(List<SpeciesGuide> species, List<HotspotGuide> hotspots, RunMetadata metadata) {
  public GuideBuild {
    species = List.copyOf(Objects.requireNonNull(species, "species"));
    hotspots = List.copyOf(Objects.requireNonNull(hotspots, "hotspots"));
    Objects.requireNonNull(metadata, "metadata");
  }
}

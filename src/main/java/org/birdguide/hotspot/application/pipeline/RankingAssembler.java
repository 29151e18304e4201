package org.birdguide.hotspot.application.pipeline;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.birdguide.hotspot.domain.HotspotGuide;
import org.birdguide.hotspot.domain.HotspotTally;
import org.birdguide.hotspot.domain.OccurrenceResult;
import org.birdguide.hotspot.domain.RankedHotspot;
import org.birdguide.hotspot.domain.SpeciesGuide;
import org.birdguide.hotspot.domain.SpeciesKey;

/**
 * <strong>What:</strong> Orders occurrences into per-species rankings and per-hotspot listings.
 * <p><strong>Why:</strong> Published rankings must be identical for identical input regardless of the order the
 * rows arrived in.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Sort by rate descending with the locality id as ascending tie-break.</li>
 *   <li>Assign strict ranks 1..n without gaps or shared positions.</li>
 *   <li>Build the inverse view listing every species at each admitted hotspot.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @implNote Rates are compared as exact fractions by cross-multiplication so two rates that are equal as
 * fractions always tie, whatever their floating-point rendering.
 * @since 0.1.0
 */
public final class RankingAssembler {
  /** Rate descending, then locality id ascending. */
  public static final Comparator<OccurrenceResult> BY_RATE_THEN_LOCALITY =
      RankingAssembler::compareRateDescending;

  private static final Comparator<OccurrenceResult> RANKING =
      BY_RATE_THEN_LOCALITY.thenComparing(OccurrenceResult::localityId);

  private static final Comparator<OccurrenceResult> HOTSPOT_LISTING =
      BY_RATE_THEN_LOCALITY.thenComparing(OccurrenceResult::species);

  /**
   * Ranks the occurrences of one species.
   *
   * @param species species identity
   * @param occurrences occurrences of that species, any order
   * @return ranked guide containing every occurrence
   * @throws IllegalArgumentException if an occurrence belongs to another species
   */
  public SpeciesGuide rank(SpeciesKey species, Collection<OccurrenceResult> occurrences) {
    Objects.requireNonNull(species, "species");
    List<OccurrenceResult> sorted = new ArrayList<>(Objects.requireNonNull(occurrences, "occurrences"));
    for (OccurrenceResult occurrence : sorted) {
      if (!occurrence.species().equals(species)) {
        throw new IllegalArgumentException(occurrence.species() + " does not belong to ranking of " + species);
      }
    }
    sorted.sort(RANKING);
    List<RankedHotspot> ranked = new ArrayList<>(sorted.size());
    for (int i = 0; i < sorted.size(); i++) {
      ranked.add(new RankedHotspot(i + 1, sorted.get(i)));
    }
    return new SpeciesGuide(species, ranked);
  }

  /**
   * Ranks every species of a calculation.
   *
   * @param calculation calculator output
   * @return guides in species order
   */
  public List<SpeciesGuide> rankAll(OccurrenceCalculation calculation) {
    Objects.requireNonNull(calculation, "calculation");
    List<SpeciesGuide> guides = new ArrayList<>(calculation.bySpecies().size());
    calculation.bySpecies().forEach((species, results) -> guides.add(rank(species, results)));
    return guides;
  }

  /**
   * Builds the per-hotspot view. Every admitted hotspot appears, including those with no detections.
   *
   * @param admitted admitted hotspot tallies in locality order
   * @param calculation calculator output
   * @return hotspot guides in the order of {@code admitted}
   */
  public List<HotspotGuide> byHotspot(Collection<HotspotTally> admitted, OccurrenceCalculation calculation) {
    Objects.requireNonNull(admitted, "admitted");
    Objects.requireNonNull(calculation, "calculation");
    Map<String, List<OccurrenceResult>> byLocality = new HashMap<>();
    for (List<OccurrenceResult> results : calculation.bySpecies().values()) {
      for (OccurrenceResult result : results) {
        byLocality.computeIfAbsent(result.localityId(), id -> new ArrayList<>()).add(result);
      }
    }
    List<HotspotGuide> guides = new ArrayList<>(admitted.size());
    for (HotspotTally tally : admitted) {
      List<OccurrenceResult> species = byLocality.getOrDefault(tally.localityId(), new ArrayList<>());
      species.sort(HOTSPOT_LISTING);
      guides.add(new HotspotGuide(tally.hotspot(), tally.checklistCount(), tally.monthlyChecklists(), species));
    }
    return guides;
  }

  private static int compareRateDescending(OccurrenceResult left, OccurrenceResult right) {
    long leftScaled = Math.multiplyExact(left.detectionCount(), right.totalChecklists());
    long rightScaled = Math.multiplyExact(right.detectionCount(), left.totalChecklists());
    return Long.compare(rightScaled, leftScaled);
  }
}

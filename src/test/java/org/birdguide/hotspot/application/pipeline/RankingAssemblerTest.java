package org.birdguide.hotspot.application.pipeline;

import static org.birdguide.hotspot.application.pipeline.OccurrenceCalculatorTest.checklistsIn;
import static org.birdguide.hotspot.application.pipeline.OccurrenceCalculatorTest.counts;
import static org.birdguide.hotspot.application.pipeline.OccurrenceCalculatorTest.hotspot;
import static org.birdguide.hotspot.testutil.Records.AMERICAN_ROBIN;
import static org.birdguide.hotspot.testutil.Records.BLUE_GROSBEAK;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.birdguide.hotspot.domain.Abundance;
import org.birdguide.hotspot.domain.GuideThresholds;
import org.birdguide.hotspot.domain.HotspotGuide;
import org.birdguide.hotspot.domain.OccurrenceResult;
import org.birdguide.hotspot.domain.RankedHotspot;
import org.birdguide.hotspot.domain.SeasonPartition;
import org.birdguide.hotspot.domain.SpeciesGuide;
import org.birdguide.hotspot.domain.SpeciesHotspotTally;
import org.birdguide.hotspot.domain.SpeciesKey;
import org.junit.jupiter.api.Test;

class RankingAssemblerTest {
  private final OccurrenceCalculator calculator =
      new OccurrenceCalculator(GuideThresholds.defaults(), SeasonPartition.defaults());
  private final RankingAssembler assembler = new RankingAssembler();

  @Test
  void ranksByRateDescendingWithLocalityTieBreak() {
    List<OccurrenceResult> results = new ArrayList<>(List.of(
        occurrence(BLUE_GROSBEAK, "L3", 2, 10),
        occurrence(BLUE_GROSBEAK, "L2", 5, 10),
        occurrence(BLUE_GROSBEAK, "L1", 10, 20),
        occurrence(BLUE_GROSBEAK, "L4", 9, 10)));

    SpeciesGuide guide = assembler.rank(BLUE_GROSBEAK, results);

    assertEquals(List.of("L4", "L1", "L2", "L3"), localities(guide));
    assertEquals(List.of(1, 2, 3, 4), guide.hotspots().stream().map(RankedHotspot::rank).toList());
    assertEquals(0.9, guide.highestRate());
    assertEquals(26, guide.totalDetections());
    assertEquals(4, guide.totalHotspotsDetected());
  }

  @Test
  void orderIsIndependentOfInputOrder() {
    List<OccurrenceResult> results = new ArrayList<>(List.of(
        occurrence(BLUE_GROSBEAK, "L5", 1, 3),
        occurrence(BLUE_GROSBEAK, "L2", 10, 30),
        occurrence(BLUE_GROSBEAK, "L9", 4, 12),
        occurrence(BLUE_GROSBEAK, "L1", 7, 10)));
    List<String> expected = localities(assembler.rank(BLUE_GROSBEAK, results));

    for (int i = 0; i < 5; i++) {
      Collections.reverse(results);
      Collections.rotate(results, i);
      assertEquals(expected, localities(assembler.rank(BLUE_GROSBEAK, results)));
    }
    assertEquals(List.of("L1", "L2", "L5", "L9"), expected);
  }

  @Test
  void comparesExactFractions() {
    // 1/3 and 333333/1000000 differ only after the sixth decimal
    OccurrenceResult third = occurrence(BLUE_GROSBEAK, "L2", 1, 3);
    OccurrenceResult almost = occurrence(BLUE_GROSBEAK, "L1", 333_333, 1_000_000);

    SpeciesGuide guide = assembler.rank(BLUE_GROSBEAK, List.of(almost, third));

    assertEquals(List.of("L2", "L1"), localities(guide));
  }

  @Test
  void topIsBoundedByAvailableHotspots() {
    SpeciesGuide guide = assembler.rank(BLUE_GROSBEAK, List.of(
        occurrence(BLUE_GROSBEAK, "L1", 1, 10), occurrence(BLUE_GROSBEAK, "L2", 2, 10)));

    assertEquals(1, guide.top(1).size());
    assertEquals(2, guide.top(10).size());
  }

  @Test
  void rejectsOccurrenceOfAnotherSpecies() {
    assertThrows(IllegalArgumentException.class,
        () -> assembler.rank(BLUE_GROSBEAK, List.of(occurrence(AMERICAN_ROBIN, "L1", 1, 10))));
  }

  @Test
  void hotspotViewListsSpeciesByRateThenName() {
    OccurrenceCalculation calculation = new OccurrenceCalculation(Map.of(
        BLUE_GROSBEAK, List.of(occurrence(BLUE_GROSBEAK, "L1", 5, 10)),
        AMERICAN_ROBIN, List.of(occurrence(AMERICAN_ROBIN, "L1", 5, 10))), 0, 0);

    List<HotspotGuide> hotspots = assembler.byHotspot(
        List.of(hotspot("L1", checklistsIn(6, 10)), hotspot("L7", checklistsIn(6, 12))), calculation);

    assertEquals(2, hotspots.size());
    assertEquals(List.of(AMERICAN_ROBIN, BLUE_GROSBEAK),
        hotspots.get(0).species().stream().map(OccurrenceResult::species).toList());
    assertEquals("L7", hotspots.get(1).hotspot().localityId());
    assertTrue(hotspots.get(1).species().isEmpty());
    assertEquals(12, hotspots.get(1).totalChecklists());
  }

  private OccurrenceResult occurrence(SpeciesKey species, String localityId, int detections, int checklists) {
    SpeciesHotspotTally tally = new SpeciesHotspotTally(species, localityId, counts(6, detections), Abundance.NONE);
    return calculator.calculate(tally, hotspot(localityId, checklistsIn(6, checklists))).orElseThrow();
  }

  private static List<String> localities(SpeciesGuide guide) {
    return guide.hotspots().stream().map(ranked -> ranked.occurrence().localityId()).toList();
  }
}

package org.birdguide.hotspot.application.pipeline;

import static org.birdguide.hotspot.testutil.Records.BLUE_GROSBEAK;
import static org.birdguide.hotspot.testutil.Records.detection;
import static org.birdguide.hotspot.testutil.Records.incompleteDetection;
import static org.birdguide.hotspot.testutil.Records.spuh;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.OptionalInt;
import org.birdguide.hotspot.domain.DetectionTotals;
import org.birdguide.hotspot.domain.SpeciesHotspotTally;
import org.birdguide.hotspot.testutil.RecordingMetricsPort;
import org.junit.jupiter.api.Test;

class DetectionAccumulatorTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final DetectionAccumulator accumulator = new DetectionAccumulator(metrics);

  @Test
  void sameSpeciesTwiceOnOneChecklistContributesOnce() {
    assertTrue(accumulator.accept(detection(BLUE_GROSBEAK, "S1", "L1", 6, OptionalInt.of(1))));
    assertFalse(accumulator.accept(detection(BLUE_GROSBEAK, "S1", "L1", 6, OptionalInt.of(5))));

    DetectionTotals totals = accumulator.finish();
    SpeciesHotspotTally tally = totals.bySpecies().get(BLUE_GROSBEAK).get("L1");

    assertEquals(1, tally.detectionCount());
    assertEquals(1, tally.abundance().totalIndividuals());
    assertEquals(1, tally.abundance().maxCount());
    assertEquals(1, totals.duplicateRows());
    assertEquals(1, metrics.count("guide.detections.duplicate"));
  }

  @Test
  void checklistsAreDedupedWithinEachMonthBucket() {
    assertTrue(accumulator.accept(detection(BLUE_GROSBEAK, "S1", "L1", 6, OptionalInt.of(2))));
    assertTrue(accumulator.accept(detection(BLUE_GROSBEAK, "S1", "L1", 7, OptionalInt.of(4))));
    assertFalse(accumulator.accept(detection(BLUE_GROSBEAK, "S1", "L1", 7, OptionalInt.of(9))));

    SpeciesHotspotTally tally = accumulator.finish().bySpecies().get(BLUE_GROSBEAK).get("L1");

    assertEquals(1, tally.monthlyDetections().get(6));
    assertEquals(1, tally.monthlyDetections().get(7));
    assertEquals(6, tally.abundance().totalIndividuals());
    assertEquals(4, tally.abundance().maxCount());
  }

  @Test
  void tracksMonthlyDetectionsAndAbundance() {
    accumulator.accept(detection(BLUE_GROSBEAK, "S1", "L1", 6, OptionalInt.of(1)));
    accumulator.accept(detection(BLUE_GROSBEAK, "S2", "L1", 6, OptionalInt.of(2)));
    accumulator.accept(detection(BLUE_GROSBEAK, "S3", "L1", 6, OptionalInt.empty()));
    accumulator.accept(detection(BLUE_GROSBEAK, "S4", "L1", 7, OptionalInt.of(3)));
    accumulator.accept(detection(BLUE_GROSBEAK, "S5", "L1", 7, OptionalInt.of(2)));

    SpeciesHotspotTally tally = accumulator.finish().bySpecies().get(BLUE_GROSBEAK).get("L1");

    assertEquals(5, tally.detectionCount());
    assertEquals(3, tally.monthlyDetections().get(6));
    assertEquals(2, tally.monthlyDetections().get(7));
    assertEquals(8, tally.abundance().totalIndividuals());
    assertEquals(4, tally.abundance().countedDetections());
    assertEquals(3, tally.abundance().maxCount());
  }

  @Test
  void incompleteChecklistsAndNonSpeciesTaxaAreIgnored() {
    assertFalse(accumulator.accept(incompleteDetection(BLUE_GROSBEAK, "S1", "L1", 6)));
    assertFalse(accumulator.accept(spuh("S2", "L1", 6)));

    DetectionTotals totals = accumulator.finish();

    assertTrue(totals.bySpecies().isEmpty());
    assertEquals(1, totals.incompleteRows());
    assertEquals(1, totals.rejectedRows());
    assertEquals(0, totals.pairCount());
  }

  @Test
  void pairsAreKeyedBySpeciesAndLocality() {
    accumulator.accept(detection(BLUE_GROSBEAK, "S1", "L1", 6));
    accumulator.accept(detection(BLUE_GROSBEAK, "S9", "L2", 6));

    DetectionTotals totals = accumulator.finish();

    assertEquals(2, totals.pairCount());
    assertEquals(2, metrics.count("guide.detections.counted"));
  }
}

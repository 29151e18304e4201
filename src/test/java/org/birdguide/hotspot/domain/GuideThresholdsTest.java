package org.birdguide.hotspot.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class GuideThresholdsTest {

  @Test
  void defaultConfidenceBoundaries() {
    GuideThresholds thresholds = GuideThresholds.defaults();

    assertEquals(Confidence.HIGH, thresholds.confidenceFor(100));
    assertEquals(Confidence.MEDIUM, thresholds.confidenceFor(99));
    assertEquals(Confidence.MEDIUM, thresholds.confidenceFor(30));
    assertEquals(Confidence.LOW, thresholds.confidenceFor(29));
    assertEquals(Confidence.LOW, thresholds.confidenceFor(10));
  }

  @Test
  void admitsFromMinimumInclusive() {
    GuideThresholds thresholds = GuideThresholds.defaults();

    assertTrue(thresholds.admits(10));
    assertFalse(thresholds.admits(9));
    assertFalse(thresholds.admits(0));
  }

  @Test
  void rejectsInconsistentThresholds() {
    assertThrows(IllegalArgumentException.class, () -> new GuideThresholds(0, 30, 100));
    assertThrows(IllegalArgumentException.class, () -> new GuideThresholds(40, 30, 100));
    assertThrows(IllegalArgumentException.class, () -> new GuideThresholds(10, 100, 100));
  }

  @Test
  void confidenceWireValuesAreLowercase() {
    assertEquals("high", Confidence.HIGH.wireValue());
    assertEquals("medium", Confidence.MEDIUM.wireValue());
    assertEquals("low", Confidence.LOW.wireValue());
  }
}

package org.birdguide.hotspot.infrastructure.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.birdguide.hotspot.domain.Abundance;
import org.birdguide.hotspot.domain.Confidence;
import org.birdguide.hotspot.domain.GuideThresholds;
import org.birdguide.hotspot.domain.Hotspot;
import org.birdguide.hotspot.domain.HotspotGuide;
import org.birdguide.hotspot.domain.MonthlyCounts;
import org.birdguide.hotspot.domain.OccurrenceResult;
import org.birdguide.hotspot.domain.RankedHotspot;
import org.birdguide.hotspot.domain.Season;
import org.birdguide.hotspot.domain.SpeciesGuide;
import org.birdguide.hotspot.domain.SpeciesKey;
import org.junit.jupiter.api.Test;

class JsonGuideWriterTest {
  private static final SpeciesKey GROSBEAK = new SpeciesKey("Blue Grosbeak", "Passerina caerulea");
  private static final Hotspot PARK = new Hotspot("L1", "Riverside Park", 40.1, -75.2);

  private final JsonGuideWriter writer = new JsonGuideWriter();

  @Test
  void ratesRoundHalfUpToFourPlaces() {
    assertEquals(0.3333, JsonGuideWriter.rate(1.0 / 3.0));
    assertEquals(0.6667, JsonGuideWriter.rate(2.0 / 3.0));
    assertEquals(0.1235, JsonGuideWriter.rate(0.12345));
    assertEquals(1.0, JsonGuideWriter.rate(1.0));
    assertEquals(2.3, JsonGuideWriter.round(7.0 / 3.0, 1));
  }

  @Test
  void speciesDocumentCarriesRankedHotspotsAndSummary() throws IOException {
    OccurrenceResult occurrence = occurrence(3, 9, new Abundance(7, 3, 4));
    SpeciesGuide guide = new SpeciesGuide(GROSBEAK, List.of(new RankedHotspot(1, occurrence)));

    String json = write(out -> writer.writeSpecies(out, guide, 10, GuideThresholds.defaults()));

    assertTrue(json.contains("\"common_name\": \"Blue Grosbeak\""), json);
    assertTrue(json.contains("\"rank\": 1"), json);
    assertTrue(json.contains("\"rate\": 0.3333"), json);
    assertTrue(json.contains("\"confidence\": \"low\""), json);
    assertTrue(json.contains("\"avg_count\": 2.3"), json);
    assertTrue(json.contains("\"max_count\": 4"), json);
    assertTrue(json.contains("\"min_checklists\": 10"), json);
    assertTrue(json.contains("\n  \"summary\""), "two-space indentation expected: " + json);
  }

  @Test
  void presenceReportsCountTowardAverageCount() throws IOException {
    SpeciesGuide guide = new SpeciesGuide(GROSBEAK,
        List.of(new RankedHotspot(1, occurrence(3, 10, new Abundance(4, 1, 4)))));

    String json = write(out -> writer.writeSpecies(out, guide, 10, GuideThresholds.defaults()));

    assertTrue(json.contains("\"avg_count\": 1.3"), json);
    assertTrue(json.contains("\"max_count\": 4"), json);
  }

  @Test
  void presenceOnlyOccurrenceOmitsAbundance() throws IOException {
    HotspotGuide guide = new HotspotGuide(PARK, 3, MonthlyCounts.of(0, 0, 0, 0, 0, 3, 0, 0, 0, 0, 0, 0),
        List.of(occurrence(2, 3, Abundance.NONE)));

    String json = write(out -> writer.writeHotspot(out, guide));

    assertTrue(json.contains("\"rate\": 0.6667"), json);
    assertTrue(json.contains("\"total\": 3"), json);
    assertTrue(json.contains("\"total_species\": 1"), json);
    assertFalse(json.contains("avg_count"), json);
    assertFalse(json.contains("max_count"), json);
  }

  @Test
  void outputIsStableAcrossWrites() throws IOException {
    SpeciesGuide guide = new SpeciesGuide(GROSBEAK, List.of(new RankedHotspot(1, occurrence(1, 3, Abundance.NONE))));

    String first = write(out -> writer.writeSpecies(out, guide, 5, GuideThresholds.defaults()));
    String second = write(out -> writer.writeSpecies(out, guide, 5, GuideThresholds.defaults()));

    assertEquals(first, second);
    assertFalse(first.contains("\r"));
  }

  private interface Write {
    void to(ByteArrayOutputStream out) throws IOException;
  }

  private static String write(Write write) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    write.to(out);
    return out.toString(StandardCharsets.UTF_8);
  }

  private static OccurrenceResult occurrence(long detections, long checklists, Abundance abundance) {
    long[] monthly = new long[MonthlyCounts.MONTHS];
    monthly[5] = detections;
    Map<Integer, Double> monthlyRates = new TreeMap<>();
    for (int month = 1; month <= MonthlyCounts.MONTHS; month++) {
      monthlyRates.put(month, month == 6 ? (double) detections / checklists : 0.0);
    }
    Map<Season, Double> seasonal = new EnumMap<>(Season.class);
    for (Season season : Season.values()) {
      seasonal.put(season, season == Season.SUMMER ? (double) detections / checklists : 0.0);
    }
    return new OccurrenceResult(GROSBEAK, PARK, checklists, MonthlyCounts.of(monthly), Confidence.LOW,
        monthlyRates, seasonal, abundance);
  }
}

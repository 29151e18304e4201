package org.birdguide.hotspot.infrastructure.output;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import org.birdguide.hotspot.application.port.GuideLayout;
import org.birdguide.hotspot.domain.GuideThresholds;
import org.birdguide.hotspot.domain.Hotspot;
import org.birdguide.hotspot.domain.HotspotGuide;
import org.birdguide.hotspot.domain.MonthlyCounts;
import org.birdguide.hotspot.domain.OccurrenceResult;
import org.birdguide.hotspot.domain.RankedHotspot;
import org.birdguide.hotspot.domain.RunMetadata;
import org.birdguide.hotspot.domain.Season;
import org.birdguide.hotspot.domain.SourceStats;
import org.birdguide.hotspot.domain.SpeciesGuide;
import org.birdguide.hotspot.domain.SpeciesKey;

/**
 * <strong>What:</strong> Serializes guide views to JSON with Jackson's streaming generator.
 * <p><strong>Why:</strong> Species files can list thousands of hotspots; streaming keeps serialization free of an
 * intermediate tree.</p>
 * <p><strong>Format:</strong> two-space indentation, {@code "\n"} line breaks, rates rounded half-up to four
 * decimals, averages to one decimal. Nothing time-dependent is written outside {@code metadata.json}.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; each call creates its own generator.</p>
 *
 * @since 0.1.0
 */
public final class JsonGuideWriter {
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Writes {@code species/<slug>.json}.
   *
   * @param out destination; left open
   * @param guide ranked species
   * @param topN summary list length
   * @param thresholds thresholds in force
   * @throws IOException on write failure
   */
  public void writeSpecies(OutputStream out, SpeciesGuide guide, int topN, GuideThresholds thresholds)
      throws IOException {
    try (JsonGenerator gen = open(out)) {
      gen.writeStartObject();
      writeSpeciesKey(gen, "species", guide.species());
      gen.writeObjectFieldStart("summary");
      gen.writeNumberField("total_detections", guide.totalDetections());
      gen.writeNumberField("total_hotspots_detected", guide.totalHotspotsDetected());
      gen.writeNumberField("highest_occurrence_rate", rate(guide.highestRate()));
      gen.writeArrayFieldStart("top_hotspots");
      for (RankedHotspot ranked : guide.top(topN)) {
        gen.writeStartObject();
        gen.writeNumberField("rank", ranked.rank());
        gen.writeStringField("locality_id", ranked.occurrence().localityId());
        gen.writeStringField("name", ranked.occurrence().hotspot().name());
        gen.writeNumberField("rate", rate(ranked.occurrence().rate()));
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
      gen.writeArrayFieldStart("hotspots");
      for (RankedHotspot ranked : guide.hotspots()) {
        gen.writeStartObject();
        gen.writeNumberField("rank", ranked.rank());
        writeHotspotFields(gen, ranked.occurrence().hotspot());
        writeOccurrence(gen, ranked.occurrence());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeObjectFieldStart("metadata");
      gen.writeNumberField("min_checklists", thresholds.minChecklists());
      gen.writeNumberField("rate_decimal_places", GuideLayout.RATE_DECIMAL_PLACES);
      gen.writeEndObject();
      gen.writeEndObject();
    }
  }

  /**
   * Writes {@code hotspots/<locality_id>.json}.
   *
   * @param out destination; left open
   * @param guide hotspot view
   * @throws IOException on write failure
   */
  public void writeHotspot(OutputStream out, HotspotGuide guide) throws IOException {
    try (JsonGenerator gen = open(out)) {
      gen.writeStartObject();
      gen.writeObjectFieldStart("hotspot");
      writeHotspotFields(gen, guide.hotspot());
      gen.writeEndObject();
      gen.writeObjectFieldStart("checklists");
      gen.writeNumberField("total", guide.totalChecklists());
      writeMonthlyCounts(gen, "monthly", guide.monthlyChecklists());
      gen.writeEndObject();
      gen.writeNumberField("total_species", guide.species().size());
      gen.writeArrayFieldStart("species");
      for (OccurrenceResult occurrence : guide.species()) {
        gen.writeStartObject();
        gen.writeStringField("common_name", occurrence.species().commonName());
        gen.writeStringField("scientific_name", occurrence.species().scientificName());
        writeOccurrence(gen, occurrence);
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
  }

  /**
   * Writes {@code index/species_index.json}.
   *
   * @param out destination; left open
   * @param species ranked species in publication order
   * @param slugs species to slug
   * @throws IOException on write failure
   */
  public void writeSpeciesIndex(OutputStream out, List<SpeciesGuide> species, Map<SpeciesKey, String> slugs)
      throws IOException {
    try (JsonGenerator gen = open(out)) {
      gen.writeStartObject();
      gen.writeNumberField("total_species", species.size());
      gen.writeArrayFieldStart("species");
      for (SpeciesGuide guide : species) {
        gen.writeStartObject();
        gen.writeStringField("common_name", guide.species().commonName());
        gen.writeStringField("scientific_name", guide.species().scientificName());
        gen.writeStringField("file", GuideLayout.speciesDocument(slugs.get(guide.species())));
        gen.writeNumberField("total_hotspots", guide.totalHotspotsDetected());
        gen.writeNumberField("highest_occurrence_rate", rate(guide.highestRate()));
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
  }

  /**
   * Writes {@code index/hotspot_index.json}.
   *
   * @param out destination; left open
   * @param hotspots hotspot views in locality order
   * @throws IOException on write failure
   */
  public void writeHotspotIndex(OutputStream out, List<HotspotGuide> hotspots) throws IOException {
    try (JsonGenerator gen = open(out)) {
      gen.writeStartObject();
      gen.writeNumberField("total_hotspots", hotspots.size());
      gen.writeArrayFieldStart("hotspots");
      for (HotspotGuide guide : hotspots) {
        gen.writeStartObject();
        writeHotspotFields(gen, guide.hotspot());
        gen.writeNumberField("total_checklists", guide.totalChecklists());
        gen.writeNumberField("total_species", guide.species().size());
        gen.writeStringField("file", GuideLayout.hotspotDocument(guide.hotspot().localityId()));
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
  }

  /**
   * Writes {@code metadata.json}.
   *
   * @param out destination; left open
   * @param metadata run metadata
   * @throws IOException on write failure
   */
  public void writeMetadata(OutputStream out, RunMetadata metadata) throws IOException {
    try (JsonGenerator gen = open(out)) {
      gen.writeStartObject();
      gen.writeStringField("generated_at", metadata.generatedAt().toString());
      gen.writeStringField("version", metadata.version());
      gen.writeObjectFieldStart("sources");
      gen.writeStringField("main", metadata.mainFile());
      gen.writeStringField("sampling", metadata.samplingFile());
      gen.writeEndObject();
      gen.writeObjectFieldStart("thresholds");
      gen.writeNumberField("min_checklists", metadata.thresholds().minChecklists());
      gen.writeNumberField("medium_min", metadata.thresholds().mediumMin());
      gen.writeNumberField("high_min", metadata.thresholds().highMin());
      gen.writeEndObject();
      gen.writeObjectFieldStart("seasons");
      for (Season season : Season.values()) {
        gen.writeArrayFieldStart(season.key());
        for (int month : metadata.seasons().months(season)) {
          gen.writeNumber(month);
        }
        gen.writeEndArray();
      }
      gen.writeEndObject();
      gen.writeNumberField("top_n", metadata.topN());
      gen.writeNumberField("rate_decimal_places", GuideLayout.RATE_DECIMAL_PLACES);
      gen.writeObjectFieldStart("totals");
      gen.writeNumberField("qualifying_checklists", metadata.totalQualifyingChecklists());
      gen.writeNumberField("hotspots_included", metadata.hotspotsIncluded());
      gen.writeNumberField("hotspots_excluded_below_minimum", metadata.hotspotsExcludedBelowMinimum());
      gen.writeNumberField("species", metadata.speciesCount());
      gen.writeNumberField("duplicate_checklist_rows", metadata.duplicateChecklistRows());
      gen.writeNumberField("duplicate_detection_rows", metadata.duplicateDetectionRows());
      gen.writeNumberField("incomplete_checklist_rows", metadata.incompleteChecklistRows());
      gen.writeNumberField("pairs_without_checklists", metadata.pairsWithoutChecklists());
      gen.writeEndObject();
      gen.writeObjectFieldStart("rows");
      writeStats(gen, "sampling", metadata.samplingStats());
      writeStats(gen, "observations", metadata.observationStats());
      gen.writeEndObject();
      gen.writeEndObject();
    }
  }

  static double rate(double value) {
    return round(value, GuideLayout.RATE_DECIMAL_PLACES);
  }

  static double round(double value, int places) {
    return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
  }

  private JsonGenerator open(OutputStream out) throws IOException {
    JsonGenerator gen = jsonFactory.createGenerator(out, JsonEncoding.UTF8);
    gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
    gen.setPrettyPrinter(new DefaultPrettyPrinter()
        .withSeparators(Separators.createDefaultInstance()
            .withObjectFieldValueSpacing(Separators.Spacing.AFTER))
        .withObjectIndenter(indenter)
        .withArrayIndenter(indenter));
    return gen;
  }

  private static void writeSpeciesKey(JsonGenerator gen, String field, SpeciesKey species) throws IOException {
    gen.writeObjectFieldStart(field);
    gen.writeStringField("common_name", species.commonName());
    gen.writeStringField("scientific_name", species.scientificName());
    gen.writeEndObject();
  }

  private static void writeHotspotFields(JsonGenerator gen, Hotspot hotspot) throws IOException {
    gen.writeStringField("locality_id", hotspot.localityId());
    gen.writeStringField("name", hotspot.name());
    gen.writeObjectFieldStart("coordinates");
    gen.writeNumberField("latitude", hotspot.latitude());
    gen.writeNumberField("longitude", hotspot.longitude());
    gen.writeEndObject();
  }

  private static void writeOccurrence(JsonGenerator gen, OccurrenceResult occurrence) throws IOException {
    gen.writeObjectFieldStart("occurrence");
    gen.writeNumberField("rate", rate(occurrence.rate()));
    gen.writeNumberField("detection_count", occurrence.detectionCount());
    gen.writeNumberField("total_checklists", occurrence.totalChecklists());
    gen.writeStringField("confidence", occurrence.confidence().wireValue());
    if (occurrence.averageCount().isPresent()) {
      gen.writeNumberField("avg_count", round(occurrence.averageCount().getAsDouble(), 1));
    }
    if (occurrence.maxCount().isPresent()) {
      gen.writeNumberField("max_count", occurrence.maxCount().getAsLong());
    }
    gen.writeEndObject();
    gen.writeObjectFieldStart("seasonal");
    for (Season season : Season.values()) {
      gen.writeNumberField(season.key(), rate(occurrence.seasonal().get(season)));
    }
    gen.writeEndObject();
    gen.writeObjectFieldStart("monthly");
    for (Map.Entry<Integer, Double> month : occurrence.monthly().entrySet()) {
      gen.writeNumberField(String.valueOf(month.getKey()), rate(month.getValue()));
    }
    gen.writeEndObject();
  }

  private static void writeMonthlyCounts(JsonGenerator gen, String field, MonthlyCounts counts)
      throws IOException {
    gen.writeObjectFieldStart(field);
    for (int month = 1; month <= MonthlyCounts.MONTHS; month++) {
      gen.writeNumberField(String.valueOf(month), counts.get(month));
    }
    gen.writeEndObject();
  }

  private static void writeStats(JsonGenerator gen, String field, SourceStats stats) throws IOException {
    gen.writeObjectFieldStart(field);
    gen.writeStringField("source", stats.source());
    gen.writeNumberField("read", stats.rowsRead());
    gen.writeNumberField("admitted", stats.rowsAdmitted());
    gen.writeNumberField("filtered", stats.rowsFiltered());
    gen.writeNumberField("skipped", stats.rowsSkipped());
    gen.writeNumberField("chunks", stats.chunks());
    gen.writeEndObject();
  }
}

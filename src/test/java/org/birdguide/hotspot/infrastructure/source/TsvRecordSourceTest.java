package org.birdguide.hotspot.infrastructure.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import org.birdguide.hotspot.application.port.RecordStream;
import org.birdguide.hotspot.application.port.SourceReadException;
import org.birdguide.hotspot.domain.ChecklistRecord;
import org.birdguide.hotspot.domain.LocalityType;
import org.birdguide.hotspot.domain.ObservationRecord;
import org.birdguide.hotspot.domain.SourceStats;
import org.birdguide.hotspot.testutil.Fixtures;
import org.birdguide.hotspot.testutil.RecordingMetricsPort;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TsvRecordSourceTest {
  private static final String SAMPLING_HEADER = String.join("\t", "SAMPLING EVENT IDENTIFIER", "LOCALITY",
      "LOCALITY ID", "LOCALITY TYPE", "LATITUDE", "LONGITUDE", "OBSERVATION DATE", "ALL SPECIES REPORTED");

  @TempDir Path tempDir;

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void samplingFixtureIsReadInChunks() throws IOException {
    Path file = Fixtures.copy(Fixtures.SAMPLING, tempDir);
    TsvRecordSource<ChecklistRecord> source = EbirdSources.checklists(file, 4, metrics);

    List<ChecklistRecord> records = drain(source.open());

    assertEquals(27, records.size());
    assertTrue(records.stream().allMatch(record -> record.localityType() == LocalityType.HOTSPOT));
    assertEquals(29, metrics.count("guide.sampling.rows.read"));
    assertEquals(1, metrics.count("guide.sampling.rows.filtered"));
    assertEquals(1, metrics.count("guide.sampling.rows.skipped"));
    assertEquals(8, metrics.observed("guide.sampling.chunk.rows").size());
    assertEquals(Fixtures.SAMPLING, source.name());
  }

  @Test
  void observationFixtureAdmitsSpeciesAtHotspots() throws IOException {
    Path file = Fixtures.copy(Fixtures.MAIN, tempDir);
    RecordStream<ObservationRecord> stream = EbirdSources.observations(file, 1000, metrics).open();

    List<ObservationRecord> records = drain(stream);
    SourceStats stats = stream.stats();

    assertEquals(29, records.size());
    assertEquals(new SourceStats(Fixtures.MAIN, 32, 29, 2, 1, 1), stats);
    assertTrue(records.stream().noneMatch(record -> record.species().commonName().endsWith(" sp.")));
  }

  @Test
  void sourceCanBeReopened() throws IOException {
    Path file = write("sampling.txt",
        SAMPLING_HEADER,
        row("S1", "Park", "L1", "H", "40.0", "-75.0", "2023-06-01", "1"),
        row("S2", "Park", "L1", "H", "40.0", "-75.0", "2023-07-01", "0"));
    TsvRecordSource<ChecklistRecord> source = EbirdSources.checklists(file, 10, metrics);

    List<ChecklistRecord> first = drain(source.open());
    List<ChecklistRecord> second = drain(source.open());

    assertEquals(first, second);
    assertEquals(2, first.size());
    assertEquals(6, first.get(0).observationMonth());
    assertFalse(first.get(1).allSpeciesReported());
  }

  @Test
  void byteOrderMarkAndExtraColumnsAreTolerated() throws IOException {
    Path file = write("sampling.txt",
        "\uFEFF" + SAMPLING_HEADER + "\tEXTRA",
        row("S1", "Park", "L1", "H", "40.0", "-75.0", "2023-06-01", "1", "ignored"));

    List<ChecklistRecord> records = drain(EbirdSources.checklists(file, 10, metrics).open());

    assertEquals(1, records.size());
    assertEquals("S1", records.get(0).checklistId());
  }

  @Test
  void malformedRowsAreSkipped() throws IOException {
    Path file = write("sampling.txt",
        SAMPLING_HEADER,
        row("S1", "Park", "L1", "H", "91.5", "-75.0", "2023-06-01", "1"),
        row("S2", "Park", "L1", "H", "40.0", "-75.0", "June 1", "1"),
        row("S3", "Park", "L1", "H", "40.0", "-75.0", "2023-06-01", "maybe"),
        row("S4", "Park", "L1", "H", "40.0"),
        row("S5", "Park", "L1", "H", "40.0", "-75.0", "2023-06-01", "1"));
    RecordStream<ChecklistRecord> stream = EbirdSources.checklists(file, 2, metrics).open();

    List<ChecklistRecord> records = drain(stream);

    assertEquals(List.of("S5"), records.stream().map(ChecklistRecord::checklistId).toList());
    assertEquals(4, stream.stats().rowsSkipped());
    assertEquals(3, stream.stats().chunks());
  }

  @Test
  void quoteCharactersAreKeptAsPlainText() throws IOException {
    Path file = write("sampling.txt",
        SAMPLING_HEADER,
        row("S1", "\"Big Marsh", "L1", "H", "40.0", "-75.0", "2023-06-01", "1"),
        row("S2", "Mill \"Pond\" Trail", "L2", "H", "40.0", "-75.0", "2023-06-02", "1"),
        row("S3", "Mill Pond", "L2", "H", "40.0", "-75.0", "2023-06-03", "1"),
        row("S4", "Mill Pond", "L2", "H", "40.0", "-75.0", "2023-06-04", "1"),
        row("S5", "Mill Pond", "L2", "H", "40.0", "-75.0", "2023-06-05", "1"),
        row("S6", "Mill Pond", "L2", "H", "40.0", "-75.0", "2023-06-06", "1"));
    RecordStream<ChecklistRecord> stream = EbirdSources.checklists(file, 10, metrics).open();

    List<ChecklistRecord> records = drain(stream);

    assertEquals(List.of("S1", "S2", "S3", "S4", "S5", "S6"),
        records.stream().map(ChecklistRecord::checklistId).toList());
    assertEquals("\"Big Marsh", records.get(0).localityName());
    assertEquals("Mill \"Pond\" Trail", records.get(1).localityName());
    assertEquals(6, stream.stats().rowsRead());
    assertEquals(0, stream.stats().rowsSkipped());
  }

  @Test
  void missingRequiredColumnFailsOpen() throws IOException {
    Path file = write("sampling.txt", "SAMPLING EVENT IDENTIFIER\tLOCALITY ID", "S1\tL1");

    SourceReadException ex = assertThrows(SourceReadException.class,
        () -> EbirdSources.checklists(file, 10, metrics).open());

    assertTrue(ex.getMessage().contains("ALL SPECIES REPORTED"), ex.getMessage());
  }

  @Test
  void emptyFileFailsOpen() throws IOException {
    Path file = write("sampling.txt");

    assertThrows(SourceReadException.class, () -> EbirdSources.checklists(file, 10, metrics).open());
  }

  @Test
  void missingFileFailsOpen() {
    assertThrows(SourceReadException.class,
        () -> EbirdSources.checklists(tempDir.resolve("absent.txt"), 10, metrics).open());
  }

  @Test
  void countsAreParsedOrLeftAsPresence() throws IOException {
    String header = String.join("\t", "SAMPLING EVENT IDENTIFIER", "COMMON NAME", "SCIENTIFIC NAME", "CATEGORY",
        "OBSERVATION COUNT", "LOCALITY", "LOCALITY ID", "LOCALITY TYPE", "LATITUDE", "LONGITUDE",
        "OBSERVATION DATE", "ALL SPECIES REPORTED");
    Path file = write("observations.txt", header,
        row("S1", "Blue Grosbeak", "Passerina caerulea", "species", "3", "Park", "L1", "H", "40", "-75",
            "2023-06-01", "1"),
        row("S2", "Blue Grosbeak", "Passerina caerulea", "species", "X", "Park", "L1", "H", "40", "-75",
            "2023-06-02", "1"));

    List<ObservationRecord> records = drain(EbirdSources.observations(file, 10, metrics).open());

    assertEquals(OptionalInt.of(3), records.get(0).individualCount());
    assertEquals(OptionalInt.empty(), records.get(1).individualCount());
  }

  @Test
  void chunkSizeMustBePositive() {
    assertThrows(IllegalArgumentException.class,
        () -> EbirdSources.checklists(tempDir.resolve("x.txt"), 0, metrics));
  }

  private Path write(String name, String... lines) throws IOException {
    Path file = tempDir.resolve(name);
    Files.writeString(file, lines.length == 0 ? "" : String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
    return file;
  }

  private static String row(String... fields) {
    return String.join("\t", fields);
  }

  private static <T> List<T> drain(RecordStream<T> stream) throws IOException {
    List<T> records = new ArrayList<>();
    try (stream) {
      T record;
      while ((record = stream.next()) != null) {
        records.add(record);
      }
    }
    return records;
  }
}

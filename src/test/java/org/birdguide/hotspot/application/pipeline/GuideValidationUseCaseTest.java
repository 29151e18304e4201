package org.birdguide.hotspot.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.birdguide.hotspot.infrastructure.output.FileGuideOutputAdapter;
import org.birdguide.hotspot.infrastructure.output.JsonGuideDocumentSource;
import org.birdguide.hotspot.testutil.ListRecordSource;
import org.birdguide.hotspot.testutil.RecordingMetricsPort;
import org.birdguide.hotspot.testutil.Scenario;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GuideValidationUseCaseTest {
  @TempDir Path tempDir;

  private Path guide;

  @BeforeEach
  void publishGuide() throws IOException {
    guide = tempDir.resolve("guide");
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    new GuideBuildUseCase(Scenario.config(guide),
        ListRecordSource.of("sampling.tsv", Scenario.checklists()),
        ListRecordSource.of("observations.tsv", Scenario.detections()),
        new FileGuideOutputAdapter(guide, false, metrics), metrics, () -> 0L).run();
  }

  @Test
  void freshGuidePassesEveryCheck() throws IOException {
    ValidationReport report = validate();

    assertTrue(report.passed(), () -> String.join("\n", report.lines()));
    assertEquals(List.of("metadata", "species index", "hotspot index", "document structure", "species ranks",
        "occurrence rates", "minimum checklists"),
        report.checks().stream().map(ValidationReport.Check::name).toList());
    assertEquals("PASS metadata: min_checklists=10", report.lines().get(0));
    assertEquals(guide.toAbsolutePath().normalize().toString(), report.location());
  }

  @Test
  void editedDetectionCountFailsRateCheck() throws IOException {
    replace("species/blue_grosbeak.json", "\"detection_count\": 5", "\"detection_count\": 7");

    ValidationReport report = validate();

    assertFalse(report.passed());
    assertEquals(List.of("occurrence rates"), failedNames(report));
    assertTrue(report.failures().get(0).detail().contains("does not match 7/10"),
        report.failures().get(0).detail());
  }

  @Test
  void missingMetadataFailsMetadataCheck() throws IOException {
    Files.delete(guide.resolve("metadata.json"));

    ValidationReport report = validate();

    assertEquals(List.of("metadata"), failedNames(report));
    assertEquals("FAIL metadata: metadata.json missing or unreadable", report.failures().get(0).line());
  }

  @Test
  void brokenRanksFailRankCheck() throws IOException {
    replace("species/blue_grosbeak.json", "\"rank\": 1", "\"rank\": 3");

    ValidationReport report = validate();

    assertEquals(List.of("species ranks"), failedNames(report));
    assertTrue(report.failures().get(0).detail().contains("expected 1"));
  }

  @Test
  void removedSpeciesFileFailsIndexCheck() throws IOException {
    Files.delete(guide.resolve("species/american_robin.json"));

    ValidationReport report = validate();

    assertEquals(List.of("species index"), failedNames(report));
    assertEquals("FAIL species index: total_species=2, entries=2, files=1", report.failures().get(0).line());
  }

  @Test
  void unparseableDocumentFailsStructureCheck() throws IOException {
    Files.writeString(guide.resolve("hotspots/L3.json"), "{\"hotspot\": ", StandardCharsets.UTF_8);

    ValidationReport report = validate();

    assertEquals(List.of("document structure"), failedNames(report));
  }

  private ValidationReport validate() throws IOException {
    return new GuideValidationUseCase(new JsonGuideDocumentSource(guide)).run();
  }

  private void replace(String document, String target, String replacement) throws IOException {
    Path file = guide.resolve(document);
    String content = Files.readString(file, StandardCharsets.UTF_8);
    assertTrue(content.contains(target), target);
    Files.writeString(file, content.replace(target, replacement), StandardCharsets.UTF_8);
  }

  private static List<String> failedNames(ValidationReport report) {
    return report.failures().stream().map(ValidationReport.Check::name).toList();
  }
}

package org.birdguide.hotspot.infrastructure.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonGuideDocumentSourceTest {
  @TempDir Path tempDir;

  @Test
  void readsNestedDocument() throws IOException {
    Files.writeString(tempDir.resolve("metadata.json"),
        "{\"thresholds\": {\"min_checklists\": 10}, \"rate\": 0.25, \"tags\": [\"a\", null, true]}",
        StandardCharsets.UTF_8);

    Optional<Object> doc = new JsonGuideDocumentSource(tempDir).read("metadata.json");

    assertTrue(doc.isPresent());
    Map<?, ?> root = (Map<?, ?>) doc.get();
    assertEquals(10, ((Number) ((Map<?, ?>) root.get("thresholds")).get("min_checklists")).intValue());
    assertEquals(0.25, ((Number) root.get("rate")).doubleValue());
    assertEquals(3, ((List<?>) root.get("tags")).size());
  }

  @Test
  void missingDocumentIsEmpty() throws IOException {
    assertTrue(new JsonGuideDocumentSource(tempDir).read("metadata.json").isEmpty());
  }

  @Test
  void malformedDocumentThrows() throws IOException {
    Files.writeString(tempDir.resolve("bad.json"), "{\"a\": ", StandardCharsets.UTF_8);
    Files.writeString(tempDir.resolve("trailing.json"), "{} {}", StandardCharsets.UTF_8);
    JsonGuideDocumentSource source = new JsonGuideDocumentSource(tempDir);

    assertThrows(IOException.class, () -> source.read("bad.json"));
    assertThrows(IOException.class, () -> source.read("trailing.json"));
  }

  @Test
  void listsOnlyJsonFilesInOrder() throws IOException {
    Path species = Files.createDirectories(tempDir.resolve("species"));
    Files.writeString(species.resolve("wren.json"), "{}", StandardCharsets.UTF_8);
    Files.writeString(species.resolve("blue_grosbeak.json"), "{}", StandardCharsets.UTF_8);
    Files.writeString(species.resolve("notes.txt"), "x", StandardCharsets.UTF_8);
    JsonGuideDocumentSource source = new JsonGuideDocumentSource(tempDir);

    assertEquals(List.of("species/blue_grosbeak.json", "species/wren.json"), source.list("species"));
    assertEquals(List.of(), source.list("hotspots"));
  }

  @Test
  void rejectsPathsOutsideGuide() {
    JsonGuideDocumentSource source = new JsonGuideDocumentSource(tempDir.resolve("guide"));

    assertThrows(IOException.class, () -> source.read("../secret.json"));
  }
}

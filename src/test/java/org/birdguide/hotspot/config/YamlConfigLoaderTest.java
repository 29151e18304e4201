package org.birdguide.hotspot.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("guide.yaml");
    Files.writeString(yaml, """
        common:
          out: guide
        build:
          minChecklists: 20
          seasons:
            summer: [6, 7, 8]
            fall: "9,10,11"
        validate: {}
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "build").orElseThrow();

    assertEquals("guide", map.get("out"));
    assertEquals("20", map.get("minChecklists"));
    assertEquals("6,7,8", map.get("seasons.summer"));
    assertEquals("9,10,11", map.get("seasons.fall"));
    assertFalse(YamlConfigLoader.load(yaml, "validate").orElseThrow().containsKey("minChecklists"));
  }

  @Test
  void missingFileYieldsEmpty() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "build");

    assertTrue(result.isEmpty());
  }

  @Test
  void nullValueBecomesEmptyString() throws IOException {
    Path yaml = tempDir.resolve("null.yaml");
    Files.writeString(yaml, """
        build:
          sampleSpecies:
        """);

    assertEquals("", YamlConfigLoader.load(yaml, "build").orElseThrow().get("sampleSpecies"));
  }

  @Test
  void malformedYamlIsIllegalArgument() throws IOException {
    Path yaml = tempDir.resolve("bad.yaml");
    Files.writeString(yaml, "build: [unclosed");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "build"));
  }

  @Test
  void nonMappingSectionIsRejected() throws IOException {
    Path yaml = tempDir.resolve("list.yaml");
    Files.writeString(yaml, """
        common:
          - out
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "build"));
  }

  @Test
  void bundledExampleParses() throws IOException {
    try (Reader reader = new InputStreamReader(
        YamlConfigLoaderTest.class.getResourceAsStream("/hotspot-guide.example.yaml"), StandardCharsets.UTF_8)) {
      Map<String, String> map = YamlConfigLoader.parse(reader, "build");

      GuideConfig config = GuideConfig.fromMap(map);
      assertEquals(map.get("minChecklists"), Integer.toString(config.thresholds().minChecklists()));
    }
  }
}

package org.birdguide.hotspot.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("build");
    Map<String, String> yaml = Map.of("minChecklists", "20", "topN", "5");
    Map<String, String> cli = Map.of("minChecklists", "15");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "build",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("15", merged.get("minChecklists"));
    assertEquals("5", merged.get("topN"));
    assertEquals("30", merged.get("mediumMin"));
    assertEquals(List.of("CLI overrides YAML for key: minChecklists"), warnings);
  }

  @Test
  void buildRejectsMediumBelowMinimum() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "build",
            Optional.empty(),
            Map.of("minChecklists", "50"),
            DefaultsForMode.asFlatMap("build"),
            msg -> {}));
  }

  @Test
  void buildRejectsOverlappingSeasons() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "build",
            Optional.of(Map.of("seasons.summer", "5,6,7")),
            Map.of(),
            DefaultsForMode.asFlatMap("build"),
            msg -> {}));

    assertTrue(ex.getMessage().contains("month 5"), ex.getMessage());
  }

  @Test
  void validateSkipsBuildChecks() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "validate",
        Optional.empty(),
        Map.of("out", "guide"),
        DefaultsForMode.asFlatMap("validate"),
        null);

    assertEquals("guide", merged.get("out"));
    assertEquals("none", merged.get("metricsExporter"));
  }
}

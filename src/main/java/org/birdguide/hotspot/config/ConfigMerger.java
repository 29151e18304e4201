package org.birdguide.hotspot.config;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.birdguide.hotspot.domain.Season;
import org.birdguide.hotspot.domain.SeasonPartition;
import org.birdguide.hotspot.validation.Numbers;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when thresholds or seasons are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }

    if ("build".equalsIgnoreCase(mode)) {
      validateBuild(merged);
    }
    return Map.copyOf(merged);
  }

  private static void validateBuild(Map<String, String> effective) {
    int min = intValue(effective, "minChecklists", 10);
    int medium = intValue(effective, "mediumMin", 30);
    int high = intValue(effective, "highMin", 100);
    if (medium < min) {
      throw new IllegalArgumentException(
          "mediumMin (" + medium + ") must not be below minChecklists (" + min + ")");
    }
    if (medium >= high) {
      throw new IllegalArgumentException("mediumMin (" + medium + ") must be below highMin (" + high + ")");
    }
    Map<Season, List<Integer>> assignment = new EnumMap<>(Season.class);
    for (Season season : Season.values()) {
      String key = "seasons." + season.key();
      String raw = effective.get(key);
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException(key + " must list at least one month");
      }
      assignment.put(season, GuideConfig.parseMonths(key, raw));
    }
    SeasonPartition.of(assignment);
  }

  private static int intValue(Map<String, String> effective, String key, int fallback) {
    String raw = effective.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseIntInRange(key, raw, 1, Integer.MAX_VALUE);
  }
}

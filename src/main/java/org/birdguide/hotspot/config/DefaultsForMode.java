package org.birdguide.hotspot.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.birdguide.hotspot.domain.Season;

/**
 * Supplies flattened default configuration maps for each guide command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode command ({@code build} or {@code validate})
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "build" -> buildBuildDefaults();
      case "validate" -> buildValidateDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("out", GuideConfig.defaults().outputDirectory().toString());
    return Map.copyOf(map);
  }

  private static Map<String, String> buildBuildDefaults() {
    GuideConfig defaults = GuideConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("dataDir", defaults.dataDirectory().toString());
    map.put("main", "");
    map.put("sampling", "");
    map.put("minChecklists", Integer.toString(defaults.thresholds().minChecklists()));
    map.put("mediumMin", Integer.toString(defaults.thresholds().mediumMin()));
    map.put("highMin", Integer.toString(defaults.thresholds().highMin()));
    map.put("topN", Integer.toString(defaults.topN()));
    map.put("chunkSize", Integer.toString(defaults.chunkSize()));
    map.put("samplingChunkSize", Integer.toString(defaults.samplingChunkSize()));
    for (Season season : Season.values()) {
      StringBuilder months = new StringBuilder();
      for (int month : defaults.seasons().months(season)) {
        if (months.length() > 0) {
          months.append(',');
        }
        months.append(month);
      }
      map.put("seasons." + season.key(), months.toString());
    }
    map.put("sampleSpecies", defaults.sampleSpecies().orElse(""));
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildValidateDefaults() {
    return new LinkedHashMap<>();
  }
}

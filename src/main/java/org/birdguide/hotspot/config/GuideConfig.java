package org.birdguide.hotspot.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.birdguide.hotspot.domain.GuideThresholds;
import org.birdguide.hotspot.domain.MonthlyCounts;
import org.birdguide.hotspot.domain.Season;
import org.birdguide.hotspot.domain.SeasonPartition;
import org.birdguide.hotspot.validation.Numbers;
import org.birdguide.hotspot.validation.Strings;

/**
 * <strong>What:</strong> Typed configuration of a guide build.
 * <p><strong>Why:</strong> Folds CLI, YAML and defaults into one validated value before any input is read, so a
 * bad threshold or season table fails fast.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@code BuildCli} and
 * {@link org.birdguide.hotspot.application.pipeline.GuideBuildUseCase}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param dataDirectory directory searched for eBird export files
 * @param mainFile explicit observation file, overriding discovery
 * @param samplingFile explicit sampling-event file, overriding discovery
 * @param outputDirectory guide destination, replaced atomically
 * @param thresholds inclusion and confidence thresholds
 * @param seasons month to season partition
 * @param topN hotspots listed in summary views
 * @param chunkSize rows per read chunk of the observation file
 * @param samplingChunkSize rows per read chunk of the sampling file
 * @param sampleSpecies species whose top hotspots are logged after a build
 * @param allowOverwrite whether a populated output directory may be replaced
 * @since 0.1.0
 * @see DefaultsForMode
 */
public record GuideConfig(
    Path dataDirectory,
    Optional<Path> mainFile,
    Optional<Path> samplingFile,
    Path outputDirectory,
    GuideThresholds thresholds,
    SeasonPartition seasons,
    int topN,
    int chunkSize,
    int samplingChunkSize,
    Optional<String> sampleSpecies,
    boolean allowOverwrite) {

  static final int MAX_CHUNK = 10_000_000;
  static final int MAX_TOP_N = 10_000;

  public GuideConfig {
    dataDirectory = normalizePath("dataDir", dataDirectory);
    mainFile = Objects.requireNonNullElse(mainFile, Optional.<Path>empty()).map(p -> normalizePath("main", p));
    samplingFile =
        Objects.requireNonNullElse(samplingFile, Optional.<Path>empty()).map(p -> normalizePath("sampling", p));
    outputDirectory = normalizePath("out", outputDirectory);
    Objects.requireNonNull(thresholds, "thresholds");
    Objects.requireNonNull(seasons, "seasons");
    Numbers.requireRange("topN", topN, 1, MAX_TOP_N);
    Numbers.requireRange("chunkSize", chunkSize, 1, MAX_CHUNK);
    Numbers.requireRange("samplingChunkSize", samplingChunkSize, 1, MAX_CHUNK);
    sampleSpecies = Objects.requireNonNullElse(sampleSpecies, Optional.empty());
  }

  /**
   * Baseline configuration: current directory as data directory, {@code ./output} as destination.
   *
   * @return default configuration
   */
  public static GuideConfig defaults() {
    return new GuideConfig(
        Path.of("."),
        Optional.empty(),
        Optional.empty(),
        Path.of("output"),
        GuideThresholds.defaults(),
        SeasonPartition.defaults(),
        10,
        100_000,
        50_000,
        Optional.of("American Robin"),
        false);
  }

  /**
   * Creates a configuration from flattened key/value pairs.
   *
   * @param options keys such as {@code dataDir}, {@code out}, {@code minChecklists}, {@code seasons.summer}
   * @return populated configuration
   * @throws IllegalArgumentException when a value is malformed or the thresholds or seasons are inconsistent
   */
  public static GuideConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    GuideConfig defaults = defaults();

    Path dataDir = optionalPath("dataDir", options.get("dataDir")).orElse(defaults.dataDirectory());
    Optional<Path> main = optionalPath("main", options.get("main"));
    Optional<Path> sampling = optionalPath("sampling", options.get("sampling"));
    Path out = optionalPath("out", options.get("out")).orElse(defaults.outputDirectory());

    GuideThresholds base = defaults.thresholds();
    GuideThresholds thresholds = new GuideThresholds(
        intOption(options, "minChecklists", base.minChecklists(), 1, Integer.MAX_VALUE),
        intOption(options, "mediumMin", base.mediumMin(), 1, Integer.MAX_VALUE),
        intOption(options, "highMin", base.highMin(), 1, Integer.MAX_VALUE));

    Map<Season, List<Integer>> assignment = new EnumMap<>(Season.class);
    for (Season season : Season.values()) {
      String raw = options.get("seasons." + season.key());
      assignment.put(season, raw == null || raw.isBlank()
          ? defaults.seasons().months(season)
          : parseMonths("seasons." + season.key(), raw));
    }
    SeasonPartition seasons = SeasonPartition.of(assignment);

    int topN = intOption(options, "topN", defaults.topN(), 1, MAX_TOP_N);
    int chunkSize = intOption(options, "chunkSize", defaults.chunkSize(), 1, MAX_CHUNK);
    int samplingChunkSize =
        intOption(options, "samplingChunkSize", defaults.samplingChunkSize(), 1, MAX_CHUNK);

    Optional<String> sampleSpecies = defaults.sampleSpecies();
    String sampleRaw = options.get("sampleSpecies");
    if (sampleRaw != null) {
      sampleSpecies = sampleRaw.isBlank()
          ? Optional.empty()
          : Optional.of(Strings.requireNonBlank("sampleSpecies", sampleRaw));
    }
    boolean allowOverwrite = parseBoolean(options.get("allowOverwrite"), defaults.allowOverwrite());

    return new GuideConfig(
        dataDir, main, sampling, out, thresholds, seasons, topN, chunkSize, samplingChunkSize, sampleSpecies,
        allowOverwrite);
  }

  static List<Integer> parseMonths(String name, String raw) {
    List<Integer> months = new ArrayList<>();
    for (String part : Strings.requireNonBlank(name, raw).split(",")) {
      if (part.isBlank()) {
        continue;
      }
      months.add(Numbers.parseIntInRange(name, part, 1, MonthlyCounts.MONTHS));
    }
    if (months.isEmpty()) {
      throw new IllegalArgumentException(name + " must list at least one month");
    }
    return months;
  }

  private static int intOption(Map<String, String> options, String key, int fallback, int min, int max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseIntInRange(key, raw, min, max);
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static Optional<Path> optionalPath(String name, String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Path.of(Strings.requireNonBlank(name, value)));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static Path normalizePath(String name, Path path) {
    Objects.requireNonNull(path, name + " must not be null");
    if (path.toString().indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    return path.toAbsolutePath().normalize();
  }
}

package org.birdguide.hotspot.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.birdguide.hotspot.application.pipeline.GuideBuildUseCase;
import org.birdguide.hotspot.application.port.SourceReadException;
import org.birdguide.hotspot.config.ConfigMerger;
import org.birdguide.hotspot.config.DataFileLocator;
import org.birdguide.hotspot.config.DefaultsForMode;
import org.birdguide.hotspot.config.GuideConfig;
import org.birdguide.hotspot.config.YamlConfigLoader;
import org.birdguide.hotspot.domain.ConsistencyFaultException;
import org.birdguide.hotspot.domain.GuideBuild;
import org.birdguide.hotspot.domain.Season;
import org.birdguide.hotspot.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import org.birdguide.hotspot.infrastructure.output.FileGuideOutputAdapter;
import org.birdguide.hotspot.infrastructure.source.EbirdSources;
import org.birdguide.hotspot.infrastructure.time.SystemClockAdapter;
import org.birdguide.hotspot.logging.LoggingConfigurator;
import org.birdguide.hotspot.validation.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for building a hotspot guide from an eBird observation export and its sampling file.
 *
 * @since 0.1.0
 */
public final class BuildCli {
  private static final Logger log = LoggerFactory.getLogger(BuildCli.class);
  private static final String MODE = "build";
  private static final String SUMMARY_USAGE =
      "usage: build [dataDir=PATH] [main=FILE] [sampling=FILE] [out=PATH] [config=FILE] "
          + "[minChecklists=N] [mediumMin=N] [highMin=N] [topN=N] [seasons.<season>=M,M,...] "
          + "[--dry-run] [--allow-overwrite] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      Hotspot guide build

      Usage:
        build dataDir=./ebird out=./guide [options]

      Inputs:
        dataDir=PATH             Directory holding ebd_*.txt and *_sampling.txt (default .)
        main=FILE                Observation file, overriding discovery
        sampling=FILE            Sampling-event file, overriding discovery
        config=FILE              YAML file with 'common' and 'build' sections

      Output:
        out=PATH                 Guide directory, replaced atomically (default ./output)
        --allow-overwrite        Permit replacing a non-empty guide directory

      Thresholds:
        minChecklists=N          Checklists a hotspot needs to be included (default 10)
        mediumMin=N              Checklists for medium confidence (default 30)
        highMin=N                Checklists for high confidence (default 100)
        topN=N                   Hotspots in each species summary (default 10)
        seasons.spring=3,4,5     Month lists per season (spring, summer, fall, winter)

      Tuning:
        chunkSize=N              Observation rows per read chunk (default 100000)
        samplingChunkSize=N      Sampling rows per read chunk (default 50000)
        sampleSpecies=NAME       Species whose top hotspots are logged (default American Robin)

      Telemetry:
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes

      Other:
        --dry-run                Resolve inputs and print the plan without reading or writing
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private BuildCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs the build command.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for build command");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.hasFlag("--dry-run")) {
      kv.put("dryRun", "true");
    }
    if (input.hasFlag("--allow-overwrite")) {
      kv.put("allowOverwrite", "true");
    }

    Optional<Map<String, String>> yaml;
    try {
      yaml = loadYaml(ConfigCliUtils.extractConfigPath(kv));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    GuideConfig config;
    boolean dryRun;
    try {
      Map<String, String> effective = new LinkedHashMap<>(
          ConfigMerger.buildEffectiveConfig(MODE, yaml, kv, DefaultsForMode.asFlatMap(MODE), log::warn));
      dryRun = ConfigCliUtils.parseBoolean(effective, "dryRun");
      TelemetryConfigurator.configureMetrics(effective);
      config = GuideConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid build configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    DataFileLocator.DataFiles files;
    try {
      files = DataFileLocator.locate(config);
    } catch (IllegalArgumentException ex) {
      log.error("Unable to resolve data files: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    Path out;
    try {
      out = Paths.validateOutputDir(config.outputDirectory(), config.allowOverwrite());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid output directory: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, files, out);
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      GuideBuildUseCase useCase = new GuideBuildUseCase(
          config,
          EbirdSources.checklists(files.samplingFile(), config.samplingChunkSize(), metrics),
          EbirdSources.observations(files.mainFile(), config.chunkSize(), metrics),
          new FileGuideOutputAdapter(out, config.allowOverwrite(), metrics),
          metrics,
          new SystemClockAdapter());
      log.info("Building guide: main={}, sampling={}, out={}", files.mainFile(), files.samplingFile(), out);
      GuideBuild build = useCase.run();
      log.info("Guide written to {}: {} species, {} hotspots",
          out, build.species().size(), build.hotspots().size());
      return ExitCode.SUCCESS;
    } catch (ConsistencyFaultException ex) {
      log.error("Inconsistent tallies; nothing was published: {}", ex.getMessage());
      return ExitCode.DATA_FAULT;
    } catch (SourceReadException ex) {
      log.error("Unable to read input: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IOException ex) {
      log.error("Unable to publish guide to {}", out, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Build configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in build", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static Optional<Map<String, String>> loadYaml(String configPath) throws IOException {
    if (configPath == null) {
      return Optional.empty();
    }
    Path yamlPath = Path.of(configPath);
    if (!Files.exists(yamlPath)) {
      throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
    }
    return YamlConfigLoader.load(yamlPath, MODE);
  }

  private static void printDryRunPlan(GuideConfig config, DataFileLocator.DataFiles files, Path out) {
    StringBuilder seasons = new StringBuilder();
    for (Season season : Season.values()) {
      if (seasons.length() > 0) {
        seasons.append(' ');
      }
      seasons.append(season.key()).append('=').append(config.seasons().months(season));
    }
    CliPrinter.printLines(
        "Build dry-run: no input will be read and no files will be written.",
        " Observation file  : " + files.mainFile(),
        " Sampling file     : " + files.samplingFile(),
        " Output directory  : " + out,
        " Allow overwrite   : " + config.allowOverwrite(),
        " Min checklists    : " + config.thresholds().minChecklists(),
        " Confidence        : medium>=" + config.thresholds().mediumMin()
            + " high>=" + config.thresholds().highMin(),
        " Seasons           : " + seasons,
        " Top N             : " + config.topN(),
        " Chunk sizes       : main=" + config.chunkSize() + " sampling=" + config.samplingChunkSize(),
        " Re-run without --dry-run to build the guide.");
  }
}

package org.birdguide.hotspot.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.birdguide.hotspot.application.pipeline.GuideValidationUseCase;
import org.birdguide.hotspot.application.pipeline.ValidationReport;
import org.birdguide.hotspot.config.ConfigMerger;
import org.birdguide.hotspot.config.DefaultsForMode;
import org.birdguide.hotspot.config.YamlConfigLoader;
import org.birdguide.hotspot.infrastructure.output.JsonGuideDocumentSource;
import org.birdguide.hotspot.logging.LoggingConfigurator;
import org.birdguide.hotspot.validation.Paths;
import org.birdguide.hotspot.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for checking a published guide directory.
 *
 * @since 0.1.0
 */
public final class ValidateCli {
  private static final Logger log = LoggerFactory.getLogger(ValidateCli.class);
  private static final String MODE = "validate";
  private static final String SUMMARY_USAGE = "usage: validate out=PATH [config=FILE]";
  private static final String HELP_TEXT = """
      Hotspot guide validation

      Usage:
        validate out=./guide

      Options:
        out=PATH      Published guide directory (default ./output)
        config=FILE   YAML file with 'common' and 'validate' sections
        --verbose     Enable DEBUG logging
        --help        Show this message

      Prints one PASS/FAIL line per check and exits with 6 when any check fails.
      """;

  private ValidateCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Map<String, String> effective;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      String configPath = ConfigCliUtils.extractConfigPath(kv);
      Optional<Map<String, String>> yaml = Optional.empty();
      if (configPath != null) {
        Path yamlPath = Path.of(configPath);
        if (!Files.exists(yamlPath)) {
          throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
        }
        yaml = YamlConfigLoader.load(yamlPath, MODE);
      }
      effective = new LinkedHashMap<>(
          ConfigMerger.buildEffectiveConfig(MODE, yaml, kv, DefaultsForMode.asFlatMap(MODE), log::warn));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    Path guide;
    try {
      guide = Paths.requireReadableDir("out", Path.of(Strings.requireNonBlank("out", effective.get("out"))));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid guide directory: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      ValidationReport report = new GuideValidationUseCase(new JsonGuideDocumentSource(guide)).run();
      CliPrinter.printLines(report.lines());
      if (!report.passed()) {
        log.error("Guide {} failed {} of {} checks", guide, report.failures().size(), report.checks().size());
        return ExitCode.DATA_FAULT;
      }
      log.info("Guide {} passed all {} checks", guide, report.checks().size());
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to read guide {}", guide, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in validate", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}

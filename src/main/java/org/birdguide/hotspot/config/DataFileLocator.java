package org.birdguide.hotspot.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import org.birdguide.hotspot.util.PathUtils;
import org.birdguide.hotspot.validation.Paths;

/**
 * Resolves the eBird observation and sampling-event files of a build.
 *
 * <p>Explicit {@code main=} / {@code sampling=} paths win. Otherwise the data directory must contain exactly one
 * {@code *_sampling.txt} and exactly one {@code ebd_*.txt} that is not a sampling file.</p>
 */
public final class DataFileLocator {
  static final String SAMPLING_SUFFIX = "_sampling.txt";
  static final String MAIN_PREFIX = "ebd_";
  static final String TEXT_SUFFIX = ".txt";

  /**
   * Resolved input files.
   *
   * @param mainFile observation file
   * @param samplingFile sampling-event file
   */
  public record DataFiles(Path mainFile, Path samplingFile) {
    public DataFiles {
      Objects.requireNonNull(mainFile, "mainFile");
      Objects.requireNonNull(samplingFile, "samplingFile");
      if (mainFile.equals(samplingFile)) {
        throw new IllegalArgumentException("main and sampling must be different files: " + mainFile);
      }
    }
  }

  private DataFileLocator() {}

  /**
   * Resolves both files for a configuration.
   *
   * @param config build configuration
   * @return readable input files
   * @throws IllegalArgumentException if a file is missing, unreadable or ambiguous
   */
  public static DataFiles locate(GuideConfig config) {
    Objects.requireNonNull(config, "config");
    Path main;
    Path sampling;
    if (config.mainFile().isPresent() && config.samplingFile().isPresent()) {
      main = config.mainFile().get();
      sampling = config.samplingFile().get();
    } else {
      List<Path> candidates = listCandidates(config.dataDirectory());
      main = config.mainFile().orElseGet(() -> single(
          "observation file (" + MAIN_PREFIX + "*" + TEXT_SUFFIX + ")",
          config.dataDirectory(),
          candidates.stream()
              .filter(p -> PathUtils.nameMatches(p, MAIN_PREFIX, TEXT_SUFFIX))
              .filter(p -> !PathUtils.nameMatches(p, "", SAMPLING_SUFFIX))
              .toList()));
      sampling = config.samplingFile().orElseGet(() -> single(
          "sampling file (*" + SAMPLING_SUFFIX + ")",
          config.dataDirectory(),
          candidates.stream().filter(p -> PathUtils.nameMatches(p, "", SAMPLING_SUFFIX)).toList()));
    }
    return new DataFiles(
        Paths.requireReadableFile("main", main), Paths.requireReadableFile("sampling", sampling));
  }

  private static List<Path> listCandidates(Path dataDirectory) {
    Path dir = Paths.requireReadableDir("dataDir", dataDirectory);
    try (Stream<Path> files = Files.list(dir)) {
      return files.filter(Files::isRegularFile).sorted().toList();
    } catch (IOException ex) {
      throw new IllegalArgumentException("Unable to list dataDir " + dataDirectory + ": " + ex.getMessage(), ex);
    }
  }

  private static Path single(String what, Path dataDirectory, List<Path> matches) {
    if (matches.isEmpty()) {
      throw new IllegalArgumentException("No " + what + " found in " + dataDirectory);
    }
    if (matches.size() > 1) {
      StringBuilder names = new StringBuilder();
      for (Path match : matches) {
        if (names.length() > 0) {
          names.append(", ");
        }
        names.append(PathUtils.displayName(match));
      }
      throw new IllegalArgumentException(
          "Multiple candidates for " + what + " in " + dataDirectory + ": " + names + "; pass it explicitly");
    }
    return matches.get(0);
  }
}

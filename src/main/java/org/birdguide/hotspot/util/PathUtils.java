package org.birdguide.hotspot.util;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/** Utility helpers for working with {@link Path} instances. */
public final class PathUtils {
  private PathUtils() {}

  /**
   * Returns the file name for the supplied path when available.
   *
   * @param path source path; may be {@code null}
   * @return optional file name string
   */
  public static Optional<String> fileName(Path path) {
    if (path == null) {
      return Optional.empty();
    }
    Path name = path.getFileName();
    return name == null ? Optional.empty() : Optional.of(name.toString());
  }

  /**
   * Returns the file name or {@code "<none>"} for log and dry-run output.
   *
   * @param path source path; may be {@code null}
   * @return printable file name
   */
  public static String displayName(Path path) {
    return fileName(path).orElse("<none>");
  }

  /**
   * Case-insensitive check of a file name prefix and suffix.
   *
   * @param path candidate path
   * @param prefix required prefix, empty for none
   * @param suffix required suffix, empty for none
   * @return {@code true} when the file name matches both
   */
  public static boolean nameMatches(Path path, String prefix, String suffix) {
    return fileName(path)
        .map(name -> name.toLowerCase(Locale.ROOT))
        .map(name -> name.startsWith(prefix.toLowerCase(Locale.ROOT))
            && name.endsWith(suffix.toLowerCase(Locale.ROOT)))
        .orElse(false);
  }
}

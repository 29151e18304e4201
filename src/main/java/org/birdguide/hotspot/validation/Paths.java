package org.birdguide.hotspot.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for the guide CLI and configuration flows.
 * <p><strong>Why:</strong> The build replaces its output directory wholesale, so an existing, populated
 * directory must only be reused when the operator asked for it.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize user-provided paths to canonical locations.</li>
 *   <li>Guard against reuse of populated directories unless explicitly approved.</li>
 *   <li>Check that input data files exist and are readable before a pass begins.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 *
 * @implNote Existing-path checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked output directory is
 * reported rather than silently followed.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates an output directory location without creating it.
   *
   * <p>The directory itself may be absent; its nearest existing ancestor must be a writable directory.
   * When the directory exists it must be a directory and, unless {@code allowReuse} is set, empty.</p>
   *
   * @param path candidate directory; must not be {@code null}
   * @param allowReuse when {@code false}, existing non-empty directories are rejected
   * @return canonical directory path when it exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the path is unusable as an output location
   */
  public static Path validateOutputDir(Path path, boolean allowReuse) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    if (containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }

    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
        ensureDirectory(real, allowReuse);
        return real;
      }
      Path parent = normalized.getParent();
      if (parent == null) {
        throw new IllegalArgumentException("path has no parent to validate: " + normalized);
      }
      Path ancestor = nearestExistingAncestor(parent);
      if (!Files.isDirectory(ancestor, LinkOption.NOFOLLOW_LINKS)) {
        throw new IllegalArgumentException("parent is not a directory: " + ancestor);
      }
      if (!Files.isWritable(ancestor)) {
        throw new IllegalArgumentException("parent directory is not writable: " + ancestor);
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Ensures a path names an existing, readable regular file.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate file
   * @return canonical file path
   * @throws IllegalArgumentException if the file is missing, not a regular file, or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    try {
      Path real = path.toRealPath();
      if (!Files.isRegularFile(real)) {
        throw new IllegalArgumentException(name + " is not a regular file: " + path);
      }
      if (!Files.isReadable(real)) {
        throw new IllegalArgumentException(name + " is not readable: " + path);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException(name + " does not exist: " + path, ex);
    }
  }

  /**
   * Ensures a path names an existing, readable directory.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate directory
   * @return canonical directory path
   * @throws IllegalArgumentException if the directory is missing or unreadable
   */
  public static Path requireReadableDir(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    try {
      Path real = path.toRealPath();
      if (!Files.isDirectory(real)) {
        throw new IllegalArgumentException(name + " must be an existing directory: " + path);
      }
      if (!Files.isReadable(real)) {
        throw new IllegalArgumentException(name + " is not readable: " + path);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Unable to access " + name + ": " + path, ex);
    }
  }

  private static void ensureDirectory(Path dir, boolean allowReuse) throws IOException {
    if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("path is not a directory: " + dir);
    }
    if (!Files.isWritable(dir)) {
      throw new IllegalArgumentException("directory is not writable: " + dir);
    }
    if (!allowReuse) {
      try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
        if (entries.iterator().hasNext()) {
          throw new IllegalArgumentException(
              "directory " + dir + " is not empty; re-run with --allow-overwrite to replace it");
        }
      }
    }
  }

  private static Path nearestExistingAncestor(Path start) throws IOException {
    Path current = start;
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current.toRealPath(LinkOption.NOFOLLOW_LINKS);
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}

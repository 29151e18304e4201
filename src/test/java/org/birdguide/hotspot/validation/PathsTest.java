package org.birdguide.hotspot.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void validateOutputDirReturnsCanonicalPathWhenDirectoryExists() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("existing"));

    assertEquals(dir.toRealPath(), Paths.validateOutputDir(dir, false));
  }

  @Test
  void validateOutputDirRejectsNonEmptyDirectoryUnlessReused() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("guide"));
    Files.createFile(dir.resolve("metadata.json"));

    assertThrows(IllegalArgumentException.class, () -> Paths.validateOutputDir(dir, false));
    assertEquals(dir.toRealPath(), Paths.validateOutputDir(dir, true));
  }

  @Test
  void validateOutputDirDoesNotCreateMissingDirectory() {
    Path dir = tempDir.resolve("a/b/guide");

    assertEquals(dir.toAbsolutePath().normalize(), Paths.validateOutputDir(dir, false));
    assertFalse(Files.exists(tempDir.resolve("a")));
  }

  @Test
  void validateOutputDirRejectsRegularFile() throws IOException {
    Path file = Files.createFile(tempDir.resolve("guide"));

    assertThrows(IllegalArgumentException.class, () -> Paths.validateOutputDir(file, true));
  }

  @Test
  void requireReadableFileAndDir() throws IOException {
    Path file = Files.writeString(tempDir.resolve("ebd_region.txt"), "header");

    assertEquals(file.toRealPath(), Paths.requireReadableFile("main", file));
    assertEquals(tempDir.toRealPath(), Paths.requireReadableDir("dataDir", tempDir));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("main", tempDir));
    assertThrows(IllegalArgumentException.class,
        () -> Paths.requireReadableFile("main", tempDir.resolve("absent.txt")));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableDir("dataDir", file));
  }
}

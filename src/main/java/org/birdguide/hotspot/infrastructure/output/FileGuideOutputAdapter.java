package org.birdguide.hotspot.infrastructure.output;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.Objects;
import org.birdguide.hotspot.application.port.GuideLayout;
import org.birdguide.hotspot.application.port.GuideOutputPort;
import org.birdguide.hotspot.application.port.MetricsPort;
import org.birdguide.hotspot.domain.GuideBuild;
import org.birdguide.hotspot.domain.HotspotGuide;
import org.birdguide.hotspot.domain.SpeciesGuide;
import org.birdguide.hotspot.domain.SpeciesKey;
import org.birdguide.hotspot.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Publishes a guide as a directory of JSON documents, all or nothing.
 * <p><strong>Why:</strong> A failed or interrupted build must never leave a half-written guide where readers
 * look for one.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write every document into a hidden staging directory next to the destination.</li>
 *   <li>Swap the staging directory into place with atomic renames, keeping the previous guide until the swap
 *   succeeded.</li>
 *   <li>Remove the staging directory when anything fails.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; concurrent publishes to one destination are unsupported.</p>
 * <p><strong>Observability:</strong> Increments {@code guide.output.files}; logs the swap at INFO.</p>
 *
 * @since 0.1.0
 */
public final class FileGuideOutputAdapter implements GuideOutputPort {
  private static final Logger log = LoggerFactory.getLogger(FileGuideOutputAdapter.class);

  private final Path destination;
  private final boolean allowOverwrite;
  private final MetricsPort metrics;
  private final JsonGuideWriter writer = new JsonGuideWriter();

  /**
   * Creates an adapter.
   *
   * @param destination guide directory
   * @param allowOverwrite whether an existing non-empty directory may be replaced
   * @param metrics metrics sink
   */
  public FileGuideOutputAdapter(Path destination, boolean allowOverwrite, MetricsPort metrics) {
    this.destination = Objects.requireNonNull(destination, "destination").toAbsolutePath().normalize();
    this.allowOverwrite = allowOverwrite;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void publish(GuideBuild build) throws IOException {
    Objects.requireNonNull(build, "build");
    Path parent = destination.getParent();
    if (parent == null) {
      throw new IOException("Output directory has no parent: " + destination);
    }
    checkDestination();
    Files.createDirectories(parent);
    Path staging = Files.createTempDirectory(parent, "." + destination.getFileName() + ".staging-");
    try {
      int files = writeAll(staging, build);
      swap(staging);
      log.info("Wrote {} documents to {}", files, destination);
    } catch (IOException | RuntimeException ex) {
      deleteTree(staging, ex);
      throw ex;
    }
  }

  private int writeAll(Path root, GuideBuild build) throws IOException {
    Files.createDirectories(root.resolve(GuideLayout.SPECIES_DIR));
    Files.createDirectories(root.resolve(GuideLayout.HOTSPOTS_DIR));
    Files.createDirectories(root.resolve(GuideLayout.INDEX_DIR));
    int topN = build.metadata().topN();
    Map<SpeciesKey, String> slugs =
        SpeciesSlugs.assign(build.species().stream().map(SpeciesGuide::species).toList());
    int files = 0;
    for (SpeciesGuide guide : build.species()) {
      try (OutputStream out = create(root.resolve(GuideLayout.speciesDocument(slugs.get(guide.species()))))) {
        writer.writeSpecies(out, guide, topN, build.metadata().thresholds());
      }
      files++;
    }
    for (HotspotGuide guide : build.hotspots()) {
      String localityId;
      try {
        localityId = Strings.requireSafeToken("localityId", guide.hotspot().localityId());
      } catch (IllegalArgumentException ex) {
        throw new IOException("Locality id cannot be used as a file name: " + guide.hotspot().localityId(), ex);
      }
      try (OutputStream out = create(root.resolve(GuideLayout.hotspotDocument(localityId)))) {
        writer.writeHotspot(out, guide);
      }
      files++;
    }
    try (OutputStream out = create(root.resolve(GuideLayout.SPECIES_INDEX))) {
      writer.writeSpeciesIndex(out, build.species(), slugs);
    }
    try (OutputStream out = create(root.resolve(GuideLayout.HOTSPOT_INDEX))) {
      writer.writeHotspotIndex(out, build.hotspots());
    }
    try (OutputStream out = create(root.resolve(GuideLayout.METADATA))) {
      writer.writeMetadata(out, build.metadata());
    }
    return files + 3;
  }

  private OutputStream create(Path file) throws IOException {
    metrics.increment("guide.output.files");
    return Files.newOutputStream(file);
  }

  private void checkDestination() throws IOException {
    if (!Files.exists(destination, LinkOption.NOFOLLOW_LINKS)) {
      return;
    }
    if (!Files.isDirectory(destination, LinkOption.NOFOLLOW_LINKS)) {
      throw new FileAlreadyExistsException(destination.toString(), null, "not a directory");
    }
    if (!allowOverwrite) {
      try (DirectoryStream<Path> entries = Files.newDirectoryStream(destination)) {
        if (entries.iterator().hasNext()) {
          throw new FileAlreadyExistsException(destination.toString(), null, "directory is not empty");
        }
      }
    }
  }

  private void swap(Path staging) throws IOException {
    if (!Files.exists(destination, LinkOption.NOFOLLOW_LINKS)) {
      move(staging, destination);
      return;
    }
    Path backup = destination.resolveSibling("." + destination.getFileName() + ".previous-" + System.nanoTime());
    move(destination, backup);
    try {
      move(staging, destination);
    } catch (IOException ex) {
      try {
        move(backup, destination);
      } catch (IOException restoreFailure) {
        ex.addSuppressed(restoreFailure);
      }
      throw ex;
    }
    IOException cleanup = new IOException("previous guide cleanup failed");
    deleteTree(backup, cleanup);
    if (cleanup.getSuppressed().length > 0) {
      log.warn("Previous guide left at {}: {}", backup, cleanup.getSuppressed()[0].getMessage());
    }
  }

  private static void move(Path from, Path to) throws IOException {
    try {
      Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(from, to);
    }
  }

  private static void deleteTree(Path root, Exception primary) {
    if (!Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
      return;
    }
    try {
      Files.walkFileTree(root, new SimpleFileVisitor<>() {
        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
          Files.delete(file);
          return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
          if (exc != null) {
            throw exc;
          }
          Files.delete(dir);
          return FileVisitResult.CONTINUE;
        }
      });
    } catch (IOException ex) {
      primary.addSuppressed(ex);
    }
  }
}

package org.birdguide.hotspot.application.port;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Read access to a published guide, used by the validator.
 *
 * <p>Documents are parsed into plain {@code Map}/{@code List}/scalar graphs.</p>
 *
 * @since 0.1.0
 */
public interface GuideDocumentSource {
  /**
   * Parses one document relative to the guide root.
   *
   * @param relativePath path such as {@code index/species_index.json}
   * @return parsed document, empty when the file does not exist
   * @throws IOException if the file exists but cannot be read or parsed
   */
  Optional<Object> read(String relativePath) throws IOException;

  /**
   * Lists JSON documents in a guide subdirectory, sorted by name.
   *
   * @param directory subdirectory such as {@code species}
   * @return relative paths of the documents, empty when the directory is missing
   * @throws IOException if the directory cannot be listed
   */
  List<String> list(String directory) throws IOException;

  /**
   * Human-readable location of the guide.
   *
   * @return guide root description
   */
  String location();
}

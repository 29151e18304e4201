package org.birdguide.hotspot.infrastructure.output;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.birdguide.hotspot.application.port.GuideDocumentSource;
import org.birdguide.hotspot.application.port.GuideLayout;

/**
 * Reads a published guide from disk, parsing each document into {@link Map}/{@link List} graphs.
 *
 * @since 0.1.0
 */
public final class JsonGuideDocumentSource implements GuideDocumentSource {
  private final JsonFactory factory = new JsonFactory();
  private final Path root;

  /**
   * Creates a reader over a guide directory.
   *
   * @param root guide directory
   */
  public JsonGuideDocumentSource(Path root) {
    this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
  }

  @Override
  public Optional<Object> read(String relativePath) throws IOException {
    Path file = resolve(relativePath);
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    try (InputStream in = Files.newInputStream(file); JsonParser parser = factory.createParser(in)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new IOException(relativePath + " is empty");
      }
      Object value = readValue(parser, token);
      if (parser.nextToken() != null) {
        throw new IOException(relativePath + " contains trailing content");
      }
      return Optional.ofNullable(value);
    } catch (JsonParseException ex) {
      throw new IOException(relativePath + " is not valid JSON: " + ex.getOriginalMessage(), ex);
    }
  }

  @Override
  public List<String> list(String directory) throws IOException {
    Path dir = resolve(directory);
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .filter(Files::isRegularFile)
          .map(path -> path.getFileName().toString())
          .filter(name -> name.endsWith(GuideLayout.EXTENSION))
          .sorted()
          .map(name -> directory + "/" + name)
          .toList();
    }
  }

  @Override
  public String location() {
    return root.toString();
  }

  private Path resolve(String relativePath) throws IOException {
    Path resolved = root.resolve(relativePath).normalize();
    if (!resolved.startsWith(root)) {
      throw new IOException("Path escapes guide directory: " + relativePath);
    }
    return resolved;
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IOException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IOException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}

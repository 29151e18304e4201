package org.birdguide.hotspot.application.port;

/**
 * <strong>What:</strong> Restartable input: every {@link #open()} starts a fresh, independent traversal.
 * <p><strong>Why:</strong> The checklist pass and the detection pass each need a full traversal and must not
 * observe state left behind by the other.</p>
 * <p><strong>Thread-safety:</strong> Factories are stateless; the streams they open are not shared.</p>
 *
 * @param <T> record type
 * @since 0.1.0
 */
public interface RecordSource<T> {
  /**
   * Opens a new traversal from the first data row.
   *
   * @return open stream; caller closes it
   * @throws SourceReadException if the input cannot be opened or its header is unusable
   */
  RecordStream<T> open() throws SourceReadException;

  /**
   * Label used in logs, MDC and run metadata, typically the file name.
   *
   * @return source name
   */
  String name();
}

package org.birdguide.hotspot.application.port;

import java.io.IOException;
import org.birdguide.hotspot.domain.SourceStats;

/**
 * Pull-based, finite traversal over the admitted records of one input.
 *
 * <p><strong>Thread-safety:</strong> Not thread-safe; one consumer per stream.</p>
 * <p><strong>Performance:</strong> Implementations hold at most one chunk of records in memory.</p>
 *
 * @param <T> record type
 * @since 0.1.0
 */
public interface RecordStream<T> extends AutoCloseable {
  /**
   * Returns the next admitted record or {@code null} when the input is exhausted.
   *
   * @return next record or {@code null}
   * @throws SourceReadException if the underlying input cannot be read
   */
  T next() throws SourceReadException;

  /**
   * Row accounting so far; final once {@link #next()} returned {@code null}.
   *
   * @return statistics snapshot
   */
  SourceStats stats();

  @Override
  void close() throws IOException;
}

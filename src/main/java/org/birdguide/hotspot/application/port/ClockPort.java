package org.birdguide.hotspot.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the build.
 * <p><strong>Why:</strong> Run metadata carries a generation timestamp; tests inject a fixed clock so the
 * published {@code metadata.json} is reproducible.</p>
 *
 * @since 0.1.0
 * @see org.birdguide.hotspot.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Current time as an {@link Instant}.
   *
   * @return instant built from {@link #nowMillis()}
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }
}

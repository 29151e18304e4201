package org.birdguide.hotspot.infrastructure.time;

import org.birdguide.hotspot.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /**
   * Returns the current epoch milliseconds.
   *
   * @return current epoch milliseconds
   */
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}

package org.birdguide.hotspot.application.port;

import java.io.IOException;

/**
 * Fatal failure to read an input source; aborts the build before anything is published.
 */
public class SourceReadException extends IOException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message description naming the source
   */
  public SourceReadException(String message) {
    super(message);
  }

  /**
   * Creates an exception wrapping the I/O cause.
   *
   * @param message description naming the source
   * @param cause underlying failure
   */
  public SourceReadException(String message, Throwable cause) {
    super(message, cause);
  }
}

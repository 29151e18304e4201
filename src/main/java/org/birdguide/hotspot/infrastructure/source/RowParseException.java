package org.birdguide.hotspot.infrastructure.source;

/**
 * A single input row is missing a required field or carries an unparseable value.
 *
 * <p>Never escapes the reader: the row is skipped and counted.</p>
 */
public final class RowParseException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception.
   *
   * @param message which field failed and why
   */
  public RowParseException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a cause.
   *
   * @param message which field failed and why
   * @param cause parse failure
   */
  public RowParseException(String message, Throwable cause) {
    super(message, cause);
  }
}

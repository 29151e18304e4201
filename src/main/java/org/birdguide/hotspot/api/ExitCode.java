package org.birdguide.hotspot.api;

/**
 * <strong>What:</strong> Process exit codes shared by the guide commands.
 * <p><strong>Why:</strong> Lets schedulers tell bad input apart from unreadable files and inconsistent data
 * without parsing logs.</p>
 * <p><strong>Role:</strong> Returned by every CLI entry point; {@link Main} passes it to {@code System.exit}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments or paths were invalid. */
  INVALID_ARGS(2),
  /** An input could not be read or the guide could not be written. */
  IO_ERROR(3),
  /** Thresholds, seasons or other settings were malformed or inconsistent. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** Tallies contradicted each other, or a published guide failed validation. */
  DATA_FAULT(6),
  /** Process was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Numeric value reported to the operating system.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}

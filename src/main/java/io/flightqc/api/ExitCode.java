package io.flightqc.api;

/**
 * <strong>What:</strong> Process exit codes of the FlightQC CLI.
 * <p><strong>Why:</strong> Lets schedulers and scripts tell a bad argument from an unreachable host or a site that
 * took too long.</p>
 * <p><strong>Thread-safety:</strong> Immutable enum.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Analysis finished and both output files were written. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Local or remote I/O failed after the session was open, e.g. listing the site root. */
  IO_ERROR(3),
  /** Configuration was missing or malformed, including an unset secret variable. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** The primary session could not be opened. */
  CONNECTION_FAILED(6),
  /** The outer analysis timeout expired. */
  GATEWAY_TIMEOUT(7),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}

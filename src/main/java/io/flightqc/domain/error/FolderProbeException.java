package io.flightqc.domain.error;

/**
 * Raised when the pre-check or listing of one site folder fails. Recovered by the folder
 * aggregator, which records the folder as failed and moves on to its siblings.
 *
 * @since 0.1.0
 */
public class FolderProbeException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String folder;

  /**
   * Creates the exception.
   *
   * @param folder folder name that failed the probe
   * @param message failure description surfaced in the folder report
   * @param cause underlying I/O failure
   */
  public FolderProbeException(String folder, String message, Throwable cause) {
    super(message, cause);
    this.folder = folder;
  }

  /**
   * Returns the folder that failed.
   *
   * @return folder name
   */
  public String folder() {
    return folder;
  }
}

package io.flightqc.domain.error;

/**
 * Raised when fewer sessions than the configured floor could be established for a batch.
 *
 * @since 0.1.0
 */
public class InsufficientPoolException extends Exception {
  private static final long serialVersionUID = 1L;

  private final int available;
  private final int floor;

  public InsufficientPoolException(int available, int floor) {
    super("Connection pool too small (" + available + " live, floor " + floor + ")");
    this.available = available;
    this.floor = floor;
  }

  public int available() {
    return available;
  }

  public int floor() {
    return floor;
  }
}

package io.flightqc.domain.error;

import java.time.Duration;

/**
 * Raised when no pooled connection became free within the lease timeout, or the pool has no
 * live connections left. The scheduler answers it by deferring the item to a sequential pass.
 *
 * @since 0.1.0
 */
public class PoolExhaustedException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Duration waited;

  /**
   * Creates the exception.
   *
   * @param message description including pool capacity
   * @param waited time spent waiting for a lease
   */
  public PoolExhaustedException(String message, Duration waited) {
    super(message);
    this.waited = waited;
  }

  /**
   * Returns how long the caller waited before giving up.
   *
   * @return wait duration; {@link Duration#ZERO} when the pool was already empty
   */
  public Duration waited() {
    return waited;
  }
}

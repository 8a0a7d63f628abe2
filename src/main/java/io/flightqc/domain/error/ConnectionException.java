package io.flightqc.domain.error;

import java.io.IOException;

/**
 * Signals that a remote session could not be opened or stopped answering.
 *
 * <p>Fatal to a single lease only: the pool drops the affected connection and the batch carries on.
 * The one place it escapes to the caller is the initial session of an analysis.</p>
 *
 * @since 0.1.0
 */
public class ConnectionException extends IOException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a diagnostic message.
   *
   * @param message description of the failure
   */
  public ConnectionException(String message) {
    super(message);
  }

  /**
   * Creates an exception wrapping the transport-level cause.
   *
   * @param message description of the failure
   * @param cause underlying transport exception
   */
  public ConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}

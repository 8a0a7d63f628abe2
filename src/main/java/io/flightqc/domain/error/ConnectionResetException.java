package io.flightqc.domain.error;

/**
 * Raised when an established session breaks mid-call (peer reset, channel closed, EOF).
 *
 * @since 0.1.0
 */
public class ConnectionResetException extends ConnectionException {
  private static final long serialVersionUID = 1L;

  public ConnectionResetException(String message) {
    super(message);
  }

  public ConnectionResetException(String message, Throwable cause) {
    super(message, cause);
  }
}

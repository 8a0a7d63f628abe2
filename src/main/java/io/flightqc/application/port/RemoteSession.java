package io.flightqc.application.port;

import io.flightqc.domain.remote.RemoteEntry;
import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * <strong>What:</strong> An open file-transfer session exposing the read-only primitives extraction needs.
 * <p><strong>Why:</strong> Keeps the pool and scheduler independent of the SSH library.</p>
 * <p><strong>Role:</strong> Implemented by {@code JschRemoteSession}; tests use in-memory fakes.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. A session is used by one worker at a time; the pool enforces
 * exclusive leases.</p>
 * <p><strong>Timeouts:</strong> every call takes its own timeout; a call that exceeds it fails with an
 * {@link IOException} rather than blocking.</p>
 *
 * @since 0.1.0
 */
public interface RemoteSession extends AutoCloseable {

  /** Stable identifier of this session, unique within the process. */
  String id();

  /**
   * Reads metadata for a single path.
   *
   * @param path absolute remote path
   * @param timeout upper bound for the call
   * @return entry describing the path
   * @throws IOException if the path is missing or the session fails;
   *     {@link io.flightqc.domain.error.ConnectionResetException} when the session itself broke
   */
  RemoteEntry stat(String path, Duration timeout) throws IOException;

  /**
   * Lists the immediate children of a directory, excluding {@code .} and {@code ..}.
   *
   * @param path absolute remote directory path
   * @param timeout upper bound for the call
   * @return entries in server order
   * @throws IOException if listing fails
   */
  List<RemoteEntry> list(String path, Duration timeout) throws IOException;

  /**
   * Reads at most {@code maxBytes} from the start of a file.
   *
   * @param path absolute remote file path
   * @param maxBytes prefix length; shorter files return their full content
   * @param timeout upper bound for the call
   * @return bytes read
   * @throws IOException if the read fails
   */
  byte[] readPrefix(String path, int maxBytes, Duration timeout) throws IOException;

  /** Whether the underlying transport still reports itself connected. A probe is still needed to trust it. */
  boolean isOpen();

  /** Closes the session. Failures are logged, never thrown. */
  @Override
  void close();
}

package io.flightqc.application.port;

import io.flightqc.domain.error.ConnectionException;
import io.flightqc.domain.remote.SessionCredentials;
import java.time.Duration;

/**
 * Opens remote file-transfer sessions.
 *
 * <p>Implementations must be safe to call from several threads at once; the pool opens connections
 * concurrently with running extractions.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SessionProvider {

  /**
   * Opens and authenticates a new session.
   *
   * @param credentials endpoint and login
   * @param connectTimeout upper bound for connect plus authentication
   * @return open session owned by the caller
   * @throws ConnectionException if the session cannot be established
   */
  RemoteSession open(SessionCredentials credentials, Duration connectTimeout) throws ConnectionException;
}

package io.flightqc.application.pool;

import io.flightqc.application.port.RemoteSession;
import io.flightqc.application.port.SessionProvider;
import io.flightqc.domain.error.ConnectionException;
import io.flightqc.domain.remote.SessionCredentials;
import java.time.Duration;
import java.util.Objects;

/**
 * Opens sessions to one fixed endpoint; the pool uses it to create and replace connections.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SessionFactory {

  /**
   * Opens a new session.
   *
   * @param connectTimeout upper bound for connect plus authentication
   * @return open session
   * @throws ConnectionException if the session cannot be established
   */
  RemoteSession open(Duration connectTimeout) throws ConnectionException;

  /**
   * Binds a provider to fixed credentials.
   *
   * @param provider session provider
   * @param credentials endpoint and login
   * @return factory opening sessions for those credentials
   */
  static SessionFactory of(SessionProvider provider, SessionCredentials credentials) {
    Objects.requireNonNull(provider, "provider");
    Objects.requireNonNull(credentials, "credentials");
    return timeout -> provider.open(credentials, timeout);
  }
}

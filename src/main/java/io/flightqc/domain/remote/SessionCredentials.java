package io.flightqc.domain.remote;

import io.flightqc.logging.Logs;
import io.flightqc.validation.Net;
import io.flightqc.validation.Numbers;
import io.flightqc.validation.Strings;

/**
 * Connection parameters for one remote file-transfer session.
 *
 * <p>The secret never appears in {@link #toString()}; log the record freely.</p>
 *
 * @param host remote host name or IP literal
 * @param port TCP port (1-65535)
 * @param user login name
 * @param secret password; may be empty when key-based authentication is configured elsewhere
 * @since 0.1.0
 */
public record SessionCredentials(String host, int port, String user, String secret) {

  /**
   * Validates host, port and user.
   *
   * @throws IllegalArgumentException when the host is malformed, the port is out of range, or the
   *     user is blank
   */
  public SessionCredentials {
    host = Net.validateHost(Strings.requireNonBlank("host", host));
    Numbers.requireRange("port", port, 1, 65_535);
    user = Strings.requireNonBlank("user", user);
    secret = secret == null ? "" : secret;
  }

  /**
   * Returns {@code user@host:port} for log lines.
   *
   * @return endpoint label without the secret
   */
  public String endpoint() {
    return user + "@" + host + ":" + port;
  }

  @Override
  public String toString() {
    return "SessionCredentials[" + endpoint() + ", secret=" + Logs.redact(secret) + "]";
  }
}

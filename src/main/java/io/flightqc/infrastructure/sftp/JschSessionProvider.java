package io.flightqc.infrastructure.sftp;

import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import io.flightqc.application.port.RemoteSession;
import io.flightqc.application.port.SessionProvider;
import io.flightqc.domain.error.ConnectionException;
import io.flightqc.domain.remote.SessionCredentials;
import io.flightqc.infrastructure.exec.ExecutorFactories;
import io.flightqc.logging.Logs;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SessionProvider} that opens password-authenticated SFTP channels with JSch.
 * <p><strong>Why:</strong> Each pooled connection is a separate SSH session so reads never contend on one channel.</p>
 * <p><strong>Thread-safety:</strong> {@link #open} may be called concurrently; each call builds its own
 * {@link Session}.</p>
 * <p><strong>Lifecycle:</strong> owns the executor that bounds blocking SFTP calls; {@link #close()} stops it.</p>
 *
 * @since 0.1.0
 */
public final class JschSessionProvider implements SessionProvider, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(JschSessionProvider.class);
  private static final String COMPRESSION = "zlib@openssh.com,zlib,none";

  private final JSch jsch;
  private final SftpOptions options;
  private final ExecutorService calls;
  private final AtomicLong sequence = new AtomicLong();

  /**
   * Creates a provider.
   *
   * @param options transport options
   * @throws ConnectionException if the known-hosts file cannot be loaded
   */
  public JschSessionProvider(SftpOptions options) throws ConnectionException {
    this.options = Objects.requireNonNull(options, "options");
    this.jsch = new JSch();
    if (options.knownHosts().isPresent()) {
      try {
        jsch.setKnownHosts(options.knownHosts().get().toString());
      } catch (JSchException ex) {
        throw new ConnectionException("Unable to load known hosts " + options.knownHosts().get(), ex);
      }
    }
    this.calls = ExecutorFactories.newIoPool(
        "flightqc-sftp", (thread, error) -> log.error("Uncaught failure on {}", thread.getName(), error));
  }

  @Override
  public RemoteSession open(SessionCredentials credentials, Duration connectTimeout) throws ConnectionException {
    Objects.requireNonNull(credentials, "credentials");
    int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, Math.max(1L, connectTimeout.toMillis()));
    Session session = null;
    try {
      session = jsch.getSession(credentials.user(), credentials.host(), credentials.port());
      session.setPassword(credentials.secret());
      session.setConfig("StrictHostKeyChecking", options.strictHostKeyChecking() ? "yes" : "no");
      session.setConfig("PreferredAuthentications", "password,keyboard-interactive,publickey");
      if (options.compression()) {
        session.setConfig("compression.s2c", COMPRESSION);
        session.setConfig("compression.c2s", COMPRESSION);
      }
      if (!options.keepAlive().isZero()) {
        session.setServerAliveInterval((int) options.keepAlive().toMillis());
      }
      session.connect(timeoutMillis);
      ChannelSftp channel = (ChannelSftp) session.openChannel("sftp");
      channel.connect(timeoutMillis);
      String id = "sftp-" + sequence.incrementAndGet();
      log.debug("Opened session {} to {}", id, credentials.endpoint());
      return new JschRemoteSession(id, session, channel, calls);
    } catch (JSchException ex) {
      if (session != null) {
        session.disconnect();
      }
      throw new ConnectionException(
          "Unable to open SFTP session to " + credentials.endpoint() + ": " + Logs.describe(ex), ex);
    }
  }

  @Override
  public void close() {
    calls.shutdownNow();
    try {
      if (!calls.awaitTermination(2, TimeUnit.SECONDS)) {
        log.debug("SFTP call threads still blocked after shutdown");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}

package io.flightqc.infrastructure.sftp;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Transport options for SFTP sessions.
 *
 * @param compression negotiate zlib compression in both directions
 * @param strictHostKeyChecking reject hosts missing from {@code knownHosts}
 * @param knownHosts OpenSSH known_hosts file; required when strict checking is on
 * @param keepAlive interval between server-alive probes; zero disables them
 * @since 0.1.0
 */
public record SftpOptions(
    boolean compression, boolean strictHostKeyChecking, Optional<Path> knownHosts, Duration keepAlive) {

  public SftpOptions {
    knownHosts = Objects.requireNonNullElse(knownHosts, Optional.empty());
    keepAlive = Objects.requireNonNullElse(keepAlive, Duration.ZERO);
    if (keepAlive.isNegative()) {
      throw new IllegalArgumentException("keepAlive must not be negative");
    }
    if (strictHostKeyChecking && knownHosts.isEmpty()) {
      throw new IllegalArgumentException("strictHostKeyChecking requires a knownHosts file");
    }
  }

  public static SftpOptions defaults() {
    return new SftpOptions(true, false, Optional.empty(), Duration.ofSeconds(15));
  }
}

package io.flightqc.infrastructure.sftp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SftpOptionsTest {

  @Test
  void defaultsCompressWithKeepAliveAndNoHostKeyCheck() {
    SftpOptions options = SftpOptions.defaults();

    assertTrue(options.compression());
    assertFalse(options.strictHostKeyChecking());
    assertEquals(Duration.ofSeconds(15), options.keepAlive());
  }

  @Test
  void nullsNormaliseToAbsent() {
    SftpOptions options = new SftpOptions(false, false, null, null);

    assertTrue(options.knownHosts().isEmpty());
    assertTrue(options.keepAlive().isZero());
  }

  @Test
  void strictCheckingNeedsKnownHosts() {
    assertThrows(IllegalArgumentException.class,
        () -> new SftpOptions(true, true, Optional.empty(), Duration.ZERO));
    new SftpOptions(true, true, Optional.of(Path.of("/etc/ssh/ssh_known_hosts")), Duration.ZERO);
  }

  @Test
  void rejectsNegativeKeepAlive() {
    assertThrows(IllegalArgumentException.class,
        () -> new SftpOptions(true, false, Optional.empty(), Duration.ofSeconds(-1)));
  }
}

package io.flightqc.infrastructure.sftp;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.flightqc.domain.error.ConnectionException;
import io.flightqc.domain.remote.SessionCredentials;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class JschSessionProviderTest {

  @Test
  void refusedEndpointSurfacesAsConnectionExceptionWithoutSecret() throws Exception {
    int port = closedPort();
    SessionCredentials credentials = new SessionCredentials("127.0.0.1", port, "pilot", "hunter2");

    try (JschSessionProvider provider = new JschSessionProvider(SftpOptions.defaults())) {
      ConnectionException ex = assertThrows(ConnectionException.class,
          () -> provider.open(credentials, Duration.ofSeconds(2)));

      assertTrue(ex.getMessage().contains("127.0.0.1:" + port), ex.getMessage());
      assertFalse(ex.getMessage().contains("hunter2"), ex.getMessage());
    }
  }

  private static int closedPort() throws IOException {
    try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      return socket.getLocalPort();
    }
  }
}

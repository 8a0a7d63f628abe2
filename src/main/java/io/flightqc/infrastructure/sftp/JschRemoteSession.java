package io.flightqc.infrastructure.sftp;

import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.SftpATTRS;
import com.jcraft.jsch.SftpException;
import io.flightqc.application.port.RemoteSession;
import io.flightqc.domain.error.ConnectionResetException;
import io.flightqc.domain.remote.EntryType;
import io.flightqc.domain.remote.RemoteEntry;
import io.flightqc.domain.remote.RemotePaths;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.SocketException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RemoteSession} over one JSch SSH session and its SFTP channel.
 *
 * <p>JSch has no per-call deadline, so every call runs on the provider's call executor and is awaited with its
 * timeout. A call that overruns closes the session: the channel may be mid-packet and cannot be reused.</p>
 */
final class JschRemoteSession implements RemoteSession {
  private static final Logger log = LoggerFactory.getLogger(JschRemoteSession.class);
  private static final int READ_CHUNK = 8 * 1024;

  private final String id;
  private final Session session;
  private final ChannelSftp channel;
  private final ExecutorService calls;

  JschRemoteSession(String id, Session session, ChannelSftp channel, ExecutorService calls) {
    this.id = id;
    this.session = session;
    this.channel = channel;
    this.calls = calls;
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public RemoteEntry stat(String path, Duration timeout) throws IOException {
    return call("stat " + path, timeout, () -> toEntry(RemotePaths.fileName(path), channel.stat(path)));
  }

  @Override
  public List<RemoteEntry> list(String path, Duration timeout) throws IOException {
    return call("list " + path, timeout, () -> {
      List<RemoteEntry> entries = new ArrayList<>();
      for (Object raw : channel.ls(path)) {
        ChannelSftp.LsEntry entry = (ChannelSftp.LsEntry) raw;
        String name = entry.getFilename();
        if (".".equals(name) || "..".equals(name)) {
          continue;
        }
        entries.add(toEntry(name, entry.getAttrs()));
      }
      return entries;
    });
  }

  @Override
  public byte[] readPrefix(String path, int maxBytes, Duration timeout) throws IOException {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    return call("read " + path, timeout, () -> {
      byte[] buffer = new byte[maxBytes];
      int filled = 0;
      try (InputStream in = channel.get(path)) {
        while (filled < maxBytes) {
          int n = in.read(buffer, filled, Math.min(READ_CHUNK, maxBytes - filled));
          if (n < 0) {
            break;
          }
          filled += n;
        }
      }
      return filled == maxBytes ? buffer : Arrays.copyOf(buffer, filled);
    });
  }

  @Override
  public boolean isOpen() {
    return session.isConnected() && channel.isConnected() && !channel.isClosed();
  }

  @Override
  public void close() {
    try {
      channel.disconnect();
    } finally {
      session.disconnect();
    }
    log.debug("Closed session {}", id);
  }

  private <T> T call(String description, Duration timeout, SftpCall<T> action) throws IOException {
    if (!isOpen()) {
      throw new ConnectionResetException("Session " + id + " is closed");
    }
    Future<T> future;
    try {
      future = calls.submit(action::run);
    } catch (RejectedExecutionException ex) {
      throw new ConnectionResetException("Session " + id + " can no longer issue calls", ex);
    }
    try {
      return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      close();
      throw new InterruptedIOException(description + " timed out after " + timeout.toMillis() + " ms");
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new InterruptedIOException(description + " interrupted");
    } catch (ExecutionException ex) {
      throw translate(description, ex.getCause());
    }
  }

  private IOException translate(String description, Throwable cause) {
    if (cause instanceof SftpException sftp) {
      if (sftp.id == ChannelSftp.SSH_FX_CONNECTION_LOST || sftp.id == ChannelSftp.SSH_FX_NO_CONNECTION
          || brokenTransport(sftp.getCause()) || !isOpen()) {
        return new ConnectionResetException(description + " lost the connection: " + sftp.getMessage(), sftp);
      }
      return new IOException(description + " failed: " + sftp.getMessage(), sftp);
    }
    if (brokenTransport(cause) || (cause instanceof IOException && !isOpen())) {
      return new ConnectionResetException(description + " lost the connection: " + cause.getMessage(), cause);
    }
    if (cause instanceof IOException io) {
      return io;
    }
    return new IOException(description + " failed", cause);
  }

  private static boolean brokenTransport(Throwable cause) {
    return cause instanceof EOFException || cause instanceof SocketException;
  }

  private static RemoteEntry toEntry(String name, SftpATTRS attrs) {
    EntryType type = attrs.isDir() ? EntryType.DIRECTORY : attrs.isReg() ? EntryType.FILE : EntryType.OTHER;
    long size = type == EntryType.FILE ? attrs.getSize() : 0L;
    int mtime = attrs.getMTime();
    Optional<Instant> modified = mtime > 0 ? Optional.of(Instant.ofEpochSecond(mtime)) : Optional.empty();
    return new RemoteEntry(name, type, size, modified);
  }

  @FunctionalInterface
  private interface SftpCall<T> {
    T run() throws SftpException, IOException;
  }
}

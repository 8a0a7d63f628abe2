package io.flightqc.domain.remote;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One entry returned by a remote directory listing or stat call.
 *
 * @param name entry name without its parent path
 * @param type file, directory or other
 * @param size size in bytes; {@code 0} for directories or when unknown
 * @param modified last modification time when the server reports one
 * @since 0.1.0
 */
public record RemoteEntry(String name, EntryType type, long size, Optional<Instant> modified) {

  public RemoteEntry {
    Objects.requireNonNull(name, "name");
    type = Objects.requireNonNullElse(type, EntryType.OTHER);
    size = Math.max(0L, size);
    modified = Objects.requireNonNullElse(modified, Optional.empty());
  }

  public static RemoteEntry file(String name, long size) {
    return new RemoteEntry(name, EntryType.FILE, size, Optional.empty());
  }

  public static RemoteEntry directory(String name) {
    return new RemoteEntry(name, EntryType.DIRECTORY, 0L, Optional.empty());
  }

  public boolean isDirectory() {
    return type == EntryType.DIRECTORY;
  }

  public boolean isFile() {
    return type == EntryType.FILE;
  }
}

package io.flightqc.testing;

import io.flightqc.domain.remote.EntryType;
import io.flightqc.domain.remote.RemoteEntry;
import io.flightqc.domain.remote.RemotePaths;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory remote file tree shared by every {@link FakeRemoteSession} of a test.
 *
 * <p>Paths are absolute and forward-slash separated. Parent directories are created implicitly.</p>
 */
public final class FakeSite {
  private final Map<String, byte[]> files = new ConcurrentHashMap<>();
  private final Set<String> directories = ConcurrentHashMap.newKeySet();
  private final Map<String, Duration> readDelays = new ConcurrentHashMap<>();
  private final Set<String> statFailures = ConcurrentHashMap.newKeySet();
  private final Set<String> listFailures = ConcurrentHashMap.newKeySet();
  private final Set<String> readFailures = ConcurrentHashMap.newKeySet();
  private final Set<String> readCrashes = ConcurrentHashMap.newKeySet();

  public FakeSite() {
    directories.add("/");
  }

  public FakeSite directory(String path) {
    String current = "";
    for (String segment : path.split("/")) {
      if (segment.isEmpty()) {
        continue;
      }
      current = current + "/" + segment;
      directories.add(current);
    }
    return this;
  }

  public FakeSite file(String path, byte[] content) {
    directory(parent(path));
    files.put(path, content.clone());
    return this;
  }

  /** Adds an image whose content the {@link TextGeotagExtractor} decodes into the given fix. */
  public FakeSite image(String path, double latitude, double longitude, double altitudeFeet) {
    return file(path, TextGeotagExtractor.encode(latitude, longitude, altitudeFeet));
  }

  /** Adds an image without a geotag. */
  public FakeSite plainImage(String path, int size) {
    return file(path, new byte[size]);
  }

  public FakeSite text(String path, String content) {
    return file(path, content.getBytes(StandardCharsets.UTF_8));
  }

  public FakeSite slowRead(String path, Duration delay) {
    readDelays.put(path, delay);
    return this;
  }

  public FakeSite slowReadsUnder(String directory, Duration delay) {
    for (String path : files.keySet()) {
      if (path.startsWith(directory + "/")) {
        readDelays.put(path, delay);
      }
    }
    return this;
  }

  public FakeSite failStat(String path) {
    statFailures.add(path);
    return this;
  }

  public FakeSite failList(String path) {
    listFailures.add(path);
    return this;
  }

  public FakeSite failRead(String path) {
    readFailures.add(path);
    return this;
  }

  /** Makes reads of {@code path} throw an unchecked exception, as a buggy transport library would. */
  public FakeSite crashRead(String path) {
    readCrashes.add(path);
    return this;
  }

  RemoteEntry stat(String path) throws IOException {
    if (statFailures.contains(path)) {
      throw new IOException("Permission denied: " + path);
    }
    if (directories.contains(path)) {
      return RemoteEntry.directory(RemotePaths.fileName(path));
    }
    byte[] content = files.get(path);
    if (content == null) {
      throw new IOException("No such file: " + path);
    }
    return RemoteEntry.file(RemotePaths.fileName(path), content.length);
  }

  List<RemoteEntry> list(String path) throws IOException {
    if (listFailures.contains(path) || statFailures.contains(path)) {
      throw new IOException("Permission denied: " + path);
    }
    if (!directories.contains(path)) {
      throw new IOException("No such directory: " + path);
    }
    List<RemoteEntry> entries = new ArrayList<>();
    for (String dir : directories) {
      if (!dir.equals(path) && parent(dir).equals(path)) {
        entries.add(new RemoteEntry(RemotePaths.fileName(dir), EntryType.DIRECTORY, 0L, Optional.empty()));
      }
    }
    for (Map.Entry<String, byte[]> file : files.entrySet()) {
      if (parent(file.getKey()).equals(path)) {
        entries.add(RemoteEntry.file(RemotePaths.fileName(file.getKey()), file.getValue().length));
      }
    }
    return entries;
  }

  byte[] content(String path) throws IOException {
    if (readCrashes.contains(path)) {
      throw new IllegalStateException("channel state corrupted reading " + path);
    }
    if (readFailures.contains(path)) {
      throw new IOException("Failure reading " + path);
    }
    byte[] content = files.get(path);
    if (content == null) {
      throw new IOException("No such file: " + path);
    }
    return content;
  }

  Duration readDelay(String path) {
    return readDelays.getOrDefault(path, Duration.ZERO);
  }

  private static String parent(String path) {
    int idx = path.lastIndexOf('/');
    return idx <= 0 ? "/" : path.substring(0, idx);
  }
}

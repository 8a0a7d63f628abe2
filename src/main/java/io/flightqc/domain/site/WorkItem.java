package io.flightqc.domain.site;

import io.flightqc.domain.remote.RemotePaths;
import java.util.Objects;

/**
 * One image scheduled for extraction. Each item is consumed exactly once per batch.
 *
 * @param folder owning folder name
 * @param path full remote path of the image
 * @since 0.1.0
 */
public record WorkItem(String folder, String path) {

  public WorkItem {
    Objects.requireNonNull(folder, "folder");
    Objects.requireNonNull(path, "path");
  }

  public String fileName() {
    return RemotePaths.fileName(path);
  }
}

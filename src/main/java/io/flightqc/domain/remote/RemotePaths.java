package io.flightqc.domain.remote;

/**
 * Path helpers for the forward-slash paths used by remote file-transfer servers.
 *
 * @since 0.1.0
 */
public final class RemotePaths {
  private RemotePaths() {}

  /**
   * Joins a parent and child path and collapses duplicate separators.
   *
   * @param parent parent directory, e.g. {@code /homes/pilot/site}
   * @param child child entry name
   * @return joined path
   */
  public static String join(String parent, String child) {
    String base = parent == null || parent.isEmpty() ? "/" : parent;
    return (base + "/" + child).replaceAll("/{2,}", "/");
  }

  /**
   * Returns the last path segment.
   *
   * @param path remote path
   * @return final segment, or the input when it has no separator
   */
  public static String fileName(String path) {
    if (path == null || path.isEmpty()) {
      return "";
    }
    String trimmed = path.endsWith("/") && path.length() > 1 ? path.substring(0, path.length() - 1) : path;
    int idx = trimmed.lastIndexOf('/');
    return idx < 0 ? trimmed : trimmed.substring(idx + 1);
  }
}

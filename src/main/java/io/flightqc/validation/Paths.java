package io.flightqc.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for report output directories.
 * <p><strong>Why:</strong> The analyze command writes {@code analysis.json} and {@code scene.json}; the target must
 * be a writable directory before any remote session is opened.
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates (and optionally creates) a writable output directory.
   *
   * @param path candidate directory; must not be {@code null}
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @return real path when the directory exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the path is not a writable directory or creation fails
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          return normalized;
        }
        Files.createDirectories(normalized);
      }
      Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
      if (!Files.isDirectory(real, LinkOption.NOFOLLOW_LINKS)) {
        throw new IllegalArgumentException("path is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException("directory is not writable: " + real);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates a remote (forward-slash) absolute path.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate remote path, e.g. {@code /homes/pilot/12345678}
   * @return the path without a trailing slash (except for {@code /})
   * @throws IllegalArgumentException if the path is blank, relative, or contains {@code ..} segments
   */
  public static String requireRemoteAbsolute(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value);
    if (!sanitized.startsWith("/")) {
      throw new IllegalArgumentException(name + " must be an absolute remote path (was " + sanitized + ")");
    }
    for (String segment : sanitized.split("/")) {
      if ("..".equals(segment)) {
        throw new IllegalArgumentException(name + " must not contain '..' segments");
      }
    }
    if (sanitized.length() > 1 && sanitized.endsWith("/")) {
      return sanitized.substring(0, sanitized.length() - 1);
    }
    return sanitized;
  }
}

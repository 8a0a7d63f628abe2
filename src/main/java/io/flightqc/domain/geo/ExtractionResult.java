package io.flightqc.domain.geo;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Geotag found in one remote image.
 *
 * <p>Images without a usable geotag produce no {@code ExtractionResult}; they still count toward the folder's
 * image total.</p>
 *
 * @param folder originating folder name
 * @param filename image file name
 * @param path full remote path of the image
 * @param latitude signed decimal degrees
 * @param longitude signed decimal degrees
 * @param altitudeFeet altitude in feet
 * @param capturedAt optional capture time
 * @since 0.1.0
 */
public record ExtractionResult(
    String folder,
    String filename,
    String path,
    double latitude,
    double longitude,
    double altitudeFeet,
    Optional<LocalDateTime> capturedAt) {

  public ExtractionResult {
    Objects.requireNonNull(folder, "folder");
    Objects.requireNonNull(filename, "filename");
    Objects.requireNonNull(path, "path");
    capturedAt = Objects.requireNonNullElse(capturedAt, Optional.empty());
  }

  /**
   * Attributes a decoded fix to the image it came from.
   *
   * @param folder originating folder name
   * @param filename image file name
   * @param path full remote path
   * @param fix decoded position
   * @return extraction result
   */
  public static ExtractionResult of(String folder, String filename, String path, GeoFix fix) {
    return new ExtractionResult(
        folder, filename, path, fix.latitude(), fix.longitude(), fix.altitudeFeet(), fix.capturedAt());
  }
}

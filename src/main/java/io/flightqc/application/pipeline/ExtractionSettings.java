package io.flightqc.application.pipeline;

import io.flightqc.validation.Numbers;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * What gets read from each folder and how much of each image.
 *
 * @param prefixBytes bytes read from the start of each image
 * @param imageExtensions lower-case extensions without the dot, e.g. {@code jpg}
 * @param altitudePrecedence ordered altitude sources, e.g. {@code xmp:drone-dji:RelativeAltitude}
 * @param probeTimeout timeout of the folder pre-check
 * @param listTimeout timeout of a directory listing
 * @since 0.1.0
 */
public record ExtractionSettings(
    int prefixBytes,
    List<String> imageExtensions,
    List<String> altitudePrecedence,
    Duration probeTimeout,
    Duration listTimeout) {

  public static final List<String> DEFAULT_EXTENSIONS = List.of("jpg", "jpeg", "png", "tif", "tiff", "dng");
  public static final List<String> DEFAULT_ALTITUDE_PRECEDENCE =
      List.of("xmp:drone-dji:RelativeAltitude", "xmp:DJI:RelativeAltitude", "gps:altitude");

  public ExtractionSettings {
    Numbers.requireRange("extract.prefixBytes", prefixBytes, 1_024, 16 * 1_024 * 1_024);
    imageExtensions = imageExtensions.stream()
        .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
        .map(ext -> ext.toLowerCase(Locale.ROOT))
        .toList();
    altitudePrecedence = List.copyOf(altitudePrecedence);
    if (imageExtensions.isEmpty()) {
      throw new IllegalArgumentException("extract.extensions must list at least one extension");
    }
    Objects.requireNonNull(probeTimeout, "probeTimeout");
    Objects.requireNonNull(listTimeout, "listTimeout");
  }

  public static ExtractionSettings defaults() {
    return new ExtractionSettings(
        64 * 1_024, DEFAULT_EXTENSIONS, DEFAULT_ALTITUDE_PRECEDENCE, Duration.ofSeconds(10), Duration.ofSeconds(30));
  }

  /**
   * Tests whether a file name carries one of the configured image extensions, ignoring case.
   *
   * @param fileName file name
   * @return {@code true} for images
   */
  public boolean isImage(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return false;
    }
    return imageExtensions.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
  }
}

package io.flightqc.domain.geo;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Position decoded from one image's embedded metadata, before it is attributed to a folder and file.
 *
 * @param latitude signed decimal degrees (south negative)
 * @param longitude signed decimal degrees (west negative)
 * @param altitudeFeet height in feet; relative-to-launch when the device records it, otherwise GPS altitude
 * @param capturedAt capture time from the camera clock when present
 * @since 0.1.0
 */
public record GeoFix(double latitude, double longitude, double altitudeFeet, Optional<LocalDateTime> capturedAt) {

  public GeoFix {
    if (!Double.isFinite(latitude) || latitude < -90d || latitude > 90d) {
      throw new IllegalArgumentException("latitude out of range: " + latitude);
    }
    if (!Double.isFinite(longitude) || longitude < -180d || longitude > 180d) {
      throw new IllegalArgumentException("longitude out of range: " + longitude);
    }
    if (!Double.isFinite(altitudeFeet)) {
      throw new IllegalArgumentException("altitude must be finite");
    }
    capturedAt = Objects.requireNonNullElse(capturedAt, Optional.empty());
  }

  public static GeoFix of(double latitude, double longitude, double altitudeFeet) {
    return new GeoFix(latitude, longitude, altitudeFeet, Optional.empty());
  }
}

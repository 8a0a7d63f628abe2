package io.flightqc.testing;

import io.flightqc.application.port.GeotagExtractor;
import io.flightqc.domain.geo.GeoFix;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/** Decodes the plain-text geotags written by {@link FakeSite#image}. */
public final class TextGeotagExtractor implements GeotagExtractor {
  private static final String PREFIX = "GPS:";

  public static byte[] encode(double latitude, double longitude, double altitudeFeet) {
    return (PREFIX + latitude + "," + longitude + "," + altitudeFeet).getBytes(StandardCharsets.US_ASCII);
  }

  @Override
  public Optional<GeoFix> extract(String fileName, byte[] prefix) {
    String text = new String(prefix, StandardCharsets.US_ASCII);
    if (!text.startsWith(PREFIX)) {
      return Optional.empty();
    }
    String[] parts = text.substring(PREFIX.length()).trim().split(",");
    if (parts.length != 3) {
      return Optional.empty();
    }
    return Optional.of(GeoFix.of(
        Double.parseDouble(parts[0]), Double.parseDouble(parts[1]), Double.parseDouble(parts[2])));
  }
}

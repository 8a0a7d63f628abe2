package io.flightqc.domain.geo;

import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Unit and coordinate conversions for embedded geotags.
 *
 * @since 0.1.0
 */
public final class Coordinates {
  /** Exact metres to feet factor used for every altitude. */
  public static final double FEET_PER_METRE = 3.28084d;

  private Coordinates() {}

  /**
   * Converts degrees, minutes and seconds plus a hemisphere reference into signed decimal degrees.
   *
   * @param degrees whole or fractional degrees
   * @param minutes minutes
   * @param seconds seconds
   * @param reference hemisphere letter: {@code N}, {@code S}, {@code E} or {@code W} (case-insensitive)
   * @return signed decimal degrees, or empty when the reference is unknown or a component is not finite
   */
  public static OptionalDouble toDecimalDegrees(double degrees, double minutes, double seconds, String reference) {
    if (!Double.isFinite(degrees) || !Double.isFinite(minutes) || !Double.isFinite(seconds) || reference == null) {
      return OptionalDouble.empty();
    }
    double magnitude = degrees + minutes / 60d + seconds / 3600d;
    return switch (reference.trim().toUpperCase(Locale.ROOT)) {
      case "N", "E" -> OptionalDouble.of(magnitude);
      case "S", "W" -> OptionalDouble.of(-magnitude);
      default -> OptionalDouble.empty();
    };
  }

  /**
   * Converts metres to feet.
   *
   * @param metres altitude in metres
   * @return altitude in feet
   */
  public static double metresToFeet(double metres) {
    return metres * FEET_PER_METRE;
  }
}

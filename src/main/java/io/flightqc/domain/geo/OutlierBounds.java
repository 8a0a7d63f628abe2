package io.flightqc.domain.geo;

/**
 * Inclusive horizontal acceptance window computed from the interquartile range of each axis.
 *
 * @param latitudeLow lower latitude bound
 * @param latitudeHigh upper latitude bound
 * @param longitudeLow lower longitude bound
 * @param longitudeHigh upper longitude bound
 * @since 0.1.0
 */
public record OutlierBounds(double latitudeLow, double latitudeHigh, double longitudeLow, double longitudeHigh) {

  public OutlierBounds {
    if (latitudeLow > latitudeHigh || longitudeLow > longitudeHigh) {
      throw new IllegalArgumentException("bounds must be ordered low <= high");
    }
  }

  /**
   * Tests whether a coordinate lies inside both axis bounds, edges included.
   *
   * @param latitude latitude to test
   * @param longitude longitude to test
   * @return {@code true} when the point is an inlier
   */
  public boolean contains(double latitude, double longitude) {
    return latitude >= latitudeLow && latitude <= latitudeHigh
        && longitude >= longitudeLow && longitude <= longitudeHigh;
  }
}

package io.flightqc.domain.scene;

import java.util.List;
import java.util.Objects;

/**
 * Flat surface drawn under the flight paths.
 *
 * <p>The mesh is the grid formed by every pair of {@code xs} and {@code ys}; every vertex sits at height
 * {@code z}.</p>
 *
 * @param xs evenly spaced longitudes
 * @param ys evenly spaced latitudes
 * @param z height of the plane in feet
 * @param color fill colour
 */
public record GroundPlane(List<Double> xs, List<Double> ys, double z, String color) {

  public GroundPlane {
    xs = List.copyOf(xs);
    ys = List.copyOf(ys);
    Objects.requireNonNull(color, "color");
  }
}

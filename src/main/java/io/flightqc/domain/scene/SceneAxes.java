package io.flightqc.domain.scene;

import java.util.Objects;

/**
 * Ranges for the three scene axes: x is longitude, y is latitude, z is height in feet.
 */
public record SceneAxes(AxisRange longitude, AxisRange latitude, AxisRange height) {

  public SceneAxes {
    Objects.requireNonNull(longitude, "longitude");
    Objects.requireNonNull(latitude, "latitude");
    Objects.requireNonNull(height, "height");
  }
}

package io.flightqc.domain.scene;

import java.util.List;
import java.util.Objects;

/**
 * One marker series of the scene. Coordinates are parallel lists: x longitude, y latitude, z height in feet.
 *
 * @param name legend label
 * @param legendGroup legend group key
 * @param x longitudes
 * @param y latitudes
 * @param z heights in feet
 * @param hoverText per-point hover label (the originating file name)
 * @param marker marker styling
 * @param showInLegend whether the series appears in the legend
 * @param outliers whether this is the aggregated outlier series
 */
public record Trace(
    String name,
    String legendGroup,
    List<Double> x,
    List<Double> y,
    List<Double> z,
    List<String> hoverText,
    Marker marker,
    boolean showInLegend,
    boolean outliers) {

  public Trace {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(legendGroup, "legendGroup");
    Objects.requireNonNull(marker, "marker");
    x = List.copyOf(x);
    y = List.copyOf(y);
    z = List.copyOf(z);
    hoverText = List.copyOf(hoverText);
    if (y.size() != x.size() || z.size() != x.size() || hoverText.size() != x.size()) {
      throw new IllegalArgumentException("trace coordinate lists must have equal length");
    }
  }

  public int size() {
    return x.size();
  }
}

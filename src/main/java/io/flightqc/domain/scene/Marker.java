package io.flightqc.domain.scene;

import java.util.Objects;

/**
 * Marker styling for one point series.
 *
 * @param size marker size in pixels
 * @param color colour name or hex value
 * @param symbol marker symbol, e.g. {@code circle} or {@code x}
 * @param opacity opacity in {@code [0, 1]}
 */
public record Marker(int size, String color, String symbol, double opacity) {

  public Marker {
    Objects.requireNonNull(color, "color");
    Objects.requireNonNull(symbol, "symbol");
    if (size <= 0) {
      throw new IllegalArgumentException("marker size must be positive");
    }
    if (opacity < 0d || opacity > 1d) {
      throw new IllegalArgumentException("opacity must be within [0, 1]");
    }
  }
}

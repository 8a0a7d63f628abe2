package io.flightqc.domain.scene;

/**
 * Fixed axis range; scenes never auto-fit.
 *
 * @param min lower bound
 * @param max upper bound
 */
public record AxisRange(double min, double max) {

  public AxisRange {
    if (!Double.isFinite(min) || !Double.isFinite(max) || min > max) {
      throw new IllegalArgumentException("invalid axis range [" + min + ", " + max + "]");
    }
  }

  public boolean contains(double value) {
    return value >= min && value <= max;
  }
}

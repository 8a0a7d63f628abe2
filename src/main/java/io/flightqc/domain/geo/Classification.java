package io.flightqc.domain.geo;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Output of the outlier classifier.
 *
 * @param points every input point, in input order, with its outlier flag
 * @param bounds bounds used, or empty when too few eligible points existed to classify
 * @since 0.1.0
 */
public record Classification(List<ClassifiedPoint> points, Optional<OutlierBounds> bounds) {

  public Classification {
    points = List.copyOf(Objects.requireNonNull(points, "points"));
    bounds = Objects.requireNonNullElse(bounds, Optional.empty());
  }

  public List<ClassifiedPoint> inliers() {
    return points.stream().filter(p -> !p.outlier()).toList();
  }

  public List<ClassifiedPoint> outliers() {
    return points.stream().filter(ClassifiedPoint::outlier).toList();
  }

  public int outlierCount() {
    return (int) points.stream().filter(ClassifiedPoint::outlier).count();
  }
}

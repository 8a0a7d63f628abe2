package io.flightqc.application.classify;

import io.flightqc.domain.geo.ClassifiedPoint;
import io.flightqc.domain.geo.Classification;
import io.flightqc.domain.geo.ExtractionResult;
import io.flightqc.domain.geo.OutlierBounds;
import io.flightqc.domain.site.FolderCategory;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Separates stray geotags from a site's flight paths with a per-axis interquartile fence.
 *
 * <p>Bounds come from latitude and longitude of eligible points only; ground-reference folders (civil, road) are
 * excluded from the fence and always kept. Altitude never participates. The result is a pure function of the
 * input.</p>
 *
 * @since 0.1.0
 */
public final class OutlierClassifier {
  private static final Logger log = LoggerFactory.getLogger(OutlierClassifier.class);

  private final ClassifierSettings settings;

  public OutlierClassifier(ClassifierSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Classifies every extracted geotag.
   *
   * @param results geotags of a site, any order
   * @return classified points in input order plus the bounds used
   */
  public Classification classify(List<ExtractionResult> results) {
    Objects.requireNonNull(results, "results");
    List<ExtractionResult> eligible = new ArrayList<>();
    for (ExtractionResult result : results) {
      if (!settings.isGroundReference(result.folder())) {
        eligible.add(result);
      }
    }

    Optional<OutlierBounds> bounds = eligible.size() < settings.minEligiblePoints()
        ? Optional.empty()
        : Optional.of(bounds(eligible));

    List<ClassifiedPoint> points = new ArrayList<>(results.size());
    int outliers = 0;
    for (ExtractionResult result : results) {
      FolderCategory category = FolderCategory.fromFolderName(result.folder());
      boolean outlier = bounds.isPresent()
          && !settings.isGroundReference(result.folder())
          && !bounds.get().contains(result.latitude(), result.longitude());
      if (outlier) {
        outliers++;
      }
      points.add(new ClassifiedPoint(
          result.latitude(),
          result.longitude(),
          result.altitudeFeet(),
          result.folder(),
          result.filename(),
          category,
          outlier));
    }
    if (bounds.isEmpty()) {
      log.debug("Skipped outlier classification: {} eligible points", eligible.size());
    } else {
      log.info("Classified {} points: {} outliers", points.size(), outliers);
    }
    return new Classification(points, bounds);
  }

  private OutlierBounds bounds(List<ExtractionResult> eligible) {
    double[] lats = new double[eligible.size()];
    double[] lons = new double[eligible.size()];
    for (int i = 0; i < eligible.size(); i++) {
      lats[i] = eligible.get(i).latitude();
      lons[i] = eligible.get(i).longitude();
    }
    Arrays.sort(lats);
    Arrays.sort(lons);
    double m = settings.multiplier();
    double q1Lat = percentile(lats, 0.25d);
    double q3Lat = percentile(lats, 0.75d);
    double q1Lon = percentile(lons, 0.25d);
    double q3Lon = percentile(lons, 0.75d);
    double iqrLat = q3Lat - q1Lat;
    double iqrLon = q3Lon - q1Lon;
    return new OutlierBounds(
        q1Lat - m * iqrLat, q3Lat + m * iqrLat, q1Lon - m * iqrLon, q3Lon + m * iqrLon);
  }

  /**
   * Percentile by linear interpolation between closest ranks.
   *
   * @param sorted ascending values, non-empty
   * @param fraction percentile as a fraction in {@code [0, 1]}
   * @return interpolated value
   */
  static double percentile(double[] sorted, double fraction) {
    double position = fraction * (sorted.length - 1);
    int lower = (int) Math.floor(position);
    int upper = Math.min(lower + 1, sorted.length - 1);
    double weight = position - lower;
    return sorted[lower] + weight * (sorted[upper] - sorted[lower]);
  }
}

package io.flightqc.application.scene;

import io.flightqc.application.classify.ClassifierSettings;
import io.flightqc.application.util.ByteSizes;
import io.flightqc.domain.geo.ClassifiedPoint;
import io.flightqc.domain.geo.Classification;
import io.flightqc.domain.scene.AxisRange;
import io.flightqc.domain.scene.GroundPlane;
import io.flightqc.domain.scene.Marker;
import io.flightqc.domain.scene.Scene;
import io.flightqc.domain.scene.SceneAxes;
import io.flightqc.domain.scene.Trace;
import io.flightqc.domain.site.FolderReport;
import io.flightqc.domain.site.SiteAnalysis;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns a classified site into a declarative 3D scene.
 * <p><strong>Layout rules:</strong>
 * <ul>
 *   <li>Axis ranges are fixed to the inlier bounding box; outliers never widen them.</li>
 *   <li>A flat ground mesh sits {@code groundOffsetFeet} below the lowest inlier; negative heights count as zero
 *   for range computation.</li>
 *   <li>One series per folder of inliers, coloured by folder category; ground-reference folders are not drawn.</li>
 *   <li>All outliers share one red {@code x} series.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class SceneBuilder {
  private static final Logger log = LoggerFactory.getLogger(SceneBuilder.class);

  private static final Marker OUTLIER_MARKER = new Marker(8, "red", "x", 1.0d);
  private static final int INLIER_MARKER_SIZE = 6;
  private static final double INLIER_OPACITY = 0.95d;
  private static final List<String> AXIS_TITLES = List.of("Longitude", "Latitude", "Height Above Drone Takeoff");

  private final SceneSettings settings;
  private final ClassifierSettings classifierSettings;

  public SceneBuilder(SceneSettings settings, ClassifierSettings classifierSettings) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.classifierSettings = Objects.requireNonNull(classifierSettings, "classifierSettings");
  }

  /**
   * Builds the scene for a site.
   *
   * @param analysis aggregated site analysis, used for titles and legend labels
   * @param classification classified geotags of the same site
   * @return scene; {@link Scene#empty()} when there are no inliers
   */
  public Scene build(SiteAnalysis analysis, Classification classification) {
    String title = "Site " + analysis.site().siteId() + " - Pilot: " + analysis.site().pilot();
    List<ClassifiedPoint> inliers = classification.inliers();
    if (inliers.isEmpty()) {
      log.info("No inliers to draw for site {}", analysis.site().siteId());
      return new Scene(title, List.of(), Optional.empty(), Optional.empty(), AXIS_TITLES,
          settings.camera(), settings.theme());
    }

    List<ClassifiedPoint> rangePoints = new ArrayList<>();
    for (ClassifiedPoint point : inliers) {
      if (!classifierSettings.isGroundReference(point.folder())) {
        rangePoints.add(point);
      }
    }
    if (rangePoints.isEmpty()) {
      rangePoints = inliers;
    }
    SceneAxes axes = axes(rangePoints);
    GroundPlane ground = ground(axes);

    List<Trace> traces = new ArrayList<>();
    Map<String, List<ClassifiedPoint>> byFolder = new LinkedHashMap<>();
    for (ClassifiedPoint point : inliers) {
      byFolder.computeIfAbsent(point.folder(), key -> new ArrayList<>()).add(point);
    }
    for (FolderReport folder : analysis.folders().values()) {
      if (classifierSettings.isGroundReference(folder.name())) {
        continue;
      }
      List<ClassifiedPoint> points = byFolder.getOrDefault(folder.name(), List.of());
      if (points.isEmpty()) {
        continue;
      }
      String legend = folder.name() + " (" + ByteSizes.format(folder.totalSizeBytes()) + " - "
          + folder.imageCount() + " files, " + points.size() + " points)";
      traces.add(trace(legend, folder.name(), points,
          new Marker(INLIER_MARKER_SIZE, folder.category().color(), "circle", INLIER_OPACITY), false));
    }
    List<ClassifiedPoint> outliers = classification.outliers();
    if (!outliers.isEmpty()) {
      traces.add(trace("Outliers (" + outliers.size() + ")", "outliers", outliers, OUTLIER_MARKER, true));
    }
    log.info("Built scene for site {}: {} series, {} inliers, {} outliers",
        analysis.site().siteId(), traces.size(), inliers.size(), outliers.size());
    return new Scene(title, traces, Optional.of(ground), Optional.of(axes), AXIS_TITLES,
        settings.camera(), settings.theme());
  }

  private SceneAxes axes(List<ClassifiedPoint> points) {
    double latMin = Double.POSITIVE_INFINITY;
    double latMax = Double.NEGATIVE_INFINITY;
    double lonMin = Double.POSITIVE_INFINITY;
    double lonMax = Double.NEGATIVE_INFINITY;
    double altMin = Double.POSITIVE_INFINITY;
    double altMax = Double.NEGATIVE_INFINITY;
    for (ClassifiedPoint point : points) {
      double altitude = Math.max(point.altitudeFeet(), 0d);
      latMin = Math.min(latMin, point.latitude());
      latMax = Math.max(latMax, point.latitude());
      lonMin = Math.min(lonMin, point.longitude());
      lonMax = Math.max(lonMax, point.longitude());
      altMin = Math.min(altMin, altitude);
      altMax = Math.max(altMax, altitude);
    }
    double groundZ = altMin - settings.groundOffsetFeet();
    double ceiling = Math.max(altMax, settings.minCeilingFeet());
    return new SceneAxes(
        new AxisRange(lonMin, lonMax),
        new AxisRange(latMin, latMax),
        new AxisRange(groundZ, Math.max(ceiling, groundZ)));
  }

  private GroundPlane ground(SceneAxes axes) {
    int n = settings.groundResolution();
    return new GroundPlane(
        linspace(axes.longitude().min(), axes.longitude().max(), n),
        linspace(axes.latitude().min(), axes.latitude().max(), n),
        axes.height().min(),
        settings.groundColor());
  }

  private static List<Double> linspace(double start, double end, int count) {
    List<Double> values = new ArrayList<>(count);
    double step = (end - start) / (count - 1);
    for (int i = 0; i < count - 1; i++) {
      values.add(start + step * i);
    }
    values.add(end);
    return values;
  }

  private static Trace trace(
      String name, String group, List<ClassifiedPoint> points, Marker marker, boolean outliers) {
    List<Double> x = new ArrayList<>(points.size());
    List<Double> y = new ArrayList<>(points.size());
    List<Double> z = new ArrayList<>(points.size());
    List<String> hover = new ArrayList<>(points.size());
    for (ClassifiedPoint point : points) {
      x.add(point.longitude());
      y.add(point.latitude());
      z.add(point.altitudeFeet());
      hover.add(point.filename());
    }
    return new Trace(name, group, x, y, z, hover, marker, true, outliers);
  }
}

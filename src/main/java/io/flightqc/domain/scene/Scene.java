package io.flightqc.domain.scene;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Declarative 3D scene of a site's flight paths. Rendering is left to whatever consumes it.
 *
 * @param title scene title
 * @param traces inlier series (one per folder) followed by at most one outlier series
 * @param ground ground plane, absent for an empty scene
 * @param axes fixed axis ranges, absent for an empty scene
 * @param axisTitles titles for the x, y and z axes
 * @param camera camera placement
 * @param theme colours and template
 */
public record Scene(
    String title,
    List<Trace> traces,
    Optional<GroundPlane> ground,
    Optional<SceneAxes> axes,
    List<String> axisTitles,
    Camera camera,
    Theme theme) {

  public Scene {
    Objects.requireNonNull(title, "title");
    traces = List.copyOf(traces);
    ground = Objects.requireNonNullElse(ground, Optional.empty());
    axes = Objects.requireNonNullElse(axes, Optional.empty());
    axisTitles = List.copyOf(axisTitles);
    Objects.requireNonNull(camera, "camera");
    Objects.requireNonNull(theme, "theme");
  }

  /** {@code true} when there were no inliers to draw. */
  public boolean empty() {
    return axes.isEmpty();
  }

  public Optional<Trace> outlierTrace() {
    return traces.stream().filter(Trace::outliers).findFirst();
  }
}

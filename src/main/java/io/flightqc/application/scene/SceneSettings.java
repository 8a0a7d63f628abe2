package io.flightqc.application.scene;

import io.flightqc.domain.scene.Camera;
import io.flightqc.domain.scene.Theme;
import io.flightqc.validation.Numbers;
import java.util.Objects;

/**
 * Scene layout tuning.
 *
 * @param groundResolution vertices per side of the ground mesh
 * @param groundOffsetFeet distance of the ground plane below the lowest inlier
 * @param minCeilingFeet lowest allowed top of the vertical axis
 * @param groundColor fill colour of the ground plane
 * @param camera camera placement
 * @param theme template and colours
 * @since 0.1.0
 */
public record SceneSettings(
    int groundResolution,
    double groundOffsetFeet,
    double minCeilingFeet,
    String groundColor,
    Camera camera,
    Theme theme) {

  public SceneSettings {
    Numbers.requireRange("scene.groundResolution", groundResolution, 2, 500);
    Numbers.requireNonNegative("scene.groundOffsetFeet", groundOffsetFeet);
    Numbers.requireNonNegative("scene.minCeilingFeet", minCeilingFeet);
    Objects.requireNonNull(groundColor, "groundColor");
    Objects.requireNonNull(camera, "camera");
    Objects.requireNonNull(theme, "theme");
  }

  public static SceneSettings defaults() {
    return new SceneSettings(
        20,
        20d,
        100d,
        "#002200",
        new Camera(1.5d, 1.5d, 1.2d),
        new Theme("plotly_dark", "black", "#e0e0e0", "gray"));
  }
}

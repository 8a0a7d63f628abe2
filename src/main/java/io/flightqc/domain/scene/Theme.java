package io.flightqc.domain.scene;

import java.util.Objects;

/**
 * Visual theme of a scene.
 *
 * @param template plotting template name, e.g. {@code plotly_dark}
 * @param background scene background colour
 * @param fontColor title and tick font colour
 * @param gridColor axis grid colour
 */
public record Theme(String template, String background, String fontColor, String gridColor) {

  public Theme {
    Objects.requireNonNull(template, "template");
    Objects.requireNonNull(background, "background");
    Objects.requireNonNull(fontColor, "fontColor");
    Objects.requireNonNull(gridColor, "gridColor");
  }
}

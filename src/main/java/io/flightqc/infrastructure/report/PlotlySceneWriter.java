package io.flightqc.infrastructure.report;

import com.fasterxml.jackson.core.JsonGenerator;
import io.flightqc.domain.scene.AxisRange;
import io.flightqc.domain.scene.GroundPlane;
import io.flightqc.domain.scene.Scene;
import io.flightqc.domain.scene.Trace;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Serializes a {@link Scene} as a Plotly figure ({@code data} plus {@code layout}).
 * <p><strong>Why:</strong> Any Plotly-capable page can render the figure with {@code Plotly.newPlot(div, data,
 * layout)}; nothing here renders pixels.</p>
 * <p><strong>Layout:</strong> the ground plane becomes a single-colour {@code surface} trace expanded to a
 * mesh grid; folder and outlier series become {@code scatter3d} marker traces; axes use fixed ranges.</p>
 *
 * @since 0.1.0
 */
public final class PlotlySceneWriter {
  private static final Logger log = LoggerFactory.getLogger(PlotlySceneWriter.class);
  public static final String FILE_NAME = "scene.json";
  private static final int FIGURE_HEIGHT = 800;

  /**
   * Writes the figure into {@code directory}, replacing any previous file.
   *
   * @param directory existing writable directory
   * @param scene scene to serialize
   * @return path of the written file
   * @throws IOException if the file cannot be written
   */
  public Path write(Path directory, Scene scene) throws IOException {
    Objects.requireNonNull(scene, "scene");
    Path target = JsonFiles.write(directory.resolve(FILE_NAME), gen -> writeFigure(gen, scene));
    log.info("Wrote 3D scene with {} traces to {}", scene.traces().size(), target);
    return target;
  }

  public String toJson(Scene scene) throws IOException {
    return JsonFiles.toString(gen -> writeFigure(gen, scene));
  }

  private void writeFigure(JsonGenerator gen, Scene scene) throws IOException {
    gen.writeStartObject();
    gen.writeArrayFieldStart("data");
    if (scene.ground().isPresent()) {
      writeGround(gen, scene.ground().get());
    }
    for (Trace trace : scene.traces()) {
      writeTrace(gen, trace);
    }
    gen.writeEndArray();
    writeLayout(gen, scene);
    gen.writeEndObject();
  }

  private static void writeGround(JsonGenerator gen, GroundPlane ground) throws IOException {
    List<Double> xs = ground.xs();
    List<Double> ys = ground.ys();
    gen.writeStartObject();
    gen.writeStringField("type", "surface");
    gen.writeStringField("name", "Ground");
    // meshgrid: rows follow y, columns follow x
    gen.writeArrayFieldStart("x");
    for (int row = 0; row < ys.size(); row++) {
      writeNumbers(gen, xs);
    }
    gen.writeEndArray();
    gen.writeArrayFieldStart("y");
    for (Double y : ys) {
      gen.writeStartArray();
      for (int col = 0; col < xs.size(); col++) {
        gen.writeNumber(y);
      }
      gen.writeEndArray();
    }
    gen.writeEndArray();
    gen.writeArrayFieldStart("z");
    for (int row = 0; row < ys.size(); row++) {
      gen.writeStartArray();
      for (int col = 0; col < xs.size(); col++) {
        gen.writeNumber(ground.z());
      }
      gen.writeEndArray();
    }
    gen.writeEndArray();
    gen.writeArrayFieldStart("colorscale");
    for (int stop = 0; stop <= 1; stop++) {
      gen.writeStartArray();
      gen.writeNumber(stop);
      gen.writeString(ground.color());
      gen.writeEndArray();
    }
    gen.writeEndArray();
    gen.writeBooleanField("showscale", false);
    gen.writeNumberField("opacity", 1.0d);
    gen.writeStringField("hoverinfo", "skip");
    gen.writeEndObject();
  }

  private static void writeTrace(JsonGenerator gen, Trace trace) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("type", "scatter3d");
    gen.writeStringField("mode", "markers");
    gen.writeStringField("name", trace.name());
    gen.writeStringField("legendgroup", trace.legendGroup());
    gen.writeBooleanField("showlegend", trace.showInLegend());
    gen.writeFieldName("x");
    writeNumbers(gen, trace.x());
    gen.writeFieldName("y");
    writeNumbers(gen, trace.y());
    gen.writeFieldName("z");
    writeNumbers(gen, trace.z());
    gen.writeArrayFieldStart("text");
    for (String text : trace.hoverText()) {
      gen.writeString(text);
    }
    gen.writeEndArray();
    gen.writeStringField("hovertemplate",
        trace.outliers() ? "%{text}<extra>(OUTLIER)</extra>" : "%{text}<extra></extra>");
    gen.writeObjectFieldStart("marker");
    gen.writeNumberField("size", trace.marker().size());
    gen.writeStringField("color", trace.marker().color());
    gen.writeStringField("symbol", trace.marker().symbol());
    gen.writeNumberField("opacity", trace.marker().opacity());
    if (trace.outliers()) {
      gen.writeObjectFieldStart("line");
      gen.writeNumberField("width", 2);
      gen.writeEndObject();
    }
    gen.writeEndObject();
    gen.writeEndObject();
  }

  private static void writeLayout(JsonGenerator gen, Scene scene) throws IOException {
    gen.writeObjectFieldStart("layout");
    gen.writeObjectFieldStart("title");
    gen.writeStringField("text", scene.title());
    gen.writeNumberField("x", 0.12d);
    gen.writeStringField("xanchor", "left");
    gen.writeObjectFieldStart("font");
    gen.writeNumberField("size", 20);
    gen.writeStringField("color", scene.theme().fontColor());
    gen.writeEndObject();
    gen.writeEndObject();

    gen.writeObjectFieldStart("scene");
    String[] axisKeys = {"xaxis", "yaxis", "zaxis"};
    for (int i = 0; i < axisKeys.length; i++) {
      gen.writeObjectFieldStart(axisKeys[i]);
      gen.writeStringField("title", i < scene.axisTitles().size() ? scene.axisTitles().get(i) : "");
      gen.writeStringField("gridcolor", scene.theme().gridColor());
      gen.writeStringField("zerolinecolor", scene.theme().gridColor());
      gen.writeObjectFieldStart("tickfont");
      gen.writeStringField("color", scene.theme().fontColor());
      gen.writeEndObject();
      if (scene.axes().isPresent()) {
        AxisRange range = switch (i) {
          case 0 -> scene.axes().get().longitude();
          case 1 -> scene.axes().get().latitude();
          default -> scene.axes().get().height();
        };
        gen.writeBooleanField("autorange", false);
        gen.writeArrayFieldStart("range");
        gen.writeNumber(range.min());
        gen.writeNumber(range.max());
        gen.writeEndArray();
      }
      gen.writeEndObject();
    }
    gen.writeStringField("bgcolor", scene.theme().background());
    gen.writeObjectFieldStart("camera");
    gen.writeObjectFieldStart("eye");
    gen.writeNumberField("x", scene.camera().eyeX());
    gen.writeNumberField("y", scene.camera().eyeY());
    gen.writeNumberField("z", scene.camera().eyeZ());
    gen.writeEndObject();
    gen.writeEndObject();
    gen.writeEndObject();

    // template name only; plotly.js itself expects a template object
    gen.writeStringField("template", scene.theme().template());
    gen.writeStringField("paper_bgcolor", scene.theme().background());
    gen.writeObjectFieldStart("margin");
    gen.writeNumberField("l", 0);
    gen.writeNumberField("r", 0);
    gen.writeNumberField("b", 0);
    gen.writeNumberField("t", 80);
    gen.writeEndObject();
    gen.writeBooleanField("showlegend", true);
    gen.writeObjectFieldStart("legend");
    gen.writeStringField("orientation", "v");
    gen.writeNumberField("x", 0);
    gen.writeNumberField("y", 1);
    gen.writeStringField("bgcolor", "rgba(0,0,0,0)");
    gen.writeEndObject();
    gen.writeNumberField("height", FIGURE_HEIGHT);
    gen.writeBooleanField("empty", scene.empty());
    gen.writeEndObject();
  }

  private static void writeNumbers(JsonGenerator gen, List<Double> values) throws IOException {
    gen.writeStartArray();
    for (Double value : values) {
      gen.writeNumber(value);
    }
    gen.writeEndArray();
  }
}

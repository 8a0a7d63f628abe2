package io.flightqc.infrastructure.report;

import com.fasterxml.jackson.core.JsonGenerator;
import io.flightqc.application.pipeline.SiteAnalysisOutcome;
import io.flightqc.application.util.ByteSizes;
import io.flightqc.domain.geo.ClassifiedPoint;
import io.flightqc.domain.geo.OutlierBounds;
import io.flightqc.domain.site.FolderReport;
import io.flightqc.domain.site.SiteAnalysis;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the site summary ({@code analysis.json}): per-folder counts, sizes, colours and errors, site totals,
 * failed folders and the outlier list.
 *
 * @since 0.1.0
 */
public final class AnalysisReportWriter {
  private static final Logger log = LoggerFactory.getLogger(AnalysisReportWriter.class);
  public static final String FILE_NAME = "analysis.json";
  private static final int SCHEMA_VERSION = 1;

  /**
   * Writes the summary into {@code directory}, replacing any previous file.
   *
   * @param directory existing writable directory
   * @param outcome finished analysis
   * @return path of the written file
   * @throws IOException if the file cannot be written
   */
  public Path write(Path directory, SiteAnalysisOutcome outcome) throws IOException {
    Objects.requireNonNull(outcome, "outcome");
    Path target = JsonFiles.write(directory.resolve(FILE_NAME), gen -> writeOutcome(gen, outcome));
    log.info("Wrote analysis summary to {}", target);
    return target;
  }

  /**
   * Renders the summary as a compact JSON string.
   *
   * @param outcome finished analysis
   * @return JSON document
   * @throws IOException if serialization fails
   */
  public String toJson(SiteAnalysisOutcome outcome) throws IOException {
    return JsonFiles.toString(gen -> writeOutcome(gen, outcome));
  }

  private void writeOutcome(JsonGenerator gen, SiteAnalysisOutcome outcome) throws IOException {
    SiteAnalysis analysis = outcome.analysis();
    gen.writeStartObject();
    gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
    gen.writeObjectFieldStart("site");
    gen.writeStringField("siteId", analysis.site().siteId());
    gen.writeStringField("pilot", analysis.site().pilot());
    gen.writeStringField("path", analysis.site().path());
    gen.writeEndObject();

    gen.writeArrayFieldStart("folders");
    for (FolderReport folder : analysis.folders().values()) {
      writeFolder(gen, folder);
    }
    gen.writeEndArray();

    gen.writeObjectFieldStart("totals");
    gen.writeNumberField("images", analysis.totalImages());
    gen.writeNumberField("sizeBytes", analysis.totalSizeBytes());
    gen.writeStringField("size", ByteSizes.format(analysis.totalSizeBytes()));
    gen.writeNumberField("gpsPoints", analysis.gpsCount());
    gen.writeNumberField("outliers", outcome.classification().outlierCount());
    gen.writeEndObject();

    writeStrings(gen, "failedFolders", analysis.failedFolders());

    gen.writeObjectFieldStart("outliers");
    if (outcome.classification().bounds().isPresent()) {
      OutlierBounds bounds = outcome.classification().bounds().get();
      gen.writeObjectFieldStart("bounds");
      gen.writeNumberField("latitudeLow", bounds.latitudeLow());
      gen.writeNumberField("latitudeHigh", bounds.latitudeHigh());
      gen.writeNumberField("longitudeLow", bounds.longitudeLow());
      gen.writeNumberField("longitudeHigh", bounds.longitudeHigh());
      gen.writeEndObject();
    }
    gen.writeArrayFieldStart("points");
    for (ClassifiedPoint point : outcome.classification().outliers()) {
      gen.writeStartObject();
      gen.writeStringField("folder", point.folder());
      gen.writeStringField("filename", point.filename());
      gen.writeNumberField("latitude", point.latitude());
      gen.writeNumberField("longitude", point.longitude());
      gen.writeNumberField("altitudeFeet", point.altitudeFeet());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeEndObject();

    gen.writeNumberField("elapsedMillis", outcome.elapsed().toMillis());
    gen.writeEndObject();
  }

  private static void writeFolder(JsonGenerator gen, FolderReport folder) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("name", folder.name());
    gen.writeStringField("category", folder.category().keyword());
    gen.writeStringField("color", folder.category().color());
    gen.writeNumberField("imageCount", folder.imageCount());
    gen.writeNumberField("sizeBytes", folder.totalSizeBytes());
    gen.writeStringField("size", ByteSizes.format(folder.totalSizeBytes()));
    gen.writeNumberField("gpsCount", folder.gpsCount());
    writeStrings(gen, "timedOut", folder.timedOutItems());
    writeStrings(gen, "failed", folder.failedItems());
    if (folder.error().isPresent()) {
      gen.writeStringField("error", folder.error().get());
    } else {
      gen.writeNullField("error");
    }
    gen.writeEndObject();
  }

  private static void writeStrings(JsonGenerator gen, String field, List<String> values) throws IOException {
    gen.writeArrayFieldStart(field);
    for (String value : values) {
      gen.writeString(value);
    }
    gen.writeEndArray();
  }
}

package io.flightqc.application.scene;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.flightqc.application.classify.ClassifierSettings;
import io.flightqc.application.classify.OutlierClassifier;
import io.flightqc.domain.geo.Classification;
import io.flightqc.domain.geo.ExtractionResult;
import io.flightqc.domain.scene.GroundPlane;
import io.flightqc.domain.scene.Scene;
import io.flightqc.domain.scene.SceneAxes;
import io.flightqc.domain.scene.Trace;
import io.flightqc.domain.site.FolderCategory;
import io.flightqc.domain.site.FolderReport;
import io.flightqc.domain.site.SiteAnalysis;
import io.flightqc.domain.site.SiteInfo;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SceneBuilderTest {
  private final ClassifierSettings classifierSettings = ClassifierSettings.defaults();
  private final SceneBuilder builder = new SceneBuilder(SceneSettings.defaults(), classifierSettings);

  @Test
  void rangesCoverInliersOnly() {
    List<ExtractionResult> orbit = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      orbit.add(result("01_Orbit", "o" + i, 40.0 + i * 1e-4, -75.0 + i * 1e-4, 150.0 + i));
    }
    orbit.add(result("01_Orbit", "stray", 45.0, -70.0, 900.0));
    SiteAnalysis analysis = analysis(folder("01_Orbit", orbit));
    Classification classification = new OutlierClassifier(classifierSettings).classify(analysis.allResults());

    Scene scene = builder.build(analysis, classification);

    SceneAxes axes = scene.axes().orElseThrow();
    assertEquals(40.0, axes.latitude().min(), 1e-9);
    assertEquals(40.0009, axes.latitude().max(), 1e-9);
    assertEquals(-75.0, axes.longitude().min(), 1e-9);
    assertEquals(-74.9991, axes.longitude().max(), 1e-9);
    assertEquals(150.0 - 20.0, axes.height().min(), 1e-9);
    assertEquals(159.0, axes.height().max(), 1e-9);

    Trace outliers = scene.outlierTrace().orElseThrow();
    assertEquals(1, outliers.size());
    assertEquals("red", outliers.marker().color());
    assertEquals("x", outliers.marker().symbol());
    assertEquals("Outliers (1)", outliers.name());
  }

  @Test
  void oneSeriesPerFolderColouredByCategory() {
    SiteAnalysis analysis = analysis(
        folder("01_Orbit", List.of(
            result("01_Orbit", "a", 40.0, -75.0, 100.0),
            result("01_Orbit", "b", 40.0001, -75.0001, 110.0))),
        folder("02_Scan", List.of(
            result("02_Scan", "c", 40.0002, -75.0002, 120.0),
            result("02_Scan", "d", 40.0003, -75.0003, 130.0))),
        folder("03_Civil", List.of(result("03_Civil", "e", 40.0004, -75.0004, 5.0))));
    Classification classification = new OutlierClassifier(classifierSettings).classify(analysis.allResults());

    Scene scene = builder.build(analysis, classification);

    assertEquals(2, scene.traces().size());
    Trace orbit = scene.traces().get(0);
    assertEquals(FolderCategory.ORBIT.color(), orbit.marker().color());
    assertEquals("01_Orbit", orbit.legendGroup());
    assertTrue(orbit.name().startsWith("01_Orbit ("), orbit.name());
    assertTrue(orbit.name().endsWith("2 files, 2 points)"), orbit.name());
    assertEquals(List.of("a", "b"), orbit.hoverText());
    assertEquals(FolderCategory.SCAN.color(), scene.traces().get(1).marker().color());
    assertTrue(scene.outlierTrace().isEmpty());
    assertEquals("Site 12345678 - Pilot: pilot", scene.title());
  }

  @Test
  void groundSitsBelowLowestInlierAndCeilingHasFloor() {
    SiteAnalysis analysis = analysis(folder("01_Orbit", List.of(
        result("01_Orbit", "a", 40.0, -75.0, -12.0),
        result("01_Orbit", "b", 40.001, -75.001, 30.0))));
    Classification classification = new OutlierClassifier(classifierSettings).classify(analysis.allResults());

    Scene scene = builder.build(analysis, classification);

    SceneAxes axes = scene.axes().orElseThrow();
    // negative heights count as zero for the range
    assertEquals(-20.0, axes.height().min(), 1e-9);
    assertEquals(100.0, axes.height().max(), 1e-9);
    GroundPlane ground = scene.ground().orElseThrow();
    assertEquals(-20.0, ground.z(), 1e-9);
    assertEquals(20, ground.xs().size());
    assertEquals(20, ground.ys().size());
    assertEquals(-75.001, ground.xs().get(0), 1e-12);
    assertEquals(-75.0, ground.xs().get(19), 1e-12);
  }

  @Test
  void noInliersYieldsEmptyScene() {
    SiteAnalysis analysis = analysis(folder("01_Orbit", List.of()));

    Scene scene = builder.build(analysis, new Classification(List.of(), Optional.empty()));

    assertTrue(scene.empty());
    assertTrue(scene.traces().isEmpty());
    assertTrue(scene.ground().isEmpty());
  }

  @Test
  void mixedKeywordGroundFoldersAreNotDrawnNorRanged() {
    SiteAnalysis analysis = analysis(
        folder("01_Orbit", List.of(
            result("01_Orbit", "a", 40.0, -75.0, 100.0),
            result("01_Orbit", "b", 40.0001, -75.0001, 110.0))),
        folder("05_Road_Downlook", List.of(result("05_Road_Downlook", "r", 41.0, -76.0, 5.0))));
    Classification classification = new OutlierClassifier(classifierSettings).classify(analysis.allResults());

    Scene scene = builder.build(analysis, classification);

    assertEquals(1, scene.traces().size());
    assertEquals("01_Orbit", scene.traces().get(0).legendGroup());
    SceneAxes axes = scene.axes().orElseThrow();
    assertEquals(40.0001, axes.latitude().max(), 1e-9);
    assertEquals(-75.0001, axes.longitude().min(), 1e-9);
  }

  private static ExtractionResult result(String folder, String file, double lat, double lon, double alt) {
    return new ExtractionResult(folder, file, "/site/" + folder + "/" + file, lat, lon, alt, Optional.empty());
  }

  private static FolderReport folder(String name, List<ExtractionResult> results) {
    return new FolderReport(name, results.size(), 1_024L * results.size(), FolderCategory.fromFolderName(name),
        results, List.of(), List.of(), Optional.empty());
  }

  private static SiteAnalysis analysis(FolderReport... folders) {
    Map<String, FolderReport> reports = new LinkedHashMap<>();
    int images = 0;
    long size = 0L;
    for (FolderReport folder : folders) {
      reports.put(folder.name(), folder);
      images += folder.imageCount();
      size += folder.totalSizeBytes();
    }
    return new SiteAnalysis(new SiteInfo("12345678", "pilot", "/homes/pilot/12345678"), reports, images, size,
        List.of());
  }
}

package io.flightqc.infrastructure.report;

import io.flightqc.application.classify.ClassifierSettings;
import io.flightqc.application.classify.OutlierClassifier;
import io.flightqc.application.pipeline.SiteAnalysisOutcome;
import io.flightqc.application.scene.SceneBuilder;
import io.flightqc.application.scene.SceneSettings;
import io.flightqc.domain.geo.Classification;
import io.flightqc.domain.geo.ExtractionResult;
import io.flightqc.domain.scene.Scene;
import io.flightqc.domain.site.FolderCategory;
import io.flightqc.domain.site.FolderReport;
import io.flightqc.domain.site.SiteAnalysis;
import io.flightqc.domain.site.SiteInfo;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** A small site: an orbit with one stray point, a civil folder, and a folder whose listing failed. */
final class ReportFixtures {

  private ReportFixtures() {}

  static SiteAnalysisOutcome outcome() {
    List<ExtractionResult> orbit = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      orbit.add(result("01_Orbit", "DJI_000" + i + ".JPG", 40.0 + i * 1e-4, -75.0 + i * 1e-4, 150.0 + i));
    }
    orbit.add(result("01_Orbit", "DJI_0099.JPG", 45.0, -70.0, 900.0));
    FolderReport orbitFolder = new FolderReport("01_Orbit", 12, 2_415_919_104L, FolderCategory.ORBIT, orbit,
        List.of("DJI_0100.JPG"), List.of(), Optional.empty());
    FolderReport civil = new FolderReport("03_Civil", 1, 1_024L, FolderCategory.CIVIL,
        List.of(result("03_Civil", "civil.jpg", 40.0005, -75.0005, 3.0)), List.of(), List.of(), Optional.empty());
    FolderReport broken = FolderReport.failed("04_Scan", "listing failed: permission denied");

    Map<String, FolderReport> folders = new LinkedHashMap<>();
    folders.put(orbitFolder.name(), orbitFolder);
    folders.put(civil.name(), civil);
    folders.put(broken.name(), broken);
    SiteAnalysis analysis = new SiteAnalysis(new SiteInfo("12345678", "pilot", "/homes/pilot/12345678"), folders,
        13, 2_415_920_128L, List.of("04_Scan"));

    Classification classification =
        new OutlierClassifier(ClassifierSettings.defaults()).classify(analysis.allResults());
    Scene scene = new SceneBuilder(SceneSettings.defaults(), ClassifierSettings.defaults())
        .build(analysis, classification);
    return new SiteAnalysisOutcome(analysis, classification, scene, Duration.ofMillis(1_500));
  }

  private static ExtractionResult result(String folder, String file, double lat, double lon, double alt) {
    return new ExtractionResult(folder, file, "/homes/pilot/12345678/" + folder + "/" + file, lat, lon, alt,
        Optional.empty());
  }
}

package io.flightqc.application.pipeline;

import io.flightqc.domain.geo.Classification;
import io.flightqc.domain.scene.Scene;
import io.flightqc.domain.site.SiteAnalysis;
import java.time.Duration;
import java.util.Objects;

/**
 * Result handed back to the caller of a site analysis.
 *
 * @param analysis folders, totals and failed folders
 * @param classification classified geotags
 * @param scene 3D scene built from the inliers
 * @param elapsed wall time of the analysis
 * @since 0.1.0
 */
public record SiteAnalysisOutcome(
    SiteAnalysis analysis, Classification classification, Scene scene, Duration elapsed) {

  public SiteAnalysisOutcome {
    Objects.requireNonNull(analysis, "analysis");
    Objects.requireNonNull(classification, "classification");
    Objects.requireNonNull(scene, "scene");
    Objects.requireNonNull(elapsed, "elapsed");
  }
}

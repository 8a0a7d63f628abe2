package io.flightqc.config;

import io.flightqc.application.classify.OutlierClassifier;
import io.flightqc.application.pipeline.ExtractionScheduler;
import io.flightqc.application.pipeline.FolderAggregator;
import io.flightqc.application.pipeline.SiteAnalysisUseCase;
import io.flightqc.application.port.GeotagExtractor;
import io.flightqc.application.port.MetricsPort;
import io.flightqc.application.port.SessionProvider;
import io.flightqc.application.scene.SceneBuilder;
import io.flightqc.domain.error.ConnectionException;
import io.flightqc.infrastructure.exif.ExifGeotagExtractor;
import io.flightqc.infrastructure.sftp.JschSessionProvider;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the analyze use case to its adapters.
 * <p><strong>Why:</strong> Keeps construction in one place so the CLI and tests assemble the same graph.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the extractor, scheduler, aggregator, classifier and scene builder from {@link AnalysisConfig}.</li>
 *   <li>Open the JSch session provider, or accept one supplied by a test.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and use on the startup thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final AnalysisConfig config;
  private final MetricsPort metrics;

  /**
   * Creates a root.
   *
   * @param config analyze configuration
   * @param metrics metrics sink shared by every component
   */
  public CompositionRoot(AnalysisConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Opens the SFTP session provider; the caller closes it after the analysis.
   *
   * @return provider
   * @throws ConnectionException if the known-hosts file cannot be loaded
   */
  public JschSessionProvider sessionProvider() throws ConnectionException {
    return new JschSessionProvider(config.sftp());
  }

  public GeotagExtractor geotagExtractor() {
    return ExifGeotagExtractor.fromPrecedence(config.extraction().altitudePrecedence());
  }

  /**
   * Builds the analyze use case over {@code provider}.
   *
   * @param provider opens the primary and pooled sessions
   * @return use case
   */
  public SiteAnalysisUseCase siteAnalysisUseCase(SessionProvider provider) {
    ExtractionScheduler scheduler = new ExtractionScheduler(
        geotagExtractor(),
        config.scheduler(),
        config.extraction().prefixBytes(),
        config.pool().leaseTimeout(),
        metrics);
    FolderAggregator aggregator = new FolderAggregator(scheduler, config.extraction(), metrics);
    return new SiteAnalysisUseCase(
        provider,
        aggregator,
        new OutlierClassifier(config.classifier()),
        new SceneBuilder(config.scene(), config.classifier()),
        config.pool(),
        metrics);
  }
}

package io.flightqc.application.pipeline;

import io.flightqc.application.classify.OutlierClassifier;
import io.flightqc.application.pool.ConnectionPoolCache;
import io.flightqc.application.pool.PoolSettings;
import io.flightqc.application.pool.SessionFactory;
import io.flightqc.application.port.MetricsPort;
import io.flightqc.application.port.RemoteSession;
import io.flightqc.application.port.SessionProvider;
import io.flightqc.application.scene.SceneBuilder;
import io.flightqc.domain.error.AnalysisTimeoutException;
import io.flightqc.domain.error.ConnectionException;
import io.flightqc.domain.geo.Classification;
import io.flightqc.domain.scene.Scene;
import io.flightqc.domain.site.SiteAnalysis;
import io.flightqc.domain.site.SiteInfo;
import io.flightqc.infrastructure.exec.ExecutorFactories;
import io.flightqc.logging.Logs;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs one site analysis end to end: open the primary session, aggregate folders over a session-scoped pool cache,
 * classify outliers and build the scene.
 *
 * <p>The whole call is bounded by the request's outer timeout; on expiry the running extraction is interrupted
 * and {@link AnalysisTimeoutException} is raised. The pool cache and the primary session are closed on every
 * exit path.</p>
 *
 * @since 0.1.0
 */
public final class SiteAnalysisUseCase {
  private static final Logger log = LoggerFactory.getLogger(SiteAnalysisUseCase.class);
  private static final String PIPELINE = "analyze";
  private static final long CANCEL_GRACE_MILLIS = 5_000L;

  private final SessionProvider sessionProvider;
  private final FolderAggregator aggregator;
  private final OutlierClassifier classifier;
  private final SceneBuilder sceneBuilder;
  private final PoolSettings poolSettings;
  private final MetricsPort metrics;

  public SiteAnalysisUseCase(
      SessionProvider sessionProvider,
      FolderAggregator aggregator,
      OutlierClassifier classifier,
      SceneBuilder sceneBuilder,
      PoolSettings poolSettings,
      MetricsPort metrics) {
    this.sessionProvider = Objects.requireNonNull(sessionProvider, "sessionProvider");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.sceneBuilder = Objects.requireNonNull(sceneBuilder, "sceneBuilder");
    this.poolSettings = Objects.requireNonNull(poolSettings, "poolSettings");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Analyzes a site.
   *
   * @param request credentials, site root and outer timeout
   * @return analysis, classification and scene
   * @throws ConnectionException if the primary session cannot be opened
   * @throws IOException if the site root cannot be listed
   * @throws AnalysisTimeoutException if the outer timeout expires
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public SiteAnalysisOutcome run(SiteAnalysisRequest request)
      throws IOException, AnalysisTimeoutException, InterruptedException {
    Objects.requireNonNull(request, "request");
    long startNanos = System.nanoTime();
    SiteInfo site = SiteInfo.parse(request.siteRoot());
    MDC.put(Logs.MDC_PIPELINE, PIPELINE);
    MDC.put(Logs.MDC_SITE, site.siteId());
    try {
      log.info("Opening session {} for site {}", request.credentials().endpoint(), request.siteRoot());
      SessionFactory factory = SessionFactory.of(sessionProvider, request.credentials());
      RemoteSession primary = factory.open(poolSettings.connectTimeout());
      ConnectionPoolCache cache = new ConnectionPoolCache(poolSettings, metrics);
      try {
        PoolSource pools = PoolSource.cached(cache, primary.id(), factory);
        SiteAnalysis analysis = aggregateWithin(request, primary, pools);
        Classification classification = classifier.classify(analysis.allResults());
        Scene scene = sceneBuilder.build(analysis, classification);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        metrics.observe("analysis.latencyNanos", elapsed.toNanos());
        log.info("Site {} analyzed in {} ms: {} images, {} GPS points, {} outliers, {} failed folders",
            site.siteId(), elapsed.toMillis(), analysis.totalImages(), analysis.gpsCount(),
            classification.outlierCount(), analysis.failedFolders().size());
        return new SiteAnalysisOutcome(analysis, classification, scene, elapsed);
      } finally {
        cache.invalidate(primary.id());
        cache.close();
        primary.close();
      }
    } finally {
      MDC.remove(Logs.MDC_SITE);
      MDC.remove(Logs.MDC_PIPELINE);
    }
  }

  private SiteAnalysis aggregateWithin(SiteAnalysisRequest request, RemoteSession primary, PoolSource pools)
      throws IOException, AnalysisTimeoutException, InterruptedException {
    ExecutorService runner = ExecutorFactories.newWorkerPool(1, "flightqc-analysis",
        (thread, error) -> log.error("Uncaught failure on {}", thread.getName(), error));
    Future<SiteAnalysis> future = runner.submit(() -> aggregator.aggregate(request.siteRoot(), primary, pools));
    try {
      return future.get(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      metrics.increment("analysis.timeout");
      log.error("Analysis of {} exceeded {} s", request.siteRoot(), request.timeout().toSeconds());
      throw new AnalysisTimeoutException(request.siteRoot(), request.timeout());
    } catch (InterruptedException ex) {
      future.cancel(true);
      throw ex;
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof IOException io) {
        throw io;
      }
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("Site analysis failed", cause);
    } finally {
      runner.shutdownNow();
      if (!runner.awaitTermination(CANCEL_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
        log.warn("Analysis worker did not stop within {} ms", CANCEL_GRACE_MILLIS);
      }
    }
  }
}

package io.flightqc.application.pipeline;

import io.flightqc.application.port.MetricsPort;
import io.flightqc.application.port.RemoteSession;
import io.flightqc.domain.error.FolderProbeException;
import io.flightqc.domain.remote.RemoteEntry;
import io.flightqc.domain.remote.RemotePaths;
import io.flightqc.domain.site.FolderCategory;
import io.flightqc.domain.site.FolderReport;
import io.flightqc.domain.site.SiteAnalysis;
import io.flightqc.domain.site.SiteInfo;
import io.flightqc.domain.site.WorkItem;
import io.flightqc.logging.Logs;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Walks a site's folders one after another, extracting each folder as one parallel batch.
 *
 * <p>A folder whose pre-check or listing fails is recorded with zero results and an error message; its siblings
 * are still processed. Only a failure to list the site root itself propagates.</p>
 *
 * @since 0.1.0
 */
public final class FolderAggregator {
  private static final Logger log = LoggerFactory.getLogger(FolderAggregator.class);

  private final ExtractionScheduler scheduler;
  private final ExtractionSettings settings;
  private final MetricsPort metrics;

  public FolderAggregator(ExtractionScheduler scheduler, ExtractionSettings settings, MetricsPort metrics) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Analyzes every immediate subdirectory of {@code siteRoot}, in name order.
   *
   * @param siteRoot absolute remote path of the site
   * @param primary primary session, used for listings, pre-checks and sequential batches
   * @param pools pool source for parallel batches
   * @return aggregated analysis; partial when folders failed or batches timed out
   * @throws IOException if the site root cannot be listed, or the calling thread is interrupted between folders
   */
  public SiteAnalysis aggregate(String siteRoot, RemoteSession primary, PoolSource pools) throws IOException {
    SiteInfo site = SiteInfo.parse(siteRoot);
    List<RemoteEntry> folders = new ArrayList<>();
    for (RemoteEntry entry : primary.list(siteRoot, settings.listTimeout())) {
      if (entry.isDirectory()) {
        folders.add(entry);
      }
    }
    folders.sort(Comparator.comparing(RemoteEntry::name));
    log.info("Analyzing site {} (pilot {}): {} folders under {}",
        site.siteId(), site.pilot(), folders.size(), siteRoot);

    Map<String, FolderReport> reports = new LinkedHashMap<>();
    List<String> failed = new ArrayList<>();
    int totalImages = 0;
    long totalSize = 0L;
    for (RemoteEntry folder : folders) {
      if (Thread.currentThread().isInterrupted()) {
        throw new InterruptedIOException("Analysis of " + siteRoot + " interrupted before folder " + folder.name());
      }
      String name = folder.name();
      MDC.put(Logs.MDC_FOLDER, name);
      FolderReport report;
      try {
        report = analyzeFolder(RemotePaths.join(siteRoot, name), name, primary, pools);
      } catch (FolderProbeException ex) {
        report = recordFailure(name, ex.getMessage(), ex.getCause());
      } catch (RuntimeException ex) {
        report = recordFailure(name, Logs.describe(ex), ex);
      } finally {
        MDC.remove(Logs.MDC_FOLDER);
      }
      if (report.failed()) {
        failed.add(name);
      }
      reports.put(name, report);
      totalImages += report.imageCount();
      totalSize += report.totalSizeBytes();
    }

    SiteAnalysis analysis = new SiteAnalysis(site, reports, totalImages, totalSize, failed);
    if (!failed.isEmpty()) {
      log.warn("Failed to process {} folders: {}", failed.size(), String.join(", ", failed));
    }
    log.info("Analysis complete: {} folders, {} images, {} GPS points",
        reports.size(), totalImages, analysis.gpsCount());
    return analysis;
  }

  private FolderReport analyzeFolder(String path, String name, RemoteSession primary, PoolSource pools)
      throws FolderProbeException {
    try {
      primary.stat(path, settings.probeTimeout());
    } catch (IOException ex) {
      throw new FolderProbeException(name, "pre-check failed: " + Logs.describe(ex), ex);
    }
    List<RemoteEntry> entries;
    try {
      entries = primary.list(path, settings.listTimeout());
    } catch (IOException ex) {
      throw new FolderProbeException(name, "listing failed: " + Logs.describe(ex), ex);
    }

    long totalSize = 0L;
    List<String> images = new ArrayList<>();
    for (RemoteEntry entry : entries) {
      if (!entry.isFile()) {
        continue;
      }
      totalSize += entry.size();
      if (settings.isImage(entry.name())) {
        images.add(entry.name());
      }
    }
    images.sort(null);
    List<WorkItem> items = new ArrayList<>(images.size());
    for (String image : images) {
      items.add(new WorkItem(name, RemotePaths.join(path, image)));
    }

    log.info("Extracting GPS from {} images in {}", items.size(), name);
    BatchReport batch = scheduler.extract(items, primary, pools);
    log.info("Extracted {}/{} GPS points from {} in {} ms",
        batch.results().size(), items.size(), name, batch.elapsed().toMillis());
    return new FolderReport(
        name,
        items.size(),
        totalSize,
        FolderCategory.fromFolderName(name),
        batch.results(),
        batch.timedOutItems(),
        batch.failedItems(),
        Optional.empty());
  }

  private FolderReport recordFailure(String name, String message, Throwable cause) {
    metrics.increment("analysis.folder.failed");
    if (cause != null) {
      log.error("Failed to analyze folder {}: {}", name, message, cause);
    } else {
      log.error("Failed to analyze folder {}: {}", name, message);
    }
    return FolderReport.failed(name, message);
  }
}

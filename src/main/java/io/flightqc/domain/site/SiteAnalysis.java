package io.flightqc.domain.site;

import io.flightqc.domain.geo.ExtractionResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated outcome of one site analysis.
 *
 * @param site parsed site identifiers
 * @param folders folder reports keyed by folder name, in visit order
 * @param totalImages sum of folder image counts
 * @param totalSizeBytes sum of folder sizes
 * @param failedFolders names of folders whose pre-check or listing failed
 * @since 0.1.0
 */
public record SiteAnalysis(
    SiteInfo site,
    Map<String, FolderReport> folders,
    int totalImages,
    long totalSizeBytes,
    List<String> failedFolders) {

  public SiteAnalysis {
    Objects.requireNonNull(site, "site");
    folders = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(folders, "folders")));
    failedFolders = List.copyOf(Objects.requireNonNull(failedFolders, "failedFolders"));
  }

  /** Every geotag across all folders, folder by folder. */
  public List<ExtractionResult> allResults() {
    List<ExtractionResult> all = new ArrayList<>();
    for (FolderReport report : folders.values()) {
      all.addAll(report.results());
    }
    return all;
  }

  public int gpsCount() {
    int count = 0;
    for (FolderReport report : folders.values()) {
      count += report.gpsCount();
    }
    return count;
  }
}

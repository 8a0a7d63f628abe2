package io.flightqc.domain.site;

import io.flightqc.domain.geo.ExtractionResult;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of extracting one site folder.
 *
 * @param name folder name
 * @param imageCount number of image files listed, with or without a geotag
 * @param totalSizeBytes sum of the sizes of every regular file in the folder
 * @param category category inferred from the folder name
 * @param results geotags found, in no particular order
 * @param timedOutItems file names abandoned by a deadline
 * @param failedItems file names whose read failed
 * @param error set only when the folder pre-check or listing failed
 * @since 0.1.0
 */
public record FolderReport(
    String name,
    int imageCount,
    long totalSizeBytes,
    FolderCategory category,
    List<ExtractionResult> results,
    List<String> timedOutItems,
    List<String> failedItems,
    Optional<String> error) {

  public FolderReport {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(category, "category");
    results = List.copyOf(Objects.requireNonNull(results, "results"));
    timedOutItems = List.copyOf(Objects.requireNonNull(timedOutItems, "timedOutItems"));
    failedItems = List.copyOf(Objects.requireNonNull(failedItems, "failedItems"));
    error = Objects.requireNonNullElse(error, Optional.empty());
  }

  /**
   * Builds the report recorded for a folder whose pre-check or listing failed.
   *
   * @param name folder name
   * @param message failure description
   * @return report with zero images and the error set
   */
  public static FolderReport failed(String name, String message) {
    return new FolderReport(
        name, 0, 0L, FolderCategory.fromFolderName(name), List.of(), List.of(), List.of(), Optional.of(message));
  }

  public int gpsCount() {
    return results.size();
  }

  public boolean failed() {
    return error.isPresent();
  }
}

package io.flightqc.application.pipeline;

import io.flightqc.domain.geo.ExtractionResult;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one extraction batch.
 *
 * @param results geotags found, unordered
 * @param processed items whose processing finished, with or without data
 * @param timedOutItems file names abandoned by the per-item or batch deadline
 * @param failedItems file names whose read failed
 * @param sequentialFallback whether any part of the batch ran sequentially because the pool could not serve it
 * @param batchTimedOut whether the batch deadline expired with items outstanding
 * @param elapsed wall time spent on the batch
 * @since 0.1.0
 */
public record BatchReport(
    List<ExtractionResult> results,
    int processed,
    List<String> timedOutItems,
    List<String> failedItems,
    boolean sequentialFallback,
    boolean batchTimedOut,
    Duration elapsed) {

  public BatchReport {
    results = List.copyOf(results);
    timedOutItems = List.copyOf(timedOutItems);
    failedItems = List.copyOf(failedItems);
    Objects.requireNonNull(elapsed, "elapsed");
  }

  public static BatchReport empty() {
    return new BatchReport(List.of(), 0, List.of(), List.of(), false, false, Duration.ZERO);
  }
}

package io.flightqc.application.pipeline;

import io.flightqc.validation.Numbers;
import java.time.Duration;
import java.util.Objects;

/**
 * Worker sizing and timeouts for one extraction batch.
 *
 * @param itemsPerWorker divisor {@code K} in {@code workerCount = clamp(batchSize / K, min, max)}
 * @param minWorkers lower clamp of the worker count
 * @param maxWorkers upper clamp of the worker count
 * @param sequentialThreshold batches smaller than this run sequentially on one connection
 * @param itemTimeout per-item deadline for reading an image prefix
 * @param batchTimeout deadline for the whole batch
 * @param progressInterval log progress every this many processed items
 * @since 0.1.0
 */
public record SchedulerSettings(
    int itemsPerWorker,
    int minWorkers,
    int maxWorkers,
    int sequentialThreshold,
    Duration itemTimeout,
    Duration batchTimeout,
    int progressInterval) {

  public SchedulerSettings {
    Numbers.requireRange("scheduler.itemsPerWorker", itemsPerWorker, 1, 100_000);
    Numbers.requireRange("scheduler.minWorkers", minWorkers, 1, 1_000);
    Numbers.requireRange("scheduler.maxWorkers", maxWorkers, minWorkers, 1_000);
    Numbers.requireRange("scheduler.sequentialThreshold", sequentialThreshold, 0, 100_000);
    Objects.requireNonNull(itemTimeout, "itemTimeout");
    Objects.requireNonNull(batchTimeout, "batchTimeout");
    Numbers.requireRange("scheduler.progressInterval", progressInterval, 1, 1_000_000);
  }

  public static SchedulerSettings defaults() {
    return new SchedulerSettings(10, 10, 20, 5, Duration.ofSeconds(30), Duration.ofSeconds(300), 20);
  }

  /**
   * Computes the worker count for a batch: {@code clamp(batchSize / itemsPerWorker, minWorkers, maxWorkers)} with
   * integer division.
   *
   * @param batchSize number of items in the batch
   * @return worker count
   */
  public int workerCount(int batchSize) {
    int raw = Math.max(0, batchSize) / itemsPerWorker;
    return Math.max(minWorkers, Math.min(maxWorkers, raw));
  }
}

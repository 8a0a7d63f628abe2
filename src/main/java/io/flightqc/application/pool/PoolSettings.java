package io.flightqc.application.pool;

import io.flightqc.validation.Numbers;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection pool tuning.
 *
 * @param floor minimum live connections for parallel extraction; below it the batch runs sequentially
 * @param connectTimeout upper bound for opening one session
 * @param leaseTimeout how long a worker waits for a free connection
 * @param healthCheckTimeout timeout of the {@code stat /} probe
 * @param probeOnLease whether connections are probed before every lease
 * @since 0.1.0
 */
public record PoolSettings(
    int floor,
    Duration connectTimeout,
    Duration leaseTimeout,
    Duration healthCheckTimeout,
    boolean probeOnLease) {

  public static final int DEFAULT_FLOOR = 5;

  public PoolSettings {
    Numbers.requireRange("pool.floor", floor, 1, 1_000);
    Objects.requireNonNull(connectTimeout, "connectTimeout");
    Objects.requireNonNull(leaseTimeout, "leaseTimeout");
    Objects.requireNonNull(healthCheckTimeout, "healthCheckTimeout");
  }

  public static PoolSettings defaults() {
    return new PoolSettings(
        DEFAULT_FLOOR, Duration.ofSeconds(30), Duration.ofSeconds(60), Duration.ofSeconds(5), false);
  }
}

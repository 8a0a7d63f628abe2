package io.flightqc.application.port;

/**
 * <strong>What:</strong> Port abstracting FlightQC metrics emission.
 * <p><strong>Why:</strong> Lets the pool, scheduler and aggregator record counters and latencies without binding to
 * a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} for tests and
 * dry runs.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from worker threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code pool.lease.exhausted},
 * {@code extract.item.latencyNanos}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code pool.connection.dropped}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value (e.g., nanoseconds, item counts); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}

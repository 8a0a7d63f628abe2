package io.flightqc.application.pipeline;

import io.flightqc.application.pool.ConnectionPool;
import io.flightqc.application.pool.PooledConnection;
import io.flightqc.application.port.GeotagExtractor;
import io.flightqc.application.port.MetricsPort;
import io.flightqc.application.port.RemoteSession;
import io.flightqc.domain.error.ConnectionResetException;
import io.flightqc.domain.error.InsufficientPoolException;
import io.flightqc.domain.error.PoolExhaustedException;
import io.flightqc.domain.geo.ExtractionResult;
import io.flightqc.domain.geo.GeoFix;
import io.flightqc.domain.site.WorkItem;
import io.flightqc.infrastructure.exec.ExecutorFactories;
import io.flightqc.logging.Logs;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fans a folder's images out over pooled connections and gathers their geotags.
 * <p><strong>Why:</strong> Reading a 64 KiB prefix is dominated by round-trip latency; parallel sessions hide it.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Size the worker pool per batch and run small batches sequentially on the primary session.</li>
 *   <li>Lease one connection per item and hand it back on every path, discarding it when it may be mid-read.</li>
 *   <li>Enforce the per-item deadline on a companion I/O executor and the batch deadline on the gather.</li>
 *   <li>Defer items the pool cannot serve to a sequential pass on the primary session.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> A scheduler instance may run one batch at a time per caller; batches share no
 * state except the pool.</p>
 * <p><strong>Observability:</strong> {@code extract.item.timeout}, {@code extract.item.failed},
 * {@code extract.item.connectionLost}, {@code extract.item.latencyNanos}, {@code extract.batch.timeout},
 * {@code extract.batch.fallback}, {@code extract.batch.workers}.</p>
 *
 * @since 0.1.0
 */
public final class ExtractionScheduler {
  private static final Logger log = LoggerFactory.getLogger(ExtractionScheduler.class);

  // one retry on a fresh connection when the first one broke
  private static final int MAX_ATTEMPTS = 2;

  private final GeotagExtractor extractor;
  private final SchedulerSettings settings;
  private final int prefixBytes;
  private final Duration leaseTimeout;
  private final MetricsPort metrics;
  private final UncaughtExceptionHandler uncaughtHandler;

  /**
   * Creates a scheduler.
   *
   * @param extractor decodes geotags from image prefixes
   * @param settings worker sizing and deadlines
   * @param prefixBytes bytes read from each image
   * @param leaseTimeout longest wait for a pooled connection
   * @param metrics metrics sink
   */
  public ExtractionScheduler(
      GeotagExtractor extractor,
      SchedulerSettings settings,
      int prefixBytes,
      Duration leaseTimeout,
      MetricsPort metrics) {
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.settings = Objects.requireNonNull(settings, "settings");
    if (prefixBytes <= 0) {
      throw new IllegalArgumentException("prefixBytes must be positive");
    }
    this.prefixBytes = prefixBytes;
    this.leaseTimeout = Objects.requireNonNull(leaseTimeout, "leaseTimeout");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.uncaughtHandler = (thread, error) -> log.error("Uncaught failure on {}", thread.getName(), error);
  }

  public SchedulerSettings settings() {
    return settings;
  }

  /**
   * Extracts geotags for one batch.
   *
   * <p>Never throws for item-level problems: timeouts, read failures and broken connections are recorded in the
   * returned report. The call returns within the batch timeout plus the time needed to cancel stragglers.</p>
   *
   * @param items images of one folder
   * @param primary session used for small batches and the sequential fallback
   * @param pools supplies the pool for parallel batches
   * @return batch outcome with partial results when deadlines expired
   */
  public BatchReport extract(List<WorkItem> items, RemoteSession primary, PoolSource pools) {
    Objects.requireNonNull(items, "items");
    Objects.requireNonNull(primary, "primary");
    Objects.requireNonNull(pools, "pools");
    long startNanos = System.nanoTime();
    long deadline = startNanos + settings.batchTimeout().toNanos();
    if (items.isEmpty()) {
      return BatchReport.empty();
    }
    Batch batch = new Batch(items);

    if (items.size() < settings.sequentialThreshold()) {
      log.debug("Extracting {} items sequentially on the primary session", items.size());
      runSequential(batch.indicesIn(ItemState.PENDING), primary, batch, deadline);
      return batch.seal(false, startNanos);
    }

    int workers = settings.workerCount(items.size());
    ConnectionPool pool;
    try {
      pool = pools.poolFor(workers);
    } catch (InsufficientPoolException ex) {
      metrics.increment("extract.batch.fallback");
      log.warn("{}; extracting {} items sequentially", ex.getMessage(), items.size());
      runSequential(batch.indicesIn(ItemState.PENDING), primary, batch, deadline);
      return batch.seal(true, startNanos);
    }

    runParallel(pool, workers, batch, deadline);

    List<Integer> deferred = batch.indicesIn(ItemState.DEFERRED);
    boolean fallback = !deferred.isEmpty();
    if (fallback) {
      metrics.increment("extract.batch.fallback");
      log.warn("Pool {} could not serve {} items; finishing them sequentially", pool.name(), deferred.size());
      runSequential(deferred, primary, batch, deadline);
    }
    return batch.seal(fallback, startNanos);
  }

  private void runParallel(ConnectionPool pool, int workers, Batch batch, long deadline) {
    log.info("Extracting {} items with {} workers over {} pooled connections",
        batch.size(), workers, pool.capacity());
    metrics.observe("extract.batch.workers", workers);
    ExecutorService workerPool = ExecutorFactories.newWorkerPool(workers, "flightqc-extract", uncaughtHandler);
    ExecutorService io = ExecutorFactories.newIoPool("flightqc-io", uncaughtHandler);
    CompletionService<Void> completion = new ExecutorCompletionService<>(workerPool);
    List<Future<Void>> futures = new ArrayList<>(batch.size());
    boolean expired = false;
    try {
      for (int i = 0; i < batch.size(); i++) {
        final int index = i;
        futures.add(completion.submit(() -> processPooled(index, pool, io, batch, deadline), null));
      }
      for (int done = 0; done < futures.size(); done++) {
        long remaining = deadline - System.nanoTime();
        Future<Void> next = remaining > 0 ? completion.poll(remaining, TimeUnit.NANOSECONDS) : null;
        if (next == null) {
          expired = true;
          break;
        }
        try {
          next.get();
        } catch (ExecutionException ex) {
          log.error("Extraction task failed", ex.getCause());
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      expired = true;
    } finally {
      if (expired) {
        for (Future<Void> future : futures) {
          future.cancel(true);
        }
      }
      workerPool.shutdownNow();
      io.shutdownNow();
    }
    List<Integer> outstanding = batch.indicesIn(ItemState.PENDING);
    if (expired) {
      outstanding.addAll(batch.indicesIn(ItemState.DEFERRED));
    }
    if (!outstanding.isEmpty()) {
      int abandoned = batch.abandon(outstanding);
      metrics.increment("extract.batch.timeout");
      log.warn("Batch deadline of {}s expired; abandoned {} outstanding items",
          settings.batchTimeout().toSeconds(), abandoned);
    }
  }

  private void processPooled(int index, ConnectionPool pool, ExecutorService io, Batch batch, long deadline) {
    WorkItem item = batch.item(index);
    try {
      for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0 || Thread.currentThread().isInterrupted()) {
          return;
        }
        PooledConnection conn;
        try {
          conn = pool.lease(Duration.ofNanos(Math.min(leaseTimeout.toNanos(), remaining)));
        } catch (PoolExhaustedException ex) {
          log.debug("Deferring {}: {}", item.fileName(), ex.getMessage());
          batch.defer(index);
          return;
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          return;
        }
        if (!readOnLease(index, item, conn, pool, io, batch, attempt < MAX_ATTEMPTS)) {
          return;
        }
      }
    } catch (RuntimeException ex) {
      log.error("Unexpected failure extracting {}", item.fileName(), ex);
      metrics.increment("extract.item.failed");
      batch.failed(index);
    }
  }

  /**
   * Reads one item on a leased connection and hands the connection back exactly once.
   *
   * @return {@code true} when the item should be retried on another connection
   */
  private boolean readOnLease(
      int index,
      WorkItem item,
      PooledConnection conn,
      ConnectionPool pool,
      ExecutorService io,
      Batch batch,
      boolean mayRetry) {
    Duration itemTimeout = settings.itemTimeout();
    long started = System.nanoTime();
    boolean discard = false;
    boolean retry = false;
    byte[] prefix = null;
    Future<byte[]> read = null;
    try {
      read = io.submit(() -> conn.session().readPrefix(item.path(), prefixBytes, itemTimeout));
      prefix = read.get(itemTimeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException ex) {
      read.cancel(true);
      discard = true;
      timedOut(index, item, conn, batch);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof InterruptedIOException) {
        // the session gave up at the same deadline
        discard = true;
        timedOut(index, item, conn, batch);
      } else {
        if (cause instanceof ConnectionResetException) {
          discard = true;
          log.warn("Connection {} reset while reading {}: {}", conn.id(), item.fileName(), Logs.describe(cause));
        } else if (cause instanceof IOException && !pool.healthCheck(conn)) {
          discard = true;
          log.warn("Connection {} failed its health check after reading {}: {}",
              conn.id(), item.fileName(), Logs.describe(cause));
        } else {
          log.debug("Skipping {}: {}", item.fileName(), Logs.describe(cause));
        }
        if (discard) {
          metrics.increment("extract.item.connectionLost");
          retry = mayRetry;
        }
        if (!retry) {
          metrics.increment("extract.item.failed");
          batch.failed(index);
        }
      }
    } catch (InterruptedException ex) {
      if (read != null) {
        read.cancel(true);
      }
      discard = true;
      Thread.currentThread().interrupt();
    } catch (RejectedExecutionException ex) {
      // io executor already shut down: the batch is over
      discard = true;
    } finally {
      if (discard) {
        pool.discard(conn);
      } else {
        pool.release(conn);
      }
    }
    if (prefix != null) {
      metrics.observe("extract.item.latencyNanos", System.nanoTime() - started);
      decode(index, item, prefix, batch);
    }
    return retry;
  }

  private void timedOut(int index, WorkItem item, PooledConnection conn, Batch batch) {
    metrics.increment("extract.item.timeout");
    log.warn("Timed out after {} ms reading {}; discarding connection {}",
        settings.itemTimeout().toMillis(), item.fileName(), conn.id());
    batch.timedOut(index);
  }

  private void runSequential(List<Integer> indices, RemoteSession session, Batch batch, long deadline) {
    for (int i = 0; i < indices.size(); i++) {
      if (System.nanoTime() - deadline >= 0 || Thread.currentThread().isInterrupted()) {
        int abandoned = batch.abandon(indices.subList(i, indices.size()));
        metrics.increment("extract.batch.timeout");
        log.warn("Batch deadline of {}s expired during sequential extraction; abandoned {} items",
            settings.batchTimeout().toSeconds(), abandoned);
        return;
      }
      int index = indices.get(i);
      WorkItem item = batch.item(index);
      long started = System.nanoTime();
      try {
        byte[] prefix = session.readPrefix(item.path(), prefixBytes, settings.itemTimeout());
        metrics.observe("extract.item.latencyNanos", System.nanoTime() - started);
        decode(index, item, prefix, batch);
      } catch (InterruptedIOException ex) {
        metrics.increment("extract.item.timeout");
        log.warn("Timed out reading {} on session {}", item.fileName(), session.id());
        batch.timedOut(index);
      } catch (IOException ex) {
        metrics.increment("extract.item.failed");
        log.debug("Skipping {}: {}", item.fileName(), Logs.describe(ex));
        batch.failed(index);
      } catch (RuntimeException ex) {
        log.error("Unexpected failure extracting {}", item.fileName(), ex);
        metrics.increment("extract.item.failed");
        batch.failed(index);
      }
    }
  }

  private void decode(int index, WorkItem item, byte[] prefix, Batch batch) {
    Optional<GeoFix> fix;
    try {
      fix = extractor.extract(item.fileName(), prefix);
    } catch (RuntimeException ex) {
      log.debug("Geotag decoder rejected {}: {}", item.fileName(), Logs.describe(ex));
      fix = Optional.empty();
    }
    batch.completed(index, fix.map(f -> ExtractionResult.of(item.folder(), item.fileName(), item.path(), f)));
  }

  private enum ItemState {
    PENDING,
    DEFERRED,
    DONE,
    ABANDONED
  }

  /** Per-batch outcome ledger. Every item settles once; updates after {@link #seal} are ignored. */
  private final class Batch {
    private final List<WorkItem> items;
    private final ItemState[] states;
    private final List<ExtractionResult> results = new ArrayList<>();
    private final List<String> timedOut = new ArrayList<>();
    private final List<String> failed = new ArrayList<>();
    private int processed;
    private boolean expired;
    private boolean sealed;

    Batch(List<WorkItem> items) {
      this.items = List.copyOf(items);
      this.states = new ItemState[items.size()];
      Arrays.fill(states, ItemState.PENDING);
    }

    int size() {
      return items.size();
    }

    WorkItem item(int index) {
      return items.get(index);
    }

    synchronized List<Integer> indicesIn(ItemState state) {
      List<Integer> indices = new ArrayList<>();
      for (int i = 0; i < states.length; i++) {
        if (states[i] == state) {
          indices.add(i);
        }
      }
      return indices;
    }

    synchronized boolean expired() {
      return expired;
    }

    synchronized void defer(int index) {
      if (!sealed && states[index] == ItemState.PENDING) {
        states[index] = ItemState.DEFERRED;
      }
    }

    synchronized void completed(int index, Optional<ExtractionResult> result) {
      if (settle(index)) {
        result.ifPresent(results::add);
        progress();
      }
    }

    synchronized void timedOut(int index) {
      if (settle(index)) {
        timedOut.add(items.get(index).fileName());
        progress();
      }
    }

    synchronized void failed(int index) {
      if (settle(index)) {
        failed.add(items.get(index).fileName());
        progress();
      }
    }

    synchronized int abandon(List<Integer> indices) {
      int count = 0;
      for (int index : indices) {
        if (!sealed && (states[index] == ItemState.PENDING || states[index] == ItemState.DEFERRED)) {
          states[index] = ItemState.ABANDONED;
          timedOut.add(items.get(index).fileName());
          count++;
        }
      }
      if (count > 0) {
        expired = true;
      }
      return count;
    }

    synchronized BatchReport seal(boolean fallback, long startNanos) {
      sealed = true;
      Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
      return new BatchReport(results, processed, timedOut, failed, fallback, expired, elapsed);
    }

    private boolean settle(int index) {
      if (sealed || states[index] == ItemState.DONE || states[index] == ItemState.ABANDONED) {
        return false;
      }
      states[index] = ItemState.DONE;
      processed++;
      return true;
    }

    private void progress() {
      if (processed % settings.progressInterval() == 0 || processed == items.size()) {
        log.info("Progress: {}/{} images processed, {} GPS points found", processed, items.size(), results.size());
      }
    }
  }
}

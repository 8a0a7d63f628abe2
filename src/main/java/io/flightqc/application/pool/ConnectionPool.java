package io.flightqc.application.pool;

import io.flightqc.application.port.MetricsPort;
import io.flightqc.application.port.RemoteSession;
import io.flightqc.domain.error.ConnectionException;
import io.flightqc.domain.error.PoolExhaustedException;
import io.flightqc.logging.Logs;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Bounded set of remote sessions lent to extraction workers.
 * <p><strong>Why:</strong> Opening an SSH session costs hundreds of milliseconds; a site with thousands of images
 * reuses a handful of sessions across all its folders.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open sessions up to a requested capacity, skipping individual failures.</li>
 *   <li>Lend free sessions with a bounded wait and take them back exactly once per lease.</li>
 *   <li>Probe sessions with {@code stat /} and drop the ones that fail, shrinking capacity.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #lease(Duration)}, {@link #release(PooledConnection)} and
 * {@link #discard(PooledConnection)} are safe from any thread. {@link #ensureCapacity(int)} is synchronized and is
 * expected to run between batches.</p>
 * <p><strong>Observability:</strong> {@code pool.connection.created}, {@code pool.connection.open.failed},
 * {@code pool.connection.dropped}, {@code pool.lease.exhausted}, {@code pool.lease.waitNanos},
 * {@code pool.release.duplicate}.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionPool implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);
  private static final String HEALTH_PROBE_PATH = "/";
  private static final long LEASE_POLL_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(250);

  private final String name;
  private final SessionFactory sessionFactory;
  private final PoolSettings settings;
  private final MetricsPort metrics;
  private final LinkedBlockingQueue<PooledConnection> free = new LinkedBlockingQueue<>();
  private final Set<PooledConnection> live = ConcurrentHashMap.newKeySet();
  private volatile boolean closed;

  /**
   * Creates an empty pool; call {@link #ensureCapacity(int)} to open sessions.
   *
   * @param name label used in log lines
   * @param sessionFactory opens sessions to the pooled endpoint
   * @param settings pool tuning
   * @param metrics metrics sink
   */
  public ConnectionPool(String name, SessionFactory sessionFactory, PoolSettings settings, MetricsPort metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Creates a pool and attempts {@code size} session opens.
   *
   * @param name label used in log lines
   * @param size number of sessions to attempt
   * @param sessionFactory opens sessions to the pooled endpoint
   * @param settings pool tuning, including the per-connect timeout
   * @param metrics metrics sink
   * @return pool holding however many sessions opened; check {@link #isSufficient()}
   */
  public static ConnectionPool create(
      String name, int size, SessionFactory sessionFactory, PoolSettings settings, MetricsPort metrics) {
    ConnectionPool pool = new ConnectionPool(name, sessionFactory, settings, metrics);
    pool.ensureCapacity(size);
    return pool;
  }

  /**
   * Tops the pool up to {@code target} live sessions.
   *
   * <p>Free sessions are probed first and dead ones dropped. New sessions are then opened one by one; a failed open
   * is logged and skipped. The pool never shrinks here when it already holds more than {@code target}.</p>
   *
   * @param target desired number of live sessions
   * @return live sessions after the top-up
   */
  public synchronized int ensureCapacity(int target) {
    if (closed) {
      throw new IllegalStateException("Connection pool " + name + " is closed");
    }
    List<PooledConnection> idle = new ArrayList<>();
    free.drainTo(idle);
    int reused = 0;
    for (PooledConnection conn : idle) {
      if (healthCheck(conn)) {
        free.offer(conn);
        reused++;
      } else {
        drop(conn, "failed health check before reuse");
      }
    }
    int missing = target - live.size();
    if (reused > 0) {
      log.info("Pool {} reusing {} cached connections, opening {} more", name, reused, Math.max(0, missing));
    }
    int failures = 0;
    for (int i = 0; i < missing; i++) {
      try {
        RemoteSession session = sessionFactory.open(settings.connectTimeout());
        PooledConnection conn = new PooledConnection(this, session);
        live.add(conn);
        free.offer(conn);
        metrics.increment("pool.connection.created");
        log.debug("Pool {} opened connection {} ({}/{})", name, session.id(), live.size(), target);
      } catch (ConnectionException ex) {
        failures++;
        metrics.increment("pool.connection.open.failed");
        log.warn("Pool {} failed to open connection {}/{}: {}", name, i + 1, missing, Logs.describe(ex));
      }
    }
    if (failures > 0) {
      log.warn("Pool {} holds {} of {} requested connections after {} failed opens",
          name, live.size(), target, failures);
    }
    return live.size();
  }

  /**
   * Leases a free connection.
   *
   * @param timeout maximum wait for a connection to become free
   * @return leased connection; the caller must pass it to exactly one of {@link #release(PooledConnection)} or
   *     {@link #discard(PooledConnection)}
   * @throws PoolExhaustedException if no connection became free in time, or the pool has no live connections
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public PooledConnection lease(Duration timeout) throws PoolExhaustedException, InterruptedException {
    long start = System.nanoTime();
    long deadline = start + Math.max(0L, timeout.toNanos());
    while (true) {
      if (closed) {
        throw exhausted("closed", start);
      }
      if (live.isEmpty()) {
        throw exhausted("empty", start);
      }
      long remaining = deadline - System.nanoTime();
      PooledConnection conn = free.poll(
          Math.max(0L, Math.min(remaining, LEASE_POLL_SLICE_NANOS)), TimeUnit.NANOSECONDS);
      if (conn == null) {
        if (System.nanoTime() - deadline >= 0) {
          throw exhausted("timeout", start);
        }
        continue;
      }
      if (conn.isDead() || (settings.probeOnLease() && !healthCheck(conn))) {
        drop(conn, "failed health check on lease");
        continue;
      }
      if (!conn.tryLease()) {
        // already leased elsewhere; only possible if a caller bypassed release
        log.warn("Pool {} found leased connection {} in free queue", name, conn.id());
        continue;
      }
      metrics.observe("pool.lease.waitNanos", System.nanoTime() - start);
      return conn;
    }
  }

  /**
   * Returns a leased connection to the free queue.
   *
   * <p>A second release of the same lease is rejected and logged. Dead connections and connections returned after
   * {@link #close()} are closed instead of requeued.</p>
   *
   * @param conn connection obtained from {@link #lease(Duration)}
   */
  public void release(PooledConnection conn) {
    checkOwner(conn);
    if (!conn.tryReturn()) {
      metrics.increment("pool.release.duplicate");
      log.warn("Pool {} ignored duplicate release of connection {}", name, conn.id());
      return;
    }
    if (closed || conn.isDead()) {
      drop(conn, closed ? "pool closed" : "marked dead");
      return;
    }
    free.offer(conn);
  }

  /**
   * Returns a leased connection known to be broken: the session is closed and capacity shrinks by one.
   *
   * @param conn connection obtained from {@link #lease(Duration)}
   */
  public void discard(PooledConnection conn) {
    checkOwner(conn);
    if (!conn.tryReturn()) {
      metrics.increment("pool.release.duplicate");
      log.warn("Pool {} ignored duplicate discard of connection {}", name, conn.id());
      return;
    }
    conn.markDead();
    drop(conn, "discarded by worker");
  }

  /**
   * Probes a connection with a cheap {@code stat /}. A failed probe marks the connection dead; the caller then
   * discards or drops it.
   *
   * @param conn connection to probe; must be leased by the caller or idle
   * @return {@code true} when the session answered in time
   */
  public boolean healthCheck(PooledConnection conn) {
    if (conn.isDead()) {
      return false;
    }
    try {
      conn.session().stat(HEALTH_PROBE_PATH, settings.healthCheckTimeout());
      return true;
    } catch (IOException | RuntimeException ex) {
      conn.markDead();
      log.debug("Pool {} health check failed for {}: {}", name, conn.id(), Logs.describe(ex));
      return false;
    }
  }

  /** Number of live connections, leased or free. */
  public int capacity() {
    return live.size();
  }

  /** Number of connections currently free. */
  public int available() {
    return free.size();
  }

  /** Whether capacity reaches the configured floor for parallel extraction. */
  public boolean isSufficient() {
    return live.size() >= settings.floor();
  }

  public int floor() {
    return settings.floor();
  }

  public String name() {
    return name;
  }

  /** Closes every free connection; leased connections are closed when they come back. */
  @Override
  public void close() {
    closed = true;
    List<PooledConnection> idle = new ArrayList<>();
    free.drainTo(idle);
    for (PooledConnection conn : idle) {
      drop(conn, "pool closed");
    }
    if (!live.isEmpty()) {
      log.debug("Pool {} closed with {} connections still leased", name, live.size());
    }
  }

  private void drop(PooledConnection conn, String reason) {
    if (!live.remove(conn)) {
      return;
    }
    conn.markDead();
    if (!"pool closed".equals(reason)) {
      metrics.increment("pool.connection.dropped");
      log.info("Pool {} dropped connection {} ({}); {} remain", name, conn.id(), reason, live.size());
    }
    try {
      conn.session().close();
    } catch (RuntimeException ex) {
      log.debug("Pool {} ignoring close failure for {}: {}", name, conn.id(), Logs.describe(ex));
    }
  }

  private PoolExhaustedException exhausted(String reason, long startNanos) {
    metrics.increment("pool.lease.exhausted");
    Duration waited = Duration.ofNanos(System.nanoTime() - startNanos);
    return new PoolExhaustedException(
        "No connection available from pool " + name + " (" + reason + ", capacity " + live.size() + ")", waited);
  }

  private void checkOwner(PooledConnection conn) {
    Objects.requireNonNull(conn, "conn");
    if (conn.owner() != this) {
      throw new IllegalArgumentException("Connection " + conn.id() + " does not belong to pool " + name);
    }
  }
}

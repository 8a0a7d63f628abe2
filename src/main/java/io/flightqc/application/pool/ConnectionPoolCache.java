package io.flightqc.application.pool;

import io.flightqc.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pools owned by one analysis, keyed by the identity of the session that owns them.
 *
 * <p>The cache lets consecutive folders of a site reuse warm connections. It is created by the analysis
 * invocation and torn down by it through {@link #invalidate(String)} or {@link #close()}; it is never shared
 * between invocations.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionPoolCache implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionPoolCache.class);

  private final PoolSettings settings;
  private final MetricsPort metrics;
  private final Map<String, ConnectionPool> pools = new HashMap<>();
  private boolean closed;

  public ConnectionPoolCache(PoolSettings settings, MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Returns the pool owned by {@code ownerId}, creating it on first use, topped up to {@code target} connections.
   *
   * @param ownerId identity of the owning session
   * @param factory opens sessions for the pool on first creation
   * @param target desired live connections for the coming batch
   * @return pool ready for leasing; may hold fewer than {@code target} connections
   */
  public ConnectionPool acquire(String ownerId, SessionFactory factory, int target) {
    Objects.requireNonNull(ownerId, "ownerId");
    ConnectionPool pool;
    synchronized (this) {
      if (closed) {
        throw new IllegalStateException("Connection pool cache is closed");
      }
      pool = pools.computeIfAbsent(ownerId, id -> new ConnectionPool("pool-" + id, factory, settings, metrics));
    }
    pool.ensureCapacity(target);
    return pool;
  }

  /**
   * Closes and forgets the pool owned by {@code ownerId}.
   *
   * @param ownerId identity of the owning session
   * @return {@code true} when a pool was removed
   */
  public boolean invalidate(String ownerId) {
    ConnectionPool pool;
    synchronized (this) {
      pool = pools.remove(ownerId);
    }
    if (pool == null) {
      return false;
    }
    int capacity = pool.capacity();
    pool.close();
    log.info("Closed {} cached connections for session {}", capacity, ownerId);
    return true;
  }

  public synchronized int size() {
    return pools.size();
  }

  /** Closes every cached pool. Further {@link #acquire} calls fail. */
  @Override
  public void close() {
    List<String> owners;
    synchronized (this) {
      closed = true;
      owners = new ArrayList<>(pools.keySet());
    }
    for (String owner : owners) {
      invalidate(owner);
    }
  }
}

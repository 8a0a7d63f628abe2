package io.flightqc.application.pipeline;

import io.flightqc.application.pool.ConnectionPool;
import io.flightqc.application.pool.ConnectionPoolCache;
import io.flightqc.application.pool.SessionFactory;
import io.flightqc.domain.error.InsufficientPoolException;

/**
 * Supplies the connection pool for a parallel batch.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface PoolSource {

  /**
   * Returns a pool holding up to {@code workers} live connections.
   *
   * @param workers worker count of the coming batch
   * @return pool whose capacity reaches its floor
   * @throws InsufficientPoolException when fewer connections than the floor could be opened
   */
  ConnectionPool poolFor(int workers) throws InsufficientPoolException;

  /**
   * Pool source backed by an analysis-scoped cache.
   *
   * @param cache cache owned by the running analysis
   * @param ownerId identity of the owning session
   * @param factory opens sessions for new pool connections
   * @return pool source
   */
  static PoolSource cached(ConnectionPoolCache cache, String ownerId, SessionFactory factory) {
    return workers -> {
      ConnectionPool pool = cache.acquire(ownerId, factory, workers);
      if (!pool.isSufficient()) {
        throw new InsufficientPoolException(pool.capacity(), pool.floor());
      }
      return pool;
    };
  }
}

package io.flightqc.application.pool;

import io.flightqc.application.port.RemoteSession;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A pooled session plus its lease state.
 *
 * <p>Only the worker holding the lease may use {@link #session()}. The lease flag is flipped atomically so a
 * connection can never be returned twice.</p>
 *
 * @since 0.1.0
 */
public final class PooledConnection {
  private final ConnectionPool owner;
  private final RemoteSession session;
  private final AtomicBoolean leased = new AtomicBoolean();
  private volatile boolean dead;

  PooledConnection(ConnectionPool owner, RemoteSession session) {
    this.owner = Objects.requireNonNull(owner, "owner");
    this.session = Objects.requireNonNull(session, "session");
  }

  public RemoteSession session() {
    return session;
  }

  public String id() {
    return session.id();
  }

  public boolean isLeased() {
    return leased.get();
  }

  public boolean isDead() {
    return dead;
  }

  ConnectionPool owner() {
    return owner;
  }

  void markDead() {
    dead = true;
  }

  boolean tryLease() {
    return leased.compareAndSet(false, true);
  }

  boolean tryReturn() {
    return leased.compareAndSet(true, false);
  }

  @Override
  public String toString() {
    return "PooledConnection[" + session.id() + (leased.get() ? ", leased" : "") + (dead ? ", dead" : "") + "]";
  }
}

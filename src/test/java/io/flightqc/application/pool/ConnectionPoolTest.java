package io.flightqc.application.pool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.flightqc.domain.error.PoolExhaustedException;
import io.flightqc.testing.FakeRemoteSession;
import io.flightqc.testing.FakeSessionProvider;
import io.flightqc.testing.FakeSessionProvider.Outcome;
import io.flightqc.testing.FakeSite;
import io.flightqc.testing.RecordingMetricsPort;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConnectionPoolTest {
  private static final Duration SHORT = Duration.ofMillis(100);

  private FakeSessionProvider provider;
  private RecordingMetricsPort metrics;
  private ConnectionPool pool;

  @BeforeEach
  void setUp() {
    provider = new FakeSessionProvider(new FakeSite());
    metrics = new RecordingMetricsPort();
  }

  @AfterEach
  void tearDown() {
    if (pool != null) {
      pool.close();
    }
  }

  @Test
  void createSkipsFailedOpensAndReportsShortfall() {
    provider.then(Outcome.HEALTHY, 1).then(Outcome.REFUSED, 2);

    pool = ConnectionPool.create("test", 5, provider::open, settings(5, false), metrics);

    assertEquals(3, pool.capacity());
    assertEquals(3, pool.available());
    assertFalse(pool.isSufficient());
    assertEquals(2, metrics.count("pool.connection.open.failed"));
    assertEquals(3, metrics.count("pool.connection.created"));
  }

  @Test
  void leaseAndReleaseCycleConnections() throws Exception {
    pool = ConnectionPool.create("test", 2, provider::open, settings(1, false), metrics);

    PooledConnection first = pool.lease(SHORT);
    PooledConnection second = pool.lease(SHORT);

    assertNotSame(first, second);
    assertTrue(first.isLeased());
    assertEquals(0, pool.available());

    pool.release(first);
    pool.release(second);

    assertEquals(2, pool.available());
    assertFalse(first.isLeased());
    assertEquals(2, metrics.observed("pool.lease.waitNanos").size());
  }

  @Test
  void duplicateReleaseIsIgnored() throws Exception {
    pool = ConnectionPool.create("test", 1, provider::open, settings(1, false), metrics);
    PooledConnection conn = pool.lease(SHORT);

    pool.release(conn);
    pool.release(conn);
    pool.discard(conn);

    assertEquals(1, pool.available());
    assertEquals(1, pool.capacity());
    assertEquals(2, metrics.count("pool.release.duplicate"));
  }

  @Test
  void discardClosesSessionAndShrinksCapacity() throws Exception {
    pool = ConnectionPool.create("test", 2, provider::open, settings(1, false), metrics);
    PooledConnection conn = pool.lease(SHORT);

    pool.discard(conn);

    assertEquals(1, pool.capacity());
    assertTrue(((FakeRemoteSession) conn.session()).closed());
    assertEquals(1, metrics.count("pool.connection.dropped"));
  }

  @Test
  void leaseTimesOutWhenEveryConnectionIsBusy() throws Exception {
    pool = ConnectionPool.create("test", 1, provider::open, settings(1, false), metrics);
    PooledConnection held = pool.lease(SHORT);

    long start = System.nanoTime();
    PoolExhaustedException ex = assertThrows(PoolExhaustedException.class, () -> pool.lease(SHORT));
    long waitedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

    assertTrue(waitedMillis >= SHORT.toMillis() - 5, "waited " + waitedMillis + " ms");
    assertTrue(ex.getMessage().contains("timeout"));
    assertEquals(1, metrics.count("pool.lease.exhausted"));
    pool.release(held);
  }

  @Test
  void emptyPoolFailsImmediately() {
    provider.then(Outcome.REFUSED, 2);
    pool = ConnectionPool.create("test", 2, provider::open, settings(1, false), metrics);

    PoolExhaustedException ex = assertThrows(PoolExhaustedException.class, () -> pool.lease(Duration.ofSeconds(30)));

    assertTrue(ex.waited().compareTo(Duration.ofSeconds(1)) < 0);
  }

  @Test
  void probeOnLeaseDropsDeadConnections() throws Exception {
    provider.then(Outcome.DEAD, 3).then(Outcome.HEALTHY, 2);
    pool = ConnectionPool.create("test", 5, provider::open, settings(1, true), metrics);

    List<PooledConnection> leased = new ArrayList<>();
    leased.add(pool.lease(SHORT));
    leased.add(pool.lease(SHORT));

    assertEquals(2, pool.capacity());
    assertEquals(3, metrics.count("pool.connection.dropped"));
    for (PooledConnection conn : leased) {
      assertTrue(pool.healthCheck(conn));
      pool.release(conn);
    }
  }

  @Test
  void healthCheckMarksBrokenConnectionDead() throws Exception {
    provider.then(Outcome.DEAD, 1);
    pool = ConnectionPool.create("test", 1, provider::open, settings(1, false), metrics);
    PooledConnection conn = pool.lease(SHORT);

    assertFalse(pool.healthCheck(conn));
    assertTrue(conn.isDead());

    pool.release(conn);
    assertEquals(0, pool.capacity());
  }

  @Test
  void ensureCapacityReplacesDeadIdleConnections() {
    provider.then(Outcome.DEAD, 1).then(Outcome.HEALTHY, 1);
    pool = ConnectionPool.create("test", 2, provider::open, settings(1, false), metrics);

    int live = pool.ensureCapacity(3);

    assertEquals(3, live);
    assertEquals(4, provider.attempts());
    assertTrue(provider.opened().get(0).closed());
  }

  @Test
  void ensureCapacityNeverShrinks() {
    pool = ConnectionPool.create("test", 4, provider::open, settings(1, false), metrics);

    assertEquals(4, pool.ensureCapacity(2));
    assertEquals(4, provider.attempts());
  }

  @Test
  void closeClosesIdleSessionsAndLateReleases() throws Exception {
    pool = ConnectionPool.create("test", 3, provider::open, settings(1, false), metrics);
    PooledConnection held = pool.lease(SHORT);

    pool.close();

    assertThrows(PoolExhaustedException.class, () -> pool.lease(SHORT));
    pool.release(held);
    assertTrue(provider.allClosed());
    assertEquals(0, pool.capacity());
  }

  @Test
  void rejectsConnectionsFromAnotherPool() throws Exception {
    pool = ConnectionPool.create("test", 1, provider::open, settings(1, false), metrics);
    try (ConnectionPool other = ConnectionPool.create("other", 1, provider::open, settings(1, false), metrics)) {
      PooledConnection foreign = other.lease(SHORT);

      assertThrows(IllegalArgumentException.class, () -> pool.release(foreign));
      other.release(foreign);
    }
  }

  @Test
  void concurrentLeasesNeverShareAConnection() throws Exception {
    pool = ConnectionPool.create("test", 4, provider::open, settings(1, false), metrics);
    Set<String> seen = Collections.synchronizedSet(new HashSet<>());
    List<Thread> threads = new ArrayList<>();
    for (int t = 0; t < 8; t++) {
      Thread thread = new Thread(() -> {
        for (int i = 0; i < 50; i++) {
          try {
            PooledConnection conn = pool.lease(Duration.ofSeconds(5));
            conn.session().stat("/", SHORT);
            seen.add(conn.id());
            pool.release(conn);
          } catch (Exception ex) {
            throw new IllegalStateException(ex);
          }
        }
      });
      threads.add(thread);
      thread.start();
    }
    for (Thread thread : threads) {
      thread.join();
    }

    assertFalse(provider.anyOverlapped());
    assertEquals(4, pool.available());
    assertTrue(seen.size() <= 4);
    assertEquals(0, metrics.count("pool.release.duplicate"));
  }

  private static PoolSettings settings(int floor, boolean probeOnLease) {
    return new PoolSettings(floor, Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofSeconds(1), probeOnLease);
  }
}

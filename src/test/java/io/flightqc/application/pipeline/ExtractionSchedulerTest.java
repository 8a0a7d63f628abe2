package io.flightqc.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import io.flightqc.application.pool.ConnectionPool;
import io.flightqc.application.pool.PoolSettings;
import io.flightqc.domain.error.InsufficientPoolException;
import io.flightqc.domain.geo.ExtractionResult;
import io.flightqc.domain.site.WorkItem;
import io.flightqc.testing.FakeRemoteSession;
import io.flightqc.testing.FakeSessionProvider;
import io.flightqc.testing.FakeSessionProvider.Outcome;
import io.flightqc.testing.FakeSite;
import io.flightqc.testing.RecordingMetricsPort;
import io.flightqc.testing.TextGeotagExtractor;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExtractionSchedulerTest {
  private static final String FOLDER = "/homes/pilot/12345678/01_Orbit";

  private FakeSite site;
  private FakeSessionProvider provider;
  private RecordingMetricsPort metrics;
  private FakeRemoteSession primary;
  private ConnectionPool pool;

  @BeforeEach
  void setUp() throws Exception {
    site = new FakeSite();
    provider = new FakeSessionProvider(site);
    metrics = new RecordingMetricsPort();
    primary = new FakeRemoteSession("primary", site, FakeRemoteSession.Behavior.HEALTHY);
  }

  @AfterEach
  void tearDown() {
    if (pool != null) {
      pool.close();
    }
  }

  @Test
  void smallBatchRunsSequentiallyOnPrimary() {
    List<WorkItem> items = images(3);
    ExtractionScheduler scheduler = scheduler(settings(Duration.ofSeconds(5), Duration.ofSeconds(30)),
        Duration.ofSeconds(1));

    BatchReport report = scheduler.extract(items, primary, workers -> fail("pool must not be requested"));

    assertEquals(3, report.results().size());
    assertEquals(3, report.processed());
    assertEquals(3, primary.reads());
    assertFalse(report.sequentialFallback());
  }

  @Test
  void parallelBatchSurvivesDeadConnectionsInPool() {
    List<WorkItem> items = images(40);
    provider.then(Outcome.DEAD, 3);
    pool = ConnectionPool.create("test", 20, provider::open, poolSettings(5, true), metrics);
    ExtractionScheduler scheduler = scheduler(settings(Duration.ofSeconds(5), Duration.ofSeconds(60)),
        Duration.ofSeconds(5));

    BatchReport report = scheduler.extract(items, primary, workers -> pool);

    assertEquals(40, report.results().size());
    assertEquals(40, report.processed());
    assertTrue(report.timedOutItems().isEmpty());
    assertTrue(report.failedItems().isEmpty());
    assertFalse(report.batchTimedOut());
    assertEquals(17, pool.capacity());
    assertEquals(pool.capacity(), pool.available());
    assertEquals(0, primary.reads());
    assertFalse(provider.anyOverlapped());
    assertEquals(0, metrics.count("pool.release.duplicate"));
    assertEquals(List.of(10L), metrics.observed("extract.batch.workers"));
  }

  @Test
  void everyItemIsProcessedExactlyOnce() {
    List<WorkItem> items = images(60);
    pool = ConnectionPool.create("test", 10, provider::open, poolSettings(5, false), metrics);
    ExtractionScheduler scheduler = scheduler(settings(Duration.ofSeconds(5), Duration.ofSeconds(60)),
        Duration.ofSeconds(5));

    BatchReport report = scheduler.extract(items, primary, workers -> pool);

    Set<String> names = report.results().stream().map(ExtractionResult::filename).collect(Collectors.toSet());
    assertEquals(60, names.size());
    assertEquals(60, report.results().size());
    int totalReads = provider.opened().stream().mapToInt(FakeRemoteSession::reads).sum();
    assertEquals(60, totalReads);
  }

  @Test
  void resetConnectionIsDiscardedAndItemRetried() {
    List<WorkItem> items = images(20);
    provider.then(Outcome.READ_RESETS, 1);
    pool = ConnectionPool.create("test", 10, provider::open, poolSettings(5, false), metrics);
    ExtractionScheduler scheduler = scheduler(settings(Duration.ofSeconds(5), Duration.ofSeconds(60)),
        Duration.ofSeconds(5));

    BatchReport report = scheduler.extract(items, primary, workers -> pool);

    assertEquals(20, report.results().size());
    assertTrue(report.failedItems().isEmpty());
    assertEquals(9, pool.capacity());
    assertTrue(provider.opened().get(0).closed());
    assertEquals(1, metrics.count("extract.item.connectionLost"));
  }

  @Test
  void slowItemTimesOutWithoutBlockingTheBatch() {
    List<WorkItem> items = images(12);
    site.slowRead(items.get(4).path(), Duration.ofSeconds(10));
    pool = ConnectionPool.create("test", 10, provider::open, poolSettings(5, false), metrics);
    ExtractionScheduler scheduler = scheduler(settings(Duration.ofMillis(300), Duration.ofSeconds(30)),
        Duration.ofSeconds(5));

    long start = System.nanoTime();
    BatchReport report = scheduler.extract(items, primary, workers -> pool);
    long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

    assertTrue(elapsedMillis < 5_000, "batch took " + elapsedMillis + " ms");
    assertEquals(11, report.results().size());
    assertEquals(List.of(items.get(4).fileName()), report.timedOutItems());
    assertEquals(12, report.processed());
    assertFalse(report.batchTimedOut());
    assertEquals(9, pool.capacity());
    assertEquals(1, metrics.count("extract.item.timeout"));
  }

  @Test
  void batchDeadlineAbandonsOutstandingItems() throws Exception {
    List<WorkItem> items = images(30);
    site.slowReadsUnder(FOLDER, Duration.ofSeconds(2));
    pool = ConnectionPool.create("test", 10, provider::open, poolSettings(5, false), metrics);
    ExtractionScheduler scheduler = scheduler(settings(Duration.ofSeconds(5), Duration.ofMillis(500)),
        Duration.ofSeconds(5));

    long start = System.nanoTime();
    BatchReport report = scheduler.extract(items, primary, workers -> pool);
    long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

    assertTrue(elapsedMillis < 2_000, "batch took " + elapsedMillis + " ms");
    assertTrue(report.batchTimedOut());
    assertTrue(report.results().isEmpty());
    assertEquals(30, report.timedOutItems().size());
    assertEquals(1, metrics.count("extract.batch.timeout"));

    // interrupted workers hand their leases back shortly after the batch returns
    long waitUntil = System.nanoTime() + Duration.ofSeconds(3).toNanos();
    while (pool.available() != pool.capacity() && System.nanoTime() < waitUntil) {
      Thread.sleep(20);
    }
    assertEquals(pool.capacity(), pool.available());
  }

  @Test
  void exhaustedPoolDefersItemsToPrimary() {
    List<WorkItem> items = images(12);
    site.slowReadsUnder(FOLDER, Duration.ofMillis(200));
    pool = ConnectionPool.create("test", 1, provider::open, poolSettings(1, false), metrics);
    ExtractionScheduler scheduler = scheduler(settings(Duration.ofSeconds(5), Duration.ofSeconds(30)),
        Duration.ofMillis(50));

    BatchReport report = scheduler.extract(items, primary, workers -> pool);

    assertTrue(report.sequentialFallback());
    assertEquals(12, report.results().size());
    assertTrue(primary.reads() > 0);
    assertEquals(1, metrics.count("extract.batch.fallback"));
    assertTrue(metrics.count("pool.lease.exhausted") > 0);
  }

  @Test
  void insufficientPoolFallsBackToSequential() {
    List<WorkItem> items = images(10);
    ExtractionScheduler scheduler = scheduler(settings(Duration.ofSeconds(5), Duration.ofSeconds(30)),
        Duration.ofSeconds(1));

    BatchReport report = scheduler.extract(items, primary, workers -> {
      throw new InsufficientPoolException(2, 5);
    });

    assertTrue(report.sequentialFallback());
    assertEquals(10, report.results().size());
    assertEquals(10, primary.reads());
  }

  @Test
  void unreadableAndUntaggedImagesAreCountedButYieldNoResult() {
    List<WorkItem> items = images(10);
    site.failRead(items.get(0).path());
    site.plainImage(items.get(1).path(), 128);
    pool = ConnectionPool.create("test", 10, provider::open, poolSettings(5, false), metrics);
    ExtractionScheduler scheduler = scheduler(settings(Duration.ofSeconds(5), Duration.ofSeconds(30)),
        Duration.ofSeconds(5));

    BatchReport report = scheduler.extract(items, primary, workers -> pool);

    assertEquals(8, report.results().size());
    assertEquals(10, report.processed());
    assertEquals(List.of(items.get(0).fileName()), report.failedItems());
    assertEquals(10, pool.capacity());
  }

  @Test
  void uncheckedReadFailureOnPrimarySkipsOnlyThatItem() {
    List<WorkItem> items = images(4);
    site.crashRead(items.get(1).path());
    ExtractionScheduler scheduler = scheduler(settings(Duration.ofSeconds(5), Duration.ofSeconds(30)),
        Duration.ofSeconds(1));

    BatchReport report = scheduler.extract(items, primary, workers -> fail("pool must not be requested"));

    assertEquals(3, report.results().size());
    assertEquals(4, report.processed());
    assertEquals(List.of(items.get(1).fileName()), report.failedItems());
    assertEquals(1, metrics.count("extract.item.failed"));
  }

  @Test
  void emptyBatchReturnsEmptyReport() {
    ExtractionScheduler scheduler = scheduler(settings(Duration.ofSeconds(5), Duration.ofSeconds(30)),
        Duration.ofSeconds(1));

    BatchReport report = scheduler.extract(List.of(), primary, workers -> fail("pool must not be requested"));

    assertEquals(0, report.processed());
    assertTrue(report.results().isEmpty());
  }

  private List<WorkItem> images(int count) {
    List<WorkItem> items = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      String path = String.format("%s/DJI_%04d.JPG", FOLDER, i);
      site.image(path, 40.0 + i * 1e-5, -75.0 - i * 1e-5, 100.0 + i);
      items.add(new WorkItem("01_Orbit", path));
    }
    return items;
  }

  private ExtractionScheduler scheduler(SchedulerSettings settings, Duration leaseTimeout) {
    return new ExtractionScheduler(new TextGeotagExtractor(), settings, 4_096, leaseTimeout, metrics);
  }

  private static SchedulerSettings settings(Duration itemTimeout, Duration batchTimeout) {
    return new SchedulerSettings(10, 10, 20, 5, itemTimeout, batchTimeout, 20);
  }

  private static PoolSettings poolSettings(int floor, boolean probeOnLease) {
    return new PoolSettings(floor, Duration.ofSeconds(1), Duration.ofSeconds(5), Duration.ofSeconds(1), probeOnLease);
  }
}

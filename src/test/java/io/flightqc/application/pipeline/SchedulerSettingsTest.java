package io.flightqc.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class SchedulerSettingsTest {

  @Test
  void workerCountClampsBatchSizeOverItemsPerWorker() {
    SchedulerSettings settings = SchedulerSettings.defaults();

    assertEquals(10, settings.workerCount(40));
    assertEquals(10, settings.workerCount(0));
    assertEquals(15, settings.workerCount(159));
    assertEquals(20, settings.workerCount(1_000));
  }

  @Test
  void maxWorkersBelowMinIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new SchedulerSettings(10, 10, 5, 5, Duration.ofSeconds(1), Duration.ofSeconds(2), 20));
  }

  @Test
  void zeroItemsPerWorkerIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new SchedulerSettings(0, 1, 5, 5, Duration.ofSeconds(1), Duration.ofSeconds(2), 20));
  }
}

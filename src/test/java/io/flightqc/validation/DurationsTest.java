package io.flightqc.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class DurationsTest {

  @Test
  void parsesEachSupportedUnit() {
    assertEquals(Duration.ofMillis(500), Durations.parsePositive("t", "500ms"));
    assertEquals(Duration.ofSeconds(30), Durations.parsePositive("t", "30s"));
    assertEquals(Duration.ofMinutes(5), Durations.parsePositive("t", "5M"));
  }

  @Test
  void bareNumbersAreSeconds() {
    assertEquals(Duration.ofSeconds(45), Durations.parsePositive("t", " 45 "));
  }

  @Test
  void rejectsZeroAndGarbage() {
    assertThrows(IllegalArgumentException.class, () -> Durations.parsePositive("t", "0s"));
    assertThrows(IllegalArgumentException.class, () -> Durations.parsePositive("t", "-3s"));
    assertThrows(IllegalArgumentException.class, () -> Durations.parsePositive("t", "1h"));
    assertThrows(IllegalArgumentException.class, () -> Durations.parsePositive("t", "99999999999999999999"));
  }

  @Test
  void formatPicksLargestExactUnit() {
    assertEquals("10m", Durations.format(Duration.ofMinutes(10)));
    assertEquals("90s", Durations.format(Duration.ofSeconds(90)));
    assertEquals("1500ms", Durations.format(Duration.ofMillis(1500)));
  }

  @Test
  void formatOutputParsesBack() {
    Duration original = Duration.ofMillis(2250);

    assertEquals(original, Durations.parsePositive("t", Durations.format(original)));
  }
}

package io.flightqc.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExtractionSettingsTest {

  @Test
  void imageMatchingIgnoresCase() {
    ExtractionSettings settings = ExtractionSettings.defaults();

    assertTrue(settings.isImage("DJI_0001.JPG"));
    assertTrue(settings.isImage("scan.tiff"));
    assertFalse(settings.isImage("flight.log"));
    assertFalse(settings.isImage("README"));
    assertFalse(settings.isImage("trailing."));
  }

  @Test
  void extensionsAreNormalized() {
    ExtractionSettings settings = new ExtractionSettings(
        4_096, List.of(".JPG", "Png"), List.of("gps:altitude"), Duration.ofSeconds(1), Duration.ofSeconds(1));

    assertEquals(List.of("jpg", "png"), settings.imageExtensions());
  }

  @Test
  void tinyPrefixIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new ExtractionSettings(
        16, List.of("jpg"), List.of("gps:altitude"), Duration.ofSeconds(1), Duration.ofSeconds(1)));
  }
}

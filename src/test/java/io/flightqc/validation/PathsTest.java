package io.flightqc.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void validateWritableDirReturnsRealPathWhenDirectoryExists() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("existing"));

    assertEquals(dir.toRealPath(), Paths.validateWritableDir(dir, false));
  }

  @Test
  void validateWritableDirCreatesWhenRequested() {
    Path dir = tempDir.resolve("reports/site-1");

    Path validated = Paths.validateWritableDir(dir, true);

    assertTrue(Files.isDirectory(validated));
  }

  @Test
  void validateWritableDirLeavesMissingDirectoryAloneWithoutCreate() {
    Path dir = tempDir.resolve("future/child");

    Path validated = Paths.validateWritableDir(dir, false);

    assertFalse(Files.exists(validated));
    assertTrue(validated.endsWith(Path.of("future", "child")));
  }

  @Test
  void validateWritableDirRejectsRegularFile() throws IOException {
    Path file = Files.createFile(tempDir.resolve("analysis.json"));

    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(file, true));
  }

  @Test
  void requireRemoteAbsoluteDropsTrailingSlash() {
    assertEquals("/homes/pilot/12345678", Paths.requireRemoteAbsolute("siteRoot", "/homes/pilot/12345678/"));
    assertEquals("/", Paths.requireRemoteAbsolute("siteRoot", "/"));
  }

  @Test
  void requireRemoteAbsoluteRejectsRelativeAndTraversal() {
    assertThrows(IllegalArgumentException.class, () -> Paths.requireRemoteAbsolute("siteRoot", "homes/pilot"));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireRemoteAbsolute("siteRoot", "/homes/../etc"));
  }
}

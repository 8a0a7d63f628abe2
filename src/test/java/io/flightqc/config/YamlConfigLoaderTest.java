package io.flightqc.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("flightqc.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
        analyze:
          host: sftp.example.org
          port: 2222
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "analyze").orElseThrow();

    assertEquals("none", map.get("metricsExporter"));
    assertEquals("sftp.example.org", map.get("host"));
    assertEquals("2222", map.get("port"));
  }

  @Test
  void loadFlattensNestedMapsAndJoinsLists() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        Analyze:
          scheduler:
            itemTimeout: 20s
          extract:
            extensions: [jpg, dng]
            altitudePrecedence:
              - xmp:drone-dji:RelativeAltitude
              - gps:altitude
          sftp:
            knownHosts:
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "analyze").orElseThrow();

    assertEquals("20s", map.get("scheduler.itemTimeout"));
    assertEquals("jpg,dng", map.get("extract.extensions"));
    assertEquals("xmp:drone-dji:RelativeAltitude,gps:altitude", map.get("extract.altitudePrecedence"));
    assertEquals("", map.get("sftp.knownHosts"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "analyze").isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("empty.yaml"), "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "analyze").orElseThrow());
  }

  @Test
  void rejectsNonMappingSectionsAndNestedLists() throws IOException {
    Path scalarSection = Files.writeString(tempDir.resolve("scalar.yaml"), "analyze: 42\n");
    Path nestedList = Files.writeString(tempDir.resolve("lists.yaml"), """
        analyze:
          extract:
            extensions:
              - [jpg]
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(scalarSection, "analyze"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(nestedList, "analyze"));
  }

  @Test
  void malformedYamlIsReportedAsInvalidArgument() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("broken.yaml"), "analyze: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "analyze"));
  }
}

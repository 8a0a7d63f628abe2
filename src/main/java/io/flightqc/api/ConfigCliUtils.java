package io.flightqc.api;

import io.flightqc.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/** Helpers shared by subcommands for the {@code config=FILE} argument and boolean settings. */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes {@code config} from the argument map and loads the file it names.
   *
   * @param args mutable argument map
   * @param mode command section to merge with {@code common}
   * @return YAML settings, or empty when no file was named
   * @throws IllegalArgumentException when the named file is missing or malformed
   * @throws IOException when the file cannot be read
   */
  static Optional<Map<String, String>> loadConfig(Map<String, String> args, String mode) throws IOException {
    String value = args.remove("config");
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    Path path = Path.of(value.trim());
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException("Configuration file does not exist: " + path);
    }
    return YamlConfigLoader.load(path, mode);
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    String value = map == null ? null : map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}

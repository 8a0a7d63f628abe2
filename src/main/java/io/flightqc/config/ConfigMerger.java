package io.flightqc.config;

import io.flightqc.validation.Durations;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings with precedence CLI &gt; YAML &gt; defaults, then checks the rules that
 * span several keys.
 */
public final class ConfigMerger {
  // never accepted from files or the command line; see AnalysisConfig#credentials
  private static final Set<String> FORBIDDEN_KEYS = Set.of("secret", "password");

  private ConfigMerger() {}

  /**
   * Builds the effective flat configuration.
   *
   * @param mode active command
   * @param yaml settings loaded from YAML, if any
   * @param cli {@code key=value} overrides
   * @param defaults embedded defaults for the command
   * @param warn receives a message for every CLI key that overrides a YAML key
   * @return immutable merged map
   * @throws IllegalArgumentException when a cross-key rule is violated
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(entry.getKey()) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + entry.getKey());
      }
      merged.put(entry.getKey(), entry.getValue());
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    for (String key : effective.keySet()) {
      if (FORBIDDEN_KEYS.contains(key.toLowerCase(Locale.ROOT))) {
        throw new IllegalArgumentException(
            key + " must not be configured directly; export it and name the variable with secretEnv");
      }
    }
    if (!"analyze".equalsIgnoreCase(mode)) {
      return;
    }
    if (parseBoolean(effective.get("sftp.strictHostKeyChecking")) && trim(effective.get("sftp.knownHosts")).isEmpty()) {
      throw new IllegalArgumentException("sftp.strictHostKeyChecking requires sftp.knownHosts");
    }
    Optional<Duration> item = duration(effective, "scheduler.itemTimeout");
    Optional<Duration> batch = duration(effective, "scheduler.batchTimeout");
    if (item.isPresent() && batch.isPresent() && item.get().compareTo(batch.get()) > 0) {
      throw new IllegalArgumentException("scheduler.itemTimeout must not exceed scheduler.batchTimeout");
    }
  }

  private static Optional<Duration> duration(Map<String, String> effective, String key) {
    String value = trim(effective.get(key));
    return value.isEmpty() ? Optional.empty() : Optional.of(Durations.parsePositive(key, value));
  }

  private static boolean parseBoolean(String value) {
    return Boolean.parseBoolean(trim(value));
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}

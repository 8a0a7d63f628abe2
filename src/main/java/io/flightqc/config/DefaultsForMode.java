package io.flightqc.config;

import io.flightqc.application.classify.ClassifierSettings;
import io.flightqc.application.pipeline.ExtractionSettings;
import io.flightqc.application.pipeline.SchedulerSettings;
import io.flightqc.application.pool.PoolSettings;
import io.flightqc.application.scene.SceneSettings;
import io.flightqc.domain.site.FolderCategory;
import io.flightqc.infrastructure.sftp.SftpOptions;
import io.flightqc.validation.Durations;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Flattened defaults per CLI command. The settings records' own {@code defaults()} are the source of truth; this
 * class only renders them as the string map the merger works on.
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = Map.of(
      "metricsExporter", "otlp",
      "otelEndpoint", "",
      "otelResourceAttributes", "",
      "verbose", "false");

  private DefaultsForMode() {}

  /**
   * Returns common defaults merged with the defaults of {@code mode}.
   *
   * @param mode command name
   * @return unmodifiable flat map
   * @throws IllegalArgumentException for an unknown command
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "analyze" -> analyzeDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> analyzeDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("port", Integer.toString(AnalysisConfig.DEFAULT_PORT));
    map.put("secretEnv", AnalysisConfig.DEFAULT_SECRET_ENV);
    map.put("out", defaultOutputDirectory().toString());
    map.put("analysisTimeout", Durations.format(AnalysisConfig.DEFAULT_ANALYSIS_TIMEOUT));
    map.put("dryRun", "false");

    PoolSettings pool = PoolSettings.defaults();
    map.put("pool.floor", Integer.toString(pool.floor()));
    map.put("pool.connectTimeout", Durations.format(pool.connectTimeout()));
    map.put("pool.leaseTimeout", Durations.format(pool.leaseTimeout()));
    map.put("pool.healthCheckTimeout", Durations.format(pool.healthCheckTimeout()));
    map.put("pool.probeOnLease", Boolean.toString(pool.probeOnLease()));

    SchedulerSettings scheduler = SchedulerSettings.defaults();
    map.put("scheduler.itemsPerWorker", Integer.toString(scheduler.itemsPerWorker()));
    map.put("scheduler.minWorkers", Integer.toString(scheduler.minWorkers()));
    map.put("scheduler.maxWorkers", Integer.toString(scheduler.maxWorkers()));
    map.put("scheduler.sequentialThreshold", Integer.toString(scheduler.sequentialThreshold()));
    map.put("scheduler.itemTimeout", Durations.format(scheduler.itemTimeout()));
    map.put("scheduler.batchTimeout", Durations.format(scheduler.batchTimeout()));
    map.put("scheduler.progressInterval", Integer.toString(scheduler.progressInterval()));

    ExtractionSettings extraction = ExtractionSettings.defaults();
    map.put("extract.prefixBytes", Integer.toString(extraction.prefixBytes()));
    map.put("extract.extensions", String.join(",", extraction.imageExtensions()));
    map.put("extract.altitudePrecedence", String.join(",", extraction.altitudePrecedence()));
    map.put("extract.probeTimeout", Durations.format(extraction.probeTimeout()));
    map.put("extract.listTimeout", Durations.format(extraction.listTimeout()));

    ClassifierSettings classifier = ClassifierSettings.defaults();
    map.put("classifier.multiplier", Double.toString(classifier.multiplier()));
    map.put("classifier.groundReference", classifier.groundReference().stream()
        .sorted()
        .map(FolderCategory::keyword)
        .collect(Collectors.joining(",")));
    map.put("classifier.minEligiblePoints", Integer.toString(classifier.minEligiblePoints()));

    SceneSettings scene = SceneSettings.defaults();
    map.put("scene.groundResolution", Integer.toString(scene.groundResolution()));
    map.put("scene.groundOffsetFeet", Double.toString(scene.groundOffsetFeet()));
    map.put("scene.minCeilingFeet", Double.toString(scene.minCeilingFeet()));
    map.put("scene.groundColor", scene.groundColor());

    SftpOptions sftp = SftpOptions.defaults();
    map.put("sftp.compression", Boolean.toString(sftp.compression()));
    map.put("sftp.strictHostKeyChecking", Boolean.toString(sftp.strictHostKeyChecking()));
    map.put("sftp.knownHosts", "");
    map.put("sftp.keepAlive", Durations.format(sftp.keepAlive()));
    return map;
  }

  private static Path defaultOutputDirectory() {
    return Path.of(System.getProperty("user.home", "."), ".flightqc", "out");
  }
}

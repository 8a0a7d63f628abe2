package io.flightqc.config;

import io.flightqc.application.classify.ClassifierSettings;
import io.flightqc.application.pipeline.ExtractionSettings;
import io.flightqc.application.pipeline.SchedulerSettings;
import io.flightqc.application.pool.PoolSettings;
import io.flightqc.application.scene.SceneSettings;
import io.flightqc.domain.remote.SessionCredentials;
import io.flightqc.domain.site.FolderCategory;
import io.flightqc.infrastructure.exif.AltitudeTag;
import io.flightqc.infrastructure.sftp.SftpOptions;
import io.flightqc.validation.Durations;
import io.flightqc.validation.Net;
import io.flightqc.validation.Numbers;
import io.flightqc.validation.Paths;
import io.flightqc.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * <strong>What:</strong> Immutable configuration of one {@code analyze} run.
 * <p><strong>Why:</strong> Collects CLI, YAML and default values into typed settings before anything connects.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Describe the remote endpoint and site root; the secret itself stays in the environment.</li>
 *   <li>Carry the nested pool, scheduler, extraction, classifier, scene and SFTP settings.</li>
 *   <li>Reject malformed values with messages that name the offending key.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param host remote host name or IP literal
 * @param port SSH port
 * @param user login name
 * @param secretEnv name of the environment variable holding the password
 * @param siteRoot absolute remote path of the site
 * @param outputDirectory local directory receiving {@code analysis.json} and {@code scene.json}
 * @param analysisTimeout outer deadline of the whole analysis
 * @param pool connection pool settings
 * @param scheduler worker sizing and deadlines
 * @param extraction prefix size, extensions and altitude precedence
 * @param classifier outlier classification settings
 * @param scene scene building settings
 * @param sftp transport options
 * @since 0.1.0
 */
public record AnalysisConfig(
    String host,
    int port,
    String user,
    String secretEnv,
    String siteRoot,
    Path outputDirectory,
    Duration analysisTimeout,
    PoolSettings pool,
    SchedulerSettings scheduler,
    ExtractionSettings extraction,
    ClassifierSettings classifier,
    SceneSettings scene,
    SftpOptions sftp) {

  public static final int DEFAULT_PORT = 22;
  public static final String DEFAULT_SECRET_ENV = "FLIGHTQC_SECRET";
  public static final Duration DEFAULT_ANALYSIS_TIMEOUT = Duration.ofMinutes(10);

  public AnalysisConfig {
    host = Net.validateHost(Strings.requireNonBlank("host", host));
    Numbers.requireRange("port", port, 1, 65_535);
    user = Strings.requireNonBlank("user", user);
    secretEnv = Strings.requireEnvName("secretEnv", secretEnv);
    siteRoot = Paths.requireRemoteAbsolute("siteRoot", siteRoot);
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    Objects.requireNonNull(analysisTimeout, "analysisTimeout");
    Objects.requireNonNull(pool, "pool");
    Objects.requireNonNull(scheduler, "scheduler");
    Objects.requireNonNull(extraction, "extraction");
    Objects.requireNonNull(classifier, "classifier");
    Objects.requireNonNull(scene, "scene");
    Objects.requireNonNull(sftp, "sftp");
  }

  /**
   * Builds a configuration from flattened key/value settings such as those produced by {@link ConfigMerger}.
   *
   * @param options flat settings; {@code host}, {@code user}, {@code siteRoot} are required
   * @return populated configuration
   * @throws IllegalArgumentException when a value is missing or malformed
   */
  public static AnalysisConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Settings s = new Settings(options);

    PoolSettings poolDefaults = PoolSettings.defaults();
    PoolSettings pool = new PoolSettings(
        s.integer("pool.floor", poolDefaults.floor()),
        s.duration("pool.connectTimeout", poolDefaults.connectTimeout()),
        s.duration("pool.leaseTimeout", poolDefaults.leaseTimeout()),
        s.duration("pool.healthCheckTimeout", poolDefaults.healthCheckTimeout()),
        s.bool("pool.probeOnLease", poolDefaults.probeOnLease()));

    SchedulerSettings schedulerDefaults = SchedulerSettings.defaults();
    SchedulerSettings scheduler = new SchedulerSettings(
        s.integer("scheduler.itemsPerWorker", schedulerDefaults.itemsPerWorker()),
        s.integer("scheduler.minWorkers", schedulerDefaults.minWorkers()),
        s.integer("scheduler.maxWorkers", schedulerDefaults.maxWorkers()),
        s.integer("scheduler.sequentialThreshold", schedulerDefaults.sequentialThreshold()),
        s.duration("scheduler.itemTimeout", schedulerDefaults.itemTimeout()),
        s.duration("scheduler.batchTimeout", schedulerDefaults.batchTimeout()),
        s.integer("scheduler.progressInterval", schedulerDefaults.progressInterval()));

    ExtractionSettings extractionDefaults = ExtractionSettings.defaults();
    ExtractionSettings extraction = new ExtractionSettings(
        s.integer("extract.prefixBytes", extractionDefaults.prefixBytes()),
        s.list("extract.extensions", true).orElse(extractionDefaults.imageExtensions()),
        s.list("extract.altitudePrecedence", false).orElse(extractionDefaults.altitudePrecedence()),
        s.duration("extract.probeTimeout", extractionDefaults.probeTimeout()),
        s.duration("extract.listTimeout", extractionDefaults.listTimeout()));
    // fail here rather than on the first image
    AltitudeTag.parseAll(extraction.altitudePrecedence());

    ClassifierSettings classifierDefaults = ClassifierSettings.defaults();
    ClassifierSettings classifier = new ClassifierSettings(
        s.decimal("classifier.multiplier", classifierDefaults.multiplier()),
        s.list("classifier.groundReference", true)
            .map(AnalysisConfig::categories)
            .orElse(classifierDefaults.groundReference()),
        s.integer("classifier.minEligiblePoints", classifierDefaults.minEligiblePoints()));

    SceneSettings sceneDefaults = SceneSettings.defaults();
    SceneSettings scene = new SceneSettings(
        s.integer("scene.groundResolution", sceneDefaults.groundResolution()),
        s.decimal("scene.groundOffsetFeet", sceneDefaults.groundOffsetFeet()),
        s.decimal("scene.minCeilingFeet", sceneDefaults.minCeilingFeet()),
        s.text("scene.groundColor").orElse(sceneDefaults.groundColor()),
        sceneDefaults.camera(),
        sceneDefaults.theme());

    SftpOptions sftpDefaults = SftpOptions.defaults();
    SftpOptions sftp = new SftpOptions(
        s.bool("sftp.compression", sftpDefaults.compression()),
        s.bool("sftp.strictHostKeyChecking", sftpDefaults.strictHostKeyChecking()),
        s.text("sftp.knownHosts").map(value -> path("sftp.knownHosts", value)),
        s.text("sftp.keepAlive").filter(value -> !value.equals("0"))
            .map(value -> Durations.parsePositive("sftp.keepAlive", value))
            .orElse(s.has("sftp.keepAlive") ? Duration.ZERO : sftpDefaults.keepAlive()));

    return new AnalysisConfig(
        s.text("host").orElseThrow(() -> new IllegalArgumentException("host is required")),
        s.integer("port", DEFAULT_PORT),
        s.text("user").orElseThrow(() -> new IllegalArgumentException("user is required")),
        s.text("secretEnv").orElse(DEFAULT_SECRET_ENV),
        s.text("siteRoot").orElseThrow(() -> new IllegalArgumentException("siteRoot is required")),
        s.text("out").map(value -> path("out", value))
            .orElseThrow(() -> new IllegalArgumentException("out is required")),
        s.duration("analysisTimeout", DEFAULT_ANALYSIS_TIMEOUT),
        pool,
        scheduler,
        extraction,
        classifier,
        scene,
        sftp);
  }

  /**
   * Resolves the session credentials, reading the secret from the configured environment variable.
   *
   * @param environment environment lookup, usually {@code System::getenv}
   * @return credentials for the primary and pooled sessions
   * @throws IllegalArgumentException when the environment variable is unset
   */
  public SessionCredentials credentials(UnaryOperator<String> environment) {
    String secret = environment.apply(secretEnv);
    if (secret == null) {
      throw new IllegalArgumentException("environment variable " + secretEnv + " is not set");
    }
    return new SessionCredentials(host, port, user, secret);
  }

  private static Set<FolderCategory> categories(List<String> keywords) {
    Set<FolderCategory> categories = EnumSet.noneOf(FolderCategory.class);
    for (String keyword : keywords) {
      categories.add(FolderCategory.fromKeyword(keyword));
    }
    return categories;
  }

  private static Path path(String key, String value) {
    try {
      return Path.of(value).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + value, ex);
    }
  }

  /** Typed lookups over the flat map; blank values count as absent. */
  private record Settings(Map<String, String> options) {

    boolean has(String key) {
      String value = options.get(key);
      return value != null && !value.isBlank();
    }

    Optional<String> text(String key) {
      return has(key) ? Optional.of(options.get(key).trim()) : Optional.empty();
    }

    int integer(String key, int fallback) {
      Optional<String> value = text(key);
      if (value.isEmpty()) {
        return fallback;
      }
      try {
        return Integer.parseInt(value.get());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(key + " must be an integer (was " + value.get() + ")", ex);
      }
    }

    double decimal(String key, double fallback) {
      Optional<String> value = text(key);
      if (value.isEmpty()) {
        return fallback;
      }
      try {
        return Double.parseDouble(value.get());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(key + " must be a number (was " + value.get() + ")", ex);
      }
    }

    boolean bool(String key, boolean fallback) {
      Optional<String> value = text(key).map(v -> v.toLowerCase(Locale.ROOT));
      if (value.isEmpty()) {
        return fallback;
      }
      return switch (value.get()) {
        case "true", "yes", "on" -> true;
        case "false", "no", "off" -> false;
        default -> throw new IllegalArgumentException(key + " must be true or false (was " + value.get() + ")");
      };
    }

    Duration duration(String key, Duration fallback) {
      return text(key).map(value -> Durations.parsePositive(key, value)).orElse(fallback);
    }

    Optional<List<String>> list(String key, boolean lowerCase) {
      return text(key).map(value -> Strings.splitList(key, value, lowerCase));
    }
  }
}

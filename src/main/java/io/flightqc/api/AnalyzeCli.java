package io.flightqc.api;

import io.flightqc.application.pipeline.SiteAnalysisOutcome;
import io.flightqc.application.pipeline.SiteAnalysisRequest;
import io.flightqc.application.port.MetricsPort;
import io.flightqc.application.port.SessionProvider;
import io.flightqc.application.util.ByteSizes;
import io.flightqc.config.AnalysisConfig;
import io.flightqc.config.CompositionRoot;
import io.flightqc.config.ConfigMerger;
import io.flightqc.config.DefaultsForMode;
import io.flightqc.domain.error.AnalysisTimeoutException;
import io.flightqc.domain.error.ConnectionException;
import io.flightqc.domain.remote.SessionCredentials;
import io.flightqc.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import io.flightqc.infrastructure.report.AnalysisReportWriter;
import io.flightqc.infrastructure.report.PlotlySceneWriter;
import io.flightqc.infrastructure.sftp.JschSessionProvider;
import io.flightqc.logging.LoggingConfigurator;
import io.flightqc.validation.Durations;
import io.flightqc.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of {@code flightqc analyze}: analyzes one remote site and writes {@code analysis.json} and
 * {@code scene.json}.
 *
 * @since 0.1.0
 */
public final class AnalyzeCli {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeCli.class);
  private static final String MODE = "analyze";
  private static final String SUMMARY_USAGE =
      "usage: analyze host=HOST user=USER siteRoot=/REMOTE/PATH out=DIR [port=22] [secretEnv=NAME] "
          + "[config=FILE] [analysisTimeout=10m] [--dry-run] [--verbose] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      FlightQC site analysis

      Usage:
        analyze host=sftp.example.org user=pilot siteRoot=/homes/jdoe/12345678 out=./qc [options]

      Required:
        host=HOST                 SFTP host name or IP literal
        user=USER                 Login name
        siteRoot=PATH             Absolute remote path of the site
        out=DIR                   Local directory for analysis.json and scene.json

      Optional:
        port=22                   SSH port
        secretEnv=FLIGHTQC_SECRET Environment variable holding the password
        config=FILE               YAML file with common/analyze sections
        analysisTimeout=10m       Outer deadline for the whole site
        pool.floor=5              Fewest pooled sessions worth running in parallel
        scheduler.itemTimeout=30s Per-image read deadline
        scheduler.batchTimeout=5m Per-folder deadline
        extract.prefixBytes=65536 Bytes read from the start of each image
        classifier.multiplier=4.0 IQR multiplier for outlier bounds
        sftp.strictHostKeyChecking=false  Require sftp.knownHosts to list the host
        metricsExporter=otlp|none Metrics exporter (default otlp)
        otelEndpoint=URL          OTLP metrics endpoint
        --dry-run                 Validate settings and print the plan without connecting
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Exit codes:
        0 success, 2 invalid arguments, 3 I/O error, 4 configuration error,
        6 connection failed, 7 analysis timed out, 130 interrupted
      """;

  private AnalyzeCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs the command against the real environment, SFTP transport and metrics exporter.
   *
   * @param args command arguments (without the {@code analyze} token)
   * @return exit code
   */
  static ExitCode run(String[] args) {
    return run(args, System::getenv, null, null);
  }

  /**
   * Runs the command with optional collaborators.
   *
   * @param args command arguments
   * @param environment environment lookup used for the secret
   * @param provider session provider, or {@code null} for JSch
   * @param metrics metrics sink, or {@code null} for OpenTelemetry
   * @return exit code
   */
  static ExitCode run(
      String[] args, UnaryOperator<String> environment, SessionProvider provider, MetricsPort metrics) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for analyze CLI");
    }

    AnalysisConfig config;
    boolean dryRun;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      Optional<Map<String, String>> yaml = ConfigCliUtils.loadConfig(kv, MODE);
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          MODE, yaml, kv, DefaultsForMode.asFlatMap(MODE), log::warn);
      dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun", false);
      TelemetryConfigurator.configureMetrics(effective);
      config = AnalysisConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    if (dryRun) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    SessionCredentials credentials;
    Path outputDirectory;
    try {
      credentials = config.credentials(environment);
      outputDirectory = Paths.validateWritableDir(config.outputDirectory(), true);
    } catch (IllegalArgumentException ex) {
      log.error("Analyze configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    OpenTelemetryMetricsAdapter ownedMetrics = metrics == null ? new OpenTelemetryMetricsAdapter() : null;
    JschSessionProvider ownedProvider = null;
    try {
      CompositionRoot root = new CompositionRoot(config, metrics == null ? ownedMetrics : metrics);
      SessionProvider sessions = provider;
      if (sessions == null) {
        ownedProvider = root.sessionProvider();
        sessions = ownedProvider;
      }
      log.info("Analyzing {} on {} (timeout {})",
          config.siteRoot(), credentials.endpoint(), Durations.format(config.analysisTimeout()));
      SiteAnalysisOutcome outcome = root.siteAnalysisUseCase(sessions)
          .run(new SiteAnalysisRequest(credentials, config.siteRoot(), config.analysisTimeout()));
      Path summary = new AnalysisReportWriter().write(outputDirectory, outcome);
      Path scene = new PlotlySceneWriter().write(outputDirectory, outcome.scene());
      printSummary(outcome, summary, scene);
      return ExitCode.SUCCESS;
    } catch (ConnectionException ex) {
      log.error("Unable to connect to {}: {}", credentials.endpoint(), ex.getMessage());
      return ExitCode.CONNECTION_FAILED;
    } catch (AnalysisTimeoutException ex) {
      log.error(ex.getMessage());
      return ExitCode.GATEWAY_TIMEOUT;
    } catch (IOException ex) {
      log.error("Analysis of {} failed with an I/O error", config.siteRoot(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Analysis interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in analysis", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      if (ownedProvider != null) {
        ownedProvider.close();
      }
      if (ownedMetrics != null) {
        ownedMetrics.flush();
        ownedMetrics.close();
      }
    }
  }

  private static void printDryRunPlan(AnalysisConfig config) {
    CliPrinter.printLines(
        "Analyze dry-run: no connection will be opened.",
        " Endpoint          : " + config.user() + "@" + config.host() + ":" + config.port(),
        " Secret variable   : " + config.secretEnv(),
        " Site root         : " + config.siteRoot(),
        " Output directory  : " + config.outputDirectory(),
        " Analysis timeout  : " + Durations.format(config.analysisTimeout()),
        " Pool floor        : " + config.pool().floor(),
        " Workers           : " + config.scheduler().minWorkers() + "-" + config.scheduler().maxWorkers()
            + " (1 per " + config.scheduler().itemsPerWorker() + " images)",
        " Item / batch      : " + Durations.format(config.scheduler().itemTimeout())
            + " / " + Durations.format(config.scheduler().batchTimeout()),
        " Prefix bytes      : " + config.extraction().prefixBytes(),
        " Altitude sources  : " + String.join(", ", config.extraction().altitudePrecedence()),
        " Outlier multiplier: " + config.classifier().multiplier(),
        " Compression       : " + config.sftp().compression());
  }

  private static void printSummary(SiteAnalysisOutcome outcome, Path summary, Path scene) {
    CliPrinter.printLines(
        "Site " + outcome.analysis().site().siteId() + " (pilot " + outcome.analysis().site().pilot() + ")",
        " Images      : " + outcome.analysis().totalImages()
            + " (" + ByteSizes.format(outcome.analysis().totalSizeBytes()) + ")",
        " GPS points  : " + outcome.analysis().gpsCount(),
        " Outliers    : " + outcome.classification().outlierCount(),
        " Failed      : " + (outcome.analysis().failedFolders().isEmpty()
            ? "none" : String.join(", ", outcome.analysis().failedFolders())),
        " Summary     : " + summary,
        " Scene       : " + scene);
  }
}

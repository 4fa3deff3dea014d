package io.github.themoah.vigil;

import io.github.themoah.vigil.alert.AlertPublisher;
import io.github.themoah.vigil.alert.LoggingAlertPublisher;
import io.github.themoah.vigil.alert.WebhookAlertPublisher;
import io.github.themoah.vigil.config.AppConfig;
import io.github.themoah.vigil.config.BackendConfig;
import io.github.themoah.vigil.config.InsightConfig;
import io.github.themoah.vigil.config.ScoringConfig;
import io.github.themoah.vigil.health.BackendHealthMonitor;
import io.github.themoah.vigil.health.HealthCheckHandler;
import io.github.themoah.vigil.http.ScoringApiHandler;
import io.github.themoah.vigil.insight.HttpInsightProvider;
import io.github.themoah.vigil.insight.InsightProvider;
import io.github.themoah.vigil.logs.LogBatchAnalyzer;
import io.github.themoah.vigil.metrics.MicrometerConfig;
import io.github.themoah.vigil.metrics.MicrometerReporter;
import io.github.themoah.vigil.metrics.PrometheusHandler;
import io.github.themoah.vigil.metrics.ReportingConfig;
import io.github.themoah.vigil.metrics.ScoreReporter;
import io.github.themoah.vigil.metrics.StaleGaugeSweeper;
import io.github.themoah.vigil.scoring.NumericSeriesScorer;
import io.github.themoah.vigil.service.LogAnalysisService;
import io.github.themoah.vigil.service.MetricScoringService;
import io.github.themoah.vigil.service.ScheduledScanner;
import io.github.themoah.vigil.source.HttpJsonClient;
import io.github.themoah.vigil.source.LogSource;
import io.github.themoah.vigil.source.LokiLogSource;
import io.github.themoah.vigil.source.PrometheusTelemetrySource;
import io.github.themoah.vigil.source.TelemetrySource;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle for Vigil.
 * Wires configuration, backend clients, scoring services, health checks and the HTTP server.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);
  private static final String CONFIG_FILE_ENV = "VIGIL_CONFIG_FILE";

  private TelemetrySource telemetrySource;
  private LogSource logSource;
  private AlertPublisher alertPublisher;
  private InsightProvider insightProvider;
  private ScoreReporter reporter;
  private BackendHealthMonitor healthMonitor;
  private ScheduledScanner scanner;
  private StaleGaugeSweeper sweeper;
  private HttpServer httpServer;

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting Vigil MainVerticle");

    AppConfig appConfig = AppConfig.fromEnvironment();
    ScoringConfig scoringConfig = ScoringConfig.fromEnvironment();
    InsightConfig insightConfig = InsightConfig.fromEnvironment();
    ReportingConfig reportingConfig = ReportingConfig.fromEnvironment();
    BackendConfig backendConfig = loadBackendConfig();
    Clock clock = Clock.systemUTC();

    long timeoutMs = backendConfig.getRequestTimeoutMs();
    telemetrySource = new PrometheusTelemetrySource(
      new HttpJsonClient(vertx, timeoutMs), backendConfig.getPrometheusUrl(), scoringConfig.stepSeconds());
    logSource = new LokiLogSource(new HttpJsonClient(vertx, timeoutMs), backendConfig.getLokiUrl());
    alertPublisher = createAlertPublisher(backendConfig);
    insightProvider = createInsightProvider(insightConfig);

    Router router = Router.router(vertx);
    reporter = createReporter(reportingConfig, router);

    MetricScoringService metricService = new MetricScoringService(
      telemetrySource, new NumericSeriesScorer(scoringConfig.minDataPoints()),
      reporter, alertPublisher, scoringConfig, clock);
    LogAnalysisService logService = new LogAnalysisService(
      logSource, new LogBatchAnalyzer(), insightProvider, insightConfig.modelId(),
      reporter, alertPublisher, scoringConfig, clock);

    healthMonitor = new BackendHealthMonitor(vertx, telemetrySource, appConfig.healthCheckIntervalMs());
    new HealthCheckHandler(healthMonitor).registerRoutes(router);
    new ScoringApiHandler(metricService, logService, clock).registerRoutes(router);

    if (scoringConfig.isScanEnabled()) {
      scanner = new ScheduledScanner(vertx, metricService, logService, scoringConfig.scanIntervalMs());
    } else {
      log.info("Scheduled scans disabled");
    }
    if (reportingConfig.isEnabled()) {
      // At least one scan period between sweeps
      sweeper = new StaleGaugeSweeper(vertx, reporter,
        Math.max(reportingConfig.cleanupIntervalMs(), scoringConfig.scanIntervalMs()));
    }

    router.route().handler(ctx -> {
      ctx.response()
        .setStatusCode(404)
        .putHeader("content-type", "application/json")
        .end("{\"error\": \"Not Found\"}");
    });

    reporter.start()
      .compose(v -> healthMonitor.start())
      .compose(v -> scanner != null ? scanner.start() : Future.<Void>succeededFuture())
      .compose(v -> sweeper != null ? sweeper.start() : Future.<Void>succeededFuture())
      .compose(v -> startHttpServer(router, appConfig.httpPort()))
      .onSuccess(server -> {
        httpServer = server;
        log.info("Vigil started successfully on port {}", appConfig.httpPort());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start Vigil", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping Vigil MainVerticle");

    stopIfPresent(httpServer != null ? httpServer::close : null)
      .compose(v -> stopIfPresent(scanner != null ? scanner::stop : null))
      .compose(v -> stopIfPresent(sweeper != null ? sweeper::stop : null))
      .compose(v -> stopIfPresent(healthMonitor != null ? healthMonitor::stop : null))
      .compose(v -> stopIfPresent(reporter != null ? reporter::close : null))
      .compose(v -> stopIfPresent(insightProvider != null ? insightProvider::close : null))
      .compose(v -> stopIfPresent(alertPublisher != null ? alertPublisher::close : null))
      .compose(v -> stopIfPresent(logSource != null ? logSource::close : null))
      .compose(v -> stopIfPresent(telemetrySource != null ? telemetrySource::close : null))
      .onSuccess(v -> {
        log.info("Vigil stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during Vigil shutdown", err);
        stopPromise.fail(err);
      });
  }

  private static Future<Void> stopIfPresent(Supplier<Future<Void>> stopper) {
    return stopper != null ? stopper.get() : Future.succeededFuture();
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", port))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }

  private BackendConfig loadBackendConfig() {
    String configFile = System.getenv(CONFIG_FILE_ENV);
    if (configFile != null && !configFile.isBlank()) {
      try {
        return BackendConfig.fromFile(Path.of(configFile));
      } catch (IOException e) {
        log.warn("Cannot read {}={}, falling back: {}", CONFIG_FILE_ENV, configFile, e.getMessage());
      }
    }
    try {
      return BackendConfig.fromClasspath();
    } catch (Exception e) {
      log.info("No classpath config found, loading from environment: {}", e.getMessage());
      return BackendConfig.fromEnvironment();
    }
  }

  private AlertPublisher createAlertPublisher(BackendConfig config) {
    if (!config.hasWebhook()) {
      log.info("No alert webhook configured, alerts will be logged");
      return new LoggingAlertPublisher();
    }
    log.info("Alerts will be posted to the configured webhook");
    return new WebhookAlertPublisher(
      new HttpJsonClient(vertx, config.getRequestTimeoutMs()), config.getWebhookUrl(), config.getWebhookHeaders());
  }

  private InsightProvider createInsightProvider(InsightConfig config) {
    if (!config.enabled()) {
      return null;
    }
    return new HttpInsightProvider(new HttpJsonClient(vertx, config.timeoutMs()), config.resolvedEndpoint());
  }

  private ScoreReporter createReporter(ReportingConfig config, Router router) {
    if (!config.isEnabled()) {
      log.info("Score reporting is disabled");
      return ScoreReporter.noop();
    }

    MeterRegistry registry = MicrometerConfig.createRegistry(config.reporterType());
    if (registry == null) {
      log.warn("Failed to create meter registry for type: {}, score reporting disabled", config.reporterType());
      return ScoreReporter.noop();
    }

    if (config.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
      log.info("JVM metrics enabled");
    }

    if (registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      new PrometheusHandler(prometheusRegistry).registerRoutes(router);
    }
    return new MicrometerReporter(registry);
  }
}

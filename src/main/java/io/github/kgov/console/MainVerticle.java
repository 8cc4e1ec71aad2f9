package io.github.kgov.console;

import io.github.kgov.console.api.ApiConfig;
import io.github.kgov.console.api.GovernanceApi;
import io.github.kgov.console.config.AppConfig;
import io.github.kgov.console.health.BackendHealthMonitor;
import io.github.kgov.console.health.HealthCheckHandler;
import io.github.kgov.console.live.LiveFeedConfig;
import io.github.kgov.console.live.LiveSnapshotSubscriber;
import io.github.kgov.console.metrics.MetricsConfig;
import io.github.kgov.console.metrics.MetricsReporter;
import io.github.kgov.console.metrics.MicrometerConfig;
import io.github.kgov.console.metrics.MicrometerReporter;
import io.github.kgov.console.metrics.PrometheusHandler;
import io.github.kgov.console.watch.LiveLagWatcher;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Console service: watches the configured consumer groups over live channels,
 * exports them as metrics and reports backend health.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private GovernanceApi api;
  private LiveSnapshotSubscriber subscriber;
  private BackendHealthMonitor healthMonitor;
  private MetricsReporter reporter;
  private LiveLagWatcher watcher;
  private HttpServer httpServer;

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting console MainVerticle");

    AppConfig appConfig = AppConfig.fromEnvironment();
    MetricsConfig metricsConfig = MetricsConfig.fromEnvironment();
    ApiConfig apiConfig = ApiConfig.load();
    LiveFeedConfig liveConfig = LiveFeedConfig.fromEnvironment();

    api = GovernanceApi.create(vertx, apiConfig);
    subscriber = new LiveSnapshotSubscriber(vertx, apiConfig.getWsBaseUrl(), liveConfig);
    healthMonitor = new BackendHealthMonitor(vertx, api.clusters(), appConfig.healthCheckIntervalMs());

    Router router = Router.router(vertx);
    reporter = createReporter(metricsConfig, router);
    watcher = new LiveLagWatcher(subscriber, appConfig.watchTargets(), reporter);
    new HealthCheckHandler(healthMonitor, watcher::statuses).registerRoutes(router);

    router.route().handler(ctx -> ctx.response()
      .setStatusCode(404)
      .putHeader("content-type", "application/json")
      .end("{\"error\": \"Not Found\"}"));

    healthMonitor.start()
      .compose(v -> reporter != null ? reporter.start() : Future.succeededFuture())
      .compose(v -> watcher.start())
      .compose(v -> startHttpServer(router, appConfig.httpPort()))
      .onSuccess(server -> {
        httpServer = server;
        log.info("Console started on port {}", appConfig.httpPort());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start console", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping console MainVerticle");

    Future<Void> stopWatcher = watcher != null ? watcher.stop() : Future.succeededFuture();
    Future<Void> stopHealthMonitor = healthMonitor != null ? healthMonitor.stop() : Future.succeededFuture();

    stopWatcher
      .compose(v -> stopHealthMonitor)
      .compose(v -> httpServer != null ? httpServer.close() : Future.<Void>succeededFuture())
      .compose(v -> reporter != null ? reporter.close() : Future.<Void>succeededFuture())
      .onComplete(ar -> {
        if (subscriber != null) {
          subscriber.close();
        }
        if (api != null) {
          api.close();
        }
      })
      .onSuccess(v -> {
        log.info("Console stopped");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during console shutdown", err);
        stopPromise.fail(err);
      });
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", port))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }

  private MetricsReporter createReporter(MetricsConfig config, Router router) {
    if (!config.isEnabled()) {
      log.info("Metrics reporting is disabled");
      return null;
    }

    MeterRegistry registry = MicrometerConfig.createRegistry(config);
    if (registry == null) {
      log.warn("Metrics disabled, no registry for type: {}", config.reporterType());
      return null;
    }

    if (registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      new PrometheusHandler(prometheusRegistry).registerRoutes(router);
    }
    return new MicrometerReporter(registry);
  }
}

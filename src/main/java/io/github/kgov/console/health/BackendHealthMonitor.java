package io.github.kgov.console.health;

import io.github.kgov.console.api.ClusterClient;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Probes the backend {@code /health} endpoint periodically and keeps the last result.
 */
public class BackendHealthMonitor {

  private static final Logger log = LoggerFactory.getLogger(BackendHealthMonitor.class);

  private static final String HEALTHY = "healthy";

  private final Vertx vertx;
  private final ClusterClient clusters;
  private final long intervalMs;
  private final AtomicReference<HealthStatus> backendStatus = new AtomicReference<>(HealthStatus.DOWN);

  private Long timerId;

  public BackendHealthMonitor(Vertx vertx, ClusterClient clusters, long intervalMs) {
    this.vertx = vertx;
    this.clusters = clusters;
    this.intervalMs = intervalMs;
  }

  /**
   * Runs a first check, then schedules the periodic one. Completes even if the backend is down.
   */
  public Future<Void> start() {
    log.info("Starting backend health monitor with interval: {}ms", intervalMs);
    return check()
      .onComplete(ar -> {
        timerId = vertx.setPeriodic(intervalMs, id -> check());
        log.debug("Backend health monitor timer ID: {}", timerId);
      })
      .mapEmpty();
  }

  public Future<Void> stop() {
    log.info("Stopping backend health monitor");
    if (timerId != null) {
      vertx.cancelTimer(timerId);
      timerId = null;
    }
    backendStatus.set(HealthStatus.DOWN);
    return Future.succeededFuture();
  }

  public boolean isBackendReachable() {
    return backendStatus.get() == HealthStatus.UP;
  }

  Future<Void> check() {
    return clusters.health()
      .transform(ar -> {
        boolean healthy = ar.succeeded() && HEALTHY.equalsIgnoreCase(ar.result());
        HealthStatus previous = backendStatus.getAndSet(HealthStatus.of(healthy));
        if (healthy && previous == HealthStatus.DOWN) {
          log.info("Backend is reachable");
        } else if (!healthy && previous == HealthStatus.UP) {
          log.warn("Backend became unreachable: {}",
            ar.failed() ? ar.cause().getMessage() : "status " + ar.result());
        } else if (!healthy) {
          log.debug("Backend health check failed");
        }
        return Future.<Void>succeededFuture();
      });
  }
}

package io.github.kgov.console.health;

import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Liveness and readiness endpoints.
 */
public class HealthCheckHandler {

  private static final Logger log = LoggerFactory.getLogger(HealthCheckHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final BackendHealthMonitor monitor;
  private final Supplier<Map<String, String>> liveChannels;

  /**
   * @param monitor backend health monitor
   * @param liveChannels status of the watched groups, reported on readiness only
   */
  public HealthCheckHandler(BackendHealthMonitor monitor, Supplier<Map<String, String>> liveChannels) {
    this.monitor = monitor;
    this.liveChannels = liveChannels;
  }

  public void registerRoutes(Router router) {
    router.get("/healthz").handler(this::handleLiveness);
    router.get("/readyz").handler(this::handleReadiness);
    log.info("Health check routes registered: /healthz, /readyz");
  }

  private void handleLiveness(RoutingContext ctx) {
    respond(ctx, HealthCheckResponse.liveness());
  }

  /**
   * 200 while the last backend check succeeded, 503 otherwise.
   */
  private void handleReadiness(RoutingContext ctx) {
    respond(ctx, HealthCheckResponse.readiness(monitor.isBackendReachable(), liveChannels.get()));
  }

  private static void respond(RoutingContext ctx, HealthCheckResponse response) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(response.status().httpStatus())
      .end(response.toJson().encode());
  }
}

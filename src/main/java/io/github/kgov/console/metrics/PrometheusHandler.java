package io.github.kgov.console.metrics;

import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the registry at {@code /metrics}, in OpenMetrics when the scraper asks for it
 * and in the Prometheus text format otherwise.
 */
public class PrometheusHandler {

  private static final Logger log = LoggerFactory.getLogger(PrometheusHandler.class);

  private final PrometheusMeterRegistry registry;

  public PrometheusHandler(PrometheusMeterRegistry registry) {
    this.registry = registry;
  }

  public void registerRoutes(Router router) {
    router.get("/metrics").handler(this::scrape);
    log.info("Registered Prometheus endpoint at /metrics");
  }

  private void scrape(RoutingContext ctx) {
    String contentType = TextFormat.chooseContentType(ctx.request().getHeader(HttpHeaders.ACCEPT));
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, contentType)
      .end(registry.scrape(contentType));
  }
}

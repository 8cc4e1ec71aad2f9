package io.github.kgov.console.health;

import io.vertx.core.json.JsonObject;
import java.util.Map;

/**
 * Body of the health endpoints.
 *
 * @param status overall status
 * @param backend backend reachability, null for liveness
 * @param liveChannels status of each watched group channel, empty for liveness
 */
public record HealthCheckResponse(HealthStatus status, String backend, Map<String, String> liveChannels) {

  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null, Map.of());
  }

  public static HealthCheckResponse readiness(boolean backendReachable, Map<String, String> liveChannels) {
    return new HealthCheckResponse(HealthStatus.of(backendReachable),
      backendReachable ? "reachable" : "unreachable", Map.copyOf(liveChannels));
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.name());
    if (backend != null) {
      json.put("backend", backend);
    }
    if (!liveChannels.isEmpty()) {
      JsonObject channels = new JsonObject();
      liveChannels.forEach(channels::put);
      json.put("live_channels", channels);
    }
    return json;
  }
}

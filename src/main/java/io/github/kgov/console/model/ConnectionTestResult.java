package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;

public record ConnectionTestResult(boolean success, String message, Double latencyMs) {

  public static ConnectionTestResult fromJson(JsonObject json) {
    return new ConnectionTestResult(
      json.getBoolean("success", false),
      json.getString("message", ""),
      json.getDouble("latency_ms")
    );
  }
}

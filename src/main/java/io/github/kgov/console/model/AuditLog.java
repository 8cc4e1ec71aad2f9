package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;

/**
 * One entry of the backend activity log.
 */
public record AuditLog(
  String activityType,
  String action,
  String target,
  String message,
  String actor,
  String team,
  String timestamp,
  JsonObject metadata
) {

  public static AuditLog fromJson(JsonObject json) {
    return new AuditLog(
      json.getString("activity_type"),
      json.getString("action"),
      json.getString("target"),
      json.getString("message"),
      json.getString("actor"),
      json.getString("team"),
      json.getString("timestamp"),
      json.getJsonObject("metadata")
    );
  }
}

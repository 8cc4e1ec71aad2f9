package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;

/**
 * One planned change of a topic batch dry-run.
 *
 * @param name topic name
 * @param action CREATE, ALTER or DELETE
 * @param diff field level changes as reported by the backend
 */
public record TopicPlanItem(String name, String action, JsonObject diff) {

  public static TopicPlanItem fromJson(JsonObject json) {
    return new TopicPlanItem(
      json.getString("name"),
      json.getString("action"),
      JsonFields.objectOrEmpty(json, "diff")
    );
  }
}

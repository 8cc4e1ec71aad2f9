package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;

/**
 * Policies in force for one environment. Either side may be null when none is active.
 */
public record ActivePolicies(String environment, Policy naming, Policy guardrail) {

  public static ActivePolicies fromJson(JsonObject json) {
    JsonObject naming = json.getJsonObject("naming_policy");
    JsonObject guardrail = json.getJsonObject("guardrail_policy");
    return new ActivePolicies(
      json.getString("environment"),
      naming != null ? Policy.fromJson(naming) : null,
      guardrail != null ? Policy.fromJson(guardrail) : null
    );
  }
}

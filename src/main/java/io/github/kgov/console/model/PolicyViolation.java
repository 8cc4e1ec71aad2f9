package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;

/**
 * A single governance rule violation reported by a dry-run or apply.
 *
 * @param name the resource the rule was evaluated against
 * @param rule the rule identifier, e.g. {@code forbid.prefix}
 * @param message human readable explanation
 * @param severity {@code error}, {@code warning} or null when the backend omits it
 * @param field the offending field, may be null
 */
public record PolicyViolation(
  String name,
  String rule,
  String message,
  String severity,
  String field
) {

  /**
   * Violations without a severity are treated as errors.
   */
  public boolean isBlocking() {
    return severity == null
      || "error".equalsIgnoreCase(severity)
      || "critical".equalsIgnoreCase(severity);
  }

  public static PolicyViolation fromJson(JsonObject json) {
    return new PolicyViolation(
      json.getString("name"),
      json.getString("rule"),
      json.getString("message"),
      json.getString("severity"),
      json.getString("field")
    );
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("rule", rule)
      .put("message", message);
    if (name != null) {
      json.put("name", name);
    }
    if (severity != null) {
      json.put("severity", severity);
    }
    if (field != null) {
      json.put("field", field);
    }
    return json;
  }
}

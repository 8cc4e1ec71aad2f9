package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;

/**
 * One version of a naming or guardrail policy.
 *
 * @param policyId stable id shared by all versions
 * @param policyType {@code naming} or {@code guardrail}
 * @param name display name
 * @param description free text
 * @param version version number, starting at 1
 * @param status lifecycle status of this version
 * @param content rule set, shape depends on the policy type
 * @param createdBy author
 * @param createdAt ISO-8601 timestamp as sent by the backend
 * @param targetEnvironment dev, stg, prod or total
 */
public record Policy(
  String policyId,
  String policyType,
  String name,
  String description,
  int version,
  PolicyStatus status,
  JsonObject content,
  String createdBy,
  String createdAt,
  String targetEnvironment
) {

  public static Policy fromJson(JsonObject json) {
    return new Policy(
      json.getString("policy_id"),
      json.getString("policy_type"),
      json.getString("name"),
      json.getString("description", ""),
      JsonFields.intOrZero(json, "version"),
      PolicyStatus.fromString(json.getString("status")),
      JsonFields.objectOrEmpty(json, "content"),
      json.getString("created_by"),
      json.getString("created_at"),
      json.getString("target_environment", "total")
    );
  }
}

package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;
import java.util.Objects;

/**
 * Request body for creating a policy. New policies start as version 1 in DRAFT.
 */
public record PolicyDraft(
  String policyType,
  String name,
  String description,
  JsonObject content,
  String createdBy,
  String targetEnvironment
) {

  public PolicyDraft {
    Objects.requireNonNull(policyType, "policyType");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(createdBy, "createdBy");
    description = description == null ? "" : description;
    targetEnvironment = targetEnvironment == null ? "total" : targetEnvironment;
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("policy_type", policyType)
      .put("name", name)
      .put("description", description)
      .put("content", content)
      .put("created_by", createdBy)
      .put("target_environment", targetEnvironment);
  }
}

package io.github.kgov.console.policy;

import io.github.kgov.console.model.PolicyDraft;
import io.vertx.core.json.JsonObject;

/**
 * A built-in policy template.
 *
 * @param kind naming or guardrail
 * @param key short identifier, e.g. {@code balanced} or {@code prod}
 * @param name display name
 * @param description what the preset is meant for
 * @param content policy content as YAML
 */
public record PolicyPreset(PresetKind kind, String key, String name, String description, String content) {

  public JsonObject contentAsJson() {
    return PresetContentParser.toJson(content);
  }

  /**
   * Builds a create request from this preset.
   *
   * @param policyName name of the new policy
   * @param createdBy author
   * @param targetEnvironment dev, stg, prod or total
   */
  public PolicyDraft toDraft(String policyName, String createdBy, String targetEnvironment) {
    return new PolicyDraft(kind.policyType(), policyName, description, contentAsJson(), createdBy,
      targetEnvironment);
  }
}

package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;
import java.util.List;
import java.util.Map;

/**
 * Validation-only plan for a topic batch.
 */
public record DryRunResult(
  String environment,
  String changeId,
  List<TopicPlanItem> plan,
  List<PolicyViolation> violations,
  Map<String, Integer> summary
) {

  public List<PolicyViolation> blockingViolations() {
    return violations.stream().filter(PolicyViolation::isBlocking).toList();
  }

  public List<String> plannedNames() {
    return plan.stream().map(TopicPlanItem::name).toList();
  }

  public static DryRunResult fromJson(JsonObject json) {
    return new DryRunResult(
      json.getString("env"),
      json.getString("change_id"),
      JsonFields.objects(json, "plan", TopicPlanItem::fromJson),
      JsonFields.objects(json, "violations", PolicyViolation::fromJson),
      JsonFields.counters(json, "summary")
    );
  }
}

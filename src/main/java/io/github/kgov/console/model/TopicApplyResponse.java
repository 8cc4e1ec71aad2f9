package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;
import java.util.List;
import java.util.Map;

/**
 * Backend response to a committed topic batch.
 */
public record TopicApplyResponse(
  String environment,
  String changeId,
  List<String> applied,
  List<String> skipped,
  List<FailureDetail> failed,
  String auditId,
  Map<String, Integer> summary
) {

  public static TopicApplyResponse fromJson(JsonObject json) {
    return new TopicApplyResponse(
      json.getString("env"),
      json.getString("change_id"),
      JsonFields.strings(json, "applied"),
      JsonFields.strings(json, "skipped"),
      JsonFields.objects(json, "failed", FailureDetail::fromJson),
      json.getString("audit_id"),
      JsonFields.counters(json, "summary")
    );
  }
}

package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;
import java.util.List;
import java.util.Map;

/**
 * Detail-page summary of a consumer group.
 *
 * @param rebalanceScore 0-100, null when the backend has no rebalance history yet
 */
public record ConsumerGroupSummary(
  String groupId,
  String clusterId,
  String state,
  int memberCount,
  int topicCount,
  Map<String, Integer> lag,
  Double rebalanceScore,
  double fairnessGini,
  List<JsonObject> stuck
) {

  public static ConsumerGroupSummary fromJson(JsonObject json) {
    return new ConsumerGroupSummary(
      json.getString("group_id"),
      json.getString("cluster_id"),
      json.getString("state"),
      JsonFields.intOrZero(json, "member_count"),
      JsonFields.intOrZero(json, "topic_count"),
      JsonFields.counters(json, "lag"),
      json.getDouble("rebalance_score"),
      JsonFields.doubleOrZero(json, "fairness_gini"),
      JsonFields.objects(json, "stuck", item -> item)
    );
  }
}

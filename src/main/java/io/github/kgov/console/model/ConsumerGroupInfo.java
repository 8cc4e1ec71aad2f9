package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;

/**
 * Consumer group row as returned by the group listing.
 */
public record ConsumerGroupInfo(
  String clusterId,
  String groupId,
  String timestamp,
  String state,
  String partitionAssignor,
  int memberCount,
  int topicCount,
  LagStats lagStats
) {

  public static ConsumerGroupInfo fromJson(JsonObject json) {
    return new ConsumerGroupInfo(
      json.getString("cluster_id"),
      json.getString("group_id"),
      json.getString("ts"),
      json.getString("state"),
      json.getString("partition_assignor"),
      JsonFields.intOrZero(json, "member_count"),
      JsonFields.intOrZero(json, "topic_count"),
      LagStats.fromJson(json.getJsonObject("lag_stats"))
    );
  }
}

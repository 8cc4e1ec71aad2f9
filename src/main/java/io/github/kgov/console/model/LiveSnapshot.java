package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;
import java.util.List;

/**
 * Point-in-time state of a consumer group pushed over the live channel.
 */
public record LiveSnapshot(
  String timestamp,
  String clusterId,
  String groupId,
  String state,
  int memberCount,
  int topicCount,
  String partitionAssignor,
  LagStats lagStats,
  List<PartitionLag> partitions,
  List<MemberInfo> members,
  double fairnessGini,
  int stuckCount,
  boolean rebalancing,
  boolean lagSpike
) {

  /**
   * Lag of one partition. {@code assignedMemberId} is null for unassigned partitions.
   */
  public record PartitionLag(
    String topic,
    int partition,
    long lag,
    Long committedOffset,
    Long latestOffset,
    String assignedMemberId
  ) {
    static PartitionLag fromJson(JsonObject json) {
      return new PartitionLag(
        json.getString("topic"),
        JsonFields.intOrZero(json, "partition"),
        JsonFields.longOrZero(json, "lag"),
        json.getLong("committed_offset"),
        json.getLong("latest_offset"),
        json.getString("assigned_member_id")
      );
    }
  }

  public record MemberInfo(String memberId, String clientId, int partitionCount) {

    static MemberInfo fromJson(JsonObject json) {
      return new MemberInfo(
        json.getString("member_id"),
        json.getString("client_id"),
        JsonFields.intOrZero(json, "partition_count")
      );
    }
  }

  public long totalLag() {
    return lagStats.totalLag();
  }

  /**
   * Partitions whose lag is strictly above the threshold, in snapshot order.
   */
  public List<PartitionLag> partitionsAbove(long threshold) {
    return partitions.stream().filter(p -> p.lag() > threshold).toList();
  }

  public static LiveSnapshot fromJson(JsonObject json) {
    return new LiveSnapshot(
      json.getString("timestamp"),
      json.getString("cluster_id"),
      json.getString("group_id"),
      json.getString("state"),
      JsonFields.intOrZero(json, "member_count"),
      JsonFields.intOrZero(json, "topic_count"),
      json.getString("partition_assignor"),
      LagStats.fromJson(json.getJsonObject("lag_stats")),
      JsonFields.objects(json, "partitions", PartitionLag::fromJson),
      JsonFields.objects(json, "members", MemberInfo::fromJson),
      JsonFields.doubleOrZero(json, "fairness_gini"),
      JsonFields.intOrZero(json, "stuck_count"),
      json.getBoolean("is_rebalancing", false),
      json.getBoolean("has_lag_spike", false)
    );
  }
}

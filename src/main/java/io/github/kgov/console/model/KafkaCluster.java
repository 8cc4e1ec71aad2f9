package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;

/**
 * Kafka cluster connection registered in the backend.
 */
public record KafkaCluster(
  String clusterId,
  String name,
  String bootstrapServers,
  String description,
  String securityProtocol,
  boolean active
) {

  public static KafkaCluster fromJson(JsonObject json) {
    return new KafkaCluster(
      json.getString("cluster_id"),
      json.getString("name"),
      json.getString("bootstrap_servers"),
      json.getString("description"),
      json.getString("security_protocol"),
      json.getBoolean("is_active", true)
    );
  }
}

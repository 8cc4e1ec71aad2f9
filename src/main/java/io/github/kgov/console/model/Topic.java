package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;
import java.util.List;

/**
 * Topic as listed by the governance catalog.
 */
public record Topic(
  String name,
  List<String> owners,
  String doc,
  List<String> tags,
  Integer partitionCount,
  Integer replicationFactor,
  Long retentionMs,
  String environment,
  String slo,
  String sla
) {

  public static Topic fromJson(JsonObject json) {
    List<String> owners = JsonFields.strings(json, "owners");
    // Older catalog responses carry a single owner
    if (owners.isEmpty() && json.getString("owner") != null) {
      owners = List.of(json.getString("owner"));
    }
    return new Topic(
      json.getString("name"),
      owners,
      json.getString("doc"),
      JsonFields.strings(json, "tags"),
      json.getInteger("partition_count"),
      json.getInteger("replication_factor"),
      json.getLong("retention_ms"),
      json.getString("environment"),
      json.getString("slo"),
      json.getString("sla")
    );
  }
}

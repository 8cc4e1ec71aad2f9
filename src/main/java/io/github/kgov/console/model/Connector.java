package io.github.kgov.console.model;

import io.vertx.core.json.JsonObject;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A Kafka Connect connector with its configuration.
 */
public record Connector(String name, String type, Map<String, String> config, List<ConnectorTask> tasks) {

  public record ConnectorTask(String connector, int task) {

    static ConnectorTask fromJson(JsonObject json) {
      return new ConnectorTask(json.getString("connector"), JsonFields.intOrZero(json, "task"));
    }
  }

  public static Connector fromJson(JsonObject json) {
    Map<String, String> config = new LinkedHashMap<>();
    JsonFields.objectOrEmpty(json, "config")
      .forEach(entry -> config.put(entry.getKey(), String.valueOf(entry.getValue())));
    return new Connector(
      json.getString("name"),
      json.getString("type"),
      Map.copyOf(config),
      JsonFields.objects(json, "tasks", ConnectorTask::fromJson)
    );
  }
}
